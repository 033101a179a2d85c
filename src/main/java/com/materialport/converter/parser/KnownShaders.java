package com.materialport.converter.parser;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.materialport.converter.model.ShaderFamily;

import lombok.experimental.UtilityClass;

/**
 * Shader identifiers seen across published asset packs, with the family each one maps to.
 * Entries that land on the polygon default are generic: they name the shader but leave the
 * family to the property signature and the material name.
 */
@UtilityClass
public class KnownShaders {

    private static final Map<String, KnownShader> BY_IDENTIFIER = Stream.of(
            generic("0730dae39bc73f34796280af9875ce14", "Synty PolygonLit", ShaderFamily.GENERIC_OPAQUE),
            shader("9b98a126c8d4d7a4baeb81b16e4f7b97", "Synty Foliage", ShaderFamily.VEGETATION),
            shader("0736e099ec10c9e46b9551b2337d0cc7", "Synty Particles", ShaderFamily.PARTICLES),
            generic("19e269a311c45cd4482cf0ac0e694503", "Synty Triplanar", ShaderFamily.GENERIC_OPAQUE),
            shader("436db39b4e2ae5e46a17e21865226b19", "Synty Water", ShaderFamily.WATER),
            shader("5808064c5204e554c89f589a7059c558", "Synty Crystal", ShaderFamily.CRYSTAL),
            shader("de1d86872962c37429cb628a7de53613", "Synty Skydome", ShaderFamily.SKY_DOME),
            shader("4a6c8c23090929241b2a55476a46a9b1", "Synty Clouds", ShaderFamily.CLOUDS),
            shader("dfec08fb273e4674bb5398df25a5932c", "Synty Leaf Card", ShaderFamily.VEGETATION),
            shader("fdea4239d29733541b44cd6960afefcd", "Synty Glass", ShaderFamily.CRYSTAL),
            generic("3b44a38ec6f81134ab0f820ac54d6a93", "Generic Standard", ShaderFamily.GENERIC_OPAQUE),
            shader("3d532bc2d70158948859b7839127e562", "Skybox Generic", ShaderFamily.SKY_DOME),
            shader("74fa94d128fe4f348889c6f5f182e0e1", "Skydome Nature", ShaderFamily.SKY_DOME),
            generic("0835602ed30128f4a88a652bf920fcaa", "Polygon UV Scroll", ShaderFamily.GENERIC_OPAQUE),
            generic("2b5804ffd3081d344bed894a653e3014", "Hologram", ShaderFamily.GENERIC_OPAQUE),
            generic("5c2ccdfe181d55b42bd5313305f194e4", "Screens CRT", ShaderFamily.GENERIC_OPAQUE),
            generic("77e5bdd170fa4a4459dea431aba43e3c", "Decals", ShaderFamily.GENERIC_OPAQUE),
            generic("972cd3fede1c33342b0f52ad57f47d90", "Blinking Lights", ShaderFamily.GENERIC_OPAQUE),
            shader("c48a4461fec61fc45a01e7d6a50e520f", "SciFi Plant", ShaderFamily.VEGETATION),
            generic("325b924500ba5804aa4b407d80084502", "Neon", ShaderFamily.GENERIC_OPAQUE),
            generic("0ecc70cac2c8895439f5094ba6660db8", "Grunge Triplanar", ShaderFamily.GENERIC_OPAQUE),
            generic("5d828b280155912429aa717d34cd8879", "Ghost", ShaderFamily.GENERIC_OPAQUE),
            generic("62e87ad08a1afa642830420bf8e0dd4d", "CyberCity Triplanar", ShaderFamily.GENERIC_OPAQUE),
            generic("2a33a166317493947a7be330dcc78a05", "Parallax Full", ShaderFamily.GENERIC_OPAQUE),
            generic("e9556606a5f42464fa7dd78d624dc180", "Hologram Urban", ShaderFamily.GENERIC_OPAQUE),
            generic("a49be8e7504a48b4fba9b0c2a7fad57b", "Emissive Scroll", ShaderFamily.GENERIC_OPAQUE),
            generic("1f67b66c29dfd4f45aa8cc07bf5e901a", "Emissive Colour Change", ShaderFamily.GENERIC_OPAQUE),
            generic("a711ca3b984db6a4e81ec2d50ca4c0ca", "Building Background", ShaderFamily.GENERIC_OPAQUE),
            generic("5d014726978e80a43b6178cba929343b", "Flipbook Cutout", ShaderFamily.GENERIC_OPAQUE),
            generic("a7331fc07349b124c8c15d545676f9ed", "Zombies", ShaderFamily.GENERIC_OPAQUE),
            generic("d0be6b296f23e8d459e94b4007017ea0", "Magic Glow", ShaderFamily.GENERIC_OPAQUE),
            generic("e8b857c3d7fea464e942e1c1f0940e96", "Magical Portal", ShaderFamily.GENERIC_OPAQUE),
            generic("e312e3877c798a44dba23093a3417a94", "Liquid Potion", ShaderFamily.GENERIC_OPAQUE),
            shader("a2cae5b0e99e16249b9a2163a7087bcb", "Wind Animation", ShaderFamily.VEGETATION),
            shader("d2820334f2975bb47ab3f2fffa1b4cbe", "Aurora", ShaderFamily.SKY_DOME),
            shader("b83105300c9f7fb42a6e1b790fd2bd29", "Particles Lit", ShaderFamily.PARTICLES),
            shader("00eec7c5cd1f4c6429ffee9a690c3d16", "Particles Unlit", ShaderFamily.PARTICLES),
            generic("f3534f26c7b573c45a1346e0634d57fc", "Generic Basic Bloody", ShaderFamily.GENERIC_OPAQUE),
            generic("e17f8fe2503580447a3784d34b316d11", "Triplanar Basic", ShaderFamily.GENERIC_OPAQUE),
            generic("933532a4fcc9baf4fa0491de14d08ed7", "Universal Render Pipeline/Lit", ShaderFamily.GENERIC_OPAQUE),
            shader("56ef766d507df464fb2a1726a99c925f", "Heat Shimmer", ShaderFamily.PARTICLES),
            shader("1ab581f9e0198304996581171522f458", "Water Amplify", ShaderFamily.WATER),
            shader("4b0390819f518774fa1a44198298459a", "Foliage Amplify", ShaderFamily.VEGETATION),
            generic("0000000000000000f000000000000000", "Unity Built-in", ShaderFamily.GENERIC_OPAQUE),
            generic("e854bc7dc0cde7044b9000faaf0c4e11", "Rock Triplanar", ShaderFamily.GENERIC_OPAQUE),
            shader("9b1e1d14d7778714391ae095571c3d4f", "Waterfall", ShaderFamily.WATER),
            generic("df6b3a02955954d41bb15c534388ba14", "No Fog", ShaderFamily.GENERIC_OPAQUE),
            shader("903fe97c2d85c8147a64932806c92eb1", "Waterfall Variant", ShaderFamily.WATER),
            shader("ca9b700964f37d84a90b00c70d981934", "Aurora Elven", ShaderFamily.SKY_DOME),
            generic("ab6da834753539b4989259dbf4bcc39b", "ProRacer Standard", ShaderFamily.GENERIC_OPAQUE),
            generic("22e3738818284144eb7ada0a62acca66", "ProRacer Decal", ShaderFamily.GENERIC_OPAQUE),
            shader("402ae1c33e4c28c45876b1bc945b77e6", "ProRacer Particles Unlit", ShaderFamily.PARTICLES),
            generic("da24369d453e6a547aaa57ebee28fc81", "ProRacer Cutout Flipbook", ShaderFamily.GENERIC_OPAQUE),
            generic("8e5d248915e86014095ff0547bc0c755", "ProRacer Advanced", ShaderFamily.GENERIC_OPAQUE),
            generic("1bf4a2dc982313347912f313ba25f563", "Road", ShaderFamily.GENERIC_OPAQUE),
            generic("e603b0446c7f2804db0c8dd0fb5c1af0", "Custom Characters", ShaderFamily.GENERIC_OPAQUE)
    ).collect(Collectors.toUnmodifiableMap(KnownShader::getIdentifier, Function.identity()));

    public static Optional<KnownShader> lookup(String identifier) {
        if (identifier == null) return Optional.empty();
        return Optional.ofNullable(BY_IDENTIFIER.get(identifier.trim().toLowerCase(Locale.ROOT)));
    }

    private static KnownShader shader(String identifier, String name, ShaderFamily family) {
        return new KnownShader(identifier, name, family, false);
    }

    private static KnownShader generic(String identifier, String name, ShaderFamily family) {
        return new KnownShader(identifier, name, family, true);
    }
}
