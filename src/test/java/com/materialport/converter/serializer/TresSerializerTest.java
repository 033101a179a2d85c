package com.materialport.converter.serializer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.materialport.converter.model.DecisionBasis;
import com.materialport.converter.model.MappedMaterial;
import com.materialport.converter.model.RgbaColor;
import com.materialport.converter.model.ShaderDecision;
import com.materialport.converter.model.ShaderFamily;
import com.materialport.converter.model.TextureBinding;
import com.materialport.converter.model.UniformValue;
import com.materialport.converter.model.Vector2;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for TresSerializer.
 */
class TresSerializerTest {

    private static final String SHADERS = "res://shaders";
    private static final String TEXTURES = "res://textures";

    private final TresSerializer serializer = new TresSerializer();

    @Test
    void testSerializeGenericMaterial() {
        Map<String, TextureBinding> textures = new LinkedHashMap<>();
        textures.put("normal_texture", TextureBinding.missing("normal_texture", "_BumpMap", "22222222222222222222222222222222"));
        textures.put("base_texture", TextureBinding.resolved("base_texture", "_BaseMap", "11111111111111111111111111111111", "albedo.png"));
        Map<String, UniformValue> uniforms = new LinkedHashMap<>();
        uniforms.put("color_tint", UniformValue.ofColor(new RgbaColor(1, 0.5, 0.25, 1)));
        uniforms.put("metallic", UniformValue.ofFloat(0));
        uniforms.put("smoothness", UniformValue.ofFloat(0.5));

        String text = serializer.serialize(material("Rock_01", ShaderFamily.GENERIC_OPAQUE, textures, uniforms),
                SHADERS, TEXTURES);

        assertThat(text).isEqualTo("""
                [gd_resource type="ShaderMaterial" load_steps=4 format=3]

                [ext_resource type="Shader" path="res://shaders/polygon.gdshader" id="1"]
                [ext_resource type="Texture2D" path="res://textures/albedo.png" id="2"]
                [ext_resource type="Texture2D" path="res://textures/__missing_texture__.png" id="3"]

                [resource]
                shader = ExtResource("1")
                shader_parameter/base_texture = ExtResource("2")
                shader_parameter/normal_texture = ExtResource("3")
                shader_parameter/enable_normal_texture = true
                shader_parameter/smoothness = 0.5
                shader_parameter/metallic = 0.0
                shader_parameter/color_tint = Color(1.0, 0.5, 0.25, 1.0)
                """);
    }

    @Test
    void testVegetationTexturesFollowDeclaredOrder() {
        Map<String, TextureBinding> textures = new LinkedHashMap<>();
        textures.put("leaf_normal", TextureBinding.resolved("leaf_normal", "_Normal", "2", "Leaf_Normal.png"));
        textures.put("leaf_color", TextureBinding.resolved("leaf_color", "_Albedo", "1", "Leaf_Albedo.png"));

        String text = serializer.serialize(material("Leaf_Bark_01", ShaderFamily.VEGETATION, textures, Map.of()),
                SHADERS, TEXTURES);

        assertThat(text).contains("path=\"res://shaders/foliage.gdshader\"");
        assertThat(text.indexOf("shader_parameter/leaf_color")).isLessThan(text.indexOf("shader_parameter/leaf_normal"));
        assertThat(text).contains("shader_parameter/enable_leaf_normal = true");
    }

    @Test
    void testParametersGroupedByKind() {
        Map<String, UniformValue> uniforms = new LinkedHashMap<>();
        uniforms.put("zeta_color", UniformValue.ofColor(new RgbaColor(0, 0, 0, 1)));
        uniforms.put("base_texture_tiling", UniformValue.ofVector(new Vector2(2, 2)));
        uniforms.put("custom_value", UniformValue.ofFloat(3));
        uniforms.put("enable_snow", UniformValue.ofBool(false));
        uniforms.put("alpha_value", UniformValue.ofFloat(1));

        String text = serializer.serialize(material("Kinds", ShaderFamily.GENERIC_OPAQUE, Map.of(), uniforms),
                SHADERS, TEXTURES);

        assertThat(text.lines().filter(l -> l.startsWith("shader_parameter/")).map(l -> l.substring(17, l.indexOf(' '))))
                .containsExactly("enable_snow", "alpha_value", "custom_value", "base_texture_tiling", "zeta_color");
    }

    @Test
    void testSharedTexturePathGetsOneResource() {
        Map<String, TextureBinding> textures = new LinkedHashMap<>();
        textures.put("base_texture", TextureBinding.missing("base_texture", "_BaseMap", "a"));
        textures.put("normal_texture", TextureBinding.missing("normal_texture", "_BumpMap", "b"));

        String text = serializer.serialize(material("Lost", ShaderFamily.GENERIC_OPAQUE, textures, Map.of()),
                SHADERS, TEXTURES);

        assertThat(text).startsWith("[gd_resource type=\"ShaderMaterial\" load_steps=3 format=3]");
        assertThat(text).containsOnlyOnce("__missing_texture__.png");
        assertThat(text).contains("shader_parameter/base_texture = ExtResource(\"2\")")
                .contains("shader_parameter/normal_texture = ExtResource(\"2\")");
    }

    @Test
    void testTriplanarSlotEnablesToggle() {
        Map<String, TextureBinding> textures = Map.of("triplanar_texture_side",
                TextureBinding.resolved("triplanar_texture_side", "_Triplanar_Texture_Side", "c", "side.png"));
        Map<String, UniformValue> uniforms = Map.of("enable_triplanar_texture", UniformValue.ofBool(false));

        String withExplicit = serializer.serialize(material("Cliff", ShaderFamily.GENERIC_OPAQUE, textures, uniforms),
                SHADERS, TEXTURES);
        String withoutExplicit = serializer.serialize(material("Cliff", ShaderFamily.GENERIC_OPAQUE, textures, Map.of()),
                SHADERS, TEXTURES);

        // an explicit value from the material is kept
        assertThat(withExplicit).contains("shader_parameter/enable_triplanar_texture = false");
        assertThat(withoutExplicit).contains("shader_parameter/enable_triplanar_texture = true");
    }

    @Test
    void testOutputIsDeterministic() {
        Map<String, UniformValue> forward = new LinkedHashMap<>();
        forward.put("smoothness", UniformValue.ofFloat(0.25));
        forward.put("opacity", UniformValue.ofFloat(0.7));
        Map<String, UniformValue> backward = new LinkedHashMap<>();
        backward.put("opacity", UniformValue.ofFloat(0.7));
        backward.put("smoothness", UniformValue.ofFloat(0.25));

        String a = serializer.serialize(material("Gem", ShaderFamily.CRYSTAL, Map.of(), forward), SHADERS, TEXTURES);
        String b = serializer.serialize(material("Gem", ShaderFamily.CRYSTAL, Map.of(), backward), SHADERS, TEXTURES);

        assertThat(a).isEqualTo(b);
        assertThat(a.indexOf("opacity")).isLessThan(a.indexOf("smoothness"));
    }

    @ParameterizedTest
    @CsvSource({
            "res://shaders, a.gdshader, res://shaders/a.gdshader",
            "res://shaders/, a.gdshader, res://shaders/a.gdshader",
            "'', a.png, a.png",
            "res://t, 'we\"ird.png', 'res://t/we\\\"ird.png'"
    })
    void testJoinPath(String base, String file, String expected) {
        assertThat(TresSerializer.joinPath(base, file)).isEqualTo(expected);
    }

    private static MappedMaterial material(String name, ShaderFamily family,
                                           Map<String, TextureBinding> textures, Map<String, UniformValue> uniforms) {
        return MappedMaterial.builder()
                .name(name)
                .family(family)
                .decision(new ShaderDecision(family, DecisionBasis.EXPLICIT_REFERENCE, null))
                .textures(textures)
                .uniforms(uniforms)
                .build();
    }
}
