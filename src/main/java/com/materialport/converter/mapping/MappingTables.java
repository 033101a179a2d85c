package com.materialport.converter.mapping;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import com.materialport.converter.model.ShaderFamily;
import com.materialport.converter.util.PropertyNameUtil;

/**
 * Static rename tables for every shader family, plus the property sets that
 * need special handling: scalars that are really toggles, and colors whose
 * zero alpha is an authoring artifact.
 *
 * Every family except {@link ShaderFamily#GENERIC_OPAQUE} inherits the
 * generic table underneath its own entries.
 */
public class MappingTables {

    private static final Set<String> BOOLEAN_PROPERTIES = Set.of(
            "_Enable_Breeze", "_Enable_Light_Wind", "_Enable_Strong_Wind", "_Enable_Wind_Twist",
            "_Enable_Frosting", "_Wind_Enabled", "_Leaves_Wave", "_Tree_Wave",
            "_Enable_Fresnel", "_Enable_Side_Fresnel", "_Enable_Depth", "_Enable_Refraction",
            "_Enable_Triplanar", "_Enable_Triplanar_Texture", "_Enable_Snow", "_Enable_Emission",
            "_Enable_Normals", "_AlphaClip", "_Enable_Hologram", "_Enable_Ghost",
            "_Use_Metallic_Map", "_Use_Weather_Controller", "_Use_Vertex_Color_Wind",
            "_Enable_UV_Distortion", "_Enable_Brightness_Breakup", "_Enable_Wave",
            "_Enable_Detail_Map", "_Enable_Parallax", "_Enable_AO",
            "_Enable_Shore_Wave_Foam", "_Enable_Shore_Foam", "_Enable_Shore_Waves",
            "_Enable_Ocean_Waves", "_Enable_Ocean_Wave", "_Enable_Caustics", "_Enable_Distortion",
            "_VertexOffset_Toggle", "_Enable_Soft_Particles", "_Enable_Camera_Fade",
            "_Enable_Scene_Fog", "_Enable_UV_Based", "_Use_Environment_Override",
            "_Enable_Fog", "_Enable_Scattering");

    private static final Set<String> ALPHA_FIX_PROPERTIES = Set.of(
            "_Base_Color", "_Base_Color_Multiplier", "_Top_Color_Multiplier", "_Deep_Color",
            "_Shallow_Color", "_Fresnel_Color", "_Refraction_Color",
            "_Water_Deep_Color", "_Water_Shallow_Color", "_Water_Near_Color", "_Water_Far_Color",
            "_Foam_Color", "_Caustics_Color", "_CausticColour", "_Shore_Foam_Color_Tint",
            "_Shore_Wave_Color_Tint", "_WaterDeepColor", "_WaterShallowColor", "_WaterColour",
            "_FresnelColour", "_Very_Deep_Color", "_ShallowColour", "_DeepColour",
            "_VeryDeepColour", "_FoamEmitColour", "_DepthGlowColour",
            "_Leaf_Base_Color", "_Trunk_Base_Color", "_Emissive_Color", "_Emissive_2_Color",
            "_Trunk_Emissive_Color", "_Frosting_Color", "_Leaf_Noise_Color", "_Trunk_Noise_Color",
            "_Neon_Colour_01", "_Neon_Colour_02", "_Glow_Colour", "_Glow_Tint", "_RimColor",
            "_Hologram_Color", "_BloodColor", "_Blood_Color", "_Dust_Colour",
            "_Color", "_BaseColor", "_BaseColour", "_Color_Tint", "_ColorTint",
            "_Hair_Color", "_Skin_Color", "_Snow_Color", "_Emission_Color", "_EmissionColor",
            "_Liquid_Color", "_Top_Color", "_Bottom_Color", "_Scattering_Color",
            "_Aurora_Color_01", "_Aurora_Color_02",
            "_Color_Primary", "_Color_Secondary", "_Color_Tertiary", "_Color_Metal_Primary",
            "_Color_Metal_Secondary", "_Color_Metal_Dark", "_Color_Leather_Primary",
            "_Color_Leather_Secondary", "_Color_Skin", "_Color_Hair", "_Color_Eyes",
            "_Color_Stubble", "_Color_Scar", "_Color_BodyArt");

    private static final MappingTables DEFAULT = new MappingTables(declaredTables(), BOOLEAN_PROPERTIES, ALPHA_FIX_PROPERTIES);

    private final Map<ShaderFamily, FamilyMappingTable> tables;
    private final Set<String> booleanProperties;
    private final Set<String> alphaFixProperties;

    /**
     * @param declared per-family tables as declared; the generic table is layered under the others here
     */
    public MappingTables(Map<ShaderFamily, FamilyMappingTable> declared,
                         Collection<String> booleanProperties,
                         Collection<String> alphaFixProperties) {
        FamilyMappingTable generic = declared.getOrDefault(ShaderFamily.GENERIC_OPAQUE,
                FamilyMappingTable.builder(ShaderFamily.GENERIC_OPAQUE).build());

        Map<ShaderFamily, FamilyMappingTable> effective = new EnumMap<>(ShaderFamily.class);
        for (ShaderFamily family : ShaderFamily.values()) {
            FamilyMappingTable own = declared.getOrDefault(family, FamilyMappingTable.builder(family).build());
            effective.put(family, family == ShaderFamily.GENERIC_OPAQUE ? own : own.inheriting(generic));
        }
        this.tables = Collections.unmodifiableMap(effective);
        this.booleanProperties = normalized(booleanProperties);
        this.alphaFixProperties = normalized(alphaFixProperties);
    }

    public static MappingTables defaults() {
        return DEFAULT;
    }

    public FamilyMappingTable forFamily(ShaderFamily family) {
        return tables.get(family);
    }

    public boolean isBooleanProperty(String sourceName) {
        return booleanProperties.contains(PropertyNameUtil.normalize(sourceName));
    }

    public boolean needsAlphaFix(String sourceName) {
        return alphaFixProperties.contains(PropertyNameUtil.normalize(sourceName));
    }

    private static Set<String> normalized(Collection<String> names) {
        return names.stream().map(PropertyNameUtil::normalize).collect(Collectors.toUnmodifiableSet());
    }

    private static Map<ShaderFamily, FamilyMappingTable> declaredTables() {
        Map<ShaderFamily, FamilyMappingTable> tables = new EnumMap<>(ShaderFamily.class);
        tables.put(ShaderFamily.VEGETATION, vegetation());
        tables.put(ShaderFamily.WATER, water());
        tables.put(ShaderFamily.CRYSTAL, crystal());
        tables.put(ShaderFamily.CLOUDS, clouds());
        tables.put(ShaderFamily.PARTICLES, particles());
        tables.put(ShaderFamily.SKY_DOME, skyDome());
        tables.put(ShaderFamily.GENERIC_OPAQUE, genericOpaque());
        return tables;
    }

    private static FamilyMappingTable vegetation() {
        return FamilyMappingTable.builder(ShaderFamily.VEGETATION)
                .texture("_Leaf_Texture", "leaf_color")
                .texture("_Albedo", "leaf_color")
                .texture("_Leaf_Normal", "leaf_normal")
                .texture("_Normal", "leaf_normal")
                .texture("_Trunk_Texture", "trunk_color")
                .texture("_Trunk_Normal", "trunk_normal")
                .texture("_Leaf_Ambient_Occlusion", "leaf_ao")
                .texture("_Trunk_Ambient_Occlusion", "trunk_ao")
                .texture("_Emissive_Mask", "emissive_mask")
                .texture("_Emissive_2_Mask", "emissive_2_mask")
                .texture("_Emissive_Pulse_Map", "emissive_pulse_mask")
                .texture("_Trunk_Emissive_Mask", "trunk_emissive_mask")
                .texture("_Breeze_Noise_Map", "breeze_noise_map")
                .scalar("_LeafSmoothness", "leaf_smoothness")
                .scalar("_Leaf_Smoothness", "leaf_smoothness")
                .scalar("_Leaf_Metallic", "leaf_metallic")
                .scalar("_TrunkSmoothness", "trunk_smoothness")
                .scalar("_Trunk_Smoothness", "trunk_smoothness")
                .scalar("_Trunk_Metallic", "trunk_metallic")
                .scalar("_Breeze_Strength", "breeze_strength")
                .scalar("_Light_Wind_Strength", "light_wind_strength")
                .scalar("_Strong_Wind_Strength", "strong_wind_strength")
                .scalar("_Wind_Twist_Strength", "wind_twist_strength")
                .scalar("_Wind_Direction", "wind_direction")
                .scalar("_Gale_Blend", "gale_blend")
                .scalar("_Light_Wind_Y_Strength", "light_wind_y_strength")
                .scalar("_Light_Wind_Y_Offset", "light_wind_y_offset")
                .scalar("_Frosting_Falloff", "frosting_falloff")
                .scalar("_Frosting_Height", "frosting_height")
                .scalar("_Leaves_WindAmount", "breeze_strength")
                .scalar("_Tree_WindAmount", "light_wind_strength")
                .color("_Leaf_Base_Color", "leaf_base_color")
                .color("_Trunk_Base_Color", "trunk_base_color")
                .color("_Leaf_Noise_Color", "leaf_noise_color")
                .color("_Trunk_Noise_Color", "trunk_noise_color")
                .color("_Emissive_Color", "emissive_color")
                .color("_Emissive_2_Color", "emissive_2_color")
                .color("_Trunk_Emissive_Color", "trunk_emissive_color")
                .color("_Frosting_Color", "frosting_color")
                .color("_ColorTint", "color_tint")
                .defaultValue("leaf_smoothness", 0.1)
                .defaultValue("trunk_smoothness", 0.15)
                .defaultValue("leaf_metallic", 0.0)
                .defaultValue("trunk_metallic", 0.0)
                .build();
    }

    private static FamilyMappingTable water() {
        return FamilyMappingTable.builder(ShaderFamily.WATER)
                .texture("_Water_Normal_Texture", "normal_texture")
                .texture("_WaterNormal", "normal_texture")
                .texture("_RipplesNormal", "normal_texture")
                .texture("_Normal_Texture", "normal_texture")
                .texture("_Normal_Map", "normal_texture")
                .texture("_BumpMap", "normal_texture")
                .texture("_MainTex", "normal_texture")
                .texture("_BaseMap", "normal_texture")
                .texture("_Foam_Noise_Texture", "noise_texture")
                .texture("_Foam_Texture", "noise_texture")
                .texture("_Noise_Texture", "noise_texture")
                .texture("_Water_Noise_Texture", "noise_texture")
                .texture("_WaveMask", "noise_texture")
                .texture("_WaveNoise", "noise_texture")
                .texture("_Wave_Gradient", "wave_gradient")
                .texture("_Caustics_Flipbook", "caustics_flipbook")
                .texture("_Scrolling_Texture", "scrolling_texture")
                .texture("_Shore_Foam_Noise_Texture", "shore_foam_noise_texture")
                .texture("_Shore_Wave_Foam_Noise_Texture", "shore_foam_noise_texture")
                .scalar("_Base_Opacity", "base_opacity")
                .scalar("_Shallows_Opacity", "shallows_opacity")
                .scalar("_Maximum_Depth", "maximum_depth")
                .scalar("_Shore_Wave_Speed", "shore_wave_speed")
                .scalar("_Ocean_Wave_Height", "ocean_wave_height")
                .scalar("_Ocean_Wave_Speed", "ocean_wave_speed")
                .scalar("_Distortion_Strength", "distortion_strength")
                .scalar("_Deep_Height", "deep_height")
                .scalar("_Very_Deep_Height", "very_deep_height")
                .scalar("_Depth_Distance", "depth_distance")
                .scalar("_Water_Depth", "water_depth")
                .scalar("_ShallowFalloff", "shallow_intensity")
                .scalar("_Shallow_Intensity", "shallow_intensity")
                .scalar("_OverallFalloff", "base_opacity")
                .scalar("_OpacityFalloff", "shallows_opacity")
                .scalar("_Shore_Foam_Intensity", "shore_foam_intensity")
                .scalar("_FoamShoreline", "shore_foam_intensity")
                .scalar("_FoamDepth", "shore_foam_intensity")
                .scalar("_FoamFalloff", "ocean_foam_opacity")
                .scalar("_Caustics_Intensity", "caustics_intensity")
                .scalar("_CausticDepthFade", "caustics_intensity")
                .scalar("_CausticScale", "caustics_scale")
                .scalar("_CausticSpeed", "caustics_speed")
                .scalar("_FresnelPower", "fresnel_power")
                .color("_Shallow_Color", "shallow_color")
                .color("_ShallowColour", "shallow_color")
                .color("_WaterShallowColor", "shallow_color")
                .color("_Water_Shallow_Color", "shallow_color")
                .color("_Water_Near_Color", "shallow_color")
                .color("_Deep_Color", "deep_color")
                .color("_DeepColour", "deep_color")
                .color("_WaterDeepColor", "deep_color")
                .color("_Water_Deep_Color", "deep_color")
                .color("_Water_Far_Color", "deep_color")
                .color("_Very_Deep_Color", "very_deep_color")
                .color("_VeryDeepColour", "very_deep_color")
                .color("_DepthGlowColour", "very_deep_color")
                .color("_Foam_Color", "foam_color")
                .color("_Caustics_Color", "caustics_color")
                .color("_CausticColour", "caustics_color")
                .color("_Shore_Foam_Color_Tint", "shore_foam_color_tint")
                .color("_FoamEmitColour", "shore_foam_color_tint")
                .color("_Shore_Wave_Color_Tint", "shore_wave_color_tint")
                .color("_WaterColour", "water_color")
                .color("_FresnelColour", "fresnel_color")
                .defaultValue("smoothness", 0.95)
                .defaultValue("metallic", 0.0)
                .build();
    }

    private static FamilyMappingTable crystal() {
        return FamilyMappingTable.builder(ShaderFamily.CRYSTAL)
                .texture("_Base_Albedo", "base_albedo")
                .texture("_MainTex", "base_albedo")
                .texture("_BaseMap", "base_albedo")
                .texture("_Base_Normal", "base_normal")
                .texture("_BumpMap", "base_normal")
                .texture("_Refraction_Height", "refraction_height")
                .texture("_Refraction_Texture", "refraction_texture")
                .texture("_Top_Albedo", "top_albedo")
                .texture("_Top_Normal", "top_normal")
                .scalar("_Opacity", "opacity")
                .scalar("_Fresnel_Power", "fresnel_power")
                .scalar("_Refraction_Strength", "refraction_strength")
                .scalar("_Deep_Depth", "deep_depth")
                .scalar("_Shallow_Depth", "shallow_depth")
                .color("_Base_Color", "base_color")
                .color("_Base_Color_Multiplier", "base_color")
                .color("_Top_Color_Multiplier", "top_color")
                .color("_Deep_Color", "deep_color")
                .color("_Shallow_Color", "shallow_color")
                .color("_Fresnel_Color", "fresnel_color")
                .color("_Refraction_Color", "refraction_color")
                .defaultValue("opacity", 0.7)
                .build();
    }

    private static FamilyMappingTable clouds() {
        return FamilyMappingTable.builder(ShaderFamily.CLOUDS)
                .scalar("_Light_Intensity", "light_intensity")
                .scalar("_Fresnel_Power", "fresnel_power")
                .scalar("_Fog_Density", "fog_density")
                .scalar("_Scattering_Multiplier", "scattering_multiplier")
                .scalar("_Cloud_Contrast", "scattering_multiplier")
                .scalar("_Cloud_Speed", "cloud_speed")
                .scalar("_CloudSpeed", "cloud_speed")
                .scalar("_Cloud_Strength", "cloud_strength")
                .scalar("_CloudCoverage", "cloud_strength")
                .scalar("_CloudPower", "cloud_strength")
                .scalar("_Cloud_Falloff", "fog_density")
                .scalar("_Aurora_Speed", "aurora_speed")
                .scalar("_Aurora_Intensity", "aurora_intensity")
                .scalar("_Aurora_Scale", "aurora_scale")
                .color("_Top_Color", "top_color")
                .color("_CloudColor", "top_color")
                .color("_Base_Color", "base_color")
                .color("_Fresnel_Color", "fresnel_color")
                .color("_Scattering_Color", "scattering_color")
                .color("_Aurora_Color_01", "aurora_color_01")
                .color("_Aurora_Color_02", "aurora_color_02")
                .build();
    }

    private static FamilyMappingTable particles() {
        return FamilyMappingTable.builder(ShaderFamily.PARTICLES)
                .texture("_Albedo_Map", "albedo_map")
                .texture("_MainTex", "albedo_map")
                .texture("_BaseMap", "albedo_map")
                // misspelled in the source shaders
                .scalar("_Alpha_Clip_Treshold", "alpha_clip_threshold")
                .scalar("_Soft_Power", "soft_power")
                .scalar("_Soft_Distance", "soft_distance")
                .scalar("_Camera_Fade_Near", "camera_fade_near")
                .scalar("_Camera_Fade_Far", "camera_fade_far")
                .scalar("_Camera_Fade_Smoothness", "camera_fade_smoothness")
                .scalar("_View_Edge_Power", "view_edge_power")
                .scalar("_Fog_Density", "fog_density")
                .color("_Base_Color", "base_color")
                .color("_Color", "base_color")
                .color("_Color_Tint", "base_color")
                .color("_BaseColor", "base_color")
                .color("_Fog_Color", "fog_color")
                .build();
    }

    private static FamilyMappingTable skyDome() {
        return FamilyMappingTable.builder(ShaderFamily.SKY_DOME)
                .scalar("_Falloff", "falloff")
                .scalar("_Offset", "offset")
                // "distance" is reserved in the target shading language
                .scalar("_Distance", "distance_")
                .color("_Top_Color", "top_color")
                .color("_Bottom_Color", "bottom_color")
                .build();
    }

    private static FamilyMappingTable genericOpaque() {
        return FamilyMappingTable.builder(ShaderFamily.GENERIC_OPAQUE)
                .texture("_Base_Texture", "base_texture")
                .texture("_Albedo", "base_texture")
                .texture("_Albedo_Map", "base_texture")
                .texture("_BaseMap", "base_texture")
                .texture("_MainTex", "base_texture")
                .texture("_MainTexture", "base_texture")
                .texture("_Normal_Texture", "normal_texture")
                .texture("_Normal", "normal_texture")
                .texture("_Normal_Map", "normal_texture")
                .texture("_BumpMap", "normal_texture")
                .texture("_Emission_Texture", "emission_texture")
                .texture("_Emission_Map", "emission_texture")
                .texture("_EmissionMap", "emission_texture")
                .texture("_Emission", "emission_texture")
                .texture("_AO_Texture", "ao_texture")
                .texture("_OcclusionMap", "ao_texture")
                .texture("_Metallic_Smoothness_Texture", "metallic_texture")
                .texture("_MetallicGlossMap", "metallic_texture")
                .texture("_Metallic_Map", "metallic_texture")
                .texture("_Triplanar_Texture_Top", "triplanar_texture_top")
                .texture("_Triplanar_Texture_Side", "triplanar_texture_side")
                .texture("_Triplanar_Texture_Bottom", "triplanar_texture_bottom")
                .texture("_Triplanar_Normal_Texture_Top", "triplanar_normal_top")
                .texture("_Triplanar_Normal_Texture_Side", "triplanar_normal_side")
                .texture("_Triplanar_Normal_Texture_Bottom", "triplanar_normal_bottom")
                .texture("_Triplanar_Emission_Texture", "triplanar_emission_texture")
                .texture("_Overlay_Texture", "overlay_texture")
                .texture("_Moss", "overlay_texture")
                .texture("_MossTexture", "overlay_texture")
                .texture("_ParallaxMap", "height_texture")
                .texture("_HeightMap", "height_texture")
                .texture("_Alpha_Texture", "alpha_texture")
                .texture("_Hair_Mask", "hair_mask")
                .texture("_Skin_Mask", "skin_mask")
                .texture("_Mask_01", "mask_01")
                .texture("_Mask_02", "mask_02")
                .texture("_Mask_03", "mask_03")
                .texture("_Mask_04", "mask_04")
                .texture("_Mask_05", "mask_05")
                .texture("_Grunge_Map", "grunge_map")
                .texture("_Blood_Mask", "blood_mask")
                .texture("_Blood_Texture", "blood_texture")
                .texture("_Rune_Texture", "rune_texture")
                .texture("_Scan_Line_Map", "scan_line_map")
                .texture("_Cloth_Mask", "cloth_mask")
                .texture("_Snow_Normal_Texture", "snow_normal_texture")
                .texture("_Snow_Metallic_Smoothness_Texture", "snow_metallic_smoothness")
                .texture("_Snow_Edge_Noise", "snow_edge_noise")
                .texture("_DetailAlbedoMap", "detail_albedo")
                .texture("_DetailNormalMap", "detail_normal")
                .texture("_DetailMask", "detail_mask")
                .scalar("_Smoothness", "smoothness")
                .scalar("_Glossiness", "smoothness")
                .scalar("_Metallic", "metallic")
                .scalar("_Normal_Intensity", "normal_intensity")
                .scalar("_Normal_Amount", "normal_intensity")
                .scalar("_BumpScale", "normal_intensity")
                .scalar("_AO_Intensity", "ao_intensity")
                .scalar("_OcclusionStrength", "ao_intensity")
                .scalar("_Alpha_Clip_Threshold", "alpha_clip_threshold")
                .scalar("_Cutoff", "alpha_clip_threshold")
                .scalar("_AlphaCutoff", "alpha_clip_threshold")
                .scalar("_Emission_Intensity", "emission_intensity")
                .scalar("_Opacity", "opacity")
                .scalar("_Snow_Level", "snow_level")
                .scalar("_Snow_Transition", "snow_transition")
                .scalar("_Snow_Metallic", "snow_metallic")
                .scalar("_Snow_Smoothness", "snow_smoothness")
                .scalar("_Snow_Normal_Intensity", "snow_normal_intensity")
                .scalar("_Triplanar_Fade", "triplanar_fade")
                .scalar("_Triplanar_Intensity", "triplanar_intensity")
                .scalar("_Triplanar_Normal_Intensity_Top", "triplanar_normal_intensity_top")
                .scalar("_Triplanar_Normal_Intensity_Side", "triplanar_normal_intensity_side")
                .scalar("_Triplanar_Normal_Intensity_Bottom", "triplanar_normal_intensity_bottom")
                .scalar("_Hologram_Intensity", "hologram_intensity")
                .scalar("_Scroll_Speed", "scroll_speed")
                .scalar("_Transparency", "transparency")
                .scalar("_RimPower", "rim_power")
                .scalar("_Dirt_Amount", "dirt_amount")
                .scalar("_Dust_Amount", "dust_amount")
                .scalar("_Grunge_Intensity", "grunge_intensity")
                .scalar("_Glow_Amount", "glow_amount")
                .scalar("_Glow_Falloff", "glow_falloff")
                .scalar("_BloodAmount", "blood_amount")
                .scalar("_Blood_Intensity", "blood_intensity")
                .scalar("_Brightness", "brightness")
                .scalar("_UVScrollSpeed", "uv_scroll_speed")
                .scalar("_Saturation", "saturation")
                .scalar("_Wave_Speed", "wave_speed")
                .scalar("_Wave_Amplitude", "wave_amplitude")
                .scalar("_Wind_Influence", "wind_influence")
                .scalar("_DetailNormalMapScale", "detail_normal_scale")
                .color("_Color_Tint", "color_tint")
                .color("_Color", "color_tint")
                .color("_BaseColor", "color_tint")
                .color("_BaseColour", "color_tint")
                .color("_Emission_Color", "emission_color")
                .color("_EmissionColor", "emission_color")
                .color("_Snow_Color", "snow_color")
                .color("_Hair_Color", "hair_color")
                .color("_Skin_Color", "skin_color")
                .color("_Neon_Colour_01", "neon_color_01")
                .color("_Neon_Colour_02", "neon_color_02")
                .color("_Hologram_Color", "hologram_color")
                .color("_RimColor", "rim_color")
                .color("_Dust_Colour", "dust_color")
                .color("_Glow_Colour", "glow_color")
                .color("_Glow_Tint", "glow_tint")
                .color("_Liquid_Color", "liquid_color")
                .color("_BloodColor", "blood_color")
                .color("_Blood_Color", "blood_color")
                .color("_Color_Primary", "color_primary")
                .color("_Color_Secondary", "color_secondary")
                .color("_Color_Tertiary", "color_tertiary")
                .color("_Color_Metal_Primary", "color_metal_primary")
                .color("_Color_Metal_Secondary", "color_metal_secondary")
                .color("_Color_Metal_Dark", "color_metal_dark")
                .color("_Color_Leather_Primary", "color_leather_primary")
                .color("_Color_Leather_Secondary", "color_leather_secondary")
                .color("_Color_Skin", "color_skin")
                .color("_Color_Hair", "color_hair")
                .color("_Color_Eyes", "color_eyes")
                .color("_Color_Stubble", "color_stubble")
                .color("_Color_Scar", "color_scar")
                .color("_Color_BodyArt", "color_bodyart")
                .defaultValue("smoothness", 0.5)
                .defaultValue("metallic", 0.0)
                .build();
    }
}
