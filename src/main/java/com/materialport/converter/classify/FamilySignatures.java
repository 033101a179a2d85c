package com.materialport.converter.classify;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.materialport.converter.model.MaterialRecord;
import com.materialport.converter.model.ShaderFamily;

import lombok.Value;

/**
 * Signature table and the most-specific-match rule.
 */
public class FamilySignatures {

    private static final List<FamilySignature> DEFAULT_SIGNATURES = List.of(
            FamilySignature.of(ShaderFamily.VEGETATION,
                    List.of("_Leaf_Texture", "_Trunk_Texture", "_Leaf_Normal", "_Trunk_Normal", "_Breeze_Noise_Map",
                            "_Leaf_Ambient_Occlusion", "_Trunk_Ambient_Occlusion"),
                    List.of("_Wind_Direction", "_Breeze_Strength", "_Light_Wind_Strength", "_Strong_Wind_Strength",
                            "_Wind_Twist_Strength", "_Leaf_Smoothness", "_LeafSmoothness", "_Trunk_Smoothness",
                            "_TrunkSmoothness", "_Leaf_Metallic", "_Trunk_Metallic", "_Enable_Breeze",
                            "_Leaves_WindAmount", "_Tree_WindAmount"),
                    List.of("_Leaf_Base_Color", "_Trunk_Base_Color")),
            FamilySignature.of(ShaderFamily.WATER,
                    List.of("_Wave_Gradient", "_Caustics_Flipbook", "_Foam_Noise_Texture", "_Shore_Foam_Noise_Texture",
                            "_Scrolling_Texture", "_Water_Normal_Texture", "_Foam_Texture"),
                    List.of("_Maximum_Depth", "_Shore_Wave_Speed", "_Ocean_Wave_Height", "_Shore_Foam_Intensity",
                            "_Caustics_Intensity", "_Base_Opacity", "_Shallows_Opacity"),
                    List.of("_Shallow_Color", "_Deep_Color", "_Very_Deep_Color", "_Foam_Color", "_Caustics_Color")),
            FamilySignature.of(ShaderFamily.CRYSTAL,
                    List.of("_Refraction_Height", "_Refraction_Texture", "_Top_Albedo", "_Base_Albedo",
                            "_Top_Normal", "_Base_Normal"),
                    List.of("_Fresnel_Power", "_Refraction_Strength", "_Deep_Depth", "_Shallow_Depth",
                            "_Enable_Fresnel", "_Enable_Refraction"),
                    List.of("_Deep_Color", "_Shallow_Color", "_Fresnel_Color", "_Refraction_Color")),
            FamilySignature.of(ShaderFamily.CLOUDS,
                    List.of(),
                    List.of("_Light_Intensity", "_Scattering_Multiplier", "_Cloud_Speed", "_Cloud_Strength",
                            "_CloudCoverage"),
                    List.of("_Scattering_Color", "_Aurora_Color_01", "_Aurora_Color_02")),
            FamilySignature.of(ShaderFamily.PARTICLES,
                    List.of(),
                    List.of("_Soft_Power", "_Soft_Distance", "_Camera_Fade_Near", "_Camera_Fade_Far",
                            "_View_Edge_Power", "_Fog_Density"),
                    List.of("_Fog_Color")),
            FamilySignature.of(ShaderFamily.SKY_DOME,
                    List.of(),
                    List.of("_Falloff", "_Offset", "_Distance"),
                    List.of("_Top_Color", "_Bottom_Color")),
            FamilySignature.of(ShaderFamily.GENERIC_OPAQUE,
                    List.of("_Triplanar_Texture_Top", "_Triplanar_Texture_Side", "_Triplanar_Texture_Bottom"),
                    List.of("_Enable_Triplanar_Texture"),
                    List.of())
    );

    private final List<FamilySignature> signatures;

    public FamilySignatures() {
        this(DEFAULT_SIGNATURES);
    }

    public FamilySignatures(List<FamilySignature> signatures) {
        this.signatures = List.copyOf(signatures);
    }

    /**
     * The satisfied signature with the most matched keys; equal counts go to
     * the family that comes first in {@link ShaderFamily} order.
     */
    public Optional<Match> bestMatch(MaterialRecord record) {
        Match best = null;
        for (FamilySignature signature : signatures) {
            Set<String> matched = signature.matchedKeys(record);
            if (matched.isEmpty()) {
                continue;
            }
            Match candidate = new Match(signature.getFamily(), matched);
            if (best == null
                    || matched.size() > best.getMatchedKeys().size()
                    || (matched.size() == best.getMatchedKeys().size() && candidate.getFamily().outranks(best.getFamily()))) {
                best = candidate;
            }
        }
        return Optional.ofNullable(best);
    }

    @Value
    public static class Match {
        ShaderFamily family;
        Set<String> matchedKeys;
    }
}
