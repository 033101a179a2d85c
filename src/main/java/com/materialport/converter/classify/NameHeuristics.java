package com.materialport.converter.classify;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import com.materialport.converter.model.ShaderFamily;

import lombok.Value;

/**
 * Scores a material name against weighted keyword patterns. Technique words
 * ("triplanar", "caustics") weigh more than broad ones ("leaf", "dirt"), so a
 * name like {@code Dirt_Leaves_Triplanar} stays generic.
 */
public class NameHeuristics {

    public static final int MINIMUM_SCORE = 20;

    private static final List<WeightedPattern> PATTERNS = List.of(
            weighted("triplanar", ShaderFamily.GENERIC_OPAQUE, 60),
            weighted("caustics", ShaderFamily.WATER, 55),
            weighted("fresnel|refractive|refraction", ShaderFamily.CRYSTAL, 55),
            weighted("soft.?particle", ShaderFamily.PARTICLES, 55),
            weighted("skydome|sky_dome|skybox|sky_box", ShaderFamily.SKY_DOME, 55),

            weighted("crystal|gem|jewel|diamond|ruby|emerald|sapphire|amethyst|quartz", ShaderFamily.CRYSTAL, 45),
            weighted("water|ocean|river|lake|waterfall", ShaderFamily.WATER, 45),
            weighted("particle|fx_", ShaderFamily.PARTICLES, 45),
            weighted("cloud|clouds|sky_cloud", ShaderFamily.CLOUDS, 45),

            weighted("glass|ice|transparent|translucent", ShaderFamily.CRYSTAL, 35),
            weighted("pond|stream|liquid|aqua|sea", ShaderFamily.WATER, 35),
            weighted("fog|mist|atmosphere", ShaderFamily.CLOUDS, 35),
            weighted("spark|dust|debris|smoke|fire|rain|snow|splash", ShaderFamily.PARTICLES, 35),
            weighted("aurora|sky_gradient", ShaderFamily.SKY_DOME, 35),
            weighted("foliage|vegetation", ShaderFamily.VEGETATION, 35),

            weighted("tree|fern|grass|vine|branch|willow|bush|shrub|hedge|bamboo|koru|treefern", ShaderFamily.VEGETATION, 25),
            weighted("leaf|leaves", ShaderFamily.VEGETATION, 20),
            weighted("bark|trunk|undergrowth|plant", ShaderFamily.VEGETATION, 20),

            weighted("moss|dirt", ShaderFamily.GENERIC_OPAQUE, 15),
            weighted("effect|additive", ShaderFamily.PARTICLES, 15)
    );

    /**
     * Best scoring family, if its total reaches {@link #MINIMUM_SCORE}.
     */
    public Optional<Score> score(String materialName) {
        if (materialName == null || materialName.isBlank()) {
            return Optional.empty();
        }

        Map<ShaderFamily, Integer> totals = new EnumMap<>(ShaderFamily.class);
        for (WeightedPattern p : PATTERNS) {
            if (p.getPattern().matcher(materialName).find()) {
                totals.merge(p.getFamily(), p.getWeight(), Integer::sum);
            }
        }

        // EnumMap iterates in priority order, so strict '>' keeps the higher-priority family on ties
        ShaderFamily best = null;
        int bestScore = 0;
        for (Map.Entry<ShaderFamily, Integer> e : totals.entrySet()) {
            if (e.getValue() > bestScore) {
                best = e.getKey();
                bestScore = e.getValue();
            }
        }

        if (best == null || bestScore < MINIMUM_SCORE) {
            return Optional.empty();
        }
        return Optional.of(new Score(best, bestScore));
    }

    private static WeightedPattern weighted(String regex, ShaderFamily family, int weight) {
        return new WeightedPattern(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), family, weight);
    }

    @Value
    private static class WeightedPattern {
        Pattern pattern;
        ShaderFamily family;
        int weight;
    }

    @Value
    public static class Score {
        ShaderFamily family;
        int points;
    }
}
