package com.materialport.converter.mapping;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.materialport.converter.archive.TextureLookup;
import com.materialport.converter.classify.ShaderClassifier;
import com.materialport.converter.model.MappedMaterial;
import com.materialport.converter.model.MaterialRecord;
import com.materialport.converter.model.RgbaColor;
import com.materialport.converter.model.ShaderDecision;
import com.materialport.converter.model.ShaderFamily;
import com.materialport.converter.model.TextureBinding;
import com.materialport.converter.model.TextureRef;
import com.materialport.converter.model.UniformValue;
import com.materialport.converter.util.PropertyNameUtil;

/**
 * Rewrites a source material into the uniforms its target family expects.
 *
 * Source properties with no entry in the family table are dropped. When two
 * source properties map to the same target, the one declared first in the
 * table wins.
 */
public class PropertyMapper {
    private static final Logger log = LoggerFactory.getLogger(PropertyMapper.class);

    static final String MODE_PROPERTY = "_Mode";

    private final MappingTables tables;
    private final ShaderClassifier classifier;
    private final TextureLookup textureLookup;

    public PropertyMapper(MappingTables tables, ShaderClassifier classifier, TextureLookup textureLookup) {
        this.tables = tables;
        this.classifier = classifier;
        this.textureLookup = textureLookup;
    }

    /**
     * @param decisionOverride cached decision for this material; when null the material is classified here
     * @throws MappingException when the material has no properties and an unresolved shader
     */
    public MappedMaterial map(MaterialRecord material, ShaderDecision decisionOverride) {
        if (!material.hasProperties() && !material.getShader().isResolved()) {
            throw new MappingException(material.getName(), "Material has no properties and no known shader");
        }

        ShaderDecision decision = decisionOverride != null ? decisionOverride : classifier.classify(material);
        FamilyMappingTable table = tables.forFamily(decision.getFamily());

        Map<String, TextureBinding> textures = new LinkedHashMap<>();
        Map<String, UniformValue> uniforms = new LinkedHashMap<>();

        mapTextures(material, table, textures, uniforms);
        mapScalars(material, table, uniforms);
        mapColors(material, table, uniforms);
        table.getDefaults().forEach(uniforms::putIfAbsent);

        log.debug("Mapped {} to {}: {} textures, {} uniforms", material.getName(), decision.getFamily(),
                textures.size(), uniforms.size());
        return MappedMaterial.builder()
                .name(material.getName())
                .family(decision.getFamily())
                .decision(decision)
                .textures(textures)
                .uniforms(uniforms)
                .build();
    }

    /**
     * Stand-in for a material that a manifest names but the archive does not
     * contain. Carries the family defaults and no textures.
     */
    public MappedMaterial placeholder(String materialName, ShaderDecision decision) {
        Map<String, UniformValue> uniforms = new LinkedHashMap<>();
        if (decision.getFamily() == ShaderFamily.CRYSTAL) {
            uniforms.put("base_color", UniformValue.ofColor(new RgbaColor(0.5, 0.7, 1.0, 1.0)));
            uniforms.put("enable_fresnel", UniformValue.ofBool(true));
        } else if (decision.getFamily() == ShaderFamily.WATER) {
            uniforms.put("deep_color", UniformValue.ofColor(new RgbaColor(0.0, 0.2, 0.4, 1.0)));
            uniforms.put("shallow_color", UniformValue.ofColor(new RgbaColor(0.2, 0.5, 0.7, 1.0)));
        }
        tables.forFamily(decision.getFamily()).getDefaults().forEach(uniforms::putIfAbsent);

        return MappedMaterial.builder()
                .name(materialName)
                .family(decision.getFamily())
                .decision(decision)
                .uniforms(uniforms)
                .placeholder(true)
                .build();
    }

    private void mapTextures(MaterialRecord material, FamilyMappingTable table,
                             Map<String, TextureBinding> textures, Map<String, UniformValue> uniforms) {
        Map<String, Map.Entry<String, TextureRef>> present = byNormalizedName(material.getTextures());

        for (Map.Entry<String, PropertyMapping> entry : table.getTextures().entrySet()) {
            Map.Entry<String, TextureRef> source = present.get(entry.getKey());
            String target = entry.getValue().getTarget();
            if (source == null || textures.containsKey(target)) {
                continue;
            }

            TextureRef ref = source.getValue();
            Optional<String> filename = textureLookup.textureFileName(ref.getIdentifier());
            if (filename.isPresent()) {
                textures.put(target, TextureBinding.resolved(target, source.getKey(), ref.getIdentifier(), filename.get()));
            } else {
                log.debug("{}: texture {} ({}) not in archive", material.getName(), source.getKey(), ref.getIdentifier());
                textures.put(target, TextureBinding.missing(target, source.getKey(), ref.getIdentifier()));
            }

            if (ref.hasCustomScale()) {
                uniforms.put(target + "_tiling", UniformValue.ofVector(ref.getScale()));
            }
            if (ref.hasCustomOffset()) {
                uniforms.put(target + "_offset", UniformValue.ofVector(ref.getOffset()));
            }
        }

        logDropped(material, "texture", material.getTextures().keySet(), table.getTextures());
    }

    private void mapScalars(MaterialRecord material, FamilyMappingTable table, Map<String, UniformValue> uniforms) {
        // Toggles first; they may have no table entry at all
        for (Map.Entry<String, Double> scalar : material.getScalars().entrySet()) {
            if (!tables.isBooleanProperty(scalar.getKey())) {
                continue;
            }
            String target = table.scalar(scalar.getKey())
                    .map(PropertyMapping::getTarget)
                    .orElseGet(() -> PropertyNameUtil.toUniformName(scalar.getKey()));
            uniforms.putIfAbsent(target, UniformValue.ofBool(scalar.getValue() != 0.0));
        }

        Map<String, Map.Entry<String, Double>> present = byNormalizedName(material.getScalars());
        for (Map.Entry<String, PropertyMapping> entry : table.getScalars().entrySet()) {
            Map.Entry<String, Double> source = present.get(entry.getKey());
            if (source == null || tables.isBooleanProperty(source.getKey())) {
                continue;
            }
            PropertyMapping mapping = entry.getValue();
            uniforms.putIfAbsent(mapping.getTarget(), UniformValue.ofFloat(source.getValue() * mapping.getScale()));
        }
    }

    private void mapColors(MaterialRecord material, FamilyMappingTable table, Map<String, UniformValue> uniforms) {
        boolean transparentMode = material.getScalars().getOrDefault(MODE_PROPERTY, 0.0) >= 1.0;
        Map<String, Map.Entry<String, RgbaColor>> present = byNormalizedName(material.getColors());

        for (Map.Entry<String, PropertyMapping> entry : table.getColors().entrySet()) {
            Map.Entry<String, RgbaColor> source = present.get(entry.getKey());
            PropertyMapping mapping = entry.getValue();
            if (source == null || uniforms.containsKey(mapping.getTarget())) {
                continue;
            }

            RgbaColor color = source.getValue();
            if (!transparentMode && color.getA() == 0.0 && color.hasRgb() && tables.needsAlphaFix(source.getKey())) {
                log.trace("{}: {} has zero alpha, writing it opaque", material.getName(), source.getKey());
                color = color.withAlpha(1.0);
            }
            color = mapping.getColorSpace().apply(color);
            if (mapping.getScale() != 1.0) {
                double s = mapping.getScale();
                color = new RgbaColor(color.getR() * s, color.getG() * s, color.getB() * s, color.getA());
            }
            uniforms.put(mapping.getTarget(), UniformValue.ofColor(color));
        }
    }

    private static <V> Map<String, Map.Entry<String, V>> byNormalizedName(Map<String, V> properties) {
        Map<String, Map.Entry<String, V>> result = new LinkedHashMap<>();
        for (Map.Entry<String, V> property : properties.entrySet()) {
            result.put(PropertyNameUtil.normalize(property.getKey()), property);
        }
        return result;
    }

    private static void logDropped(MaterialRecord material, String kind, Iterable<String> names,
                                   Map<String, PropertyMapping> mapped) {
        if (!log.isDebugEnabled()) {
            return;
        }
        for (String name : names) {
            if (!mapped.containsKey(PropertyNameUtil.normalize(name))) {
                log.debug("{}: no {} mapping for {}", material.getName(), kind, name);
            }
        }
    }
}
