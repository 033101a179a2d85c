package com.materialport.converter.mapping;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.materialport.converter.model.ShaderFamily;
import com.materialport.converter.model.UniformValue;
import com.materialport.converter.util.PropertyNameUtil;

import lombok.Getter;

/**
 * Rename table for one shader family. Entries are keyed by normalized source
 * name and kept in declaration order; that order also fixes the order
 * uniforms are written in.
 */
@Getter
public class FamilyMappingTable {
    private final ShaderFamily family;
    private final Map<String, PropertyMapping> textures;
    private final Map<String, PropertyMapping> scalars;
    private final Map<String, PropertyMapping> colors;
    private final Map<String, UniformValue> defaults;
    private final List<String> uniformOrder;

    private FamilyMappingTable(Builder builder) {
        this.family = builder.family;
        this.textures = Collections.unmodifiableMap(new LinkedHashMap<>(builder.textures));
        this.scalars = Collections.unmodifiableMap(new LinkedHashMap<>(builder.scalars));
        this.colors = Collections.unmodifiableMap(new LinkedHashMap<>(builder.colors));
        this.defaults = Collections.unmodifiableMap(new LinkedHashMap<>(builder.defaults));

        List<String> order = new ArrayList<>();
        addTargets(order, textures.values());
        addTargets(order, scalars.values());
        addTargets(order, colors.values());
        defaults.keySet().stream().filter(name -> !order.contains(name)).forEach(order::add);
        this.uniformOrder = Collections.unmodifiableList(order);
    }

    public static Builder builder(ShaderFamily family) {
        return new Builder(family);
    }

    public Optional<PropertyMapping> scalar(String sourceName) {
        return Optional.ofNullable(scalars.get(PropertyNameUtil.normalize(sourceName)));
    }

    /**
     * This table's entries layered over {@code base}: entries declared here win,
     * inherited entries follow them. Defaults are not inherited.
     */
    public FamilyMappingTable inheriting(FamilyMappingTable base) {
        Builder merged = new Builder(family);
        textures.values().forEach(merged::texture);
        base.textures.values().forEach(merged::texture);
        scalars.values().forEach(merged::scalar);
        base.scalars.values().forEach(merged::scalar);
        colors.values().forEach(merged::color);
        base.colors.values().forEach(merged::color);
        merged.defaults.putAll(defaults);
        return merged.build();
    }

    private static void addTargets(List<String> order, Collection<PropertyMapping> mappings) {
        for (PropertyMapping mapping : mappings) {
            if (!order.contains(mapping.getTarget())) {
                order.add(mapping.getTarget());
            }
        }
    }

    public static final class Builder {
        private final ShaderFamily family;
        private final Map<String, PropertyMapping> textures = new LinkedHashMap<>();
        private final Map<String, PropertyMapping> scalars = new LinkedHashMap<>();
        private final Map<String, PropertyMapping> colors = new LinkedHashMap<>();
        private final Map<String, UniformValue> defaults = new LinkedHashMap<>();

        private Builder(ShaderFamily family) {
            this.family = family;
        }

        public Builder texture(String source, String target) {
            return texture(PropertyMapping.rename(source, target));
        }

        public Builder texture(PropertyMapping mapping) {
            textures.putIfAbsent(PropertyNameUtil.normalize(mapping.getSource()), mapping);
            return this;
        }

        public Builder scalar(String source, String target) {
            return scalar(PropertyMapping.rename(source, target));
        }

        public Builder scalar(String source, String target, double scale) {
            return scalar(new PropertyMapping(source, target, scale, ColorSpace.NONE));
        }

        public Builder scalar(PropertyMapping mapping) {
            scalars.putIfAbsent(PropertyNameUtil.normalize(mapping.getSource()), mapping);
            return this;
        }

        public Builder color(String source, String target) {
            return color(PropertyMapping.rename(source, target));
        }

        public Builder color(String source, String target, ColorSpace colorSpace) {
            return color(new PropertyMapping(source, target, 1.0, colorSpace));
        }

        public Builder color(PropertyMapping mapping) {
            colors.putIfAbsent(PropertyNameUtil.normalize(mapping.getSource()), mapping);
            return this;
        }

        public Builder defaultValue(String uniform, double value) {
            defaults.put(uniform, UniformValue.ofFloat(value));
            return this;
        }

        public Builder defaultValue(String uniform, boolean value) {
            defaults.put(uniform, UniformValue.ofBool(value));
            return this;
        }

        public FamilyMappingTable build() {
            return new FamilyMappingTable(this);
        }
    }
}
