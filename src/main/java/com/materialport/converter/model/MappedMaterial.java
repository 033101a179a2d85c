package com.materialport.converter.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Target-ready form of a material: its family, texture slots and typed
 * uniforms. Map order is the order the mapper produced them in; the
 * serializer applies its own declared ordering.
 */
@Value
public class MappedMaterial {
    String name;
    ShaderFamily family;
    ShaderDecision decision;
    Map<String, TextureBinding> textures;
    Map<String, UniformValue> uniforms;
    boolean placeholder;

    @Builder
    private MappedMaterial(@NonNull String name, @NonNull ShaderFamily family, @NonNull ShaderDecision decision,
                           Map<String, TextureBinding> textures, Map<String, UniformValue> uniforms,
                           boolean placeholder) {
        this.name = name;
        this.family = family;
        this.decision = decision;
        this.textures = textures == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(textures));
        this.uniforms = uniforms == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(uniforms));
        this.placeholder = placeholder;
    }

    /**
     * Names of every texture slot, resolved or not.
     */
    public Set<String> getRequiredTextureNames() {
        return new LinkedHashSet<>(textures.keySet());
    }

    public boolean hasMissingTextures() {
        return textures.values().stream().anyMatch(TextureBinding::isMissing);
    }
}
