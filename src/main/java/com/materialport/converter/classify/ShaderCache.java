package com.materialport.converter.classify;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.materialport.converter.model.ShaderDecision;

/**
 * Material name to shader decision, fixed once built.
 */
public class ShaderCache {

    private final Map<String, ShaderDecision> decisions;

    public ShaderCache(Map<String, ShaderDecision> decisions) {
        this.decisions = Collections.unmodifiableMap(new LinkedHashMap<>(decisions));
    }

    public Optional<ShaderDecision> get(String materialName) {
        return Optional.ofNullable(decisions.get(materialName));
    }

    public boolean contains(String materialName) {
        return decisions.containsKey(materialName);
    }

    public int size() {
        return decisions.size();
    }

    public Map<String, ShaderDecision> asMap() {
        return decisions;
    }
}
