package com.materialport.converter.model;

import lombok.Value;

/**
 * A material's reference to its source shader.
 *
 * <ul>
 *   <li>identifier: the shader asset identifier, null when the material has none</li>
 *   <li>shaderName: resolved name, null when the identifier is unknown</li>
 *   <li>family: family declared for a well-known shader, null otherwise</li>
 *   <li>generic: the shader is a stock lit/fallback shader that says nothing about the family</li>
 * </ul>
 */
@Value
public class ShaderReference {
    String identifier;
    String shaderName;
    ShaderFamily family;
    boolean generic;

    public static ShaderReference none() {
        return new ShaderReference(null, null, null, false);
    }

    public static ShaderReference unresolved(String identifier) {
        return new ShaderReference(identifier, null, null, false);
    }

    public boolean isResolved() {
        return shaderName != null;
    }

    /**
     * True when the reference alone determines the family.
     */
    public boolean isConclusive() {
        return family != null && !generic;
    }
}
