package com.materialport.converter.model;

/**
 * Target shader families. Declaration order is the tie-break priority:
 * earlier constants win when two families are equally well supported.
 */
public enum ShaderFamily {
    VEGETATION("foliage.gdshader"),
    WATER("water.gdshader"),
    CRYSTAL("crystal.gdshader"),
    CLOUDS("clouds.gdshader"),
    PARTICLES("particles.gdshader"),
    SKY_DOME("skydome.gdshader"),
    GENERIC_OPAQUE("polygon.gdshader");

    private final String shaderFile;

    ShaderFamily(String shaderFile) {
        this.shaderFile = shaderFile;
    }

    public String getShaderFile() {
        return shaderFile;
    }

    /**
     * True when this family outranks {@code other} in tie-breaks.
     */
    public boolean outranks(ShaderFamily other) {
        return other == null || ordinal() < other.ordinal();
    }
}
