package com.materialport.converter.parser;

import com.materialport.converter.model.ShaderFamily;

import lombok.NonNull;
import lombok.Value;

@Value
public class KnownShader {
    @NonNull String identifier;
    @NonNull String name;
    @NonNull ShaderFamily family;

    /**
     * Stock lit or fallback shader; its family is only a default.
     */
    boolean generic;
}
