package com.materialport.converter.model;

import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * One source material as read from the archive. Property maps keep the
 * order in which the properties appear in the material file.
 */
@Value
@Builder
public class MaterialRecord {
    @NonNull String name;

    /**
     * Declared archive path of the material file, when known.
     */
    String sourcePath;

    @NonNull
    @Builder.Default
    ShaderReference shader = ShaderReference.none();

    @Singular Map<String, TextureRef> textures;
    @Singular Map<String, Double> scalars;
    @Singular Map<String, RgbaColor> colors;

    public boolean hasProperties() {
        return !textures.isEmpty() || !scalars.isEmpty() || !colors.isEmpty();
    }
}
