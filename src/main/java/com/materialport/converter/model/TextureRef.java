package com.materialport.converter.model;

import lombok.NonNull;
import lombok.Value;

/**
 * A populated texture slot of a source material.
 */
@Value
public class TextureRef {
    @NonNull String identifier;
    @NonNull Vector2 scale;
    @NonNull Vector2 offset;

    public boolean hasCustomScale() {
        return !Vector2.ONE.equals(scale);
    }

    public boolean hasCustomOffset() {
        return !Vector2.ZERO.equals(offset);
    }
}
