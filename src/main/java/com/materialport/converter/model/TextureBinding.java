package com.materialport.converter.model;

import lombok.NonNull;
import lombok.Value;

/**
 * A target texture slot and the file it resolves to. Unresolved slots keep
 * their place and carry the missing marker instead of a file name.
 */
@Value
public class TextureBinding {
    public static final String MISSING_FILENAME = "__missing_texture__.png";

    @NonNull String uniform;
    @NonNull String sourceProperty;
    String identifier;
    String filename;

    public static TextureBinding resolved(String uniform, String sourceProperty, String identifier, String filename) {
        return new TextureBinding(uniform, sourceProperty, identifier, filename);
    }

    public static TextureBinding missing(String uniform, String sourceProperty, String identifier) {
        return new TextureBinding(uniform, sourceProperty, identifier, null);
    }

    public boolean isMissing() {
        return filename == null;
    }

    /**
     * File name to reference from the generated resource.
     */
    public String getReferenceName() {
        return isMissing() ? MISSING_FILENAME : filename;
    }
}
