package com.materialport.converter.archive;

import java.util.Optional;

/**
 * Resolves a texture identifier to the file name it was packaged under.
 */
@FunctionalInterface
public interface TextureLookup {

    Optional<String> textureFileName(String identifier);

    static TextureLookup empty() {
        return identifier -> Optional.empty();
    }
}
