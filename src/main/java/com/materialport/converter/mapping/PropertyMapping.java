package com.materialport.converter.mapping;

import lombok.NonNull;
import lombok.Value;

/**
 * One rename rule: source property to target uniform, with the factor and
 * color-space conversion applied on the way.
 */
@Value
public class PropertyMapping {
    @NonNull String source;
    @NonNull String target;
    double scale;
    @NonNull ColorSpace colorSpace;

    public static PropertyMapping rename(String source, String target) {
        return new PropertyMapping(source, target, 1.0, ColorSpace.NONE);
    }
}
