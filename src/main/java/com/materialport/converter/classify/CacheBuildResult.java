package com.materialport.converter.classify;

import java.util.SortedSet;

import lombok.Value;

/**
 * The built cache plus the material names that were classified on their own
 * because no LOD0 decision covered them.
 */
@Value
public class CacheBuildResult {
    ShaderCache cache;
    SortedSet<String> unmatched;
}
