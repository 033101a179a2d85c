package com.materialport.converter.pipeline;

import java.nio.file.Path;

import com.materialport.converter.archive.UnityPackageExtractor;
import com.materialport.converter.parser.MaterialRecordParser;

import lombok.Builder;
import lombok.Value;

/**
 * Settings for one conversion run.
 */
@Value
@Builder
public class ConverterConfig {
    public static final String DEFAULT_SHADER_BASE = "res://shaders";
    public static final String DEFAULT_TEXTURE_BASE = "res://textures";

    @Builder.Default
    String shaderBase = DEFAULT_SHADER_BASE;

    @Builder.Default
    String textureBase = DEFAULT_TEXTURE_BASE;

    /** Largest non-texture asset kept from the archive. */
    @Builder.Default
    long maxContentBytes = UnityPackageExtractor.DEFAULT_MAX_CONTENT_BYTES;

    @Builder.Default
    double colorEpsilon = MaterialRecordParser.DEFAULT_COLOR_EPSILON;

    /** Parent of the extraction work directory; null uses the system temp directory. */
    Path tempRoot;

    public static ConverterConfig defaults() {
        return ConverterConfig.builder().build();
    }
}
