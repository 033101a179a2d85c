package com.materialport.converter.pipeline;

import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import com.materialport.converter.classify.ShaderCache;
import com.materialport.converter.diagnostics.ConversionDiagnostics;
import com.materialport.converter.model.MappedMaterial;
import com.materialport.converter.model.PrefabMaterials;

import lombok.Builder;
import lombok.Data;

/**
 * Result of a conversion run. Partial results are kept when individual
 * materials fail; {@code success} is false only when the archive itself
 * could not be read.
 */
@Data
@Builder
public class ConversionResult {
    private boolean success;
    private String errorMessage;

    /** Output file name -> resource text, sorted by file name. */
    @Builder.Default
    private Map<String, String> resources = new TreeMap<>();

    @Builder.Default
    private List<MappedMaterial> mappedMaterials = List.of();

    /** Texture file names the resources reference, including the missing marker when used. */
    @Builder.Default
    private SortedSet<String> requiredTextures = new TreeSet<>();

    /** "material/uniform" for every texture slot with no file in the archive. */
    @Builder.Default
    private List<String> missingTextures = List.of();

    /** Manifest prefabs, grouped across LODs. */
    @Builder.Default
    private List<PrefabMaterials> prefabs = List.of();

    @Builder.Default
    private SortedSet<String> unmatchedMaterials = new TreeSet<>();

    private ShaderCache shaderCache;

    private int materialsFound;
    private int materialsParsed;
    private int materialsMapped;
    private int placeholdersCreated;

    @Builder.Default
    private ConversionDiagnostics diagnostics = new ConversionDiagnostics();

    public static ConversionResult failure(String errorMessage, ConversionDiagnostics diagnostics) {
        return ConversionResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .diagnostics(diagnostics)
                .build();
    }
}
