package com.materialport.converter.pipeline;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.materialport.converter.archive.AssetIndex;
import com.materialport.converter.archive.ExtractionException;
import com.materialport.converter.archive.UnityPackageExtractor;
import com.materialport.converter.classify.CacheBuildResult;
import com.materialport.converter.classify.ShaderCache;
import com.materialport.converter.classify.ShaderCacheBuilder;
import com.materialport.converter.classify.ShaderClassifier;
import com.materialport.converter.diagnostics.ConversionDiagnostics;
import com.materialport.converter.diagnostics.DiagnosticKind;
import com.materialport.converter.mapping.MappingException;
import com.materialport.converter.mapping.MappingTables;
import com.materialport.converter.mapping.PropertyMapper;
import com.materialport.converter.materiallist.MaterialListDocument;
import com.materialport.converter.materiallist.MaterialListParser;
import com.materialport.converter.materiallist.MeshMaterialMappingWriter;
import com.materialport.converter.materiallist.PrefabGrouper;
import com.materialport.converter.model.DecisionBasis;
import com.materialport.converter.model.MappedMaterial;
import com.materialport.converter.model.MaterialRecord;
import com.materialport.converter.model.ShaderDecision;
import com.materialport.converter.model.TextureBinding;
import com.materialport.converter.parser.MaterialParseException;
import com.materialport.converter.parser.MaterialRecordParser;
import com.materialport.converter.serializer.TresSerializer;
import com.materialport.converter.util.FileNameUtil;
import com.materialport.converter.util.FileWriteUtil;

/**
 * Runs one conversion: extract the package, read materials and material
 * lists, build the shader cache, map and render every material.
 *
 * Only an unreadable package stops a run. Everything else is recorded in the
 * result's diagnostics and the run carries on with the remaining materials.
 * Extracted files are removed before {@link #convert} returns.
 */
public class ConversionPipeline {
    private static final Logger log = LoggerFactory.getLogger(ConversionPipeline.class);

    public static final String MATERIALS_DIR = "materials";
    public static final String RESOURCE_EXTENSION = ".tres";

    private final ConverterConfig config;
    private final MappingTables tables;
    private final ShaderClassifier classifier;
    private final TresSerializer serializer;
    private final MaterialListParser materialListParser = new MaterialListParser();
    private final MeshMaterialMappingWriter mappingWriter = new MeshMaterialMappingWriter();

    public ConversionPipeline(ConverterConfig config) {
        this(config, MappingTables.defaults(), new ShaderClassifier());
    }

    public ConversionPipeline(ConverterConfig config, MappingTables tables, ShaderClassifier classifier) {
        this.config = config;
        this.tables = tables;
        this.classifier = classifier;
        this.serializer = new TresSerializer(tables);
    }

    public ConversionResult convert(Path archive, List<Path> materialLists) {
        ConversionDiagnostics diagnostics = new ConversionDiagnostics();
        log.info("Converting {}", archive);

        AssetIndex index;
        try {
            index = new UnityPackageExtractor(config.getMaxContentBytes(), config.getTempRoot())
                    .extract(archive, diagnostics);
        } catch (ExtractionException e) {
            log.error("Extraction failed: {}", e.getMessage());
            diagnostics.error(DiagnosticKind.EXTRACTION, archive.toString(), e.getMessage());
            return ConversionResult.failure(e.getMessage(), diagnostics);
        }

        try {
            return convert(index, readMaterialLists(materialLists, diagnostics), diagnostics);
        } finally {
            release(index, diagnostics);
        }
    }

    /**
     * Converts an already extracted package. The index is left open.
     */
    public ConversionResult convert(AssetIndex index, MaterialListDocument materialList, ConversionDiagnostics diagnostics) {
        // Step 1: parse materials
        List<MaterialRecord> records = parseMaterials(index, diagnostics);

        // Step 2: classify, LOD0 decisions shared across each prefab
        CacheBuildResult cacheResult = new ShaderCacheBuilder(classifier).build(records, materialList.getPrefabs());
        ShaderCache cache = cacheResult.getCache();
        reportDecisions(cache, materialList, diagnostics);

        // Step 3: map
        PropertyMapper mapper = new PropertyMapper(tables, classifier, index);
        List<MappedMaterial> mapped = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (MaterialRecord record : records) {
            seen.add(record.getName());
            try {
                mapped.add(mapper.map(record, cache.get(record.getName()).orElse(null)));
            } catch (MappingException e) {
                log.warn("Skipping material {}: {}", record.getName(), e.getMessage());
                diagnostics.error(DiagnosticKind.MAPPING, record.getName(), e.getMessage());
            }
        }
        int materialsMapped = mapped.size();

        // Step 4: placeholders for names the material lists use but the package lacks
        int placeholders = 0;
        for (String name : materialList.getAllMaterialNames()) {
            if (seen.contains(name)) {
                continue;
            }
            ShaderDecision decision = cache.get(name).orElseGet(() -> classifier.classifyByName(name));
            mapped.add(mapper.placeholder(name, decision));
            diagnostics.info(DiagnosticKind.UNRESOLVED_REFERENCE, name, "Not in package; writing a placeholder");
            placeholders++;
        }

        // Step 5: render
        Map<String, String> resources = new TreeMap<>();
        SortedSet<String> requiredTextures = new TreeSet<>();
        List<String> missingTextures = new ArrayList<>();
        Map<String, String> hints = materialList.getTextureHints();
        Set<String> usedNames = new HashSet<>();

        for (MappedMaterial material : mapped) {
            String fileName = outputName(material.getName(), usedNames, diagnostics) + RESOURCE_EXTENSION;
            resources.put(fileName, serializer.serialize(material, config.getShaderBase(), config.getTextureBase()));

            for (TextureBinding texture : material.getTextures().values()) {
                requiredTextures.add(texture.getReferenceName());
                if (texture.isMissing()) {
                    missingTextures.add(material.getName() + "/" + texture.getUniform());
                    String hint = hints.containsKey(material.getName()) ? " (listed texture " + hints.get(material.getName()) + ")" : "";
                    diagnostics.warn(DiagnosticKind.UNRESOLVED_REFERENCE, material.getName(),
                            "Texture " + texture.getSourceProperty() + " [" + texture.getIdentifier() + "] not in package" + hint);
                }
            }
        }

        log.info("Converted {} materials ({} placeholders), {} textures required, {} missing",
                resources.size(), placeholders, requiredTextures.size(), missingTextures.size());

        return ConversionResult.builder()
                .success(true)
                .resources(resources)
                .mappedMaterials(mapped)
                .requiredTextures(requiredTextures)
                .missingTextures(missingTextures)
                .prefabs(PrefabGrouper.group(materialList.getPrefabs()))
                .unmatchedMaterials(cacheResult.getUnmatched())
                .shaderCache(cache)
                .materialsFound(index.materialIdentifiers().size())
                .materialsParsed(records.size())
                .materialsMapped(materialsMapped)
                .placeholdersCreated(placeholders)
                .diagnostics(diagnostics)
                .build();
    }

    /**
     * Writes {@code materials/<name>.tres} and the mesh mapping under {@code outputDir}.
     */
    public void write(ConversionResult result, Path outputDir) throws IOException {
        Path materialsDir = outputDir.resolve(MATERIALS_DIR);
        for (Map.Entry<String, String> resource : result.getResources().entrySet()) {
            FileWriteUtil.safeWriteString(materialsDir.resolve(resource.getKey()), resource.getValue());
        }
        log.info("Wrote {} material resources to {}", result.getResources().size(), materialsDir);

        if (!result.getPrefabs().isEmpty()) {
            mappingWriter.write(result.getPrefabs(), outputDir.resolve(MeshMaterialMappingWriter.FILE_NAME));
        }
    }

    private MaterialListDocument readMaterialLists(List<Path> materialLists, ConversionDiagnostics diagnostics) {
        MaterialListDocument merged = new MaterialListDocument();
        for (Path file : materialLists) {
            try {
                MaterialListDocument doc = materialListParser.parse(file);
                doc.getWarnings().forEach(w -> diagnostics.warn(DiagnosticKind.MANIFEST_PARSE, file.toString(), w));
                doc.getNotes().forEach(n -> diagnostics.info(DiagnosticKind.MANIFEST_PARSE, file.toString(), n));
                merged.merge(doc);
            } catch (IOException e) {
                log.warn("Cannot read material list {}: {}", file, e.getMessage());
                diagnostics.warn(DiagnosticKind.MANIFEST_PARSE, file.toString(), "Cannot read: " + e.getMessage());
            }
        }
        log.info("Material lists: {} prefab entries", merged.getPrefabs().size());
        return merged;
    }

    private List<MaterialRecord> parseMaterials(AssetIndex index, ConversionDiagnostics diagnostics) {
        MaterialRecordParser parser = new MaterialRecordParser(config.getColorEpsilon(), index::pathname);
        List<MaterialRecord> records = new ArrayList<>();

        for (String identifier : index.materialIdentifiers()) {
            String path = index.pathname(identifier).orElse(identifier);
            try {
                MaterialRecord record = parser.parse(index.getContents().get(identifier), path);
                records.add(record);
                if (record.getShader().getIdentifier() != null && !record.getShader().isResolved()) {
                    diagnostics.info(DiagnosticKind.UNRESOLVED_REFERENCE, record.getName(),
                            "Unknown shader " + record.getShader().getIdentifier());
                }
            } catch (MaterialParseException e) {
                log.warn("Skipping {}: {}", path, e.getMessage());
                diagnostics.error(DiagnosticKind.MATERIAL_PARSE, path, e.getMessage());
            }
        }
        log.info("Parsed {} of {} materials", records.size(), index.materialIdentifiers().size());
        return records;
    }

    private void reportDecisions(ShaderCache cache, MaterialListDocument materialList, ConversionDiagnostics diagnostics) {
        Set<String> customShader = new LinkedHashSet<>(materialList.getCustomShaderMaterials());
        cache.asMap().forEach((name, decision) -> {
            if (decision.getBasis() != DecisionBasis.DEFAULT) {
                return;
            }
            String message = customShader.contains(name)
                    ? "Listed as using a custom shader but matched no family; using " + decision.getFamily()
                    : "No shader evidence; using " + decision.getFamily();
            diagnostics.info(DiagnosticKind.CLASSIFICATION_FALLBACK, name, message);
        });
    }

    private static String outputName(String materialName, Set<String> usedNames, ConversionDiagnostics diagnostics) {
        String base = FileNameUtil.sanitize(materialName);
        String unique = FileNameUtil.uniqueName(base, usedNames);
        if (!unique.equals(base)) {
            diagnostics.warn(DiagnosticKind.OUTPUT, materialName, "Output name taken; writing as " + unique);
        }
        return unique;
    }

    private static void release(AssetIndex index, ConversionDiagnostics diagnostics) {
        try {
            index.close();
        } catch (IOException e) {
            log.warn("Could not remove extracted files under {}: {}", index.getWorkDirectory(), e.getMessage());
            diagnostics.warn(DiagnosticKind.EXTRACTION, String.valueOf(index.getWorkDirectory()),
                    "Could not remove extracted files: " + e.getMessage());
        }
    }
}
