package com.materialport.converter.cli.output;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.materialport.converter.cli.exception.OptionsValidationException;
import com.materialport.converter.cli.model.ConvertOptions;
import com.materialport.converter.cli.model.ValidatedConvertOptions;
import com.materialport.converter.diagnostics.ConversionDiagnostics;
import com.materialport.converter.diagnostics.Diagnostic;
import com.materialport.converter.pipeline.ConversionPipeline;
import com.materialport.converter.pipeline.ConversionResult;

/**
 * Responsible only for printing CLI output for the "convert" command.
 * No validation, no execution.
 */
public class ConvertResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(ConvertResultsPrinter.class);

    static final int MAX_LISTED = 20;

    public void printBanner(ConvertOptions o, ValidatedConvertOptions v) {
        log.info("=================================================");
        log.info("Unity Material Converter");
        log.info("=================================================");
        log.info("Package: {}", o.getPackageFile().toAbsolutePath());
        if (v.getMaterialLists().isEmpty()) {
            log.info("Material Lists: None");
        } else {
            log.info("Material Lists{}:", v.isMaterialListsDiscovered() ? " (found beside package)" : "");
            v.getMaterialLists().forEach(p -> log.info("  {}", p.toAbsolutePath()));
        }
        log.info("Shader Base: {}", o.getShaderBase());
        log.info("Texture Base: {}", o.getTextureBase());
        log.info("Output Directory: {}", v.getNormalizedOutputDir());
        if (o.isDryRun()) {
            log.info("Dry run: nothing will be written");
        }
        log.info("=================================================");
    }

    public void printSuccess(ConvertOptions o, ValidatedConvertOptions v, ConversionResult result) {
        log.info("");
        log.info("=================================================");
        log.info(o.isDryRun() ? "DRY RUN COMPLETE" : "CONVERSION SUCCESSFUL");
        log.info("=================================================");
        if (!o.isDryRun()) {
            log.info("Materials Written To: {}", v.getNormalizedOutputDir().resolve(ConversionPipeline.MATERIALS_DIR));
        }
        log.info("Materials Found: {}", result.getMaterialsFound());
        log.info("Materials Parsed: {}", result.getMaterialsParsed());
        log.info("Materials Converted: {}", result.getMaterialsMapped());
        log.info("Placeholders Created: {}", result.getPlaceholdersCreated());
        log.info("Prefabs Mapped: {}", result.getPrefabs().size());
        log.info("Textures Required: {}", result.getRequiredTextures().size());
        log.info("Textures Missing: {}", result.getMissingTextures().size());
        log.info("Classified Outside Prefabs: {}", result.getUnmatchedMaterials().size());

        printDiagnostics(result.getDiagnostics());
        log.info("=================================================");
    }

    public void printFailure(ConversionResult result) {
        log.error("Conversion failed: {}", result.getErrorMessage());
    }

    public void printValidationErrors(OptionsValidationException e) {
        log.error("Invalid options ({}):", e.getErrorCount());
        e.getErrors().forEach(error -> log.error("  {}", error));
    }

    private void printDiagnostics(ConversionDiagnostics diagnostics) {
        if (diagnostics.getErrors().isEmpty() && diagnostics.getWarnings().isEmpty()) {
            return;
        }
        log.info("");
        log.info("Diagnostics: {} errors, {} warnings, {} notes",
                diagnostics.getErrors().size(), diagnostics.getWarnings().size(), diagnostics.getInfos().size());
        printLimited(diagnostics.getErrors(), true);
        printLimited(diagnostics.getWarnings(), false);
    }

    private void printLimited(List<Diagnostic> entries, boolean errors) {
        entries.stream().limit(MAX_LISTED).forEach(d -> {
            if (errors) {
                log.error("  {}", d);
            } else {
                log.warn("  {}", d);
            }
        });
        if (entries.size() > MAX_LISTED) {
            log.info("  ... and {} more", entries.size() - MAX_LISTED);
        }
    }
}
