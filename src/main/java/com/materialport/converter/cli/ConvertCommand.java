package com.materialport.converter.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.materialport.converter.cli.exception.OptionsValidationException;
import com.materialport.converter.cli.model.ConvertOptions;
import com.materialport.converter.cli.model.ValidatedConvertOptions;
import com.materialport.converter.cli.output.ConvertResultsPrinter;
import com.materialport.converter.cli.validation.ConvertOptionsValidator;
import com.materialport.converter.pipeline.ConversionPipeline;
import com.materialport.converter.pipeline.ConversionResult;
import com.materialport.converter.pipeline.ConverterConfig;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command converting a Unity package's materials into shader material resources.
 */
@Command(
        name = "convert",
        mixinStandardHelpOptions = true,
        version = "material-port 1.0.0",
        description = "Converts the materials of a .unitypackage into ShaderMaterial (.tres) resources."
)
public class ConvertCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ConvertCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_INVALID_OPTIONS = 2;

    @Mixin
    private ConvertOptions options;

    private final ConvertOptionsValidator validator = new ConvertOptionsValidator();
    private final ConvertResultsPrinter printer = new ConvertResultsPrinter();

    @Override
    public Integer call() {
        try {
            ValidatedConvertOptions validated = validator.validate(options);
            printer.printBanner(options, validated);

            ConverterConfig config = ConverterConfig.builder()
                    .shaderBase(options.getShaderBase())
                    .textureBase(options.getTextureBase())
                    .maxContentBytes(options.getMaxContentBytes())
                    .build();

            ConversionPipeline pipeline = new ConversionPipeline(config);
            ConversionResult result = pipeline.convert(options.getPackageFile(), validated.getMaterialLists());

            if (!result.isSuccess()) {
                printer.printFailure(result);
                return EXIT_FAILED;
            }

            if (!options.isDryRun()) {
                pipeline.write(result, validated.getNormalizedOutputDir());
            }

            printer.printSuccess(options, validated, result);
            return EXIT_OK;

        } catch (OptionsValidationException e) {
            printer.printValidationErrors(e);
            return EXIT_INVALID_OPTIONS;
        } catch (Exception e) {
            log.error("Conversion failed with exception", e);
            return EXIT_FAILED;
        }
    }
}
