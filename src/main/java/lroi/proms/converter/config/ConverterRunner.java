package lroi.proms.converter.config;

import lombok.extern.slf4j.Slf4j;
import lroi.proms.converter.dto.ConversionResultDto;
import lroi.proms.converter.exception.ConfigurationException;
import lroi.proms.converter.model.MappingConfig;
import lroi.proms.converter.service.PromsConversionService;
import lroi.proms.converter.util.InputPathUtil;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs one conversion with the converter.* properties at application startup.
 *
 * Exit codes:
 * - 0 at least one questionnaire converted
 * - 1 configuration error, an input folder could not be listed, or the
 *     document could not be written
 * - 2 nothing converted
 */
@Slf4j
@Component
public class ConverterRunner implements ApplicationRunner, ExitCodeGenerator {

    public static final int EXIT_OK = 0;
    public static final int EXIT_CONFIGURATION_ERROR = 1;
    public static final int EXIT_NOTHING_CONVERTED = 2;

    private final ConverterProperties properties;
    private final MappingConfigLoader mappingConfigLoader;
    private final PromsConversionService conversionService;

    private int exitCode = EXIT_OK;

    public ConverterRunner(ConverterProperties properties,
                           MappingConfigLoader mappingConfigLoader,
                           PromsConversionService conversionService) {
        this.properties = properties;
        this.mappingConfigLoader = mappingConfigLoader;
        this.conversionService = conversionService;
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute();
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute() {
        if (properties.getMappingFile() == null || properties.getMappingFile().trim().isEmpty()) {
            log.error("No mapping file configured; set converter.mapping-file");
            return EXIT_CONFIGURATION_ERROR;
        }

        try {
            List<Path> inputs = InputPathUtil.expandInputs(properties.getInputs());
            if (inputs.isEmpty()) {
                log.warn("No input files to convert; set converter.inputs to files or folders");
                return EXIT_NOTHING_CONVERTED;
            }

            MappingConfig config = mappingConfigLoader.load(Path.of(properties.getMappingFile().trim()));
            if (properties.getHospital() != null) {
                log.info("Hospital overridden from properties: {}", properties.getHospital());
                config = config.toBuilder().hospital(properties.getHospital()).build();
            }

            Path lutFile = properties.hasLutFile() ? Path.of(properties.getLutFile().trim()) : null;
            Path outputFile = properties.hasOutputFile() ? Path.of(properties.getOutputFile().trim()) : null;

            ConversionResultDto result = conversionService.convert(inputs, config, lutFile, outputFile);
            log.info("Run {} finished in {} ms: {} converted, {} skipped",
                    result.getRunId(), result.getProcessingDurationMs(), result.getConverted(), result.getSkipped());
            return result.isSuccessful() ? EXIT_OK : EXIT_NOTHING_CONVERTED;

        } catch (ConfigurationException e) {
            log.error("Configuration error: {}", e.getMessage(), e);
            return EXIT_CONFIGURATION_ERROR;
        } catch (IOException e) {
            log.error("Failed to write output: {}", e.getMessage(), e);
            return EXIT_CONFIGURATION_ERROR;
        } catch (UncheckedIOException e) {
            log.error("Cannot read inputs: {}", e.getMessage(), e);
            return EXIT_CONFIGURATION_ERROR;
        }
    }
}
