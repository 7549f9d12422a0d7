package lroi.proms.converter.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings of one converter run.
 *
 * Maps directly to properties in application.properties, or to
 * --converter.* command line arguments:
 * - converter.mapping-file
 * - converter.inputs
 * - converter.lut-file
 * - converter.output-file
 * - converter.hospital
 */
@Configuration
@ConfigurationProperties(prefix = "converter")
@Data
public class ConverterProperties {

    /** TOML mapping configuration (converter.mapping-file) */
    private String mappingFile;

    /** Questionnaire exports: files and/or folders (converter.inputs) */
    private List<String> inputs = new ArrayList<>();

    /** Optional lookup table with demographics (converter.lut-file) */
    private String lutFile;

    /** Where to write the XML; nothing is written when empty (converter.output-file) */
    private String outputFile;

    /** Overrides [defaults].hospital of the mapping file when set (converter.hospital) */
    private Integer hospital;

    public boolean hasLutFile() {
        return lutFile != null && !lutFile.trim().isEmpty();
    }

    public boolean hasOutputFile() {
        return outputFile != null && !outputFile.trim().isEmpty();
    }
}
