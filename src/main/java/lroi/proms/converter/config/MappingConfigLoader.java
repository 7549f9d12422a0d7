package lroi.proms.converter.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import lombok.extern.slf4j.Slf4j;
import lroi.proms.converter.exception.ConfigurationException;
import lroi.proms.converter.model.ConversionRule;
import lroi.proms.converter.model.FieldMapping;
import lroi.proms.converter.model.LookupSpec;
import lroi.proms.converter.model.MappingConfig;
import lroi.proms.converter.model.RowTypeDefinition;
import lroi.proms.converter.util.SchemaElementOrder;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads the declarative TOML mapping file and validates it into a {@link MappingConfig}.
 *
 * Everything that can be wrong with the file is reported here, before a run
 * starts. The one exception is a regular expression that does not compile:
 * it is logged and kept as an inert rule.
 */
@Slf4j
@Service
public class MappingConfigLoader {

    static final String DEFAULTS = "defaults";
    static final String LUT = "lut";
    static final String PROM = "PROM";

    static final String DETECTION_COLUMN = "detection_column";
    static final String LOOKUP = "lookup";

    // keys of the [defaults] table that belong to the command line front end
    private static final Set<String> ENTRY_POINT_DEFAULTS = Set.of(
            "log_file_template", "xlsx_log_file_template", "xml_file_template", "output_dir");

    private final TomlMapper tomlMapper;

    public MappingConfigLoader(TomlMapper tomlMapper) {
        this.tomlMapper = tomlMapper;
    }

    /**
     * @param mappingFile path to the TOML file
     * @return validated mapping configuration
     * @throws ConfigurationException if the file is missing, unreadable or invalid
     */
    public MappingConfig load(Path mappingFile) {
        if (mappingFile == null || !Files.isRegularFile(mappingFile)) {
            throw new ConfigurationException("Config file not found: " + mappingFile);
        }
        log.info("Loading mapping configuration: {}", mappingFile);
        String toml;
        try {
            toml = Files.readString(mappingFile);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read config file " + mappingFile + ": " + e.getMessage(), e);
        }
        return parse(toml);
    }

    public MappingConfig parse(String toml) {
        JsonNode root;
        try {
            root = tomlMapper.readTree(toml);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid TOML in mapping configuration: " + e.getOriginalMessage(), e);
        }
        return fromTree(root);
    }

    MappingConfig fromTree(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("Mapping configuration is empty");
        }

        MappingConfig.MappingConfigBuilder builder = MappingConfig.builder();
        readDefaults(root.path(DEFAULTS), builder);

        String lutJoinColumn = MappingConfig.DEFAULT_LUT_JOIN_COLUMN;
        JsonNode lut = root.path(LUT);
        if (!lut.isMissingNode()) {
            requireTable(lut, "[" + LUT + "]");
            if (lut.has("join_column")) {
                lutJoinColumn = requireText(lut.get("join_column"), "[lut].join_column");
            }
        }
        builder.lutJoinColumn(lutJoinColumn);

        JsonNode proms = root.path(PROM);
        if (proms.isMissingNode() || proms.isEmpty()) {
            throw new ConfigurationException("Mapping configuration defines no [PROM.<TYPE>] sections");
        }
        requireTable(proms, "[" + PROM + "]");

        Iterator<Map.Entry<String, JsonNode>> sections = proms.fields();
        int rowTypeCount = 0;
        while (sections.hasNext()) {
            Map.Entry<String, JsonNode> section = sections.next();
            builder.rowType(readRowType(section.getKey(), section.getValue(), lutJoinColumn));
            rowTypeCount++;
        }

        MappingConfig config = builder.build();
        log.info("Mapping configuration loaded: {} PROM types, hospital={}, LUT join column '{}'",
                rowTypeCount, config.getHospital(), config.getLutJoinColumn());
        return config;
    }

    private void readDefaults(JsonNode defaults, MappingConfig.MappingConfigBuilder builder) {
        if (defaults.isMissingNode()) {
            return;
        }
        requireTable(defaults, "[" + DEFAULTS + "]");

        Iterator<Map.Entry<String, JsonNode>> entries = defaults.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            String key = entry.getKey();
            JsonNode value = entry.getValue();
            if ("hospital".equals(key)) {
                builder.hospital(readHospital(value));
            } else if ("lut_column_prefix".equals(key)) {
                builder.lutColumnPrefix(requireText(value, "[defaults].lut_column_prefix"));
            } else if (!ENTRY_POINT_DEFAULTS.contains(key)) {
                log.warn("Unknown key in [defaults] ignored: {}", key);
            }
        }
    }

    private int readHospital(JsonNode value) {
        if (value.isIntegralNumber() && value.canConvertToInt()) {
            return value.intValue();
        }
        if (value.isTextual()) {
            try {
                return Integer.parseInt(value.textValue().trim());
            } catch (NumberFormatException e) {
                throw new ConfigurationException("[defaults].hospital must be an integer, got '" + value.textValue() + "'", e);
            }
        }
        throw new ConfigurationException("[defaults].hospital must be an integer, got " + value);
    }

    private RowTypeDefinition readRowType(String key, JsonNode section, String lutJoinColumn) {
        String where = "[PROM." + key + "]";
        if (!SchemaElementOrder.knownRowTypes().contains(key)) {
            throw new ConfigurationException("Unknown PROM type " + where
                    + "; supported types: " + SchemaElementOrder.knownRowTypes());
        }
        requireTable(section, where);

        JsonNode detection = section.get(DETECTION_COLUMN);
        if (detection == null) {
            throw new ConfigurationException(where + " is missing '" + DETECTION_COLUMN + "'");
        }
        String detectionColumn = requireText(detection, where + "." + DETECTION_COLUMN);

        LookupSpec lookup = null;
        if (section.has(LOOKUP)) {
            lookup = readLookup(section.get(LOOKUP), where + "." + LOOKUP, lutJoinColumn);
        }

        List<String> schemaOrder = SchemaElementOrder.forRowType(key).orElseThrow();
        List<FieldMapping> fields = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> entries = section.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            String name = entry.getKey();
            if (DETECTION_COLUMN.equals(name) || LOOKUP.equals(name)) {
                continue;
            }
            fields.add(readField(name, entry.getValue(), where + "." + name));
            if (!schemaOrder.contains(name)) {
                log.warn("{}.{} is not an element of the {} schema and will never be written", where, name, key);
            }
        }

        return new RowTypeDefinition(key, detectionColumn, fields, lookup);
    }

    private LookupSpec readLookup(JsonNode node, String where, String lutJoinColumn) {
        requireTable(node, where);

        boolean required = false;
        String joinColumn = null;
        List<String> addColumns = new ArrayList<>();
        Map<String, String> legacy = new LinkedHashMap<>();

        Iterator<Map.Entry<String, JsonNode>> entries = node.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            String key = entry.getKey();
            JsonNode value = entry.getValue();
            switch (key) {
                case "required":
                    if (!value.isBoolean()) {
                        throw new ConfigurationException(where + ".required must be true or false");
                    }
                    required = value.booleanValue();
                    break;
                case "join_column":
                    joinColumn = requireText(value, where + ".join_column");
                    break;
                case "add_columns":
                    if (!value.isArray()) {
                        throw new ConfigurationException(where + ".add_columns must be a list of column names");
                    }
                    for (JsonNode column : value) {
                        addColumns.add(requireText(column, where + ".add_columns"));
                    }
                    break;
                default:
                    legacy.put(key, requireText(value, where + "." + key));
            }
        }

        if (!addColumns.isEmpty() && !legacy.isEmpty()) {
            log.warn("{} has both add_columns and element mappings; using add_columns, ignoring {}",
                    where, legacy.keySet());
        }
        if (required && joinColumn == null) {
            log.info("{} has no join_column, using [lut].join_column '{}'", where, lutJoinColumn);
            joinColumn = lutJoinColumn;
        }
        return new LookupSpec(required, joinColumn, addColumns, legacy);
    }

    private FieldMapping readField(String name, JsonNode node, String where) {
        if (!node.isObject()) {
            throw new ConfigurationException(where + " must be a table with a 'column' entry");
        }
        JsonNode column = node.get("column");
        if (column == null) {
            throw new ConfigurationException(where + " is missing 'column'");
        }
        String sourceColumn = requireText(column, where + ".column");

        List<ConversionRule> rules = new ArrayList<>();
        JsonNode values = node.get("value");
        if (values != null) {
            if (!values.isArray()) {
                throw new ConfigurationException(where + ".value must be a list of {match, replace, flags} tables");
            }
            int index = 0;
            for (JsonNode ruleNode : values) {
                rules.add(readRule(ruleNode, where + ".value[" + index + "]"));
                index++;
            }
        }
        return new FieldMapping(name, sourceColumn, rules);
    }

    private ConversionRule readRule(JsonNode node, String where) {
        if (!node.isObject()) {
            throw new ConfigurationException(where + " must be a {match, replace, flags} table");
        }
        JsonNode match = node.get("match");
        if (match == null) {
            throw new ConfigurationException(where + " is missing 'match'");
        }
        String pattern = requireText(match, where + ".match");
        String replace = node.has("replace") ? scalarText(node.get("replace"), where + ".replace") : null;
        String flags = node.has("flags") ? scalarText(node.get("flags"), where + ".flags") : null;

        ConversionRule rule = ConversionRule.of(pattern, replace, flags);
        rule.patternError().ifPresent(error ->
                log.warn("{}: invalid regex '{}' ({}); the rule will be ignored", where, pattern, error));
        return rule;
    }

    private static void requireTable(JsonNode node, String where) {
        if (!node.isObject()) {
            throw new ConfigurationException(where + " must be a table");
        }
    }

    private static String requireText(JsonNode node, String where) {
        String text = scalarText(node, where);
        if (text.trim().isEmpty()) {
            throw new ConfigurationException(where + " must not be empty");
        }
        return text;
    }

    // replace and flags may be empty; numbers are accepted as their text
    private static String scalarText(JsonNode node, String where) {
        if (node == null || !node.isValueNode() || node.isNull()) {
            throw new ConfigurationException(where + " must be a string");
        }
        return node.asText();
    }
}
