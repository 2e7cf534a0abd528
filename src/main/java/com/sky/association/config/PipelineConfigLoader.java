package com.sky.association.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.sky.association.api.PipelineOptions;
import com.sky.association.extraction.ExtractionParameters;
import com.sky.association.qa.QualityThresholds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads a YAML run configuration.
 *
 * <pre>
 * stages:
 *   source finding: yes
 *   source association: yes
 *   catalog matching: yes
 * options:
 *   save to database: yes
 *   quality checks: yes
 *   overwrite: no
 *   reprocess: no
 *   redo match: no
 *   update match: no
 * setup:
 *   root directory: /data/
 *   files: [[image1.fits, image2.fits]]
 *   catalogs: [nvss, first]
 * extraction_params:
 *   mode: default
 *   scale: 0.5
 *   thresh: hard
 * image_qa_params:
 *   min nvis:
 *   max sensitivity metric: 2500
 * </pre>
 *
 * Blank values fall back to the defaults. {@code pybdsf_params} is accepted as an alias
 * of {@code extraction_params}.
 */
public class PipelineConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(PipelineConfigLoader.class);

    private static final Set<String> TRUE_WORDS = Set.of("yes", "y", "true", "on");
    private static final Set<String> FALSE_WORDS = Set.of("no", "n", "false", "off");

    private final ObjectMapper mapper;

    public PipelineConfigLoader() {
        this.mapper = new ObjectMapper(new YAMLFactory());
    }

    public PipelineConfig load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path)) {
            PipelineConfig config = load(reader);
            log.info("Loaded run configuration from {}", path);
            return config;
        }
    }

    public PipelineConfig load(InputStream input) throws IOException {
        return parse(mapper.readTree(input));
    }

    public PipelineConfig load(Reader reader) throws IOException {
        return parse(mapper.readTree(reader));
    }

    private PipelineConfig parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Run configuration must be a YAML mapping");
        }
        JsonNode stages = root.path("stages");
        JsonNode opts = root.path("options");
        JsonNode setup = root.path("setup");

        PipelineOptions.Builder options = PipelineOptions.builder()
                .sourceFinding(flag(stages, "source finding", true))
                .sourceAssociation(flag(stages, "source association", true))
                .catalogMatching(flag(stages, "catalog matching", true))
                .saveToDatabase(flag(opts, "save to database", true))
                .qualityChecks(flag(opts, "quality checks", true))
                .overwrite(flag(opts, "overwrite", false))
                .reprocess(flag(opts, "reprocess", false))
                .redoMatch(flag(opts, "redo match", false))
                .updateMatch(flag(opts, "update match", false))
                .catalogs(strings(setup.path("catalogs")))
                .extractionParameters(extraction(root.has("extraction_params")
                        ? root.path("extraction_params") : root.path("pybdsf_params")));

        QualityThresholds defaults = QualityThresholds.defaults();
        JsonNode qa = root.path("image_qa_params");
        QualityThresholds thresholds = new QualityThresholds(
                (int) number(qa, "min nvis", defaults.minNvis()),
                number(qa, "max sensitivity metric", defaults.maxSensitivityMetric()),
                number(qa, "max beam axis ratio", defaults.maxBeamAxisRatio()),
                number(qa, "max source count metric", defaults.maxSourceCountMetric()));

        String rootDirectory = text(setup, "root directory");
        return new PipelineConfig(options.build(), thresholds, rootDirectory, strings(setup.path("files")));
    }

    private ExtractionParameters extraction(JsonNode node) {
        ExtractionParameters defaults = ExtractionParameters.defaults();
        if (!node.isObject()) {
            return defaults;
        }
        String mode = text(node, "mode");
        double scale = number(node, "scale", defaults.scale());
        Map<String, Object> extra = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            if (key.equals("mode") || key.equals("scale") || isBlank(field.getValue())) {
                continue;
            }
            extra.put(key, mapper.convertValue(field.getValue(), Object.class));
        }
        return new ExtractionParameters(mode != null ? mode : defaults.mode(), scale, extra);
    }

    private static boolean flag(JsonNode section, String key, boolean defaultValue) {
        JsonNode node = section.path(key);
        if (isBlank(node)) {
            return defaultValue;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        String word = node.asText().trim().toLowerCase(Locale.ROOT);
        if (TRUE_WORDS.contains(word)) {
            return true;
        }
        if (FALSE_WORDS.contains(word)) {
            return false;
        }
        throw new IllegalArgumentException("'" + key + "' must be yes/no or true/false, got: " + node.asText());
    }

    private static double number(JsonNode section, String key, double defaultValue) {
        JsonNode node = section.path(key);
        if (isBlank(node)) {
            return defaultValue;
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        try {
            return Double.parseDouble(node.asText().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("'" + key + "' must be a number, got: " + node.asText(), e);
        }
    }

    private static String text(JsonNode section, String key) {
        JsonNode node = section.path(key);
        return isBlank(node) ? null : node.asText().trim();
    }

    /**
     * Flattens a scalar, a list or a list of lists into strings.
     */
    private static List<String> strings(JsonNode node) {
        List<String> values = new ArrayList<>();
        collect(node, values);
        return values;
    }

    private static void collect(JsonNode node, List<String> values) {
        if (isBlank(node)) {
            return;
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                collect(item, values);
            }
        } else {
            values.add(node.asText().trim());
        }
    }

    private static boolean isBlank(JsonNode node) {
        return node == null || node.isMissingNode() || node.isNull()
                || (node.isTextual() && node.asText().isBlank());
    }
}
