package deckhand.engine.descriptor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import deckhand.engine.model.BatchParams;
import deckhand.engine.model.PipelineDescriptor;
import deckhand.engine.model.ServiceParams;
import deckhand.engine.model.StageConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reads {@code deckhand.yaml} into a {@link PipelineDescriptor}.
 *
 * <p>
 * Every missing or mis-specified parameter is collected before failing, so a
 * single {@link DescriptorException} reports all of them. Cross-references
 * (DAG, on-failure stage) are checked by {@link DescriptorValidator}.
 */
public final class DescriptorLoader {

    private static final Logger log = LoggerFactory.getLogger(DescriptorLoader.class);

    public static final String DESCRIPTOR_FILENAME = "deckhand.yaml";

    static final Set<String> LOG_LEVELS = Set.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR");
    private static final Pattern ENV_VAR_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final ObjectMapper yaml = new ObjectMapper(new YAMLFactory());

    /**
     * Load the descriptor from the root of a code bundle.
     */
    public PipelineDescriptor loadFromBundle(Path bundleRoot) {
        return load(bundleRoot.resolve(DESCRIPTOR_FILENAME));
    }

    /**
     * Load and validate a descriptor file.
     *
     * @throws DescriptorException if the file is missing, malformed or invalid
     */
    public PipelineDescriptor load(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new DescriptorException(DescriptorException.Reason.NOT_FOUND,
                    "no descriptor found at " + file);
        }
        try {
            log.debug("Loading descriptor from {}", file);
            return parse(Files.readString(file));
        } catch (IOException e) {
            throw new DescriptorException(DescriptorException.Reason.NOT_FOUND,
                    "Failed to read descriptor " + file, e);
        }
    }

    /**
     * Parse descriptor text.
     *
     * @throws DescriptorException if the text is malformed or invalid
     */
    public PipelineDescriptor parse(String text) {
        JsonNode root;
        try {
            root = yaml.readTree(text);
        } catch (JsonProcessingException e) {
            throw new DescriptorException(DescriptorException.Reason.MALFORMED,
                    "descriptor is not valid YAML: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new DescriptorException(DescriptorException.Reason.MALFORMED,
                    "descriptor must be a YAML mapping");
        }

        List<String> problems = new ArrayList<>();
        PipelineDescriptor.Builder builder = PipelineDescriptor.builder();

        builder.version(requiredText(root, "version", "version", problems));

        JsonNode project = root.get("project");
        if (project == null || !project.isObject()) {
            problems.add("project section is missing");
        } else {
            builder.name(requiredText(project, "name", "project.name", problems));
            builder.containerImage(requiredText(project, "docker_image", "project.docker_image", problems));
            builder.dagExpression(requiredText(project, "DAG", "project.DAG", problems));
            builder.secretsGroup(optionalText(project, "secrets_group"));
            builder.runOnFailure(optionalText(project, "run_on_failure"));
        }

        JsonNode logging = root.get("logging");
        String logLevel = logging != null ? optionalText(logging, "log_level") : null;
        if (logLevel != null) {
            String normalized = normalizeLogLevel(logLevel);
            if (normalized == null) {
                problems.add("logging.log_level must be one of " + LOG_LEVELS);
            } else {
                builder.logLevel(normalized);
            }
        }

        JsonNode stages = root.get("stages");
        if (stages == null || !stages.isObject() || stages.isEmpty()) {
            problems.add("stages section is missing or empty");
        } else {
            Iterator<Map.Entry<String, JsonNode>> fields = stages.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                StageConfig stage = parseStage(entry.getKey(), entry.getValue(), problems);
                if (stage != null) {
                    builder.stage(stage);
                }
            }
        }

        if (!problems.isEmpty()) {
            throw new DescriptorException(DescriptorException.Reason.INVALID,
                    "descriptor has missing or invalid parameters", problems);
        }
        return builder.build();
    }

    /** Map a log level name onto an SLF4J level name, or null if unknown. */
    static String normalizeLogLevel(String level) {
        String upper = level.trim().toUpperCase();
        if (upper.equals("WARNING")) {
            return "WARN";
        }
        if (upper.equals("CRITICAL")) {
            return "ERROR";
        }
        return LOG_LEVELS.contains(upper) ? upper : null;
    }

    private StageConfig parseStage(String name, JsonNode node, List<String> problems) {
        String prefix = "stages." + name;
        if (node == null || !node.isObject()) {
            problems.add(prefix + " must be a mapping");
            return null;
        }
        int before = problems.size();

        StageConfig.Builder builder = StageConfig.builder()
                .name(name)
                .entryPoint(requiredText(node, "executable_module_path", prefix + ".executable_module_path", problems))
                .args(textList(node.get("args"), prefix + ".args", problems))
                .requirements(textList(node.get("requirements"), prefix + ".requirements", problems));

        JsonNode cpu = node.get("cpu_request");
        if (cpu != null && !cpu.isNull()) {
            if (!cpu.isNumber() || cpu.asDouble() <= 0) {
                problems.add(prefix + ".cpu_request must be a positive number");
            } else {
                builder.cpuRequest(cpu.asDouble());
            }
        }

        JsonNode memory = node.get("memory_request_mb");
        if (memory != null && !memory.isNull()) {
            if (!memory.canConvertToInt() || !memory.isIntegralNumber() || memory.asInt() <= 0) {
                problems.add(prefix + ".memory_request_mb must be a positive integer");
            } else {
                builder.memoryRequestMB(memory.asInt());
            }
        }

        JsonNode secrets = node.get("secrets");
        if (secrets != null && !secrets.isNull()) {
            if (!secrets.isObject()) {
                problems.add(prefix + ".secrets must be a mapping of ENV_VAR: secret-name");
            } else {
                Map<String, String> bindings = new LinkedHashMap<>();
                secrets.fields().forEachRemaining(e -> {
                    if (!ENV_VAR_NAME.matcher(e.getKey()).matches()) {
                        problems.add(prefix + ".secrets." + e.getKey() + " is not a valid environment variable name");
                    } else if (!e.getValue().isTextual() || e.getValue().asText().isBlank()) {
                        problems.add(prefix + ".secrets." + e.getKey() + " must name a secret");
                    } else {
                        bindings.put(e.getKey(), e.getValue().asText().trim());
                    }
                });
                builder.secrets(bindings);
            }
        }

        JsonNode batch = node.get("batch");
        JsonNode service = node.get("service");
        if (batch != null && service != null) {
            problems.add(prefix + " cannot declare both batch and service");
        } else if (batch == null && service == null) {
            problems.add(prefix + " must declare either batch or service");
        } else if (batch != null) {
            builder.batch(parseBatch(batch, prefix + ".batch", problems));
        } else {
            builder.service(parseService(service, prefix + ".service", problems));
        }

        return problems.size() == before ? builder.build() : null;
    }

    private BatchParams parseBatch(JsonNode node, String prefix, List<String> problems) {
        if (!node.isObject()) {
            problems.add(prefix + " must be a mapping");
            return null;
        }
        int completion = requiredInt(node, "max_completion_time_seconds", prefix, 1, problems);
        int retries = requiredInt(node, "retries", prefix, 0, problems);
        return new BatchParams(completion, retries);
    }

    private ServiceParams parseService(JsonNode node, String prefix, List<String> problems) {
        if (!node.isObject()) {
            problems.add(prefix + " must be a mapping");
            return null;
        }
        int startup = requiredInt(node, "max_startup_time_seconds", prefix, 1, problems);
        int replicas = requiredInt(node, "replicas", prefix, 1, problems);
        int port = requiredInt(node, "port", prefix, 1, problems);
        if (port > 65535) {
            problems.add(prefix + ".port must be between 1 and 65535");
        }
        JsonNode ingress = node.get("ingress");
        boolean expose = false;
        if (ingress != null && !ingress.isNull()) {
            if (!ingress.isBoolean()) {
                problems.add(prefix + ".ingress must be true or false");
            } else {
                expose = ingress.asBoolean();
            }
        }
        return new ServiceParams(startup, replicas, port, expose);
    }

    // ===== helpers =====

    private static String requiredText(JsonNode node, String field, String path, List<String> problems) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode() || value.asText().isBlank()) {
            problems.add(path + " is missing");
            return null;
        }
        return value.asText().trim();
    }

    private static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            return null;
        }
        return value.asText().trim();
    }

    private static int requiredInt(JsonNode node, String field, String prefix, int min, List<String> problems) {
        JsonNode value = node.get(field);
        if (value == null || !value.isIntegralNumber() || !value.canConvertToInt()) {
            problems.add(prefix + "." + field + " is missing or not an integer");
            return min;
        }
        if (value.asInt() < min) {
            problems.add(prefix + "." + field + " must be >= " + min);
            return min;
        }
        return value.asInt();
    }

    private static List<String> textList(JsonNode node, String path, List<String> problems) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            problems.add(path + " must be a list");
            return List.of();
        }
        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            if (!item.isValueNode()) {
                problems.add(path + " may only contain scalar values");
                return List.of();
            }
            values.add(item.asText());
        }
        return values;
    }
}
