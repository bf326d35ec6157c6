package io.macroexpand.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Function;
import java.util.function.IntConsumer;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Loads {@link ExpansionConfig} from the {@code expansion} section of a YAML file, with an
 * environment variable overlay.
 *
 * <pre>
 * expansion:
 *   max-feedback-iterations: 16
 *   parallelism: 4
 *   builtin-attributes: [available, objc]
 * </pre>
 *
 * <p>
 * Missing keys keep the defaults from {@link ExpansionConfig.Builder}. Environment variables take
 * precedence over YAML values. An environment variable counts as set only if it is defined and its
 * trimmed value is non-empty.
 */
public final class ExpansionConfigLoader {

    public static final String ENV_MAX_FEEDBACK_ITERATIONS = "MACROEXPAND_MAX_FEEDBACK_ITERATIONS";
    public static final String ENV_PARALLELISM = "MACROEXPAND_PARALLELISM";
    public static final String ENV_BUILTIN_ATTRIBUTES = "MACROEXPAND_BUILTIN_ATTRIBUTES";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ExpansionConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from {@code configPath}, overlaying {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML or holds invalid values
     */
    public static ExpansionConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration from {@code configPath}, overlaying variables from {@code envLookup}.
     * A lookup returning {@code null} means the variable is not defined.
     */
    public static ExpansionConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToConfig(root, envLookup, configPath.toString());
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid configuration in " + configPath + ": " + e.getMessage(), e);
        }
    }

    /** Defaults plus the environment overlay, for drivers without a configuration file. */
    public static ExpansionConfig fromEnvironment(Function<String, String> envLookup) {
        try {
            return mapToConfig(null, envLookup, "environment");
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid configuration in environment: " + e.getMessage(), e);
        }
    }

    private static ExpansionConfig mapToConfig(JsonNode root, Function<String, String> envLookup, String source) {
        ExpansionConfig.Builder builder = ExpansionConfig.builder();

        JsonNode expansion = root != null ? root.path("expansion") : null;
        if (expansion != null && !expansion.isMissingNode() && !expansion.isNull()) {
            if (!expansion.isObject()) {
                throw new ConfigLoadException("'expansion' must be a mapping in " + source);
            }
            if (expansion.has("max-feedback-iterations")) {
                builder.maxFeedbackIterations(requireInt(expansion, "max-feedback-iterations", source));
            }
            if (expansion.has("parallelism")) {
                builder.parallelism(requireInt(expansion, "parallelism", source));
            }
            if (expansion.has("builtin-attributes")) {
                builder.builtinAttributes(readNames(expansion.get("builtin-attributes"), source));
            }
        }

        envInt(envLookup, ENV_MAX_FEEDBACK_ITERATIONS, builder::maxFeedbackIterations);
        envInt(envLookup, ENV_PARALLELISM, builder::parallelism);
        if (isSet(envLookup, ENV_BUILTIN_ATTRIBUTES)) {
            builder.builtinAttributes(Arrays.stream(envLookup.apply(ENV_BUILTIN_ATTRIBUTES).split(","))
                    .map(String::trim)
                    .filter(name -> !name.isEmpty())
                    .collect(Collectors.toCollection(LinkedHashSet::new)));
        }

        return builder.build();
    }

    // --- YAML helpers ---

    private static int requireInt(JsonNode node, String field, String source) {
        JsonNode value = node.get(field);
        if (!value.canConvertToInt() || !value.isIntegralNumber()) {
            throw new ConfigLoadException("'expansion." + field + "' must be an integer in " + source);
        }
        return value.asInt();
    }

    private static Set<String> readNames(JsonNode node, String source) {
        if (!node.isArray()) {
            throw new ConfigLoadException("'expansion.builtin-attributes' must be a list in " + source);
        }
        return StreamSupport.stream(node.spliterator(), false)
                .map(JsonNode::asText)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    // --- Env var helpers ---

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String raw = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(raw));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer, got '" + raw + "'", e);
            }
        }
    }
}
