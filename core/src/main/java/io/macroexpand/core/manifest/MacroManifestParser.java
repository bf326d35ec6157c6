package io.macroexpand.core.manifest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.macroexpand.core.error.ManifestParseException;
import io.macroexpand.core.model.InputDependency;
import io.macroexpand.core.model.MacroDefinition;
import io.macroexpand.core.model.NamePattern;
import io.macroexpand.core.model.NamePolicy;
import io.macroexpand.core.model.RoleKind;
import io.macroexpand.core.model.RoleSpec;
import io.macroexpand.core.spi.ExpansionFunction;
import io.macroexpand.core.spi.MacroImplementation;
import io.macroexpand.core.syntax.Position;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Parses YAML macro manifests into {@link MacroDefinition}s, binding each entry to a registered
 * {@link MacroImplementation}.
 *
 * <pre>
 * macros:
 *   - name: AddCompletionHandler
 *     implementation: add-completion-handler
 *     roles:
 *       - kind: peer
 *         names: [overloaded]
 *         positions: [async-function]
 * </pre>
 *
 * <p>
 * The document is first validated against the bundled JSON Schema
 * ({@code schemas/macro-manifest.schema.json}); structural errors are reported all at once.
 * Semantic errors (unknown implementation, malformed name pattern, roles without a matching
 * function) are reported for the first offending macro.
 *
 * <p>
 * Thread-safe if the implementation registry is (it is).
 */
public final class MacroManifestParser {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
    private static final String SCHEMA_RESOURCE = "/schemas/macro-manifest.schema.json";
    private static final JsonSchema MANIFEST_SCHEMA = loadSchema();

    private final MacroImplementationRegistry implementations;

    public MacroManifestParser(MacroImplementationRegistry implementations) {
        this.implementations = Objects.requireNonNull(implementations, "implementations must not be null");
    }

    public MacroImplementationRegistry implementations() {
        return implementations;
    }

    /**
     * Parses the manifest at {@code path}.
     *
     * @throws ManifestParseException if the file cannot be read, fails schema validation or refers
     *                                to unknown implementations
     */
    public List<MacroDefinition> parse(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String source = path.toString();
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(path.toFile());
        } catch (IOException e) {
            throw new ManifestParseException("Failed to read or parse YAML: " + e.getMessage(), e, null, source);
        }
        return parse(root, source);
    }

    /** Parses manifest text; {@code source} names it in error messages. */
    public List<MacroDefinition> parse(String yaml, String source) {
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(yaml);
        } catch (IOException e) {
            throw new ManifestParseException("Failed to parse YAML: " + e.getMessage(), e, null, source);
        }
        return parse(root, source);
    }

    private List<MacroDefinition> parse(JsonNode root, String source) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new ManifestParseException("Manifest is empty", null, source);
        }
        Set<ValidationMessage> violations = MANIFEST_SCHEMA.validate(root);
        if (!violations.isEmpty()) {
            String detail = violations.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new ManifestParseException("Manifest does not match schema: " + detail, null, source);
        }

        List<MacroDefinition> definitions = new ArrayList<>();
        for (JsonNode macro : root.get("macros")) {
            definitions.add(parseMacro(macro, source));
        }
        return definitions;
    }

    private MacroDefinition parseMacro(JsonNode macro, String source) {
        String name = macro.get("name").asText();
        String implementationId = macro.get("implementation").asText();
        MacroImplementation implementation = implementations
                .getImplementation(implementationId)
                .orElseThrow(() -> new ManifestParseException(
                        "Unknown macro implementation '" + implementationId + "'", name, source));

        MacroDefinition.Builder builder = MacroDefinition.builder(name);
        if (macro.hasNonNull("module")) {
            builder.module(macro.get("module").asText());
        }
        if (macro.has("generic-parameters")) {
            List<String> parameters = new ArrayList<>();
            macro.get("generic-parameters").forEach(p -> parameters.add(p.asText()));
            builder.genericParameters(parameters.toArray(String[]::new));
        }

        List<ExpansionFunction> functions = implementation.functions();
        Set<RoleKind> declared = EnumSet.noneOf(RoleKind.class);
        for (JsonNode roleNode : macro.get("roles")) {
            RoleSpec role = parseRole(roleNode, name, source);
            declared.add(role.kind());
            ExpansionFunction function = functions.stream()
                    .filter(f -> f.kind() == role.kind())
                    .findFirst()
                    .orElseThrow(() -> new ManifestParseException(
                            "Implementation '" + implementationId + "' has no function for role '"
                                    + role.kind().label() + "'",
                            name,
                            source));
            builder.role(role, function);
        }
        for (ExpansionFunction function : functions) {
            if (!declared.contains(function.kind())) {
                throw new ManifestParseException(
                        "Implementation '" + implementationId + "' provides a " + function.kind().label()
                                + " function but the manifest does not declare that role",
                        name,
                        source);
            }
        }
        return builder.build();
    }

    private static RoleSpec parseRole(JsonNode roleNode, String macroName, String source) {
        RoleSpec.Builder role = RoleSpec.builder(RoleKind.fromLabel(roleNode.get("kind").asText()));
        if (roleNode.has("names")) {
            Set<NamePattern> patterns = new LinkedHashSet<>();
            roleNode.get("names").forEach(p -> patterns.add(NamePatternParser.parse(p.asText(), macroName, source)));
            role.names(new NamePolicy(patterns));
        }
        if (roleNode.has("positions")) {
            List<Position> positions = new ArrayList<>();
            roleNode.get("positions").forEach(p -> positions.add(Position.fromLabel(p.asText())));
            role.onlyAt(positions.toArray(Position[]::new));
        }
        if (roleNode.path("default-witness").asBoolean(false)) {
            role.defaultWitness();
        }
        if (roleNode.path("introduces-stored-properties").asBoolean(false)) {
            role.introducesStoredProperties();
        }
        if (roleNode.has("reads")) {
            List<InputDependency> reads = new ArrayList<>();
            roleNode.get("reads").forEach(r -> reads.add(InputDependency.fromLabel(r.asText())));
            role.reads(reads.toArray(InputDependency[]::new));
        }
        return role.build();
    }

    private static JsonSchema loadSchema() {
        try (InputStream in = MacroManifestParser.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Manifest schema not found on classpath: " + SCHEMA_RESOURCE);
            }
            return SCHEMA_FACTORY.getSchema(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load manifest schema " + SCHEMA_RESOURCE, e);
        }
    }
}
