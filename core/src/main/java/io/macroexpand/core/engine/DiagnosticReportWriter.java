package io.macroexpand.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.macroexpand.core.model.Diagnostic;
import io.macroexpand.core.model.ExpansionOutcome;
import java.util.List;

/**
 * Renders diagnostics as a JSON document for compilation drivers and tooling.
 *
 * <pre>
 * {
 *   "unit": "Point.swift",
 *   "errorCount": 1,
 *   "diagnostics": [
 *     { "severity": "error", "type": "urn:macro-expand:error:unknown-macro",
 *       "message": "...", "file": "Point.swift", "line": 3, "column": 5, "macro": "Foo" }
 *   ]
 * }
 * </pre>
 *
 * <p>
 * Thread-safe and immutable.
 */
public final class DiagnosticReportWriter {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Builds the report for one unit's outcome. */
    public JsonNode build(String unit, ExpansionOutcome outcome) {
        return build(unit, outcome.diagnostics());
    }

    public JsonNode build(String unit, List<Diagnostic> diagnostics) {
        ObjectNode report = MAPPER.createObjectNode();
        report.put("unit", unit);
        report.put("errorCount", diagnostics.stream().filter(Diagnostic::isError).count());
        ArrayNode entries = report.putArray("diagnostics");
        for (Diagnostic diagnostic : diagnostics) {
            entries.add(toJson(diagnostic));
        }
        return report;
    }

    /** Serializes the report to a JSON string. */
    public String write(String unit, ExpansionOutcome outcome) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(build(unit, outcome));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize diagnostic report", e);
        }
    }

    private static ObjectNode toJson(Diagnostic diagnostic) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("severity", diagnostic.severity().name().toLowerCase());
        node.put("type", diagnostic.code().urn());
        node.put("message", diagnostic.message());
        node.put("file", diagnostic.location().file());
        node.put("line", diagnostic.location().line());
        node.put("column", diagnostic.location().column());
        if (diagnostic.macroName() != null) {
            node.put("macro", diagnostic.macroName());
        }
        return node;
    }
}
