package io.macroexpand.core.model;

import io.macroexpand.core.syntax.SyntaxTree;
import java.util.List;
import java.util.Objects;

/**
 * What the engine hands back to the compilation driver for one unit.
 *
 * @param tree        the final merged tree
 * @param diagnostics every diagnostic emitted during the run, in emission order
 */
public record ExpansionOutcome(SyntaxTree tree, List<Diagnostic> diagnostics) {

    public ExpansionOutcome {
        Objects.requireNonNull(tree, "tree must not be null");
        diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    public List<Diagnostic> diagnostics(DiagnosticCode code) {
        return diagnostics.stream().filter(d -> d.code() == code).toList();
    }
}
