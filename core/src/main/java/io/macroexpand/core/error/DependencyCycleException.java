package io.macroexpand.core.error;

import io.macroexpand.core.model.DiagnosticCode;
import io.macroexpand.core.syntax.SourceLocation;
import java.util.List;

/**
 * Expansions in one batch depend on each other's output. The message names the full cycle, e.g.
 * {@code Point -> Point.x -> Point}.
 */
public final class DependencyCycleException extends MacroExpansionException {

    private static final long serialVersionUID = 1L;

    private final List<String> path;

    public DependencyCycleException(List<String> path, String macroName, SourceLocation location) {
        super("Macro expansion dependency cycle: " + String.join(" -> ", path), macroName, location,
                DiagnosticCode.DEPENDENCY_CYCLE);
        this.path = List.copyOf(path);
    }

    /** Qualified names along the cycle; the first entry is repeated at the end. */
    public List<String> path() {
        return path;
    }
}
