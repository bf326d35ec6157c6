package io.macroexpand.core.error;

import io.macroexpand.core.model.DiagnosticCode;
import io.macroexpand.core.syntax.SourceLocation;
import java.util.List;

/** An attribute name matches macros from more than one module. */
public final class AmbiguousMacroException extends MacroExpansionException {

    private static final long serialVersionUID = 1L;

    private final List<String> candidates;

    public AmbiguousMacroException(String macroName, List<String> candidates, SourceLocation location) {
        super(
                "Macro '" + macroName + "' is ambiguous: " + String.join(", ", candidates),
                macroName,
                location,
                DiagnosticCode.AMBIGUOUS_MACRO);
        this.candidates = List.copyOf(candidates);
    }

    /** Qualified names of the matching definitions. */
    public List<String> candidates() {
        return candidates;
    }
}
