package io.macroexpand.core.engine;

import io.macroexpand.core.model.Diagnostic;
import io.macroexpand.core.model.DiagnosticCode;
import io.macroexpand.core.model.Severity;
import io.macroexpand.core.spi.ExpansionContext;
import io.macroexpand.core.syntax.SourceLocation;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The context handed to a macro for one request. Diagnostics are buffered here and forwarded to the
 * unit's sink when the request's result is merged, which keeps diagnostic order independent of
 * worker scheduling.
 */
public final class DefaultExpansionContext implements ExpansionContext {

    private final UniqueNameAllocator allocator;
    private final long slot;
    private final List<String> lexicalContext;
    private final SourceLocation attributeLocation;
    private final String macroName;
    private final List<Diagnostic> diagnostics = Collections.synchronizedList(new ArrayList<>());
    private int nextIndex;

    public DefaultExpansionContext(
            UniqueNameAllocator allocator, List<String> lexicalContext, SourceLocation attributeLocation, String macroName) {
        this.allocator = Objects.requireNonNull(allocator, "allocator must not be null");
        this.slot = allocator.reserveSlot();
        this.lexicalContext = List.copyOf(lexicalContext);
        this.attributeLocation = attributeLocation;
        this.macroName = macroName;
    }

    @Override
    public synchronized String makeUniqueName(String base) {
        return allocator.issue(slot, nextIndex++, base);
    }

    @Override
    public void diagnose(Severity severity, String message) {
        diagnose(severity, message, attributeLocation);
    }

    @Override
    public void diagnose(Severity severity, String message, SourceLocation location) {
        diagnostics.add(new Diagnostic(
                severity,
                DiagnosticCode.MACRO_EMITTED,
                message,
                location != null ? location : attributeLocation,
                macroName));
    }

    @Override
    public List<String> lexicalContext() {
        return lexicalContext;
    }

    @Override
    public boolean hasErrors() {
        return diagnostics().stream().anyMatch(Diagnostic::isError);
    }

    /** Diagnostics the macro reported, in order. */
    public List<Diagnostic> diagnostics() {
        synchronized (diagnostics) {
            return List.copyOf(diagnostics);
        }
    }
}
