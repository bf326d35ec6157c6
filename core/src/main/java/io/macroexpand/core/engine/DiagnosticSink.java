package io.macroexpand.core.engine;

import io.macroexpand.core.model.Diagnostic;
import java.util.ArrayList;
import java.util.List;

/** Collects diagnostics for one compilation unit in emission order. Thread-safe. */
public final class DiagnosticSink {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public synchronized void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public synchronized void reportAll(List<Diagnostic> batch) {
        diagnostics.addAll(batch);
    }

    public synchronized List<Diagnostic> diagnostics() {
        return List.copyOf(diagnostics);
    }

    public synchronized boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }
}
