package io.macroexpand.core.model;

/**
 * Machine-readable diagnostic classes. Every engine failure maps to exactly one code;
 * {@link #MACRO_EMITTED} covers diagnostics a macro reports through its context.
 */
public enum DiagnosticCode {
    UNKNOWN_MACRO("unknown-macro", false),
    AMBIGUOUS_MACRO("ambiguous-macro", false),
    ROLE_NOT_APPLICABLE("role-not-applicable", false),
    INVALID_INTRODUCED_NAME("invalid-introduced-name", false),
    UNDECLARED_STORED_PROPERTY("undeclared-stored-property", false),
    MACRO_IMPLEMENTATION_ERROR("macro-implementation-error", false),
    MACRO_EMITTED("macro-emitted", false),
    DEPENDENCY_CYCLE("dependency-cycle", true),
    NONTERMINATING_EXPANSION("nonterminating-expansion", true);

    private final String slug;
    private final boolean batchFatal;

    DiagnosticCode(String slug, boolean batchFatal) {
        this.slug = slug;
        this.batchFatal = batchFatal;
    }

    /** Stable URN, e.g. {@code urn:macro-expand:error:dependency-cycle}. */
    public String urn() {
        return "urn:macro-expand:error:" + slug;
    }

    /** Whether this failure invalidates the whole batch rather than one occurrence or fragment. */
    public boolean batchFatal() {
        return batchFatal;
    }
}
