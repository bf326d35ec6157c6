package io.macroexpand.core.spi;

/**
 * SPI for observability hooks. Drivers bridge these callbacks to metrics or tracing systems; the
 * engine itself carries no telemetry dependency.
 *
 * <p>
 * Implementations MUST be thread-safe and non-blocking. Exceptions thrown by listeners are caught
 * by the engine and logged; they never affect expansion.
 *
 * <p>
 * Every method has an empty default, so implementations override only what they observe.
 */
public interface ExpansionListener {

    /** Called after a macro definition is accepted by the registry. */
    default void onMacroRegistered(MacroRegisteredEvent event) {}

    /** Called after one request's fragments have been validated. */
    default void onExpansionInvoked(ExpansionInvokedEvent event) {}

    /** Called when an occurrence fails and contributes no fragments. */
    default void onExpansionFailed(ExpansionFailedEvent event) {}

    /** Called when a fragment is discarded by the name-hygiene or stored-property checks. */
    default void onFragmentRejected(FragmentRejectedEvent event) {}

    /** Called when a batch's result is merged into the unit's tree. */
    default void onBatchCommitted(BatchCommittedEvent event) {}

    /** Called when a batch fails with a cycle or nontermination and its work is discarded. */
    default void onBatchAborted(BatchAbortedEvent event) {}

    // --- Event records ---

    /** A definition entered the registry. */
    record MacroRegisteredEvent(String qualifiedName, String roles) {}

    /** One request was expanded. */
    record ExpansionInvokedEvent(String macroName, String role, String target, int fragments, long durationMicros) {}

    /** An occurrence failed to resolve or its macro failed. */
    record ExpansionFailedEvent(String macroName, String target, String code, String detail) {}

    /** A produced fragment was discarded. */
    record FragmentRejectedEvent(String macroName, String role, String target, String code, String detail) {}

    /** A batch completed. */
    record BatchCommittedEvent(String unit, String root, int iterations, int expansions) {}

    /** A batch was abandoned. */
    record BatchAbortedEvent(String unit, String root, String code, String detail) {}
}
