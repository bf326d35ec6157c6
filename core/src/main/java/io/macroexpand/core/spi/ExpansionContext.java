package io.macroexpand.core.spi;

import io.macroexpand.core.model.Severity;
import io.macroexpand.core.syntax.SourceLocation;
import java.util.List;

/**
 * Services the engine offers a macro during one expansion. A context is bound to a single request
 * and must not be retained past the call.
 */
public interface ExpansionContext {

    /**
     * Returns a name that cannot collide with any user-written name or any other generated name in
     * the compilation. Generated names are always accepted by the name-hygiene check.
     *
     * @param base readable stem embedded in the name
     */
    String makeUniqueName(String base);

    /** Reports a diagnostic at the attribute's location. */
    void diagnose(Severity severity, String message);

    /** Reports a diagnostic at an explicit location. */
    void diagnose(Severity severity, String message, SourceLocation location);

    /** Names of the enclosing scopes, outermost first, ending with the attached declaration. */
    List<String> lexicalContext();

    /** Whether this macro has reported an error through this context. */
    boolean hasErrors();
}
