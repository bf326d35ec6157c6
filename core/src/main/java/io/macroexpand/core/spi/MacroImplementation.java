package io.macroexpand.core.spi;

import java.util.List;

/**
 * Java side of a macro declared in a manifest. A manifest entry names the implementation by
 * {@link #id()}; the engine pairs the manifest's roles with the returned functions by role kind.
 *
 * <p>Implementations MUST be stateless and thread-safe: the same functions may be called from
 * several worker threads at once.
 */
public interface MacroImplementation {

    /** Identifier referenced by the manifest's {@code implementation} field. */
    String id();

    /** One expansion function per role the macro is declared with. */
    List<ExpansionFunction> functions();
}
