package io.macroexpand.core.spi;

import io.macroexpand.core.syntax.Accessor;
import io.macroexpand.core.syntax.Attribute;
import io.macroexpand.core.syntax.Declaration;
import java.util.List;

/** Expansion function of an accessor role. */
@FunctionalInterface
public interface AccessorExpander {

    /**
     * Produces accessors for a stored property or subscript. The first accessor expansion on a
     * declaration replaces its accessor block and drops its initializer.
     *
     * @return produced accessors; {@code null} is treated as empty
     */
    List<Accessor> expandAccessors(Attribute attribute, Declaration declaration, ExpansionContext context);
}
