package io.macroexpand.core.spi;

import io.macroexpand.core.syntax.Attribute;
import io.macroexpand.core.syntax.Declaration;
import java.util.List;

/** Expansion function of a peer role. */
@FunctionalInterface
public interface PeerExpander {

    /**
     * Produces declarations to insert immediately after {@code declaration}, in the returned order.
     *
     * @param attribute   the attribute the macro was invoked through
     * @param declaration snapshot of the attached declaration
     * @param context     the expansion context
     * @return produced declarations; {@code null} is treated as empty
     */
    List<Declaration> expandPeers(Attribute attribute, Declaration declaration, ExpansionContext context);
}
