package io.macroexpand.core.spi;

import io.macroexpand.core.syntax.Attribute;
import io.macroexpand.core.syntax.Declaration;
import io.macroexpand.core.syntax.TypeDecl;
import java.util.List;

/** Expansion function of a member role. */
@FunctionalInterface
public interface MemberExpander {

    /**
     * Produces members to append to {@code type}.
     *
     * @return produced members; {@code null} is treated as empty
     */
    List<Declaration> expandMembers(Attribute attribute, TypeDecl type, ExpansionContext context);
}
