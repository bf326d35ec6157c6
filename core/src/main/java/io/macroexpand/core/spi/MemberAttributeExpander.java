package io.macroexpand.core.spi;

import io.macroexpand.core.syntax.Attribute;
import io.macroexpand.core.syntax.Declaration;
import io.macroexpand.core.syntax.TypeDecl;
import java.util.List;

/** Expansion function of a member-attribute role, called once per member of the attached type. */
@FunctionalInterface
public interface MemberAttributeExpander {

    /**
     * Produces attributes to add to {@code member}. Attributes the member already carries are not
     * added twice.
     *
     * @return produced attributes; {@code null} is treated as empty
     */
    List<Attribute> expandMemberAttributes(
            Attribute attribute, TypeDecl type, Declaration member, ExpansionContext context);
}
