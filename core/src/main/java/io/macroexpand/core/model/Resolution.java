package io.macroexpand.core.model;

import io.macroexpand.core.error.MacroExpansionException;
import io.macroexpand.core.syntax.Attribute;
import java.util.List;
import java.util.Objects;

/** Outcome of resolving one attribute occurrence on a declaration. */
public sealed interface Resolution {

    Attribute attribute();

    /** The attribute names a macro that has at least one role applicable at this position. */
    record Resolved(AttributeOccurrence occurrence, List<RoleSpec> applicableRoles) implements Resolution {
        public Resolved {
            Objects.requireNonNull(occurrence, "occurrence must not be null");
            applicableRoles = List.copyOf(applicableRoles);
            if (applicableRoles.isEmpty()) {
                throw new IllegalArgumentException("a resolved occurrence needs at least one applicable role");
            }
        }

        @Override
        public Attribute attribute() {
            return occurrence.attribute();
        }
    }

    /** The attribute could not be resolved; siblings are unaffected. */
    record Failed(Attribute attribute, MacroExpansionException error) implements Resolution {
        public Failed {
            Objects.requireNonNull(attribute, "attribute must not be null");
            Objects.requireNonNull(error, "error must not be null");
        }
    }
}
