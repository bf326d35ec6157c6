package io.macroexpand.core.model;

import io.macroexpand.core.syntax.Accessor;
import io.macroexpand.core.syntax.Attribute;
import io.macroexpand.core.syntax.DeclId;
import io.macroexpand.core.syntax.Declaration;
import io.macroexpand.core.syntax.VariableDecl;
import java.util.Objects;
import java.util.Set;

/** A piece of syntax produced by a macro, tagged with the names it introduces. */
public sealed interface Fragment {

    /** Names this fragment brings into scope. */
    Set<String> introducedNames();

    /** A declaration produced by a peer or member role. */
    record DeclarationFragment(Declaration declaration) implements Fragment {
        public DeclarationFragment {
            Objects.requireNonNull(declaration, "declaration must not be null");
        }

        @Override
        public Set<String> introducedNames() {
            return Set.of(declaration.name());
        }

        public boolean isStoredProperty() {
            return declaration instanceof VariableDecl variable && variable.isStored();
        }
    }

    /** An accessor produced by an accessor role. */
    record AccessorFragment(Accessor accessor) implements Fragment {
        public AccessorFragment {
            Objects.requireNonNull(accessor, "accessor must not be null");
        }

        @Override
        public Set<String> introducedNames() {
            return Set.of();
        }
    }

    /** An attribute a member-attribute role adds to one member. */
    record AttributeFragment(DeclId member, Attribute attribute) implements Fragment {
        public AttributeFragment {
            Objects.requireNonNull(member, "member must not be null");
            Objects.requireNonNull(attribute, "attribute must not be null");
        }

        @Override
        public Set<String> introducedNames() {
            return Set.of();
        }
    }
}
