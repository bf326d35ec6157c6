package io.macroexpand.core.spi;

import io.macroexpand.core.model.RoleKind;
import java.util.Objects;

/**
 * A macro's implementation for one role. The variant fixes which role the function serves, so a
 * definition pairs each declared role with exactly one function of the matching variant.
 */
public sealed interface ExpansionFunction {

    RoleKind kind();

    static ExpansionFunction peer(PeerExpander expander) {
        return new PeerRole(expander);
    }

    static ExpansionFunction member(MemberExpander expander) {
        return new MemberRole(expander);
    }

    static ExpansionFunction accessor(AccessorExpander expander) {
        return new AccessorRole(expander);
    }

    static ExpansionFunction memberAttribute(MemberAttributeExpander expander) {
        return new MemberAttributeRole(expander);
    }

    record PeerRole(PeerExpander expander) implements ExpansionFunction {
        public PeerRole {
            Objects.requireNonNull(expander, "expander must not be null");
        }

        @Override
        public RoleKind kind() {
            return RoleKind.PEER;
        }
    }

    record MemberRole(MemberExpander expander) implements ExpansionFunction {
        public MemberRole {
            Objects.requireNonNull(expander, "expander must not be null");
        }

        @Override
        public RoleKind kind() {
            return RoleKind.MEMBER;
        }
    }

    record AccessorRole(AccessorExpander expander) implements ExpansionFunction {
        public AccessorRole {
            Objects.requireNonNull(expander, "expander must not be null");
        }

        @Override
        public RoleKind kind() {
            return RoleKind.ACCESSOR;
        }
    }

    record MemberAttributeRole(MemberAttributeExpander expander) implements ExpansionFunction {
        public MemberAttributeRole {
            Objects.requireNonNull(expander, "expander must not be null");
        }

        @Override
        public RoleKind kind() {
            return RoleKind.MEMBER_ATTRIBUTE;
        }
    }
}
