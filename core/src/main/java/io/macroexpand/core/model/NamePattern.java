package io.macroexpand.core.model;

import java.util.Objects;

/**
 * One entry of a role's name-introduction policy. Patterns are checked against the base name of
 * the declaration the macro is attached to, so whether a name is permitted can be decided without
 * running the macro.
 *
 * <p>
 * Thread-safe and immutable.
 */
public sealed interface NamePattern {

    /**
     * Returns {@code true} if {@code candidate} is permitted for a macro attached to a declaration
     * whose base name is {@code targetBaseName}.
     */
    boolean matches(String candidate, String targetBaseName);

    /** The manifest spelling of this pattern, e.g. {@code prefixed(_)}. */
    String render();

    static NamePattern overloaded() {
        return Overloaded.INSTANCE;
    }

    static NamePattern arbitrary() {
        return Arbitrary.INSTANCE;
    }

    static NamePattern prefixed(String prefix) {
        return new Prefixed(prefix);
    }

    static NamePattern suffixed(String suffix) {
        return new Suffixed(suffix);
    }

    static NamePattern named(String name) {
        return new Named(name);
    }

    // ── Implementations ──

    /** The introduced name equals the target's base name. */
    record Overloaded() implements NamePattern {
        static final Overloaded INSTANCE = new Overloaded();

        @Override
        public boolean matches(String candidate, String targetBaseName) {
            return candidate.equals(targetBaseName);
        }

        @Override
        public String render() {
            return "overloaded";
        }
    }

    /** The introduced name is the target's base name with {@code prefix} in front. */
    record Prefixed(String prefix) implements NamePattern {
        public Prefixed {
            Objects.requireNonNull(prefix, "prefix must not be null");
            if (prefix.isEmpty()) {
                throw new IllegalArgumentException("prefix must not be empty");
            }
        }

        @Override
        public boolean matches(String candidate, String targetBaseName) {
            return candidate.equals(prefix + targetBaseName);
        }

        @Override
        public String render() {
            return "prefixed(" + prefix + ")";
        }
    }

    /** The introduced name is the target's base name followed by {@code suffix}. */
    record Suffixed(String suffix) implements NamePattern {
        public Suffixed {
            Objects.requireNonNull(suffix, "suffix must not be null");
            if (suffix.isEmpty()) {
                throw new IllegalArgumentException("suffix must not be empty");
            }
        }

        @Override
        public boolean matches(String candidate, String targetBaseName) {
            return candidate.equals(targetBaseName + suffix);
        }

        @Override
        public String render() {
            return "suffixed(" + suffix + ")";
        }
    }

    /** Exactly the given name, independent of the target. */
    record Named(String name) implements NamePattern {
        public Named {
            Objects.requireNonNull(name, "name must not be null");
            if (name.isEmpty()) {
                throw new IllegalArgumentException("name must not be empty");
            }
        }

        @Override
        public boolean matches(String candidate, String targetBaseName) {
            return candidate.equals(name);
        }

        @Override
        public String render() {
            return "named(" + name + ")";
        }
    }

    /** Any name. Only ever permitted when declared explicitly. */
    record Arbitrary() implements NamePattern {
        static final Arbitrary INSTANCE = new Arbitrary();

        @Override
        public boolean matches(String candidate, String targetBaseName) {
            return true;
        }

        @Override
        public String render() {
            return "arbitrary";
        }
    }
}
