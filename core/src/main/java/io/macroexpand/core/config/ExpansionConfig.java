package io.macroexpand.core.config;

import java.util.Objects;
import java.util.Set;

/**
 * Engine settings for one compilation run.
 *
 * @param maxFeedbackIterations resolve/expand passes a batch may take before it is declared
 *                              nonterminating
 * @param parallelism           worker threads for independent declarations; {@code 1} runs every
 *                              request on the calling thread
 * @param builtinAttributes     attribute names that are compiler attributes, not macros, and are
 *                              skipped during resolution
 */
public record ExpansionConfig(int maxFeedbackIterations, int parallelism, Set<String> builtinAttributes) {

    public static final int DEFAULT_MAX_FEEDBACK_ITERATIONS = 32;
    public static final int DEFAULT_PARALLELISM = 1;
    public static final Set<String> DEFAULT_BUILTIN_ATTRIBUTES = Set.of(
            "available",
            "objc",
            "inlinable",
            "usableFromInline",
            "discardableResult",
            "escaping",
            "frozen",
            "MainActor",
            "Sendable");

    public ExpansionConfig {
        if (maxFeedbackIterations < 1) {
            throw new IllegalArgumentException("maxFeedbackIterations must be >= 1, got " + maxFeedbackIterations);
        }
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, got " + parallelism);
        }
        builtinAttributes = Set.copyOf(Objects.requireNonNull(builtinAttributes, "builtinAttributes must not be null"));
    }

    public static ExpansionConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isBuiltin(String attributeName) {
        return builtinAttributes.contains(attributeName);
    }

    /** Builder with the documented defaults. */
    public static final class Builder {

        private int maxFeedbackIterations = DEFAULT_MAX_FEEDBACK_ITERATIONS;
        private int parallelism = DEFAULT_PARALLELISM;
        private Set<String> builtinAttributes = DEFAULT_BUILTIN_ATTRIBUTES;

        private Builder() {}

        public Builder maxFeedbackIterations(int maxFeedbackIterations) {
            this.maxFeedbackIterations = maxFeedbackIterations;
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder builtinAttributes(Set<String> builtinAttributes) {
            this.builtinAttributes = builtinAttributes;
            return this;
        }

        public ExpansionConfig build() {
            return new ExpansionConfig(maxFeedbackIterations, parallelism, builtinAttributes);
        }
    }
}
