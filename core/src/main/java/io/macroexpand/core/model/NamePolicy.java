package io.macroexpand.core.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The set of name patterns a role declares. A name is permitted if any declared pattern matches
 * it. Context-generated unique names are always permitted and are checked by the hygiene validator,
 * not here.
 *
 * @param patterns the declared patterns
 */
public record NamePolicy(Set<NamePattern> patterns) {

    private static final NamePolicy NONE = new NamePolicy(Set.of());

    public NamePolicy {
        patterns = patterns != null ? Set.copyOf(patterns) : Set.of();
    }

    /** A policy that declares no names; only generated unique names are allowed. */
    public static NamePolicy none() {
        return NONE;
    }

    public static NamePolicy of(NamePattern... patterns) {
        return new NamePolicy(new LinkedHashSet<>(List.of(patterns)));
    }

    public boolean permits(String candidate, String targetBaseName) {
        return patterns.stream().anyMatch(pattern -> pattern.matches(candidate, targetBaseName));
    }

    public boolean isEmpty() {
        return patterns.isEmpty();
    }

    public boolean isArbitrary() {
        return patterns.contains(NamePattern.arbitrary());
    }

    @Override
    public String toString() {
        return patterns.stream().map(NamePattern::render).sorted().collect(Collectors.joining(", ", "[", "]"));
    }
}
