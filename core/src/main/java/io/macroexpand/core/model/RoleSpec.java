package io.macroexpand.core.model;

import io.macroexpand.core.syntax.Position;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * One role a macro inhabits, together with the declarations the role makes about its output.
 *
 * <p>
 * Besides the naming policy, a role may declare what it reads from the enclosing type and whether
 * it introduces stored properties. Those declarations are what the dependency graph is built from,
 * so they must hold for every expansion: a stored property produced by a role that did not declare
 * {@code introducesStoredProperties} is rejected.
 *
 * @param kind                       the role kind
 * @param names                      the name-introduction policy
 * @param positions                  positions the role is narrowed to; empty means every position
 *                                   legal for {@code kind}
 * @param defaultWitness             whether this role only supplies members the type lacks
 * @param introducesStoredProperties whether produced declarations may be stored properties
 * @param reads                      parts of the enclosing type the expansion reads
 */
public record RoleSpec(
        RoleKind kind,
        NamePolicy names,
        Set<Position> positions,
        boolean defaultWitness,
        boolean introducesStoredProperties,
        Set<InputDependency> reads) {

    public RoleSpec {
        Objects.requireNonNull(kind, "kind must not be null");
        names = names != null ? names : NamePolicy.none();
        positions = positions != null ? Set.copyOf(positions) : Set.of();
        reads = reads != null ? Set.copyOf(reads) : Set.of();
    }

    public static RoleSpec of(RoleKind kind, NamePolicy names) {
        return new RoleSpec(kind, names, Set.of(), false, false, Set.of());
    }

    public static Builder builder(RoleKind kind) {
        return new Builder(kind);
    }

    /**
     * Returns {@code true} if this role can expand on a declaration occupying {@code declPositions}.
     */
    public boolean appliesTo(Set<Position> declPositions) {
        if (!kind.isLegalAt(declPositions)) {
            return false;
        }
        return positions.isEmpty() || declPositions.stream().anyMatch(positions::contains);
    }

    /** Dependencies including the implicit stored-property read of a default-witness role. */
    public Set<InputDependency> effectiveReads() {
        if (!defaultWitness || reads.contains(InputDependency.STORED_PROPERTIES)) {
            return reads;
        }
        Set<InputDependency> all = EnumSet.of(InputDependency.STORED_PROPERTIES);
        all.addAll(reads);
        return Set.copyOf(all);
    }

    /** Builder for roles that declare more than a kind and a naming policy. */
    public static final class Builder {

        private final RoleKind kind;
        private NamePolicy names = NamePolicy.none();
        private final Set<Position> positions = EnumSet.noneOf(Position.class);
        private boolean defaultWitness;
        private boolean introducesStoredProperties;
        private final Set<InputDependency> reads = EnumSet.noneOf(InputDependency.class);

        Builder(RoleKind kind) {
            this.kind = Objects.requireNonNull(kind, "kind must not be null");
        }

        public Builder names(NamePattern... patterns) {
            this.names = NamePolicy.of(patterns);
            return this;
        }

        public Builder names(NamePolicy policy) {
            this.names = policy;
            return this;
        }

        public Builder onlyAt(Position... narrowed) {
            positions.addAll(Set.of(narrowed));
            return this;
        }

        public Builder defaultWitness() {
            this.defaultWitness = true;
            return this;
        }

        public Builder introducesStoredProperties() {
            this.introducesStoredProperties = true;
            return this;
        }

        public Builder reads(InputDependency... dependencies) {
            reads.addAll(Set.of(dependencies));
            return this;
        }

        public RoleSpec build() {
            return new RoleSpec(kind, names, positions, defaultWitness, introducesStoredProperties, reads);
        }
    }
}
