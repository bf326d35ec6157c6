package io.macroexpand.core.model;

import io.macroexpand.core.syntax.Position;
import java.util.EnumSet;
import java.util.Set;

/**
 * The expansion roles an attached macro can inhabit. Constants are declared in the fixed execution
 * order used for requests on one declaration: {@code memberAttribute → member → peer → accessor}.
 */
public enum RoleKind {

    /** Adds attributes to each member of the attached type or extension. */
    MEMBER_ATTRIBUTE("memberAttribute", EnumSet.of(Position.TYPE, Position.EXTENSION)),

    /** Appends new members to the attached type or extension. */
    MEMBER("member", EnumSet.of(Position.TYPE, Position.EXTENSION)),

    /** Inserts new declarations next to the attached declaration. */
    PEER("peer", EnumSet.allOf(Position.class)),

    /** Replaces the accessor block of a stored property or subscript. */
    ACCESSOR("accessor", EnumSet.of(Position.STORED_PROPERTY, Position.SUBSCRIPT));

    private final String label;
    private final Set<Position> legalPositions;

    RoleKind(String label, Set<Position> legalPositions) {
        this.label = label;
        this.legalPositions = Set.copyOf(legalPositions);
    }

    /** The camel-case name used in manifests and diagnostics. */
    public String label() {
        return label;
    }

    /** Positions this role can ever apply to. */
    public Set<Position> legalPositions() {
        return legalPositions;
    }

    /** Returns {@code true} if a declaration occupying {@code positions} can host this role. */
    public boolean isLegalAt(Set<Position> positions) {
        return positions.stream().anyMatch(legalPositions::contains);
    }

    /** Roles that can introduce declarations, and therefore names. */
    public boolean introducesDeclarations() {
        return this == MEMBER || this == PEER;
    }

    /**
     * Looks up a role kind by its manifest label.
     *
     * @throws IllegalArgumentException if no role has that label
     */
    public static RoleKind fromLabel(String label) {
        for (RoleKind kind : values()) {
            if (kind.label.equals(label)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown role kind '" + label + "'");
    }
}
