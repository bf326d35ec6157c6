package io.macroexpand.core.model;

import static org.assertj.core.api.Assertions.assertThat;

import io.macroexpand.core.syntax.Position;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for {@link RoleSpec} applicability and effective input dependencies. */
@DisplayName("RoleSpec")
class RoleSpecTest {

    @Test
    @DisplayName("a role applies only at positions legal for its kind")
    void legalPositions() {
        RoleSpec accessor = RoleSpec.of(RoleKind.ACCESSOR, null);

        assertThat(accessor.appliesTo(Set.of(Position.STORED_PROPERTY))).isTrue();
        assertThat(accessor.appliesTo(Set.of(Position.SUBSCRIPT))).isTrue();
        assertThat(accessor.appliesTo(Set.of(Position.COMPUTED_PROPERTY))).isFalse();
        assertThat(RoleSpec.of(RoleKind.MEMBER, null).appliesTo(Set.of(Position.FUNCTION))).isFalse();
        assertThat(RoleSpec.of(RoleKind.PEER, null).appliesTo(Set.of(Position.EXTENSION))).isTrue();
    }

    @Test
    @DisplayName("a positions restriction narrows the kind's legal positions")
    void narrowedPositions() {
        RoleSpec asyncOnly = RoleSpec.builder(RoleKind.PEER).onlyAt(Position.ASYNC_FUNCTION).build();

        assertThat(asyncOnly.appliesTo(Set.of(Position.FUNCTION, Position.ASYNC_FUNCTION))).isTrue();
        assertThat(asyncOnly.appliesTo(Set.of(Position.FUNCTION))).isFalse();
    }

    @Test
    @DisplayName("default witnesses implicitly read stored properties")
    void defaultWitnessReads() {
        RoleSpec witness = RoleSpec.builder(RoleKind.MEMBER).defaultWitness().build();
        RoleSpec plain = RoleSpec.builder(RoleKind.MEMBER).reads(InputDependency.MEMBERS).build();

        assertThat(witness.effectiveReads()).containsExactly(InputDependency.STORED_PROPERTIES);
        assertThat(plain.effectiveReads()).containsExactly(InputDependency.MEMBERS);
    }

    @Test
    @DisplayName("labels round-trip through fromLabel")
    void labels() {
        assertThat(RoleKind.fromLabel("memberAttribute")).isEqualTo(RoleKind.MEMBER_ATTRIBUTE);
        assertThat(InputDependency.fromLabel("stored-properties")).isEqualTo(InputDependency.STORED_PROPERTIES);
        assertThat(Position.fromLabel("async-function")).isEqualTo(Position.ASYNC_FUNCTION);
    }
}
