package io.macroexpand.core.engine;

import static io.macroexpand.core.testkit.TestDecls.attr;
import static io.macroexpand.core.testkit.TestDecls.func;
import static io.macroexpand.core.testkit.TestDecls.storedVar;
import static io.macroexpand.core.testkit.TestDecls.struct;
import static org.assertj.core.api.Assertions.assertThat;

import io.macroexpand.core.error.AmbiguousMacroException;
import io.macroexpand.core.error.RoleNotApplicableException;
import io.macroexpand.core.error.UnknownMacroException;
import io.macroexpand.core.model.MacroDefinition;
import io.macroexpand.core.model.Resolution;
import io.macroexpand.core.model.RoleKind;
import io.macroexpand.core.model.RoleSpec;
import io.macroexpand.core.spi.ExpansionFunction;
import io.macroexpand.core.syntax.TypeDecl;
import io.macroexpand.core.testkit.TestMacros;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for {@link AttributeResolver}. */
@DisplayName("AttributeResolver")
class AttributeResolverTest {

    private RoleRegistry registry;
    private AttributeResolver resolver;

    @BeforeEach
    void setUp() {
        registry = new RoleRegistry();
        registry.register(TestMacros.recursive());
        registry.register(TestMacros.addCompletionHandler());
        registry.register(TestMacros.observed());
        resolver = new AttributeResolver(registry, Set.of("available"));
    }

    @Test
    @DisplayName("applicable roles are returned in role order")
    void rolesInOrder() {
        TypeDecl type = struct("S", List.of(), attr("Recursive"));

        List<Resolution> resolutions = resolver.resolve(type);

        assertThat(resolutions).hasSize(1);
        Resolution.Resolved resolved = (Resolution.Resolved) resolutions.get(0);
        assertThat(resolved.applicableRoles())
                .extracting(RoleSpec::kind)
                .containsExactly(RoleKind.MEMBER_ATTRIBUTE, RoleKind.MEMBER);
        assertThat(resolved.occurrence().ordinal()).isZero();
        assertThat(resolved.occurrence().macro().name()).isEqualTo("Recursive");
    }

    @Test
    @DisplayName("roles not legal at the position are filtered out")
    void filtersByPosition() {
        MacroDefinition both = MacroDefinition.builder("Both")
                .role(RoleSpec.of(RoleKind.PEER, null), ExpansionFunction.peer((a, d, c) -> List.of()))
                .role(RoleSpec.of(RoleKind.ACCESSOR, null), ExpansionFunction.accessor((a, d, c) -> List.of()))
                .build();
        registry.register(both);

        Resolution onFunction = resolver.resolve(func("f", attr("Both"))).get(0);
        Resolution onProperty = resolver.resolve(storedVar("v", "v", "Int", null, attr("Both"))).get(0);

        assertThat(((Resolution.Resolved) onFunction).applicableRoles())
                .extracting(RoleSpec::kind)
                .containsExactly(RoleKind.PEER);
        assertThat(((Resolution.Resolved) onProperty).applicableRoles())
                .extracting(RoleSpec::kind)
                .containsExactly(RoleKind.PEER, RoleKind.ACCESSOR);
    }

    @Test
    @DisplayName("each failing attribute fails alone; builtins are skipped")
    void perAttributeFailures() {
        List<Resolution> resolutions = resolver.resolve(
                func("f", attr("available"), attr("Nope", 2), attr("AddCompletionHandler", 3), attr("Observed", 4)));

        assertThat(resolutions).hasSize(3).allSatisfy(r -> assertThat(r).isInstanceOf(Resolution.Failed.class));
        assertThat(((Resolution.Failed) resolutions.get(0)).error()).isInstanceOf(UnknownMacroException.class);
        assertThat(((Resolution.Failed) resolutions.get(1)).error())
                .isInstanceOf(RoleNotApplicableException.class)
                .hasMessage("Macro 'AddCompletionHandler' has no role applicable to function 'f' "
                        + "(declared roles: peer[async-function])");
        assertThat(((Resolution.Failed) resolutions.get(2)).error().location().line()).isEqualTo(4);
    }

    @Test
    @DisplayName("two modules defining the name → ambiguous")
    void ambiguous() {
        registry.register(MacroDefinition.builder("Observed")
                .module("Other")
                .role(RoleSpec.of(RoleKind.ACCESSOR, null), ExpansionFunction.accessor((a, d, c) -> List.of()))
                .build());

        Resolution resolution = resolver.resolve(storedVar("v", "v", "Int", null, attr("Observed"))).get(0);

        assertThat(((Resolution.Failed) resolution).error())
                .isInstanceOfSatisfying(AmbiguousMacroException.class, e -> assertThat(e.candidates())
                        .containsExactly("Other.Observed", "main.Observed"));
    }
}
