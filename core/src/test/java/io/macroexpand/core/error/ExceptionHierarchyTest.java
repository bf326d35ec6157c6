package io.macroexpand.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import io.macroexpand.core.model.Diagnostic;
import io.macroexpand.core.model.DiagnosticCode;
import io.macroexpand.core.model.Severity;
import io.macroexpand.core.syntax.SourceLocation;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Tests for the exception hierarchy: the registration/expansion split, common fields and the
 * diagnostic each expansion error converts to.
 */
class ExceptionHierarchyTest {

    private static final SourceLocation AT = SourceLocation.of("Point.swift", 4, 5);

    // --- Hierarchy structure ---

    @Test
    void macroExceptionIsAbstractAndRoot() {
        assertThat(MacroException.class).isAbstract();
        assertThat(MacroException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    @Test
    void registrationAndExpansionTiersAreAbstract() {
        assertThat(MacroRegistrationException.class).isAbstract();
        assertThat(MacroRegistrationException.class.getSuperclass()).isEqualTo(MacroException.class);
        assertThat(MacroExpansionException.class).isAbstract();
        assertThat(MacroExpansionException.class.getSuperclass()).isEqualTo(MacroException.class);
    }

    // --- Registration-time exceptions ---

    @Test
    void manifestParseExceptionCarriesSource() {
        var cause = new IllegalStateException("bad yaml");
        var ex = new ManifestParseException("Failed to parse YAML", cause, "Codable", "/macros.yaml");

        assertThat(ex).isInstanceOf(MacroRegistrationException.class);
        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.macroName()).isEqualTo("Codable");
        assertThat(ex.source()).isEqualTo("/macros.yaml");
        assertThat(ex.detail()).isEqualTo("Failed to parse YAML");
        assertThat(ex.phase()).isEqualTo(MacroException.Phase.REGISTRATION);
    }

    @Test
    void duplicateAndInvalidRoleCombinationHaveNoSourceByDefault() {
        var duplicate = new DuplicateMacroException("Macro 'A.Twin' is already registered", "A.Twin");
        var invalid = new InvalidRoleCombinationException("no roles", "main.Empty");

        assertThat(duplicate).isInstanceOf(MacroRegistrationException.class);
        assertThat(duplicate.source()).isNull();
        assertThat(invalid.phase()).isEqualTo(MacroException.Phase.REGISTRATION);
        assertThat(invalid.macroName()).isEqualTo("main.Empty");
    }

    // --- Expansion-time exceptions ---

    @Test
    void unknownMacroBuildsMessageAndDiagnostic() {
        var ex = new UnknownMacroException("Missing", AT);

        assertThat(ex).isInstanceOf(MacroExpansionException.class);
        assertThat(ex.phase()).isEqualTo(MacroException.Phase.EXPANSION);
        assertThat(ex.getMessage()).isEqualTo("No macro named 'Missing' is registered");
        assertThat(ex.isBatchFatal()).isFalse();

        Diagnostic diagnostic = ex.toDiagnostic();
        assertThat(diagnostic.severity()).isEqualTo(Severity.ERROR);
        assertThat(diagnostic.code()).isEqualTo(DiagnosticCode.UNKNOWN_MACRO);
        assertThat(diagnostic.location()).isEqualTo(AT);
        assertThat(diagnostic.macroName()).isEqualTo("Missing");
        assertThat(diagnostic.toString())
                .isEqualTo("Point.swift:4:5: error: No macro named 'Missing' is registered "
                        + "[urn:macro-expand:error:unknown-macro]");
    }

    @Test
    void ambiguousMacroListsCandidates() {
        var ex = new AmbiguousMacroException("Twin", List.of("A.Twin", "B.Twin"), AT);

        assertThat(ex.getMessage()).isEqualTo("Macro 'Twin' is ambiguous: A.Twin, B.Twin");
        assertThat(ex.candidates()).containsExactly("A.Twin", "B.Twin");
        assertThat(ex.code()).isEqualTo(DiagnosticCode.AMBIGUOUS_MACRO);
    }

    @Test
    void dependencyCycleIsBatchFatal() {
        var ex = new DependencyCycleException(List.of("Point", "Point.x", "Point"), "Mirror", AT);

        assertThat(ex.getMessage()).isEqualTo("Macro expansion dependency cycle: Point -> Point.x -> Point");
        assertThat(ex.path()).containsExactly("Point", "Point.x", "Point");
        assertThat(ex.isBatchFatal()).isTrue();
    }

    @Test
    void nonterminatingIsBatchFatal() {
        var ex = new NonterminatingExpansionException("did not reach a fixed point", "Recursive", AT);

        assertThat(ex.code()).isEqualTo(DiagnosticCode.NONTERMINATING_EXPANSION);
        assertThat(ex.isBatchFatal()).isTrue();
    }

    @Test
    void perOccurrenceErrorsAreNotBatchFatal() {
        assertThat(new RoleNotApplicableException("x", "M", AT).isBatchFatal()).isFalse();
        assertThat(new InvalidIntroducedNameException("x", "M", "sneaky", AT).introducedName())
                .isEqualTo("sneaky");
        assertThat(new UndeclaredStoredPropertyException("x", "M", AT).code())
                .isEqualTo(DiagnosticCode.UNDECLARED_STORED_PROPERTY);
        var cause = new IllegalStateException("boom");
        assertThat(new MacroImplementationException("x", cause, "M", AT).getCause()).isSameAs(cause);
    }

    @Test
    void missingLocationFallsBackToUnknown() {
        var ex = new UnknownMacroException("Missing", null);

        assertThat(ex.location()).isEqualTo(SourceLocation.UNKNOWN);
        assertThat(ex.toDiagnostic().location()).isEqualTo(SourceLocation.UNKNOWN);
    }
}
