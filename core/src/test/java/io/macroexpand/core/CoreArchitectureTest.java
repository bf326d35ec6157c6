package io.macroexpand.core;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;
import io.macroexpand.core.error.MacroException;

/**
 * Architecture guardrails for the core module: the syntax tree stands alone, registration code
 * does not reach into the engine, and nothing uses reflection.
 */
@AnalyzeClasses(
        packages = "io.macroexpand.core",
        importOptions = {ImportOption.DoNotIncludeTests.class})
class CoreArchitectureTest {

    @ArchTest
    static final ArchRule syntaxIsSelfContained = noClasses()
            .that()
            .resideInAPackage("io.macroexpand.core.syntax..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage(
                    "io.macroexpand.core.model..",
                    "io.macroexpand.core.spi..",
                    "io.macroexpand.core.error..",
                    "io.macroexpand.core.config..",
                    "io.macroexpand.core.manifest..",
                    "io.macroexpand.core.engine..")
            .because("the declaration tree is shared by every phase and must not depend on them");

    @ArchTest
    static final ArchRule registrationDoesNotDependOnEngine = noClasses()
            .that()
            .resideInAnyPackage("io.macroexpand.core.manifest..", "io.macroexpand.core.config..")
            .should()
            .dependOnClassesThat()
            .resideInAPackage("io.macroexpand.core.engine..")
            .because("manifests and configuration are loaded before any engine exists");

    @ArchTest
    static final ArchRule spiDoesNotDependOnEngine = noClasses()
            .that()
            .resideInAPackage("io.macroexpand.core.spi..")
            .should()
            .dependOnClassesThat()
            .resideInAPackage("io.macroexpand.core.engine..")
            .because("macro implementations compile against the SPI only");

    @ArchTest
    static final ArchRule noReflectionUsage = noClasses()
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("java.lang.reflect..")
            .because("macro implementations are bound through manifests, not reflection");

    @ArchTest
    static final ArchRule exceptionsLiveInErrorPackage = classes()
            .that()
            .areAssignableTo(MacroException.class)
            .should()
            .resideInAPackage("io.macroexpand.core.error..")
            .because("every macro failure belongs to the one exception hierarchy");
}
