package io.macroexpand.core.testkit;

import io.macroexpand.core.model.InputDependency;
import io.macroexpand.core.model.MacroDefinition;
import io.macroexpand.core.model.NamePattern;
import io.macroexpand.core.model.NamePolicy;
import io.macroexpand.core.model.RoleKind;
import io.macroexpand.core.model.RoleSpec;
import io.macroexpand.core.model.Severity;
import io.macroexpand.core.spi.ExpansionFunction;
import io.macroexpand.core.spi.MacroImplementation;
import io.macroexpand.core.syntax.Accessor;
import io.macroexpand.core.syntax.AccessorKind;
import io.macroexpand.core.syntax.Attribute;
import io.macroexpand.core.syntax.Binding;
import io.macroexpand.core.syntax.Declaration;
import io.macroexpand.core.syntax.FunctionDecl;
import io.macroexpand.core.syntax.Parameter;
import io.macroexpand.core.syntax.Position;
import io.macroexpand.core.syntax.TypeDecl;
import io.macroexpand.core.syntax.TypeKind;
import io.macroexpand.core.syntax.VariableDecl;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Macro definitions used by the engine tests. Each one is small and does exactly one thing, so a
 * test can combine them to set up a scenario.
 */
public final class TestMacros {

    private TestMacros() {}

    /**
     * {@code @AddCompletionHandler}: on an async function, adds a non-async overload taking a
     * completion handler for the original result.
     */
    public static MacroDefinition addCompletionHandler() {
        return MacroDefinition.builder("AddCompletionHandler")
                .role(
                        RoleSpec.builder(RoleKind.PEER)
                                .names(NamePattern.overloaded())
                                .onlyAt(Position.ASYNC_FUNCTION)
                                .build(),
                        ExpansionFunction.peer((attribute, declaration, context) -> {
                            FunctionDecl function = (FunctionDecl) declaration;
                            String result = function.returnType() != null ? function.returnType() : "Void";
                            List<Parameter> parameters = new ArrayList<>(function.parameters());
                            parameters.add(new Parameter(null, "completionHandler", "@escaping (" + result + ") -> Void"));
                            String call = function.parameters().stream()
                                    .map(p -> p.callLabel() != null ? p.callLabel() + ": " + p.name() : p.name())
                                    .collect(Collectors.joining(", "));
                            String body = "{ Task { completionHandler(await " + function.name() + "(" + call + ")) } }";
                            return List.of(new FunctionDecl(
                                    TestDecls.produced(), function.name(), List.of(), parameters, null, false,
                                    false, body, null));
                        }))
                .build();
    }

    /** {@code @Observed}: turns a stored property into a get/set pair over a backing dictionary. */
    public static MacroDefinition observed() {
        return MacroDefinition.builder("Observed")
                .role(
                        RoleSpec.of(RoleKind.ACCESSOR, null),
                        ExpansionFunction.accessor((attribute, declaration, context) -> List.of(
                                Accessor.getter("return storage[\"" + declaration.name() + "\"]"),
                                Accessor.setter("storage[\"" + declaration.name() + "\"] = newValue"))))
                .build();
    }

    /** {@code @Logged}: an accessor role that adds a {@code didSet} observer. */
    public static MacroDefinition logged() {
        return MacroDefinition.builder("Logged")
                .role(
                        RoleSpec.of(RoleKind.ACCESSOR, null),
                        ExpansionFunction.accessor((attribute, declaration, context) -> List.of(
                                new Accessor(AccessorKind.DID_SET, "print(\"" + declaration.name() + " changed\")"))))
                .build();
    }

    /** A peer macro adding {@code <prefix><name>()} next to its target. */
    public static MacroDefinition prefixedPeer(String macroName, String prefix) {
        return MacroDefinition.builder(macroName)
                .role(
                        RoleSpec.of(RoleKind.PEER, NamePolicy.of(NamePattern.prefixed(prefix))),
                        ExpansionFunction.peer((attribute, declaration, context) ->
                                List.of(TestDecls.method("produced", prefix + declaration.name()))))
                .build();
    }

    /** {@code @AddFoo}: attaches {@code @foo} to every stored property of a type. */
    public static MacroDefinition addFoo() {
        return MacroDefinition.builder("AddFoo")
                .role(
                        RoleSpec.of(RoleKind.MEMBER_ATTRIBUTE, null),
                        ExpansionFunction.memberAttribute((attribute, type, member, context) ->
                                member instanceof VariableDecl ? List.of(Attribute.of("foo")) : List.of()))
                .build();
    }

    /** {@code @foo}: adds a {@code foo_<name>()} accessor function next to a property. */
    public static MacroDefinition foo() {
        return prefixedPeer("foo", "foo_");
    }

    /**
     * {@code @Recursive}: adds a nested {@code struct Nested} and marks every nested type with
     * itself, so expansion never settles.
     */
    public static MacroDefinition recursive() {
        return MacroDefinition.builder("Recursive")
                .role(
                        RoleSpec.of(RoleKind.MEMBER_ATTRIBUTE, null),
                        ExpansionFunction.memberAttribute((attribute, type, member, context) ->
                                member instanceof TypeDecl ? List.of(Attribute.of("Recursive")) : List.of()))
                .role(
                        RoleSpec.builder(RoleKind.MEMBER).names(NamePattern.named("Nested")).build(),
                        ExpansionFunction.member((attribute, type, context) -> List.of(new TypeDecl(
                                TestDecls.produced(), TypeKind.STRUCT, "Nested", List.of(), List.of(), List.of(),
                                null))))
                .build();
    }

    /** {@code @Spread}: a member-attribute role that attaches {@code @Spread} to every member. */
    public static MacroDefinition spread() {
        return MacroDefinition.builder("Spread")
                .role(
                        RoleSpec.of(RoleKind.MEMBER_ATTRIBUTE, null),
                        ExpansionFunction.memberAttribute((attribute, type, member, context) ->
                                List.of(Attribute.of("Spread"))))
                .build();
    }

    /** {@code @Grow}: adds a nested {@code struct Nested} that carries {@code @Grow} again. */
    public static MacroDefinition grow() {
        return MacroDefinition.builder("Grow")
                .role(
                        RoleSpec.builder(RoleKind.MEMBER).names(NamePattern.named("Nested")).build(),
                        ExpansionFunction.member((attribute, type, context) -> List.of(new TypeDecl(
                                TestDecls.produced(), TypeKind.STRUCT, "Nested", List.of(Attribute.of("Grow")),
                                List.of(), List.of(), null))))
                .build();
    }

    /** {@code @AddHelper}: adds {@code helper()}, marked {@code @Shadow}. */
    public static MacroDefinition addHelper() {
        return MacroDefinition.builder("AddHelper")
                .role(
                        RoleSpec.builder(RoleKind.MEMBER).names(NamePattern.named("helper")).build(),
                        ExpansionFunction.member((attribute, type, context) -> List.of(new FunctionDecl(
                                TestDecls.produced(), "helper", List.of(Attribute.of("Shadow")), List.of(), "Void",
                                false, false, "{ }", null))))
                .build();
    }

    /** {@code @Chain}: produces {@code next_<name>}, which carries {@code @Chain} again. */
    public static MacroDefinition chain() {
        return MacroDefinition.builder("Chain")
                .role(
                        RoleSpec.of(RoleKind.PEER, NamePolicy.of(NamePattern.prefixed("next_"))),
                        ExpansionFunction.peer((attribute, declaration, context) -> List.<Declaration>of(
                                new FunctionDecl(TestDecls.produced(), "next_" + declaration.name(),
                                        List.of(Attribute.of("Chain")), List.of(), "Void", false, false, "{ }",
                                        null))))
                .build();
    }

    /**
     * {@code @Codable}: a default-witness member role synthesizing {@code encode(to:)} from the
     * type's stored properties.
     */
    public static MacroDefinition codable() {
        return MacroDefinition.builder("Codable")
                .role(
                        RoleSpec.builder(RoleKind.MEMBER)
                                .names(NamePattern.named("encode"))
                                .defaultWitness()
                                .build(),
                        ExpansionFunction.member((attribute, type, context) -> {
                            String body = type.storedProperties().stream()
                                    .map(p -> "try container.encode(" + p.name() + ")")
                                    .collect(Collectors.joining("; ", "{ ", " }"));
                            return List.of(new FunctionDecl(
                                    TestDecls.produced(), "encode",
                                    List.of(),
                                    List.of(new Parameter("to", "encoder", "Encoder")),
                                    null, false, true, body, null));
                        }))
                .build();
    }

    /**
     * {@code @Mirror}: a peer on a property that reads the enclosing type's members and adds a
     * stored {@code mirror_<name>} property.
     */
    public static MacroDefinition mirror() {
        return MacroDefinition.builder("Mirror")
                .role(
                        RoleSpec.builder(RoleKind.PEER)
                                .names(NamePattern.prefixed("mirror_"))
                                .introducesStoredProperties()
                                .reads(InputDependency.MEMBERS)
                                .build(),
                        ExpansionFunction.peer((attribute, declaration, context) -> List.of(new VariableDecl(
                                TestDecls.produced(), Binding.VAR, "mirror_" + declaration.name(), "String",
                                "\"\"", null, List.of(), null))))
                .build();
    }

    /** {@code @Shadow}: a peer on a property adding a stored {@code shadow_<name>} property. */
    public static MacroDefinition shadow() {
        return MacroDefinition.builder("Shadow")
                .role(
                        RoleSpec.builder(RoleKind.PEER)
                                .names(NamePattern.prefixed("shadow_"))
                                .introducesStoredProperties()
                                .build(),
                        ExpansionFunction.peer((attribute, declaration, context) -> List.of(new VariableDecl(
                                TestDecls.produced(), Binding.VAR, "shadow_" + declaration.name(), "Int", "0",
                                null, List.of(), null))))
                .build();
    }

    /** {@code @AddStorage}: a member role that declares it introduces stored properties. */
    public static MacroDefinition addStorage() {
        return MacroDefinition.builder("AddStorage")
                .role(
                        RoleSpec.builder(RoleKind.MEMBER)
                                .names(NamePattern.named("storage"))
                                .introducesStoredProperties()
                                .build(),
                        ExpansionFunction.member((attribute, type, context) -> List.of(new VariableDecl(
                                TestDecls.produced(), Binding.VAR, "storage", "[String: Any]", "[:]", null,
                                List.of(), null))))
                .build();
    }

    /** {@code @Describe}: a member role that reads stored properties and adds {@code describe()}. */
    public static MacroDefinition describe() {
        return MacroDefinition.builder("Describe")
                .role(
                        RoleSpec.builder(RoleKind.MEMBER)
                                .names(NamePattern.named("describe"))
                                .reads(InputDependency.STORED_PROPERTIES)
                                .build(),
                        ExpansionFunction.member((attribute, type, context) -> {
                            String fields = type.storedProperties().stream()
                                    .map(VariableDecl::name)
                                    .collect(Collectors.joining(","));
                            return List.of(new FunctionDecl(
                                    TestDecls.produced(), "describe", List.of(), List.of(), "String", false, false,
                                    "{ \"" + fields + "\" }", null));
                        }))
                .build();
    }

    /** {@code @Explode}: a peer whose body throws. */
    public static MacroDefinition failing() {
        return MacroDefinition.builder("Explode")
                .role(
                        RoleSpec.of(RoleKind.PEER, null),
                        ExpansionFunction.peer((attribute, declaration, context) -> {
                            throw new IllegalStateException("boom");
                        }))
                .build();
    }

    /** {@code @Sneaky}: declares overloaded names but produces a different one. */
    public static MacroDefinition badName() {
        return MacroDefinition.builder("Sneaky")
                .role(
                        RoleSpec.of(RoleKind.PEER, NamePolicy.of(NamePattern.overloaded())),
                        ExpansionFunction.peer((attribute, declaration, context) -> List.of(
                                TestDecls.method("produced", declaration.name()),
                                TestDecls.method("produced", "sneaky"))))
                .build();
    }

    /** {@code @Helper}: adds a peer function with a generated unique name. */
    public static MacroDefinition uniqueHelper() {
        return MacroDefinition.builder("Helper")
                .role(
                        RoleSpec.of(RoleKind.PEER, null),
                        ExpansionFunction.peer((attribute, declaration, context) -> List.of(
                                TestDecls.method("produced", context.makeUniqueName(declaration.name())),
                                TestDecls.method("produced", context.makeUniqueName(declaration.name())))))
                .build();
    }

    /** {@code @Refuse}: reports an error through its context and still returns a declaration. */
    public static MacroDefinition refusing() {
        return MacroDefinition.builder("Refuse")
                .role(
                        RoleSpec.of(RoleKind.PEER, NamePolicy.of(NamePattern.arbitrary())),
                        ExpansionFunction.peer((attribute, declaration, context) -> {
                            context.diagnose(Severity.WARNING, "'" + declaration.name() + "' looks odd");
                            context.diagnose(Severity.ERROR, "cannot expand '" + declaration.name() + "'");
                            return List.of(TestDecls.method("produced", "ignored"));
                        }))
                .build();
    }

    /** {@code @SelfCopy}: produces a copy of its target, attribute included. */
    public static MacroDefinition selfCopy() {
        return MacroDefinition.builder("SelfCopy")
                .role(
                        RoleSpec.of(RoleKind.PEER, NamePolicy.of(NamePattern.overloaded())),
                        ExpansionFunction.peer((attribute, declaration, context) ->
                                List.<Declaration>of(declaration.withId(TestDecls.produced()))))
                .build();
    }

    /** An implementation with the given id for manifest tests. */
    public static MacroImplementation implementation(String id, ExpansionFunction... functions) {
        List<ExpansionFunction> list = List.of(functions);
        return new MacroImplementation() {
            @Override
            public String id() {
                return id;
            }

            @Override
            public List<ExpansionFunction> functions() {
                return list;
            }
        };
    }
}
