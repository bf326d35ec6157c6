package io.macroexpand.core.model;

import io.macroexpand.core.spi.ExpansionFunction;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A registered attached macro: its name, generic parameters, the roles it inhabits and one
 * expansion function per role. Immutable, so the role set is fixed from registration on.
 *
 * <p>
 * Structural consistency between {@link #roles()} and {@link #functions()} is checked by
 * {@code RoleRegistry.register}, not here.
 *
 * @param name              macro name as written in attributes
 * @param module            module that declares the macro
 * @param genericParameters generic parameter names
 * @param roles             role declarations
 * @param functions         expansion functions, one per role kind
 */
public record MacroDefinition(
        String name,
        String module,
        List<String> genericParameters,
        List<RoleSpec> roles,
        List<ExpansionFunction> functions) {

    public static final String DEFAULT_MODULE = "main";

    public MacroDefinition {
        Objects.requireNonNull(name, "name must not be null");
        module = module != null ? module : DEFAULT_MODULE;
        genericParameters = genericParameters != null ? List.copyOf(genericParameters) : List.of();
        roles = roles != null ? List.copyOf(roles) : List.of();
        functions = functions != null ? List.copyOf(functions) : List.of();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public Optional<RoleSpec> role(RoleKind kind) {
        return roles.stream().filter(role -> role.kind() == kind).findFirst();
    }

    public Optional<ExpansionFunction> function(RoleKind kind) {
        return functions.stream().filter(function -> function.kind() == kind).findFirst();
    }

    public Set<RoleKind> roleKinds() {
        return roles.stream().map(RoleSpec::kind).collect(Collectors.toUnmodifiableSet());
    }

    /** {@code module.name}, used to tell apart equally named macros. */
    public String qualifiedName() {
        return module + "." + name;
    }

    /** Builder that pairs each role with its function as they are added. */
    public static final class Builder {

        private final String name;
        private String module = DEFAULT_MODULE;
        private List<String> genericParameters = List.of();
        private final List<RoleSpec> roles = new ArrayList<>();
        private final List<ExpansionFunction> functions = new ArrayList<>();

        Builder(String name) {
            this.name = name;
        }

        public Builder module(String module) {
            this.module = module;
            return this;
        }

        public Builder genericParameters(String... parameters) {
            this.genericParameters = List.of(parameters);
            return this;
        }

        /** Adds a role and the function implementing it. */
        public Builder role(RoleSpec role, ExpansionFunction function) {
            roles.add(role);
            functions.add(function);
            return this;
        }

        public MacroDefinition build() {
            return new MacroDefinition(name, module, genericParameters, roles, functions);
        }
    }
}
