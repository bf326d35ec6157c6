package io.macroexpand.core.engine;

import io.macroexpand.core.error.DuplicateMacroException;
import io.macroexpand.core.error.InvalidRoleCombinationException;
import io.macroexpand.core.model.MacroDefinition;
import io.macroexpand.core.model.RoleKind;
import io.macroexpand.core.model.RoleSpec;
import io.macroexpand.core.spi.ExpansionFunction;
import io.macroexpand.core.spi.ExpansionListener;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds every registered macro definition, keyed by attribute name.
 *
 * <p>
 * Registration validates the role combination up front, so the rest of the engine can rely on
 * each definition having one function per role and no contradictory role declarations. Two
 * modules may define macros with the same name; lookups then return both and the resolver reports
 * the attribute as ambiguous.
 *
 * <p>
 * Thread-safe: registration is serialized, lookups read immutable snapshots.
 */
public final class RoleRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(RoleRegistry.class);

    private final Map<String, List<MacroDefinition>> byName = new ConcurrentHashMap<>();
    private final ListenerNotifier notifier;

    public RoleRegistry() {
        this(ListenerNotifier.NONE);
    }

    RoleRegistry(ListenerNotifier notifier) {
        this.notifier = notifier;
    }

    /**
     * Validates and registers a definition.
     *
     * @throws InvalidRoleCombinationException if the roles or functions are inconsistent
     * @throws DuplicateMacroException         if the same module already registered this name
     */
    public void register(MacroDefinition definition) {
        register(definition, null);
    }

    /**
     * Validates and registers a definition loaded from {@code source}.
     *
     * @param source manifest path for error reporting, or {@code null}
     */
    public synchronized void register(MacroDefinition definition, String source) {
        if (definition == null) {
            throw new NullPointerException("definition must not be null");
        }
        validate(definition, source);

        List<MacroDefinition> existing = byName.getOrDefault(definition.name(), List.of());
        for (MacroDefinition other : existing) {
            if (other.module().equals(definition.module())) {
                throw new DuplicateMacroException(
                        "Macro '" + definition.qualifiedName() + "' is already registered", definition.name());
            }
        }
        List<MacroDefinition> updated = new ArrayList<>(existing);
        updated.add(definition);
        byName.put(definition.name(), List.copyOf(updated));

        String roles = definition.roles().stream()
                .map(role -> role.kind().label())
                .collect(Collectors.joining(","));
        LOG.info("macro.registered macro={} roles={} source={}", definition.qualifiedName(), roles, source);
        notifier.notify(
                "onMacroRegistered",
                listener -> listener.onMacroRegistered(
                        new ExpansionListener.MacroRegisteredEvent(definition.qualifiedName(), roles)));
    }

    /**
     * Every definition registered under {@code name}, in registration order. A qualified name
     * ({@code Module.Name}) matches only the definition from that module.
     */
    public List<MacroDefinition> lookup(String name) {
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return byName.getOrDefault(name, List.of());
        }
        String module = name.substring(0, dot);
        return byName.getOrDefault(name.substring(dot + 1), List.of()).stream()
                .filter(definition -> definition.module().equals(module))
                .toList();
    }

    /** The roles of every definition registered under {@code name}. */
    public Set<RoleSpec> lookupRoles(String name) {
        Set<RoleSpec> roles = new LinkedHashSet<>();
        lookup(name).forEach(definition -> roles.addAll(definition.roles()));
        return Set.copyOf(roles);
    }

    public boolean contains(String name) {
        return byName.containsKey(name);
    }

    /** Number of registered definitions. */
    public int size() {
        return byName.values().stream().mapToInt(List::size).sum();
    }

    // --- Validation ---

    private static void validate(MacroDefinition definition, String source) {
        String name = definition.name();
        if (name.isEmpty()) {
            throw invalid(definition, "macro name must not be empty", source);
        }
        if (definition.roles().isEmpty()) {
            throw invalid(definition, "a macro must inhabit at least one role", source);
        }

        Set<RoleKind> kinds = EnumSet.noneOf(RoleKind.class);
        for (RoleSpec role : definition.roles()) {
            if (!kinds.add(role.kind())) {
                throw invalid(definition, "role '" + role.kind().label() + "' is declared more than once", source);
            }
            validateRole(definition, role, source);
        }

        Set<RoleKind> functionKinds = EnumSet.noneOf(RoleKind.class);
        for (ExpansionFunction function : definition.functions()) {
            if (!functionKinds.add(function.kind())) {
                throw invalid(
                        definition,
                        "more than one expansion function for role '" + function.kind().label() + "'",
                        source);
            }
            if (!kinds.contains(function.kind())) {
                throw invalid(
                        definition,
                        "expansion function for undeclared role '" + function.kind().label() + "'",
                        source);
            }
        }
        for (RoleKind kind : kinds) {
            if (!functionKinds.contains(kind)) {
                throw invalid(definition, "role '" + kind.label() + "' has no expansion function", source);
            }
        }

        boolean storedMember = definition
                .role(RoleKind.MEMBER)
                .map(RoleSpec::introducesStoredProperties)
                .orElse(false);
        if (kinds.contains(RoleKind.ACCESSOR) && storedMember) {
            throw invalid(
                    definition,
                    "an accessor role cannot be combined with a member role that introduces stored properties",
                    source);
        }
    }

    private static void validateRole(MacroDefinition definition, RoleSpec role, String source) {
        RoleKind kind = role.kind();
        if (role.defaultWitness() && kind != RoleKind.MEMBER) {
            throw invalid(definition, "only a member role can be a default witness", source);
        }
        if (role.defaultWitness() && role.introducesStoredProperties()) {
            throw invalid(definition, "a default-witness role may never introduce stored properties", source);
        }
        if (role.introducesStoredProperties() && !kind.introducesDeclarations()) {
            throw invalid(
                    definition,
                    "role '" + kind.label() + "' cannot introduce stored properties",
                    source);
        }
        if (!kind.introducesDeclarations() && !role.names().isEmpty()) {
            throw invalid(
                    definition,
                    "role '" + kind.label() + "' introduces no declarations and cannot declare names "
                            + role.names(),
                    source);
        }
        if (!role.positions().isEmpty() && role.positions().stream().noneMatch(kind.legalPositions()::contains)) {
            throw invalid(
                    definition,
                    "role '" + kind.label() + "' is restricted to positions where it can never apply: "
                            + role.positions(),
                    source);
        }
    }

    private static InvalidRoleCombinationException invalid(MacroDefinition definition, String detail, String source) {
        return new InvalidRoleCombinationException(
                "Invalid macro '" + definition.qualifiedName() + "': " + detail, definition.name(), source);
    }
}
