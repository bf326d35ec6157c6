package io.macroexpand.core.engine;

import io.macroexpand.core.error.AmbiguousMacroException;
import io.macroexpand.core.error.RoleNotApplicableException;
import io.macroexpand.core.error.UnknownMacroException;
import io.macroexpand.core.model.AttributeOccurrence;
import io.macroexpand.core.model.MacroDefinition;
import io.macroexpand.core.model.Resolution;
import io.macroexpand.core.model.RoleSpec;
import io.macroexpand.core.syntax.Attribute;
import io.macroexpand.core.syntax.Declaration;
import io.macroexpand.core.syntax.Position;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Maps the attributes of a declaration to macro definitions and the roles that apply at the
 * declaration's syntactic position. Failures are per attribute: an unresolvable attribute yields a
 * {@link Resolution.Failed} and its siblings are still resolved.
 */
public final class AttributeResolver {

    private final RoleRegistry registry;
    private final Set<String> builtinAttributes;

    public AttributeResolver(RoleRegistry registry, Set<String> builtinAttributes) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.builtinAttributes = Set.copyOf(builtinAttributes);
    }

    /**
     * Resolves every macro attribute of {@code declaration}, in source order. Builtin compiler
     * attributes are skipped.
     */
    public List<Resolution> resolve(Declaration declaration) {
        List<Resolution> resolutions = new ArrayList<>();
        List<Attribute> attributes = declaration.attributes();
        for (int i = 0; i < attributes.size(); i++) {
            Attribute attribute = attributes.get(i);
            if (!isBuiltin(attribute)) {
                resolutions.add(resolveAttribute(declaration, attribute, i));
            }
        }
        return resolutions;
    }

    public boolean isBuiltin(Attribute attribute) {
        return builtinAttributes.contains(attribute.name());
    }

    /** Whether {@code attribute} resolves to exactly {@code macro}. Builtin attributes never do. */
    public boolean resolvesTo(Attribute attribute, MacroDefinition macro) {
        if (isBuiltin(attribute)) {
            return false;
        }
        List<MacroDefinition> candidates = registry.lookup(attribute.name());
        return candidates.size() == 1 && candidates.get(0).qualifiedName().equals(macro.qualifiedName());
    }

    /** Resolves one attribute written at index {@code ordinal} of the declaration's attributes. */
    public Resolution resolveAttribute(Declaration declaration, Attribute attribute, int ordinal) {
        List<MacroDefinition> candidates = registry.lookup(attribute.name());
        if (candidates.isEmpty()) {
            return new Resolution.Failed(attribute, new UnknownMacroException(attribute.name(), attribute.location()));
        }
        if (candidates.size() > 1) {
            List<String> names = candidates.stream()
                    .map(MacroDefinition::qualifiedName)
                    .sorted()
                    .toList();
            return new Resolution.Failed(
                    attribute, new AmbiguousMacroException(attribute.name(), names, attribute.location()));
        }

        MacroDefinition macro = candidates.get(0);
        Set<Position> positions = declaration.positions();
        List<RoleSpec> applicable = macro.roles().stream()
                .filter(role -> role.appliesTo(positions))
                .sorted(Comparator.comparing(RoleSpec::kind))
                .toList();
        if (applicable.isEmpty()) {
            return new Resolution.Failed(
                    attribute,
                    new RoleNotApplicableException(
                            "Macro '" + macro.name() + "' has no role applicable to "
                                    + describe(positions) + " '" + declaration.name() + "' (declared roles: "
                                    + describeRoles(macro) + ")",
                            macro.name(),
                            attribute.location()));
        }
        return new Resolution.Resolved(
                new AttributeOccurrence(declaration.id(), attribute, ordinal, macro), applicable);
    }

    private static String describe(Set<Position> positions) {
        return positions.stream()
                .sorted()
                .map(Position::label)
                .collect(Collectors.joining("/"));
    }

    private static String describeRoles(MacroDefinition macro) {
        return macro.roles().stream()
                .map(role -> role.positions().isEmpty()
                        ? role.kind().label()
                        : role.kind().label() + "[" + describe(role.positions()) + "]")
                .collect(Collectors.joining(", "));
    }
}
