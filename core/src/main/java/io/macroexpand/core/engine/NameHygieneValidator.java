package io.macroexpand.core.engine;

import io.macroexpand.core.error.InvalidIntroducedNameException;
import io.macroexpand.core.error.MacroExpansionException;
import io.macroexpand.core.error.UndeclaredStoredPropertyException;
import io.macroexpand.core.model.ExpansionRequest;
import io.macroexpand.core.model.ExpansionResult;
import io.macroexpand.core.model.Fragment;
import io.macroexpand.core.model.RoleSpec;
import io.macroexpand.core.spi.ExpansionListener;
import io.macroexpand.core.syntax.Declaration;
import io.macroexpand.core.syntax.SourceLocation;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks every fragment of a result against the declarations its role made at registration.
 *
 * <p>
 * A name is accepted if the role's {@link io.macroexpand.core.model.NamePolicy} permits it for the
 * target's base name, or if the compilation's {@link UniqueNameAllocator} issued it. A stored
 * property is accepted only from a role that declared {@code introducesStoredProperties}. Each
 * violation discards only the offending fragment.
 */
public final class NameHygieneValidator {

    private static final Logger LOG = LoggerFactory.getLogger(NameHygieneValidator.class);

    private final UniqueNameAllocator allocator;
    private final ListenerNotifier notifier;

    public NameHygieneValidator(UniqueNameAllocator allocator) {
        this(allocator, ListenerNotifier.NONE);
    }

    NameHygieneValidator(UniqueNameAllocator allocator, ListenerNotifier notifier) {
        this.allocator = Objects.requireNonNull(allocator, "allocator must not be null");
        this.notifier = notifier;
    }

    /** Accepted fragments and one error per rejected fragment. */
    public record Validation(ExpansionResult accepted, List<MacroExpansionException> rejected) {
        public Validation {
            rejected = List.copyOf(rejected);
        }
    }

    /** Returns {@code true} if a role may introduce {@code name} next to or into {@code targetName}. */
    public boolean permits(RoleSpec role, String name, String targetName) {
        return allocator.isGenerated(name) || role.names().permits(name, targetName);
    }

    public Validation validate(ExpansionResult result) {
        ExpansionRequest request = result.request();
        RoleSpec role = request.role();
        String targetName = request.target().name();

        List<Fragment> kept = new ArrayList<>(result.fragments().size());
        List<MacroExpansionException> rejected = new ArrayList<>();
        for (Fragment fragment : result.fragments()) {
            MacroExpansionException error = check(request, role, targetName, fragment);
            if (error == null) {
                kept.add(fragment);
            } else {
                rejected.add(error);
                reportRejection(request, error);
            }
        }
        return new Validation(result.withFragments(kept), rejected);
    }

    private MacroExpansionException check(
            ExpansionRequest request, RoleSpec role, String targetName, Fragment fragment) {
        for (String name : fragment.introducedNames()) {
            if (!permits(role, name, targetName)) {
                return new InvalidIntroducedNameException(
                        "Macro '" + request.macroName() + "' introduced name '" + name + "' through its "
                                + role.kind().label() + " role on '" + targetName + "', which declares "
                                + (role.names().isEmpty() ? "no names" : "only " + role.names()),
                        request.macroName(),
                        name,
                        locate(request, fragment));
            }
        }
        if (fragment instanceof Fragment.DeclarationFragment declaration
                && declaration.isStoredProperty()
                && !role.introducesStoredProperties()) {
            String detail = role.defaultWitness()
                    ? "a default-witness role may never introduce a stored property"
                    : "its " + role.kind().label() + " role does not declare that it introduces stored properties";
            return new UndeclaredStoredPropertyException(
                    "Macro '" + request.macroName() + "' produced stored property '"
                            + declaration.declaration().name() + "' but " + detail,
                    request.macroName(),
                    locate(request, fragment));
        }
        return null;
    }

    private static SourceLocation locate(ExpansionRequest request, Fragment fragment) {
        if (fragment instanceof Fragment.DeclarationFragment declaration) {
            Declaration produced = declaration.declaration();
            if (!SourceLocation.UNKNOWN.equals(produced.location())) {
                return produced.location();
            }
        }
        return request.occurrence().attribute().location();
    }

    private void reportRejection(ExpansionRequest request, MacroExpansionException error) {
        LOG.warn(
                "expansion.fragment.rejected macro={} role={} target={} code={} detail={}",
                request.macroName(),
                request.kind().label(),
                request.target().id(),
                error.code().urn(),
                error.getMessage());
        notifier.notify(
                "onFragmentRejected",
                listener -> listener.onFragmentRejected(new ExpansionListener.FragmentRejectedEvent(
                        request.macroName(),
                        request.kind().label(),
                        request.target().id().value(),
                        error.code().urn(),
                        error.getMessage())));
    }
}
