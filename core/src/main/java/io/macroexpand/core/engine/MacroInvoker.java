package io.macroexpand.core.engine;

import io.macroexpand.core.error.MacroImplementationException;
import io.macroexpand.core.model.ExpansionRequest;
import io.macroexpand.core.model.ExpansionResult;
import io.macroexpand.core.model.Fragment;
import io.macroexpand.core.spi.ExpansionContext;
import io.macroexpand.core.spi.ExpansionFunction;
import io.macroexpand.core.spi.ExpansionListener;
import io.macroexpand.core.spi.MacroExpansionFailure;
import io.macroexpand.core.syntax.Accessor;
import io.macroexpand.core.syntax.Attribute;
import io.macroexpand.core.syntax.Declaration;
import io.macroexpand.core.syntax.SourceLocation;
import io.macroexpand.core.syntax.TypeDecl;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Calls the expansion function matching a request's role.
 *
 * <p>
 * The macro sees only the attribute, the declaration snapshot and its context. Anything it throws
 * is caught here and rethrown as a {@link MacroImplementationException} located at the attribute
 * (or at the location carried by a {@link MacroExpansionFailure}). An invocation that reported an
 * error through its context yields no fragments.
 *
 * <p>
 * Stateless and thread-safe.
 */
public final class MacroInvoker {

    private static final Logger LOG = LoggerFactory.getLogger(MacroInvoker.class);

    private final ListenerNotifier notifier;

    public MacroInvoker() {
        this(ListenerNotifier.NONE);
    }

    MacroInvoker(ListenerNotifier notifier) {
        this.notifier = notifier;
    }

    /**
     * Runs the macro for {@code request}.
     *
     * @return the produced fragments in the order the macro returned them
     * @throws MacroImplementationException if the macro body throws
     */
    public ExpansionResult invoke(ExpansionRequest request) {
        ExpansionFunction function = request.occurrence()
                .macro()
                .function(request.kind())
                .orElseThrow(() -> new IllegalStateException(
                        "Macro '" + request.macroName() + "' has no function for role " + request.kind()));
        Attribute attribute = request.occurrence().attribute();
        ExpansionContext context = request.context();

        long start = System.nanoTime();
        List<Fragment> fragments;
        try {
            fragments = dispatch(function, request, attribute, context);
        } catch (MacroExpansionFailure e) {
            SourceLocation location = e.location() != null ? e.location() : attribute.location();
            throw failure(request, e.getMessage(), e, location);
        } catch (RuntimeException e) {
            throw failure(request, e.getClass().getSimpleName() + ": " + e.getMessage(), e, attribute.location());
        }
        long durationMicros = (System.nanoTime() - start) / 1_000;

        if (context.hasErrors()) {
            LOG.debug(
                    "Macro reported an error, discarding output: macro={}, role={}, target={}",
                    request.macroName(),
                    request.kind().label(),
                    request.target().id());
            fragments = List.of();
        }

        int produced = fragments.size();
        LOG.debug(
                "expansion.invoked macro={} role={} target={} fragments={} durationMicros={}",
                request.macroName(),
                request.kind().label(),
                request.target().id(),
                produced,
                durationMicros);
        notifier.notify(
                "onExpansionInvoked",
                listener -> listener.onExpansionInvoked(new ExpansionListener.ExpansionInvokedEvent(
                        request.macroName(),
                        request.kind().label(),
                        request.target().id().value(),
                        produced,
                        durationMicros)));
        return new ExpansionResult(request, fragments);
    }

    private static List<Fragment> dispatch(
            ExpansionFunction function, ExpansionRequest request, Attribute attribute, ExpansionContext context) {
        Declaration target = request.target();
        if (function instanceof ExpansionFunction.PeerRole peer) {
            return declarations(peer.expander().expandPeers(attribute, target, context));
        } else if (function instanceof ExpansionFunction.MemberRole member) {
            return declarations(member.expander().expandMembers(attribute, asType(target), context));
        } else if (function instanceof ExpansionFunction.AccessorRole accessor) {
            return accessors(accessor.expander().expandAccessors(attribute, target, context));
        } else if (function instanceof ExpansionFunction.MemberAttributeRole memberAttribute) {
            TypeDecl type = asType(target);
            List<Fragment> fragments = new ArrayList<>();
            for (Declaration member : type.members()) {
                if (!request.affectedMembers().contains(member.id())) {
                    continue;
                }
                List<Attribute> added =
                        memberAttribute.expander().expandMemberAttributes(attribute, type, member, context);
                if (added != null) {
                    for (Attribute produced : added) {
                        fragments.add(new Fragment.AttributeFragment(
                                member.id(), Objects.requireNonNull(produced, "macro returned a null attribute")));
                    }
                }
            }
            return fragments;
        }
        throw new IllegalStateException("Unsupported expansion function: " + function);
    }

    private static List<Fragment> declarations(List<Declaration> produced) {
        if (produced == null) {
            return List.of();
        }
        List<Fragment> fragments = new ArrayList<>(produced.size());
        for (Declaration declaration : produced) {
            fragments.add(new Fragment.DeclarationFragment(
                    Objects.requireNonNull(declaration, "macro returned a null declaration")));
        }
        return fragments;
    }

    private static List<Fragment> accessors(List<Accessor> produced) {
        if (produced == null) {
            return List.of();
        }
        List<Fragment> fragments = new ArrayList<>(produced.size());
        for (Accessor accessor : produced) {
            fragments.add(new Fragment.AccessorFragment(
                    Objects.requireNonNull(accessor, "macro returned a null accessor")));
        }
        return fragments;
    }

    private static TypeDecl asType(Declaration target) {
        if (target instanceof TypeDecl type) {
            return type;
        }
        throw new IllegalStateException("Declaration '" + target.id() + "' is not a type or extension");
    }

    private static MacroImplementationException failure(
            ExpansionRequest request, String detail, Throwable cause, SourceLocation location) {
        return new MacroImplementationException(
                "Macro '" + request.macroName() + "' failed during " + request.kind().label() + " expansion of '"
                        + request.target().name() + "': " + detail,
                cause,
                request.macroName(),
                location);
    }
}
