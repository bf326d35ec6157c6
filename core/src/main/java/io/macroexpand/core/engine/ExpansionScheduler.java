package io.macroexpand.core.engine;

import io.macroexpand.core.error.DependencyCycleException;
import io.macroexpand.core.error.MacroExpansionException;
import io.macroexpand.core.error.MacroImplementationException;
import io.macroexpand.core.error.NonterminatingExpansionException;
import io.macroexpand.core.model.AttributeOccurrence;
import io.macroexpand.core.model.Diagnostic;
import io.macroexpand.core.model.ExpansionRequest;
import io.macroexpand.core.model.ExpansionResult;
import io.macroexpand.core.model.Fragment;
import io.macroexpand.core.model.OccurrenceKey;
import io.macroexpand.core.model.Resolution;
import io.macroexpand.core.model.RoleKind;
import io.macroexpand.core.model.RoleSpec;
import io.macroexpand.core.spi.ExpansionListener;
import io.macroexpand.core.syntax.Attribute;
import io.macroexpand.core.syntax.DeclId;
import io.macroexpand.core.syntax.Declaration;
import io.macroexpand.core.syntax.SyntaxTree;
import io.macroexpand.core.syntax.TypeDecl;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Orders and runs expansions for one compilation unit.
 *
 * <p>
 * The unit is processed in batches, one per top-level declaration, in source order. Peers produced
 * next to a top-level declaration become top-level declarations themselves and are processed as
 * later batches. Each batch works on its own copy of the tree and is committed only if it
 * finishes; a dependency cycle or nontermination discards the batch and leaves the committed tree
 * untouched.
 *
 * <p>
 * Within a batch the scheduler iterates to a fixed point. Every pass:
 * <ol>
 * <li>resolves new attribute occurrences in the batch's subtree, in pre-order;
 * <li>runs member-attribute roles for members that have not received their output yet, and
 * starts over if that changed any attribute list;
 * <li>collects the pending member, peer and accessor expansions, checks them for repeated states
 * and dependency cycles, and runs them in dependency waves.
 * </ol>
 * A pass that finds nothing pending ends the batch. The number of passes is bounded by
 * {@code maxFeedbackIterations}.
 *
 * <p>
 * The same {@code maxFeedbackIterations} value also bounds peer generations: a top-level
 * declaration that descends from more than that many chained peer expansions is reported as
 * nonterminating instead of starting another batch. There is no separate setting for this limit.
 *
 * <p>
 * Within a wave, each declaration's requests run sequentially in role order
 * ({@code memberAttribute -> member -> peer -> accessor}) and then source order; different
 * declarations may run concurrently on the executor. Results are merged on the calling thread in
 * pre-order, so the merged tree does not depend on the executor.
 */
public final class ExpansionScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(ExpansionScheduler.class);

    private final AttributeResolver resolver;
    private final MacroInvoker invoker;
    private final NameHygieneValidator validator;
    private final DependencyCycleDetector cycleDetector;
    private final UniqueNameAllocator allocator;
    private final int maxFeedbackIterations;
    private final Executor executor;
    private final ListenerNotifier notifier;

    public ExpansionScheduler(
            AttributeResolver resolver,
            MacroInvoker invoker,
            NameHygieneValidator validator,
            DependencyCycleDetector cycleDetector,
            UniqueNameAllocator allocator,
            int maxFeedbackIterations,
            Executor executor) {
        this(resolver, invoker, validator, cycleDetector, allocator, maxFeedbackIterations, executor,
                ListenerNotifier.NONE);
    }

    ExpansionScheduler(
            AttributeResolver resolver,
            MacroInvoker invoker,
            NameHygieneValidator validator,
            DependencyCycleDetector cycleDetector,
            UniqueNameAllocator allocator,
            int maxFeedbackIterations,
            Executor executor,
            ListenerNotifier notifier) {
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.invoker = Objects.requireNonNull(invoker, "invoker must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.cycleDetector = Objects.requireNonNull(cycleDetector, "cycleDetector must not be null");
        this.allocator = Objects.requireNonNull(allocator, "allocator must not be null");
        this.maxFeedbackIterations = maxFeedbackIterations;
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.notifier = notifier;
    }

    /**
     * Expands every batch of {@code tree} and returns the final tree. Diagnostics are reported to
     * {@code sink} batch by batch.
     */
    public SyntaxTree expandUnit(String unit, SyntaxTree tree, DiagnosticSink sink) {
        UnitState state = new UnitState();
        SyntaxTree committed = tree;
        for (int i = 0; i < committed.declarations().size(); i++) {
            DeclId root = committed.declarations().get(i).id();
            committed = runBatch(unit, committed, root, state, sink);
        }
        return committed;
    }

    private SyntaxTree runBatch(String unit, SyntaxTree committed, DeclId root, UnitState state, DiagnosticSink sink) {
        Batch batch = new Batch(unit, root, state);
        String rootName = committed.qualifiedName(root);
        try {
            int generation = state.generation.getOrDefault(root, 0);
            if (generation > maxFeedbackIterations) {
                Declaration declaration = committed.require(root);
                throw new NonterminatingExpansionException(
                        "Macro expansion does not terminate: '" + rootName + "' is the product of " + generation
                                + " nested top-level expansions, more than the limit of " + maxFeedbackIterations,
                        null,
                        declaration.location());
            }

            SyntaxTree result = batch.run(committed);

            sink.reportAll(batch.diagnostics);
            state.visited.putAll(batch.visited);
            state.produced.addAll(batch.merger.producedIds());
            Set<DeclId> before = committed.declarations().stream()
                    .map(Declaration::id)
                    .collect(Collectors.toSet());
            for (Declaration declaration : result.declarations()) {
                if (!before.contains(declaration.id())) {
                    state.generation.put(declaration.id(), generation + 1);
                }
            }

            LOG.info(
                    "expansion.batch.committed unit={} root={} iterations={} expansions={}",
                    unit,
                    rootName,
                    batch.iterations,
                    batch.expansions);
            int iterations = batch.iterations;
            int expansions = batch.expansions;
            notifier.notify(
                    "onBatchCommitted",
                    listener -> listener.onBatchCommitted(
                            new ExpansionListener.BatchCommittedEvent(unit, rootName, iterations, expansions)));
            return result;
        } catch (DependencyCycleException | NonterminatingExpansionException e) {
            batch.diagnostics.add(e.toDiagnostic());
            sink.reportAll(batch.diagnostics);
            LOG.warn(
                    "expansion.batch.aborted unit={} root={} code={} detail={}",
                    unit,
                    rootName,
                    e.code().urn(),
                    e.getMessage());
            notifier.notify(
                    "onBatchAborted",
                    listener -> listener.onBatchAborted(new ExpansionListener.BatchAbortedEvent(
                            unit, rootName, e.code().urn(), e.getMessage())));
            return committed;
        }
    }

    /** State that outlives a single batch. Only committed batches write to it. */
    private static final class UnitState {
        final Map<StateKey, DeclId> visited = new HashMap<>();
        final Set<DeclId> produced = new HashSet<>();
        final Map<DeclId, Integer> generation = new HashMap<>();
    }

    /** Scope path, signature and attribute fingerprint of a declaration about to be expanded. */
    private record StateKey(List<String> scopePath, String signature, String attributes) {}

    private record ExpandedKey(OccurrenceKey occurrence, RoleKind kind) {}

    private record MemberKey(OccurrenceKey occurrence, DeclId member) {}

    private record RequestOutcome(
            ExpansionRequest request,
            ExpansionResult accepted,
            List<Diagnostic> emitted,
            List<MacroExpansionException> errors) {}

    /** One batch: the subtree of a single top-level declaration. */
    private final class Batch {

        private final String unit;
        private final DeclId root;
        private final UnitState state;
        private final Map<OccurrenceKey, Resolution> resolutions = new HashMap<>();
        private final Set<ExpandedKey> expanded = new HashSet<>();
        private final Set<MemberKey> attributed = new HashSet<>();
        private final List<PendingExpansion> readers = new ArrayList<>();
        private final Map<StateKey, DeclId> visited;
        private final List<Diagnostic> diagnostics = new ArrayList<>();
        private final ResultMerger merger = new ResultMerger();
        private int iterations;
        private int expansions;
        private AttributeOccurrence lastOccurrence;

        Batch(String unit, DeclId root, UnitState state) {
            this.unit = unit;
            this.root = root;
            this.state = state;
            this.visited = new HashMap<>(state.visited);
        }

        SyntaxTree run(SyntaxTree committed) {
            SyntaxTree working = committed;
            for (int iteration = 1; ; iteration++) {
                if (iteration > maxFeedbackIterations) {
                    throw new NonterminatingExpansionException(
                            "Macro expansion of '" + working.qualifiedName(root)
                                    + "' did not reach a fixed point within " + maxFeedbackIterations
                                    + " iterations",
                            lastOccurrence != null ? lastOccurrence.macro().name() : null,
                            lastOccurrence != null
                                    ? lastOccurrence.attribute().location()
                                    : working.require(root).location());
                }
                iterations = iteration;

                List<Resolution.Resolved> resolved = resolveSubtree(working);

                SyntaxTree fed = runMemberAttributes(working, resolved);
                if (fed != working) {
                    working = fed;
                    continue;
                }

                List<PendingExpansion> pending = collectPending(resolved);
                if (pending.isEmpty()) {
                    return working;
                }
                lastOccurrence = pending.get(pending.size() - 1).occurrence();
                checkRepeats(working, pending);
                DependencyGraph graph = cycleDetector.check(working, pending);
                cycleDetector.checkLateProducers(working, readers, pending);

                Map<DeclId, List<PendingExpansion>> byTarget = new LinkedHashMap<>();
                pending.forEach(p -> byTarget.computeIfAbsent(p.target(), k -> new ArrayList<>()).add(p));
                byTarget.values().forEach(list -> list.sort(PendingExpansion.EXECUTION_ORDER));

                for (List<DeclId> wave : graph.waves()) {
                    working = runWave(working, wave, byTarget);
                }
                pending.forEach(p -> expanded.add(new ExpandedKey(p.occurrence().key(), p.kind())));
                pending.stream().filter(p -> !p.role().effectiveReads().isEmpty()).forEach(readers::add);
            }
        }

        // --- Resolution ---

        private List<Resolution.Resolved> resolveSubtree(SyntaxTree tree) {
            List<Resolution.Resolved> resolved = new ArrayList<>();
            for (Declaration declaration : tree.preorder(root)) {
                List<Attribute> attributes = declaration.attributes();
                for (int i = 0; i < attributes.size(); i++) {
                    Attribute attribute = attributes.get(i);
                    if (resolver.isBuiltin(attribute)) {
                        continue;
                    }
                    OccurrenceKey key = new OccurrenceKey(declaration.id(), i, attribute.name());
                    Resolution resolution = resolutions.get(key);
                    if (resolution == null) {
                        resolution = resolver.resolveAttribute(declaration, attribute, i);
                        resolutions.put(key, resolution);
                        if (resolution instanceof Resolution.Failed failed) {
                            recordFailure(tree.qualifiedName(declaration.id()), failed.error());
                        }
                    }
                    if (resolution instanceof Resolution.Resolved success) {
                        resolved.add(success);
                    }
                }
            }
            return resolved;
        }

        private List<PendingExpansion> collectPending(List<Resolution.Resolved> resolved) {
            List<PendingExpansion> pending = new ArrayList<>();
            for (Resolution.Resolved resolution : resolved) {
                for (RoleSpec role : resolution.applicableRoles()) {
                    if (role.kind() == RoleKind.MEMBER_ATTRIBUTE) {
                        continue;
                    }
                    if (!expanded.contains(new ExpandedKey(resolution.occurrence().key(), role.kind()))) {
                        pending.add(new PendingExpansion(resolution.occurrence(), role));
                    }
                }
            }
            return pending;
        }

        // --- Member-attribute feedback ---

        private SyntaxTree runMemberAttributes(SyntaxTree tree, List<Resolution.Resolved> resolved) {
            SyntaxTree current = tree;
            for (Resolution.Resolved resolution : resolved) {
                AttributeOccurrence occurrence = resolution.occurrence();
                RoleSpec role = resolution.applicableRoles().stream()
                        .filter(r -> r.kind() == RoleKind.MEMBER_ATTRIBUTE)
                        .findFirst()
                        .orElse(null);
                if (role == null) {
                    continue;
                }
                TypeDecl type = (TypeDecl) current.require(occurrence.target());
                Set<DeclId> fresh = new LinkedHashSet<>();
                for (Declaration member : type.members()) {
                    if (attributed.add(new MemberKey(occurrence.key(), member.id()))) {
                        fresh.add(member.id());
                    }
                }
                if (fresh.isEmpty()) {
                    continue;
                }
                lastOccurrence = occurrence;
                RequestOutcome outcome = execute(prepare(current, occurrence, role, fresh));
                record(current, outcome);
                checkSelfPropagation(current, occurrence, outcome.accepted());
                current = merger.mergeAttributes(current, outcome.accepted());
            }
            return current;
        }

        /** Rejects a member-attribute result that attaches the expanding macro to a member. */
        private void checkSelfPropagation(SyntaxTree tree, AttributeOccurrence occurrence, ExpansionResult result) {
            for (Fragment fragment : result.fragments()) {
                if (fragment instanceof Fragment.AttributeFragment added
                        && resolver.resolvesTo(added.attribute(), occurrence.macro())) {
                    throw new NonterminatingExpansionException(
                            "Macro expansion does not terminate: @" + occurrence.macro().name() + " on '"
                                    + tree.qualifiedName(occurrence.target()) + "' attaches itself to member '"
                                    + tree.qualifiedName(added.member()) + "'",
                            occurrence.macro().name(),
                            occurrence.attribute().location());
                }
            }
        }

        // --- Expansion waves ---

        private void checkRepeats(SyntaxTree tree, List<PendingExpansion> pending) {
            Set<DeclId> targets = new LinkedHashSet<>();
            pending.forEach(p -> targets.add(p.target()));
            for (DeclId id : targets) {
                Declaration declaration = tree.require(id);
                String fingerprint = declaration.attributes().stream()
                        .map(Attribute::render)
                        .collect(Collectors.joining(" "));
                StateKey key = new StateKey(tree.scopePath(id), declaration.signature(), fingerprint);
                DeclId first = visited.putIfAbsent(key, id);
                boolean produced = merger.isProduced(id) || state.produced.contains(id);
                if (first != null && !first.equals(id) && produced) {
                    PendingExpansion culprit = pending.stream()
                            .filter(p -> p.target().equals(id))
                            .findFirst()
                            .orElseThrow();
                    throw new NonterminatingExpansionException(
                            "Macro expansion does not terminate: '" + tree.qualifiedName(id) + "' with attributes ["
                                    + fingerprint + "] repeats the state of declaration " + first,
                            culprit.occurrence().macro().name(),
                            culprit.occurrence().attribute().location());
                }
            }
        }

        private SyntaxTree runWave(
                SyntaxTree snapshot, List<DeclId> wave, Map<DeclId, List<PendingExpansion>> byTarget) {
            List<CompletableFuture<List<RequestOutcome>>> tasks = new ArrayList<>(wave.size());
            for (DeclId target : wave) {
                List<ExpansionRequest> requests = byTarget.get(target).stream()
                        .map(p -> prepare(snapshot, p.occurrence(), p.role(), Set.of()))
                        .toList();
                tasks.add(CompletableFuture.supplyAsync(
                        withMdc(() -> requests.stream().map(ExpansionScheduler.this::execute).toList()),
                        executor));
            }

            SyntaxTree current = snapshot;
            for (CompletableFuture<List<RequestOutcome>> task : tasks) {
                for (RequestOutcome outcome : join(task)) {
                    record(current, outcome);
                    current = merger.merge(current, outcome.accepted());
                    expansions++;
                }
            }
            return current;
        }

        private ExpansionRequest prepare(
                SyntaxTree snapshot, AttributeOccurrence occurrence, RoleSpec role, Set<DeclId> affected) {
            DeclId id = occurrence.target();
            DefaultExpansionContext context = new DefaultExpansionContext(
                    allocator, snapshot.scopePath(id), occurrence.attribute().location(), occurrence.macro().name());
            return new ExpansionRequest(
                    occurrence, role, snapshot.require(id), snapshot.parentOf(id).orElse(null), affected, context);
        }

        // --- Diagnostics ---

        private void record(SyntaxTree tree, RequestOutcome outcome) {
            diagnostics.addAll(outcome.emitted());
            for (MacroExpansionException error : outcome.errors()) {
                diagnostics.add(error.toDiagnostic());
                if (error instanceof MacroImplementationException) {
                    recordFailureEvent(tree.qualifiedName(outcome.request().target().id()), error);
                }
            }
        }

        private void recordFailure(String target, MacroExpansionException error) {
            diagnostics.add(error.toDiagnostic());
            recordFailureEvent(target, error);
        }

        private void recordFailureEvent(String target, MacroExpansionException error) {
            LOG.warn(
                    "Expansion failed: unit={}, macro={}, target={}, code={}, detail={}",
                    unit,
                    error.macroName(),
                    target,
                    error.code().urn(),
                    error.getMessage());
            notifier.notify(
                    "onExpansionFailed",
                    listener -> listener.onExpansionFailed(new ExpansionListener.ExpansionFailedEvent(
                            error.macroName(), target, error.code().urn(), error.getMessage())));
        }
    }

    // --- Request execution (runs on worker threads) ---

    private RequestOutcome execute(ExpansionRequest request) {
        DefaultExpansionContext context = (DefaultExpansionContext) request.context();
        try {
            ExpansionResult result = invoker.invoke(request);
            NameHygieneValidator.Validation validation = validator.validate(result);
            return new RequestOutcome(request, validation.accepted(), context.diagnostics(), validation.rejected());
        } catch (MacroImplementationException e) {
            return new RequestOutcome(request, ExpansionResult.empty(request), context.diagnostics(), List.of(e));
        }
    }

    /** Carries the caller's MDC (the {@code unit} key) onto the worker thread. */
    private static <T> Supplier<T> withMdc(Supplier<T> task) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (context != null) {
                MDC.setContextMap(context);
            }
            try {
                return task.get();
            } finally {
                if (previous != null) {
                    MDC.setContextMap(previous);
                } else {
                    MDC.clear();
                }
            }
        };
    }

    private static <T> T join(CompletableFuture<T> task) {
        try {
            return task.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Expansion task failed", cause);
        }
    }
}
