package io.macroexpand.core.engine;

import io.macroexpand.core.config.ExpansionConfig;
import io.macroexpand.core.error.ManifestParseException;
import io.macroexpand.core.error.MacroRegistrationException;
import io.macroexpand.core.manifest.MacroImplementationRegistry;
import io.macroexpand.core.manifest.MacroManifestParser;
import io.macroexpand.core.model.ExpansionOutcome;
import io.macroexpand.core.model.MacroDefinition;
import io.macroexpand.core.spi.ExpansionListener;
import io.macroexpand.core.spi.MacroImplementation;
import io.macroexpand.core.syntax.SyntaxTree;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Entry point for compilation drivers: registers macros, then expands one compilation unit at a
 * time.
 *
 * <p>
 * One engine serves one compilation run. Registration is expected to finish before the first
 * {@link #expand} call; definitions are read-only from then on. Generated unique names come from
 * one allocator per engine, so they are unique across every unit the engine expands.
 *
 * <p>
 * Expansion-time problems never escape {@link #expand}; they are returned as diagnostics in the
 * {@link ExpansionOutcome}. Registration problems are thrown to the caller as
 * {@link MacroRegistrationException}s.
 *
 * <p>
 * With {@code parallelism > 1} the engine owns a worker pool; {@link #close()} shuts it down.
 */
public final class MacroExpansionEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(MacroExpansionEngine.class);

    /** MDC key holding the compilation unit name during {@link #expand}. */
    public static final String MDC_UNIT = "unit";

    private final ExpansionConfig config;
    private final MacroManifestParser manifestParser;
    private final ListenerNotifier notifier;
    private final RoleRegistry registry;
    private final UniqueNameAllocator allocator = new UniqueNameAllocator();
    private final ExecutorService workers; // null when running on the calling thread
    private final ExpansionScheduler scheduler;

    /** Creates an engine with default configuration, no manifests and no listener. */
    public MacroExpansionEngine() {
        this(ExpansionConfig.defaults());
    }

    public MacroExpansionEngine(ExpansionConfig config) {
        this(config, new MacroManifestParser(new MacroImplementationRegistry()), null);
    }

    /**
     * Creates an engine with all options.
     *
     * @param config         engine settings
     * @param manifestParser parser used by {@link #loadManifest}, bound to an implementation registry
     * @param listener       optional listener for expansion lifecycle events, may be {@code null}
     */
    public MacroExpansionEngine(
            ExpansionConfig config, MacroManifestParser manifestParser, ExpansionListener listener) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.manifestParser = Objects.requireNonNull(manifestParser, "manifestParser must not be null");
        this.notifier = new ListenerNotifier(listener);
        this.registry = new RoleRegistry(notifier);
        this.workers = config.parallelism() > 1
                ? Executors.newFixedThreadPool(config.parallelism(), new WorkerThreadFactory())
                : null;
        this.scheduler = new ExpansionScheduler(
                new AttributeResolver(registry, config.builtinAttributes()),
                new MacroInvoker(notifier),
                new NameHygieneValidator(allocator, notifier),
                new DependencyCycleDetector(),
                allocator,
                config.maxFeedbackIterations(),
                workers != null ? workers : Runnable::run,
                notifier);
    }

    /**
     * Registers a macro definition.
     *
     * @throws MacroRegistrationException if the definition is invalid or already registered
     */
    public void register(MacroDefinition definition) {
        registry.register(definition);
    }

    /** Makes an implementation available to manifests loaded afterwards. */
    public void registerImplementation(MacroImplementation implementation) {
        manifestParser.implementations().register(implementation);
    }

    /**
     * Loads a YAML manifest and registers every macro it declares. Nothing is registered if the
     * manifest fails to parse.
     *
     * @return the registered definitions, in manifest order
     * @throws ManifestParseException     if the manifest is malformed
     * @throws MacroRegistrationException if a definition is invalid or already registered
     */
    public List<MacroDefinition> loadManifest(Path manifestPath) {
        List<MacroDefinition> definitions = manifestParser.parse(manifestPath);
        for (MacroDefinition definition : definitions) {
            registry.register(definition, manifestPath.toString());
        }
        LOG.info("manifest.loaded path={} macros={}", manifestPath, definitions.size());
        return definitions;
    }

    /**
     * Expands every attached macro in {@code tree}.
     *
     * @param unitName name of the compilation unit, used in logs and reports
     * @param tree     the unit's declaration tree as produced by the parser
     * @return the final tree and every diagnostic, in emission order
     */
    public ExpansionOutcome expand(String unitName, SyntaxTree tree) {
        Objects.requireNonNull(tree, "tree must not be null");
        MDC.put(MDC_UNIT, unitName);
        try {
            long start = System.nanoTime();
            DiagnosticSink sink = new DiagnosticSink();
            SyntaxTree expanded = scheduler.expandUnit(unitName, tree, sink);
            ExpansionOutcome outcome = new ExpansionOutcome(expanded, sink.diagnostics());
            LOG.info(
                    "Expansion complete: unit={}, declarations={}, diagnostics={}, errors={}, durationMs={}",
                    unitName,
                    expanded.declarations().size(),
                    outcome.diagnostics().size(),
                    outcome.hasErrors(),
                    (System.nanoTime() - start) / 1_000_000);
            return outcome;
        } finally {
            MDC.remove(MDC_UNIT);
        }
    }

    public RoleRegistry registry() {
        return registry;
    }

    public ExpansionConfig config() {
        return config;
    }

    @Override
    public void close() {
        if (workers == null) return;
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "macro-expand-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
