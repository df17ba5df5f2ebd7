package org.clausewitz.cwt.analysis;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.clausewitz.cwt.error.Diagnostic;
import org.clausewitz.cwt.error.DiagnosticCode;
import org.clausewitz.cwt.error.SchemaLoadException;
import org.clausewitz.cwt.parser.ParseResult;
import org.clausewitz.cwt.parser.ParserConfig;
import org.clausewitz.cwt.parser.ScriptParser;
import org.clausewitz.cwt.schema.Schema;
import org.clausewitz.cwt.schema.SchemaRegistry;
import org.clausewitz.cwt.schema.SchemaSource;
import org.clausewitz.cwt.tree.LineIndex;
import org.clausewitz.cwt.validate.CancellationToken;
import org.clausewitz.cwt.validate.CompletionCandidate;
import org.clausewitz.cwt.validate.CompletionEngine;
import org.clausewitz.cwt.validate.SymbolLookup;
import org.clausewitz.cwt.validate.ValidationOutcome;
import org.clausewitz.cwt.validate.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Open documents, their parse trees, the workspace symbol index and the latest diagnostics.
 *
 * <p>Edits are parsed and indexed on the caller thread; validation runs on the store's worker
 * pool. Revisions are drawn while holding the document's monitor, so the installed snapshot of a
 * path always carries the largest revision handed out for it. Validations of one document are chained, so at most one runs at a time per document, and
 * a validation that is overtaken by a newer revision stops at its next checkpoint and publishes
 * nothing. Published diagnostics always belong to exactly one revision of the document.
 *
 * <p>When an edit changes the set of definitions a document declares, the other open documents
 * are revalidated as well, since their references or duplicates may have changed.
 */
public final class AnalysisStore implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(AnalysisStore.class);

    private final SchemaRegistry registry;
    private final AnalysisConfig config;
    private final SymbolIndex symbols = new SymbolIndex();
    private final Map<String, Slot> slots = new ConcurrentHashMap<>();
    private final List<DiagnosticsListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong revisions = new AtomicLong();
    private final ExecutorService executor;
    private volatile boolean closed;

    public AnalysisStore(SchemaRegistry registry, AnalysisConfig config) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.config = Objects.requireNonNull(config, "config");
        this.executor = Executors.newFixedThreadPool(config.parallelism(),
                                                     new ThreadFactoryBuilder().setNameFormat("cwt-analysis-%d")
                                                                               .setDaemon(true)
                                                                               .build());
    }

    public static AnalysisStore create(Schema schema) {
        var registry = new SchemaRegistry();
        registry.install(schema);
        return new AnalysisStore(registry, AnalysisConfig.DEFAULT);
    }

    public void addListener(DiagnosticsListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public Schema schema() {
        return registry.snapshot();
    }

    /**
     * Open a document, or replace its text if it is already open.
     *
     * @return the new revision
     */
    public long open(String path, String text) {
        return update(path, text);
    }

    /**
     * Replace the full text of an open document.
     *
     * @return the new revision
     */
    public long change(String path, String text) {
        Preconditions.checkArgument(slots.containsKey(path), "Document is not open: %s", path);
        return update(path, text);
    }

    /**
     * Forget a document. A validation in flight for it is abandoned.
     */
    public void close(String path) {
        ensureOpen();
        var slot = slots.remove(path);
        if (slot == null) {
            return;
        }
        synchronized (slot) {
            slot.closed = true;
        }
        LOG.debug("Closed {}", path);
        if (symbols.remove(path)) {
            revalidateAllExcept(path);
        }
    }

    /**
     * Diagnostics of the current revision, waiting for its validation if needed. Unknown paths
     * have none.
     */
    public List<Diagnostic> diagnostics(String path) {
        while (true) {
            ensureOpen();
            var slot = slots.get(path);
            if (slot == null) {
                return List.of();
            }
            CompletableFuture<Published> pending;
            long revision;
            synchronized (slot) {
                pending = slot.pending;
                revision = slot.document.revision();
            }
            var result = pending.join();
            if (result != null && result.revision() == revision) {
                return result.diagnostics();
            }
            // overtaken by a newer revision; wait for that one
        }
    }

    /**
     * Latest published diagnostics without waiting; they may belong to an older revision.
     */
    public List<Diagnostic> publishedDiagnostics(String path) {
        var slot = slots.get(path);
        if (slot == null) {
            return List.of();
        }
        synchronized (slot) {
            return slot.published == null ? List.of() : slot.published.diagnostics();
        }
    }

    public Optional<Document> document(String path) {
        var slot = slots.get(path);
        if (slot == null) {
            return Optional.empty();
        }
        synchronized (slot) {
            return Optional.of(slot.document);
        }
    }

    /**
     * The live symbol index, for validating text outside the store against the open workspace.
     */
    public SymbolLookup symbolLookup() {
        return symbols;
    }

    public List<SymbolLocation> symbols(String type) {
        return symbols.definitions(type);
    }

    public List<SymbolLocation> lookup(String type, String name) {
        return symbols.lookup(type, name);
    }

    /**
     * Completion candidates at a 1-based line and column of an open document.
     */
    public List<CompletionCandidate> completions(String path, int line, int column) {
        return document(path).map(document -> new CompletionEngine(registry.snapshot(), symbols)
                                 .complete(document.root(),
                                           path,
                                           LineIndex.of(document.text())
                                                    .offsetOf(line, column)))
                             .orElse(List.of());
    }

    /**
     * Load many documents at once: parse and index all of them in parallel, then validate all of
     * them, so that cross-file references resolve regardless of load order.
     *
     * @return diagnostics per path, sorted by path
     */
    public Map<String, List<Diagnostic>> scan(Map<String, String> files) {
        ensureOpen();
        long started = System.nanoTime();
        var schema = registry.snapshot();
        var parsing = new ArrayList<CompletableFuture<Parsed>>();
        files.forEach((path, text) -> parsing.add(CompletableFuture.supplyAsync(() -> parse(schema, path, text),
                                                                                executor)));
        boolean declarationsChanged = false;
        for (var future : parsing) {
            var parsed = future.join();
            var slot = slots.computeIfAbsent(parsed.path(), p -> new Slot());
            synchronized (slot) {
                slot.document = parsed.at(revisions.incrementAndGet());
                slot.closed = false;
                declarationsChanged |= symbols.replace(parsed.path(), parsed.symbols());
            }
        }
        for (var path : files.keySet()) {
            schedule(slots.get(path));
        }
        if (declarationsChanged) {
            slots.keySet()
                 .stream()
                 .filter(path -> !files.containsKey(path))
                 .forEach(this::revalidate);
        }
        var result = new TreeMap<String, List<Diagnostic>>();
        files.keySet()
             .forEach(path -> result.put(path, diagnostics(path)));
        LOG.info("Scanned {} files in {} ms ({} diagnostics)",
                 files.size(),
                 TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started),
                 result.values()
                       .stream()
                       .mapToInt(List::size)
                       .sum());
        return result;
    }

    /**
     * Load and install a new schema, then re-index and revalidate every open document.
     *
     * @throws SchemaLoadException if the schema does not load; the store keeps the current one
     */
    public void reloadSchema(List<SchemaSource> sources) throws SchemaLoadException {
        ensureOpen();
        registry.load(sources);
        reindex();
    }

    public void reloadSchema(Schema schema) {
        ensureOpen();
        registry.install(schema);
        reindex();
    }

    /**
     * Stop the worker pool. Validations in flight are abandoned.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        executor.shutdownNow();
        LOG.info("Analysis store closed with {} open documents", slots.size());
    }

    private long update(String path, String text) {
        ensureOpen();
        var parsed = parse(registry.snapshot(), path, text);
        var slot = slots.computeIfAbsent(path, p -> new Slot());
        Document document;
        boolean declarationsChanged;
        // the new revision and its validation become visible together
        synchronized (slot) {
            document = parsed.at(revisions.incrementAndGet());
            slot.document = document;
            slot.closed = false;
            declarationsChanged = symbols.replace(path, document.symbols());
            schedule(slot);
        }
        LOG.debug("{} at revision {}", path, document.revision());
        if (declarationsChanged) {
            revalidateAllExcept(path);
        }
        return document.revision();
    }

    private Parsed parse(Schema schema, String path, String text) {
        var parse = ScriptParser.parse(text, ParserConfig.DEFAULT);
        return new Parsed(path, text, parse, SymbolExtractor.extract(schema, symbols, path, parse.root()));
    }

    private void reindex() {
        var schema = registry.snapshot();
        var indexed = new HashMap<String, Document>();
        var extracted = new HashMap<String, List<SymbolLocation>>();
        slots.forEach((path, slot) -> {
            Document document;
            synchronized (slot) {
                document = slot.document;
            }
            indexed.put(path, document);
            extracted.put(path, SymbolExtractor.extract(schema, symbols, path, document.root()));
        });
        symbols.replaceAll(extracted);
        slots.forEach((path, slot) -> {
            synchronized (slot) {
                var document = slot.document;
                var declared = extracted.get(path);
                if (indexed.get(path) != document) {
                    // edited or opened while the index was rebuilt
                    declared = SymbolExtractor.extract(schema, symbols, path, document.root());
                    symbols.replace(path, declared);
                }
                slot.document = document.withRevision(revisions.incrementAndGet(), declared);
            }
        });
        LOG.info("Revalidating {} documents against schema generation {}", slots.size(), schema.generation());
        slots.values()
             .forEach(this::schedule);
    }

    private void revalidateAllExcept(String path) {
        slots.keySet()
             .stream()
             .filter(other -> !other.equals(path))
             .forEach(this::revalidate);
    }

    private void revalidate(String path) {
        var slot = slots.get(path);
        if (slot == null) {
            return;
        }
        synchronized (slot) {
            slot.document = slot.document.withRevision(revisions.incrementAndGet(), slot.document.symbols());
            schedule(slot);
        }
    }

    private CompletableFuture<Published> schedule(Slot slot) {
        synchronized (slot) {
            var document = slot.document;
            var validator = new Validator(registry.snapshot(), symbols, config.localisation(), config.validator());
            CancellationToken token = () -> closed || slot.isStale(document.revision());
            slot.pending = slot.pending.handle((previous, failure) -> document)
                                       .thenApplyAsync(d -> validate(d, validator, token), executor)
                                       .thenApply(outcome -> publish(slot, document, outcome));
            return slot.pending;
        }
    }

    private ValidationOutcome validate(Document document, Validator validator, CancellationToken token) {
        var outcome = validator.validateFile(document.root(), document.path(), token);
        if (outcome.isCancelled()) {
            LOG.debug("Discarded stale validation of {} at revision {}", document.path(), document.revision());
            return outcome;
        }
        var all = new ArrayList<>(document.parse()
                                          .diagnostics());
        all.addAll(outcome.diagnostics());
        all.addAll(duplicates(document, validator.schema()));
        all.sort(Comparator.comparing(d -> d.span()
                                            .start()));
        return new ValidationOutcome.Completed(all);
    }

    private List<Diagnostic> duplicates(Document document, Schema schema) {
        var result = new ArrayList<Diagnostic>();
        for (var symbol : document.symbols()) {
            var unique = schema.type(symbol.type())
                               .map(t -> t.unique())
                               .orElse(false);
            if (!unique) {
                continue;
            }
            var declarations = symbols.lookup(symbol.type(), symbol.name());
            if (declarations.size() < 2) {
                continue;
            }
            var diagnostic = Diagnostic.error(DiagnosticCode.DUPLICATE_DEFINITION,
                                              symbol.type() + " '" + symbol.name() + "' is defined "
                                              + declarations.size() + " times",
                                              symbol.span())
                                       .withLabel("defined here")
                                       .withDetail("type", symbol.type())
                                       .withDetail("name", symbol.name())
                                       .withDetail("count", declarations.size());
            for (var other : declarations) {
                if (other == symbol) {
                    continue;
                }
                if (other.path()
                         .equals(document.path())) {
                    diagnostic = diagnostic.withSecondaryLabel(other.span(), "also defined here");
                } else {
                    diagnostic = diagnostic.withNote("also defined in " + other.path() + " at "
                                                     + other.span()
                                                            .start());
                }
            }
            diagnostic = diagnostic.withHelp("rename or remove all but one " + symbol.type() + " '" + symbol.name() + "'");
            result.add(diagnostic);
        }
        return result;
    }

    private Published publish(Slot slot, Document document, ValidationOutcome outcome) {
        if (outcome.isCancelled()) {
            return null;
        }
        Published published;
        synchronized (slot) {
            if (slot.isStale(document.revision())) {
                return null;
            }
            published = new Published(document.revision(), outcome.diagnostics());
            slot.published = published;
        }
        for (var listener : listeners) {
            listener.published(document.path(), published.revision(), published.diagnostics());
        }
        return published;
    }

    private void ensureOpen() {
        Preconditions.checkState(!closed, "Analysis store is closed");
    }

    private record Published(long revision, List<Diagnostic> diagnostics) {}

    /**
     * A parsed and indexed text still waiting for its revision.
     */
    private record Parsed(String path, String text, ParseResult parse, List<SymbolLocation> symbols) {
        Document at(long revision) {
            return new Document(path, text, revision, parse, symbols);
        }
    }

    /**
     * Per-document state. Guarded by its own monitor.
     */
    private static final class Slot {
        Document document;
        CompletableFuture<Published> pending = CompletableFuture.completedFuture(null);
        Published published;
        boolean closed;

        synchronized boolean isStale(long revision) {
            return closed || document.revision() != revision;
        }
    }
}
