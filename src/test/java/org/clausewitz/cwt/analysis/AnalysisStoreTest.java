package org.clausewitz.cwt.analysis;

import org.clausewitz.cwt.error.Diagnostic;
import org.clausewitz.cwt.error.DiagnosticCode;
import org.clausewitz.cwt.error.SchemaLoadException;
import org.clausewitz.cwt.schema.SchemaLoader;
import org.clausewitz.cwt.schema.SchemaRegistry;
import org.clausewitz.cwt.schema.SchemaSource;
import org.clausewitz.cwt.validate.CompletionCandidate;
import org.clausewitz.cwt.validate.LocalisationOracle;
import org.clausewitz.cwt.validate.SymbolLookup;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Timeout(30)
class AnalysisStoreTest {
    private static final String A = "common/buildings/a.txt";
    private static final String B = "common/buildings/b.txt";

    private static final SchemaSource SCHEMA = SchemaSource.of("buildings.cwt", """
        types = {
            type[building] = {
                path = "game/common/buildings"
                unique = yes
            }
        }
        building = {
            category = scalar
            ## cardinality = 0..1
            upgrade = <building>
        }
        """);

    private SchemaRegistry registry;
    private AnalysisStore store;

    @BeforeEach
    void setUp() throws SchemaLoadException {
        registry = new SchemaRegistry();
        registry.load(List.of(SCHEMA));
        store = new AnalysisStore(registry, AnalysisConfig.DEFAULT.withParallelism(2));
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private static List<DiagnosticCode> codes(List<Diagnostic> diagnostics) {
        return diagnostics.stream()
                          .map(Diagnostic::code)
                          .toList();
    }

    @Test
    void openValidatesDocument() {
        long revision = store.open(A, "farm = { }");

        assertThat(codes(store.diagnostics(A))).containsExactly(DiagnosticCode.MISSING_REQUIRED_KEY);
        var document = store.document(A)
                            .orElseThrow();
        assertEquals(revision, document.revision());
        assertEquals("farm = { }", document.text());
        assertThat(document.symbols()).extracting(SymbolLocation::name)
                                      .containsExactly("farm");
    }

    @Test
    void changeReplacesDiagnostics() {
        long first = store.open(A, "farm = { }");
        long second = store.change(A, "farm = { category = resource }");

        assertTrue(second > first);
        assertThat(store.diagnostics(A)).isEmpty();
        assertThat(store.publishedDiagnostics(A)).isEmpty();
    }

    @Test
    void syntaxErrorsComeFirstInPositionOrder() {
        store.open(A, """
            farm = {
                category =
            }
            mine = { }
            """);

        var diagnostics = store.diagnostics(A);

        assertThat(codes(diagnostics)).contains(DiagnosticCode.PARSE_ERROR, DiagnosticCode.MISSING_REQUIRED_KEY);
        assertThat(diagnostics).isSortedAccordingTo((x, y) -> x.span()
                                                               .start()
                                                               .compareTo(y.span()
                                                                           .start()));
    }

    @Test
    void referencesResolveAcrossDocuments() {
        store.open(A, "farm = { category = resource upgrade = mine }");
        assertThat(codes(store.diagnostics(A))).containsExactly(DiagnosticCode.UNDEFINED_REFERENCE);

        store.open(B, "mine = { category = resource }");
        assertThat(store.diagnostics(A)).isEmpty();

        store.close(B);
        assertThat(codes(store.diagnostics(A))).containsExactly(DiagnosticCode.UNDEFINED_REFERENCE);
        assertThat(store.diagnostics(B)).isEmpty();
        assertTrue(store.document(B)
                        .isEmpty());
    }

    @Test
    void reportsDuplicateUniqueDefinitionsInEveryDocument() {
        store.open(A, "farm = { category = resource }");
        store.open(B, "\nFARM = { category = food }");

        var inA = store.diagnostics(A);
        var inB = store.diagnostics(B);

        assertThat(inA).singleElement()
                       .satisfies(d -> {
                           assertEquals(DiagnosticCode.DUPLICATE_DEFINITION, d.code());
                           assertEquals("2", d.details()
                                              .get("count"));
                           assertThat(d.notes()).containsExactly("also defined in " + B + " at 2:1",
                                                                 "help: rename or remove all but one building 'farm'");
                           assertThat(d.labels()).singleElement()
                                                 .satisfies(label -> {
                                                     assertTrue(label.primary());
                                                     assertEquals("defined here", label.message());
                                                 });
                       });
        assertThat(codes(inB)).containsExactly(DiagnosticCode.DUPLICATE_DEFINITION);
        assertThat(store.lookup("building", "farm")).hasSize(2);

        store.change(B, "mine = { category = food }");
        assertThat(store.diagnostics(A)).isEmpty();
    }

    @Test
    void duplicatesInOneDocumentPointAtEachOther() {
        store.open(A, "farm = { category = a }\nfarm = { category = b }");

        var diagnostics = store.diagnostics(A);

        assertThat(diagnostics).hasSize(2)
                               .allMatch(d -> d.code() == DiagnosticCode.DUPLICATE_DEFINITION);
        var first = diagnostics.get(0);
        assertEquals(1, first.span()
                             .start()
                             .line());
        assertThat(first.labels()).extracting(Diagnostic.Label::primary)
                                  .containsExactly(true, false);
        assertEquals(2, first.labels()
                             .get(1)
                             .span()
                             .start()
                             .line());
        assertThat(first.notes()).singleElement()
                                 .satisfies(note -> assertTrue(note.startsWith("help: ")));
        assertThat(first.format(store.document(A)
                                     .orElseThrow()
                                     .text(), A)).contains("also defined here");
    }

    @Test
    void concurrentChangesLeaveTheNewestRevisionInstalled() throws Exception {
        store.open(A, "farm = { category = resource }");
        var pool = Executors.newFixedThreadPool(4);
        try {
            var futures = new ArrayList<Future<List<Long>>>();
            for (int t = 0; t < 4; t++) {
                int writer = t;
                futures.add(pool.submit(() -> {
                    var returned = new ArrayList<Long>();
                    for (int i = 0; i < 20; i++) {
                        returned.add(store.change(A, "b" + writer + "_" + i + " = { category = resource }"));
                    }
                    return returned;
                }));
            }
            long newest = 0;
            for (var future : futures) {
                for (long revision : future.get()) {
                    newest = Math.max(newest, revision);
                }
            }

            var document = store.document(A)
                                .orElseThrow();
            assertEquals(newest, document.revision());
            var name = document.text()
                               .substring(0,
                                          document.text()
                                                  .indexOf(' '));
            assertThat(store.symbols("building")).extracting(SymbolLocation::name)
                                                 .containsExactly(name);
            assertThat(store.diagnostics(A)).isEmpty();
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void scanIndexesBeforeValidating() {
        var result = store.scan(Map.of(B, "mine = { category = resource upgrade = farm }",
                                       A, "farm = { category = resource upgrade = quarry }",
                                       "common/buildings/c.txt", "quarry = { category = stone }"));

        assertThat(result.keySet()).containsExactly(A, B, "common/buildings/c.txt");
        assertThat(result.values()).allMatch(List::isEmpty);
        assertThat(store.symbols("building")).extracting(SymbolLocation::name)
                                             .containsExactlyInAnyOrder("farm", "mine", "quarry");
    }

    @Test
    void scanRevalidatesDocumentsAlreadyOpen() {
        store.open(A, "farm = { category = resource upgrade = mine }");
        assertThat(store.diagnostics(A)).hasSize(1);

        store.scan(Map.of(B, "mine = { category = resource }"));

        assertThat(store.diagnostics(A)).isEmpty();
    }

    @Test
    void reloadSchemaRevalidatesOpenDocuments() throws SchemaLoadException {
        store.open(A, "farm = { category = resource level = 3 }");
        assertThat(codes(store.diagnostics(A))).containsExactly(DiagnosticCode.UNEXPECTED_KEY);
        long generation = store.schema()
                               .generation();

        store.reloadSchema(List.of(SchemaSource.of("buildings.cwt", """
            types = { type[building] = { path = "game/common/buildings" } }
            building = {
                category = scalar
                level = int
            }
            """)));

        assertEquals(generation + 1, store.schema()
                                          .generation());
        assertThat(store.diagnostics(A)).isEmpty();
    }

    @Test
    void reloadingTheSchemaNeverPublishesUnresolvedReferences() {
        var unresolved = new CopyOnWriteArrayList<String>();
        store.addListener((path, revision, diagnostics) -> diagnostics.stream()
                                                                      .filter(d -> d.code() == DiagnosticCode.UNDEFINED_REFERENCE)
                                                                      .forEach(d -> unresolved.add(path + "@" + revision)));
        store.open(B, "mine = { category = resource }");
        store.open(A, "farm = { category = resource upgrade = mine }");
        assertThat(store.diagnostics(A)).isEmpty();

        var schema = store.schema();
        for (int i = 0; i < 25; i++) {
            store.reloadSchema(schema);
        }

        assertThat(store.diagnostics(A)).isEmpty();
        assertThat(store.diagnostics(B)).isEmpty();
        assertThat(unresolved).isEmpty();
        assertThat(store.symbols("building")).extracting(SymbolLocation::name)
                                             .containsExactlyInAnyOrder("farm", "mine");
    }

    @Test
    void failedReloadKeepsCurrentSchema() {
        long generation = store.schema()
                               .generation();

        assertThrows(SchemaLoadException.class,
                     () -> store.reloadSchema(List.of(SchemaSource.of("bad.cwt", "single_alias[broken] = enum[missing]"))));

        assertEquals(generation, store.schema()
                                      .generation());
    }

    @Test
    void listenersReceiveEachPublication() {
        var published = new CopyOnWriteArrayList<String>();
        store.addListener((path, revision, diagnostics) -> published.add(path + "@" + revision + ":" + diagnostics.size()));

        long revision = store.open(A, "farm = { }");
        store.diagnostics(A);

        assertThat(published).containsExactly(A + "@" + revision + ":1");
    }

    @Test
    void staleValidationIsNeverPublished() throws Exception {
        var entered = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        LocalisationOracle blocking = key -> {
            if (key.equals("farm")) {
                entered.countDown();
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread()
                          .interrupt();
                }
            }
            return false;
        };
        var schema = SchemaSource.of("buildings.cwt", """
            types = {
                type[building] = {
                    path = "game/common/buildings"
                    localisation = {
                        ## required
                        name = "$"
                    }
                }
            }
            building = {
                category = scalar
            }
            """);
        var localRegistry = new SchemaRegistry();
        localRegistry.load(List.of(schema));
        try (var blockingStore = new AnalysisStore(localRegistry,
                                                   AnalysisConfig.DEFAULT.withParallelism(2)
                                                                         .withLocalisation(blocking))) {
            var revisions = new CopyOnWriteArrayList<Long>();
            blockingStore.addListener((path, revision, diagnostics) -> revisions.add(revision));

            blockingStore.open(A, "farm = { category = resource }\nbarn = { category = resource }");
            assertTrue(entered.await(10, TimeUnit.SECONDS));
            long current = blockingStore.change(A, "mine = { category = resource }");
            release.countDown();

            var diagnostics = blockingStore.diagnostics(A);

            assertThat(diagnostics).singleElement()
                                   .satisfies(d -> assertEquals("mine", d.details()
                                                                         .get("key")));
            assertThat(revisions).containsExactly(current);
        }
    }

    @Test
    void completesAtLineAndColumn() {
        store.open(B, "mine = { category = resource }");
        store.open(A, "farm = {\n    upgrade = m\n}");

        var candidates = store.completions(A, 2, 16);

        assertThat(candidates).extracting(CompletionCandidate::label)
                              .containsExactly("farm", "mine");
        assertThat(store.completions("common/buildings/unknown.txt", 1, 1)).isEmpty();
    }

    @Test
    void unknownPathsHaveNoDiagnostics() {
        assertThat(store.diagnostics("common/buildings/none.txt")).isEmpty();
        assertThat(store.publishedDiagnostics("common/buildings/none.txt")).isEmpty();
    }

    @Test
    void changeRequiresOpenDocument() {
        assertThrows(IllegalArgumentException.class, () -> store.change(A, "farm = { }"));
    }

    @Test
    void closedStoreRejectsOperations() {
        store.open(A, "farm = { }");
        store.close();

        assertThrows(IllegalStateException.class, () -> store.open(B, "mine = { }"));
        assertThrows(IllegalStateException.class, () -> store.diagnostics(A));
        assertThrows(IllegalStateException.class, () -> store.scan(Map.of()));
        store.close();
    }

    @Test
    void collectedEnumMembersAndValueSetsResolveAcrossDocuments() throws SchemaLoadException {
        var schema = SchemaLoader.load(SchemaSource.of("policies.cwt", """
            types = {
                type[policy] = { path = "game/common/policies" }
                type[event] = { path = "game/events" }
            }
            enums = {
                complex_enum[policy_option] = {
                    path = "game/common/policies"
                    name = {
                        option = { name = enum_name }
                    }
                }
            }
            policy = {
                ## cardinality = 0..inf
                option = { name = scalar }
                ## cardinality = 0..inf
                set_flag = value_set[flag]
            }
            event = {
                ## cardinality = 0..inf
                pick = enum[policy_option]
                ## cardinality = 0..inf
                has_flag = value[flag]
            }
            """));
        var policies = "common/policies/trade.txt";
        var events = "events/trade_events.txt";
        try (var workspace = AnalysisStore.create(schema)) {
            workspace.open(events, "e = { pick = tariffs has_flag = visited }");
            assertThat(workspace.diagnostics(events)).isEmpty();

            workspace.open(policies, """
                trade = {
                    option = { name = free_trade }
                    option = { name = tariffs }
                    set_flag = visited
                }
                """);
            assertThat(workspace.diagnostics(events)).isEmpty();
            assertThat(workspace.symbols(SymbolLookup.enumNamespace("policy_option"))).extracting(SymbolLocation::name)
                                                                                   .containsExactlyInAnyOrder("free_trade",
                                                                                                              "tariffs");
            assertThat(workspace.symbols(SymbolLookup.valueSetNamespace("flag"))).singleElement()
                                                                             .satisfies(s -> assertEquals(policies, s.path()));

            workspace.change(events, "e = { pick = mercantilism has_flag = seen }");
            assertThat(codes(workspace.diagnostics(events))).containsExactly(DiagnosticCode.UNKNOWN_ENUM_VALUE,
                                                                            DiagnosticCode.UNDEFINED_REFERENCE);

            workspace.close(policies);
            assertThat(workspace.diagnostics(events)).isEmpty();
        }
    }
}
