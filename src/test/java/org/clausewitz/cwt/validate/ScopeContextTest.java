package org.clausewitz.cwt.validate;

import org.clausewitz.cwt.error.SchemaLoadException;
import org.clausewitz.cwt.schema.Schema;
import org.clausewitz.cwt.schema.SchemaLoader;
import org.clausewitz.cwt.schema.SchemaSource;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ScopeContextTest {

    @Test
    void definitionScopeBindsThisAndRoot() {
        var scope = ScopeContext.of("Country");

        assertEquals(Optional.of("country"), scope.current());
        assertEquals(Optional.of("country"), scope.resolve("root"));
        assertEquals(Optional.empty(), scope.resolve("from"));
    }

    @Test
    void pushShiftsPreviousScopes() {
        var scope = ScopeContext.of("country")
                                .push("planet")
                                .push("pop");

        assertEquals(Optional.of("pop"), scope.current());
        assertEquals(Optional.of("planet"), scope.resolve("prev"));
        assertEquals(Optional.of("country"), scope.resolve("prevprev"));
        assertEquals(Optional.of("country"), scope.resolve("root"));
    }

    @Test
    void replaceRebindsNamedScopes() {
        var scope = ScopeContext.of("country")
                                .replace(Map.of("from", "planet", "this", "fleet"));

        assertEquals(Optional.of("fleet"), scope.current());
        assertEquals(Optional.of("planet"), scope.resolve("FROM"));
        assertSame(scope, scope.replace(Map.of()));
    }

    @Test
    void resolvesDottedPaths() {
        var scope = ScopeContext.of(Map.of("this", "pop", "root", "country", "from", "planet"));

        assertEquals(Optional.of("country"), scope.resolve("from.root"));
        assertEquals(Optional.of("planet"), scope.resolve("from.this"));
        assertEquals(Optional.empty(), scope.resolve("root.from"));
        assertEquals(Optional.empty(), scope.resolve("root.prev"));
        assertEquals(Optional.empty(), scope.resolve("root.owner"));
        assertEquals(Optional.empty(), scope.resolve("event_target:capital"));
        assertTrue(ScopeContext.isScopeKeyword("event_target:capital"));
        assertFalse(ScopeContext.isScopeKeyword("owner"));
    }

    @Test
    void followsDeclaredLinks() throws SchemaLoadException {
        var schema = SchemaLoader.load(SchemaSource.of("links.cwt", """
            links = {
                owner = { input_scopes = { planet fleet } output_scope = country }
                capital = { input_scopes = { country } output_scope = planet }
                event_target = { prefix = "event_target:" from_data = yes }
            }
            """));
        var scope = ScopeContext.of(Map.of("this", "planet", "root", "country"));

        assertEquals(Optional.of("country"), scope.resolve("owner", schema));
        assertEquals(Optional.of("planet"), scope.resolve("owner.capital", schema));
        assertEquals(Optional.of("country"), scope.resolve("owner.this", schema));
        assertEquals(Optional.of("planet"), scope.resolve("root.capital", schema));
        assertEquals(Optional.of("any"), scope.resolve("event_target:home", schema));
        assertEquals(Optional.empty(), scope.resolve("owner.controller", schema));
        assertTrue(scope.misusedLink("owner.capital", schema).isEmpty());

        assertTrue(ScopeContext.isScopePath("root.owner.capital", schema));
        assertFalse(ScopeContext.isScopePath("root.controller", schema));
        assertFalse(ScopeContext.isScopePath("owner.", schema));
        assertFalse(ScopeContext.isScopePath("owner", Schema.EMPTY));
    }

    @Test
    void reportsLinkFollowedFromAScopeItDoesNotAccept() throws SchemaLoadException {
        var schema = SchemaLoader.load(SchemaSource.of("links.cwt", """
            links = {
                owner = { input_scopes = { planet fleet } output_scope = country }
                capital = { input_scopes = { country } output_scope = planet }
            }
            """));
        var scope = ScopeContext.of("country");

        var misuse = scope.misusedLink("capital.owner.owner", schema)
                          .orElseThrow();
        assertEquals("owner", misuse.segment());
        assertEquals("country", misuse.scope());
        assertEquals(List.of("planet", "fleet"), misuse.link().inputScopes());
        assertTrue(ScopeContext.UNKNOWN.misusedLink("capital", schema).isEmpty());
    }

    @Test
    void unknownScopeAllowsEverything() {
        assertTrue(ScopeContext.UNKNOWN.allows(List.of("planet")));
        assertTrue(ScopeContext.of("any")
                               .allows(List.of("planet")));
        assertTrue(ScopeContext.of("country")
                               .allows(List.of("planet", "any")));
        assertFalse(ScopeContext.of("country")
                                .allows(List.of("planet")));
    }

    @Test
    void equalityFollowsBindings() {
        assertEquals(ScopeContext.of("country"), ScopeContext.of(Map.of("this", "country", "root", "country")));
        assertNotEquals(ScopeContext.of("country"), ScopeContext.of("planet"));
    }
}
