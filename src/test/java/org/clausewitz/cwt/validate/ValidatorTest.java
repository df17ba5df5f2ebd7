package org.clausewitz.cwt.validate;

import org.clausewitz.cwt.error.Diagnostic;
import org.clausewitz.cwt.error.Diagnostic.Severity;
import org.clausewitz.cwt.error.DiagnosticCode;
import org.clausewitz.cwt.error.EngineDefectException;
import org.clausewitz.cwt.error.SchemaLoadException;
import org.clausewitz.cwt.parser.ScriptParser;
import org.clausewitz.cwt.schema.Schema;
import org.clausewitz.cwt.schema.SchemaLoader;
import org.clausewitz.cwt.schema.SchemaSource;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ValidatorTest {
    private static final String BUILDINGS = "common/buildings/farm.txt";
    private static final String POLICIES = "common/policies/p.txt";

    private static final String SCHEMA = """
        types = {
            type[building] = {
                path = "game/common/buildings"
                subtype[capital] = {
                    capital = yes
                }
                localisation = {
                    ## required
                    name = "$"
                    desc = "$_desc"
                }
            }
            ## push_scope = country
            type[policy] = {
                path = "game/common/policies"
            }
        }
        enums = {
            enum[category] = { resource manufacturing research }
        }

        alias[effect:add_money] = int
        alias[effect:set_flag] = scalar

        building = {
            category = enum[category]
            ## cardinality = 0..1
            hidden = yes
            ## cardinality = 0..1
            capital = bool
            ## cardinality = 0..1
            cost = int[0..100]
            ## cardinality = 0..1
            upgrade = <building>
            ## cardinality = 0..1
            name_key = localisation
            ## cardinality = 0..1
            on_built = {
                alias_name[effect] = alias_match_left[effect]
            }
            subtype[capital] = {
                capital_bonus = int
            }
            subtype[!capital] = {
                ## cardinality = 0..1
                upkeep = int
            }
        }

        policy = {
            ## scope = planet
            ## cardinality = 0..1
            planet_only = yes
            ## cardinality = 0..1
            ## push_scope = planet
            on_planet = {
                ## scope = planet
                ## cardinality = 0..1
                planet_only = yes
                ## cardinality = 0..1
                owner = scope[country]
            }
            ## cardinality = 0..1
            target = scope[planet]
        }
        """;

    private static Schema load(String text) throws SchemaLoadException {
        return SchemaLoader.load(SchemaSource.of("test.cwt", text));
    }

    private static List<Diagnostic> validate(Validator validator, String path, String script) {
        var parsed = ScriptParser.parse(script);
        assertFalse(parsed.hasErrors(), () -> parsed.diagnostics()
                                                    .toString());
        return validator.validateFile(parsed.root(), path, CancellationToken.NEVER)
                        .diagnostics();
    }

    private static List<Diagnostic> validate(String script) throws SchemaLoadException {
        var validator = new Validator(load(SCHEMA),
                                      SymbolLookup.of(Map.of("building", List.of("farm", "mine"))),
                                      LocalisationOracle.ACCEPT_ALL,
                                      ValidatorConfig.DEFAULT);
        return validate(validator, BUILDINGS, script);
    }

    private static List<DiagnosticCode> codes(List<Diagnostic> diagnostics) {
        return diagnostics.stream()
                          .map(Diagnostic::code)
                          .toList();
    }

    @Test
    void validDefinitionHasNoDiagnostics() throws SchemaLoadException {
        var diagnostics = validate("""
            farm = {
                category = resource
                hidden = yes
                cost = 50
                upgrade = mine
                on_built = {
                    add_money = 10
                    set_flag = farm_built
                }
            }
            """);

        assertThat(diagnostics).isEmpty();
    }

    @Test
    void filesOutsideTypePathsAreNotChecked() throws SchemaLoadException {
        var validator = Validator.of(load(SCHEMA));

        assertThat(validate(validator, "events/e.txt", "farm = { bogus = 1 }")).isEmpty();
    }

    @Test
    void reportsMissingRequiredKeyAtDefinitionKey() throws SchemaLoadException {
        var diagnostics = validate("""
            farm = {
                hidden = yes
            }
            """);

        assertThat(diagnostics).singleElement()
                               .satisfies(d -> {
                                   assertEquals(DiagnosticCode.MISSING_REQUIRED_KEY, d.code());
                                   assertEquals(Severity.ERROR, d.severity());
                                   assertEquals(1, d.span()
                                                    .start()
                                                    .line());
                                   assertEquals("category", d.details()
                                                             .get("key"));
                               });
    }

    @Test
    void unexpectedKeySeverityIsConfigurable() throws SchemaLoadException {
        var script = "farm = { category = resource bogus = 1 }";
        var schema = load(SCHEMA);

        assertThat(validate(Validator.of(schema), BUILDINGS, script)).singleElement()
                                                                     .satisfies(d -> {
                                                                         assertEquals(DiagnosticCode.UNEXPECTED_KEY, d.code());
                                                                         assertEquals(Severity.WARNING, d.severity());
                                                                     });

        var strict = new Validator(schema,
                                   SymbolLookup.EMPTY,
                                   LocalisationOracle.ACCEPT_ALL,
                                   ValidatorConfig.DEFAULT.withUnexpectedKeys(Severity.ERROR));
        assertEquals(Severity.ERROR, validate(strict, BUILDINGS, script).get(0)
                                                                        .severity());

        var quiet = new Validator(schema,
                                  SymbolLookup.EMPTY,
                                  LocalisationOracle.ACCEPT_ALL,
                                  ValidatorConfig.DEFAULT.ignoringUnexpectedKeys());
        assertThat(validate(quiet, BUILDINGS, script)).isEmpty();
    }

    @Test
    void checksLiteralAndRangedValues() throws SchemaLoadException {
        var diagnostics = validate("""
            farm = {
                category = resource
                hidden = no
                cost = 500
            }
            """);

        assertThat(codes(diagnostics)).containsExactly(DiagnosticCode.TYPE_MISMATCH, DiagnosticCode.TYPE_MISMATCH);
        assertEquals(3, diagnostics.get(0)
                                   .span()
                                   .start()
                                   .line());
        assertEquals("'yes'", diagnostics.get(0)
                                       .details()
                                       .get("expected"));
    }

    @Test
    void relationalOperatorOnEqualsRuleIsTypeMismatch() throws SchemaLoadException {
        var diagnostics = validate("farm = { category = resource cost < 5 }");

        assertThat(diagnostics).singleElement()
                               .satisfies(d -> {
                                   assertEquals(DiagnosticCode.TYPE_MISMATCH, d.code());
                                   assertThat(d.message()).contains("'<'");
                               });
    }

    @Test
    void referencesAreAlwaysAccepted() throws SchemaLoadException {
        var diagnostics = validate("farm = { category = @default_category cost = @[base * 2] }");

        assertThat(diagnostics).isEmpty();
    }

    @Test
    void reportsUnknownEnumValue() throws SchemaLoadException {
        var diagnostics = validate("farm = { category = Farming }");

        assertThat(diagnostics).singleElement()
                               .satisfies(d -> {
                                   assertEquals(DiagnosticCode.UNKNOWN_ENUM_VALUE, d.code());
                                   assertEquals("category", d.details()
                                                             .get("enum"));
                                   assertEquals("Farming", d.details()
                                                            .get("value"));
                               });
        assertThat(validate("farm = { category = RESEARCH }")).isEmpty();
    }

    @Test
    void reportsUndefinedTypeReference() throws SchemaLoadException {
        var diagnostics = validate("farm = { category = resource upgrade = castle }");

        assertThat(diagnostics).singleElement()
                               .satisfies(d -> {
                                   assertEquals(DiagnosticCode.UNDEFINED_REFERENCE, d.code());
                                   assertEquals(Map.of("type", "building", "name", "castle"), d.details());
                               });
    }

    @Test
    void checksAliasMembers() throws SchemaLoadException {
        var diagnostics = validate("""
            farm = {
                category = resource
                on_built = {
                    add_money = lots
                    launch_rockets = yes
                }
            }
            """);

        assertThat(codes(diagnostics)).containsExactly(DiagnosticCode.TYPE_MISMATCH, DiagnosticCode.UNRESOLVED_ALIAS);
        var unresolved = diagnostics.get(1);
        assertEquals(Severity.ERROR, unresolved.severity());
        assertEquals("launch_rockets", unresolved.details()
                                                 .get("key"));
        assertEquals("effect", unresolved.details()
                                         .get("categories"));
    }

    @Test
    void subtypeRulesApplyOnlyToMatchingDefinitions() throws SchemaLoadException {
        var capitalMissingBonus = validate("""
            palace = {
                category = resource
                capital = yes
                upkeep = 3
            }
            """);
        assertThat(codes(capitalMissingBonus)).containsExactlyInAnyOrder(DiagnosticCode.UNEXPECTED_KEY,
                                                                         DiagnosticCode.MISSING_REQUIRED_KEY);

        var capital = validate("palace = { category = resource capital = yes capital_bonus = 2 }");
        assertThat(capital).isEmpty();

        var plain = validate("farm = { category = resource capital = no upkeep = 3 }");
        assertThat(plain).isEmpty();

        var plainWithBonus = validate("farm = { category = resource capital_bonus = 2 }");
        assertThat(codes(plainWithBonus)).containsExactly(DiagnosticCode.UNEXPECTED_KEY);
    }

    @Test
    void checksScopes() throws SchemaLoadException {
        var validator = Validator.of(load(SCHEMA));

        var diagnostics = validate(validator, POLICIES, """
            tax = {
                planet_only = yes
                on_planet = {
                    planet_only = yes
                    owner = prev
                }
                target = root
            }
            """);

        assertThat(codes(diagnostics)).containsExactly(DiagnosticCode.SCOPE_MISMATCH, DiagnosticCode.SCOPE_MISMATCH);
        assertEquals(2, diagnostics.get(0)
                                   .span()
                                   .start()
                                   .line());
        assertEquals(Map.of("expected", "planet", "actual", "country"), diagnostics.get(1)
                                                                                  .details());

        var wrongOwner = validate(validator, POLICIES, "tax = { on_planet = { owner = this } }");
        assertThat(wrongOwner).singleElement()
                              .satisfies(d -> assertEquals("planet", d.details()
                                                                      .get("actual")));
    }

    @Test
    void reportsMissingLocalisation() throws SchemaLoadException {
        var validator = new Validator(load(SCHEMA),
                                      SymbolLookup.EMPTY,
                                      LocalisationOracle.of(List.of("farm", "farm_title")),
                                      ValidatorConfig.DEFAULT);

        var diagnostics = validate(validator, BUILDINGS, """
            farm = {
                category = resource
                name_key = farm_title
            }
            mine = {
                category = resource
                name_key = "A deep mine"
            }
            quarry = {
                category = resource
                name_key = quarry_title
            }
            """);

        assertThat(diagnostics).allMatch(d -> d.code() == DiagnosticCode.MISSING_LOCALISATION_KEY)
                               .allMatch(d -> d.severity() == Severity.WARNING)
                               .extracting(d -> d.details()
                                                 .get("key"))
                               .containsExactly("mine", "quarry", "quarry_title");
    }

    @Test
    void validationIsRepeatable() throws SchemaLoadException {
        var validator = Validator.of(load(SCHEMA));
        var root = ScriptParser.parse("farm = { hidden = no bogus = 1 }")
                               .root();

        var first = validator.validateFile(root, BUILDINGS, CancellationToken.NEVER);
        var second = validator.validateFile(root, BUILDINGS, CancellationToken.NEVER);

        assertEquals(first, second);
        assertEquals(3, first.diagnostics()
                             .size());
    }

    @Test
    void cancelledPassReportsNothing() throws SchemaLoadException {
        var validator = Validator.of(load(SCHEMA));
        var root = ScriptParser.parse("farm = { bogus = 1 } mine = { bogus = 2 }")
                               .root();
        var polls = new AtomicInteger();

        var outcome = validator.validateFile(root, BUILDINGS, CancellationToken.of(() -> polls.incrementAndGet() > 2));

        assertTrue(outcome.isCancelled());
        assertThrows(IllegalStateException.class, outcome::diagnostics);
    }

    @Test
    void singleAliasChainsDeeperThanLimitAreDefects() throws SchemaLoadException {
        var schema = load("""
            types = { type[building] = { path = "game/common/buildings" } }
            single_alias[a] = single_alias_right[b]
            single_alias[b] = single_alias_right[c]
            single_alias[c] = int
            building = { level = single_alias_right[a] }
            """);
        var script = "farm = { level = 3 }";

        assertThat(validate(Validator.of(schema), BUILDINGS, script)).isEmpty();

        var shallow = new Validator(schema,
                                    SymbolLookup.EMPTY,
                                    LocalisationOracle.ACCEPT_ALL,
                                    new ValidatorConfig(Optional.of(Severity.WARNING), false, Severity.WARNING, 2));
        assertThrows(EngineDefectException.class, () -> validate(shallow, BUILDINGS, script));
    }

    @Test
    void lenientWildcardBlocksSuppressUnexpectedKeys() throws SchemaLoadException {
        var schema = load("""
            types = { type[building] = { path = "game/common/buildings" } }
            building = {
                ## cardinality = 0..1
                produces = {
                    <building> = int
                }
            }
            """);
        var script = "farm = { produces = { food = 3 } }";

        assertThat(codes(validate(Validator.of(schema), BUILDINGS, script))).containsExactly(DiagnosticCode.UNEXPECTED_KEY);

        var lenient = new Validator(schema,
                                    SymbolLookup.EMPTY,
                                    LocalisationOracle.ACCEPT_ALL,
                                    ValidatorConfig.DEFAULT.withLenientWildcardBlocks(true));
        assertThat(validate(lenient, BUILDINGS, script)).isEmpty();
    }

    @Test
    void severityOptionOverridesRuleDiagnostics() throws SchemaLoadException {
        var schema = load("""
            types = { type[building] = { path = "game/common/buildings" } }
            building = {
                ## cardinality = 0..1
                ## severity = info
                icon = int
            }
            """);

        assertThat(validate(Validator.of(schema), BUILDINGS, "farm = { icon = big }")).singleElement()
                                                                                     .satisfies(d -> {
                                                                                         assertEquals(DiagnosticCode.TYPE_MISMATCH, d.code());
                                                                                         assertEquals(Severity.INFO, d.severity());
                                                                                     });
    }

    @Test
    void conditionalSectionsDoNotCountTowardCardinality() throws SchemaLoadException {
        var diagnostics = validate("""
            farm = {
                category = resource
                [[HAS_RESEARCH] category = research ]
                [[!HAS_RESEARCH] category = manufacturing ]
            }
            """);

        assertThat(diagnostics).isEmpty();

        var onlyConditional = validate("farm = { [[HAS_Y] category = resource ] }");
        assertThat(codes(onlyConditional)).containsExactly(DiagnosticCode.MISSING_REQUIRED_KEY);
    }

    @Test
    void conditionalSectionEntriesAreCheckedAgainstTheEnclosingRules() throws SchemaLoadException {
        var diagnostics = validate("""
            farm = {
                category = resource
                [[HAS_Y]
                    cost = 500
                    bogus = 1
                ]
            }
            """);

        assertThat(codes(diagnostics)).containsExactly(DiagnosticCode.TYPE_MISMATCH, DiagnosticCode.UNEXPECTED_KEY);
        assertEquals(4, diagnostics.get(0)
                                   .span()
                                   .start()
                                   .line());
    }

    @Test
    void rulesOfEveryMatchingSubtypeApplyTogether() throws SchemaLoadException {
        var schema = load("""
            types = {
                type[thing] = {
                    path = "game/common/things"
                    subtype[has_a] = { mode_a = yes }
                    subtype[has_b] = { mode_b = yes }
                }
            }
            thing = {
                ## cardinality = 0..1
                mode_a = yes
                ## cardinality = 0..1
                mode_b = yes
                subtype[has_a] = { need_a = int }
                subtype[has_b] = { need_b = int }
            }
            """);
        var validator = Validator.of(schema);

        var both = validate(validator, "common/things/t.txt", "x = { mode_a = yes mode_b = yes }");
        assertThat(both).allMatch(d -> d.code() == DiagnosticCode.MISSING_REQUIRED_KEY)
                        .extracting(d -> d.details()
                                          .get("key"))
                        .containsExactlyInAnyOrder("need_a", "need_b");

        var onlyA = validate(validator, "common/things/t.txt", "x = { mode_a = yes need_a = 1 }");
        assertThat(onlyA).isEmpty();

        var satisfied = validate(validator, "common/things/t.txt", "x = { mode_a = yes mode_b = yes need_a = 1 need_b = 2 }");
        assertThat(satisfied).isEmpty();
    }

    private static final String EVENTS = "events/e.txt";

    private static final String DYNAMIC_SCHEMA = """
        types = {
            ## push_scope = planet
            type[event] = {
                path = "game/events"
            }
        }
        enums = {
            complex_enum[policy_option] = {
                path = "game/common/policies"
                name = {
                    option = { name = enum_name }
                }
            }
        }
        links = {
            owner = { input_scopes = { planet fleet } output_scope = country }
            capital = { input_scopes = { country } output_scope = planet }
        }
        event = {
            ## cardinality = 0..inf
            pick = enum[policy_option]
            ## cardinality = 0..inf
            set_flag = value_set[flag]
            ## cardinality = 0..inf
            has_flag = value[flag]
            ## cardinality = 0..1
            flag_weights = {
                value[flag] = int
            }
            ## cardinality = 0..inf
            mark = value_set[flag]
            ## cardinality = 0..inf
            mark = {
                name = value_set[flag]
                count = int
            }
            ## cardinality = 0..inf
            target = scope[country]
            ## cardinality = 0..inf
            scope[any] = {
                ## cardinality = 0..inf
                ## scope = country
                country_only = yes
            }
        }
        """;

    @Test
    void complexEnumAcceptsCollectedMembers() throws SchemaLoadException {
        var schema = load(DYNAMIC_SCHEMA);
        var collected = new Validator(schema,
                                      SymbolLookup.of(Map.of(SymbolLookup.enumNamespace("policy_option"),
                                                             List.of("free_trade"))),
                                      LocalisationOracle.ACCEPT_ALL,
                                      ValidatorConfig.DEFAULT);

        assertThat(validate(collected, EVENTS, "e = { pick = Free_Trade }")).isEmpty();
        assertThat(validate(collected, EVENTS, "e = { pick = mercantilism }")).singleElement()
                                                                               .satisfies(d -> {
                                                                                   assertEquals(DiagnosticCode.UNKNOWN_ENUM_VALUE,
                                                                                                d.code());
                                                                                   assertEquals("policy_option",
                                                                                                d.details()
                                                                                                 .get("enum"));
                                                                               });
    }

    @Test
    void complexEnumWithNothingCollectedAcceptsAnyValue() throws SchemaLoadException {
        var validator = Validator.of(load(DYNAMIC_SCHEMA));

        assertThat(validate(validator, EVENTS, "e = { pick = mercantilism }")).isEmpty();
    }

    @Test
    void valueReadsMustNameADeclaredValue() throws SchemaLoadException {
        var validator = new Validator(load(DYNAMIC_SCHEMA),
                                      SymbolLookup.of(Map.of(SymbolLookup.valueSetNamespace("flag"), List.of("alpha"))),
                                      LocalisationOracle.ACCEPT_ALL,
                                      ValidatorConfig.DEFAULT);

        assertThat(validate(validator, EVENTS, "e = { has_flag = alpha flag_weights = { alpha = 2 } }")).isEmpty();

        var diagnostics = validate(validator, EVENTS, """
            e = {
                has_flag = gamma
                flag_weights = { gamma = 2 }
            }
            """);
        assertThat(codes(diagnostics)).containsExactly(DiagnosticCode.UNDEFINED_REFERENCE, DiagnosticCode.UNEXPECTED_KEY);
        assertEquals(Map.of("value_set", "flag", "name", "gamma"), diagnostics.get(0)
                                                                              .details());
    }

    @Test
    void collectsValueSetDeclarationsFromTheBestFittingRule() throws SchemaLoadException {
        var validator = Validator.of(load(DYNAMIC_SCHEMA));
        var parsed = ScriptParser.parse("""
            e = {
                set_flag = alpha
                has_flag = ignored
                mark = beta
                mark = { name = gamma count = 1 }
                mark = { name = delta count = lots }
            }
            """);

        var declared = validator.collectValueSets(parsed.root(), EVENTS);

        assertThat(declared).extracting(DeclaredValue::name)
                            .containsExactly("alpha", "beta", "gamma");
        assertThat(declared).allMatch(v -> v.set()
                                            .equals("flag"));
        assertEquals(2, declared.get(0)
                                .span()
                                .start()
                                .line());
        assertThat(validator.collectValueSets(parsed.root(), "common/other/x.txt")).isEmpty();
    }

    @Test
    void scopeValuesFollowDeclaredLinks() throws SchemaLoadException {
        var validator = Validator.of(load(DYNAMIC_SCHEMA));

        assertThat(validate(validator, EVENTS, "e = { target = owner target = owner.capital.owner }")).isEmpty();

        var wrongScope = validate(validator, EVENTS, "e = { target = owner.capital }");
        assertThat(wrongScope).singleElement()
                              .satisfies(d -> assertEquals(Map.of("expected", "country", "actual", "planet"),
                                                           d.details()));

        var misused = validate(validator, EVENTS, "e = { target = capital }");
        assertThat(misused).singleElement()
                           .satisfies(d -> {
                               assertEquals(DiagnosticCode.SCOPE_MISMATCH, d.code());
                               assertEquals(Map.of("link", "capital", "scope", "planet"), d.details());
                               assertThat(d.notes()).containsExactly("help: 'capital' is usable from country");
                           });
    }

    @Test
    void scopeKeysChangeTheScopeOfTheirBlock() throws SchemaLoadException {
        var validator = Validator.of(load(DYNAMIC_SCHEMA));

        assertThat(validate(validator, EVENTS, "e = { owner = { country_only = yes } }")).isEmpty();
        assertThat(validate(validator, EVENTS, "e = { owner.capital.owner = { country_only = yes } }")).isEmpty();

        var diagnostics = validate(validator, EVENTS, "e = { this = { country_only = yes } }");
        assertThat(diagnostics).singleElement()
                               .satisfies(d -> {
                                   assertEquals(DiagnosticCode.SCOPE_MISMATCH, d.code());
                                   assertEquals("planet", d.details()
                                                           .get("scope"));
                               });

        var notAScope = validate(validator, EVENTS, "e = { controller = { country_only = yes } }");
        assertThat(codes(notAScope)).containsExactly(DiagnosticCode.UNEXPECTED_KEY);
    }
}
