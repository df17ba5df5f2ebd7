package org.clausewitz.cwt;

import org.clausewitz.cwt.analysis.AnalysisConfig;
import org.clausewitz.cwt.analysis.AnalysisStore;
import org.clausewitz.cwt.diff.Changeset;
import org.clausewitz.cwt.diff.DiffEngine;
import org.clausewitz.cwt.error.SchemaLoadException;
import org.clausewitz.cwt.parser.ParseResult;
import org.clausewitz.cwt.parser.ParserConfig;
import org.clausewitz.cwt.parser.RecoveryStrategy;
import org.clausewitz.cwt.parser.ScriptParser;
import org.clausewitz.cwt.schema.Schema;
import org.clausewitz.cwt.schema.SchemaRegistry;
import org.clausewitz.cwt.schema.SchemaSource;
import org.clausewitz.cwt.validate.CancellationToken;
import org.clausewitz.cwt.validate.LocalisationOracle;
import org.clausewitz.cwt.validate.ValidationOutcome;
import org.clausewitz.cwt.validate.Validator;
import org.clausewitz.cwt.validate.ValidatorConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point tying the parser, schema registry, analysis store and diff engine together.
 *
 * <p>Example usage:
 * <pre>{@code
 * try (var engine = CwtEngine.builder()
 *                            .schema(SchemaSource.of("buildings.cwt", cwtText))
 *                            .parallelism(2)
 *                            .build()) {
 *     engine.store().open("common/buildings/farms.txt", scriptText);
 *     var diagnostics = engine.store().diagnostics("common/buildings/farms.txt");
 * }
 * }</pre>
 */
public final class CwtEngine implements AutoCloseable {
    private final SchemaRegistry registry;
    private final ParserConfig parserConfig;
    private final AnalysisConfig analysisConfig;
    private final AnalysisStore store;

    private CwtEngine(SchemaRegistry registry, ParserConfig parserConfig, AnalysisConfig analysisConfig) {
        this.registry = registry;
        this.parserConfig = parserConfig;
        this.analysisConfig = analysisConfig;
        this.store = new AnalysisStore(registry, analysisConfig);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Engine over already loaded schema files with default settings.
     */
    public static CwtEngine create(SchemaSource... sources) throws SchemaLoadException {
        return builder().schema(sources)
                        .build();
    }

    public ParseResult parse(String text) {
        return ScriptParser.parse(text, parserConfig);
    }

    public Schema schema() {
        return registry.snapshot();
    }

    /**
     * Replace the schema and revalidate every open document.
     *
     * @throws SchemaLoadException if the files do not load; the current schema stays in force
     */
    public Schema reloadSchema(List<SchemaSource> sources) throws SchemaLoadException {
        store.reloadSchema(sources);
        return registry.snapshot();
    }

    /**
     * Validate one file outside the store. References resolve against the documents open in the
     * store; syntax errors are not included.
     */
    public ValidationOutcome validate(String relativePath, String text) {
        var validator = new Validator(registry.snapshot(),
                                      store.symbolLookup(),
                                      analysisConfig.localisation(),
                                      analysisConfig.validator());
        return validator.validateFile(parse(text).root(), relativePath, CancellationToken.NEVER);
    }

    public Changeset diff(String before, String after) {
        return DiffEngine.diff(parse(before).root(), parse(after).root());
    }

    public AnalysisStore store() {
        return store;
    }

    @Override
    public void close() {
        store.close();
    }

    /**
     * Builder for engines with custom configuration.
     */
    public static final class Builder {
        private final List<SchemaSource> sources = new ArrayList<>();
        private RecoveryStrategy recoveryStrategy = RecoveryStrategy.RESYNC;
        private AnalysisConfig analysisConfig = AnalysisConfig.DEFAULT;

        private Builder() {}

        public Builder schema(SchemaSource... files) {
            sources.addAll(List.of(files));
            return this;
        }

        public Builder schema(List<SchemaSource> files) {
            sources.addAll(files);
            return this;
        }

        public Builder recovery(RecoveryStrategy strategy) {
            this.recoveryStrategy = strategy;
            return this;
        }

        public Builder parallelism(int threads) {
            this.analysisConfig = analysisConfig.withParallelism(threads);
            return this;
        }

        public Builder validator(ValidatorConfig config) {
            this.analysisConfig = analysisConfig.withValidator(config);
            return this;
        }

        public Builder localisation(LocalisationOracle oracle) {
            this.analysisConfig = analysisConfig.withLocalisation(oracle);
            return this;
        }

        /**
         * @throws SchemaLoadException if the schema files do not load
         */
        public CwtEngine build() throws SchemaLoadException {
            var registry = new SchemaRegistry();
            if (!sources.isEmpty()) {
                registry.load(sources);
            }
            return new CwtEngine(registry, new ParserConfig(recoveryStrategy, false), analysisConfig);
        }
    }
}
