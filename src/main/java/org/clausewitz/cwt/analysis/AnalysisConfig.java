package org.clausewitz.cwt.analysis;

import com.google.common.base.Preconditions;
import org.clausewitz.cwt.validate.LocalisationOracle;
import org.clausewitz.cwt.validate.ValidatorConfig;

/**
 * Configuration of an {@link AnalysisStore}.
 *
 * @param parallelism  Worker threads for validation and scans
 * @param validator    Validator settings
 * @param localisation Localisation keys known to the host
 */
public record AnalysisConfig(int parallelism, ValidatorConfig validator, LocalisationOracle localisation) {
    public static final AnalysisConfig DEFAULT = new AnalysisConfig(Math.max(1,
                                                                             Runtime.getRuntime()
                                                                                    .availableProcessors() - 1),
                                                                    ValidatorConfig.DEFAULT,
                                                                    LocalisationOracle.ACCEPT_ALL);

    public AnalysisConfig {
        Preconditions.checkArgument(parallelism > 0, "parallelism must be positive: %s", parallelism);
        Preconditions.checkNotNull(validator, "validator");
        Preconditions.checkNotNull(localisation, "localisation");
    }

    public AnalysisConfig withParallelism(int threads) {
        return new AnalysisConfig(threads, validator, localisation);
    }

    public AnalysisConfig withValidator(ValidatorConfig config) {
        return new AnalysisConfig(parallelism, config, localisation);
    }

    public AnalysisConfig withLocalisation(LocalisationOracle oracle) {
        return new AnalysisConfig(parallelism, validator, oracle);
    }
}
