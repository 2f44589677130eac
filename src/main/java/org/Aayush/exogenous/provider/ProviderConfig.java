package org.Aayush.exogenous.provider;

import lombok.Builder;
import lombok.Value;
import org.Aayush.exogenous.ProjectionException;

/**
 * Construction-time configuration shared by the region providers.
 */
@Value
@Builder
public class ProviderConfig {
    public static final int DEFAULT_PERIOD_LENGTH = 5;
    public static final int DEFAULT_ECONOMIC_START_YEAR = 2010;
    public static final int DEFAULT_DEMOGRAPHIC_START_YEAR = 2020;
    public static final int DEFAULT_STOP_YEAR = 2100;

    /**
     * Active model qualifier (for example {@code low}); required by the economic provider only.
     */
    String model;

    /**
     * Active scenario id (for example {@code SSP3}).
     */
    String scenario;

    /**
     * First year of every produced series; baselines are drawn from this year.
     */
    @Builder.Default
    int startYear = DEFAULT_ECONOMIC_START_YEAR;

    /**
     * Last year of every produced series, inclusive.
     */
    @Builder.Default
    int stopYear = DEFAULT_STOP_YEAR;

    /**
     * Years covered by one growth factor.
     */
    @Builder.Default
    int periodLength = DEFAULT_PERIOD_LENGTH;

    /**
     * Returns economic config with default horizon {@code 2010..2100}.
     *
     * @param model active model qualifier.
     * @param scenario active scenario id.
     */
    public static ProviderConfig economic(String model, String scenario) {
        return ProviderConfig.builder()
                .model(model)
                .scenario(scenario)
                .build();
    }

    /**
     * Returns demographic config with default horizon {@code 2020..2100}.
     *
     * @param scenario active scenario id.
     */
    public static ProviderConfig demographic(String scenario) {
        return ProviderConfig.builder()
                .scenario(scenario)
                .startYear(DEFAULT_DEMOGRAPHIC_START_YEAR)
                .build();
    }

    /**
     * Validates the horizon and ids.
     *
     * @param requireModel whether {@link #getModel()} must be set.
     * @return this config.
     * @throws ProjectionException with {@link ProjectionException#REASON_CONFIG_INVALID}.
     */
    ProviderConfig validate(boolean requireModel) {
        if (requireModel && isBlank(model)) {
            throw invalid("model must be provided");
        }
        if (isBlank(scenario)) {
            throw invalid("scenario must be provided");
        }
        if (stopYear < startYear) {
            throw invalid("stopYear " + stopYear + " precedes startYear " + startYear);
        }
        if (periodLength < 1) {
            throw invalid("periodLength must be >= 1, got " + periodLength);
        }
        return this;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static ProjectionException invalid(String message) {
        return new ProjectionException(ProjectionException.REASON_CONFIG_INVALID, message);
    }
}
