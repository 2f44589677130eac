package org.Aayush.exogenous.key;

import lombok.experimental.UtilityClass;

import java.util.Objects;

/**
 * Helpers for the two geographic key granularities.
 *
 * <p>A coarse key is a fixed-length country code ({@code ZWE}); a fine key is a hierarchical
 * region id prefixed by its coarse key ({@code ZWE.2.2}). A coarse key is also a valid fine key
 * of itself.</p>
 */
@UtilityClass
public class EntityKey {

    /**
     * Length of every coarse key.
     */
    public static final int COARSE_LENGTH = 3;

    /**
     * Truncates a fine key to its coarse key.
     *
     * @param fineKey hierarchical region id or coarse key.
     * @return coarse key prefix.
     * @throws IllegalArgumentException when the key is shorter than {@link #COARSE_LENGTH}.
     */
    public static String coarse(String fineKey) {
        String key = Objects.requireNonNull(fineKey, "fineKey");
        if (!hasCoarsePrefix(key)) {
            throw new IllegalArgumentException(
                    "region key must have at least " + COARSE_LENGTH + " characters: '" + key + "'"
            );
        }
        return key.substring(0, COARSE_LENGTH);
    }

    /**
     * @param key candidate key.
     * @return true when the key is long enough to carry a coarse key.
     */
    public static boolean hasCoarsePrefix(String key) {
        return key != null && key.length() >= COARSE_LENGTH;
    }
}
