package org.Aayush.exogenous.series;

import java.util.Arrays;
import java.util.OptionalInt;

/**
 * Immutable dense series of annual values from {@code startYear} to {@code stopYear} inclusive.
 *
 * <p>Values derived from a missing baseline or a missing growth factor are tagged explicitly:
 * every index at or after {@link #missingFromIndex()} is missing and stores {@code NaN}.
 * Callers should test {@link #isMissing(int)} rather than probing for {@code NaN}.</p>
 */
public final class AnnualSeries {
    /**
     * Sentinel for "no missing values".
     */
    public static final int NONE_MISSING = -1;

    private final int startYear;
    private final double[] values;
    private final int missingFromIndex;

    AnnualSeries(int startYear, double[] values, int missingFromIndex) {
        if (values.length == 0) {
            throw new IllegalArgumentException("series must hold at least one year");
        }
        if (missingFromIndex < NONE_MISSING || missingFromIndex >= values.length) {
            throw new IllegalArgumentException("missingFromIndex out of range: " + missingFromIndex);
        }
        this.startYear = startYear;
        this.values = values;
        this.missingFromIndex = missingFromIndex;
    }

    /**
     * Creates a fully-present series from a copy of the provided values.
     *
     * @param startYear year of the first value.
     * @param values annual values.
     * @return immutable series.
     */
    public static AnnualSeries of(int startYear, double... values) {
        return new AnnualSeries(startYear, values.clone(), NONE_MISSING);
    }

    public int startYear() {
        return startYear;
    }

    public int stopYear() {
        return startYear + values.length - 1;
    }

    /**
     * @return number of annual values.
     */
    public int length() {
        return values.length;
    }

    /**
     * @param index zero-based offset from the start year.
     * @return stored value; {@code NaN} when missing.
     * @throws IndexOutOfBoundsException when the index is outside the series.
     */
    public double get(int index) {
        return values[checkIndex(index)];
    }

    /**
     * @param index zero-based offset from the start year.
     * @return true when the value at the index is tagged missing.
     */
    public boolean isMissing(int index) {
        checkIndex(index);
        return missingFromIndex != NONE_MISSING && index >= missingFromIndex;
    }

    /**
     * @return true when at least one year is missing.
     */
    public boolean hasMissing() {
        return missingFromIndex != NONE_MISSING;
    }

    /**
     * @return first missing index, or {@link #NONE_MISSING}.
     */
    public int missingFromIndex() {
        return missingFromIndex;
    }

    /**
     * @return first missing year, when any.
     */
    public OptionalInt missingFromYear() {
        return hasMissing() ? OptionalInt.of(startYear + missingFromIndex) : OptionalInt.empty();
    }

    /**
     * Multiplies every value by a constant; the missing tag is carried over unchanged.
     *
     * @param factor multiplier.
     * @return new scaled series.
     */
    public AnnualSeries scale(double factor) {
        double[] scaled = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            scaled[i] = values[i] * factor;
        }
        return new AnnualSeries(startYear, scaled, missingFromIndex);
    }

    /**
     * @return defensive copy of the values.
     */
    public double[] toArray() {
        return values.clone();
    }

    private int checkIndex(int index) {
        if (index < 0 || index >= values.length) {
            throw new IndexOutOfBoundsException(
                    "series index " + index + " outside [0, " + (values.length - 1) + "]"
            );
        }
        return index;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AnnualSeries other)) {
            return false;
        }
        return startYear == other.startYear
                && missingFromIndex == other.missingFromIndex
                && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        int result = Integer.hashCode(startYear);
        result = 31 * result + Integer.hashCode(missingFromIndex);
        return 31 * result + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "AnnualSeries{" + startYear + ".." + stopYear()
                + (hasMissing() ? ", missingFrom=" + (startYear + missingFromIndex) : "")
                + ", values=" + Arrays.toString(values) + '}';
    }
}
