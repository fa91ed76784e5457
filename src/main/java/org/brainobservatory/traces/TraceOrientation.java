package org.brainobservatory.traces;

import lombok.experimental.UtilityClass;

import java.util.Objects;

/**
 * Conversions between entity-major ({@code [roi][t]}, in memory) and time-major ({@code [t][roi]}, on disk) matrices.
 *
 * <p>Each conversion allocates a fresh matrix and rejects ragged input. The explicit dimension argument
 * carries the width of a matrix with no rows, so {@code T x 0} and {@code 0 x T} keep their shape.</p>
 */
@UtilityClass
public final class TraceOrientation {

    /**
     * @param entityMajor {@code [roi][t]} samples.
     * @param timepointCount expected row width.
     * @return {@code [t][roi]} samples with {@code timepointCount} rows.
     */
    public static double[][] toTimeMajor(double[][] entityMajor, int timepointCount) {
        return transpose(entityMajor, timepointCount, "entityMajor");
    }

    /**
     * @param timeMajor {@code [t][roi]} samples.
     * @param roiCount expected row width.
     * @return {@code [roi][t]} samples with {@code roiCount} rows.
     */
    public static double[][] toEntityMajor(double[][] timeMajor, int roiCount) {
        return transpose(timeMajor, roiCount, "timeMajor");
    }

    private static double[][] transpose(double[][] source, int width, String fieldName) {
        Objects.requireNonNull(source, fieldName);
        if (width < 0) {
            throw new IllegalArgumentException("width must be >= 0");
        }
        double[][] target = new double[width][source.length];
        for (int i = 0; i < source.length; i++) {
            double[] row = Objects.requireNonNull(source[i], fieldName + "[" + i + "]");
            if (row.length != width) {
                throw new IllegalArgumentException(
                        fieldName + "[" + i + "] length mismatch: " + row.length + " != " + width
                );
            }
            for (int j = 0; j < width; j++) {
                target[j][i] = row[j];
            }
        }
        return target;
    }
}
