package org.brainobservatory.nwb;

import java.util.Arrays;

/**
 * Immutable timestamp vector in seconds, shared by reference between aligned series.
 *
 * <p>Identity matters: two series hold the same time axis only when they hold the same instance.</p>
 */
public final class Timestamps {
    private final double[] seconds;

    public Timestamps(double[] seconds) {
        if (seconds == null) {
            throw new IllegalArgumentException("seconds cannot be null");
        }
        for (int i = 0; i < seconds.length; i++) {
            if (!Double.isFinite(seconds[i])) {
                throw new IllegalArgumentException("timestamps[" + i + "] must be finite");
            }
            if (i > 0 && seconds[i] < seconds[i - 1]) {
                throw new IllegalArgumentException(
                        "timestamps must be non-decreasing: [" + (i - 1) + "]=" + seconds[i - 1]
                                + " > [" + i + "]=" + seconds[i]
                );
            }
        }
        this.seconds = Arrays.copyOf(seconds, seconds.length);
    }

    public int count() {
        return seconds.length;
    }

    public double get(int index) {
        if (index < 0 || index >= seconds.length) {
            throw new IllegalArgumentException("timestamp index out of bounds: " + index);
        }
        return seconds[index];
    }

    public double[] secondsCopy() {
        return Arrays.copyOf(seconds, seconds.length);
    }
}
