package org.brainobservatory.traces;

import org.brainobservatory.core.id.RoiIdIndex;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable entity-major table of corrected fluorescence traces.
 *
 * <p>One row per ROI, keyed by a unique ROI id; every row holds exactly {@link #timepointCount()}
 * samples. Row order is significant and preserved through every transform. All array accessors
 * return copies.</p>
 */
public final class TraceTable {

    /**
     * Index name required by the container write path.
     */
    public static final String CELL_ROI_ID = "cell_roi_id";

    private final String indexName;
    private final RoiIdIndex index;
    private final double[][] samples;
    private final int timepointCount;

    private TraceTable(String indexName, RoiIdIndex index, double[][] samples, int timepointCount) {
        this.indexName = indexName;
        this.index = index;
        this.samples = samples;
        this.timepointCount = timepointCount;
    }

    /**
     * Builds a table indexed by {@value #CELL_ROI_ID}.
     *
     * @param roiIds unique ROI ids in row order.
     * @param samples entity-major samples, {@code samples[row][t]}.
     */
    public static TraceTable of(long[] roiIds, double[][] samples) {
        return of(CELL_ROI_ID, roiIds, samples);
    }

    /**
     * Builds a table with an explicit index name. The timepoint count is taken from the rows;
     * an empty table has zero timepoints.
     */
    public static TraceTable of(String indexName, long[] roiIds, double[][] samples) {
        Objects.requireNonNull(samples, "samples");
        int timepoints = samples.length == 0 || samples[0] == null ? 0 : samples[0].length;
        return of(indexName, roiIds, samples, timepoints);
    }

    /**
     * Builds a table with an explicit timepoint count, which keeps the time axis length of a table with no rows.
     */
    public static TraceTable of(String indexName, long[] roiIds, double[][] samples, int timepointCount) {
        Objects.requireNonNull(indexName, "indexName");
        Objects.requireNonNull(roiIds, "roiIds");
        if (timepointCount < 0) {
            throw new IllegalArgumentException("timepointCount must be >= 0");
        }
        if (roiIds.length != samples.length) {
            throw new IllegalArgumentException(
                    "row count mismatch: roiIds=" + roiIds.length + ", samples=" + samples.length
            );
        }
        RoiIdIndex index = RoiIdIndex.of(roiIds);
        return new TraceTable(indexName, index, copyAndValidateRows(samples, timepointCount), timepointCount);
    }

    public String getIndexName() {
        return indexName;
    }

    /**
     * @return number of ROI rows.
     */
    public int size() {
        return samples.length;
    }

    public boolean isEmpty() {
        return samples.length == 0;
    }

    public int timepointCount() {
        return timepointCount;
    }

    public boolean contains(long roiId) {
        return index.contains(roiId);
    }

    public long roiIdAt(int row) {
        return index.toRoiId(row);
    }

    public long[] roiIdsCopy() {
        return index.roiIdsCopy();
    }

    /**
     * Returns the samples of one ROI.
     *
     * @throws RoiIdIndex.UnknownRoiIdException when the id is not in the table.
     */
    public double[] samplesCopy(long roiId) {
        double[] row = samples[index.toRow(roiId)];
        return Arrays.copyOf(row, row.length);
    }

    /**
     * Returns the samples at a row position.
     */
    public double[] samplesAt(int row) {
        if (row < 0 || row >= samples.length) {
            throw new IndexOutOfBoundsException("Row out of bounds: " + row);
        }
        return Arrays.copyOf(samples[row], timepointCount);
    }

    /**
     * Stacks the rows in table order into an entity-major matrix.
     */
    public double[][] toEntityMajor() {
        double[][] matrix = new double[samples.length][];
        for (int row = 0; row < samples.length; row++) {
            matrix[row] = Arrays.copyOf(samples[row], timepointCount);
        }
        return matrix;
    }

    /**
     * Returns the same rows under another index name.
     */
    public TraceTable withIndexName(String newIndexName) {
        Objects.requireNonNull(newIndexName, "newIndexName");
        return new TraceTable(newIndexName, index, samples, timepointCount);
    }

    /**
     * Selects rows by id in the requested order. Ids must be present and unique.
     */
    TraceTable select(long[] roiIds) {
        double[][] selected = new double[roiIds.length][];
        for (int i = 0; i < roiIds.length; i++) {
            selected[i] = samples[index.toRow(roiIds[i])];
        }
        return of(indexName, roiIds, selected, timepointCount);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TraceTable)) {
            return false;
        }
        TraceTable other = (TraceTable) o;
        return timepointCount == other.timepointCount
                && indexName.equals(other.indexName)
                && Arrays.equals(index.roiIdsCopy(), other.index.roiIdsCopy())
                && samplesBitEqual(samples, other.samples);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(indexName, timepointCount);
        result = 31 * result + Arrays.hashCode(index.roiIdsCopy());
        for (double[] row : samples) {
            for (double value : row) {
                result = 31 * result + Long.hashCode(Double.doubleToRawLongBits(value));
            }
        }
        return result;
    }

    /**
     * Compares raw bit patterns, so NaN payloads and signed zeros must match exactly.
     */
    private static boolean samplesBitEqual(double[][] a, double[][] b) {
        if (a.length != b.length) {
            return false;
        }
        for (int row = 0; row < a.length; row++) {
            if (a[row].length != b[row].length) {
                return false;
            }
            for (int t = 0; t < a[row].length; t++) {
                if (Double.doubleToRawLongBits(a[row][t]) != Double.doubleToRawLongBits(b[row][t])) {
                    return false;
                }
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "TraceTable{indexName=" + indexName + ", rois=" + samples.length
                + ", timepoints=" + timepointCount + "}";
    }

    private static double[][] copyAndValidateRows(double[][] samples, int timepointCount) {
        double[][] copy = new double[samples.length][];
        for (int row = 0; row < samples.length; row++) {
            double[] values = Objects.requireNonNull(samples[row], "samples[" + row + "]");
            if (values.length != timepointCount) {
                throw new IllegalArgumentException(
                        "samples[" + row + "] length mismatch: " + values.length + " != " + timepointCount
                );
            }
            copy[row] = Arrays.copyOf(values, values.length);
        }
        return copy;
    }
}
