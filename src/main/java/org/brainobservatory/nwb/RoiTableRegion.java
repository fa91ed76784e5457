package org.brainobservatory.nwb;

import lombok.Getter;

import java.util.Arrays;
import java.util.Objects;

/**
 * Selection of rows from an {@link RoiTable}; the entity axis of an ROI response series.
 */
public final class RoiTableRegion {
    @Getter
    private final String description;
    @Getter
    private final RoiTable table;
    private final int[] rows;

    public RoiTableRegion(String description, RoiTable table, int[] rows) {
        this.description = Objects.requireNonNull(description, "description");
        this.table = Objects.requireNonNull(table, "table");
        Objects.requireNonNull(rows, "rows");
        this.rows = Arrays.copyOf(rows, rows.length);
        for (int i = 0; i < this.rows.length; i++) {
            int row = this.rows[i];
            if (row < 0 || row >= table.size()) {
                throw new IllegalArgumentException(
                        "rows[" + i + "] out of bounds: " + row + " [0," + table.size() + ")"
                );
            }
        }
    }

    /**
     * Region covering every row of the table in table order.
     */
    public static RoiTableRegion all(String description, RoiTable table) {
        Objects.requireNonNull(table, "table");
        int[] rows = new int[table.size()];
        for (int i = 0; i < rows.length; i++) {
            rows[i] = i;
        }
        return new RoiTableRegion(description, table, rows);
    }

    public int size() {
        return rows.length;
    }

    public int[] rowsCopy() {
        return Arrays.copyOf(rows, rows.length);
    }

    /**
     * Resolves the region rows to ROI ids, in region order.
     */
    public long[] ids() {
        long[] ids = new long[rows.length];
        for (int i = 0; i < rows.length; i++) {
            ids[i] = table.idAt(rows[i]);
        }
        return ids;
    }
}
