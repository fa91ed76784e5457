package org.brainobservatory.core.id;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FastUtilRoiIdIndexTest {

    @Test
    @DisplayName("Baseline Correctness: ids map to their row positions and back")
    void testBidirectionalMapping() {
        RoiIdIndex index = RoiIdIndex.of(new long[]{1086496928L, 7L, 9L});

        assertEquals(0, index.toRow(1086496928L));
        assertEquals(2, index.toRow(9L));
        assertEquals(7L, index.toRoiId(1));

        assertTrue(index.contains(7L));
        assertFalse(index.contains(8L));
        assertEquals(3, index.size());
    }

    @Test
    @DisplayName("Row order follows input order, not id order")
    void testInputOrderPreserved() {
        RoiIdIndex index = RoiIdIndex.of(new long[]{30L, 10L, 20L});
        assertArrayEquals(new long[]{30L, 10L, 20L}, index.roiIdsCopy());
    }

    @Test
    @DisplayName("Negative and extreme ids are plain keys")
    void testExtremeIds() {
        RoiIdIndex index = RoiIdIndex.of(new long[]{-1L, Long.MAX_VALUE, Long.MIN_VALUE});
        assertEquals(0, index.toRow(-1L));
        assertEquals(1, index.toRow(Long.MAX_VALUE));
        assertEquals(2, index.toRow(Long.MIN_VALUE));
    }

    @Test
    @DisplayName("Exception Path: duplicate ids rejected")
    void testDuplicateIds() {
        IllegalArgumentException ex = assertThrows(
                IllegalArgumentException.class,
                () -> RoiIdIndex.of(new long[]{5L, 6L, 5L})
        );
        assertTrue(ex.getMessage().contains("Duplicate ROI id 5"));
    }

    @Test
    @DisplayName("Exception Path: unknown id and bad row")
    void testUnknownLookups() {
        RoiIdIndex index = new FastUtilRoiIdIndex(new long[]{1L, 2L});

        assertThrows(RoiIdIndex.UnknownRoiIdException.class, () -> index.toRow(3L));
        assertThrows(IndexOutOfBoundsException.class, () -> index.toRoiId(2));
        assertThrows(IndexOutOfBoundsException.class, () -> index.toRoiId(-1));
        assertThrows(IllegalArgumentException.class, () -> new FastUtilRoiIdIndex(null));
    }

    @Test
    @DisplayName("Input and output arrays are copies")
    void testDefensiveCopies() {
        long[] ids = {1L, 2L};
        RoiIdIndex index = RoiIdIndex.of(ids);
        ids[0] = 99L;
        long[] out = index.roiIdsCopy();
        out[1] = 77L;

        assertArrayEquals(new long[]{1L, 2L}, index.roiIdsCopy());
        assertFalse(index.contains(99L));
    }

    @Test
    @DisplayName("Empty index is valid")
    void testEmptyIndex() {
        RoiIdIndex index = RoiIdIndex.of(new long[0]);
        assertEquals(0, index.size());
        assertFalse(index.contains(0L));
    }
}
