package org.brainobservatory.nwb;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("RoiResponseSeries Contract Tests")
class RoiResponseSeriesTest {

    private static RoiTableRegion region(long... ids) {
        return RoiTableRegion.all("cells", new RoiTable("cells", ids));
    }

    @Test
    @DisplayName("Series keeps shape, unit and shared axis references")
    void testSeriesShapeAndReferences() {
        RoiTableRegion rois = region(7L, 9L);
        Timestamps timestamps = new Timestamps(new double[]{0.0, 0.1, 0.2});
        RoiResponseInterface dff = RoiResponseInterface.dfOverF("dff");

        RoiResponseSeries series = dff.createRoiResponseSeries(
                "traces",
                new double[][]{{1.0, 4.0}, {2.0, 5.0}, {3.0, 6.0}},
                "NA",
                rois,
                timestamps
        );

        assertEquals(3, series.timepointCount());
        assertEquals(2, series.roiCount());
        assertEquals("NA", series.getUnit());
        assertSame(rois, series.getRois());
        assertSame(timestamps, series.getTimestamps());
        assertSame(series, dff.getRoiResponseSeries("traces").orElseThrow());
        assertEquals(RoiResponseInterface.Kind.DF_OVER_F, dff.getKind());

        AxisDescriptor axes = series.axisDescriptor();
        assertSame(rois, axes.getRois());
        assertSame(timestamps, axes.getTimestamps());
        assertEquals(2, axes.roiCount());
        assertEquals(3, axes.timepointCount());
    }

    @Test
    @DisplayName("Data accessors are defensive")
    void testDataCopies() {
        double[][] data = {{1.0}, {2.0}};
        RoiResponseSeries series = RoiResponseInterface.fluorescence("f").createRoiResponseSeries(
                "traces", data, "NA", region(1L), new Timestamps(new double[]{0.0, 1.0})
        );
        data[0][0] = 100.0;
        double[][] out = series.dataCopy();
        out[1][0] = 200.0;

        assertArrayEquals(new double[]{1.0}, series.dataCopy()[0]);
        assertArrayEquals(new double[]{2.0}, series.dataCopy()[1]);
    }

    @Test
    @DisplayName("Series rejects data that does not match the axes")
    void testShapeValidation() {
        RoiResponseInterface f = RoiResponseInterface.fluorescence("f");
        Timestamps twoTimestamps = new Timestamps(new double[]{0.0, 1.0});

        assertThrows(
                IllegalArgumentException.class,
                () -> f.createRoiResponseSeries("a", new double[][]{{1.0, 2.0}}, "NA", region(1L, 2L), twoTimestamps)
        );
        assertThrows(
                IllegalArgumentException.class,
                () -> f.createRoiResponseSeries("b", new double[][]{{1.0}, {2.0}}, "NA", region(1L, 2L), twoTimestamps)
        );
        assertThrows(
                NullPointerException.class,
                () -> f.createRoiResponseSeries("c", new double[][]{{1.0}, null}, "NA", region(1L), twoTimestamps)
        );
        assertTrue(f.getRoiResponseSeries().isEmpty());
    }

    @Test
    @DisplayName("Series names are unique within an interface")
    void testDuplicateSeriesRejected() {
        RoiResponseInterface f = RoiResponseInterface.fluorescence("f");
        Timestamps timestamps = new Timestamps(new double[]{0.0});
        f.createRoiResponseSeries("traces", new double[][]{{1.0}}, "NA", region(1L), timestamps);

        assertThrows(
                IllegalArgumentException.class,
                () -> f.createRoiResponseSeries("traces", new double[][]{{2.0}}, "NA", region(1L), timestamps)
        );
    }

    @Test
    @DisplayName("Timestamps must be finite and non-decreasing")
    void testTimestampValidation() {
        assertThrows(IllegalArgumentException.class, () -> new Timestamps(new double[]{0.0, Double.NaN}));
        assertThrows(IllegalArgumentException.class, () -> new Timestamps(new double[]{0.2, 0.1}));
        assertThrows(IllegalArgumentException.class, () -> new Timestamps(null));

        Timestamps timestamps = new Timestamps(new double[]{0.0, 0.0, 0.5});
        assertEquals(3, timestamps.count());
        assertEquals(0.5, timestamps.get(2));
        double[] seconds = timestamps.secondsCopy();
        seconds[2] = 9.0;
        assertArrayEquals(new double[]{0.0, 0.0, 0.5}, timestamps.secondsCopy());
        assertThrows(IllegalArgumentException.class, () -> timestamps.get(3));
    }
}
