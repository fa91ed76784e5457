package org.brainobservatory.testutil;

import org.brainobservatory.nwb.NwbFile;
import org.brainobservatory.nwb.ProcessingModule;
import org.brainobservatory.nwb.RoiResponseInterface;
import org.brainobservatory.nwb.RoiTable;
import org.brainobservatory.nwb.RoiTableRegion;
import org.brainobservatory.nwb.Timestamps;
import org.brainobservatory.traces.TraceOrientation;

/**
 * Shared container fixtures for trace read/write tests.
 */
public final class OphysFixtureFactory {
    public static final String OPHYS = "ophys";
    public static final String DFF = "dff";
    public static final String TRACES = "traces";

    private OphysFixtureFactory() {
    }

    /**
     * Creates a container holding only an empty {@code ophys} module.
     */
    public static NwbFile emptyOphysFile() {
        NwbFile nwbFile = new NwbFile("session-1", "fixture session");
        nwbFile.createProcessingModule(OPHYS, "optical physiology");
        return nwbFile;
    }

    /**
     * Creates a container with a {@code dff} companion over the given ROIs and timestamps.
     * Companion samples are derived from the row/column position so they never equal test traces.
     */
    public static NwbFile fileWithDffCompanion(long[] roiIds, double[] timestamps) {
        NwbFile nwbFile = emptyOphysFile();
        addDfOverF(nwbFile.getProcessingModule(OPHYS).orElseThrow(), DFF, roiIds, timestamps);
        return nwbFile;
    }

    /**
     * Adds a dF/F interface with one {@code traces} series covering every ROI of a fresh table.
     */
    public static RoiResponseInterface addDfOverF(
            ProcessingModule module,
            String interfaceName,
            long[] roiIds,
            double[] timestamps
    ) {
        RoiTable table = new RoiTable("cell_specimen_table", roiIds);
        RoiTableRegion region = RoiTableRegion.all("segmented cells", table);
        double[][] entityMajor = new double[roiIds.length][timestamps.length];
        for (int r = 0; r < roiIds.length; r++) {
            for (int t = 0; t < timestamps.length; t++) {
                entityMajor[r][t] = -(r * 1000.0 + t);
            }
        }
        RoiResponseInterface dff = RoiResponseInterface.dfOverF(interfaceName);
        dff.createRoiResponseSeries(
                TRACES,
                TraceOrientation.toTimeMajor(entityMajor, timestamps.length),
                "NA",
                region,
                new Timestamps(timestamps)
        );
        module.addDataInterface(dff);
        return dff;
    }

    /**
     * Evenly spaced timestamps starting at zero.
     */
    public static double[] timestamps(int count, double periodSeconds) {
        double[] out = new double[count];
        for (int i = 0; i < count; i++) {
            out[i] = i * periodSeconds;
        }
        return out;
    }
}
