package org.brainobservatory.traces;

import org.brainobservatory.dataobject.DataObject;
import org.brainobservatory.nwb.AxisDescriptor;
import org.brainobservatory.nwb.NwbFile;
import org.brainobservatory.nwb.ProcessingModule;
import org.brainobservatory.nwb.RoiResponseInterface;
import org.brainobservatory.nwb.RoiResponseSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;

/**
 * Corrected fluorescence traces of one imaging session.
 *
 * <p>Contract summary:</p>
 * <ul>
 * <li>Value is an entity-major {@link TraceTable}, immutable after construction.</li>
 * <li>Containers store the traces time-major; reads and writes transpose exactly once.</li>
 * <li>Writes borrow the ROI region and timestamps of a companion modality by reference and
 * validate everything before the container is touched.</li>
 * </ul>
 */
public final class CorrectedFluorescenceTraces extends DataObject<TraceTable> {

    public static final String NAME = "corrected_fluorescence_traces";

    private static final Logger LOG = LoggerFactory.getLogger(CorrectedFluorescenceTraces.class);

    public CorrectedFluorescenceTraces(TraceTable traces) {
        this(traces, null);
    }

    /**
     * @param traces source traces indexed by {@code cell_roi_id}.
     * @param filterToRoiIds when non-null, keep only these ids in this order, for example to drop invalid ROIs.
     * @throws TraceValidationException when a requested id is absent from {@code traces} or requested twice.
     */
    public CorrectedFluorescenceTraces(TraceTable traces, long[] filterToRoiIds) {
        super(NAME, filter(traces, filterToRoiIds));
    }

    private static TraceTable filter(TraceTable traces, long[] filterToRoiIds) {
        Objects.requireNonNull(traces, "traces");
        if (filterToRoiIds == null) {
            return traces;
        }
        return RoiFilter.apply(traces, filterToRoiIds).orElseThrow();
    }

    /**
     * Reads the traces from the container using {@link TraceNwbConfig#defaults()}.
     */
    public static CorrectedFluorescenceTraces fromNwb(NwbFile nwbFile) {
        return fromNwb(nwbFile, null, TraceNwbConfig.defaults());
    }

    public static CorrectedFluorescenceTraces fromNwb(NwbFile nwbFile, long[] filterToRoiIds) {
        return fromNwb(nwbFile, filterToRoiIds, TraceNwbConfig.defaults());
    }

    /**
     * Reads the time-major block, transposes it to one row per ROI and indexes it by the block's ROI ids.
     *
     * @throws MissingDependencyException when the module, interface or series is absent.
     */
    public static CorrectedFluorescenceTraces fromNwb(
            NwbFile nwbFile,
            long[] filterToRoiIds,
            TraceNwbConfig config
    ) {
        Objects.requireNonNull(nwbFile, "nwbFile");
        Objects.requireNonNull(config, "config");

        RoiResponseSeries series = requireModule(nwbFile, config)
                .getDataInterface(config.getInterfaceName())
                .flatMap(dataInterface -> dataInterface.getRoiResponseSeries(config.getSeriesName()))
                .orElseThrow(() -> new MissingDependencyException(
                        MissingDependencyException.CONTAINER_BLOCK_MISSING,
                        "no series '" + config.getSeriesName() + "' in interface '"
                                + config.getInterfaceName() + "' of module '"
                                + config.getProcessingModuleName() + "'"
                ));

        // stored as timepoints x rois; the table wants rois x timepoints
        long[] roiIds = series.getRois().ids();
        double[][] entityMajor = TraceOrientation.toEntityMajor(series.dataCopy(), roiIds.length);
        TraceTable table = TraceTable.of(TraceTable.CELL_ROI_ID, roiIds, entityMajor, series.timepointCount());
        LOG.debug("Read {} ROIs x {} timepoints from {}/{}/{} of {}",
                table.size(), table.timepointCount(), config.getProcessingModuleName(),
                config.getInterfaceName(), config.getSeriesName(), nwbFile.getIdentifier());
        return new CorrectedFluorescenceTraces(table, filterToRoiIds);
    }

    /**
     * Reads the traces from a demix output. The demix data is already entity-major and unfiltered.
     */
    public static CorrectedFluorescenceTraces fromDataFile(DemixFile demixFile) {
        Objects.requireNonNull(demixFile, "demixFile");
        TraceTable data = Objects.requireNonNull(demixFile.getData(), "demixFile.getData()");
        LOG.debug("Read {} ROIs x {} timepoints from demix file", data.size(), data.timepointCount());
        return new CorrectedFluorescenceTraces(data);
    }

    /**
     * Writes the traces into the container using {@link TraceNwbConfig#defaults()}.
     *
     * @see #toNwb(NwbFile, String, TraceNwbConfig)
     */
    public NwbFile toNwb(NwbFile nwbFile, String companionInterfaceName) {
        return toNwb(nwbFile, companionInterfaceName, TraceNwbConfig.defaults());
    }

    /**
     * Writes the traces as a new time-major series aligned to a companion modality.
     *
     * <p>The companion series (same series name, interface {@code companionInterfaceName}) must already be
     * in the container; its ROI region and timestamps are attached to the new series by reference. Table
     * row ids must equal the companion region ids in order. Every check runs before the container is
     * modified, so a failed write leaves it unchanged.</p>
     *
     * @param nwbFile target container.
     * @param companionInterfaceName interface owning the borrowed axes, conventionally
     *                               {@link TraceNwbConfig#DEFAULT_COMPANION_INTERFACE}.
     * @param config container naming.
     * @return {@code nwbFile}.
     * @throws TraceInvariantException on wrong index name, misaligned ROIs or timestamps, or an existing target.
     * @throws MissingDependencyException when the module or companion series is absent.
     */
    public NwbFile toNwb(NwbFile nwbFile, String companionInterfaceName, TraceNwbConfig config) {
        Objects.requireNonNull(nwbFile, "nwbFile");
        Objects.requireNonNull(companionInterfaceName, "companionInterfaceName");
        Objects.requireNonNull(config, "config");
        TraceTable traces = getValue();

        if (!config.getRequiredIndexName().equals(traces.getIndexName())) {
            throw new TraceInvariantException(
                    TraceInvariantException.INDEX_NAME_MISMATCH,
                    "index name must be '" + config.getRequiredIndexName() + "' but was '"
                            + traces.getIndexName() + "'"
            );
        }

        ProcessingModule ophysModule = requireModule(nwbFile, config);
        AxisDescriptor axes = ophysModule.getDataInterface(companionInterfaceName)
                .flatMap(companion -> companion.getRoiResponseSeries(config.getSeriesName()))
                .map(RoiResponseSeries::axisDescriptor)
                .orElseThrow(() -> new MissingDependencyException(
                        MissingDependencyException.COMPANION_MODALITY_MISSING,
                        "companion series '" + companionInterfaceName + "/" + config.getSeriesName()
                                + "' must be written before " + config.getInterfaceName()
                ));

        if (ophysModule.hasDataInterface(config.getInterfaceName())) {
            throw new TraceInvariantException(
                    TraceInvariantException.TARGET_ALREADY_PRESENT,
                    "data interface '" + config.getInterfaceName() + "' already exists in module '"
                            + ophysModule.getName() + "'"
            );
        }
        requireAligned(traces, axes, companionInterfaceName);

        double[][] timeMajor = TraceOrientation.toTimeMajor(traces.toEntityMajor(), traces.timepointCount());
        RoiResponseInterface fluorescence = RoiResponseInterface.fluorescence(config.getInterfaceName());
        fluorescence.createRoiResponseSeries(
                config.getSeriesName(),
                timeMajor,
                config.getUnit(),
                axes.getRois(),
                axes.getTimestamps()
        );
        ophysModule.addDataInterface(fluorescence);
        LOG.debug("Wrote {} ROIs x {} timepoints to {}/{}/{} of {} (axes from {})",
                traces.size(), traces.timepointCount(), ophysModule.getName(), config.getInterfaceName(),
                config.getSeriesName(), nwbFile.getIdentifier(), companionInterfaceName);
        return nwbFile;
    }

    private static ProcessingModule requireModule(NwbFile nwbFile, TraceNwbConfig config) {
        return nwbFile.getProcessingModule(config.getProcessingModuleName())
                .orElseThrow(() -> new MissingDependencyException(
                        MissingDependencyException.PROCESSING_MODULE_MISSING,
                        "no processing module '" + config.getProcessingModuleName() + "' in "
                                + nwbFile.getIdentifier()
                ));
    }

    private static void requireAligned(TraceTable traces, AxisDescriptor axes, String companionInterfaceName) {
        long[] tableIds = traces.roiIdsCopy();
        long[] companionIds = axes.getRois().ids();
        if (!Arrays.equals(tableIds, companionIds)) {
            throw new TraceInvariantException(
                    TraceInvariantException.ROI_ALIGNMENT_MISMATCH,
                    "ROI ids " + Arrays.toString(tableIds) + " do not match '" + companionInterfaceName
                            + "' ROI ids " + Arrays.toString(companionIds)
            );
        }
        if (traces.timepointCount() != axes.timepointCount()) {
            throw new TraceInvariantException(
                    TraceInvariantException.TIMESTAMP_COUNT_MISMATCH,
                    "traces have " + traces.timepointCount() + " timepoints but '" + companionInterfaceName
                            + "' has " + axes.timepointCount() + " timestamps"
            );
        }
    }
}
