package org.Aayush.association.cost;

import it.unimi.dsi.fastutil.ints.IntList;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.association.core.AssociationException;
import org.Aayush.association.model.Detection;
import org.Aayush.association.model.IndexLists;
import org.Aayush.association.model.Track;
import org.Aayush.association.motion.MotionModel;

import java.util.List;
import java.util.Objects;

/**
 * Statistical feasibility filter for cost matrices.
 *
 * <p>Every track/detection pair whose gating distance is strictly above the chi-square 95%
 * threshold is replaced by {@link #gatedCost()}. A distance equal to the threshold is kept.
 * A NaN distance is treated as infeasible.</p>
 */
@Accessors(fluent = true)
public final class CostGate {
    public static final double DEFAULT_GATED_COST = 1e5;

    private final MotionModel motionModel;
    @Getter
    private final double gatedCost;
    @Getter
    private final boolean onlyPosition;
    @Getter
    private final double threshold;

    /**
     * Creates a gate with the default gated cost over all four measurement dimensions.
     */
    public CostGate(MotionModel motionModel) {
        this(motionModel, DEFAULT_GATED_COST, false);
    }

    /**
     * Creates a gate with explicit gated cost and dimensionality.
     *
     * @param motionModel motion model used for gating distances.
     * @param gatedCost cost written into infeasible entries.
     * @param onlyPosition true to gate on center position only (2 DOF).
     */
    public CostGate(MotionModel motionModel, double gatedCost, boolean onlyPosition) {
        this.motionModel = Objects.requireNonNull(motionModel, "motionModel");
        if (Double.isNaN(gatedCost) || gatedCost < 0.0d) {
            throw new IllegalArgumentException("gatedCost must be >= 0");
        }
        this.gatedCost = gatedCost;
        this.onlyPosition = onlyPosition;
        this.threshold = ChiSquareTable.gatingThreshold(onlyPosition);
    }

    /**
     * Returns a copy of {@code costMatrix} with infeasible entries set to the gated cost.
     *
     * @param costMatrix N x M matrix over {@code trackIndices} x {@code detectionIndices}.
     * @throws AssociationException when the matrix shape does not match the index lists.
     */
    public <T extends Track, D extends Detection> CostMatrix gate(
            CostMatrix costMatrix,
            List<T> tracks,
            List<D> detections,
            IntList trackIndices,
            IntList detectionIndices
    ) {
        Objects.requireNonNull(costMatrix, "costMatrix");
        Objects.requireNonNull(tracks, "tracks");
        Objects.requireNonNull(detections, "detections");
        IntList rows = IndexLists.orAll(trackIndices, tracks.size());
        IntList cols = IndexLists.orAll(detectionIndices, detections.size());
        IndexLists.validate(rows, tracks.size(), "trackIndices");
        IndexLists.validate(cols, detections.size(), "detectionIndices");
        costMatrix.requireShape(rows.size(), cols.size());

        double[][] measurements = new double[cols.size()][];
        for (int j = 0; j < cols.size(); j++) {
            measurements[j] = detections.get(cols.getInt(j)).toXyah();
        }

        double[][] gated = costMatrix.toArray();
        for (int i = 0; i < rows.size(); i++) {
            Track track = tracks.get(rows.getInt(i));
            double[] distances = motionModel.gatingDistance(track.mean(), track.covariance(), measurements, onlyPosition);
            if (distances.length != measurements.length) {
                throw new AssociationException(
                        AssociationException.REASON_GATING_FAILED,
                        "motion model returned " + distances.length + " distances for " + measurements.length + " measurements"
                );
            }
            for (int j = 0; j < distances.length; j++) {
                if (!(distances[j] <= threshold)) {
                    gated[i][j] = gatedCost;
                }
            }
        }
        return CostMatrix.of(gated);
    }
}
