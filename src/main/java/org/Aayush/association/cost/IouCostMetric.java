package org.Aayush.association.cost;

import it.unimi.dsi.fastutil.ints.IntList;
import org.Aayush.association.model.BoundingBox;
import org.Aayush.association.model.Detection;
import org.Aayush.association.model.Track;

import java.util.Arrays;
import java.util.List;

/**
 * Overlap cost {@code 1 - IoU(track box, detection box)}.
 *
 * <p>Only tracks updated in the previous frame are scored; rows for older tracks are filled with
 * the infeasible cost because their predicted box drifts too far for overlap to be meaningful.
 * A prediction whose height or width has collapsed below zero, or gone non-finite, has no box
 * to overlap and is scored infeasible as well.</p>
 */
public final class IouCostMetric<T extends Track, D extends Detection> implements CostMetric<T, D> {
    private final double infeasibleCost;

    public IouCostMetric() {
        this(CostGate.DEFAULT_GATED_COST);
    }

    public IouCostMetric(double infeasibleCost) {
        if (Double.isNaN(infeasibleCost) || infeasibleCost < 0.0d) {
            throw new IllegalArgumentException("infeasibleCost must be >= 0");
        }
        this.infeasibleCost = infeasibleCost;
    }

    @Override
    public CostMatrix compute(List<T> tracks, List<D> detections, IntList trackIndices, IntList detectionIndices) {
        if (trackIndices.isEmpty()) {
            return CostMatrix.filled(0, detectionIndices.size(), 0.0d);
        }
        double[][] cost = new double[trackIndices.size()][detectionIndices.size()];
        BoundingBox[] candidates = new BoundingBox[detectionIndices.size()];
        for (int j = 0; j < candidates.length; j++) {
            candidates[j] = detections.get(detectionIndices.getInt(j)).box();
        }
        for (int i = 0; i < trackIndices.size(); i++) {
            Track track = tracks.get(trackIndices.getInt(i));
            if (track.timeSinceUpdate() > 1 || !hasUsableBox(track.mean())) {
                Arrays.fill(cost[i], infeasibleCost);
                continue;
            }
            BoundingBox box = track.box();
            for (int j = 0; j < candidates.length; j++) {
                cost[i][j] = 1.0d - box.iou(candidates[j]);
            }
        }
        return CostMatrix.of(cost);
    }

    private static boolean hasUsableBox(double[] mean) {
        double height = mean[3];
        double width = mean[2] * height;
        return Double.isFinite(mean[0])
                && Double.isFinite(mean[1])
                && Double.isFinite(width)
                && Double.isFinite(height)
                && width >= 0.0d
                && height >= 0.0d;
    }
}
