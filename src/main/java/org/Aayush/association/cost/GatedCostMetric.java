package org.Aayush.association.cost;

import it.unimi.dsi.fastutil.ints.IntList;
import org.Aayush.association.model.Detection;
import org.Aayush.association.model.Track;

import java.util.List;
import java.util.Objects;

/**
 * Decorates a base metric with motion-model gating.
 */
public final class GatedCostMetric<T extends Track, D extends Detection> implements CostMetric<T, D> {
    private final CostMetric<T, D> delegate;
    private final CostGate gate;

    public GatedCostMetric(CostMetric<T, D> delegate, CostGate gate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.gate = Objects.requireNonNull(gate, "gate");
    }

    @Override
    public CostMatrix compute(List<T> tracks, List<D> detections, IntList trackIndices, IntList detectionIndices) {
        CostMatrix raw = delegate.compute(tracks, detections, trackIndices, detectionIndices);
        return gate.gate(raw, tracks, detections, trackIndices, detectionIndices);
    }
}
