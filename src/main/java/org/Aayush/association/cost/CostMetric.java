package org.Aayush.association.cost;

import it.unimi.dsi.fastutil.ints.IntList;
import org.Aayush.association.model.Detection;
import org.Aayush.association.model.Track;

import java.util.List;

/**
 * Caller-supplied association cost.
 *
 * <p>Given the full track and detection collections plus N track indices and M detection
 * indices, returns an N x M matrix where entry {@code (i, j)} is the cost of associating
 * {@code tracks.get(trackIndices.getInt(i))} with {@code detections.get(detectionIndices.getInt(j))}.</p>
 *
 * @param <T> track type.
 * @param <D> detection type.
 */
@FunctionalInterface
public interface CostMetric<T extends Track, D extends Detection> {

    CostMatrix compute(List<T> tracks, List<D> detections, IntList trackIndices, IntList detectionIndices);
}
