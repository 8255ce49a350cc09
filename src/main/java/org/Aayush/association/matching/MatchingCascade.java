package org.Aayush.association.matching;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import org.Aayush.association.core.AssociationException;
import org.Aayush.association.cost.CostMetric;
import org.Aayush.association.model.Detection;
import org.Aayush.association.model.IndexLists;
import org.Aayush.association.model.Match;
import org.Aayush.association.model.Track;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Staged matching that offers detections to recently updated tracks first.
 *
 * <p>Level {@code k} (0-based) considers only tracks with {@code timeSinceUpdate == k + 1}
 * against the detections still unmatched after earlier levels. Tracks that are not matched at
 * their own level stay available; a track outside every level remains unmatched.</p>
 */
public final class MatchingCascade {
    private static final Logger log = LoggerFactory.getLogger(MatchingCascade.class);

    private final MinCostMatcher matcher;

    public MatchingCascade(MinCostMatcher matcher) {
        this.matcher = Objects.requireNonNull(matcher, "matcher");
    }

    /**
     * Runs the cascade over all tracks and detections.
     */
    public <T extends Track, D extends Detection> MatchingResult match(
            CostMetric<T, D> metric,
            double maxDistance,
            int cascadeDepth,
            List<T> tracks,
            List<D> detections
    ) {
        return match(metric, maxDistance, cascadeDepth, tracks, detections, null, null);
    }

    /**
     * Runs the cascade over the given subsets.
     *
     * @param metric cost metric shared by every level.
     * @param maxDistance gating threshold shared by every level.
     * @param cascadeDepth number of levels; normally the maximum track age.
     * @param tracks full track collection.
     * @param detections full detection collection.
     * @param trackIndices tracks to consider, or null for all.
     * @param detectionIndices detections to consider, or null for all.
     * @return accumulated matches, surviving tracks and leftover detections.
     */
    public <T extends Track, D extends Detection> MatchingResult match(
            CostMetric<T, D> metric,
            double maxDistance,
            int cascadeDepth,
            List<T> tracks,
            List<D> detections,
            IntList trackIndices,
            IntList detectionIndices
    ) {
        Objects.requireNonNull(metric, "metric");
        Objects.requireNonNull(tracks, "tracks");
        Objects.requireNonNull(detections, "detections");
        MinCostMatcher.requireMaxDistance(maxDistance);
        if (cascadeDepth < 0) {
            throw new AssociationException(
                    AssociationException.REASON_INVALID_CONFIG,
                    "cascadeDepth must be >= 0, got " + cascadeDepth
            );
        }
        IntList allTracks = IndexLists.orAll(trackIndices, tracks.size());
        IntList allDetections = IndexLists.orAll(detectionIndices, detections.size());
        IndexLists.validate(allTracks, tracks.size(), "trackIndices");
        IndexLists.validate(allDetections, detections.size(), "detectionIndices");

        IntOpenHashSet available = new IntOpenHashSet(allTracks);
        IntArrayList survivors = new IntArrayList(allTracks);
        IntList unmatchedDetections = new IntArrayList(allDetections);
        List<Match> matches = new ArrayList<>();

        for (int level = 0; level < cascadeDepth; level++) {
            if (unmatchedDetections.isEmpty()) {
                break;
            }
            IntArrayList levelTracks = tracksAtAge(tracks, survivors, level + 1);
            if (levelTracks.isEmpty()) {
                continue;
            }

            MatchingResult round = matcher.match(metric, maxDistance, tracks, detections, levelTracks, unmatchedDetections);
            for (Match match : round.getMatches()) {
                available.remove(match.trackIndex());
            }
            matches.addAll(round.getMatches());
            survivors = retainAvailable(survivors, available);
            unmatchedDetections = round.getUnmatchedDetections();

            log.debug(
                    "Cascade level {}: {} candidate tracks, {} matches, {} detections left",
                    level,
                    levelTracks.size(),
                    round.getMatches().size(),
                    unmatchedDetections.size()
            );
        }
        return MatchingResult.of(matches, survivors, unmatchedDetections);
    }

    private static <T extends Track> IntArrayList tracksAtAge(List<T> tracks, IntList candidates, int age) {
        IntArrayList selected = new IntArrayList();
        for (int i = 0; i < candidates.size(); i++) {
            int trackIndex = candidates.getInt(i);
            if (tracks.get(trackIndex).timeSinceUpdate() == age) {
                selected.add(trackIndex);
            }
        }
        return selected;
    }

    private static IntArrayList retainAvailable(IntList previous, IntOpenHashSet available) {
        IntArrayList rebuilt = new IntArrayList(available.size());
        for (int i = 0; i < previous.size(); i++) {
            int trackIndex = previous.getInt(i);
            if (available.contains(trackIndex)) {
                rebuilt.add(trackIndex);
            }
        }
        return rebuilt;
    }
}
