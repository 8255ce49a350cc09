package org.Aayush.association.matching;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import org.Aayush.association.model.Match;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one matching call, expressed in the caller's index space.
 *
 * <p>Every input track index appears exactly once across {@link #getMatches()} and
 * {@link #getUnmatchedTracks()}; the same holds for detections.</p>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MatchingResult {
    /** Matched pairs in emission order. */
    List<Match> matches;
    /** Track indices left without a detection. */
    IntList unmatchedTracks;
    /** Detection indices that start no existing track. */
    IntList unmatchedDetections;

    /**
     * Creates an immutable result from copies of the given lists.
     */
    public static MatchingResult of(List<Match> matches, IntList unmatchedTracks, IntList unmatchedDetections) {
        return new MatchingResult(
                List.copyOf(Objects.requireNonNull(matches, "matches")),
                IntLists.unmodifiable(new IntArrayList(Objects.requireNonNull(unmatchedTracks, "unmatchedTracks"))),
                IntLists.unmodifiable(new IntArrayList(Objects.requireNonNull(unmatchedDetections, "unmatchedDetections")))
        );
    }

    /**
     * Result with no matches: every given track and detection is unmatched.
     */
    public static MatchingResult allUnmatched(IntList trackIndices, IntList detectionIndices) {
        return of(List.of(), trackIndices, detectionIndices);
    }

    /**
     * Track indices that appear in a match, in match order.
     */
    public IntList matchedTracks() {
        IntArrayList matched = new IntArrayList(matches.size());
        for (Match match : matches) {
            matched.add(match.trackIndex());
        }
        return matched;
    }

    /**
     * Detection indices that appear in a match, in match order.
     */
    public IntList matchedDetections() {
        IntArrayList matched = new IntArrayList(matches.size());
        for (Match match : matches) {
            matched.add(match.detectionIndex());
        }
        return matched;
    }
}
