package org.Aayush.association.cost;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.Aayush.association.matching.MatchingCascade;
import org.Aayush.association.matching.MatchingResult;
import org.Aayush.association.matching.MinCostMatcher;
import org.Aayush.association.solver.HungarianAssignmentSolver;
import org.Aayush.association.testutil.AssociationFixtures;
import org.Aayush.association.testutil.AssociationFixtures.TestDetection;
import org.Aayush.association.testutil.AssociationFixtures.TestTrack;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("IouCostMetric Tests")
class IouCostMetricTest {

    private final IouCostMetric<TestTrack, TestDetection> metric = new IouCostMetric<>();

    @Test
    @DisplayName("Identical boxes cost 0, disjoint boxes cost 1, half overlap costs 2/3")
    void testOverlapCosts() {
        List<TestTrack> tracks = List.of(AssociationFixtures.track(10.0, 10.0, 1.0, 10.0, 1));
        List<TestDetection> detections = List.of(
                AssociationFixtures.detection(10.0, 10.0, 1.0, 10.0),
                AssociationFixtures.detection(100.0, 100.0, 1.0, 10.0),
                AssociationFixtures.detection(15.0, 10.0, 1.0, 10.0)
        );

        CostMatrix cost = metric.compute(tracks, detections, IntArrayList.of(0), IntArrayList.of(0, 1, 2));

        assertEquals(0.0d, cost.get(0, 0), 1e-12);
        assertEquals(1.0d, cost.get(0, 1), 1e-12);
        assertEquals(2.0d / 3.0d, cost.get(0, 2), 1e-12);
    }

    @Test
    @DisplayName("Tracks not updated last frame get the infeasible cost for the whole row")
    void testStaleTrackRow() {
        List<TestTrack> tracks = List.of(
                AssociationFixtures.track(10.0, 10.0, 1.0, 10.0, 1),
                AssociationFixtures.track(10.0, 10.0, 1.0, 10.0, 2)
        );
        List<TestDetection> detections = List.of(AssociationFixtures.detection(10.0, 10.0, 1.0, 10.0));

        CostMatrix cost = metric.compute(tracks, detections, IntArrayList.of(1, 0), IntArrayList.of(0));

        assertEquals(CostGate.DEFAULT_GATED_COST, cost.get(0, 0));
        assertEquals(0.0d, cost.get(1, 0), 1e-12);
    }

    @Test
    @DisplayName("Collapsed predicted box is scored infeasible instead of failing")
    void testCollapsedPredictionRow() {
        List<TestTrack> tracks = List.of(
                AssociationFixtures.track(10.0, 10.0, 1.0, -0.5, 1),
                AssociationFixtures.track(10.0, 10.0, -1.0, 10.0, 1),
                AssociationFixtures.track(10.0, 10.0, 1.0, 10.0, 1)
        );
        List<TestDetection> detections = List.of(AssociationFixtures.detection(10.0, 10.0, 1.0, 10.0));

        CostMatrix cost = metric.compute(tracks, detections, IntArrayList.of(0, 1, 2), IntArrayList.of(0));

        assertEquals(CostGate.DEFAULT_GATED_COST, cost.get(0, 0));
        assertEquals(CostGate.DEFAULT_GATED_COST, cost.get(1, 0));
        assertEquals(0.0d, cost.get(2, 0), 1e-12);
    }

    @Test
    @DisplayName("Cascade over a collapsed prediction leaves that track unmatched")
    void testCollapsedPredictionInCascade() {
        List<TestTrack> tracks = List.of(AssociationFixtures.track(10.0, 10.0, 1.0, -0.5, 1));
        List<TestDetection> detections = List.of(AssociationFixtures.detection(10.0, 10.0, 1.0, 10.0));
        MatchingCascade cascade = new MatchingCascade(new MinCostMatcher(new HungarianAssignmentSolver()));

        MatchingResult result = cascade.match(metric, 0.7d, 30, tracks, detections);

        assertTrue(result.getMatches().isEmpty());
        assertEquals(IntArrayList.of(0), result.getUnmatchedTracks());
        assertEquals(IntArrayList.of(0), result.getUnmatchedDetections());
    }
}
