package org.Aayush.association.matching;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.Aayush.association.core.AssociationException;
import org.Aayush.association.cost.CostMetric;
import org.Aayush.association.model.Match;
import org.Aayush.association.solver.HungarianAssignmentSolver;
import org.Aayush.association.testutil.AssociationAssertions;
import org.Aayush.association.testutil.AssociationFixtures;
import org.Aayush.association.testutil.AssociationFixtures.TestDetection;
import org.Aayush.association.testutil.AssociationFixtures.TestTrack;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("MatchingCascade Tests")
class MatchingCascadeTest {

    private final MatchingCascade cascade = new MatchingCascade(new MinCostMatcher(new HungarianAssignmentSolver()));

    @Test
    @DisplayName("Equal-cost detection goes to the most recently updated track")
    void testYoungestTrackWins() {
        MatchingResult result = cascade.match(
                AssociationFixtures.constantMetric(0.1d),
                0.5d,
                30,
                AssociationFixtures.tracksWithAges(1, 2, 3),
                AssociationFixtures.detections(1)
        );

        assertEquals(List.of(new Match(0, 0)), result.getMatches());
        assertEquals(IntArrayList.of(1, 2), result.getUnmatchedTracks());
        assertTrue(result.getUnmatchedDetections().isEmpty());
    }

    @Test
    @DisplayName("Priority follows track age, not position in the track list")
    void testPriorityByAgeNotPosition() {
        MatchingResult result = cascade.match(
                AssociationFixtures.constantMetric(0.1d),
                0.5d,
                30,
                AssociationFixtures.tracksWithAges(3, 2, 1),
                AssociationFixtures.detections(1)
        );

        assertEquals(List.of(new Match(2, 0)), result.getMatches());
        assertEquals(IntArrayList.of(0, 1), result.getUnmatchedTracks());
    }

    @Test
    @DisplayName("Leftover detections carry forward to older tracks")
    void testDetectionsCarryForward() {
        double[][] table = {
                {0.1, 0.9},
                {0.05, 0.1}
        };
        MatchingResult result = cascade.match(
                AssociationFixtures.tableMetric(table),
                0.5d,
                30,
                AssociationFixtures.tracksWithAges(1, 2),
                AssociationFixtures.detections(2)
        );

        assertEquals(List.of(new Match(0, 0), new Match(1, 1)), result.getMatches());
        assertTrue(result.getUnmatchedTracks().isEmpty());
        assertTrue(result.getUnmatchedDetections().isEmpty());
    }

    @Test
    @DisplayName("Levels without tracks are skipped and later levels still run")
    void testEmptyLevelsSkipped() {
        List<IntList> seenRows = new ArrayList<>();
        CostMetric<TestTrack, TestDetection> recording = (tracks, detections, rows, cols) -> {
            seenRows.add(new IntArrayList(rows));
            return AssociationFixtures.<TestTrack, TestDetection>constantMetric(0.1d).compute(tracks, detections, rows, cols);
        };
        MatchingResult result = cascade.match(
                recording,
                0.5d,
                5,
                AssociationFixtures.tracksWithAges(4, 1),
                AssociationFixtures.detections(2)
        );

        assertEquals(List.of(IntArrayList.of(1), IntArrayList.of(0)), seenRows);
        assertEquals(2, result.getMatches().size());
    }

    @Test
    @DisplayName("Cascade stops once every detection is matched")
    void testStopsWhenDetectionsExhausted() {
        int[] calls = new int[1];
        CostMetric<TestTrack, TestDetection> counting = (tracks, detections, rows, cols) -> {
            calls[0]++;
            return AssociationFixtures.<TestTrack, TestDetection>constantMetric(0.1d).compute(tracks, detections, rows, cols);
        };
        MatchingResult result = cascade.match(
                counting,
                0.5d,
                30,
                AssociationFixtures.tracksWithAges(1, 1, 2),
                AssociationFixtures.detections(1)
        );

        assertEquals(1, calls[0]);
        assertEquals(1, result.getMatches().size());
        assertEquals(2, result.getUnmatchedTracks().size());
    }

    @Test
    @DisplayName("Tracks older than the cascade depth are never matched")
    void testTracksBeyondDepthUnmatched() {
        MatchingResult result = cascade.match(
                AssociationFixtures.constantMetric(0.1d),
                0.5d,
                2,
                AssociationFixtures.tracksWithAges(3, 5),
                AssociationFixtures.detections(2)
        );

        assertTrue(result.getMatches().isEmpty());
        assertEquals(IntArrayList.of(0, 1), result.getUnmatchedTracks());
        assertEquals(IntArrayList.of(0, 1), result.getUnmatchedDetections());
    }

    @Test
    @DisplayName("Track rejected at its level by threshold stays unmatched")
    void testRejectedTrackStaysUnmatched() {
        MatchingResult result = cascade.match(
                AssociationFixtures.constantMetric(0.9d),
                0.5d,
                30,
                AssociationFixtures.tracksWithAges(1),
                AssociationFixtures.detections(1)
        );

        assertTrue(result.getMatches().isEmpty());
        assertEquals(IntArrayList.of(0), result.getUnmatchedTracks());
        assertEquals(IntArrayList.of(0), result.getUnmatchedDetections());
    }

    @Test
    @DisplayName("Index subsets restrict both sides and results stay in caller space")
    void testSubsets() {
        MatchingResult result = cascade.match(
                AssociationFixtures.constantMetric(0.1d),
                0.5d,
                30,
                AssociationFixtures.tracksWithAges(1, 1, 2),
                AssociationFixtures.detections(3),
                IntArrayList.of(2, 1),
                IntArrayList.of(2)
        );

        assertEquals(List.of(new Match(1, 2)), result.getMatches());
        assertEquals(IntArrayList.of(2), result.getUnmatchedTracks());
        assertTrue(result.getUnmatchedDetections().isEmpty());
    }

    @Test
    @DisplayName("Zero depth and empty detections leave everything unmatched; negative depth is rejected")
    void testDegenerateDepths() {
        MatchingResult zeroDepth = cascade.match(
                AssociationFixtures.constantMetric(0.1d),
                0.5d,
                0,
                AssociationFixtures.tracksWithAges(1),
                AssociationFixtures.detections(1)
        );
        assertTrue(zeroDepth.getMatches().isEmpty());
        assertEquals(IntArrayList.of(0), zeroDepth.getUnmatchedDetections());

        MatchingResult noDetections = cascade.match(
                AssociationFixtures.constantMetric(0.1d),
                0.5d,
                30,
                AssociationFixtures.tracksWithAges(1, 2),
                AssociationFixtures.detections(0)
        );
        assertEquals(IntArrayList.of(0, 1), noDetections.getUnmatchedTracks());

        AssociationException ex = assertThrows(
                AssociationException.class,
                () -> cascade.match(
                        AssociationFixtures.constantMetric(0.1d),
                        0.5d,
                        -1,
                        AssociationFixtures.tracksWithAges(1),
                        AssociationFixtures.detections(1)
                )
        );
        assertEquals(AssociationException.REASON_INVALID_CONFIG, ex.getReasonCode());
    }

    @Test
    @DisplayName("Random frames: cascade output partitions inputs and respects maxDistance")
    void testRandomFramesPartition() {
        Random random = new Random(7L);
        for (int trial = 0; trial < 50; trial++) {
            int trackCount = 1 + random.nextInt(8);
            int detectionCount = random.nextInt(8);
            int[] ages = new int[trackCount];
            for (int i = 0; i < trackCount; i++) {
                ages[i] = 1 + random.nextInt(4);
            }
            double[][] table = new double[trackCount][detectionCount];
            for (double[] row : table) {
                for (int j = 0; j < row.length; j++) {
                    row[j] = random.nextDouble();
                }
            }

            MatchingResult result = cascade.match(
                    AssociationFixtures.tableMetric(table),
                    0.4d,
                    3,
                    AssociationFixtures.tracksWithAges(ages),
                    AssociationFixtures.detections(detectionCount)
            );

            AssociationAssertions.assertPartition(result, IntArrayList.of(range(trackCount)), IntArrayList.of(range(detectionCount)));
            AssociationAssertions.assertWithinThreshold(result, table, 0.4d);
            for (Match match : result.getMatches()) {
                assertTrue(ages[match.trackIndex()] <= 3);
            }
        }
    }

    private static int[] range(int size) {
        int[] values = new int[size];
        for (int i = 0; i < size; i++) {
            values[i] = i;
        }
        return values;
    }
}
