package org.Aayush.app;

import org.Aayush.association.core.DataAssociator;
import org.Aayush.association.cost.CostMetric;
import org.Aayush.association.cost.IouCostMetric;
import org.Aayush.association.matching.MatchingResult;
import org.Aayush.association.model.BoundingBox;
import org.Aayush.association.model.Detection;
import org.Aayush.association.model.Match;
import org.Aayush.association.model.Track;

import java.util.List;

/**
 * Minimal application entry point that associates one synthetic frame.
 */
public class Main {

    /**
     * Runs the IoU matching cascade, gated by the constant-velocity model, and prints the result.
     * Thresholds come from {@code association.*} system properties when set.
     *
     * @param args command-line arguments (unused).
     */
    public static void main(String[] args) {
        List<DemoTrack> tracks = List.of(
                DemoTrack.at(50.0d, 50.0d, 0.5d, 100.0d, 1),
                DemoTrack.at(200.0d, 60.0d, 0.5d, 80.0d, 1),
                DemoTrack.at(400.0d, 300.0d, 0.5d, 60.0d, 3)
        );
        List<DemoDetection> detections = List.of(
                new DemoDetection(BoundingBox.fromXyah(52.0d, 51.0d, 0.5d, 100.0d)),
                new DemoDetection(BoundingBox.fromXyah(198.0d, 62.0d, 0.5d, 82.0d)),
                new DemoDetection(BoundingBox.fromXyah(600.0d, 600.0d, 0.5d, 90.0d))
        );

        DataAssociator associator = DataAssociator.withDefaults();
        CostMetric<DemoTrack, DemoDetection> metric = associator.gated(new IouCostMetric<>());
        MatchingResult result = associator.matchingCascade(metric, tracks, detections);

        System.out.println("solver = " + associator.telemetry().getSolverId());
        for (Match match : result.getMatches()) {
            System.out.println("match track=" + match.trackIndex() + " detection=" + match.detectionIndex());
        }
        System.out.println("unmatched tracks = " + result.getUnmatchedTracks());
        System.out.println("unmatched detections = " + result.getUnmatchedDetections());
    }

    private record DemoTrack(double[] mean, double[][] covariance, int timeSinceUpdate) implements Track {
        static DemoTrack at(double x, double y, double aspect, double height, int timeSinceUpdate) {
            double[] mean = {x, y, aspect, height, 0.0d, 0.0d, 0.0d, 0.0d};
            double[][] covariance = new double[8][8];
            for (int i = 0; i < 8; i++) {
                covariance[i][i] = 1.0d;
            }
            return new DemoTrack(mean, covariance, timeSinceUpdate);
        }
    }

    private record DemoDetection(BoundingBox box) implements Detection {
    }
}
