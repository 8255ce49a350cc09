package org.Aayush.association.matching;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.Aayush.association.core.AssociationException;
import org.Aayush.association.cost.CostMatrix;
import org.Aayush.association.cost.CostMetric;
import org.Aayush.association.model.Detection;
import org.Aayush.association.model.IndexLists;
import org.Aayush.association.model.Match;
import org.Aayush.association.model.Track;
import org.Aayush.association.solver.Assignment;
import org.Aayush.association.solver.AssignmentSolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Single-pass gated minimum-cost matching.
 *
 * <p>Execution flow:</p>
 * <ul>
 * <li>Short-circuit to all-unmatched when either index list is empty.</li>
 * <li>Evaluate the metric over exactly the given index subsets and check its shape.</li>
 * <li>Cap every cost at {@code maxDistance + epsilon} and solve the capped matrix.</li>
 * <li>Normalize solver output so each column belongs to at most one row.</li>
 * <li>Reject assigned pairs whose uncapped cost exceeds {@code maxDistance}.</li>
 * <li>Translate rows and columns back to caller indices.</li>
 * </ul>
 *
 * <p>The cap and the rejection use the same {@code maxDistance}; epsilon only separates
 * infeasible entries from a feasible entry sitting exactly on the threshold.</p>
 */
public final class MinCostMatcher {
    private static final Logger log = LoggerFactory.getLogger(MinCostMatcher.class);

    public static final double DEFAULT_EPSILON = 1e-5;

    private final AssignmentSolver solver;
    private final double epsilon;

    /**
     * Creates a matcher with {@link #DEFAULT_EPSILON}.
     */
    public MinCostMatcher(AssignmentSolver solver) {
        this(solver, DEFAULT_EPSILON);
    }

    /**
     * Creates a matcher with explicit clamp epsilon.
     */
    public MinCostMatcher(AssignmentSolver solver, double epsilon) {
        this.solver = Objects.requireNonNull(solver, "solver");
        if (!(epsilon > 0.0d) || Double.isInfinite(epsilon)) {
            throw new IllegalArgumentException("epsilon must be finite and > 0");
        }
        this.epsilon = epsilon;
    }

    public AssignmentSolver solver() {
        return solver;
    }

    public double epsilon() {
        return epsilon;
    }

    /**
     * Matches all tracks against all detections.
     */
    public <T extends Track, D extends Detection> MatchingResult match(
            CostMetric<T, D> metric,
            double maxDistance,
            List<T> tracks,
            List<D> detections
    ) {
        return match(metric, maxDistance, tracks, detections, null, null);
    }

    /**
     * Runs one matching round over the given subsets.
     *
     * @param metric cost metric evaluated over {@code trackIndices x detectionIndices}.
     * @param maxDistance gating threshold; pairs with larger cost are never matched.
     * @param tracks full track collection.
     * @param detections full detection collection.
     * @param trackIndices rows to consider, or null for all tracks.
     * @param detectionIndices columns to consider, or null for all detections.
     * @return matches and leftovers in caller index space.
     * @throws AssociationException when index lists or the metric result violate their contracts.
     */
    public <T extends Track, D extends Detection> MatchingResult match(
            CostMetric<T, D> metric,
            double maxDistance,
            List<T> tracks,
            List<D> detections,
            IntList trackIndices,
            IntList detectionIndices
    ) {
        Objects.requireNonNull(metric, "metric");
        Objects.requireNonNull(tracks, "tracks");
        Objects.requireNonNull(detections, "detections");
        requireMaxDistance(maxDistance);
        IntList rows = IndexLists.orAll(trackIndices, tracks.size());
        IntList cols = IndexLists.orAll(detectionIndices, detections.size());
        IndexLists.validate(rows, tracks.size(), "trackIndices");
        IndexLists.validate(cols, detections.size(), "detectionIndices");

        if (rows.isEmpty() || cols.isEmpty()) {
            return MatchingResult.allUnmatched(rows, cols);
        }

        CostMatrix costMatrix = metric.compute(tracks, detections, rows, cols);
        if (costMatrix == null) {
            throw new AssociationException(
                    AssociationException.REASON_METRIC_RESULT_REQUIRED,
                    "cost metric returned null"
            );
        }
        costMatrix.requireShape(rows.size(), cols.size());
        costMatrix.requireNonNegative();

        CostMatrix clamped = costMatrix.clampedCopy(maxDistance + epsilon);
        int[] raw = solver.solve(clamped.flatten(), clamped.rows(), clamped.cols());
        Assignment assignment = Assignment.fromSolverOutput(raw, clamped.cols());
        if (assignment.correctedRows() > 0) {
            log.debug("Solver {} repeated columns; {} rows demoted to unassigned", solver.id(), assignment.correctedRows());
        }

        List<Match> matches = new ArrayList<>(assignment.assignedCount());
        IntArrayList unmatchedTracks = new IntArrayList();
        IntArrayList unmatchedDetections = new IntArrayList();
        for (int col = 0; col < cols.size(); col++) {
            if (!assignment.isColumnUsed(col)) {
                unmatchedDetections.add(cols.getInt(col));
            }
        }
        for (int row = 0; row < rows.size(); row++) {
            int trackIndex = rows.getInt(row);
            OptionalInt col = assignment.columnFor(row);
            if (col.isEmpty()) {
                unmatchedTracks.add(trackIndex);
                continue;
            }
            int detectionIndex = cols.getInt(col.getAsInt());
            if (costMatrix.get(row, col.getAsInt()) > maxDistance) {
                unmatchedTracks.add(trackIndex);
                unmatchedDetections.add(detectionIndex);
            } else {
                matches.add(new Match(trackIndex, detectionIndex));
            }
        }

        log.debug(
                "Matched {}x{} with solver {}: {} matches, {} unmatched tracks, {} unmatched detections",
                rows.size(),
                cols.size(),
                solver.id(),
                matches.size(),
                unmatchedTracks.size(),
                unmatchedDetections.size()
        );
        return MatchingResult.of(matches, unmatchedTracks, unmatchedDetections);
    }

    static void requireMaxDistance(double maxDistance) {
        if (!Double.isFinite(maxDistance) || maxDistance < 0.0d) {
            throw new AssociationException(
                    AssociationException.REASON_INVALID_CONFIG,
                    "maxDistance must be finite and >= 0, got " + maxDistance
            );
        }
    }
}
