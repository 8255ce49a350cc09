package org.Aayush.association.core;

import it.unimi.dsi.fastutil.ints.IntList;
import lombok.Builder;
import org.Aayush.association.cost.CostGate;
import org.Aayush.association.cost.CostMatrix;
import org.Aayush.association.cost.CostMetric;
import org.Aayush.association.cost.GatedCostMetric;
import org.Aayush.association.matching.MatchingCascade;
import org.Aayush.association.matching.MatchingResult;
import org.Aayush.association.matching.MinCostMatcher;
import org.Aayush.association.model.Detection;
import org.Aayush.association.model.Track;
import org.Aayush.association.motion.ConstantVelocityMotionModel;
import org.Aayush.association.motion.MotionModel;
import org.Aayush.association.solver.AssignmentSolver;
import org.Aayush.association.solver.AssignmentSolverRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Per-frame data-association entry point.
 *
 * <p>The facade binds configuration, solver and motion model once and then exposes:</p>
 * <ul>
 * <li>{@link #minCostMatching} for one gated matching round.</li>
 * <li>{@link #matchingCascade} for staged matching by track staleness.</li>
 * <li>{@link #gateCostMatrix} to mark statistically infeasible pairs.</li>
 * </ul>
 *
 * <p>Instances hold no per-frame state and every call is independent given its arguments.</p>
 */
public final class DataAssociator {
    private static final Logger log = LoggerFactory.getLogger(DataAssociator.class);

    private final AssociationConfig config;
    private final AssignmentSolver solver;
    private final CostGate costGate;
    private final MinCostMatcher matcher;
    private final MatchingCascade cascade;

    /**
     * Creates the facade with strict configuration validation.
     *
     * @param config association parameters, or null for {@link AssociationConfig#defaults()}.
     * @param solverRegistry solver lookup, or null for {@link AssignmentSolverRegistry#builtIns()}.
     * @param motionModel gating model, or null for {@link ConstantVelocityMotionModel}.
     * @throws AssociationException when configuration is invalid or the solver id is unknown.
     */
    @Builder
    public DataAssociator(
            AssociationConfig config,
            AssignmentSolverRegistry solverRegistry,
            MotionModel motionModel
    ) {
        this.config = (config == null ? AssociationConfig.defaults() : config).validate();
        this.solver = (solverRegistry == null ? AssignmentSolverRegistry.builtIns() : solverRegistry)
                .solver(this.config.getSolverId());
        this.costGate = new CostGate(
                motionModel == null ? new ConstantVelocityMotionModel() : motionModel,
                this.config.getGatedCost(),
                this.config.isOnlyPosition()
        );
        this.matcher = new MinCostMatcher(solver, this.config.getEpsilon());
        this.cascade = new MatchingCascade(matcher);
        log.debug(
                "Bound association runtime: solver={}, maxDistance={}, cascadeDepth={}",
                solver.id(),
                this.config.getMaxDistance(),
                this.config.getCascadeDepth()
        );
    }

    /**
     * Creates a facade with {@link AssociationConfig#defaults()} and built-in collaborators.
     */
    public static DataAssociator withDefaults() {
        return DataAssociator.builder().build();
    }

    public AssociationConfig config() {
        return config;
    }

    /**
     * One gated matching round over all tracks and detections.
     */
    public <T extends Track, D extends Detection> MatchingResult minCostMatching(
            CostMetric<T, D> metric,
            List<T> tracks,
            List<D> detections
    ) {
        return minCostMatching(metric, tracks, detections, null, null);
    }

    /**
     * One gated matching round over index subsets, using the configured {@code maxDistance}.
     */
    public <T extends Track, D extends Detection> MatchingResult minCostMatching(
            CostMetric<T, D> metric,
            List<T> tracks,
            List<D> detections,
            IntList trackIndices,
            IntList detectionIndices
    ) {
        return matcher.match(metric, config.getMaxDistance(), tracks, detections, trackIndices, detectionIndices);
    }

    /**
     * Staged matching over all tracks and detections.
     */
    public <T extends Track, D extends Detection> MatchingResult matchingCascade(
            CostMetric<T, D> metric,
            List<T> tracks,
            List<D> detections
    ) {
        return matchingCascade(metric, tracks, detections, null, null);
    }

    /**
     * Staged matching over index subsets, using the configured {@code maxDistance} and depth.
     */
    public <T extends Track, D extends Detection> MatchingResult matchingCascade(
            CostMetric<T, D> metric,
            List<T> tracks,
            List<D> detections,
            IntList trackIndices,
            IntList detectionIndices
    ) {
        return cascade.match(
                metric,
                config.getMaxDistance(),
                config.getCascadeDepth(),
                tracks,
                detections,
                trackIndices,
                detectionIndices
        );
    }

    /**
     * Returns a copy of {@code costMatrix} with statistically infeasible entries replaced by the gated cost.
     */
    public <T extends Track, D extends Detection> CostMatrix gateCostMatrix(
            CostMatrix costMatrix,
            List<T> tracks,
            List<D> detections,
            IntList trackIndices,
            IntList detectionIndices
    ) {
        return costGate.gate(costMatrix, tracks, detections, trackIndices, detectionIndices);
    }

    /**
     * Wraps a metric so that its results pass through this facade's gate.
     */
    public <T extends Track, D extends Detection> CostMetric<T, D> gated(CostMetric<T, D> metric) {
        return new GatedCostMetric<>(Objects.requireNonNull(metric, "metric"), costGate);
    }

    /**
     * Returns a snapshot of the bound runtime.
     */
    public AssociationTelemetry telemetry() {
        return AssociationTelemetry.builder()
                .solverId(solver.id())
                .optimalSolver(solver.isOptimal())
                .maxDistance(config.getMaxDistance())
                .cascadeDepth(config.getCascadeDepth())
                .gatingThreshold(costGate.threshold())
                .onlyPosition(costGate.onlyPosition())
                .build();
    }
}
