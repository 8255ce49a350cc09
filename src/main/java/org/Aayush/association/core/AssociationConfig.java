package org.Aayush.association.core;

import lombok.Builder;
import lombok.Value;
import org.Aayush.association.cost.CostGate;
import org.Aayush.association.matching.MinCostMatcher;
import org.Aayush.association.solver.AssignmentSolverRegistry;

/**
 * Association parameters bound once when a {@link DataAssociator} is created.
 */
@Value
@Builder(toBuilder = true)
public class AssociationConfig {
    public static final double DEFAULT_MAX_DISTANCE = 0.7d;
    public static final int DEFAULT_CASCADE_DEPTH = 30;

    public static final String PROP_MAX_DISTANCE = "association.maxDistance";
    public static final String PROP_CASCADE_DEPTH = "association.cascadeDepth";
    public static final String PROP_SOLVER_ID = "association.solverId";
    public static final String PROP_ONLY_POSITION = "association.onlyPosition";

    /**
     * Gating threshold; associations with larger cost are disregarded.
     */
    @Builder.Default
    double maxDistance = DEFAULT_MAX_DISTANCE;

    /**
     * Number of cascade levels, normally the maximum track age.
     */
    @Builder.Default
    int cascadeDepth = DEFAULT_CASCADE_DEPTH;

    /**
     * Assignment solver id resolved through {@link AssignmentSolverRegistry}.
     */
    @Builder.Default
    String solverId = AssignmentSolverRegistry.SOLVER_OPTIMAL;

    /**
     * Margin added to {@code maxDistance} when capping costs before solving.
     */
    @Builder.Default
    double epsilon = MinCostMatcher.DEFAULT_EPSILON;

    /**
     * Cost written into statistically infeasible entries by the gate.
     */
    @Builder.Default
    double gatedCost = CostGate.DEFAULT_GATED_COST;

    /**
     * True to gate on box center only (2 degrees of freedom instead of 4).
     */
    @Builder.Default
    boolean onlyPosition = false;

    /**
     * Loads defaults overridden by system properties. Malformed values keep the built-in default.
     */
    public static AssociationConfig defaults() {
        AssociationConfigBuilder builder = AssociationConfig.builder()
                .maxDistance(readDouble(PROP_MAX_DISTANCE, DEFAULT_MAX_DISTANCE))
                .cascadeDepth(readInt(PROP_CASCADE_DEPTH, DEFAULT_CASCADE_DEPTH))
                .onlyPosition(Boolean.parseBoolean(System.getProperty(PROP_ONLY_POSITION, "false").trim()));
        String solverId = System.getProperty(PROP_SOLVER_ID);
        if (solverId != null && !solverId.isBlank()) {
            builder.solverId(solverId.trim());
        }
        return builder.build();
    }

    /**
     * Validates value ranges.
     *
     * @throws AssociationException with {@link AssociationException#REASON_INVALID_CONFIG}.
     */
    public AssociationConfig validate() {
        if (!Double.isFinite(maxDistance) || maxDistance < 0.0d) {
            throw invalid("maxDistance must be finite and >= 0, got " + maxDistance);
        }
        if (cascadeDepth < 0) {
            throw invalid("cascadeDepth must be >= 0, got " + cascadeDepth);
        }
        if (solverId == null || solverId.isBlank()) {
            throw invalid("solverId must be non-blank");
        }
        if (!(epsilon > 0.0d) || Double.isInfinite(epsilon)) {
            throw invalid("epsilon must be finite and > 0, got " + epsilon);
        }
        if (Double.isNaN(gatedCost) || gatedCost <= maxDistance) {
            throw invalid("gatedCost must exceed maxDistance, got " + gatedCost);
        }
        return this;
    }

    private static AssociationException invalid(String message) {
        return new AssociationException(AssociationException.REASON_INVALID_CONFIG, message);
    }

    private static double readDouble(String property, double fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    private static int readInt(String property, int fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }
}
