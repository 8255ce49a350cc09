package org.Aayush.association.core;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable snapshot of the parameters bound into a {@link DataAssociator}.
 */
@Value
@Builder
public class AssociationTelemetry {

    /**
     * Bound assignment solver id.
     */
    String solverId;

    /**
     * True when the bound solver guarantees minimum total cost.
     */
    boolean optimalSolver;

    double maxDistance;

    int cascadeDepth;

    /**
     * Chi-square threshold applied by the gate.
     */
    double gatingThreshold;

    boolean onlyPosition;
}
