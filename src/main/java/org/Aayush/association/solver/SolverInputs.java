package org.Aayush.association.solver;

import lombok.experimental.UtilityClass;
import org.Aayush.association.core.AssociationException;

import java.util.Objects;

/**
 * Shared precondition checks for solver implementations.
 */
@UtilityClass
class SolverInputs {

    void validate(double[] costs, int rows, int cols) {
        Objects.requireNonNull(costs, "costs");
        if (rows < 1 || cols < 1) {
            throw new AssociationException(
                    AssociationException.REASON_INVALID_SOLVER_INPUT,
                    "solver requires rows >= 1 and cols >= 1, got " + rows + "x" + cols
            );
        }
        if ((long) rows * cols != costs.length) {
            throw new AssociationException(
                    AssociationException.REASON_INVALID_SOLVER_INPUT,
                    "cost vector length " + costs.length + " does not match " + rows + "x" + cols
            );
        }
        for (int i = 0; i < costs.length; i++) {
            double cost = costs[i];
            if (!Double.isFinite(cost) || cost < 0.0d) {
                throw new AssociationException(
                        AssociationException.REASON_INVALID_SOLVER_INPUT,
                        "cost at (" + (i / cols) + ", " + (i % cols) + ") must be finite and >= 0, got " + cost
                );
            }
        }
    }
}
