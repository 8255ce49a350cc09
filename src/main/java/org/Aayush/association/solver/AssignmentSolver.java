package org.Aayush.association.solver;

/**
 * Strategy contract for dense rectangular assignment.
 *
 * <p>Implementations are pure and deterministic. They return the raw per-row column
 * vector; callers wrap it with {@link Assignment#fromSolverOutput(int[], int)} before
 * interpreting it, which enforces that a column is claimed by at most one row.</p>
 */
public interface AssignmentSolver {

    /**
     * Raw marker for a row without a column.
     */
    int UNASSIGNED = -1;

    /**
     * Stable solver identifier.
     */
    String id();

    /**
     * Returns true when the solver guarantees a minimum total cost.
     */
    boolean isOptimal();

    /**
     * Solves one assignment problem.
     *
     * @param costs row-major {@code rows x cols} costs; finite and non-negative.
     * @param rows number of rows, at least 1.
     * @param cols number of columns, at least 1.
     * @return column per row, or {@link #UNASSIGNED}; length {@code rows}.
     */
    int[] solve(double[] costs, int rows, int cols);
}
