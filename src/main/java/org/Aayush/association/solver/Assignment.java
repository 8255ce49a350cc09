package org.Aayush.association.solver;

import org.Aayush.association.core.AssociationException;

import java.util.Arrays;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Normalized, immutable row-to-column assignment.
 *
 * <p>Invariant: each column is the result for at most one row. Raw solver output that
 * repeats a column keeps the first (lowest) row and leaves every later row unassigned.</p>
 */
public final class Assignment {
    private final int[] columnByRow;
    private final boolean[] columnUsed;
    private final int assignedCount;
    private final int correctedRows;

    private Assignment(int[] columnByRow, boolean[] columnUsed, int assignedCount, int correctedRows) {
        this.columnByRow = columnByRow;
        this.columnUsed = columnUsed;
        this.assignedCount = assignedCount;
        this.correctedRows = correctedRows;
    }

    /**
     * Normalizes raw solver output.
     *
     * @param rawColumns column per row or {@link AssignmentSolver#UNASSIGNED}.
     * @param columnCount number of columns of the solved matrix.
     * @return normalized assignment.
     * @throws AssociationException when a raw column is outside {@code [0, columnCount)}.
     */
    public static Assignment fromSolverOutput(int[] rawColumns, int columnCount) {
        Objects.requireNonNull(rawColumns, "rawColumns");
        if (columnCount < 0) {
            throw new IllegalArgumentException("columnCount must be >= 0");
        }
        int[] normalized = new int[rawColumns.length];
        boolean[] used = new boolean[columnCount];
        int assigned = 0;
        int corrected = 0;
        for (int row = 0; row < rawColumns.length; row++) {
            int col = rawColumns[row];
            if (col == AssignmentSolver.UNASSIGNED) {
                normalized[row] = AssignmentSolver.UNASSIGNED;
                continue;
            }
            if (col < 0 || col >= columnCount) {
                throw new AssociationException(
                        AssociationException.REASON_INVALID_SOLVER_OUTPUT,
                        "solver returned column " + col + " for row " + row + " outside [0, " + columnCount + ")"
                );
            }
            if (used[col]) {
                normalized[row] = AssignmentSolver.UNASSIGNED;
                corrected++;
                continue;
            }
            used[col] = true;
            normalized[row] = col;
            assigned++;
        }
        return new Assignment(normalized, used, assigned, corrected);
    }

    public int rowCount() {
        return columnByRow.length;
    }

    public int columnCount() {
        return columnUsed.length;
    }

    /**
     * Returns the column assigned to one row, or empty when the row is unassigned.
     */
    public OptionalInt columnFor(int row) {
        int col = columnByRow[row];
        return col == AssignmentSolver.UNASSIGNED ? OptionalInt.empty() : OptionalInt.of(col);
    }

    public boolean isColumnUsed(int col) {
        return columnUsed[col];
    }

    public int assignedCount() {
        return assignedCount;
    }

    /**
     * Number of rows demoted to unassigned because their column was already claimed.
     */
    public int correctedRows() {
        return correctedRows;
    }

    /**
     * Sums the costs of assigned pairs over a row-major matrix of the solved shape.
     */
    public double totalCost(double[] costs) {
        double total = 0.0d;
        int cols = columnUsed.length;
        for (int row = 0; row < columnByRow.length; row++) {
            int col = columnByRow[row];
            if (col != AssignmentSolver.UNASSIGNED) {
                total += costs[row * cols + col];
            }
        }
        return total;
    }

    @Override
    public String toString() {
        return "Assignment" + Arrays.toString(columnByRow);
    }
}
