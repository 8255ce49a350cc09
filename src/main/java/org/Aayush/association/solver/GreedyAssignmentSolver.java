package org.Aayush.association.solver;

import it.unimi.dsi.fastutil.ints.IntArrays;

import java.util.Arrays;

/**
 * Suboptimal solver that repeatedly takes the cheapest pair whose row and column are both free.
 *
 * <p>Ties are broken by lowest row, then lowest column. Cost is {@code O(nm log nm)}.</p>
 */
public final class GreedyAssignmentSolver implements AssignmentSolver {
    public static final String ID = "GREEDY";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public boolean isOptimal() {
        return false;
    }

    @Override
    public int[] solve(double[] costs, int rows, int cols) {
        SolverInputs.validate(costs, rows, cols);
        int[] order = new int[costs.length];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        // Row-major position already encodes (row, col) ordering for equal costs.
        IntArrays.quickSort(order, (a, b) -> {
            int byCost = Double.compare(costs[a], costs[b]);
            return byCost != 0 ? byCost : Integer.compare(a, b);
        });

        int[] assignment = new int[rows];
        Arrays.fill(assignment, UNASSIGNED);
        boolean[] columnTaken = new boolean[cols];
        int remaining = Math.min(rows, cols);
        for (int k = 0; k < order.length && remaining > 0; k++) {
            int flat = order[k];
            int row = flat / cols;
            int col = flat % cols;
            if (assignment[row] != UNASSIGNED || columnTaken[col]) {
                continue;
            }
            assignment[row] = col;
            columnTaken[col] = true;
            remaining--;
        }
        return assignment;
    }
}
