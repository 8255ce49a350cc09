package org.Aayush.association.solver;

import java.util.Arrays;

/**
 * Exact Kuhn-Munkres solver using row/column potentials (O(n^2 m) for n &lt;= m).
 *
 * <p>When there are more rows than columns the transposed problem is solved, so every
 * column is used and the surplus rows stay unassigned. Ties are resolved toward the
 * lowest column index, which keeps results reproducible across runs.</p>
 */
public final class HungarianAssignmentSolver implements AssignmentSolver {
    public static final String ID = "OPTIMAL";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public boolean isOptimal() {
        return true;
    }

    @Override
    public int[] solve(double[] costs, int rows, int cols) {
        SolverInputs.validate(costs, rows, cols);
        boolean transposed = rows > cols;
        int n = transposed ? cols : rows;
        int m = transposed ? rows : cols;

        // 1-based potentials; column 0 is the virtual start column.
        double[] u = new double[n + 1];
        double[] v = new double[m + 1];
        int[] rowOfColumn = new int[m + 1];
        int[] way = new int[m + 1];
        double[] minSlack = new double[m + 1];
        boolean[] used = new boolean[m + 1];

        for (int i = 1; i <= n; i++) {
            rowOfColumn[0] = i;
            int j0 = 0;
            Arrays.fill(minSlack, Double.POSITIVE_INFINITY);
            Arrays.fill(used, false);
            do {
                used[j0] = true;
                int i0 = rowOfColumn[j0];
                double delta = Double.POSITIVE_INFINITY;
                int j1 = 0;
                for (int j = 1; j <= m; j++) {
                    if (used[j]) {
                        continue;
                    }
                    double reduced = cost(costs, cols, transposed, i0 - 1, j - 1) - u[i0] - v[j];
                    if (reduced < minSlack[j]) {
                        minSlack[j] = reduced;
                        way[j] = j0;
                    }
                    if (minSlack[j] < delta) {
                        delta = minSlack[j];
                        j1 = j;
                    }
                }
                for (int j = 0; j <= m; j++) {
                    if (used[j]) {
                        u[rowOfColumn[j]] += delta;
                        v[j] -= delta;
                    } else {
                        minSlack[j] -= delta;
                    }
                }
                j0 = j1;
            } while (rowOfColumn[j0] != 0);

            do {
                int j1 = way[j0];
                rowOfColumn[j0] = rowOfColumn[j1];
                j0 = j1;
            } while (j0 != 0);
        }

        int[] assignment = new int[rows];
        Arrays.fill(assignment, UNASSIGNED);
        for (int j = 1; j <= m; j++) {
            int i = rowOfColumn[j];
            if (i == 0) {
                continue;
            }
            if (transposed) {
                assignment[j - 1] = i - 1;
            } else {
                assignment[i - 1] = j - 1;
            }
        }
        return assignment;
    }

    private static double cost(double[] costs, int cols, boolean transposed, int row, int col) {
        return transposed ? costs[col * cols + row] : costs[row * cols + col];
    }
}
