package org.Aayush.association.cost;

import org.Aayush.association.core.AssociationException;

import java.util.Arrays;
import java.util.Objects;

/**
 * Dense row-major association cost matrix.
 *
 * <p>Row {@code i} belongs to the {@code i}-th entry of a track-index list and column
 * {@code j} to the {@code j}-th entry of a detection-index list. Instances are immutable;
 * array accessors return copies.</p>
 */
public final class CostMatrix {
    private final int rows;
    private final int cols;
    private final double[] values;

    private CostMatrix(int rows, int cols, double[] values) {
        this.rows = rows;
        this.cols = cols;
        this.values = values;
    }

    /**
     * Creates a matrix from rectangular rows. Zero rows yields a {@code 0 x 0} matrix.
     */
    public static CostMatrix of(double[][] source) {
        Objects.requireNonNull(source, "source");
        int rowCount = source.length;
        int colCount = rowCount == 0 ? 0 : Objects.requireNonNull(source[0], "source[0]").length;
        double[] flat = new double[rowCount * colCount];
        for (int i = 0; i < rowCount; i++) {
            double[] row = Objects.requireNonNull(source[i], "source[" + i + "]");
            if (row.length != colCount) {
                throw new IllegalArgumentException(
                        "cost matrix rows must have equal length: row " + i + " has " + row.length + ", expected " + colCount
                );
            }
            System.arraycopy(row, 0, flat, i * colCount, colCount);
        }
        return new CostMatrix(rowCount, colCount, flat);
    }

    /**
     * Creates a matrix from a row-major vector.
     */
    public static CostMatrix ofRowMajor(int rows, int cols, double[] values) {
        Objects.requireNonNull(values, "values");
        if (rows < 0 || cols < 0) {
            throw new IllegalArgumentException("dimensions must be >= 0");
        }
        if ((long) rows * cols != values.length) {
            throw new IllegalArgumentException(
                    "values length " + values.length + " does not match " + rows + "x" + cols
            );
        }
        return new CostMatrix(rows, cols, values.clone());
    }

    /**
     * Creates a matrix filled with one value.
     */
    public static CostMatrix filled(int rows, int cols, double value) {
        double[] flat = new double[Math.multiplyExact(rows, cols)];
        Arrays.fill(flat, value);
        return new CostMatrix(rows, cols, flat);
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    public double get(int row, int col) {
        Objects.checkIndex(row, rows);
        Objects.checkIndex(col, cols);
        return values[row * cols + col];
    }

    /**
     * Returns a copy with every entry capped at {@code maxValue}; infinities become {@code maxValue}.
     */
    public CostMatrix clampedCopy(double maxValue) {
        double[] clamped = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            clamped[i] = Math.min(values[i], maxValue);
        }
        return new CostMatrix(rows, cols, clamped);
    }

    /**
     * Returns a row-major copy of the values.
     */
    public double[] flatten() {
        return values.clone();
    }

    /**
     * Returns a deep copy as nested rows.
     */
    public double[][] toArray() {
        double[][] copy = new double[rows][];
        for (int i = 0; i < rows; i++) {
            copy[i] = Arrays.copyOfRange(values, i * cols, (i + 1) * cols);
        }
        return copy;
    }

    /**
     * Fails fast when the shape does not match the index-list lengths.
     *
     * @throws AssociationException with {@link AssociationException#REASON_COST_MATRIX_DIMENSION_MISMATCH}.
     */
    public void requireShape(int expectedRows, int expectedCols) {
        if (rows != expectedRows || cols != expectedCols) {
            throw new AssociationException(
                    AssociationException.REASON_COST_MATRIX_DIMENSION_MISMATCH,
                    "cost matrix is " + rows + "x" + cols + " but index lists are " + expectedRows + "x" + expectedCols
            );
        }
    }

    /**
     * Rejects NaN and negative entries. Positive infinity is accepted as an infeasibility marker.
     *
     * @throws AssociationException with {@link AssociationException#REASON_INVALID_COST}.
     */
    public void requireNonNegative() {
        for (int i = 0; i < values.length; i++) {
            double value = values[i];
            if (Double.isNaN(value) || value < 0.0d) {
                throw new AssociationException(
                        AssociationException.REASON_INVALID_COST,
                        "cost at (" + (i / cols) + ", " + (i % cols) + ") must be >= 0, got " + value
                );
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CostMatrix)) {
            return false;
        }
        CostMatrix other = (CostMatrix) o;
        return rows == other.rows && cols == other.cols && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * rows + cols) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "CostMatrix{" + rows + "x" + cols + ", " + Arrays.deepToString(toArray()) + "}";
    }
}
