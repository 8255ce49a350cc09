package org.Aayush.association.motion;

import org.Aayush.association.core.AssociationException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Gating queries for an 8-D constant-velocity box model.
 *
 * <p>State layout is {@code (x, y, a, h, vx, vy, va, vh)}: box center, aspect ratio, height and
 * their velocities. The observation matrix selects the first four entries. Measurement noise is
 * proportional to the predicted height, except for aspect ratio which uses a fixed deviation.</p>
 * <pre>
 * projected_mean = H * mean
 * projected_cov  = H * P * H^T + diag(w*h, w*h, 0.1, w*h)^2
 * distance       = (z - projected_mean)^T * projected_cov^-1 * (z - projected_mean)
 * </pre>
 */
public final class ConstantVelocityMotionModel implements MotionModel {
    private static final Logger log = LoggerFactory.getLogger(ConstantVelocityMotionModel.class);

    public static final int STATE_DIM = 8;
    public static final int MEASUREMENT_DIM = 4;
    public static final double DEFAULT_STD_WEIGHT_POSITION = 1.0d / 20.0d;
    public static final double ASPECT_RATIO_STD = 1e-1;

    private static final double SYMMETRY_THRESHOLD = 1e-6;
    private static final double POSITIVITY_THRESHOLD = 1e-10;

    private final double stdWeightPosition;

    /**
     * Creates a model with the default position noise weight of {@code 1/20}.
     */
    public ConstantVelocityMotionModel() {
        this(DEFAULT_STD_WEIGHT_POSITION);
    }

    /**
     * Creates a model with an explicit position noise weight relative to box height.
     */
    public ConstantVelocityMotionModel(double stdWeightPosition) {
        if (!(stdWeightPosition > 0.0d) || Double.isInfinite(stdWeightPosition)) {
            throw new IllegalArgumentException("stdWeightPosition must be finite and > 0");
        }
        this.stdWeightPosition = stdWeightPosition;
    }

    @Override
    public double[] gatingDistance(double[] mean, double[][] covariance, double[][] measurements, boolean onlyPosition) {
        Objects.requireNonNull(mean, "mean");
        Objects.requireNonNull(covariance, "covariance");
        Objects.requireNonNull(measurements, "measurements");
        if (mean.length != STATE_DIM || covariance.length != STATE_DIM) {
            throw new IllegalArgumentException(
                    "expected " + STATE_DIM + "-D state, got mean " + mean.length + " and covariance " + covariance.length
            );
        }

        int dims = onlyPosition ? 2 : MEASUREMENT_DIM;
        RealMatrix projectedCovariance = projectCovariance(mean, covariance).getSubMatrix(0, dims - 1, 0, dims - 1);
        DecompositionSolver solver = choleskySolver(projectedCovariance);

        double[] distances = new double[measurements.length];
        for (int i = 0; i < measurements.length; i++) {
            double[] measurement = Objects.requireNonNull(measurements[i], "measurements[" + i + "]");
            if (measurement.length < dims) {
                throw new IllegalArgumentException(
                        "measurement " + i + " has " + measurement.length + " entries, expected " + MEASUREMENT_DIM
                );
            }
            RealVector residual = new ArrayRealVector(dims);
            for (int k = 0; k < dims; k++) {
                residual.setEntry(k, measurement[k] - mean[k]);
            }
            distances[i] = residual.dotProduct(solver.solve(residual));
        }
        return distances;
    }

    /**
     * Projects the state covariance into measurement space and adds measurement noise.
     */
    RealMatrix projectCovariance(double[] mean, double[][] covariance) {
        RealMatrix projected = MatrixUtils.createRealMatrix(MEASUREMENT_DIM, MEASUREMENT_DIM);
        for (int r = 0; r < MEASUREMENT_DIM; r++) {
            double[] row = Objects.requireNonNull(covariance[r], "covariance[" + r + "]");
            if (row.length != STATE_DIM) {
                throw new IllegalArgumentException("covariance must be " + STATE_DIM + "x" + STATE_DIM);
            }
            for (int c = 0; c < MEASUREMENT_DIM; c++) {
                projected.setEntry(r, c, row[c]);
            }
        }
        double positionStd = stdWeightPosition * mean[3];
        double[] noiseStd = {positionStd, positionStd, ASPECT_RATIO_STD, positionStd};
        for (int k = 0; k < MEASUREMENT_DIM; k++) {
            projected.addToEntry(k, k, noiseStd[k] * noiseStd[k]);
        }
        return projected;
    }

    private static DecompositionSolver choleskySolver(RealMatrix matrix) {
        try {
            return new CholeskyDecomposition(matrix, SYMMETRY_THRESHOLD, POSITIVITY_THRESHOLD).getSolver();
        } catch (MathIllegalArgumentException ex) {
            log.warn("Projected covariance rejected by Cholesky factorization: {}", ex.getMessage());
            throw new AssociationException(
                    AssociationException.REASON_GATING_FAILED,
                    "projected covariance is not symmetric positive definite",
                    ex
            );
        }
    }
}
