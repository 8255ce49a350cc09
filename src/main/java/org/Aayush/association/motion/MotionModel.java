package org.Aayush.association.motion;

/**
 * Query side of a predictive motion filter.
 *
 * <p>Implementations must be deterministic and must not mutate their arguments.</p>
 */
public interface MotionModel {

    /**
     * Squared Mahalanobis distance between one predicted state distribution and each measurement.
     *
     * @param mean predicted state mean.
     * @param covariance predicted state covariance.
     * @param measurements one {@code (center_x, center_y, aspect_ratio, height)} row per detection.
     * @param onlyPosition when true only the first two measurement dimensions are used.
     * @return one distance per measurement row.
     */
    double[] gatingDistance(double[] mean, double[][] covariance, double[][] measurements, boolean onlyPosition);
}
