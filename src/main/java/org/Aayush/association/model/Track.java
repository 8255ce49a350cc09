package org.Aayush.association.model;

/**
 * Read-only view of one tracked object's predicted state.
 *
 * <p>The host tracker owns and mutates the underlying state; association code only reads it
 * for the duration of one matching call.</p>
 */
public interface Track {

    /**
     * Predicted state vector; the first four entries are {@code (center_x, center_y, aspect_ratio, height)}.
     */
    double[] mean();

    /**
     * Predicted state covariance, square with the same dimension as {@link #mean()}.
     */
    double[][] covariance();

    /**
     * Frames elapsed since the last successful match, at least 1 after prediction.
     */
    int timeSinceUpdate();

    /**
     * Current box estimate derived from the predicted mean.
     */
    default BoundingBox box() {
        double[] mean = mean();
        return BoundingBox.fromXyah(mean[0], mean[1], mean[2], mean[3]);
    }
}
