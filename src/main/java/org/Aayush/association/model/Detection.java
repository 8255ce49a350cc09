package org.Aayush.association.model;

/**
 * One observation produced by the per-frame detector.
 */
public interface Detection {

    BoundingBox box();

    /**
     * Measurement vector used for gating: {@code (center_x, center_y, aspect_ratio, height)}.
     */
    default double[] toXyah() {
        return box().toXyah();
    }
}
