package org.Aayush.association.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Immutable axis-aligned box in {@code (left, top, width, height)} form.
 *
 * <p>Gating works in {@code (center_x, center_y, aspect_ratio, height)} space where
 * aspect ratio is {@code width / height}; overlap metrics work in corner form.</p>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BoundingBox {
    double left;
    double top;
    double width;
    double height;

    /**
     * Creates a box from top-left corner and size.
     */
    public static BoundingBox ofTlwh(double left, double top, double width, double height) {
        requireFinite(left, "left");
        requireFinite(top, "top");
        requireFinite(width, "width");
        requireFinite(height, "height");
        if (width < 0.0d || height < 0.0d) {
            throw new IllegalArgumentException("box size must be >= 0, got " + width + "x" + height);
        }
        return new BoundingBox(left, top, width, height);
    }

    /**
     * Creates a box from center, aspect ratio and height.
     */
    public static BoundingBox fromXyah(double centerX, double centerY, double aspectRatio, double height) {
        double width = aspectRatio * height;
        return ofTlwh(centerX - width / 2.0d, centerY - height / 2.0d, width, height);
    }

    /**
     * Returns {@code [center_x, center_y, aspect_ratio, height]}.
     */
    public double[] toXyah() {
        return new double[]{
                left + width / 2.0d,
                top + height / 2.0d,
                width / height,
                height
        };
    }

    /**
     * Returns {@code [min_x, min_y, max_x, max_y]}.
     */
    public double[] toTlbr() {
        return new double[]{left, top, left + width, top + height};
    }

    public double area() {
        return width * height;
    }

    /**
     * Intersection over union with another box; 0 when the union is empty.
     */
    public double iou(BoundingBox other) {
        double interLeft = Math.max(left, other.left);
        double interTop = Math.max(top, other.top);
        double interRight = Math.min(left + width, other.left + other.width);
        double interBottom = Math.min(top + height, other.top + other.height);
        double intersection = Math.max(0.0d, interRight - interLeft) * Math.max(0.0d, interBottom - interTop);
        double union = area() + other.area() - intersection;
        if (union <= 0.0d) {
            return 0.0d;
        }
        return intersection / union;
    }

    private static void requireFinite(double value, String fieldName) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(fieldName + " must be finite");
        }
    }
}
