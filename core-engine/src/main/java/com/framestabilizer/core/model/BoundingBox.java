package com.framestabilizer.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Axis-aligned bounding box in centre + size form.
 *
 * <p>
 * {@code x}/{@code y} locate the <strong>centre</strong> of the box and
 * {@code width}/{@code height} its extent, which is the native output format
 * of the upstream detection model. Units are whatever the caller supplies
 * (normalised {@code [0,1]} or pixels); no conversion is ever performed, so
 * all boxes compared within one frame must share the same units.
 * </p>
 *
 * @since 1.0.0
 */
public final class BoundingBox implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double x;
    private final double y;
    private final double width;
    private final double height;

    public BoundingBox(double x, double y, double width, double height) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }

    public double area() {
        return width * height;
    }

    /**
     * @return {@code true} when every component is finite and the extent is
     *         non-negative
     */
    public boolean isWellFormed() {
        return Double.isFinite(x) && Double.isFinite(y)
                && Double.isFinite(width) && Double.isFinite(height)
                && width >= 0 && height >= 0;
    }

    /**
     * Intersection-over-Union with another box.
     *
     * <p>
     * Symmetric and bounded to {@code [0, 1]}. Returns {@code 0.0} when the
     * boxes do not overlap (touching edges included) or when the union area
     * is not positive, e.g. two zero-size boxes.
     * </p>
     *
     * @param other the box to compare against; must not be {@code null}
     * @return IoU score in {@code [0, 1]}
     */
    public double iou(BoundingBox other) {
        Objects.requireNonNull(other, "other bounding box must not be null");

        double interMinX = Math.max(minX(), other.minX());
        double interMinY = Math.max(minY(), other.minY());
        double interMaxX = Math.min(maxX(), other.maxX());
        double interMaxY = Math.min(maxY(), other.maxY());

        if (interMaxX <= interMinX || interMaxY <= interMinY) {
            return 0.0;
        }

        double interArea = (interMaxX - interMinX) * (interMaxY - interMinY);
        double unionArea = area() + other.area() - interArea;
        if (unionArea <= 0) {
            return 0.0;
        }
        return interArea / unionArea;
    }

    private double minX() {
        return x - width / 2;
    }

    private double maxX() {
        return x + width / 2;
    }

    private double minY() {
        return y - height / 2;
    }

    private double maxY() {
        return y + height / 2;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof BoundingBox that))
            return false;
        return Double.compare(x, that.x) == 0
                && Double.compare(y, that.y) == 0
                && Double.compare(width, that.width) == 0
                && Double.compare(height, that.height) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, width, height);
    }

    @Override
    public String toString() {
        return "BoundingBox{x=" + x + ", y=" + y + ", width=" + width + ", height=" + height + '}';
    }
}
