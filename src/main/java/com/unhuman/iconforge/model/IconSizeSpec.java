package com.unhuman.iconforge.model;

import java.util.Objects;

/**
 * One slot of the icon matrix: a logical size in points and the display scale it is rendered at.
 */
public class IconSizeSpec {
    private final double logicalWidth;
    private final double logicalHeight;
    private final int scale;
    private final IconIdiom idiom;

    public IconSizeSpec(double logicalWidth, double logicalHeight, int scale, IconIdiom idiom) {
        this.logicalWidth = logicalWidth;
        this.logicalHeight = logicalHeight;
        this.scale = scale;
        this.idiom = idiom;
    }

    public static IconSizeSpec square(double logicalSize, int scale, IconIdiom idiom) {
        return new IconSizeSpec(logicalSize, logicalSize, scale, idiom);
    }

    public double getLogicalWidth() { return logicalWidth; }
    public double getLogicalHeight() { return logicalHeight; }
    public int getScale() { return scale; }
    public IconIdiom getIdiom() { return idiom; }

    public boolean isSquare() {
        return logicalWidth == logicalHeight;
    }

    /** Rendered edge length in pixels, {@code round(logicalWidth * scale)}. */
    public int getPixelSize() {
        return (int) Math.round(logicalWidth * scale);
    }

    /**
     * Logical size as the asset catalog writes it: "20x20", "83.5x83.5".
     */
    public String getSizeLabel() {
        return formatPoints(logicalWidth) + "x" + formatPoints(logicalHeight);
    }

    private static String formatPoints(double points) {
        if (points == Math.rint(points)) {
            return String.valueOf((long) points);
        }
        return String.valueOf(points);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IconSizeSpec)) return false;
        IconSizeSpec that = (IconSizeSpec) o;
        return Double.compare(that.logicalWidth, logicalWidth) == 0
            && Double.compare(that.logicalHeight, logicalHeight) == 0
            && scale == that.scale
            && idiom == that.idiom;
    }

    @Override
    public int hashCode() {
        return Objects.hash(logicalWidth, logicalHeight, scale, idiom);
    }

    @Override
    public String toString() {
        return idiom + " " + getSizeLabel() + " @" + scale + "x";
    }
}
