package com.unhuman.iconforge.model;

/**
 * Immutable design parameters for the badge icon.
 * Built once at startup (usually by {@code ConfigManager}) and passed into every renderer.
 */
public class IconDesign {
    /** Size the shadow blur radius is expressed against. */
    public static final int REFERENCE_SIZE = 1024;
    public static final double DEFAULT_SHADOW_BLUR_RADIUS = 2.0;
    public static final double MAX_SHADOW_BLUR_RADIUS = 64.0;

    private final Palette palette;
    private final double shadowBlurRadius;
    private final boolean scaleShadowBlur;

    /**
     * @throws IllegalArgumentException if the blur radius is not a number within [0, {@link #MAX_SHADOW_BLUR_RADIUS}]
     */
    public IconDesign(Palette palette, double shadowBlurRadius, boolean scaleShadowBlur) {
        if (!isValidBlurRadius(shadowBlurRadius)) {
            throw new IllegalArgumentException("Shadow blur radius must be within 0.."
                + MAX_SHADOW_BLUR_RADIUS + " but was " + shadowBlurRadius);
        }
        this.palette = palette;
        this.shadowBlurRadius = shadowBlurRadius;
        this.scaleShadowBlur = scaleShadowBlur;
    }

    public static IconDesign defaults() {
        return new IconDesign(Palette.defaults(), DEFAULT_SHADOW_BLUR_RADIUS, false);
    }

    public static boolean isValidBlurRadius(double radius) {
        // false for NaN
        return radius >= 0 && radius <= MAX_SHADOW_BLUR_RADIUS;
    }

    public Palette getPalette() { return palette; }
    public double getShadowBlurRadius() { return shadowBlurRadius; }
    public boolean isScaleShadowBlur() { return scaleShadowBlur; }

    /**
     * Blur radius to use for an icon of the given size. Fixed unless
     * {@link #isScaleShadowBlur()} is set, in which case it shrinks with the icon.
     */
    public double blurRadiusFor(int pixelSize) {
        if (!scaleShadowBlur) {
            return shadowBlurRadius;
        }
        return shadowBlurRadius * pixelSize / REFERENCE_SIZE;
    }
}
