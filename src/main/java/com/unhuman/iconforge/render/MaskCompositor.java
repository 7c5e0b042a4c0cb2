package com.unhuman.iconforge.render;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.geom.Ellipse2D;
import java.awt.geom.RoundRectangle2D;
import java.awt.image.BufferedImage;

/**
 * Builds opacity masks and pastes images through them.
 */
public final class MaskCompositor {

    private MaskCompositor() {}

    /**
     * Mask of a rounded rectangle inscribed in a {@code size x size} square.
     * Edge coverage comes from the Java2D antialiasing rasterizer.
     *
     * @throws InvalidSizeException if size is not positive or the radius is outside [0, size/2]
     */
    public static AlphaMask roundedMask(int size, int cornerRadius) {
        InvalidSizeException.requirePositive(size, "Mask size");
        if (cornerRadius < 0 || cornerRadius * 2 > size) {
            throw new InvalidSizeException("Corner radius " + cornerRadius + " does not fit a "
                + size + "px mask", cornerRadius);
        }
        BufferedImage gray = new BufferedImage(size, size, BufferedImage.TYPE_BYTE_GRAY);
        Graphics2D g = Canvases.antialiased(gray);
        try {
            g.setColor(Color.WHITE);
            float arc = cornerRadius * 2.0f;
            g.fill(new RoundRectangle2D.Float(0, 0, size, size, arc, arc));
        } finally {
            g.dispose();
        }
        return new AlphaMask(gray);
    }

    /**
     * Mask of the circle inscribed in a {@code size x size} square, {@code opacity} inside and 0 outside.
     */
    public static AlphaMask circleMask(int size, int opacity) {
        InvalidSizeException.requirePositive(size, "Mask size");
        if (opacity < 0 || opacity > 255) {
            throw new IllegalArgumentException("Opacity must be within 0..255 but was " + opacity);
        }
        BufferedImage gray = new BufferedImage(size, size, BufferedImage.TYPE_BYTE_GRAY);
        Graphics2D g = Canvases.antialiased(gray);
        try {
            g.setColor(new Color(opacity, opacity, opacity));
            g.fill(new Ellipse2D.Float(0, 0, size, size));
        } finally {
            g.dispose();
        }
        return new AlphaMask(gray);
    }

    /**
     * Paste {@code source} into {@code dest} with its top left corner at (originX, originY), weighting every
     * pixel by the mask. Blending is linear in premultiplied space, so a mask value of 0 leaves the destination
     * pixel as is, 255 replaces it with the source pixel, and values in between mix proportionally.
     * Only {@code dest} is modified.
     *
     * @throws CompositeBoundsException if source and mask differ in size or the region does not fit in dest
     */
    public static void compositeThroughMask(BufferedImage source, AlphaMask mask, BufferedImage dest,
                                            int originX, int originY) {
        int width = source.getWidth();
        int height = source.getHeight();
        if (mask.getWidth() != width || mask.getHeight() != height) {
            throw new CompositeBoundsException("Mask " + mask.getWidth() + "x" + mask.getHeight()
                + " does not match source " + width + "x" + height);
        }
        if (originX < 0 || originY < 0
                || originX + width > dest.getWidth() || originY + height > dest.getHeight()) {
            throw new CompositeBoundsException("Source " + width + "x" + height + " at (" + originX + ","
                + originY + ") exceeds destination " + dest.getWidth() + "x" + dest.getHeight());
        }

        int[] sourceRow = new int[width];
        int[] destRow = new int[width];
        int[] maskRow = new int[width];
        for (int y = 0; y < height; y++) {
            source.getRGB(0, y, width, 1, sourceRow, 0, width);
            dest.getRGB(originX, originY + y, width, 1, destRow, 0, width);
            mask.getRow(y, maskRow);
            for (int x = 0; x < width; x++) {
                destRow[x] = blend(sourceRow[x], destRow[x], maskRow[x]);
            }
            dest.setRGB(originX, originY + y, width, 1, destRow, 0, width);
        }
    }

    static int blend(int src, int dst, int maskValue) {
        if (maskValue <= 0) {
            return dst;
        }
        if (maskValue >= 255) {
            return src;
        }
        double weight = maskValue / 255.0;
        double srcAlpha = (src >>> 24) * weight;
        double dstAlpha = (dst >>> 24) * (1 - weight);
        double outAlpha = srcAlpha + dstAlpha;
        if (outAlpha <= 0) {
            return 0;
        }
        int r = channel(src >> 16, dst >> 16, srcAlpha, dstAlpha, outAlpha);
        int g = channel(src >> 8, dst >> 8, srcAlpha, dstAlpha, outAlpha);
        int b = channel(src, dst, srcAlpha, dstAlpha, outAlpha);
        int a = Math.min(255, (int) Math.round(outAlpha));
        return (a << 24) | (r << 16) | (g << 8) | b;
    }

    private static int channel(int src, int dst, double srcAlpha, double dstAlpha, double outAlpha) {
        double value = ((src & 0xFF) * srcAlpha + (dst & 0xFF) * dstAlpha) / outAlpha;
        return Math.min(255, (int) Math.round(value));
    }
}
