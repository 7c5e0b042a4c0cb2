package com.unhuman.iconforge.render;

import java.awt.AlphaComposite;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.Ellipse2D;
import java.awt.image.BufferedImage;

/**
 * Small drawing helpers shared by the renderers. Every operation takes the canvas it draws on
 * and disposes its own {@link Graphics2D}, so no drawing state outlives a call.
 */
public final class Canvases {

    private Canvases() {}

    /** Fully transparent ARGB canvas. */
    public static BufferedImage newCanvas(int width, int height) {
        InvalidSizeException.requirePositive(width, "Canvas width");
        InvalidSizeException.requirePositive(height, "Canvas height");
        return new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
    }

    static Graphics2D antialiased(BufferedImage canvas) {
        Graphics2D g = canvas.createGraphics();
        g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
        g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
        return g;
    }

    /**
     * Fill the ellipse inscribed in the given box, blending over what is already there.
     */
    public static void fillEllipse(BufferedImage canvas, double x, double y, double width, double height, Color color) {
        Graphics2D g = antialiased(canvas);
        try {
            g.setColor(color);
            g.fill(new Ellipse2D.Double(x, y, width, height));
        } finally {
            g.dispose();
        }
    }

    /**
     * Porter-Duff "source over": {@code layer} is alpha-composited onto {@code dest} at the given offset.
     * The layer itself is left untouched.
     */
    public static void drawOver(BufferedImage dest, BufferedImage layer, int x, int y) {
        Graphics2D g = dest.createGraphics();
        try {
            g.setComposite(AlphaComposite.SrcOver);
            g.drawImage(layer, x, y, null);
        } finally {
            g.dispose();
        }
    }

    /**
     * Exact pixel copy of a region into a new ARGB image that owns its buffer.
     */
    public static BufferedImage crop(BufferedImage source, int x, int y, int width, int height) {
        if (x < 0 || y < 0 || x + width > source.getWidth() || y + height > source.getHeight()) {
            throw new CompositeBoundsException("Crop " + width + "x" + height + " at (" + x + "," + y
                + ") exceeds " + source.getWidth() + "x" + source.getHeight());
        }
        BufferedImage out = newCanvas(width, height);
        int[] pixels = source.getRGB(x, y, width, height, null, 0, width);
        out.setRGB(0, 0, width, height, pixels, 0, width);
        return out;
    }

    public static BufferedImage copy(BufferedImage source) {
        return crop(source, 0, 0, source.getWidth(), source.getHeight());
    }
}
