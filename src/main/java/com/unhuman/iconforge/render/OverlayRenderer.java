package com.unhuman.iconforge.render;

import com.unhuman.iconforge.model.IconDesign;
import com.unhuman.iconforge.model.Palette;

import java.awt.image.BufferedImage;

/**
 * Translucent layers drawn above and below the badge: the glass highlight and the soft drop shadow.
 */
public final class OverlayRenderer {
    static final double HIGHLIGHT_INSET = 0.1;
    static final double HIGHLIGHT_SPAN = 0.8;
    static final double SHADOW_SCALE = 1.1;

    private OverlayRenderer() {}

    /**
     * A {@code size x size} transparent layer with the palette's 30% white ellipse filling its inner 80%.
     */
    public static BufferedImage highlightOverlay(int size, Palette palette) {
        BufferedImage layer = Canvases.newCanvas(size, size);
        int inset = (int) (size * HIGHLIGHT_INSET);
        int span = (int) (size * HIGHLIGHT_SPAN);
        if (span > 0) {
            Canvases.fillEllipse(layer, inset, inset, span, span, palette.getHighlightWhite());
        }
        return layer;
    }

    /** Edge length of the shadow canvas for an icon of the given size. */
    public static int shadowSize(int size) {
        InvalidSizeException.requirePositive(size, "Icon size");
        return (int) (size * SHADOW_SCALE);
    }

    /**
     * A 10% black ellipse filling a canvas 110% of {@code size}, softened with a Gaussian blur.
     * The blur radius comes from {@link IconDesign#blurRadiusFor(int)}.
     */
    public static BufferedImage shadowLayer(int size, IconDesign design) {
        int shadowSize = shadowSize(size);
        BufferedImage layer = Canvases.newCanvas(shadowSize, shadowSize);
        Canvases.fillEllipse(layer, 0, 0, shadowSize, shadowSize, design.getPalette().getShadowGray());
        return gaussianBlur(layer, design.blurRadiusFor(size));
    }

    /**
     * Separable Gaussian blur with sigma equal to {@code radius}. Pixels outside the image count as transparent,
     * so edge pixels are blurred too and the result keeps the input's dimensions. Channels are blurred
     * premultiplied and rounded once at the end, so a flat region keeps its exact color and alpha.
     */
    public static BufferedImage gaussianBlur(BufferedImage image, double radius) {
        if (radius <= 0) {
            return Canvases.copy(image);
        }
        float[] weights = gaussianKernel(radius);
        int width = image.getWidth();
        int height = image.getHeight();
        int[] pixels = image.getRGB(0, 0, width, height, null, 0, width);

        // alpha, then premultiplied red, green and blue
        float[][] planes = new float[4][width * height];
        for (int i = 0; i < pixels.length; i++) {
            int argb = pixels[i];
            float alpha = argb >>> 24;
            planes[0][i] = alpha;
            planes[1][i] = ((argb >> 16) & 0xFF) * alpha / 255f;
            planes[2][i] = ((argb >> 8) & 0xFF) * alpha / 255f;
            planes[3][i] = (argb & 0xFF) * alpha / 255f;
        }

        float[] scratch = new float[width * height];
        for (float[] plane : planes) {
            convolve(plane, scratch, width, height, weights, 1, 0);
            convolve(scratch, plane, width, height, weights, 0, 1);
        }

        for (int i = 0; i < pixels.length; i++) {
            float alpha = planes[0][i];
            int a = clamp(Math.round(alpha));
            if (a == 0) {
                pixels[i] = 0;
                continue;
            }
            int r = clamp(Math.round(planes[1][i] * 255f / alpha));
            int g = clamp(Math.round(planes[2][i] * 255f / alpha));
            int b = clamp(Math.round(planes[3][i] * 255f / alpha));
            pixels[i] = (a << 24) | (r << 16) | (g << 8) | b;
        }
        BufferedImage out = Canvases.newCanvas(width, height);
        out.setRGB(0, 0, width, height, pixels, 0, width);
        return out;
    }

    /** One 1D pass along (dx, dy); samples outside the image are zero. */
    private static void convolve(float[] in, float[] out, int width, int height, float[] weights, int dx, int dy) {
        int half = weights.length / 2;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double sum = 0;
                for (int k = -half; k <= half; k++) {
                    int sx = x + k * dx;
                    int sy = y + k * dy;
                    if (sx >= 0 && sx < width && sy >= 0 && sy < height) {
                        sum += weights[k + half] * in[sy * width + sx];
                    }
                }
                out[y * width + x] = (float) sum;
            }
        }
    }

    private static int clamp(int value) {
        return Math.max(0, Math.min(255, value));
    }

    /**
     * @throws IllegalArgumentException if sigma is not a positive finite number
     */
    static float[] gaussianKernel(double sigma) {
        if (!(sigma > 0) || Double.isInfinite(sigma)) {
            throw new IllegalArgumentException("Blur sigma must be positive and finite but was " + sigma);
        }
        int half = (int) Math.ceil(sigma * 3);
        float[] weights = new float[half * 2 + 1];
        double sum = 0;
        for (int i = -half; i <= half; i++) {
            double w = Math.exp(-(i * i) / (2 * sigma * sigma));
            weights[i + half] = (float) w;
            sum += w;
        }
        for (int i = 0; i < weights.length; i++) {
            weights[i] = (float) (weights[i] / sum);
        }
        return weights;
    }
}
