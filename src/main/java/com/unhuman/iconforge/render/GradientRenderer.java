package com.unhuman.iconforge.render;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * Renders opaque square images whose rows fade linearly from one color to another.
 */
public final class GradientRenderer {

    private GradientRenderer() {}

    /**
     * Row {@code y} gets {@code from * (1 - y/size) + to * (y/size)} per channel, truncated.
     * Columns are not interpolated. The color alphas are ignored; the result is fully opaque.
     */
    public static BufferedImage renderGradient(int size, Color from, Color to) {
        InvalidSizeException.requirePositive(size, "Gradient size");
        BufferedImage image = new BufferedImage(size, size, BufferedImage.TYPE_INT_ARGB);
        int[] row = new int[size];
        for (int y = 0; y < size; y++) {
            double ratio = (double) y / size;
            int r = interpolate(from.getRed(), to.getRed(), ratio);
            int g = interpolate(from.getGreen(), to.getGreen(), ratio);
            int b = interpolate(from.getBlue(), to.getBlue(), ratio);
            Arrays.fill(row, 0xFF000000 | (r << 16) | (g << 8) | b);
            image.setRGB(0, y, size, 1, row, 0, size);
        }
        return image;
    }

    static int interpolate(int from, int to, double ratio) {
        return (int) (from * (1 - ratio) + to * ratio);
    }
}
