package com.unhuman.iconforge.render;

import java.awt.image.BufferedImage;

/**
 * Single channel opacity map: 0 keeps the destination, 255 takes the source.
 */
public class AlphaMask {
    private final BufferedImage gray;

    AlphaMask(BufferedImage gray) {
        if (gray.getType() != BufferedImage.TYPE_BYTE_GRAY) {
            throw new IllegalArgumentException("Mask image must be TYPE_BYTE_GRAY");
        }
        this.gray = gray;
    }

    public int getWidth() { return gray.getWidth(); }
    public int getHeight() { return gray.getHeight(); }

    public int getValue(int x, int y) {
        return gray.getRaster().getSample(x, y, 0);
    }

    int[] getRow(int y, int[] buffer) {
        return gray.getRaster().getSamples(0, y, gray.getWidth(), 1, 0, buffer);
    }
}
