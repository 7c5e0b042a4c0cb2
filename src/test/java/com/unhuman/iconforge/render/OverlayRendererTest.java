package com.unhuman.iconforge.render;

import com.unhuman.iconforge.model.IconDesign;
import com.unhuman.iconforge.model.Palette;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;

import java.awt.Color;
import java.awt.image.BufferedImage;

import static org.junit.jupiter.api.Assertions.*;

class OverlayRendererTest {

    private static int alpha(BufferedImage img, int x, int y) {
        return img.getRGB(x, y) >>> 24;
    }

    // ───────── Highlight ─────────

    @Nested
    @DisplayName("highlightOverlay()")
    class Highlight {

        @Test
        @DisplayName("is size x size with a 30% white center")
        void center() {
            BufferedImage layer = OverlayRenderer.highlightOverlay(100, Palette.defaults());
            assertEquals(100, layer.getWidth());
            assertEquals(100, layer.getHeight());
            Color c = new Color(layer.getRGB(50, 50), true);
            assertEquals(77, c.getAlpha(), 1);
            assertEquals(255, c.getRed(), 1);
        }

        @Test
        @DisplayName("leaves the outer 10% band transparent")
        void outerBand() {
            BufferedImage layer = OverlayRenderer.highlightOverlay(100, Palette.defaults());
            assertEquals(0, alpha(layer, 5, 50));
            assertEquals(0, alpha(layer, 50, 95));
            assertEquals(0, alpha(layer, 0, 0));
        }
    }

    // ───────── Shadow ─────────

    @Nested
    @DisplayName("shadowLayer()")
    class Shadow {

        @Test
        @DisplayName("canvas is 110% of the icon size")
        void size() {
            assertEquals(66, OverlayRenderer.shadowSize(60));
            assertEquals(1126, OverlayRenderer.shadowSize(1024));
            BufferedImage layer = OverlayRenderer.shadowLayer(60, IconDesign.defaults());
            assertEquals(66, layer.getWidth());
            assertEquals(66, layer.getHeight());
        }

        @Test
        @DisplayName("center is 10% black, corners stay clear")
        void content() {
            BufferedImage layer = OverlayRenderer.shadowLayer(200, IconDesign.defaults());
            Color c = new Color(layer.getRGB(110, 110), true);
            assertEquals(25, c.getAlpha());
            assertEquals(0, c.getRed());
            assertEquals(0, alpha(layer, 0, 0));
        }

        @Test
        @DisplayName("interior keeps exactly the palette's 10% alpha at every catalog scale")
        void exactAlpha() {
            for (int size : new int[] {20, 60, 167, 1024}) {
                BufferedImage layer = OverlayRenderer.shadowLayer(size, IconDesign.defaults());
                int center = layer.getWidth() / 2;
                assertEquals(Palette.SHADOW_GRAY.getAlpha(), alpha(layer, center, center), "size " + size);
            }
        }

        @Test
        @DisplayName("rejects non-positive size")
        void rejectsNonPositive() {
            assertThrows(InvalidSizeException.class, () -> OverlayRenderer.shadowLayer(0, IconDesign.defaults()));
        }
    }

    // ───────── Blur ─────────

    @Nested
    @DisplayName("gaussianBlur()")
    class Blur {

        @Test
        @DisplayName("kernel is normalized and three sigma wide")
        void kernel() {
            float[] weights = OverlayRenderer.gaussianKernel(2.0);
            assertEquals(13, weights.length);
            float sum = 0;
            for (float w : weights) {
                sum += w;
            }
            assertEquals(1.0f, sum, 1e-4f);
            assertTrue(weights[6] > weights[5]);
            assertEquals(weights[0], weights[12], 1e-7f);
        }

        @Test
        @DisplayName("flat regions keep their color and alpha")
        void flatRegion() {
            BufferedImage img = Canvases.newCanvas(40, 40);
            for (int y = 0; y < 40; y++) {
                for (int x = 0; x < 40; x++) {
                    img.setRGB(x, y, 0xC8336699);
                }
            }
            BufferedImage blurred = OverlayRenderer.gaussianBlur(img, 2.0);
            assertEquals(0xC8336699, blurred.getRGB(20, 20));
            assertEquals(0xC8336699, blurred.getRGB(7, 32));
            assertTrue(alpha(blurred, 0, 20) < 200);
        }

        @Test
        @DisplayName("rejects a non-finite radius")
        void nonFiniteRadius() {
            BufferedImage img = Canvases.newCanvas(4, 4);
            assertThrows(IllegalArgumentException.class,
                () -> OverlayRenderer.gaussianBlur(img, Double.POSITIVE_INFINITY));
            assertThrows(IllegalArgumentException.class, () -> OverlayRenderer.gaussianBlur(img, Double.NaN));
        }

        @Test
        @DisplayName("spreads a single opaque pixel to its neighbours")
        void spreads() {
            BufferedImage img = Canvases.newCanvas(21, 21);
            img.setRGB(10, 10, 0xFF000000);
            BufferedImage blurred = OverlayRenderer.gaussianBlur(img, 2.0);

            assertEquals(21, blurred.getWidth());
            assertTrue(alpha(blurred, 10, 10) < 255);
            assertTrue(alpha(blurred, 11, 10) > 0);
            assertTrue(alpha(blurred, 10, 12) > 0);
            assertEquals(0, alpha(blurred, 0, 0));
        }

        @Test
        @DisplayName("blurs pixels on the image edge")
        void edges() {
            BufferedImage img = Canvases.newCanvas(9, 9);
            img.setRGB(0, 4, 0xFF000000);
            BufferedImage blurred = OverlayRenderer.gaussianBlur(img, 1.0);
            assertTrue(alpha(blurred, 0, 4) < 255);
            assertTrue(alpha(blurred, 1, 4) > 0);
        }

        @Test
        @DisplayName("zero radius returns an independent copy")
        void zeroRadius() {
            BufferedImage img = Canvases.newCanvas(4, 4);
            img.setRGB(1, 1, 0xFF112233);
            BufferedImage copy = OverlayRenderer.gaussianBlur(img, 0);
            assertNotSame(img, copy);
            assertEquals(0xFF112233, copy.getRGB(1, 1));
        }

        @Test
        @DisplayName("scaled radius changes the small shadow")
        void scaledRadius() {
            BufferedImage fixed = OverlayRenderer.shadowLayer(60, IconDesign.defaults());
            BufferedImage scaled = OverlayRenderer.shadowLayer(60, new IconDesign(Palette.defaults(), 2.0, true));
            boolean differs = false;
            for (int x = 0; x < 66 && !differs; x++) {
                differs = fixed.getRGB(x, 33) != scaled.getRGB(x, 33);
            }
            assertTrue(differs);
        }
    }
}
