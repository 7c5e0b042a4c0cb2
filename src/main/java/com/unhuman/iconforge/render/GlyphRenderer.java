package com.unhuman.iconforge.render;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.geom.Path2D;
import java.awt.geom.Point2D;
import java.awt.image.BufferedImage;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Draws the checkmark glyph as a flat polygon; no fonts involved.
 */
public final class GlyphRenderer {

    private GlyphRenderer() {}

    /**
     * The three vertices of the simplified checkmark inside the box at (x, y) with edge {@code size}:
     * (20%, 50%), then (40%, 70%), then (80%, 30%).
     */
    public static List<Point2D.Double> checkmarkPolygon(double x, double y, double size) {
        return Collections.unmodifiableList(Arrays.asList(
            new Point2D.Double(x + size * 0.2, y + size * 0.5),
            new Point2D.Double(x + size * 0.4, y + size * 0.7),
            new Point2D.Double(x + size * 0.8, y + size * 0.3)
        ));
    }

    /**
     * Fill the closed polygon through {@code points} with a flat color.
     */
    public static void fillPolygon(BufferedImage canvas, List<? extends Point2D> points, Color color) {
        if (points.size() < 3) {
            throw new IllegalArgumentException("A polygon needs at least 3 points but got " + points.size());
        }
        Path2D.Double path = new Path2D.Double();
        Point2D first = points.get(0);
        path.moveTo(first.getX(), first.getY());
        for (int i = 1; i < points.size(); i++) {
            Point2D p = points.get(i);
            path.lineTo(p.getX(), p.getY());
        }
        path.closePath();

        Graphics2D g = Canvases.antialiased(canvas);
        try {
            g.setColor(color);
            g.fill(path);
        } finally {
            g.dispose();
        }
    }
}
