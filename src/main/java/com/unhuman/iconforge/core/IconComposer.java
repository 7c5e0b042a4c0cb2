package com.unhuman.iconforge.core;

import com.unhuman.iconforge.model.IconDesign;
import com.unhuman.iconforge.model.Palette;
import com.unhuman.iconforge.render.AlphaMask;
import com.unhuman.iconforge.render.Canvases;
import com.unhuman.iconforge.render.GlyphRenderer;
import com.unhuman.iconforge.render.GradientRenderer;
import com.unhuman.iconforge.render.InvalidSizeException;
import com.unhuman.iconforge.render.MaskCompositor;
import com.unhuman.iconforge.render.OverlayRenderer;

import java.awt.image.BufferedImage;

/**
 * Builds the finished badge icon for one pixel size.
 *
 * <p>Layers, bottom to top:
 * <ol>
 *   <li>blue gradient clipped to a rounded square (corner radius 22%)</li>
 *   <li>white main circle, 60%</li>
 *   <li>10% blue to purple gradient disc, 40%</li>
 *   <li>white badge circle, 30%</li>
 *   <li>blue checkmark inside a 25% box</li>
 *   <li>30% white glass highlight</li>
 * </ol>
 * The stack is then centered on the blurred drop shadow, which is 110% of the icon, and the result is
 * center-cropped back to {@code pixelSize x pixelSize}. Output dimensions therefore always equal the
 * requested size.
 *
 * <p>Every call allocates its own buffers, so one composer can serve several threads.
 */
public class IconComposer {
    static final double CORNER_RADIUS_RATIO = 0.22;
    static final double MAIN_CIRCLE_RATIO = 0.6;
    static final double INNER_CIRCLE_RATIO = 0.4;
    static final double BADGE_CIRCLE_RATIO = 0.3;
    static final double CHECKMARK_RATIO = 0.25;
    /** 10% of 255. */
    static final int INNER_CIRCLE_OPACITY = 25;

    private final IconDesign design;

    public IconComposer(IconDesign design) {
        this.design = design;
    }

    /**
     * Render the icon at {@code pixelSize}. Same input, same pixels.
     *
     * @throws InvalidSizeException if pixelSize is not positive
     */
    public BufferedImage composeIcon(int pixelSize) {
        if (pixelSize <= 0) {
            throw new InvalidSizeException("Icon size must be positive but was " + pixelSize, pixelSize);
        }
        Palette palette = design.getPalette();

        BufferedImage gradient = GradientRenderer.renderGradient(pixelSize,
            palette.getPrimaryBlue(), palette.getSecondaryBlue());
        int cornerRadius = (int) Math.round(pixelSize * CORNER_RADIUS_RATIO);
        AlphaMask badgeMask = MaskCompositor.roundedMask(pixelSize, cornerRadius);
        BufferedImage icon = Canvases.newCanvas(pixelSize, pixelSize);
        MaskCompositor.compositeThroughMask(gradient, badgeMask, icon, 0, 0);

        fillCenteredCircle(icon, (int) (pixelSize * MAIN_CIRCLE_RATIO), palette);

        int innerSize = (int) (pixelSize * INNER_CIRCLE_RATIO);
        if (innerSize > 0) {
            BufferedImage innerGradient = GradientRenderer.renderGradient(innerSize,
                palette.getPrimaryBlue(), palette.getAccentPurple());
            AlphaMask innerMask = MaskCompositor.circleMask(innerSize, INNER_CIRCLE_OPACITY);
            int offset = (pixelSize - innerSize) / 2;
            MaskCompositor.compositeThroughMask(innerGradient, innerMask, icon, offset, offset);
        }

        fillCenteredCircle(icon, (int) (pixelSize * BADGE_CIRCLE_RATIO), palette);

        int checkSize = (int) (pixelSize * CHECKMARK_RATIO);
        if (checkSize > 0) {
            int checkOffset = (pixelSize - checkSize) / 2;
            GlyphRenderer.fillPolygon(icon,
                GlyphRenderer.checkmarkPolygon(checkOffset, checkOffset, checkSize),
                palette.getPrimaryBlue());
        }

        Canvases.drawOver(icon, OverlayRenderer.highlightOverlay(pixelSize, palette), 0, 0);

        BufferedImage shadow = OverlayRenderer.shadowLayer(pixelSize, design);
        int bleed = (shadow.getWidth() - pixelSize) / 2;
        Canvases.drawOver(shadow, icon, bleed, bleed);
        return Canvases.crop(shadow, bleed, bleed, pixelSize, pixelSize);
    }

    private static void fillCenteredCircle(BufferedImage icon, int diameter, Palette palette) {
        if (diameter <= 0) {
            return;
        }
        int offset = (icon.getWidth() - diameter) / 2;
        Canvases.fillEllipse(icon, offset, offset, diameter, diameter, palette.getBackgroundWhite());
    }
}
