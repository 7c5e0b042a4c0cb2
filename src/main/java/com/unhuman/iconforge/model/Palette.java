package com.unhuman.iconforge.model;

import java.awt.Color;

/**
 * Named colors shared by every renderer.
 * {@link java.awt.Color} is immutable, so a palette can be handed to any number of render calls.
 */
public class Palette {
    public static final Color DEFAULT_PRIMARY_BLUE = new Color(0, 122, 255);
    public static final Color DEFAULT_SECONDARY_BLUE = new Color(0, 89, 204);
    public static final Color DEFAULT_ACCENT_PURPLE = new Color(128, 0, 255);
    public static final Color DEFAULT_BACKGROUND_WHITE = new Color(255, 255, 255);

    /** 10% black. */
    public static final Color SHADOW_GRAY = new Color(0, 0, 0, 25);
    /** 30% white. */
    public static final Color HIGHLIGHT_WHITE = new Color(255, 255, 255, 77);

    private final Color primaryBlue;
    private final Color secondaryBlue;
    private final Color accentPurple;
    private final Color backgroundWhite;

    public Palette(Color primaryBlue, Color secondaryBlue, Color accentPurple, Color backgroundWhite) {
        this.primaryBlue = primaryBlue;
        this.secondaryBlue = secondaryBlue;
        this.accentPurple = accentPurple;
        this.backgroundWhite = backgroundWhite;
    }

    public static Palette defaults() {
        return new Palette(DEFAULT_PRIMARY_BLUE, DEFAULT_SECONDARY_BLUE,
            DEFAULT_ACCENT_PURPLE, DEFAULT_BACKGROUND_WHITE);
    }

    public Color getPrimaryBlue() { return primaryBlue; }
    public Color getSecondaryBlue() { return secondaryBlue; }
    public Color getAccentPurple() { return accentPurple; }
    public Color getBackgroundWhite() { return backgroundWhite; }
    public Color getShadowGray() { return SHADOW_GRAY; }
    public Color getHighlightWhite() { return HIGHLIGHT_WHITE; }

    /**
     * Parse a {@code #RRGGBB} string such as {@code "#007AFF"}.
     * @throws NumberFormatException if the value is not a 6 digit hex color
     */
    public static Color parseHex(String value) {
        String hex = value.trim();
        if (hex.startsWith("#")) {
            hex = hex.substring(1);
        }
        if (hex.length() != 6) {
            throw new NumberFormatException("Expected #RRGGBB but got: " + value);
        }
        return new Color(Integer.parseInt(hex, 16));
    }

    public static String toHex(Color color) {
        return String.format("#%02X%02X%02X", color.getRed(), color.getGreen(), color.getBlue());
    }
}
