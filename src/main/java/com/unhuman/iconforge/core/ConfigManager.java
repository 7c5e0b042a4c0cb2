package com.unhuman.iconforge.core;

import com.unhuman.iconforge.model.IconDesign;
import com.unhuman.iconforge.model.Palette;
import com.unhuman.iconforge.util.LogCategory;
import com.unhuman.iconforge.util.LogManager;

import java.awt.Color;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.util.Properties;

/**
 * Loads icon generation settings from a properties file, creating one with defaults when missing.
 */
public class ConfigManager {
    public static final String DEFAULT_OUTPUT_DIRECTORY = "AppIcon.appiconset";

    private final String configFilePath;
    private final Properties properties = new Properties();
    private String outputDirectory = DEFAULT_OUTPUT_DIRECTORY;
    private Color primaryBlue = Palette.DEFAULT_PRIMARY_BLUE;
    private Color secondaryBlue = Palette.DEFAULT_SECONDARY_BLUE;
    private Color accentPurple = Palette.DEFAULT_ACCENT_PURPLE;
    private Color backgroundWhite = Palette.DEFAULT_BACKGROUND_WHITE;
    private double shadowBlurRadius = IconDesign.DEFAULT_SHADOW_BLUR_RADIUS;
    private boolean scaleShadowBlur = false;
    private int parallelism = 1;
    private boolean writeContentsJson = true;

    public ConfigManager(String configFilePath) {
        this.configFilePath = configFilePath;
        LogManager.getInstance().info(LogCategory.GENERAL, "ConfigManager initialized with path: " + configFilePath);
    }

    public void loadConfiguration() {
        File configFile = new File(configFilePath);
        File configDir = configFile.getAbsoluteFile().getParentFile();
        if (configDir != null && !configDir.exists()) {
            configDir.mkdirs();
        }
        if (configFile.exists()) {
            try {
                FileInputStream fis = new FileInputStream(configFile);
                try {
                    properties.load(fis);
                } finally {
                    fis.close();
                }
                loadPropertiesFromConfig();
                LogManager.getInstance().info(LogCategory.GENERAL, "Configuration loaded from " + configFilePath);
            } catch (Exception e) {
                LogManager.getInstance().error(LogCategory.GENERAL, "Error loading configuration: " + e.getMessage());
                createDefaultConfig(configFile);
            }
        } else {
            createDefaultConfig(configFile);
        }
    }

    private void createDefaultConfig(File configFile) {
        LogManager.getInstance().info(LogCategory.GENERAL, "Creating default configuration at " + configFile.getAbsolutePath());
        properties.clear();
        properties.setProperty("outputDirectory", DEFAULT_OUTPUT_DIRECTORY);
        properties.setProperty("primaryBlue", Palette.toHex(Palette.DEFAULT_PRIMARY_BLUE));
        properties.setProperty("secondaryBlue", Palette.toHex(Palette.DEFAULT_SECONDARY_BLUE));
        properties.setProperty("accentPurple", Palette.toHex(Palette.DEFAULT_ACCENT_PURPLE));
        properties.setProperty("backgroundWhite", Palette.toHex(Palette.DEFAULT_BACKGROUND_WHITE));
        properties.setProperty("shadowBlurRadius", String.valueOf(IconDesign.DEFAULT_SHADOW_BLUR_RADIUS));
        properties.setProperty("scaleShadowBlur", "false");
        properties.setProperty("parallelism", "1");
        properties.setProperty("writeContentsJson", "true");
        try {
            FileOutputStream fos = new FileOutputStream(configFile);
            try {
                properties.store(fos, "IconForge Configuration");
            } finally {
                fos.close();
            }
            LogManager.getInstance().info(LogCategory.GENERAL,
                "Configuration file created at " + configFile.getAbsolutePath() + "\n\n" +
                "Edit it to change where icons are written (outputDirectory), the badge colors\n" +
                "(#RRGGBB values), the shadow blur radius in pixels at 1024px (shadowBlurRadius),\n" +
                "whether that radius shrinks with smaller icons (scaleShadowBlur) and how many\n" +
                "icons are rendered at once (parallelism).");
        } catch (Exception e) {
            LogManager.getInstance().error(LogCategory.GENERAL, "Error creating default configuration: " + e.getMessage());
        }
        loadPropertiesFromConfig();
    }

    private void loadPropertiesFromConfig() {
        outputDirectory = properties.getProperty("outputDirectory", DEFAULT_OUTPUT_DIRECTORY);
        primaryBlue = parseColor("primaryBlue", Palette.DEFAULT_PRIMARY_BLUE);
        secondaryBlue = parseColor("secondaryBlue", Palette.DEFAULT_SECONDARY_BLUE);
        accentPurple = parseColor("accentPurple", Palette.DEFAULT_ACCENT_PURPLE);
        backgroundWhite = parseColor("backgroundWhite", Palette.DEFAULT_BACKGROUND_WHITE);
        try {
            shadowBlurRadius = Double.parseDouble(properties.getProperty("shadowBlurRadius",
                String.valueOf(IconDesign.DEFAULT_SHADOW_BLUR_RADIUS)));
        } catch (NumberFormatException e) {
            LogManager.getInstance().warn(LogCategory.GENERAL, "Invalid shadowBlurRadius value, using default: " + e.getMessage());
            shadowBlurRadius = IconDesign.DEFAULT_SHADOW_BLUR_RADIUS;
        }
        if (!IconDesign.isValidBlurRadius(shadowBlurRadius)) {
            LogManager.getInstance().warn(LogCategory.GENERAL, "shadowBlurRadius must be within 0.."
                + IconDesign.MAX_SHADOW_BLUR_RADIUS + ", got " + shadowBlurRadius);
            shadowBlurRadius = IconDesign.DEFAULT_SHADOW_BLUR_RADIUS;
        }
        scaleShadowBlur = Boolean.parseBoolean(properties.getProperty("scaleShadowBlur", "false"));
        try {
            parallelism = Integer.parseInt(properties.getProperty("parallelism", "1"));
        } catch (NumberFormatException e) {
            LogManager.getInstance().warn(LogCategory.GENERAL, "Invalid parallelism value, using default: " + e.getMessage());
            parallelism = 1;
        }
        if (parallelism < 1) {
            LogManager.getInstance().warn(LogCategory.GENERAL, "parallelism must be at least 1, got " + parallelism);
            parallelism = 1;
        }
        writeContentsJson = Boolean.parseBoolean(properties.getProperty("writeContentsJson", "true"));
    }

    private Color parseColor(String key, Color defaultColor) {
        String value = properties.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultColor;
        }
        try {
            return Palette.parseHex(value);
        } catch (NumberFormatException e) {
            LogManager.getInstance().warn(LogCategory.GENERAL, "Invalid " + key + " value, using default: " + e.getMessage());
            return defaultColor;
        }
    }

    public String getConfigFilePath() { return configFilePath; }
    public String getOutputDirectory() { return outputDirectory; }
    public double getShadowBlurRadius() { return shadowBlurRadius; }
    public boolean isScaleShadowBlur() { return scaleShadowBlur; }
    public int getParallelism() { return parallelism; }
    public boolean isWriteContentsJson() { return writeContentsJson; }

    public Palette getPalette() {
        return new Palette(primaryBlue, secondaryBlue, accentPurple, backgroundWhite);
    }

    /** Snapshot of the current settings for the renderers. */
    public IconDesign toIconDesign() {
        return new IconDesign(getPalette(), shadowBlurRadius, scaleShadowBlur);
    }
}
