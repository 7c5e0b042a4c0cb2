package com.unhuman.iconforge.core;

import com.unhuman.iconforge.model.IconIdiom;
import com.unhuman.iconforge.model.IconSizeSpec;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The icon matrix an app icon set must provide, and the filename each slot is written to.
 */
public final class SizeCatalog {
    public static final String FILENAME_PREFIX = "AppIcon-";
    public static final int STORE_LOGICAL_SIZE = 1024;
    public static final String STORE_FILENAME = FILENAME_PREFIX + STORE_LOGICAL_SIZE + ".png";

    private static final Pattern FILENAME_PATTERN = Pattern.compile("^AppIcon-(\\d+)(?:@(\\d+)x)?\\.png$");

    private static final List<IconSizeSpec> REQUIRED_SIZES = Collections.unmodifiableList(Arrays.asList(
        // iPhone
        IconSizeSpec.square(20, 1, IconIdiom.IPHONE),
        IconSizeSpec.square(20, 2, IconIdiom.IPHONE),
        IconSizeSpec.square(20, 3, IconIdiom.IPHONE),
        IconSizeSpec.square(29, 1, IconIdiom.IPHONE),
        IconSizeSpec.square(29, 2, IconIdiom.IPHONE),
        IconSizeSpec.square(29, 3, IconIdiom.IPHONE),
        IconSizeSpec.square(40, 1, IconIdiom.IPHONE),
        IconSizeSpec.square(40, 2, IconIdiom.IPHONE),
        IconSizeSpec.square(40, 3, IconIdiom.IPHONE),
        IconSizeSpec.square(60, 1, IconIdiom.IPHONE),
        IconSizeSpec.square(60, 2, IconIdiom.IPHONE),
        IconSizeSpec.square(60, 3, IconIdiom.IPHONE),
        // iPad
        IconSizeSpec.square(76, 1, IconIdiom.IPAD),
        IconSizeSpec.square(76, 2, IconIdiom.IPAD),
        IconSizeSpec.square(83.5, 2, IconIdiom.IPAD),
        // App Store
        IconSizeSpec.square(STORE_LOGICAL_SIZE, 1, IconIdiom.IOS_MARKETING)
    ));

    private SizeCatalog() {}

    public static List<IconSizeSpec> getRequiredSizes() {
        return REQUIRED_SIZES;
    }

    /**
     * {@code AppIcon-{size}.png} at 1x, {@code AppIcon-{size}@{scale}x.png} above that, with the logical
     * size truncated (83.5 becomes 83). Every store-size slot maps to {@link #STORE_FILENAME}.
     */
    public static String filenameFor(IconSizeSpec spec) {
        int logical = (int) spec.getLogicalWidth();
        if (logical == STORE_LOGICAL_SIZE) {
            return STORE_FILENAME;
        }
        if (spec.getScale() > 1) {
            return FILENAME_PREFIX + logical + "@" + spec.getScale() + "x.png";
        }
        return FILENAME_PREFIX + logical + ".png";
    }

    public static boolean isStoreIcon(IconSizeSpec spec) {
        return (int) spec.getLogicalWidth() == STORE_LOGICAL_SIZE;
    }

    /** Filenames the given specs produce, first occurrence order, collisions collapsed. */
    public static Set<String> distinctFilenames(List<IconSizeSpec> specs) {
        Set<String> names = new LinkedHashSet<>();
        for (IconSizeSpec spec : specs) {
            names.add(filenameFor(spec));
        }
        return names;
    }

    /**
     * Logical size encoded in an icon filename, or -1 if the name does not follow the icon naming scheme.
     */
    public static int logicalSizeOf(String filename) {
        Matcher matcher = FILENAME_PATTERN.matcher(filename);
        if (!matcher.matches()) {
            return -1;
        }
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
