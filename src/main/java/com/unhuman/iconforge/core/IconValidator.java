package com.unhuman.iconforge.core;

import com.unhuman.iconforge.model.ValidationResult;
import com.unhuman.iconforge.util.LogCategory;
import com.unhuman.iconforge.util.LogManager;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads produced icons back and checks them against the packaging rules, in order:
 * square, store icon at least 1024px, PNG encoded.
 */
public class IconValidator {
    public static final String NOT_SQUARE = "Icon must be square";
    public static final String STORE_TOO_SMALL = "App Store icon must be at least 1024x1024";
    public static final String WRONG_FORMAT = "Icon must be PNG format";
    public static final String ERROR_PREFIX = "Error validating icon: ";

    private static final String EXPECTED_FORMAT = "png";

    /**
     * Decode the file and apply the rules. Read and decode problems come back as an invalid result.
     */
    public ValidationResult isValid(Path path) {
        Path name = path.getFileName();
        String filename = name != null ? name.toString() : path.toString();
        ValidationResult result;
        try {
            if (name == null) {
                result = ValidationResult.invalid(ERROR_PREFIX + "no file name in " + path);
            } else {
                result = check(path, filename);
            }
        } catch (IOException | RuntimeException e) {
            result = ValidationResult.invalid(ERROR_PREFIX + (e.getMessage() != null ? e.getMessage() : e.toString()));
        }
        if (result.isValid()) {
            LogManager.getInstance().info(LogCategory.VALIDATION, filename + " - " + result.getReason());
        } else {
            LogManager.getInstance().warn(LogCategory.VALIDATION, filename + " - " + result.getReason());
        }
        return result;
    }

    private ValidationResult check(Path path, String filename) throws IOException {
        if (!Files.isRegularFile(path)) {
            return ValidationResult.invalid(ERROR_PREFIX + "no such file " + path);
        }
        try (ImageInputStream in = ImageIO.createImageInputStream(path.toFile())) {
            if (in == null) {
                return ValidationResult.invalid(ERROR_PREFIX + "cannot open " + path);
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                return ValidationResult.invalid(ERROR_PREFIX + "unrecognized image data in " + filename);
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(in, true, true);
                BufferedImage image = reader.read(0);
                return applyRules(filename, image.getWidth(), image.getHeight(), reader.getFormatName());
            } finally {
                reader.dispose();
            }
        }
    }

    static ValidationResult applyRules(String filename, int width, int height, String formatName) {
        if (width != height) {
            return ValidationResult.invalid(NOT_SQUARE);
        }
        if (SizeCatalog.logicalSizeOf(filename) == SizeCatalog.STORE_LOGICAL_SIZE
                && width < SizeCatalog.STORE_LOGICAL_SIZE) {
            return ValidationResult.invalid(STORE_TOO_SMALL);
        }
        if (!EXPECTED_FORMAT.equalsIgnoreCase(formatName)) {
            return ValidationResult.invalid(WRONG_FORMAT);
        }
        return ValidationResult.valid();
    }

    /**
     * Validate every {@code *.png} in the directory, in filename order.
     *
     * @throws IOException if the directory cannot be listed
     */
    public Map<String, ValidationResult> validateDirectory(Path directory) throws IOException {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*.png")) {
            for (Path file : stream) {
                files.add(file);
            }
        }
        Collections.sort(files);
        Map<String, ValidationResult> results = new LinkedHashMap<>();
        for (Path file : files) {
            results.put(file.getFileName().toString(), isValid(file));
        }
        return results;
    }
}
