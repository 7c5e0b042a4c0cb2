package com.unhuman.iconforge.core;

import com.unhuman.iconforge.model.IconDesign;
import com.unhuman.iconforge.model.ValidationResult;
import com.unhuman.iconforge.util.LogManager;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class IconValidatorTest {

    private Path tempDir;
    private IconValidator validator;

    @BeforeEach
    void setup() throws IOException {
        LogManager.getInstance();
        tempDir = Files.createTempDirectory("iconforge-validate");
        validator = new IconValidator();
    }

    @AfterEach
    void cleanup() throws IOException {
        if (Files.exists(tempDir)) {
            try (Stream<Path> walk = Files.walk(tempDir)) {
                walk.sorted(Comparator.reverseOrder())
                    .map(Path::toFile)
                    .forEach(File::delete);
            }
        }
    }

    private Path writeImage(String name, int width, int height, int type, String format) throws IOException {
        Path target = tempDir.resolve(name);
        assertTrue(ImageIO.write(new BufferedImage(width, height, type), format, target.toFile()));
        return target;
    }

    // ───────── Files ─────────

    @Nested
    @DisplayName("isValid()")
    class SingleFile {

        @Test
        @DisplayName("accepts a square PNG")
        void squarePng() throws IOException {
            ValidationResult result = validator.isValid(writeImage("AppIcon-20@2x.png", 40, 40,
                BufferedImage.TYPE_INT_ARGB, "png"));
            assertTrue(result.isValid());
            assertEquals(ValidationResult.VALID_MESSAGE, result.getReason());
        }

        @Test
        @DisplayName("rejects a non-square PNG")
        void nonSquare() throws IOException {
            ValidationResult result = validator.isValid(writeImage("AppIcon-20.png", 40, 20,
                BufferedImage.TYPE_INT_ARGB, "png"));
            assertFalse(result.isValid());
            assertEquals(IconValidator.NOT_SQUARE, result.getReason());
        }

        @Test
        @DisplayName("rejects an undersized store icon")
        void smallStoreIcon() throws IOException {
            ValidationResult result = validator.isValid(writeImage("AppIcon-1024.png", 512, 512,
                BufferedImage.TYPE_INT_ARGB, "png"));
            assertFalse(result.isValid());
            assertEquals(IconValidator.STORE_TOO_SMALL, result.getReason());
        }

        @Test
        @DisplayName("rejects JPEG data even with a .png name")
        void jpegData() throws IOException {
            ValidationResult result = validator.isValid(writeImage("AppIcon-29.png", 29, 29,
                BufferedImage.TYPE_INT_RGB, "jpg"));
            assertFalse(result.isValid());
            assertEquals(IconValidator.WRONG_FORMAT, result.getReason());
        }

        @Test
        @DisplayName("missing file is reported as an error")
        void missing() {
            ValidationResult result = validator.isValid(tempDir.resolve("AppIcon-40.png"));
            assertFalse(result.isValid());
            assertTrue(result.getReason().startsWith(IconValidator.ERROR_PREFIX), result.getReason());
        }

        @Test
        @DisplayName("a path without a file name is reported as an error")
        void noFileName() {
            Path root = tempDir.getRoot();
            assertNull(root.getFileName());
            ValidationResult result = validator.isValid(root);
            assertFalse(result.isValid());
            assertTrue(result.getReason().startsWith(IconValidator.ERROR_PREFIX), result.getReason());
        }

        @Test
        @DisplayName("garbage bytes are reported as an error")
        void garbage() throws IOException {
            Path bogus = Files.write(tempDir.resolve("AppIcon-60.png"), "not an image".getBytes());
            ValidationResult result = validator.isValid(bogus);
            assertFalse(result.isValid());
            assertTrue(result.getReason().startsWith(IconValidator.ERROR_PREFIX), result.getReason());
        }
    }

    // ───────── Rule Order ─────────

    @Nested
    @DisplayName("rule order")
    class RuleOrder {

        @Test
        @DisplayName("squareness is checked before the store size")
        void squareFirst() {
            assertEquals(IconValidator.NOT_SQUARE,
                IconValidator.applyRules("AppIcon-1024.png", 1024, 512, "png").getReason());
        }

        @Test
        @DisplayName("store size is checked before the format")
        void storeBeforeFormat() {
            assertEquals(IconValidator.STORE_TOO_SMALL,
                IconValidator.applyRules("AppIcon-1024.png", 100, 100, "JPEG").getReason());
        }

        @Test
        @DisplayName("only the store filename triggers the store size rule")
        void storeRuleScope() {
            assertTrue(IconValidator.applyRules("AppIcon-60@3x.png", 180, 180, "png").isValid());
            assertTrue(IconValidator.applyRules("AppIcon-1024.png", 2048, 2048, "PNG").isValid());
        }
    }

    // ───────── Directory ─────────

    @Nested
    @DisplayName("validateDirectory()")
    class Directory {

        @Test
        @DisplayName("validates every PNG in name order and ignores other files")
        void sortedResults() throws IOException {
            writeImage("AppIcon-40.png", 40, 40, BufferedImage.TYPE_INT_ARGB, "png");
            writeImage("AppIcon-20.png", 20, 10, BufferedImage.TYPE_INT_ARGB, "png");
            Files.write(tempDir.resolve("Contents.json"), "{}".getBytes());

            Map<String, ValidationResult> results = validator.validateDirectory(tempDir);

            assertEquals(Arrays.asList("AppIcon-20.png", "AppIcon-40.png"), new ArrayList<>(results.keySet()));
            assertFalse(results.get("AppIcon-20.png").isValid());
            assertTrue(results.get("AppIcon-40.png").isValid());
        }

        @Test
        @DisplayName("generated catalog passes validation")
        void generatedCatalog() throws IOException {
            new BatchGenerator(new IconComposer(IconDesign.defaults()), 2)
                .generateAll(tempDir);
            Map<String, ValidationResult> results = validator.validateDirectory(tempDir);
            assertEquals(16, results.size());
            for (Map.Entry<String, ValidationResult> entry : results.entrySet()) {
                assertTrue(entry.getValue().isValid(), entry.getKey() + ": " + entry.getValue().getReason());
            }
        }

        @Test
        @DisplayName("missing directory throws")
        void missingDirectory() {
            assertThrows(IOException.class, () -> validator.validateDirectory(tempDir.resolve("nope")));
        }
    }
}
