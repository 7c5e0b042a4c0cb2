package com.unhuman.iconforge.core;

import com.unhuman.iconforge.model.IconIdiom;
import com.unhuman.iconforge.model.IconSizeSpec;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SizeCatalogTest {

    // ───────── Catalog ─────────

    @Nested
    @DisplayName("required sizes")
    class RequiredSizes {

        @Test
        @DisplayName("lists sixteen square slots")
        void count() {
            List<IconSizeSpec> sizes = SizeCatalog.getRequiredSizes();
            assertEquals(16, sizes.size());
            for (IconSizeSpec spec : sizes) {
                assertTrue(spec.isSquare(), spec.toString());
            }
        }

        @Test
        @DisplayName("has exactly one store entry at 1x")
        void storeEntry() {
            long store = SizeCatalog.getRequiredSizes().stream().filter(SizeCatalog::isStoreIcon).count();
            assertEquals(1, store);
            assertTrue(SizeCatalog.getRequiredSizes().contains(
                IconSizeSpec.square(1024, 1, IconIdiom.IOS_MARKETING)));
        }

        @Test
        @DisplayName("is read-only")
        void readOnly() {
            assertThrows(UnsupportedOperationException.class,
                () -> SizeCatalog.getRequiredSizes().add(IconSizeSpec.square(10, 1, IconIdiom.IPHONE)));
        }

        @Test
        @DisplayName("produces sixteen distinct filenames")
        void distinct() {
            assertEquals(16, SizeCatalog.distinctFilenames(SizeCatalog.getRequiredSizes()).size());
        }
    }

    // ───────── Filenames ─────────

    @Nested
    @DisplayName("filenameFor()")
    class Filenames {

        @Test
        @DisplayName("1x has no scale suffix")
        void oneX() {
            assertEquals("AppIcon-20.png", SizeCatalog.filenameFor(IconSizeSpec.square(20, 1, IconIdiom.IPHONE)));
        }

        @Test
        @DisplayName("higher scales get an @Nx suffix")
        void scaled() {
            assertEquals("AppIcon-60@3x.png", SizeCatalog.filenameFor(IconSizeSpec.square(60, 3, IconIdiom.IPHONE)));
        }

        @Test
        @DisplayName("fractional logical size is truncated")
        void truncated() {
            IconSizeSpec spec = IconSizeSpec.square(83.5, 2, IconIdiom.IPAD);
            assertEquals("AppIcon-83@2x.png", SizeCatalog.filenameFor(spec));
            assertEquals(167, spec.getPixelSize());
        }

        @Test
        @DisplayName("every store variant collapses onto AppIcon-1024.png")
        void storeCollapse() {
            assertEquals("AppIcon-1024.png", SizeCatalog.filenameFor(IconSizeSpec.square(1024, 1, IconIdiom.IOS_MARKETING)));
            assertEquals("AppIcon-1024.png", SizeCatalog.filenameFor(IconSizeSpec.square(1024, 2, IconIdiom.IOS_MARKETING)));
        }

        @Test
        @DisplayName("distinct non-store slots never share a filename")
        void injective() {
            List<IconSizeSpec> specs = Arrays.asList(
                IconSizeSpec.square(20, 1, IconIdiom.IPHONE),
                IconSizeSpec.square(20, 2, IconIdiom.IPHONE),
                IconSizeSpec.square(29, 1, IconIdiom.IPHONE),
                IconSizeSpec.square(76, 2, IconIdiom.IPAD),
                IconSizeSpec.square(83.5, 2, IconIdiom.IPAD));
            Map<String, IconSizeSpec> seen = new HashMap<>();
            for (IconSizeSpec spec : SizeCatalog.getRequiredSizes()) {
                if (!SizeCatalog.isStoreIcon(spec)) {
                    assertNull(seen.put(SizeCatalog.filenameFor(spec), spec), "collision for " + spec);
                }
            }
            assertEquals(5, SizeCatalog.distinctFilenames(specs).size());
        }
    }

    // ───────── Parsing ─────────

    @Nested
    @DisplayName("logicalSizeOf()")
    class Parsing {

        @Test
        @DisplayName("reads the logical size back from generated names")
        void parses() {
            assertEquals(1024, SizeCatalog.logicalSizeOf("AppIcon-1024.png"));
            assertEquals(83, SizeCatalog.logicalSizeOf("AppIcon-83@2x.png"));
            assertEquals(20, SizeCatalog.logicalSizeOf("AppIcon-20.png"));
        }

        @Test
        @DisplayName("returns -1 for foreign names")
        void foreign() {
            assertEquals(-1, SizeCatalog.logicalSizeOf("icon.png"));
            assertEquals(-1, SizeCatalog.logicalSizeOf("AppIcon-1024.jpg"));
            assertEquals(-1, SizeCatalog.logicalSizeOf("Contents.json"));
        }
    }
}
