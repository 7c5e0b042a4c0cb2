package com.unhuman.iconforge.model;

import java.nio.file.Path;

/**
 * A PNG written by the batch generator
 */
public class IconFile {
    private final Path path;
    private final int pixelSize;

    public IconFile(Path path, int pixelSize) {
        this.path = path;
        this.pixelSize = pixelSize;
    }

    public Path getPath() { return path; }
    public int getPixelSize() { return pixelSize; }

    public String getFilename() {
        return path.getFileName().toString();
    }

    @Override
    public String toString() {
        return getFilename() + " (" + pixelSize + "x" + pixelSize + ")";
    }
}
