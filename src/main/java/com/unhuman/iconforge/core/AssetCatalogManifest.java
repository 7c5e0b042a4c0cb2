package com.unhuman.iconforge.core;

import com.unhuman.iconforge.model.IconSizeSpec;
import com.unhuman.iconforge.util.LogCategory;
import com.unhuman.iconforge.util.LogManager;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes the {@code Contents.json} that tells the asset catalog which file fills which icon slot.
 */
public final class AssetCatalogManifest {
    public static final String FILENAME = "Contents.json";
    private static final String AUTHOR = "xcode";
    private static final int VERSION = 1;

    private AssetCatalogManifest() {}

    public static JSONObject build(List<IconSizeSpec> specs) {
        JSONArray images = new JSONArray();
        for (IconSizeSpec spec : specs) {
            if (!spec.isSquare()) {
                continue;
            }
            JSONObject image = new JSONObject();
            image.put("filename", SizeCatalog.filenameFor(spec));
            image.put("idiom", spec.getIdiom().getCatalogName());
            image.put("scale", spec.getScale() + "x");
            image.put("size", spec.getSizeLabel());
            images.put(image);
        }

        JSONObject info = new JSONObject();
        info.put("author", AUTHOR);
        info.put("version", VERSION);

        JSONObject root = new JSONObject();
        root.put("images", images);
        root.put("info", info);
        return root;
    }

    public static Path write(Path directory, List<IconSizeSpec> specs) throws IOException {
        Files.createDirectories(directory);
        Path target = directory.resolve(FILENAME);
        JSONObject manifest = build(specs);
        Files.write(target, manifest.toString(2).getBytes(StandardCharsets.UTF_8));
        LogManager.getInstance().info(LogCategory.FILE_OUTPUT,
            "Wrote " + FILENAME + " with " + manifest.getJSONArray("images").length() + " slots");
        return target;
    }
}
