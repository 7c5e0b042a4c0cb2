package com.unhuman.iconforge.core;

import com.unhuman.iconforge.model.IconFile;
import com.unhuman.iconforge.model.IconSizeSpec;
import com.unhuman.iconforge.util.LogCategory;
import com.unhuman.iconforge.util.LogManager;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Renders every catalog slot and writes it as a PNG into an output directory.
 *
 * <p>Slots are grouped by derived filename. Each group is one unit of work and writes its slots in catalog
 * order, so later slots overwrite earlier ones with the same name and no two workers ever touch the same
 * file. With {@code parallelism > 1} groups run on a fixed pool and the call returns only after all of them
 * have finished.
 *
 * <p>Write failures are recorded per file and the batch carries on. Rendering failures are rethrown and
 * abort the whole batch.
 */
public class BatchGenerator {
    private static final String PNG_FORMAT = "png";

    private final IconComposer composer;
    private final int parallelism;

    public BatchGenerator(IconComposer composer) {
        this(composer, 1);
    }

    public BatchGenerator(IconComposer composer, int parallelism) {
        this.composer = composer;
        this.parallelism = Math.max(1, parallelism);
    }

    public BatchReport generateAll(Path outputDir) throws IOException {
        return generateAll(outputDir, SizeCatalog.getRequiredSizes());
    }

    /**
     * @throws IOException if the output directory cannot be created
     */
    public BatchReport generateAll(Path outputDir, List<IconSizeSpec> specs) throws IOException {
        // createDirectories treats an existing directory as success
        Files.createDirectories(outputDir);

        BatchReport report = new BatchReport();
        Map<String, List<IconSizeSpec>> groups = new LinkedHashMap<>();
        for (IconSizeSpec spec : specs) {
            if (!spec.isSquare()) {
                LogManager.getInstance().warn(LogCategory.RENDERING, "Skipping non-square slot " + spec);
                report.addSkipped(spec);
                continue;
            }
            groups.computeIfAbsent(SizeCatalog.filenameFor(spec), k -> new ArrayList<>()).add(spec);
        }

        if (parallelism == 1 || groups.size() <= 1) {
            for (Map.Entry<String, List<IconSizeSpec>> group : groups.entrySet()) {
                try {
                    report.addWritten(writeGroup(outputDir, group.getKey(), group.getValue()));
                } catch (IOException e) {
                    recordFailure(report, group.getKey(), e);
                }
            }
        } else {
            generateConcurrently(outputDir, groups, report);
        }

        LogManager.getInstance().info(LogCategory.FILE_OUTPUT, "Icon batch finished in " + outputDir + ": " + report);
        return report;
    }

    private void generateConcurrently(Path outputDir, Map<String, List<IconSizeSpec>> groups, BatchReport report) {
        AtomicInteger threadCount = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(parallelism, r -> {
            Thread t = new Thread(r, "IconRender-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            Map<String, Future<IconFile>> futures = new LinkedHashMap<>();
            for (Map.Entry<String, List<IconSizeSpec>> group : groups.entrySet()) {
                Callable<IconFile> task = () -> writeGroup(outputDir, group.getKey(), group.getValue());
                futures.put(group.getKey(), executor.submit(task));
            }
            for (Map.Entry<String, Future<IconFile>> entry : futures.entrySet()) {
                try {
                    report.addWritten(entry.getValue().get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof IOException) {
                        recordFailure(report, entry.getKey(), (IOException) cause);
                    } else if (cause instanceof RuntimeException) {
                        executor.shutdownNow();
                        throw (RuntimeException) cause;
                    } else if (cause instanceof Error) {
                        executor.shutdownNow();
                        throw (Error) cause;
                    } else {
                        executor.shutdownNow();
                        throw new IllegalStateException("Icon task failed for " + entry.getKey(), cause);
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
            throw new IllegalStateException("Interrupted while generating icons", e);
        } finally {
            executor.shutdown();
        }
    }

    private IconFile writeGroup(Path outputDir, String filename, List<IconSizeSpec> specs) throws IOException {
        Path target = outputDir.resolve(filename);
        IconFile last = null;
        for (IconSizeSpec spec : specs) {
            int pixelSize = spec.getPixelSize();
            BufferedImage icon = composer.composeIcon(pixelSize);
            if (!ImageIO.write(icon, PNG_FORMAT, target.toFile())) {
                throw new IOException("No PNG writer available for " + target);
            }
            LogManager.getInstance().info(LogCategory.FILE_OUTPUT,
                "Generated: " + filename + " (" + icon.getWidth() + "x" + icon.getHeight() + ")");
            last = new IconFile(target, pixelSize);
        }
        return last;
    }

    private static void recordFailure(BatchReport report, String filename, IOException e) {
        LogManager.getInstance().error(LogCategory.FILE_OUTPUT, "Failed to write " + filename + ": " + e.getMessage());
        report.addFailure(filename, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
    }
}
