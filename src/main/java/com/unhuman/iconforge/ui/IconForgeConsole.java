package com.unhuman.iconforge.ui;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import com.unhuman.iconforge.core.AssetCatalogManifest;
import com.unhuman.iconforge.core.BatchGenerator;
import com.unhuman.iconforge.core.BatchReport;
import com.unhuman.iconforge.core.ConfigManager;
import com.unhuman.iconforge.core.IconComposer;
import com.unhuman.iconforge.core.IconValidator;
import com.unhuman.iconforge.core.SizeCatalog;
import com.unhuman.iconforge.model.ValidationResult;
import com.unhuman.iconforge.util.LogCategory;
import com.unhuman.iconforge.util.LogEntry;
import com.unhuman.iconforge.util.LogManager;

/**
 * Command line front end: renders the full icon set, writes its manifest and validates the result.
 *
 * <pre>
 * java -jar icon-forge.jar [outputDirectory] [configFile]
 * </pre>
 */
public class IconForgeConsole {
    private static final String APP_DIR = ".iconforge";
    private static final String CONFIG_FILE = "iconforge.properties";

    private final ConfigManager configManager;

    public IconForgeConsole(String configPath) {
        // recap covers this run only
        LogManager.getInstance().clearLogs();
        this.configManager = new ConfigManager(configPath);
        this.configManager.loadConfiguration();
    }

    public static String defaultConfigPath() {
        return new File(new File(System.getProperty("user.home"), APP_DIR), CONFIG_FILE).getAbsolutePath();
    }

    /**
     * Generate, then validate once every icon has been written.
     * @param outputOverride directory to use instead of the configured one, may be null
     * @return process exit code, 0 when every icon was written and is valid
     */
    public int run(String outputOverride) throws IOException {
        Path outputDir = Paths.get(outputOverride != null ? outputOverride : configManager.getOutputDirectory());

        LogManager.getInstance().info(LogCategory.GENERAL, "Generating app icons into " + outputDir.toAbsolutePath());
        IconComposer composer = new IconComposer(configManager.toIconDesign());
        BatchGenerator generator = new BatchGenerator(composer, configManager.getParallelism());
        BatchReport report = generator.generateAll(outputDir);

        if (configManager.isWriteContentsJson()) {
            AssetCatalogManifest.write(outputDir, SizeCatalog.getRequiredSizes());
        }

        IconValidator validator = new IconValidator();
        Map<String, ValidationResult> results = validator.validateDirectory(outputDir);
        int invalid = 0;
        for (Map.Entry<String, ValidationResult> entry : results.entrySet()) {
            ValidationResult result = entry.getValue();
            if (!result.isValid()) {
                invalid++;
            }
            LogManager.getInstance().info(LogCategory.VALIDATION,
                (result.isValid() ? "[OK]   " : "[FAIL] ") + entry.getKey() + " - " + result.getReason());
        }

        boolean success = report.isComplete() && invalid == 0;
        if (success) {
            LogManager.getInstance().info(LogCategory.GENERAL, "All " + results.size() + " app icons generated successfully");
        } else {
            recapProblems();
            LogManager.getInstance().warn(LogCategory.GENERAL, report.getFailures().size() + " icons not written, "
                + invalid + " icons invalid");
        }
        return success ? 0 : 1;
    }

    /**
     * Repeat every warning and error of this run in one block, so they are not lost among the per-icon lines.
     */
    private static void recapProblems() {
        List<LogEntry> problems = LogManager.getInstance().getProblems();
        StringBuilder recap = new StringBuilder("Problems during this run:");
        for (LogEntry problem : problems) {
            recap.append("\n  [").append(problem.getCategory().getDisplayName()).append("] ")
                .append(problem.getMessage());
        }
        LogManager.getInstance().info(LogCategory.GENERAL, recap.toString());
    }

    public static void main(String[] args) {
        String outputOverride = args.length > 0 ? args[0] : null;
        String configPath = args.length > 1 ? args[1] : defaultConfigPath();
        int exitCode;
        try {
            exitCode = new IconForgeConsole(configPath).run(outputOverride);
        } catch (Exception e) {
            LogManager.getInstance().error(LogCategory.GENERAL, "Icon generation aborted", e);
            exitCode = 1;
        }
        System.exit(exitCode);
    }
}
