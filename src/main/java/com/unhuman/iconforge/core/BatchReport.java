package com.unhuman.iconforge.core;

import com.unhuman.iconforge.model.IconFile;
import com.unhuman.iconforge.model.IconSizeSpec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What a batch run produced: written files, slots that were not rendered, and per-file write failures.
 */
public class BatchReport {
    private final List<IconFile> written = new ArrayList<>();
    private final List<IconSizeSpec> skipped = new ArrayList<>();
    private final Map<String, String> failures = new LinkedHashMap<>();

    void addWritten(IconFile file) {
        written.add(file);
    }

    void addSkipped(IconSizeSpec spec) {
        skipped.add(spec);
    }

    void addFailure(String filename, String message) {
        failures.put(filename, message);
    }

    public List<IconFile> getWritten() {
        return Collections.unmodifiableList(written);
    }

    /** Non-square slots: listed in the catalog, never composed. */
    public List<IconSizeSpec> getSkipped() {
        return Collections.unmodifiableList(skipped);
    }

    /** Filename to I/O error message. */
    public Map<String, String> getFailures() {
        return Collections.unmodifiableMap(failures);
    }

    public boolean isComplete() {
        return failures.isEmpty();
    }

    @Override
    public String toString() {
        return written.size() + " written, " + skipped.size() + " skipped, " + failures.size() + " failed";
    }
}
