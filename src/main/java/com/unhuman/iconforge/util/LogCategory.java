package com.unhuman.iconforge.util;

/**
 * Log categories for filtering
 */
public enum LogCategory {
    RENDERING("Rendering"),
    FILE_OUTPUT("File Output"),
    VALIDATION("Validation"),
    GENERAL("General");

    private final String displayName;

    LogCategory(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
