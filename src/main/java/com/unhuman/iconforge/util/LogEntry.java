package com.unhuman.iconforge.util;

/**
 * One buffered log line. Records the thread it came from because batch workers log concurrently.
 */
public class LogEntry {
    static final String LEVEL_INFO = "INFO";
    static final String LEVEL_WARN = "WARN";
    static final String LEVEL_ERROR = "ERROR";

    private final String timestamp;
    private final String level;
    private final LogCategory category;
    private final String threadName;
    private final String message;

    public LogEntry(String timestamp, String level, LogCategory category, String threadName, String message) {
        this.timestamp = timestamp;
        this.level = level;
        this.category = category;
        this.threadName = threadName;
        this.message = message;
    }

    public String getTimestamp() { return timestamp; }
    public String getLevel() { return level; }
    public LogCategory getCategory() { return category; }
    public String getThreadName() { return threadName; }
    public String getMessage() { return message; }

    /** WARN and ERROR entries. */
    public boolean isProblem() {
        return LEVEL_WARN.equals(level) || LEVEL_ERROR.equals(level);
    }

    /** {@code <timestamp> [LEVEL] [Category] (thread) message} */
    public String getFormattedMessage() {
        return timestamp + " [" + level + "] [" + category.getDisplayName() + "] (" + threadName + ") " + message;
    }

    @Override
    public String toString() {
        return getFormattedMessage();
    }
}
