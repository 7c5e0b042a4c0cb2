package com.unhuman.iconforge.util;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Process-wide log sink for the icon pipeline.
 * Echoes every entry to the console and keeps a bounded buffer of recent entries,
 * so the problems of a batch run can be recapped once it finishes.
 */
public class LogManager {
    private static LogManager instance;
    private static final int MAX_LOG_LINES = 2000;
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");
    private final ConcurrentLinkedDeque<LogEntry> logBuffer = new ConcurrentLinkedDeque<>();

    private LogManager() {}

    public static synchronized LogManager getInstance() {
        if (instance == null) {
            instance = new LogManager();
        }
        return instance;
    }

    public void info(LogCategory category, String message) {
        log(LogEntry.LEVEL_INFO, message, category);
    }

    public void warn(LogCategory category, String message) {
        log(LogEntry.LEVEL_WARN, message, category);
    }

    public void error(LogCategory category, String message) {
        log(LogEntry.LEVEL_ERROR, message, category);
    }

    public void error(LogCategory category, String message, Throwable e) {
        StringBuilder sb = new StringBuilder(message);
        sb.append(": ").append(e.getMessage());
        StringWriter sw = new StringWriter();
        PrintWriter pw = new PrintWriter(sw);
        e.printStackTrace(pw);
        sb.append("\n").append(sw.toString());
        log(LogEntry.LEVEL_ERROR, sb.toString(), category);
    }

    private static final ThreadLocal<Boolean> isLogging = ThreadLocal.withInitial(() -> Boolean.FALSE);

    private void log(String level, String message, LogCategory category) {
        if (Boolean.TRUE.equals(isLogging.get())) {
            return;
        }
        isLogging.set(Boolean.TRUE);
        try {
            String timestamp = DATE_FORMAT.format(LocalDateTime.now());
            LogEntry entry = new LogEntry(timestamp, level, category,
                Thread.currentThread().getName(), message);

            if (LogEntry.LEVEL_ERROR.equals(level)) {
                System.err.println(entry.getFormattedMessage());
            } else {
                System.out.println(entry.getFormattedMessage());
            }

            addToBuffer(entry);
        } finally {
            isLogging.set(Boolean.FALSE);
        }
    }

    // Batch workers log from several threads at once
    private synchronized void addToBuffer(LogEntry entry) {
        logBuffer.add(entry);
        while (logBuffer.size() > MAX_LOG_LINES) {
            logBuffer.removeFirst();
        }
    }

    /** Snapshot of the buffered entries, oldest first. */
    public List<LogEntry> getEntries() {
        return new ArrayList<>(logBuffer);
    }

    /** Buffered WARN and ERROR entries, oldest first. */
    public List<LogEntry> getProblems() {
        List<LogEntry> problems = new ArrayList<>();
        for (LogEntry entry : logBuffer) {
            if (entry.isProblem()) {
                problems.add(entry);
            }
        }
        return problems;
    }

    public void clearLogs() {
        logBuffer.clear();
    }
}
