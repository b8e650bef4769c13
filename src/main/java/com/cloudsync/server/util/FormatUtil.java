package com.cloudsync.server.util;

import java.util.Locale;

public class FormatUtil {

    private static final long KB = 1024L;

    private static final long MB = KB * 1024;

    private static final long GB = MB * 1024;

    /**
     * Compact human duration. {@code 45s}, {@code 3m 20s} under an hour, {@code 2h 5m} beyond.
     */
    public static String formatDuration(long seconds) {
        if (seconds < 0) {
            seconds = 0;
        }
        if (seconds < 60) {
            return "%ds".formatted(seconds);
        }
        long minutes = seconds / 60;
        long secs = seconds % 60;
        if (minutes < 60) {
            return "%dm %ds".formatted(minutes, secs);
        }
        long hours = minutes / 60;
        return "%dh %dm".formatted(hours, minutes % 60);
    }

    public static String formatBytes(long bytes) {
        if (bytes < KB) {
            return "%d B".formatted(bytes);
        }
        if (bytes < MB) {
            return String.format(Locale.ROOT, "%.1f KB", bytes / (double) KB);
        }
        if (bytes < GB) {
            return String.format(Locale.ROOT, "%.1f MB", bytes / (double) MB);
        }
        return String.format(Locale.ROOT, "%.2f GB", bytes / (double) GB);
    }
}
