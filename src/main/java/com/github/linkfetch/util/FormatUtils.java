package com.github.linkfetch.util;

import lombok.experimental.UtilityClass;

/**
 * Utility class for formatting sizes and speeds in log output.
 */
@UtilityClass
public class FormatUtils {

    /**
     * Format bytes per second to human-readable speed string.
     *
     * @param bytesPerSecond Speed in bytes per second
     * @return Formatted string like "5.23 MB/s", "128.45 KB/s", or "512 B/s"
     */
    public static String formatSpeed(double bytesPerSecond) {
        return formatSize((long) bytesPerSecond) + "/s";
    }

    /**
     * Format bytes to human-readable size string.
     *
     * @param bytes Size in bytes
     * @return Formatted string like "1.23 GB", "456.78 MB", or "789 B"
     */
    public static String formatSize(long bytes) {
        if (bytes >= DownloadConstants.BYTES_PER_GB) {
            return String.format("%.2f GB", bytes / (double) DownloadConstants.BYTES_PER_GB);
        } else if (bytes >= DownloadConstants.BYTES_PER_MB) {
            return String.format("%.2f MB", bytes / (double) DownloadConstants.BYTES_PER_MB);
        } else if (bytes >= DownloadConstants.BYTES_PER_KB) {
            return String.format("%.2f KB", bytes / (double) DownloadConstants.BYTES_PER_KB);
        } else {
            return String.format("%d B", bytes);
        }
    }
}
