package com.github.linkfetch.util;

import lombok.experimental.UtilityClass;

/**
 * Utility class for download progress calculations.
 */
@UtilityClass
public class ProgressCalculator {

    /**
     * Calculate the completed fraction based on bytes.
     *
     * @param bytesWritten Bytes written so far
     * @param totalBytes Expected total, from Content-Length
     * @return Fraction between 0.0 and 1.0, or null if the total is unknown
     */
    public static Double calculateFraction(long bytesWritten, long totalBytes) {
        if (totalBytes <= 0 || bytesWritten < 0) {
            return null;
        }

        if (bytesWritten >= totalBytes) {
            return 1.0;
        }

        return (double) bytesWritten / totalBytes;
    }

    /**
     * Calculate download speed in bytes per second.
     *
     * @param bytesWritten Bytes written so far
     * @param elapsedMillis Time since the transfer started
     * @return Speed in bytes per second, or null if calculation not possible
     */
    public static Double calculateSpeed(long bytesWritten, long elapsedMillis) {
        if (elapsedMillis <= 0 || bytesWritten <= 0) {
            return null;
        }
        return bytesWritten * 1000.0 / elapsedMillis;
    }
}
