package com.github.linkfetch.util;

/**
 * Constants used throughout the download system.
 */
public final class DownloadConstants {

    private DownloadConstants() {
        // Utility class, no instantiation
    }

    // ========== HTTP ==========

    public static final String HEADER_USER_AGENT = "User-Agent";

    public static final String HEADER_CONTENT_TYPE = "Content-Type";

    public static final String HEADER_AUTHORIZATION = "Authorization";

    /**
     * Media type prefix every JSON API response must carry.
     */
    public static final String JSON_MEDIA_TYPE = "application/json";

    // ========== Transfer ==========

    /**
     * Chunk size used when streaming response bodies to disk.
     */
    public static final int DEFAULT_BUFFER_SIZE = 4096;

    /**
     * File name used when the URL path ends in '/'.
     */
    public static final String DEFAULT_FILENAME = "index";

    // ========== Size Units ==========

    public static final long BYTES_PER_KB = 1_000L;

    public static final long BYTES_PER_MB = 1_000_000L;

    public static final long BYTES_PER_GB = 1_000_000_000L;
}
