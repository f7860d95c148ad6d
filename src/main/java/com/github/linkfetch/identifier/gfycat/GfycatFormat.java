package com.github.linkfetch.identifier.gfycat;

/**
 * Formats every Gfycat item is available in.
 */
public enum GfycatFormat {
    /** MP4 video (video/mp4) */
    MP4,
    /** GIF image (image/gif) */
    GIF,
    /** WebM video (video/webm) */
    WEBM
}
