package com.github.linkfetch.identifier;

/**
 * Implemented by identifiers whose provider offers the same asset in several
 * formats (e.g. GIF, WebM and MP4 versions of one animation).
 *
 * @param <T> Enum of the formats the provider knows
 */
public interface AltDownloadFormats<T extends Enum<T>> {

    /**
     * @return Format picked when a response offers more than one
     */
    T getPreferredFormat();

    void setPreferredFormat(T format);
}
