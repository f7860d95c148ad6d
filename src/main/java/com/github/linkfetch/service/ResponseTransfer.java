package com.github.linkfetch.service;

import com.github.linkfetch.config.LinkfetchProperties;
import com.github.linkfetch.exception.ContentTypeException;
import com.github.linkfetch.exception.DownloadException;
import com.github.linkfetch.exception.NetworkException;
import com.github.linkfetch.exception.StorageException;
import com.github.linkfetch.model.DownloadProgress;
import com.github.linkfetch.model.DownloadRequest;
import com.github.linkfetch.util.DownloadConstants;
import com.github.linkfetch.util.FormatUtils;
import com.github.linkfetch.util.PathUtils;
import com.github.linkfetch.util.ProgressCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * Validates a target's HTTP response and streams its body into the request's directory.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResponseTransfer {

    private final LinkfetchProperties properties;

    /**
     * Write the body of a response to disk. The caller owns and closes the response.
     * A file left incomplete by a failure is deleted.
     *
     * @param request Request the target was resolved from
     * @param sourceUrl Target URL, reported in progress updates and errors
     * @param response Response to the target's GET
     * @param progressCallback Notified after every chunk written
     * @return Path of the written file
     * @throws NetworkException if the status is outside [200, 300) or the connection fails mid-body
     * @throws ContentTypeException if the Content-Type is not acceptable
     * @throws com.github.linkfetch.exception.ConfigurationException if the directory is unusable
     * @throws StorageException if the directory or the file cannot be written
     */
    public Path transfer(DownloadRequest request, String sourceUrl, Response response,
                         Consumer<DownloadProgress> progressCallback) {
        if (!response.isSuccessful()) {
            throw new NetworkException(response.code(), sourceUrl);
        }

        String contentType = response.header(DownloadConstants.HEADER_CONTENT_TYPE);
        if (!request.accepts(contentType)) {
            throw new ContentTypeException(contentType, request.getAcceptableContentTypes(), sourceUrl);
        }

        // Redirects may have changed the path, name the file after the final one
        String fileName = PathUtils.fileNameFromUrlPath(response.request().url().encodedPath());
        log.debug("File name detected as '{}'", fileName);

        PathUtils.prepareDirectory(request.getDirectory(), properties.getDownload().isCreateDirectories());
        Path location = request.getDirectory().resolve(fileName);

        ResponseBody body = response.body();
        if (body == null) {
            throw new NetworkException("Response from " + sourceUrl + " has no body", null, sourceUrl);
        }

        long totalBytes = body.contentLength();
        long startTime = System.currentTimeMillis();

        long written;
        try {
            written = copy(body.byteStream(), location, sourceUrl, totalBytes, progressCallback);
        } catch (DownloadException e) {
            deletePartialFile(location);
            throw e;
        }

        Double speed = ProgressCalculator.calculateSpeed(written, System.currentTimeMillis() - startTime);
        log.info("Downloaded file to {} ({}{})", location, FormatUtils.formatSize(written),
                speed != null ? ", " + FormatUtils.formatSpeed(speed) : "");
        return location;
    }

    /**
     * Stream the body into the file. Read failures are network errors, open, write
     * and close failures are storage errors.
     *
     * @return Number of bytes written
     */
    private long copy(InputStream in, Path location, String sourceUrl, long totalBytes,
                      Consumer<DownloadProgress> progressCallback) {
        long written = 0;

        try (OutputStream out = Files.newOutputStream(location)) {
            byte[] buffer = new byte[properties.getDownload().getBufferSize()];
            int len;
            while ((len = read(in, buffer, sourceUrl)) != -1) {
                out.write(buffer, 0, len);
                written += len;

                if (progressCallback != null) {
                    progressCallback.accept(DownloadProgress.builder()
                            .sourceUrl(sourceUrl)
                            .bytesWritten(written)
                            .totalBytes(totalBytes >= 0 ? totalBytes : null)
                            .fraction(ProgressCalculator.calculateFraction(written, totalBytes))
                            .build());
                }
            }
        } catch (IOException e) {
            throw new StorageException("Failed to write " + location + ": " + e.getMessage(), e, location);
        }

        return written;
    }

    private int read(InputStream in, byte[] buffer, String sourceUrl) {
        try {
            return in.read(buffer);
        } catch (IOException e) {
            throw new NetworkException("Connection to " + sourceUrl + " failed while reading the body: "
                    + e.getMessage(), e, sourceUrl);
        }
    }

    private void deletePartialFile(Path location) {
        try {
            if (Files.deleteIfExists(location)) {
                log.debug("Deleted partial file {}", location);
            }
        } catch (IOException e) {
            log.warn("Failed to delete partial file {}: {}", location, e.getMessage());
        }
    }
}
