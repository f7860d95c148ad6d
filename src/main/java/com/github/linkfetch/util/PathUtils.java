package com.github.linkfetch.util;

import com.github.linkfetch.exception.ConfigurationException;
import com.github.linkfetch.exception.StorageException;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility class for download file naming and directory preparation.
 */
@Slf4j
@UtilityClass
public class PathUtils {

    /**
     * Take the last '/'-delimited segment of a URL path as the file name.
     *
     * @param urlPath Path component of a URL, e.g. "/images/abc.png"
     * @return File name, or {@link DownloadConstants#DEFAULT_FILENAME} if the path ends in '/'
     */
    public static String fileNameFromUrlPath(String urlPath) {
        if (urlPath == null || urlPath.isEmpty()) {
            return DownloadConstants.DEFAULT_FILENAME;
        }

        String name = urlPath.substring(urlPath.lastIndexOf('/') + 1);
        return name.isEmpty() ? DownloadConstants.DEFAULT_FILENAME : name;
    }

    /**
     * Make sure the directory exists before writing into it.
     *
     * @param directory Destination directory
     * @param create Whether a missing directory may be created
     * @throws ConfigurationException if the path is a regular file, or missing and {@code create} is false
     * @throws StorageException if creating the directory fails
     */
    public static void prepareDirectory(Path directory, boolean create) {
        if (Files.isDirectory(directory)) {
            return;
        }

        if (Files.exists(directory)) {
            throw new ConfigurationException("Download directory exists but is not a directory: " + directory,
                    "directory", directory.toString());
        }

        if (!create) {
            throw new ConfigurationException("Download directory does not exist: " + directory,
                    "linkfetch.download.create-directories", "false");
        }

        try {
            Files.createDirectories(directory);
            log.debug("Created directory structure: {}", directory);
        } catch (IOException e) {
            throw new StorageException("Failed to create directory " + directory, e, directory);
        }
    }
}
