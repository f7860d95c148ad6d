package com.github.linkfetch.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class DownloadProgress {

    private final String sourceUrl;
    private final long bytesWritten;
    private final Long totalBytes;  // null when the server sent no Content-Length
    private final Double fraction;  // 0.0 - 1.0, null when totalBytes is unknown
}
