package com.github.linkfetch.config;

import com.github.linkfetch.identifier.gfycat.GfycatFormat;
import com.github.linkfetch.identifier.imgur.ImgurGifFormat;
import com.github.linkfetch.util.DownloadConstants;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "linkfetch")
public class LinkfetchProperties {

    private Client client = new Client();
    private Download download = new Download();
    private Imgur imgur = new Imgur();
    private Gfycat gfycat = new Gfycat();

    @Data
    public static class Client {
        @NotBlank
        private String userAgent = "linkfetch/1.0";

        /**
         * Extra headers sent with every request, in addition to the User-Agent.
         */
        private Map<String, String> defaultHeaders = new LinkedHashMap<>();

        @Min(1)
        private int timeoutSeconds = 30;

        @Min(1)
        private int maxRequests = 64;

        @Min(1)
        private int maxRequestsPerHost = 5;
    }

    @Data
    public static class Download {
        private boolean createDirectories = true;

        @Min(512)
        private int bufferSize = DownloadConstants.DEFAULT_BUFFER_SIZE;

        /**
         * Content-Type prefixes accepted when a caller passes none. Empty accepts anything.
         */
        private Set<String> acceptableContentTypes = new LinkedHashSet<>();
    }

    @Data
    public static class Imgur {
        private String clientId;

        @NotBlank
        private String apiBaseUrl = "https://api.imgur.com/3";

        @NotNull
        private ImgurGifFormat preferredFormat = ImgurGifFormat.GIF;

        private boolean downloadMultiple = true;

        public boolean isConfigured() {
            return clientId != null && !clientId.isBlank();
        }
    }

    @Data
    public static class Gfycat {
        private boolean enabled = true;

        @NotBlank
        private String apiBaseUrl = "https://gfycat.com";

        @NotNull
        private GfycatFormat preferredFormat = GfycatFormat.WEBM;
    }
}
