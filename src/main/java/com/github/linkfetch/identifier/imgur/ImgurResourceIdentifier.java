package com.github.linkfetch.identifier.imgur;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.linkfetch.exception.ApiException;
import com.github.linkfetch.identifier.AltDownloadFormats;
import com.github.linkfetch.identifier.RegexResourceIdentifier;
import com.github.linkfetch.identifier.RegexTable;
import com.github.linkfetch.rest.ApiConsumer;
import com.github.linkfetch.rest.RestClient;
import com.github.linkfetch.util.DownloadConstants;
import com.github.linkfetch.util.RegexUtils;
import lombok.Getter;
import lombok.NonNull;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Uses the Imgur API to find the files behind albums ({@code /a/...}), gallery
 * posts ({@code /gallery/...}) and image pages ({@code /...}). Animated images
 * come in several versions; which one is downloaded is chosen with
 * {@link #setPreferredFormat(ImgurGifFormat)}.
 */
@Slf4j
public class ImgurResourceIdentifier extends RegexResourceIdentifier
        implements AltDownloadFormats<ImgurGifFormat>, ApiConsumer {

    public static final String KIND_ALBUM = "album";
    public static final String KIND_GALLERY = "gallery";
    public static final String KIND_IMAGE = "image";

    public static final String DEFAULT_API_BASE_URL = "https://api.imgur.com/3";

    private static final String PROVIDER = "Imgur";
    private static final String LINK_FIELD = "link";

    @Getter
    private final RestClient restClient;
    private final String apiBaseUrl;
    private final Map<String, String> headers;

    @Getter
    @Setter
    @NonNull
    private volatile ImgurGifFormat preferredFormat = ImgurGifFormat.GIF;

    /**
     * Whether albums and galleries are expanded. When false they resolve to no
     * targets at all; single images are unaffected.
     */
    @Getter
    @Setter
    private volatile boolean downloadMultiple = true;

    public ImgurResourceIdentifier(RestClient restClient, String clientId) {
        this(restClient, clientId, DEFAULT_API_BASE_URL);
    }

    public ImgurResourceIdentifier(RestClient restClient, @NonNull String clientId, @NonNull String apiBaseUrl) {
        // Album before image: "/a" must not be taken for an image id
        super(new RegexTable()
                .add(RegexUtils.ofUrlGlob("imgur.com", "/a/*"), KIND_ALBUM)
                .add(RegexUtils.ofUrlGlob("imgur.com", "/gallery/*"), KIND_GALLERY)
                .add(RegexUtils.ofUrl("imgur\\.com", "/([a-zA-Z0-9]{6,})"), KIND_IMAGE));
        this.restClient = restClient;
        this.apiBaseUrl = apiBaseUrl.endsWith("/") ? apiBaseUrl.substring(0, apiBaseUrl.length() - 1) : apiBaseUrl;
        this.headers = Map.of(DownloadConstants.HEADER_AUTHORIZATION, "Client-ID " + clientId);
    }

    @Override
    protected Set<String> expand(String url, RegexTable.Match match) {
        String id = stripQuery(match.group(1));

        switch (match.getResourceKind()) {
            case KIND_ALBUM: {
                if (!downloadMultiple) {
                    log.debug("Skipping album {}, multiple downloads disabled", id);
                    return Collections.emptySet();
                }
                String apiUrl = apiBaseUrl + "/album/" + id + "/images";
                JsonNode root = restClient.get(apiUrl, headers).getJson();
                checkForError(root, apiUrl);
                return parseLinks(root.path("data"), apiUrl);
            }
            case KIND_GALLERY: {
                if (!downloadMultiple) {
                    log.debug("Skipping gallery {}, multiple downloads disabled", id);
                    return Collections.emptySet();
                }
                String apiUrl = apiBaseUrl + "/gallery/album/" + id;
                JsonNode root = restClient.get(apiUrl, headers).getJson();
                checkForError(root, apiUrl);
                return parseLinks(root.path("data").path("images"), apiUrl);
            }
            case KIND_IMAGE: {
                String apiUrl = apiBaseUrl + "/image/" + id;
                JsonNode root = restClient.get(apiUrl, headers).getJson();
                checkForError(root, apiUrl);
                Set<String> links = new LinkedHashSet<>();
                links.add(selectLink(root.path("data"), apiUrl));
                return links;
            }
            default:
                throw new IllegalStateException("Unknown resource kind: " + match.getResourceKind());
        }
    }

    private Set<String> parseLinks(JsonNode items, String apiUrl) {
        if (!items.isArray()) {
            throw new ApiException("Imgur API response has no list of images", PROVIDER, apiUrl);
        }

        Set<String> links = new LinkedHashSet<>();
        for (JsonNode item : items) {
            links.add(selectLink(item, apiUrl));
        }
        return links;
    }

    private String selectLink(JsonNode item, String apiUrl) {
        String field = item.has(preferredFormat.getJsonName()) ? preferredFormat.getJsonName() : LINK_FIELD;
        JsonNode link = item.get(field);
        if (link == null || !link.isTextual()) {
            throw new ApiException("Imgur API response has no '" + field + "' field", PROVIDER, apiUrl);
        }
        return link.asText();
    }

    @Override
    public void checkForError(JsonNode root, String url) {
        JsonNode success = root.get("success");
        if (success != null && !success.asBoolean(false)) {
            JsonNode error = root.path("data").path("error");
            String message = error.isTextual() ? error.asText() : error.toString();
            throw new ApiException("Imgur API returned an error: " + message, PROVIDER, url);
        }
    }
}
