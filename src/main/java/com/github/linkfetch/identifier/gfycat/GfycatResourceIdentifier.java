package com.github.linkfetch.identifier.gfycat;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.linkfetch.exception.ApiException;
import com.github.linkfetch.identifier.AltDownloadFormats;
import com.github.linkfetch.identifier.RegexTable;
import com.github.linkfetch.identifier.SimpleRegexResourceIdentifier;
import com.github.linkfetch.rest.ApiConsumer;
import com.github.linkfetch.rest.RestClient;
import com.github.linkfetch.util.RegexUtils;
import lombok.Getter;
import lombok.NonNull;
import lombok.Setter;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Intercepts any URL on gfycat.com and downloads the video or image shown on that page.
 */
public class GfycatResourceIdentifier extends SimpleRegexResourceIdentifier
        implements AltDownloadFormats<GfycatFormat>, ApiConsumer {

    public static final String DEFAULT_API_BASE_URL = "https://gfycat.com";

    private static final String PROVIDER = "Gfycat";

    @Getter
    private final RestClient restClient;
    private final String apiBaseUrl;

    @Getter
    @Setter
    @NonNull
    private volatile GfycatFormat preferredFormat = GfycatFormat.WEBM;

    public GfycatResourceIdentifier(RestClient restClient) {
        this(restClient, DEFAULT_API_BASE_URL);
    }

    public GfycatResourceIdentifier(RestClient restClient, @NonNull String apiBaseUrl) {
        super(RegexUtils.ofUrlGlob("gfycat.com", "/*"));
        this.restClient = restClient;
        this.apiBaseUrl = apiBaseUrl.endsWith("/") ? apiBaseUrl.substring(0, apiBaseUrl.length() - 1) : apiBaseUrl;
    }

    @Override
    protected Set<String> expand(String url, RegexTable.Match match) {
        String id = stripQuery(match.group(1));
        String apiUrl = apiBaseUrl + "/cajax/get/" + id;

        JsonNode root = restClient.get(apiUrl).getJson();
        checkForError(root, apiUrl);

        String field = preferredFormat.name().toLowerCase(Locale.ROOT) + "Url";
        JsonNode link = root.path("gfyItem").get(field);
        if (link == null || !link.isTextual()) {
            throw new ApiException("Gfycat API response has no '" + field + "' field", PROVIDER, apiUrl);
        }

        Set<String> links = new LinkedHashSet<>();
        links.add(link.asText());
        return links;
    }

    @Override
    public void checkForError(JsonNode root, String url) {
        if (root.has("error")) {
            JsonNode error = root.get("error");
            String message = error.isTextual() ? error.asText() : error.toString();
            throw new ApiException("Gfycat API returned an error: " + message, PROVIDER, url);
        }
    }
}
