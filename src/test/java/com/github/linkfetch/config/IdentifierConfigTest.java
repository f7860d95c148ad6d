package com.github.linkfetch.config;

import com.github.linkfetch.identifier.ResourceIdentifierChain;
import com.github.linkfetch.identifier.gfycat.GfycatFormat;
import com.github.linkfetch.identifier.gfycat.GfycatResourceIdentifier;
import com.github.linkfetch.identifier.imgur.ImgurGifFormat;
import com.github.linkfetch.identifier.imgur.ImgurResourceIdentifier;
import com.github.linkfetch.rest.RestClient;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("IdentifierConfig")
class IdentifierConfigTest {

    private LinkfetchProperties properties;
    private RestClient restClient;

    @BeforeEach
    void setUp() {
        properties = new LinkfetchProperties();
        restClient = new RestClient(new OkHttpClient());
    }

    private ResourceIdentifierChain buildChain() {
        return new IdentifierConfig(properties).resourceIdentifierChain(restClient);
    }

    @Test
    @DisplayName("should skip Imgur without a client ID")
    void shouldSkipImgurWithoutClientId() {
        properties.getImgur().setClientId("  ");

        ResourceIdentifierChain chain = buildChain();

        assertEquals(1, chain.size());
        assertInstanceOf(GfycatResourceIdentifier.class, chain.getIdentifiers().get(0));
        assertEquals(1, chain.resolve("https://imgur.com/a/xyz").size());
    }

    @Test
    @DisplayName("should configure Imgur from properties")
    void shouldConfigureImgur() {
        properties.getImgur().setClientId("abc");
        properties.getImgur().setPreferredFormat(ImgurGifFormat.MP4);
        properties.getImgur().setDownloadMultiple(false);

        ResourceIdentifierChain chain = buildChain();

        ImgurResourceIdentifier imgur = (ImgurResourceIdentifier) chain.getIdentifiers().get(0);
        assertEquals(ImgurGifFormat.MP4, imgur.getPreferredFormat());
        assertFalse(imgur.isDownloadMultiple());
        assertTrue(chain.resolve("https://imgur.com/a/xyz").isEmpty());
    }

    @Test
    @DisplayName("should honour Gfycat settings")
    void shouldHonourGfycatSettings() {
        properties.getGfycat().setPreferredFormat(GfycatFormat.GIF);

        GfycatResourceIdentifier gfycat = (GfycatResourceIdentifier) buildChain().getIdentifiers().get(0);
        assertEquals(GfycatFormat.GIF, gfycat.getPreferredFormat());

        properties.getGfycat().setEnabled(false);
        assertEquals(0, buildChain().size());
    }
}
