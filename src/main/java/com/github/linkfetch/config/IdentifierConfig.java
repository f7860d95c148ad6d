package com.github.linkfetch.config;

import com.github.linkfetch.identifier.ResourceIdentifierChain;
import com.github.linkfetch.identifier.gfycat.GfycatResourceIdentifier;
import com.github.linkfetch.identifier.imgur.ImgurResourceIdentifier;
import com.github.linkfetch.rest.RestClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class IdentifierConfig {

    private final LinkfetchProperties properties;

    @Bean
    public ResourceIdentifierChain resourceIdentifierChain(RestClient restClient) {
        ResourceIdentifierChain chain = new ResourceIdentifierChain();

        LinkfetchProperties.Imgur imgur = properties.getImgur();
        if (imgur.isConfigured()) {
            ImgurResourceIdentifier identifier =
                    new ImgurResourceIdentifier(restClient, imgur.getClientId(), imgur.getApiBaseUrl());
            identifier.setPreferredFormat(imgur.getPreferredFormat());
            identifier.setDownloadMultiple(imgur.isDownloadMultiple());
            chain.add(identifier);
        } else {
            log.warn("Imgur client ID not configured. Imgur albums and images will be downloaded as plain URLs.");
            log.info("Set linkfetch.imgur.client-id to enable Imgur resolution.");
        }

        LinkfetchProperties.Gfycat gfycat = properties.getGfycat();
        if (gfycat.isEnabled()) {
            GfycatResourceIdentifier identifier = new GfycatResourceIdentifier(restClient, gfycat.getApiBaseUrl());
            identifier.setPreferredFormat(gfycat.getPreferredFormat());
            chain.add(identifier);
        }

        log.info("Resource identifier chain initialized with {} identifier(s)", chain.size());
        return chain;
    }
}
