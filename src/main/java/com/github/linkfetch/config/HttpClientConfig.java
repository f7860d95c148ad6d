package com.github.linkfetch.config;

import com.github.linkfetch.util.DownloadConstants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Dispatcher;
import okhttp3.Interceptor;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class HttpClientConfig {

    private final LinkfetchProperties properties;

    /**
     * The one client every download and API call goes through, so connections are pooled
     * across calls. Asynchronous downloads run on its dispatcher.
     */
    @Bean
    public OkHttpClient okHttpClient() {
        LinkfetchProperties.Client client = properties.getClient();

        Dispatcher dispatcher = new Dispatcher();
        dispatcher.setMaxRequests(client.getMaxRequests());
        dispatcher.setMaxRequestsPerHost(client.getMaxRequestsPerHost());

        log.debug("Creating HTTP client (user agent '{}', {} requests per host)",
                client.getUserAgent(), client.getMaxRequestsPerHost());

        return new OkHttpClient.Builder()
                .dispatcher(dispatcher)
                .connectTimeout(Duration.ofSeconds(client.getTimeoutSeconds()))
                .readTimeout(Duration.ofSeconds(client.getTimeoutSeconds()))
                .writeTimeout(Duration.ofSeconds(client.getTimeoutSeconds()))
                .addInterceptor(new DefaultHeadersInterceptor(defaultHeaders()))
                .followRedirects(true)
                .followSslRedirects(true)
                .build();
    }

    private Map<String, String> defaultHeaders() {
        Map<String, String> headers = new LinkedHashMap<>(properties.getClient().getDefaultHeaders());
        headers.put(DownloadConstants.HEADER_USER_AGENT, properties.getClient().getUserAgent());
        return headers;
    }

    /**
     * Adds the configured default headers to every request. Headers already set on
     * the request are left alone.
     */
    static class DefaultHeadersInterceptor implements Interceptor {

        private final Map<String, String> headers;

        DefaultHeadersInterceptor(Map<String, String> headers) {
            this.headers = Map.copyOf(headers);
        }

        @NotNull
        @Override
        public Response intercept(@NotNull Chain chain) throws IOException {
            Request original = chain.request();
            Request.Builder builder = original.newBuilder();

            headers.forEach((name, value) -> {
                if (original.header(name) == null) {
                    builder.header(name, value);
                }
            });

            return chain.proceed(builder.build());
        }
    }
}
