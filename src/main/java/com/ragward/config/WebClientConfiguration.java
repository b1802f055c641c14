package com.ragward.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * WebClient configuration for HTTP requests to providers.
 *
 * The response timeout matches the per-attempt timeout; the overall deadline is enforced above
 * the client by the timeout supervisor.
 */
@Configuration
public class WebClientConfiguration {

    private static final int MAX_RESPONSE_BYTES = 16 * 1024 * 1024;

    private final RagwardProperties properties;

    public WebClientConfiguration(RagwardProperties properties) {
        this.properties = properties;
    }

    @Bean
    public WebClient providerWebClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(properties.getRetry().getAttemptTimeout());

        // Large embedding batches exceed the default 256 KB buffer
        return builder
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_RESPONSE_BYTES))
                .build();
    }
}
