package com.ragward.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ragward.provider.AbstractWebClientProvider;
import com.ragward.provider.AzureOpenAiProvider;
import com.ragward.provider.GeminiProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Selects the provider variant once at startup.
 */
@Slf4j
@Configuration
public class ProviderConfiguration {

    @Bean
    public AbstractWebClientProvider provider(WebClient providerWebClient,
                                              RagwardProperties properties,
                                              ObjectMapper objectMapper) {
        RagwardProperties.ProviderConfig config = properties.getProvider();

        AbstractWebClientProvider provider = switch (config.getType()) {
            case AZURE_OPENAI -> new AzureOpenAiProvider(providerWebClient, config, objectMapper);
            case GEMINI -> new GeminiProvider(providerWebClient, config, objectMapper);
        };

        if (isBlank(config.getEndpoint()) || isBlank(config.getApiKey())) {
            log.warn("Provider {} is missing endpoint or API key; calls will fail until configured",
                    provider.getName());
        }
        log.info("Configured provider: {} (deployment={}, embeddings={}/{} dims)", provider.getName(),
                config.getDeployment(), provider.getEmbeddingModel(), provider.getDimensions());
        return provider;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
