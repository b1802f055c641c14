package com.ragward.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ragward.config.RagwardProperties;
import com.ragward.exception.PermanentProviderException;
import com.ragward.model.ModelParameters;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Azure OpenAI provider.
 * Chat completions and embeddings against deployment-scoped endpoints with an api-version query parameter.
 */
@Slf4j
public class AzureOpenAiProvider extends AbstractWebClientProvider {

    private static final String NAME = "azure-openai";
    private static final String CHAT_PATH = "/openai/deployments/{deployment}/chat/completions?api-version={version}";
    private static final String EMBEDDINGS_PATH = "/openai/deployments/{deployment}/embeddings?api-version={version}";

    private final ObjectMapper objectMapper;

    public AzureOpenAiProvider(WebClient webClient, RagwardProperties.ProviderConfig config, ObjectMapper objectMapper) {
        super(webClient, config);
        this.objectMapper = objectMapper;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getEmbeddingModel() {
        return config.getEmbeddingDeployment();
    }

    @Override
    public Mono<String> invokeText(String prompt, ModelParameters parameters) {
        return requireConfigured().then(Mono.defer(() -> {
            log.info("Forwarding request to Azure OpenAI: deployment={}, prompt={} chars",
                    config.getDeployment(), prompt.length());

            Mono<String> response = webClient.post()
                    .uri(stripTrailingSlash(config.getEndpoint()) + CHAT_PATH,
                            config.getDeployment(), config.getApiVersion())
                    .header("api-key", config.getApiKey())
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .bodyValue(buildChatRequest(prompt, parameters))
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .map(this::extractContent);

            return classifyErrors(response);
        }));
    }

    @Override
    public Mono<List<float[]>> invokeEmbedding(List<String> batch) {
        return requireConfigured().then(Mono.defer(() -> {
            log.info("Forwarding {} texts to Azure OpenAI embeddings: deployment={}",
                    batch.size(), config.getEmbeddingDeployment());

            ObjectNode request = objectMapper.createObjectNode();
            ArrayNode input = request.putArray("input");
            batch.forEach(input::add);

            Mono<List<float[]>> response = webClient.post()
                    .uri(stripTrailingSlash(config.getEndpoint()) + EMBEDDINGS_PATH,
                            config.getEmbeddingDeployment(), config.getEmbeddingApiVersion())
                    .header("api-key", config.getApiKey())
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .bodyValue(request)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .map(body -> requireSize(extractEmbeddings(body), batch.size()));

            return classifyErrors(response);
        }));
    }

    /**
     * Build chat completions request body.
     */
    private JsonNode buildChatRequest(String prompt, ModelParameters parameters) {
        ObjectNode request = objectMapper.createObjectNode();

        ArrayNode messages = request.putArray("messages");
        ObjectNode user = messages.addObject();
        user.put("role", "user");
        user.put("content", prompt);

        request.put("temperature", parameters.getTemperature());
        request.put("max_tokens", parameters.getMaxTokens());
        request.put("top_p", parameters.getTopP());
        return request;
    }

    /**
     * Extract assistant text from choices[0].message.content.
     */
    private String extractContent(JsonNode response) {
        JsonNode content = response.path("choices").path(0).path("message").path("content");
        if (content.isMissingNode() || content.isNull()) {
            String finishReason = response.path("choices").path(0).path("finish_reason").asText("unknown");
            throw new PermanentProviderException(NAME,
                    "Azure OpenAI returned no content (finish_reason=" + finishReason + ")");
        }
        return content.asText();
    }

    /**
     * Extract data[].embedding ordered by index.
     */
    private List<float[]> extractEmbeddings(JsonNode response) {
        JsonNode data = response.path("data");
        if (!data.isArray()) {
            throw new PermanentProviderException(NAME, "Azure OpenAI embeddings response has no data array");
        }

        List<JsonNode> items = new ArrayList<>();
        data.forEach(items::add);
        items.sort(Comparator.comparingInt(item -> item.path("index").asInt()));

        List<float[]> vectors = new ArrayList<>(items.size());
        for (JsonNode item : items) {
            vectors.add(toVector(item.get("embedding")));
        }
        return vectors;
    }
}
