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
import java.util.List;

/**
 * Google Gemini provider (Generative Language REST API).
 * Uses generateContent for text and batchEmbedContents for embeddings.
 */
@Slf4j
public class GeminiProvider extends AbstractWebClientProvider {

    private static final String NAME = "gemini";
    private static final String DEFAULT_API_VERSION = "v1beta";

    private final ObjectMapper objectMapper;
    private final String apiVersion;

    public GeminiProvider(WebClient webClient, RagwardProperties.ProviderConfig config, ObjectMapper objectMapper) {
        super(webClient, config);
        this.objectMapper = objectMapper;
        this.apiVersion = resolveApiVersion(config.getApiVersion());
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
            log.info("Forwarding request to Gemini: model={}, prompt={} chars", config.getDeployment(), prompt.length());

            Mono<String> response = webClient.post()
                    .uri(apiUrl(config.getDeployment(), "generateContent"))
                    .header("x-goog-api-key", config.getApiKey())
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .bodyValue(buildGenerateRequest(prompt, parameters))
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .map(this::extractText);

            return classifyErrors(response);
        }));
    }

    @Override
    public Mono<List<float[]>> invokeEmbedding(List<String> batch) {
        return requireConfigured().then(Mono.defer(() -> {
            String model = config.getEmbeddingDeployment();
            log.info("Forwarding {} texts to Gemini embeddings: model={}", batch.size(), model);

            ObjectNode request = objectMapper.createObjectNode();
            ArrayNode requests = request.putArray("requests");
            for (String text : batch) {
                ObjectNode item = requests.addObject();
                item.put("model", "models/" + model);
                item.putObject("content").putArray("parts").addObject().put("text", text);
                item.put("taskType", "RETRIEVAL_DOCUMENT");
            }

            Mono<List<float[]>> response = webClient.post()
                    .uri(apiUrl(model, "batchEmbedContents"))
                    .header("x-goog-api-key", config.getApiKey())
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .bodyValue(request)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .map(body -> requireSize(extractEmbeddings(body), batch.size()));

            return classifyErrors(response);
        }));
    }

    private String apiUrl(String model, String action) {
        // API key travels in a header, never in the URL.
        return String.format("%s/%s/models/%s:%s",
                stripTrailingSlash(config.getEndpoint()), apiVersion, model, action);
    }

    private JsonNode buildGenerateRequest(String prompt, ModelParameters parameters) {
        ObjectNode request = objectMapper.createObjectNode();
        request.putArray("contents").addObject()
                .put("role", "user")
                .putArray("parts").addObject().put("text", prompt);

        ObjectNode generationConfig = request.putObject("generationConfig");
        generationConfig.put("temperature", parameters.getTemperature());
        generationConfig.put("maxOutputTokens", parameters.getMaxTokens());
        generationConfig.put("topP", parameters.getTopP());
        return request;
    }

    /**
     * Concatenate candidates[0].content.parts[].text.
     */
    private String extractText(JsonNode response) {
        JsonNode parts = response.path("candidates").path(0).path("content").path("parts");
        if (!parts.isArray() || parts.isEmpty()) {
            String blockReason = response.path("promptFeedback").path("blockReason").asText("");
            String finishReason = response.path("candidates").path(0).path("finishReason").asText("unknown");
            throw new PermanentProviderException(NAME, "Gemini returned no content (finishReason=" + finishReason
                    + (blockReason.isEmpty() ? "" : ", blockReason=" + blockReason) + ")");
        }

        StringBuilder text = new StringBuilder();
        for (JsonNode part : parts) {
            text.append(part.path("text").asText(""));
        }
        return text.toString();
    }

    private List<float[]> extractEmbeddings(JsonNode response) {
        JsonNode embeddings = response.path("embeddings");
        if (!embeddings.isArray()) {
            throw new PermanentProviderException(NAME, "Gemini embeddings response has no embeddings array");
        }

        List<float[]> vectors = new ArrayList<>(embeddings.size());
        for (JsonNode embedding : embeddings) {
            vectors.add(toVector(embedding.get("values")));
        }
        return vectors;
    }

    private static String resolveApiVersion(String configured) {
        if (configured != null && configured.matches("v\\d+(beta|alpha)?\\d*")) {
            return configured;
        }
        log.warn("api-version '{}' is not a Gemini API version, using {}", configured, DEFAULT_API_VERSION);
        return DEFAULT_API_VERSION;
    }
}
