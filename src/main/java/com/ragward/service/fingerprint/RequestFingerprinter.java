package com.ragward.service.fingerprint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ragward.model.CacheKey;
import com.ragward.model.ModelParameters;
import com.ragward.model.QueryMode;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.TreeMap;

/**
 * Derives stable cache keys from request content.
 *
 * Steps:
 * 1. Collect the semantic inputs into a map with sorted keys
 * 2. Render floating point parameters at a fixed precision
 * 3. Serialize as compact JSON with a private mapper (independent of application settings)
 * 4. SHA-256 hex digest
 *
 * Question text is hashed exactly as it will be sent to the provider. It is not case- or
 * whitespace-folded here, because the provider is sensitive to both.
 */
@Slf4j
@Service
public class RequestFingerprinter {

    private static final int FLOAT_PRECISION = 4;
    private static final String QUERY_NAMESPACE = "query/v1";
    private static final String EMBEDDING_NAMESPACE = "embedding/v1";

    private final ObjectMapper canonicalMapper = new ObjectMapper();

    /**
     * Cache key for a text query.
     *
     * @param mode          selected query mode
     * @param text          question text, already trimmed
     * @param corpusVersion opaque corpus token
     * @param parameters    generation parameters
     * @return SHA-256 key (64 hex chars)
     */
    public CacheKey fingerprint(QueryMode mode, String text, String corpusVersion, ModelParameters parameters) {
        Map<String, Object> canonical = new TreeMap<>();
        canonical.put("ns", QUERY_NAMESPACE);
        canonical.put("mode", mode.wireName());
        canonical.put("text", text);
        canonical.put("corpus_version", corpusVersion != null ? corpusVersion : "");
        canonical.put("parameters", canonicalParameters(parameters));

        return digest(canonical);
    }

    /**
     * Cache key for one embedded text.
     *
     * @param provider   provider name
     * @param model      embedding model or deployment
     * @param dimensions vector dimensionality
     * @param text       text to embed
     * @return SHA-256 key (64 hex chars)
     */
    public CacheKey fingerprintEmbedding(String provider, String model, int dimensions, String text) {
        Map<String, Object> canonical = new TreeMap<>();
        canonical.put("ns", EMBEDDING_NAMESPACE);
        canonical.put("provider", provider);
        canonical.put("model", model != null ? model : "");
        canonical.put("dimensions", dimensions);
        canonical.put("text", text);

        return digest(canonical);
    }

    private Map<String, Object> canonicalParameters(ModelParameters parameters) {
        ModelParameters params = parameters != null ? parameters : ModelParameters.defaults();

        Map<String, Object> canonical = new TreeMap<>();
        canonical.put("max_tokens", params.getMaxTokens());
        canonical.put("temperature", roundFloat(params.getTemperature()));
        canonical.put("top_p", roundFloat(params.getTopP()));
        return canonical;
    }

    /**
     * Fixed-precision decimal string so 0, 0.0 and 0.00001 hash alike.
     */
    private String roundFloat(double value) {
        BigDecimal rounded = BigDecimal.valueOf(value)
                .setScale(FLOAT_PRECISION, RoundingMode.HALF_UP)
                .stripTrailingZeros();
        return rounded.signum() == 0 ? "0" : rounded.toPlainString();
    }

    private CacheKey digest(Map<String, Object> canonical) {
        try {
            String json = canonicalMapper.writeValueAsString(canonical);
            return CacheKey.of(DigestUtils.sha256Hex(json));
        } catch (JsonProcessingException e) {
            // Only strings, numbers and nested maps are ever written here.
            throw new IllegalStateException("Unable to serialize canonical request", e);
        }
    }
}
