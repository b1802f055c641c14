package com.ragward.resilience;

import com.ragward.exception.MediationException;
import com.ragward.exception.PermanentProviderException;
import com.ragward.exception.RateLimitException;
import com.ragward.exception.TransientProviderException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Maps raw transport failures onto the mediation error taxonomy.
 *
 * Only an explicit throttling signal (HTTP 429, or a quota/resource-exhausted body) becomes a
 * rate-limit error; generic failures never do.
 */
public final class ProviderErrorClassifier {

    private static final int MAX_MESSAGE_LENGTH = 300;

    private ProviderErrorClassifier() {
    }

    public static MediationException classify(String provider, Throwable error) {
        if (error instanceof MediationException mediation) {
            return mediation;
        }

        if (error instanceof WebClientResponseException response) {
            return classifyResponse(provider, response);
        }

        if (error instanceof WebClientRequestException
                || error instanceof IOException
                || error instanceof TimeoutException) {
            return new TransientProviderException(provider, null,
                    provider + " unreachable: " + shortMessage(error), error);
        }

        return new PermanentProviderException(provider, null,
                provider + " call failed: " + shortMessage(error), error);
    }

    private static MediationException classifyResponse(String provider, WebClientResponseException response) {
        int status = response.getStatusCode().value();
        String body = shortText(response.getResponseBodyAsString());
        String detail = provider + " returned HTTP " + status + (body.isEmpty() ? "" : ": " + body);

        if (status == 429 || isQuotaSignal(body)) {
            return new RateLimitException(provider, detail, response);
        }
        if (status == 408 || response.getStatusCode().is5xxServerError()) {
            return new TransientProviderException(provider, status, detail, response);
        }
        // 400 malformed, 401/403 auth, 404 unknown deployment, other 4xx validation.
        return new PermanentProviderException(provider, status, detail, response);
    }

    private static boolean isQuotaSignal(String body) {
        String lower = body.toLowerCase(Locale.ROOT);
        return lower.contains("resource_exhausted") || lower.contains("rate limit") || lower.contains("quota exceeded");
    }

    private static String shortMessage(Throwable error) {
        String message = error.getMessage();
        return message != null ? shortText(message) : error.getClass().getSimpleName();
    }

    private static String shortText(String text) {
        if (text == null) {
            return "";
        }
        String trimmed = text.strip();
        return trimmed.length() > MAX_MESSAGE_LENGTH ? trimmed.substring(0, MAX_MESSAGE_LENGTH) + "..." : trimmed;
    }
}
