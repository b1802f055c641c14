package com.ragward.exception;

import java.time.Duration;

/**
 * Deadline exceeded. The last underlying provider error, if any, is attached as the cause.
 */
public class QueryTimeoutException extends MediationException {

    private static final long serialVersionUID = 1L;

    private final transient Duration maxWait;

    public QueryTimeoutException(Duration maxWait, Throwable lastError) {
        super(ErrorKind.TIMEOUT, buildMessage(maxWait, lastError), lastError);
        this.maxWait = maxWait;
    }

    public Duration getMaxWait() {
        return maxWait;
    }

    private static String buildMessage(Duration maxWait, Throwable lastError) {
        String message = "Query timed out after " + maxWait.toMillis() + "ms";
        if (lastError != null) {
            message += " (last error: " + lastError.getMessage() + ")";
        }
        return message;
    }
}
