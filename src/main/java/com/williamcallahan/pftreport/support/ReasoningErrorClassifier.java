package com.williamcallahan.pftreport.support;

import com.openai.errors.OpenAIIoException;
import com.openai.errors.OpenAIServiceException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.Locale;

/**
 * Classifies reasoning-provider errors so only transient failures are retried.
 */
public final class ReasoningErrorClassifier {
    private static final int HTTP_REQUEST_TIMEOUT = 408;
    private static final int HTTP_CONFLICT = 409;
    private static final int HTTP_TOO_MANY_REQUESTS = 429;
    private static final int HTTP_INTERNAL_SERVER_ERROR = 500;

    private ReasoningErrorClassifier() {}

    /**
     * Determine a stable error category based on exception messages and causes.
     *
     * @param error failure raised by the provider call
     * @return normalized error category label
     */
    public static String determineErrorType(Throwable error) {
        StringBuilder messageBuilder = new StringBuilder();
        Throwable current = error;
        while (current != null) {
            String currentMessage = current.getMessage();
            if (currentMessage != null && !currentMessage.isBlank()) {
                if (messageBuilder.length() > 0) {
                    messageBuilder.append(' ');
                }
                messageBuilder.append(currentMessage);
            }
            current = current.getCause();
        }

        String message = messageBuilder.toString().toLowerCase(Locale.ROOT);

        if (message.contains("401") || message.contains("unauthorized")) {
            return "401 Unauthorized";
        } else if (message.contains("403") || message.contains("forbidden")) {
            return "403 Forbidden";
        } else if (message.contains("404") || message.contains("not found")) {
            return "404 Not Found";
        } else if (message.contains("429") || message.contains("too many requests")) {
            return "429 Rate Limited";
        } else if (message.contains("connection") || message.contains("timeout") || message.contains("timed out")) {
            return "Connection Error";
        }
        return "Unknown Error";
    }

    /**
     * Determines whether a failed provider call is worth repeating.
     *
     * <p>I/O failures, rate limits, request timeouts and 5xx responses are transient. Authentication,
     * validation and unparseable responses are not.</p>
     *
     * @param error the exception to classify
     * @return true if the error is transient
     */
    public static boolean isTransient(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof OpenAIIoException
                    || current instanceof ConnectException
                    || current instanceof SocketTimeoutException) {
                return true;
            }
            if (current instanceof OpenAIServiceException serviceException) {
                int statusCode = serviceException.statusCode();
                return statusCode == HTTP_REQUEST_TIMEOUT
                        || statusCode == HTTP_CONFLICT
                        || statusCode == HTTP_TOO_MANY_REQUESTS
                        || statusCode >= HTTP_INTERNAL_SERVER_ERROR;
            }
            current = current.getCause();
        }
        String errorType = determineErrorType(error);
        return "Connection Error".equals(errorType) || "429 Rate Limited".equals(errorType);
    }
}
