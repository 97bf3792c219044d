package com.statejobs.harvester.crawl.model;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;

public record HttpFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    String body,
    String contentType,
    Instant fetchedAt,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public enum FailureKind {
        TRANSIENT,
        PERMANENT
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public String finalUrlOrRequested() {
        return finalUri != null ? finalUri.toString() : requestedUrl;
    }

    /**
     * Classifies a failed fetch. Returns {@code null} for a successful one.
     */
    public FailureKind failureKind() {
        if (isSuccessful()) {
            return null;
        }
        if (errorCode != null) {
            return switch (errorCode) {
                case "timeout", "io_error", "http_error" -> FailureKind.TRANSIENT;
                default -> FailureKind.PERMANENT;
            };
        }
        if (statusCode == 408 || statusCode == 429 || statusCode >= 500) {
            return FailureKind.TRANSIENT;
        }
        return FailureKind.PERMANENT;
    }
}
