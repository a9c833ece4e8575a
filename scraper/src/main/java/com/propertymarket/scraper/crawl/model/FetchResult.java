package com.propertymarket.scraper.crawl.model;

import java.time.Duration;
import java.time.Instant;

public record FetchResult(
    FetchRequest request,
    FetchStatus status,
    int httpStatus,
    String body,
    String contentType,
    Instant fetchedAt,
    Duration duration,
    int attempts,
    String errorCode,
    String errorMessage
) {
    public static final String INVALID_URL = "invalid_url";
    public static final String INTERRUPTED = "interrupted";

    public boolean isOk() {
        return status == FetchStatus.OK;
    }

    public boolean hasBody() {
        return body != null && !body.isBlank();
    }

    /**
     * Successful pages and 4xx responses are stable for the rest of a run.
     */
    public boolean isCacheable() {
        if (status == FetchStatus.OK) {
            return true;
        }
        return status == FetchStatus.HTTP_ERROR && httpStatus >= 400 && httpStatus < 500;
    }

    public boolean isRetryable() {
        return switch (status) {
            case OK -> false;
            case TIMEOUT -> true;
            case HTTP_ERROR -> httpStatus >= 500;
            case NETWORK_ERROR -> !INVALID_URL.equals(errorCode) && !INTERRUPTED.equals(errorCode);
        };
    }

    public FetchResult withAttempts(int attemptCount) {
        return new FetchResult(
            request,
            status,
            httpStatus,
            body,
            contentType,
            fetchedAt,
            duration,
            attemptCount,
            errorCode,
            errorMessage
        );
    }
}
