package com.siteready.audit.model;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;

public record HttpFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    String body,
    byte[] bodyBytes,
    String contentType,
    String contentEncoding,
    Instant fetchedAt,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public boolean isOk() {
        return statusCode == 200 && errorCode == null;
    }

    public String finalUrlOrRequested() {
        return finalUri != null ? finalUri.toString() : requestedUrl;
    }

    public String describeFailure() {
        if (errorCode != null) {
            return errorMessage == null || errorMessage.isBlank() ? errorCode : errorCode + ": " + errorMessage;
        }
        return "HTTP " + statusCode;
    }
}
