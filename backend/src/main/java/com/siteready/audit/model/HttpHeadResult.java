package com.siteready.audit.model;

import java.net.http.HttpHeaders;
import java.util.Map;

public record HttpHeadResult(
    String requestedUrl,
    int statusCode,
    HttpHeaders headers,
    String errorCode,
    String errorMessage
) {
    public HttpHeadResult {
        headers = headers == null ? HttpHeaders.of(Map.of(), (name, value) -> true) : headers;
    }

    public boolean isOk() {
        return statusCode == 200 && errorCode == null;
    }

    public String firstHeader(String name) {
        return headers.firstValue(name).orElse(null);
    }

    public String describeFailure() {
        if (errorCode != null) {
            return errorMessage == null || errorMessage.isBlank() ? errorCode : errorCode + ": " + errorMessage;
        }
        return "HTTP " + statusCode;
    }
}
