package com.cornerleague.collector.domain.dto;

import com.cornerleague.collector.domain.enums.FetchOutcome;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

public record FetchResult(
        FetchOutcome outcome,
        String requestedUrl,
        String finalUrl,
        int statusCode,
        byte[] body,
        String contentType,
        Charset charset,
        long elapsedMs,
        long retryAfterMs,
        String error
) {

    public static FetchResult success(String requestedUrl, String finalUrl, int statusCode, byte[] body,
                                      String contentType, Charset charset, long elapsedMs) {
        return new FetchResult(FetchOutcome.SUCCESS, requestedUrl, finalUrl, statusCode, body,
                contentType, charset, elapsedMs, 0L, null);
    }

    public static FetchResult transientFailure(String requestedUrl, int statusCode, long elapsedMs,
                                               long retryAfterMs, String error) {
        return new FetchResult(FetchOutcome.TRANSIENT_FAILURE, requestedUrl, requestedUrl, statusCode, null,
                null, null, elapsedMs, retryAfterMs, error);
    }

    public static FetchResult permanentFailure(String requestedUrl, int statusCode, long elapsedMs, String error) {
        return new FetchResult(FetchOutcome.PERMANENT_FAILURE, requestedUrl, requestedUrl, statusCode, null,
                null, null, elapsedMs, 0L, error);
    }

    public boolean isSuccess() {
        return outcome == FetchOutcome.SUCCESS;
    }

    public String bodyAsString() {
        if (body == null) return null;
        return new String(body, charset != null ? charset : StandardCharsets.UTF_8);
    }
}
