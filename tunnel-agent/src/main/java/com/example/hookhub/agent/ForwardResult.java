package com.example.hookhub.agent;

import lombok.Builder;
import lombok.Getter;

/**
 * Outcome of one request sent to the local server. Only ever logged.
 */
@Getter
@Builder
public class ForwardResult {
    private final boolean success;
    @Builder.Default
    private final int statusCode = -1;
    private final long elapsedMillis;
    private final String error;

    @Override
    public String toString() {
        return success ? "HTTP " + statusCode + " in " + elapsedMillis + "ms" : "FAILED: " + error;
    }
}
