package com.example.hookhub.protocol;

/**
 * HTTP methods a relayed request may carry.
 */
public enum HttpVerb {
    GET,
    HEAD,
    POST,
    PUT,
    PATCH,
    DELETE,
    OPTIONS,
    TRACE,
    CONNECT;

    /**
     * Looks up a request-line method token.
     *
     * @param token method as received, case-sensitive
     * @return the verb, or {@code null} for tokens outside this set
     */
    public static HttpVerb fromToken(String token) {
        if (token == null) {
            return null;
        }
        for (HttpVerb verb : values()) {
            if (verb.name().equals(token)) {
                return verb;
            }
        }
        return null;
    }
}
