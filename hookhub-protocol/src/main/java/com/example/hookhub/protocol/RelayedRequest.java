package com.example.hookhub.protocol;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One inbound webhook call as it travels through the tunnel.
 * <p>
 * Headers keep their arrival order and duplicates. The body is opaque bytes and may be empty.
 */
@Value
public class RelayedRequest implements TunnelMessage {

    HttpVerb method;

    /** Raw path plus {@code ?query} when there is one. */
    String fullPath;

    List<HttpHeader> headers;

    @Getter(AccessLevel.NONE)
    byte[] body;

    @Builder
    @Jacksonized
    private RelayedRequest(HttpVerb method, String fullPath, List<HttpHeader> headers, byte[] body) {
        this.method = method;
        this.fullPath = fullPath;
        this.headers = headers == null ? List.of() : List.copyOf(headers);
        this.body = body == null ? new byte[0] : body.clone();
    }

    /**
     * @return a copy of the body bytes
     */
    public byte[] getBody() {
        return body.clone();
    }

    /**
     * Values of every header named {@code name}, compared case-insensitively, in arrival order.
     */
    public List<String> headerValues(String name) {
        return headers.stream()
                .filter(h -> h.getName().equalsIgnoreCase(name))
                .map(HttpHeader::getValue)
                .collect(Collectors.toList());
    }
}
