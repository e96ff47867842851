package com.example.hookhub.agent.history;

import com.example.hookhub.protocol.HttpHeader;
import com.example.hookhub.protocol.HttpVerb;
import com.example.hookhub.protocol.RelayedRequest;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * A request the agent received, as stored on disk.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HistoryItem {

    // taken from the file name, not stored in it
    private transient String id;

    private String receivedAt;
    private String local;
    private String method;
    private String fullPath;
    private List<HttpHeader> headers;
    private String body; // base64

    public static HistoryItem of(RelayedRequest request, Instant receivedAt, URI local) {
        return HistoryItem.builder()
                .receivedAt(receivedAt.toString())
                .local(local.toString())
                .method(request.getMethod().name())
                .fullPath(request.getFullPath())
                .headers(new ArrayList<>(request.getHeaders()))
                .body(Base64.getEncoder().encodeToString(request.getBody()))
                .build();
    }

    /**
     * Rebuilds the relayed request.
     *
     * @throws IllegalStateException if the stored method is unknown
     */
    public RelayedRequest toRequest() {
        HttpVerb verb = HttpVerb.fromToken(method);
        if (verb == null) {
            throw new IllegalStateException("History item " + id + " has unknown method " + method);
        }
        return RelayedRequest.builder()
                .method(verb)
                .fullPath(fullPath)
                .headers(headers)
                .body(body == null ? new byte[0] : Base64.getDecoder().decode(body))
                .build();
    }

    public Instant receivedAtInstant() {
        return receivedAt == null ? Instant.EPOCH : Instant.parse(receivedAt);
    }
}
