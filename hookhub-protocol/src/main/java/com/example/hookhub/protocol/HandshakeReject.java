package com.example.hookhub.protocol;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Sent by the server right before it closes an unauthenticated connection.
 */
@Value
@Builder
@Jacksonized
public class HandshakeReject implements TunnelMessage {
    String reason;
}
