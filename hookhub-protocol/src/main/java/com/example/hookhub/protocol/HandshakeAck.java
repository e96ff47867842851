package com.example.hookhub.protocol;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Sent by the server once the client is registered; relayed requests only ever follow it.
 */
@Value
@Builder
@Jacksonized
public class HandshakeAck implements TunnelMessage {
    String message;
}
