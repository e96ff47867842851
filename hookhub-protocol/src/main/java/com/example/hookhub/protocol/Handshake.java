package com.example.hookhub.protocol;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * First frame a client sends after the transport is up.
 */
@Value
@Builder
@Jacksonized
public class Handshake implements TunnelMessage {

    @ToString.Exclude
    String secret;

    @Builder.Default
    int protocolVersion = TunnelProtocol.PROTOCOL_VERSION;
}
