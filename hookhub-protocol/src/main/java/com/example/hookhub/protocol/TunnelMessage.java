package com.example.hookhub.protocol;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One frame on the tunnel. Concrete types are told apart by the {@code type} property.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Handshake.class, name = "HANDSHAKE"),
        @JsonSubTypes.Type(value = HandshakeAck.class, name = "HANDSHAKE_ACK"),
        @JsonSubTypes.Type(value = HandshakeReject.class, name = "HANDSHAKE_REJECT"),
        @JsonSubTypes.Type(value = RelayedRequest.class, name = "REQUEST")
})
public interface TunnelMessage {
}
