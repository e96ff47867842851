package com.example.hookhub.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.cbor.databind.CBORMapper;

import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * Encodes tunnel frames as CBOR.
 * <p>
 * CBOR byte strings carry their own length, so request bodies pass through byte-for-byte.
 * Instances are stateless and thread-safe.
 */
public class TunnelMessageCodec {

    private final ObjectWriter writer;
    private final ObjectReader reader;

    public TunnelMessageCodec() {
        ObjectMapper mapper = CBORMapper.builder()
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
        this.writer = mapper.writerFor(TunnelMessage.class);
        this.reader = mapper.readerFor(TunnelMessage.class);
    }

    public byte[] encode(TunnelMessage message) {
        try {
            return writer.writeValueAsBytes(message);
        } catch (JsonProcessingException e) {
            // only reachable for a message type missing from TunnelMessage's subtype list
            throw new IllegalStateException("Unable to encode " + message.getClass().getSimpleName(), e);
        }
    }

    public TunnelMessage decode(byte[] frame) throws DecodeException {
        if (frame == null || frame.length == 0) {
            throw new DecodeException("Empty frame");
        }

        TunnelMessage message;
        try {
            message = reader.readValue(frame);
        } catch (IOException e) {
            throw new DecodeException("Malformed frame: " + e.getMessage(), e);
        }

        if (message == null) {
            throw new DecodeException("Frame holds no message");
        }
        validate(message);
        return message;
    }

    public TunnelMessage decode(ByteBuffer frame) throws DecodeException {
        ByteBuffer copy = frame.duplicate();
        byte[] bytes = new byte[copy.remaining()];
        copy.get(bytes);
        return decode(bytes);
    }

    /**
     * Decodes a frame that must be a relayed request.
     */
    public RelayedRequest decodeRequest(byte[] frame) throws DecodeException {
        TunnelMessage message = decode(frame);
        if (!(message instanceof RelayedRequest)) {
            throw new DecodeException("Expected REQUEST but got " + message.getClass().getSimpleName());
        }
        return (RelayedRequest) message;
    }

    private void validate(TunnelMessage message) throws DecodeException {
        if (message instanceof Handshake) {
            if (((Handshake) message).getSecret() == null) {
                throw new DecodeException("HANDSHAKE without secret");
            }
        } else if (message instanceof RelayedRequest) {
            RelayedRequest request = (RelayedRequest) message;
            if (request.getMethod() == null) {
                throw new DecodeException("REQUEST without method");
            }
            if (request.getFullPath() == null || !request.getFullPath().startsWith("/")) {
                throw new DecodeException("REQUEST path must start with '/': " + request.getFullPath());
            }
            for (HttpHeader header : request.getHeaders()) {
                if (header.getName() == null || header.getName().isEmpty() || header.getValue() == null) {
                    throw new DecodeException("REQUEST carries an incomplete header");
                }
            }
        }
    }
}
