package com.example.hookhub.protocol;

/**
 * A frame did not match the tunnel message layout.
 */
public class DecodeException extends Exception {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
