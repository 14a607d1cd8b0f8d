package com.webchat.server.im.exception;

/**
 * An inbound envelope that does not satisfy the contract of its event.
 */
public class InvalidEnvelopeException extends Exception {

    public InvalidEnvelopeException(String message) {
        super(message);
    }

    public InvalidEnvelopeException(String message, Throwable cause) {
        super(message, cause);
    }
}
