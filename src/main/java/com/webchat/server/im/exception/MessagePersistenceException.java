package com.webchat.server.im.exception;

public class MessagePersistenceException extends Exception {

    public MessagePersistenceException(String message) {
        super(message);
    }

    public MessagePersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
