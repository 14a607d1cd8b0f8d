package com.webchat.server.im.handler;

import com.webchat.server.im.exception.InvalidEnvelopeException;
import com.webchat.server.im.model.UserIdentity;

import java.util.Map;

/**
 * Handles one inbound event. The router validates the payload through {@link #parse}
 * exactly once and hands the typed result to {@link #handle}.
 *
 * @param <T> typed payload of the event
 */
public interface EventHandler<T> {

    /**
     * Get the event name this handler is responsible for
     * @return Event name, e.g. {@code send_private_message}
     */
    String getEvent();

    /**
     * Check the payload contract of the event and convert it to its typed form.
     * @param data Envelope payload, never null
     * @return Typed payload
     * @throws InvalidEnvelopeException if a required key is missing or has the wrong type
     */
    T parse(Map<String, Object> data) throws InvalidEnvelopeException;

    /**
     * Handle the event. Runs on the router thread, one event at a time.
     * @param sender Identity of the connection the event was read from
     * @param payload Typed payload returned by {@link #parse}
     */
    void handle(UserIdentity sender, T payload);
}
