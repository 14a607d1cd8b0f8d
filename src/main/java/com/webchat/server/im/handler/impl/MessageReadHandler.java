package com.webchat.server.im.handler.impl;

import com.webchat.server.im.exception.InvalidEnvelopeException;
import com.webchat.server.im.handler.EventHandler;
import com.webchat.server.im.handler.Events;
import com.webchat.server.im.handler.PayloadReader;
import com.webchat.server.im.model.ReadReceipt;
import com.webchat.server.im.model.UserIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Read receipts are only logged. Marking the stored message read and notifying its
 * sender happen through the HTTP API.
 */
@Component
public class MessageReadHandler implements EventHandler<ReadReceipt> {

    private static final Logger log = LoggerFactory.getLogger(MessageReadHandler.class);

    @Override
    public String getEvent() {
        return Events.MESSAGE_READ;
    }

    @Override
    public ReadReceipt parse(Map<String, Object> data) throws InvalidEnvelopeException {
        return new ReadReceipt(PayloadReader.requireLong(data, "message_id"));
    }

    @Override
    public void handle(UserIdentity sender, ReadReceipt receipt) {
        log.info("Message {} marked as read by user {}", receipt.getMessageId(), sender.getUserId());
    }
}
