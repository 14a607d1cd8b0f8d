package com.webchat.server.im.handler.impl;

import com.webchat.server.im.handler.EventHandler;
import com.webchat.server.im.handler.Events;
import com.webchat.server.im.model.UserIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class PongHandler implements EventHandler<Void> {

    private static final Logger log = LoggerFactory.getLogger(PongHandler.class);

    @Override
    public String getEvent() {
        return Events.PONG;
    }

    @Override
    public Void parse(Map<String, Object> data) {
        return null;
    }

    @Override
    public void handle(UserIdentity sender, Void payload) {
        log.debug("Received pong from user {}", sender.getUserId());
    }
}
