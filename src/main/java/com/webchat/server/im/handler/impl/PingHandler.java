package com.webchat.server.im.handler.impl;

import com.webchat.server.im.handler.EventHandler;
import com.webchat.server.im.handler.Events;
import com.webchat.server.im.model.UserIdentity;
import com.webchat.server.im.service.MessageSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class PingHandler implements EventHandler<Void> {

    private static final Logger log = LoggerFactory.getLogger(PingHandler.class);

    private final MessageSender messageSender;

    @Autowired
    public PingHandler(MessageSender messageSender) {
        this.messageSender = messageSender;
    }

    @Override
    public String getEvent() {
        return Events.PING;
    }

    @Override
    public Void parse(Map<String, Object> data) {
        return null;
    }

    @Override
    public void handle(UserIdentity sender, Void payload) {
        log.debug("Received ping from user {}, sending pong", sender.getUserId());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("timestamp", Instant.now().toString());
        messageSender.sendToUser(sender.getUserId(), Events.PONG, data);
    }
}
