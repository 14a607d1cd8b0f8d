package com.webchat.server.im.handler;

/**
 * Event names exchanged with clients.
 */
public final class Events {

    // Inbound
    public static final String SEND_PRIVATE_MESSAGE = "send_private_message";
    public static final String SEND_GROUP_MESSAGE = "send_group_message";
    public static final String USER_TYPING = "user_typing";
    public static final String MESSAGE_READ = "message_read";
    public static final String PING = "ping";
    public static final String PONG = "pong";

    // Outbound
    public static final String PRIVATE_MESSAGE = "private_message";
    public static final String GROUP_MESSAGE = "group_message";
    public static final String MESSAGE_SENT = "message_sent";
    public static final String TYPING = "typing";
    public static final String USER_ONLINE_STATUS = "user_online_status";

    private Events() {
    }
}
