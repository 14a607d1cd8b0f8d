package com.webchat.server.im.model;

import lombok.Value;

/**
 * Authenticated identity attached to a socket at upgrade time.
 */
@Value
public class UserIdentity {
    long userId;
    String username;
}
