package com.webchat.server.im.auth;

import com.webchat.server.im.exception.InvalidTokenException;
import com.webchat.server.im.model.UserIdentity;

public interface TokenValidator {

    /**
     * Validate an access token and return the identity it was issued to.
     * @throws InvalidTokenException if the token is malformed, badly signed or expired
     */
    UserIdentity validate(String token) throws InvalidTokenException;
}
