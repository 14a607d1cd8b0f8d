package com.webchat.server.im.model;

import lombok.Value;

@Value
public class ReadReceipt {
    long messageId;
}
