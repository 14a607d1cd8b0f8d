package com.webchat.server.im.cluster;

import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Random id of this process, used to tag relayed envelopes and cluster keys.
 */
@Component
public class InstanceIdentity {

    private final String instanceId;

    public InstanceIdentity() {
        this(UUID.randomUUID().toString());
    }

    public InstanceIdentity(String instanceId) {
        this.instanceId = instanceId;
    }

    public String getInstanceId() {
        return instanceId;
    }
}
