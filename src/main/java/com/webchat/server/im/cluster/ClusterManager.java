package com.webchat.server.im.cluster;

import com.webchat.server.im.presence.PresenceKeys;
import com.webchat.server.im.service.MessageSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Keeps this instance's heartbeat alive and clears presence left behind by instances that
 * stopped without unregistering their users.
 * <p>
 * Every instance runs the sweep; the operations are idempotent, so overlapping sweeps
 * at worst publish the same offline notification twice.
 */
@Component
@ConditionalOnProperty(name = "chat.presence.store", havingValue = "redis", matchIfMissing = true)
public class ClusterManager {

    private static final Logger log = LoggerFactory.getLogger(ClusterManager.class);

    private final StringRedisTemplate redisTemplate;
    private final MessageSender messageSender;
    private final String instanceId;
    private final Duration heartbeatTtl;

    public ClusterManager(StringRedisTemplate redisTemplate,
                          MessageSender messageSender,
                          InstanceIdentity instanceIdentity,
                          @Value("${chat.cluster.heartbeat-ttl:10s}") Duration heartbeatTtl) {
        this.redisTemplate = redisTemplate;
        this.messageSender = messageSender;
        this.instanceId = instanceIdentity.getInstanceId();
        this.heartbeatTtl = heartbeatTtl;
    }

    @PostConstruct
    public void init() {
        log.info("Cluster Manager started. Instance ID: {}", instanceId);
        sendHeartbeat();
    }

    @PreDestroy
    public void shutdown() {
        // Let other instances see this one as gone right away instead of after the TTL
        try {
            redisTemplate.delete(ClusterKeys.heartbeat(instanceId));
        } catch (RuntimeException e) {
            log.warn("Failed to remove heartbeat of instance {}", instanceId, e);
        }
    }

    @Scheduled(fixedRate = 5000)
    public void sendHeartbeat() {
        try {
            redisTemplate.opsForValue().set(ClusterKeys.heartbeat(instanceId),
                    String.valueOf(System.currentTimeMillis()), heartbeatTtl);
        } catch (RuntimeException e) {
            log.error("Failed to refresh heartbeat of instance {}", instanceId, e);
        }
    }

    @Scheduled(fixedRate = 10000)
    public void checkDeadInstances() {
        try {
            Set<String> instanceKeys = redisTemplate.keys(ClusterKeys.INSTANCE_SESSIONS_PREFIX + "*");
            if (instanceKeys == null || instanceKeys.isEmpty()) {
                return;
            }

            List<String> liveKeys = new ArrayList<>();
            List<String> deadKeys = new ArrayList<>();
            for (String key : instanceKeys) {
                String otherId = key.substring(ClusterKeys.INSTANCE_SESSIONS_PREFIX.length());
                if (otherId.equals(instanceId) || Boolean.TRUE.equals(redisTemplate.hasKey(ClusterKeys.heartbeat(otherId)))) {
                    liveKeys.add(key);
                } else {
                    deadKeys.add(key);
                }
            }

            for (String key : deadKeys) {
                String deadInstanceId = key.substring(ClusterKeys.INSTANCE_SESSIONS_PREFIX.length());
                log.warn("Detected DEAD instance: {}. Starting session cleanup...", deadInstanceId);
                cleanUpDeadInstance(deadInstanceId, key, liveKeys);
            }
        } catch (RuntimeException e) {
            log.error("Error checking dead instances", e);
        }
    }

    private void cleanUpDeadInstance(String deadInstanceId, String sessionSetKey, List<String> liveKeys) {
        Set<String> members = redisTemplate.opsForSet().members(sessionSetKey);
        if (members != null) {
            for (String member : members) {
                long userId;
                try {
                    userId = Long.parseLong(member);
                } catch (NumberFormatException e) {
                    log.warn("Skipping malformed session entry {} of instance {}", member, deadInstanceId);
                    continue;
                }
                if (isHeldByLiveInstance(member, liveKeys)) {
                    // The user reconnected elsewhere before the sweep ran
                    continue;
                }
                redisTemplate.delete(PresenceKeys.onlineKey(userId));
                messageSender.publishPresence(userId, false);
                log.info("Cleared stale presence of user {} left by instance {}", userId, deadInstanceId);
            }
        }

        redisTemplate.delete(sessionSetKey);
        log.info("Completed cleanup for dead instance {}", deadInstanceId);
    }

    private boolean isHeldByLiveInstance(String member, List<String> liveKeys) {
        for (String liveKey : liveKeys) {
            if (Boolean.TRUE.equals(redisTemplate.opsForSet().isMember(liveKey, member))) {
                return true;
            }
        }
        return false;
    }
}
