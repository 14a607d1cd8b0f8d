package com.webchat.server.im.connection;

import com.webchat.server.im.cluster.InstanceIdentity;
import com.webchat.server.im.model.UserIdentity;
import com.webchat.server.im.netty.NettyTransport;
import com.webchat.server.im.presence.PresenceStore;
import com.webchat.server.im.service.MessageRouter;
import io.netty.channel.Channel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;

/**
 * Creates, starts and registers a {@link Connection} for a freshly upgraded channel.
 */
@Component
public class ConnectionFactory {

    private static final Logger log = LoggerFactory.getLogger(ConnectionFactory.class);

    private final ConnectionSettings settings;
    private final MessageRouter router;
    private final PresenceStore presenceStore;
    private final InstanceIdentity instanceIdentity;
    private final ExecutorService connectionExecutor;

    @Autowired
    public ConnectionFactory(ConnectionSettings settings,
                             MessageRouter router,
                             PresenceStore presenceStore,
                             InstanceIdentity instanceIdentity,
                             @Qualifier("connectionExecutor") ExecutorService connectionExecutor) {
        this.settings = settings;
        this.router = router;
        this.presenceStore = presenceStore;
        this.instanceIdentity = instanceIdentity;
        this.connectionExecutor = connectionExecutor;
    }

    public Connection open(UserIdentity identity, Channel channel) {
        Connection connection = new Connection(identity, new NettyTransport(channel), settings, router);
        connection.start(connectionExecutor, presenceStore, instanceIdentity.getInstanceId());
        router.register(connection);
        log.debug("Opened {} for channel {}", connection, channel.id());
        return connection;
    }
}
