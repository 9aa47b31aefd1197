package com.octate.collab.client;

import com.octate.collab.config.CollabConfig;
import com.octate.collab.config.TransportSettings;
import com.octate.collab.document.DocumentState;
import com.octate.collab.presence.PresenceTracker;
import com.octate.collab.scheduling.TaskScheduler;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Builds client transports wired to the application's scheduler and the
 * {@code collab.client.*} settings.
 */
@ApplicationScoped
public class SyncTransportFactory {

    private final TaskScheduler scheduler;
    private final TransportSettings settings;
    private final ChannelConnector connector;

    @Inject
    public SyncTransportFactory(TaskScheduler scheduler, CollabConfig config) {
        this(scheduler, TransportSettings.from(config.client()), new WebSocketChannelConnector());
    }

    public SyncTransportFactory(TaskScheduler scheduler, TransportSettings settings, ChannelConnector connector) {
        this.scheduler = scheduler;
        this.settings = settings;
        this.connector = connector;
    }

    public SyncTransport create(DocumentState document) {
        PresenceTracker presence = new PresenceTracker(settings.presenceTimeout(), scheduler::currentTimeMillis);
        return new SyncTransport(connector, scheduler, settings, document, presence);
    }

    public TransportSettings settings() {
        return settings;
    }
}
