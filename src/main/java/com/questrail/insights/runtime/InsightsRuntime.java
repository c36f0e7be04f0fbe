package com.questrail.insights.runtime;

import com.questrail.insights.api.InsightsSnapshot;
import com.questrail.insights.api.ListenerRegistration;
import com.questrail.insights.api.RefreshOutcome;
import com.questrail.insights.api.SnapshotListener;
import com.questrail.insights.client.EventClient;
import com.questrail.insights.client.ProtectCommand;
import com.questrail.insights.client.http.InsightsHttpResourceClient;
import com.questrail.insights.client.http.ProtectHttpEventClient;
import com.questrail.insights.config.ApiEndpointConfig;
import com.questrail.insights.config.SyncConfig;
import com.questrail.insights.core.InsightsCoordinator;
import com.questrail.insights.internal.time.MonotonicClock;
import com.questrail.insights.internal.time.MonotonicScheduler;
import com.questrail.insights.internal.time.ScheduledExecutorScheduler;
import com.questrail.insights.internal.time.SystemMonotonicClock;
import com.questrail.insights.internal.time.SystemWallClock;
import com.questrail.insights.observability.Slf4jSyncObservabilitySink;
import com.questrail.insights.observability.SyncObservabilitySink;
import com.questrail.insights.transport.ApiTransport;
import com.questrail.insights.transport.PushEndpoint;
import com.questrail.insights.transport.netty.NettyTransportFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * InsightsRuntime
 * =============================================================================
 * Unified composition root and lifecycle owner for the production
 * synchronization stack: Netty transports, both HTTP clients and the
 * coordinator.
 */
public final class InsightsRuntime {
    private final InsightsCoordinator coordinator;
    private final InsightsHttpResourceClient resourceClient;
    private final ApiTransport transport;
    private final NettyTransportFactory transports;
    private final ScheduledExecutorService schedulerExecutor;

    private InsightsRuntime(
            InsightsCoordinator coordinator,
            InsightsHttpResourceClient resourceClient,
            ApiTransport transport,
            NettyTransportFactory transports,
            ScheduledExecutorService schedulerExecutor) {
        this.coordinator = coordinator;
        this.resourceClient = resourceClient;
        this.transport = transport;
        this.transports = transports;
        this.schedulerExecutor = schedulerExecutor;
    }

    public void start() {
        coordinator.start();
    }

    public void stop() {
        coordinator.stop();
        schedulerExecutor.shutdown();
        try {
            if (!schedulerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                schedulerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            schedulerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            transport.close();
            transports.close();
        }
    }

    /**
     * Checks the configured API key against the network API without touching
     * the snapshot.
     */
    public boolean validateCredentials() {
        return resourceClient.validateCredentials();
    }

    public InsightsSnapshot snapshot() {
        return coordinator.snapshot();
    }

    public CompletableFuture<RefreshOutcome> refresh() {
        return coordinator.refresh();
    }

    public CompletableFuture<RefreshOutcome> refresh(String siteId) {
        return coordinator.refresh(siteId);
    }

    public ListenerRegistration addListener(SnapshotListener listener) {
        return coordinator.addListener(listener);
    }

    public boolean restartDevice(String siteId, String deviceId) {
        return coordinator.restartDevice(siteId, deviceId);
    }

    public void sendProtectCommand(ProtectCommand command) {
        coordinator.sendProtectCommand(command);
    }

    public InsightsCoordinator coordinator() {
        return coordinator;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ApiEndpointConfig endpoint;
        private SyncConfig syncConfig = SyncConfig.defaults();
        private SyncObservabilitySink observabilitySink = new Slf4jSyncObservabilitySink();
        private boolean protectEnabled = true;
        private Runnable onAuthenticationFailure;

        public Builder withEndpoint(ApiEndpointConfig endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder withSyncConfig(SyncConfig config) {
            this.syncConfig = config;
            return this;
        }

        public Builder withObservabilitySink(SyncObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /** When false no event client is built and no push connection is opened. */
        public Builder withProtectEnabled(boolean enabled) {
            this.protectEnabled = enabled;
            return this;
        }

        public Builder onAuthenticationFailure(Runnable hook) {
            this.onAuthenticationFailure = hook;
            return this;
        }

        public InsightsRuntime build() {
            Objects.requireNonNull(endpoint, "endpoint");
            Objects.requireNonNull(syncConfig, "syncConfig");

            // 1. Time
            MonotonicClock clock = SystemMonotonicClock.INSTANCE;
            ScheduledExecutorService schedulerExec = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "insights-scheduler");
                t.setDaemon(true);
                return t;
            });
            MonotonicScheduler scheduler = new ScheduledExecutorScheduler(schedulerExec, clock);

            // 2. Transports
            NettyTransportFactory transports = new NettyTransportFactory(endpoint);
            ApiTransport transport = transports.apiTransport();

            // 3. Clients
            InsightsHttpResourceClient resourceClient = new InsightsHttpResourceClient(transport, endpoint.apiKey());

            EventClient eventClient = null;
            if (protectEnabled && syncConfig.protectEnabled()) {
                Map<String, String> headers = ProtectHttpEventClient.authHeaders(endpoint.apiKey());
                PushEndpoint devices = transports.pushEndpoint(ProtectHttpEventClient.DEVICES_SUBSCRIPTION_PATH, headers);
                PushEndpoint events = transports.pushEndpoint(ProtectHttpEventClient.EVENTS_SUBSCRIPTION_PATH, headers);
                eventClient = new ProtectHttpEventClient(
                        transport,
                        endpoint.apiKey(),
                        devices,
                        events,
                        scheduler,
                        clock,
                        endpoint.reconnectInitialBackoff(),
                        endpoint.reconnectMaxBackoff());
            }

            // 4. Coordinator
            InsightsCoordinator coordinator = InsightsCoordinator.builder()
                    .withResourceClient(resourceClient)
                    .withEventClient(eventClient)
                    .withConfig(syncConfig)
                    .withScheduler(scheduler)
                    .withClock(clock)
                    .withWallClock(SystemWallClock.INSTANCE)
                    .withObservabilitySink(observabilitySink)
                    .onAuthenticationFailure(onAuthenticationFailure)
                    .build();

            return new InsightsRuntime(coordinator, resourceClient, transport, transports, schedulerExec);
        }
    }
}
