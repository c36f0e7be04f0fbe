package com.questrail.insights.core;

import com.questrail.insights.api.InsightsSnapshot;
import com.questrail.insights.api.ListenerRegistration;
import com.questrail.insights.api.RefreshOutcome;
import com.questrail.insights.api.SnapshotChange;
import com.questrail.insights.api.SnapshotListener;
import com.questrail.insights.client.DeviceCommand;
import com.questrail.insights.client.EventClient;
import com.questrail.insights.client.ProtectCommand;
import com.questrail.insights.client.ResourceClient;
import com.questrail.insights.config.SyncConfig;
import com.questrail.insights.internal.time.Cancellable;
import com.questrail.insights.internal.time.MonotonicClock;
import com.questrail.insights.internal.time.MonotonicScheduler;
import com.questrail.insights.internal.time.SystemMonotonicClock;
import com.questrail.insights.internal.time.SystemWallClock;
import com.questrail.insights.internal.time.WallClock;
import com.questrail.insights.observability.NullObservabilitySink;
import com.questrail.insights.observability.SyncErrorEvent;
import com.questrail.insights.observability.SyncObservabilitySink;
import com.questrail.insights.observability.TickCoalescedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * InsightsCoordinator
 * =============================================================================
 * Keeps a {@link SnapshotStore} synchronized with the network management API
 * (scheduled pull) and the video/sensor API (push), and notifies listeners
 * after every mutation.
 *
 * <h2>Threading Model</h2>
 * <ul>
 *   <li>Refresh cycles run one at a time on a dedicated cycle thread. Manual
 *       refreshes queue behind a running cycle; a scheduled tick that fires
 *       while any cycle is queued or running is skipped.</li>
 *   <li>Fetches within a cycle fan out on a worker pool, unbounded unless
 *       {@link SyncConfig#maxConcurrentFetches()} caps it.</li>
 *   <li>Push callbacks run on the event client's delivery thread and write
 *       the store concurrently with a cycle. The store's per-key atomic
 *       replacement keeps the two from tearing each other's writes.</li>
 * </ul>
 *
 * <h2>Cadence</h2>
 * Ticks are armed at fixed deadlines on the monotonic clock, start-to-start,
 * beginning with an immediate tick on {@link #start()}.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   coordinator.start()      → first cycle now, then every refreshInterval
 *   coordinator.refresh()    → queue a manual cycle
 *   coordinator.stop()       → cancel cadence, stop push, drain within shutdownGrace
 * </pre>
 * A stopped coordinator cannot be restarted; refresh requests made after
 * {@code stop()} complete as {@code SKIPPED}.
 */
public final class InsightsCoordinator
{
    private static final Logger log = LoggerFactory.getLogger(InsightsCoordinator.class);

    private final ResourceClient resources;
    private final EventClient events;
    private final SyncConfig config;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final SyncObservabilitySink sink;
    private final Runnable onAuthenticationFailure;

    private final SnapshotStore store = new SnapshotStore();
    private final ListenerRegistry listeners;
    private final PushEventMerger pushMerger;
    private final RefreshCycle cycle;

    private final ExecutorService cycleExecutor;
    private final ExecutorService fetchExecutor;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final AtomicInteger cyclesInFlight = new AtomicInteger();
    private final Object cadenceLock = new Object();

    private long nextDeadlineNanos;
    private Cancellable scheduledTick;

    private InsightsCoordinator(Builder b) {
        this.resources = Objects.requireNonNull(b.resources, "resources");
        this.events = b.events;
        this.config = Objects.requireNonNull(b.config, "config");
        this.scheduler = Objects.requireNonNull(b.scheduler, "scheduler");
        this.clock = Objects.requireNonNullElse(b.clock, SystemMonotonicClock.INSTANCE);
        this.wallClock = Objects.requireNonNullElse(b.wallClock, SystemWallClock.INSTANCE);
        this.sink = Objects.requireNonNullElse(b.sink, NullObservabilitySink.INSTANCE);
        this.onAuthenticationFailure = Objects.requireNonNullElse(b.onAuthenticationFailure, () -> {});

        this.listeners = new ListenerRegistry(sink, wallClock);
        this.pushMerger = new PushEventMerger(store, listeners, wallClock, sink);

        this.cycleExecutor = Executors.newSingleThreadExecutor(named("insights-refresh", false));
        this.fetchExecutor = config.isFanOutBounded()
                ? Executors.newFixedThreadPool(config.maxConcurrentFetches(), named("insights-fetch", true))
                : Executors.newCachedThreadPool(named("insights-fetch", true));

        ProtectBulkRefresh protectRefresh = isProtectActive()
                ? new ProtectBulkRefresh(events, store, wallClock, sink)
                : null;
        this.cycle = new RefreshCycle(resources, protectRefresh, store, fetchExecutor, clock, wallClock, sink);
    }

    public static Builder builder() {
        return new Builder();
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    /**
     * Subscribes to push callbacks, runs the first cycle immediately and arms
     * the cadence. Idempotent.
     */
    public void start() {
        if (stopped.get()) {
            throw new IllegalStateException("coordinator has been stopped");
        }
        if (!running.compareAndSet(false, true)) {
            return;
        }

        if (isProtectActive()) {
            events.registerDeviceUpdateCallback(pushMerger);
            events.registerEventUpdateCallback(pushMerger);
        }

        log.info("Starting synchronization (interval {}, protect {})",
                config.refreshInterval(), isProtectActive() ? "enabled" : "disabled");

        synchronized (cadenceLock) {
            nextDeadlineNanos = clock.nowNanos();
        }
        onTick();
    }

    /**
     * Cancels the cadence, stops the push connection and waits up to
     * {@link SyncConfig#shutdownGrace()} for a running cycle to finish.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        running.set(false);

        synchronized (cadenceLock) {
            if (scheduledTick != null) {
                scheduledTick.cancel();
                scheduledTick = null;
            }
        }

        if (isProtectActive()) {
            try {
                events.stopPushConnection();
            }
            catch (RuntimeException e) {
                sink.onError(new SyncErrorEvent(wallClock.now(), "Failed to stop push connection", e));
            }
        }

        cycleExecutor.shutdown();
        try {
            if (!cycleExecutor.awaitTermination(config.shutdownGrace().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Refresh cycle still running after {}; abandoning it", config.shutdownGrace());
                cycleExecutor.shutdownNow();
            }
        }
        catch (InterruptedException e) {
            cycleExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        finally {
            fetchExecutor.shutdownNow();
        }
        log.info("Synchronization stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    private void onTick() {
        synchronized (cadenceLock) {
            if (!running.get()) {
                return;
            }
            nextDeadlineNanos += config.refreshInterval().toNanos();
            scheduledTick = scheduler.scheduleAtNanos(nextDeadlineNanos, this::onTick);
        }

        int inFlight = cyclesInFlight.get();
        if (inFlight > 0) {
            sink.onTickCoalesced(new TickCoalescedEvent(wallClock.now(), inFlight));
            return;
        }
        submit(null);
    }

    // -------------------------------------------------------------------------
    // Refresh
    // -------------------------------------------------------------------------

    /**
     * Queues a full refresh cycle.
     */
    public CompletableFuture<RefreshOutcome> refresh() {
        return submit(null);
    }

    /**
     * Queues a refresh of one site already present in the snapshot.
     * Completes as {@code SKIPPED} for an unknown site.
     */
    public CompletableFuture<RefreshOutcome> refresh(String siteId) {
        return submit(Objects.requireNonNull(siteId, "siteId"));
    }

    /** Cycles queued or running. */
    public int cyclesInFlight() {
        return cyclesInFlight.get();
    }

    private CompletableFuture<RefreshOutcome> submit(String siteId) {
        CompletableFuture<RefreshOutcome> result = new CompletableFuture<>();
        cyclesInFlight.incrementAndGet();
        try {
            cycleExecutor.execute(() -> {
                try {
                    RefreshOutcome outcome = runCycle(siteId);
                    cyclesInFlight.decrementAndGet();
                    result.complete(outcome);
                }
                catch (RuntimeException e) {
                    cyclesInFlight.decrementAndGet();
                    sink.onError(new SyncErrorEvent(wallClock.now(), "Refresh cycle failed", e));
                    result.completeExceptionally(e);
                }
            });
        }
        catch (RejectedExecutionException e) {
            cyclesInFlight.decrementAndGet();
            result.complete(RefreshOutcome.skipped(wallClock.now(), "coordinator stopped"));
        }
        return result;
    }

    private RefreshOutcome runCycle(String siteId) {
        RefreshOutcome outcome = siteId == null ? cycle.run() : cycle.runSite(siteId);

        if (outcome.status() == RefreshOutcome.Status.AUTHENTICATION_FAILURE) {
            try {
                onAuthenticationFailure.run();
            }
            catch (RuntimeException e) {
                sink.onError(new SyncErrorEvent(wallClock.now(), "Re-authentication hook failed", e));
            }
        }

        if (outcome.status() != RefreshOutcome.Status.SKIPPED) {
            listeners.notifyListeners(store,
                    siteId == null ? SnapshotChange.refreshCycle() : SnapshotChange.siteRefresh(siteId));
        }
        return outcome;
    }

    // -------------------------------------------------------------------------
    // Readers and listeners
    // -------------------------------------------------------------------------

    public InsightsSnapshot snapshot() {
        return store;
    }

    public boolean isAvailable() {
        return store.isAvailable();
    }

    public ListenerRegistration addListener(SnapshotListener listener) {
        return listeners.add(listener);
    }

    /**
     * Registers a listener that is only told about changes from {@code sources}.
     */
    public ListenerRegistration addListener(Set<SnapshotChange.Source> sources, SnapshotListener listener) {
        return listeners.add(sources, listener);
    }

    // -------------------------------------------------------------------------
    // Commands
    // -------------------------------------------------------------------------

    public boolean restartDevice(String siteId, String deviceId) {
        return sendDeviceCommand(siteId, deviceId, DeviceCommand.RESTART);
    }

    public boolean sendDeviceCommand(String siteId, String deviceId, DeviceCommand command) {
        return resources.sendDeviceCommand(siteId, deviceId, command);
    }

    /**
     * Forwards a command to the video/sensor API.
     *
     * @throws IllegalStateException if no event client is configured or the
     *                               video/sensor integration is disabled
     */
    public void sendProtectCommand(ProtectCommand command) {
        if (!isProtectActive()) {
            throw new IllegalStateException("video/sensor integration is not enabled");
        }
        events.execute(command);
    }

    public boolean isPushConnected() {
        return isProtectActive() && events.isPushConnected();
    }

    private boolean isProtectActive() {
        return events != null && config.protectEnabled();
    }

    private static ThreadFactory named(String prefix, boolean numbered) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, numbered ? prefix + "-" + counter.incrementAndGet() : prefix);
            t.setDaemon(true);
            return t;
        };
    }

    public static final class Builder
    {
        private ResourceClient resources;
        private EventClient events;
        private SyncConfig config = SyncConfig.defaults();
        private MonotonicScheduler scheduler;
        private MonotonicClock clock;
        private WallClock wallClock;
        private SyncObservabilitySink sink;
        private Runnable onAuthenticationFailure;

        public Builder withResourceClient(ResourceClient resources) {
            this.resources = resources;
            return this;
        }

        /** Optional; without it the video/sensor integration is off. */
        public Builder withEventClient(EventClient events) {
            this.events = events;
            return this;
        }

        public Builder withConfig(SyncConfig config) {
            this.config = config;
            return this;
        }

        public Builder withScheduler(MonotonicScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public Builder withObservabilitySink(SyncObservabilitySink sink) {
            this.sink = sink;
            return this;
        }

        /** Invoked on the cycle thread whenever a cycle ends in an authentication failure. */
        public Builder onAuthenticationFailure(Runnable hook) {
            this.onAuthenticationFailure = hook;
            return this;
        }

        public InsightsCoordinator build() {
            return new InsightsCoordinator(this);
        }
    }
}
