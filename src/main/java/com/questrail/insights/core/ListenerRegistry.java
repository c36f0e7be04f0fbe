package com.questrail.insights.core;

import com.questrail.insights.api.InsightsSnapshot;
import com.questrail.insights.api.ListenerRegistration;
import com.questrail.insights.api.SnapshotChange;
import com.questrail.insights.api.SnapshotListener;
import com.questrail.insights.internal.time.WallClock;
import com.questrail.insights.observability.SyncErrorEvent;
import com.questrail.insights.observability.SyncObservabilitySink;

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Registered snapshot listeners and their delivery.
 *
 * <p>Delivery is synchronous on the caller's thread. Registration and removal
 * may happen concurrently with delivery; a listener added during a delivery
 * may or may not see that delivery.</p>
 */
final class ListenerRegistry
{
    private final List<Entry> entries = new CopyOnWriteArrayList<>();
    private final SyncObservabilitySink sink;
    private final WallClock wallClock;

    ListenerRegistry(SyncObservabilitySink sink, WallClock wallClock) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    ListenerRegistration add(Set<SnapshotChange.Source> sources, SnapshotListener listener) {
        Objects.requireNonNull(listener, "listener");
        if (sources.isEmpty()) {
            throw new IllegalArgumentException("sources must not be empty");
        }
        Entry entry = new Entry(listener, EnumSet.copyOf(sources));
        entries.add(entry);
        return () -> entries.remove(entry);
    }

    ListenerRegistration add(SnapshotListener listener) {
        return add(EnumSet.allOf(SnapshotChange.Source.class), listener);
    }

    /**
     * Invokes every listener interested in {@code change.source()}. A listener
     * that throws is reported and skipped.
     */
    void notifyListeners(InsightsSnapshot snapshot, SnapshotChange change) {
        for (Entry entry : entries) {
            if (!entry.sources.contains(change.source())) {
                continue;
            }
            try {
                entry.listener.onSnapshotChanged(snapshot, change);
            }
            catch (RuntimeException e) {
                sink.onError(new SyncErrorEvent(wallClock.now(),
                        "Listener " + entry.listener + " failed on " + change, e));
            }
        }
    }

    int size() {
        return entries.size();
    }

    // Identity equality, so the same listener may be registered twice and removed once.
    private static final class Entry
    {
        private final SnapshotListener listener;
        private final Set<SnapshotChange.Source> sources;

        Entry(SnapshotListener listener, Set<SnapshotChange.Source> sources) {
            this.listener = listener;
            this.sources = sources;
        }
    }
}
