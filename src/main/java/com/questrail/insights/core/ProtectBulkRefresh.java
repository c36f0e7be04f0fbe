package com.questrail.insights.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.insights.client.EventClient;
import com.questrail.insights.client.ProtectListResponse;
import com.questrail.insights.client.ProtectListResponseDecoder;
import com.questrail.insights.internal.time.WallClock;
import com.questrail.insights.model.ProtectEntity;
import com.questrail.insights.model.ProtectModelKind;
import com.questrail.insights.observability.FetchFailureEvent;
import com.questrail.insights.observability.FetchFailureEvent.Scope;
import com.questrail.insights.observability.SyncObservabilitySink;

import java.util.List;
import java.util.Objects;

/**
 * Bulk pass over the video/sensor kinds that runs at the end of a successful
 * full refresh cycle.
 *
 * <p>Each kind is fetched, decoded and stored independently: a failure in one
 * kind is reported and the next kind proceeds. Every decoded shape has a
 * handler:</p>
 * <ul>
 *   <li>{@code Listed} / {@code Wrapped}: each item with an identifier replaces
 *       its stored entity</li>
 *   <li>{@code SingleId}: the entity is fetched by identifier, then stored</li>
 *   <li>{@code Malformed}: reported, nothing stored</li>
 * </ul>
 * Afterwards the push connection is started if it is not already up.
 */
final class ProtectBulkRefresh
{
    private final EventClient client;
    private final SnapshotStore store;
    private final WallClock wallClock;
    private final SyncObservabilitySink sink;

    ProtectBulkRefresh(EventClient client, SnapshotStore store, WallClock wallClock, SyncObservabilitySink sink) {
        this.client = Objects.requireNonNull(client, "client");
        this.store = Objects.requireNonNull(store, "store");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * @return number of kinds refreshed without failure
     */
    int run() {
        int refreshed = 0;
        for (ProtectModelKind kind : ProtectModelKind.bulkKinds()) {
            try {
                if (refreshKind(kind)) {
                    refreshed++;
                }
            }
            catch (RuntimeException e) {
                sink.onFetchFailure(FetchFailureEvent.protect(wallClock.now(), Scope.PROTECT_BULK, kind, null, e));
            }
        }
        ensurePushConnected();
        return refreshed;
    }

    boolean refreshKind(ProtectModelKind kind) {
        ProtectListResponse response = ProtectListResponseDecoder.decode(kind, client.listResources(kind));

        if (response instanceof ProtectListResponse.Listed listed) {
            storeAll(kind, listed.items());
            return true;
        }
        if (response instanceof ProtectListResponse.Wrapped wrapped) {
            storeAll(kind, wrapped.items());
            return true;
        }
        if (response instanceof ProtectListResponse.SingleId single) {
            try {
                storeAll(kind, List.of(client.getResource(kind, single.id())));
                return true;
            }
            catch (RuntimeException e) {
                sink.onFetchFailure(FetchFailureEvent.protect(wallClock.now(), Scope.PROTECT_DETAIL, kind,
                        "detail fetch for " + single.id() + " failed: " + e.getMessage(), e));
                return false;
            }
        }
        ProtectListResponse.Malformed malformed = (ProtectListResponse.Malformed) response;
        sink.onFetchFailure(FetchFailureEvent.protect(wallClock.now(), Scope.PROTECT_BULK, kind,
                "malformed listing: " + malformed.reason(), null));
        return false;
    }

    private void storeAll(ProtectModelKind kind, List<JsonNode> items) {
        int skipped = 0;
        for (JsonNode item : items) {
            if (ProtectEntity.idOf(item).isEmpty()) {
                skipped++;
                continue;
            }
            store.replaceProtectEntity(ProtectEntity.of(kind, item));
        }
        if (skipped > 0) {
            sink.onFetchFailure(FetchFailureEvent.protect(wallClock.now(), Scope.PROTECT_BULK, kind,
                    skipped + " item(s) without id skipped", null));
        }
    }

    private void ensurePushConnected() {
        try {
            if (!client.isPushConnected()) {
                client.startPushConnection();
            }
        }
        catch (RuntimeException e) {
            sink.onFetchFailure(FetchFailureEvent.protect(wallClock.now(), Scope.PUSH_CONNECTION, null,
                    "push connection start failed: " + e.getMessage(), e));
        }
    }
}
