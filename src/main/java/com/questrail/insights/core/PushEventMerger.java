package com.questrail.insights.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.insights.api.SnapshotChange;
import com.questrail.insights.client.DeviceUpdateCallback;
import com.questrail.insights.client.EventUpdateCallback;
import com.questrail.insights.internal.time.WallClock;
import com.questrail.insights.model.ProtectEntity;
import com.questrail.insights.model.ProtectEvent;
import com.questrail.insights.model.ProtectEventType;
import com.questrail.insights.model.ProtectModelKind;
import com.questrail.insights.observability.PushUpdateEvent;
import com.questrail.insights.observability.PushUpdateEvent.Channel;
import com.questrail.insights.observability.PushUpdateEvent.Disposition;
import com.questrail.insights.observability.SyncObservabilitySink;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * PushEventMerger
 * -----------------------------------------------------------------------------
 * Merges push callbacks into the snapshot.
 *
 * <h2>Device updates</h2>
 * The model key is resolved against {@link ProtectModelKind} here, at entry.
 * Unknown kinds and objects without an identifier are dropped and leave the
 * store untouched. Anything else replaces the stored entity whole.
 *
 * <h2>Event updates</h2>
 * Every event with an identifier is stored under {@code (eventKind, id)}. If it
 * names a {@code device} that is already known, one field patch is applied:
 * <ul>
 *   <li>{@code motion} on a camera: {@code lastMotion = start}, smart
 *       detection types cleared</li>
 *   <li>{@code motion} on a light: {@code lastMotion = start}</li>
 *   <li>{@code smartDetectZone} on a camera: {@code lastMotion = start}
 *       (0 if absent), {@code lastSmartDetectTypes = smartDetectTypes}</li>
 *   <li>{@code ring} on a camera: {@code lastRing = start}</li>
 * </ul>
 * Any other combination stores the event without correlation. Patches never
 * create an entity.
 *
 * <p>Listeners are notified after every applied update, never for a drop.</p>
 */
final class PushEventMerger implements DeviceUpdateCallback, EventUpdateCallback
{
    private final SnapshotStore store;
    private final ListenerRegistry listeners;
    private final WallClock wallClock;
    private final SyncObservabilitySink sink;

    PushEventMerger(SnapshotStore store, ListenerRegistry listeners, WallClock wallClock, SyncObservabilitySink sink) {
        this.store = Objects.requireNonNull(store, "store");
        this.listeners = Objects.requireNonNull(listeners, "listeners");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    @Override
    public void onDeviceUpdate(String modelKey, JsonNode object) {
        Optional<String> id = ProtectEntity.idOf(object);
        Optional<ProtectModelKind> kind = ProtectModelKind.fromModelKey(modelKey);

        if (kind.isEmpty()) {
            report(Channel.DEVICE, modelKey, id.orElse(null), Disposition.DROPPED_UNKNOWN_KIND);
            return;
        }
        if (id.isEmpty()) {
            report(Channel.DEVICE, modelKey, null, Disposition.DROPPED_MISSING_ID);
            return;
        }

        store.replaceProtectEntity(ProtectEntity.of(kind.get(), object));
        report(Channel.DEVICE, modelKey, id.get(), Disposition.APPLIED);
        listeners.notifyListeners(store, SnapshotChange.protectDevice(kind.get(), id.get()));
    }

    @Override
    public void onEventUpdate(String eventKind, JsonNode object) {
        if (eventKind == null || ProtectEntity.idOf(object).isEmpty()) {
            report(Channel.EVENT, eventKind, null, Disposition.DROPPED_MISSING_ID);
            return;
        }

        ProtectEvent event = ProtectEvent.of(eventKind, object);
        store.putEvent(event);

        boolean correlated = correlate(event);
        report(Channel.EVENT, eventKind, event.id(), correlated ? Disposition.CORRELATED : Disposition.APPLIED);
        listeners.notifyListeners(store, SnapshotChange.protectEvent(eventKind, event.id()));
    }

    /**
     * @return whether a stored entity was patched
     */
    boolean correlate(ProtectEvent event) {
        Optional<String> device = event.device();
        Optional<ProtectEventType> type = event.type();
        if (device.isEmpty() || type.isEmpty()) {
            return false;
        }

        String deviceId = device.get();
        switch (type.get()) {
            case MOTION:
                if (store.patchProtectEntity(ProtectModelKind.CAMERA, deviceId,
                        camera -> camera.withMotion(event.start(), List.of()))) {
                    return true;
                }
                return store.patchProtectEntity(ProtectModelKind.LIGHT, deviceId,
                        light -> light.withLastMotion(event.start()));
            case SMART_DETECT_ZONE:
                OptionalLong start = OptionalLong.of(event.start().orElse(0L));
                return store.patchProtectEntity(ProtectModelKind.CAMERA, deviceId,
                        camera -> camera.withMotion(start, event.smartDetectTypes()));
            case RING:
                return store.patchProtectEntity(ProtectModelKind.CAMERA, deviceId,
                        camera -> camera.withLastRing(event.start()));
            default:
                return false;
        }
    }

    private void report(Channel channel, String kind, String id, Disposition disposition) {
        sink.onPushUpdate(new PushUpdateEvent(wallClock.now(), channel, kind, id, disposition));
    }
}
