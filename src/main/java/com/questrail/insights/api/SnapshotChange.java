package com.questrail.insights.api;

import com.questrail.insights.model.ProtectModelKind;

import java.util.Objects;
import java.util.Optional;

/**
 * Describes the mutation batch a listener is being notified about.
 *
 * @param source what produced the mutation
 * @param key    the affected key for single-key mutations (site id,
 *               {@code kind/id} of an entity or event); {@code null} for a full cycle
 */
public record SnapshotChange(Source source, String key)
{
    public enum Source
    {
        REFRESH_CYCLE,
        SITE_REFRESH,
        PROTECT_DEVICE,
        PROTECT_EVENT
    }

    public SnapshotChange {
        Objects.requireNonNull(source, "source");
    }

    public static SnapshotChange refreshCycle() {
        return new SnapshotChange(Source.REFRESH_CYCLE, null);
    }

    public static SnapshotChange siteRefresh(String siteId) {
        return new SnapshotChange(Source.SITE_REFRESH, siteId);
    }

    public static SnapshotChange protectDevice(ProtectModelKind kind, String id) {
        return new SnapshotChange(Source.PROTECT_DEVICE, kind.modelKey() + "/" + id);
    }

    public static SnapshotChange protectEvent(String eventKind, String id) {
        return new SnapshotChange(Source.PROTECT_EVENT, eventKind + "/" + id);
    }

    public Optional<String> affectedKey() {
        return Optional.ofNullable(key);
    }

    public boolean isPush() {
        return source == Source.PROTECT_DEVICE || source == Source.PROTECT_EVENT;
    }
}
