package com.questrail.insights.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.insights.model.ProtectModelKind;

/**
 * EventClient
 * -----------------------------------------------------------------------------
 * Port to the video/sensor management API: bulk listings, commands, and a
 * persistent push connection.
 *
 * <h2>Push delivery</h2>
 * Callbacks are invoked on the client's own delivery thread, asynchronously
 * with respect to any caller. The client owns its reconnect lifecycle;
 * {@link #startPushConnection()} only needs to be called once and is
 * idempotent.
 *
 * <h2>Bulk listings</h2>
 * {@link #listResources(ProtectModelKind)} returns the raw response body. The
 * remote side is not consistent about its shape (plain list, wrapper object,
 * or a bare identifier); callers decode it with
 * {@link ProtectListResponseDecoder}.
 */
public interface EventClient
{
    void registerDeviceUpdateCallback(DeviceUpdateCallback callback);

    void registerEventUpdateCallback(EventUpdateCallback callback);

    void startPushConnection();

    void stopPushConnection();

    boolean isPushConnected();

    JsonNode listResources(ProtectModelKind kind);

    JsonNode getResource(ProtectModelKind kind, String id);

    /**
     * Forwards a command opaquely. Argument validation is the caller's concern.
     */
    void execute(ProtectCommand command);
}
