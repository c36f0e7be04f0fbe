package com.questrail.insights.client;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Objects;

/**
 * ProtectListResponse
 * -----------------------------------------------------------------------------
 * Decoded shape of a bulk listing response from the video/sensor API.
 *
 * <p>The remote side returns one of several shapes for the same endpoint; each
 * variant has a defined handler in the bulk refresh:</p>
 * <ul>
 *   <li>{@link Listed}: a plain array of entity objects (a single entity object
 *       is decoded as a list of one)</li>
 *   <li>{@link Wrapped}: an object carrying the array under a named key</li>
 *   <li>{@link SingleId}: a bare identifier string; the entity must be fetched
 *       with a secondary detail call</li>
 *   <li>{@link Malformed}: anything else; reported and skipped</li>
 * </ul>
 */
public sealed interface ProtectListResponse
        permits ProtectListResponse.Listed,
                ProtectListResponse.Wrapped,
                ProtectListResponse.SingleId,
                ProtectListResponse.Malformed
{
    record Listed(List<JsonNode> items) implements ProtectListResponse {
        public Listed {
            items = List.copyOf(items);
        }
    }

    record Wrapped(String key, List<JsonNode> items) implements ProtectListResponse {
        public Wrapped {
            Objects.requireNonNull(key, "key");
            items = List.copyOf(items);
        }
    }

    record SingleId(String id) implements ProtectListResponse {
        public SingleId {
            Objects.requireNonNull(id, "id");
        }
    }

    record Malformed(String reason) implements ProtectListResponse {
        public Malformed {
            Objects.requireNonNull(reason, "reason");
        }
    }
}
