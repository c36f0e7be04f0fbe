package com.questrail.insights.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.insights.model.ProtectModelKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Classifies a raw bulk listing body into a {@link ProtectListResponse}.
 *
 * <p>Never throws: every input, including {@code null}, maps to a variant.</p>
 */
public final class ProtectListResponseDecoder
{
    private static final String DATA_KEY = "data";

    private ProtectListResponseDecoder() {}

    public static ProtectListResponse decode(ProtectModelKind kind, JsonNode body) {
        if (body == null || body.isNull() || body.isMissingNode()) {
            return new ProtectListResponse.Malformed("empty body");
        }
        if (body.isArray()) {
            return new ProtectListResponse.Listed(elements(body));
        }
        if (body.isTextual()) {
            String id = body.asText().trim();
            if (id.isEmpty()) {
                return new ProtectListResponse.Malformed("blank identifier");
            }
            return new ProtectListResponse.SingleId(id);
        }
        if (body.isObject()) {
            for (String key : List.of(kind.pluralKey(), DATA_KEY)) {
                JsonNode wrapped = body.get(key);
                if (wrapped != null && wrapped.isArray()) {
                    return new ProtectListResponse.Wrapped(key, elements(wrapped));
                }
            }
            // Single-instance kinds (an NVR) answer with the entity itself.
            JsonNode id = body.get("id");
            if (id != null && id.isValueNode() && !id.isNull()) {
                return new ProtectListResponse.Listed(List.of(body));
            }
            return new ProtectListResponse.Malformed("object without list or id: " + fieldNames(body));
        }
        return new ProtectListResponse.Malformed("unexpected " + body.getNodeType());
    }

    private static List<JsonNode> elements(JsonNode array) {
        List<JsonNode> out = new ArrayList<>(array.size());
        array.forEach(out::add);
        return out;
    }

    private static List<String> fieldNames(JsonNode object) {
        List<String> names = new ArrayList<>();
        object.fieldNames().forEachRemaining(names::add);
        return names;
    }
}
