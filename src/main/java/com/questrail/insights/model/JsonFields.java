package com.questrail.insights.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Small helpers shared by the model records for reading loosely-typed API objects.
 *
 * <p>All model records hold a private deep copy of the object they were built
 * from, so a record handed to readers can never change underneath them.</p>
 */
final class JsonFields
{
    private JsonFields() {}

    static ObjectNode copyOf(JsonNode node) {
        if (node == null || !node.isObject()) {
            return JsonNodeFactory.instance.objectNode();
        }
        return ((ObjectNode) node).deepCopy();
    }

    /**
     * Returns the textual identifier carried in {@code id}, if any.
     * Numeric identifiers are accepted and rendered as text.
     */
    static Optional<String> id(JsonNode node) {
        return text(node, "id");
    }

    static Optional<String> text(JsonNode node, String field) {
        if (node == null) {
            return Optional.empty();
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return Optional.empty();
        }
        String text = value.asText();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    static OptionalLong longValue(JsonNode node, String field) {
        if (node == null) {
            return OptionalLong.empty();
        }
        JsonNode value = node.get(field);
        if (value == null || !value.isNumber()) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(value.asLong());
    }

    static List<String> textList(JsonNode node, String field) {
        if (node == null) {
            return List.of();
        }
        JsonNode value = node.get(field);
        if (value == null || !value.isArray()) {
            return List.of();
        }
        List<String> out = new ArrayList<>(value.size());
        for (JsonNode element : value) {
            if (element.isValueNode() && !element.isNull()) {
                out.add(element.asText());
            }
        }
        return Collections.unmodifiableList(out);
    }

    static String require(Optional<String> value, String what, JsonNode source) {
        return value.orElseThrow(() -> new IllegalArgumentException(what + " missing in " + source));
    }
}
