package com.questrail.insights.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;
import java.util.Optional;

/**
 * Site
 * -----------------------------------------------------------------------------
 * Top-level scoping unit of the network management API (one physical location's
 * managed network).
 *
 * <p>A site record is never merged: each successful site listing replaces it
 * with the latest full object returned by the API.</p>
 */
public final class Site
{
    private final String id;
    private final ObjectNode attributes;

    private Site(String id, ObjectNode attributes) {
        this.id = id;
        this.attributes = attributes;
    }

    /**
     * Builds a site from an API object.
     *
     * @throws IllegalArgumentException if the object carries no {@code id}
     */
    public static Site of(JsonNode object) {
        String id = JsonFields.require(JsonFields.id(object), "site id", object);
        return new Site(id, JsonFields.copyOf(object));
    }

    public String id() {
        return id;
    }

    public Optional<String> name() {
        return JsonFields.text(attributes, "name");
    }

    /**
     * Returns a copy of the full API object.
     */
    public ObjectNode attributes() {
        return attributes.deepCopy();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Site that)) return false;
        return id.equals(that.id) && attributes.equals(that.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, attributes);
    }

    @Override
    public String toString() {
        return "Site{" + id + ", name=" + name().orElse("?") + "}";
    }
}
