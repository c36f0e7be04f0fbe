package com.questrail.insights.client.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Decodes subscription text frames into {@link ProtectPushMessage}s.
 *
 * <p>Decoding is total: a frame that is not JSON, has no recognizable action,
 * no object {@code item}, or no kind field yields {@link Optional#empty()}
 * together with a reason retrievable from {@link Result#reason()}.</p>
 */
public final class ProtectPushMessageDecoder
{
    /** Kind field inside a device-channel item. */
    public static final String DEVICE_KIND_FIELD = "modelKey";
    /** Kind field inside an event-channel item. */
    public static final String EVENT_KIND_FIELD = "type";

    private final ObjectMapper mapper;

    public ProtectPushMessageDecoder(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public record Result(ProtectPushMessage message, String reason)
    {
        static Result ok(ProtectPushMessage message) {
            return new Result(message, null);
        }

        static Result rejected(String reason) {
            return new Result(null, reason);
        }

        public Optional<ProtectPushMessage> decoded() {
            return Optional.ofNullable(message);
        }
    }

    public Result decode(String text, String kindField) {
        if (text == null || text.isBlank()) {
            return Result.rejected("empty frame");
        }

        JsonNode root;
        try {
            root = mapper.readTree(text);
        }
        catch (JsonProcessingException e) {
            return Result.rejected("not JSON: " + e.getOriginalMessage());
        }
        if (!root.isObject()) {
            return Result.rejected("not an object");
        }

        ProtectPushMessage.Action action;
        try {
            action = ProtectPushMessage.Action.valueOf(root.path("type").asText("").toUpperCase(Locale.ROOT));
        }
        catch (IllegalArgumentException e) {
            return Result.rejected("unknown message type '" + root.path("type").asText("") + "'");
        }

        JsonNode item = root.get("item");
        if (item == null || !item.isObject()) {
            return Result.rejected("missing item");
        }

        JsonNode kind = item.get(kindField);
        if (kind == null || !kind.isTextual() || kind.asText().isEmpty()) {
            return Result.rejected("item without " + kindField);
        }
        return Result.ok(new ProtectPushMessage(action, kind.asText(), item));
    }
}
