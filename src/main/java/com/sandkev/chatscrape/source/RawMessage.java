package com.sandkev.chatscrape.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * A message as the source delivered it. Only the id and send time are lifted out;
 * everything else stays in {@code body} for the normalizer.
 */
public record RawMessage(long id, @Nullable Instant date, JsonNode body) {

    public RawMessage {
        body = body == null ? MissingNode.getInstance() : body;
    }

    /** Messages without a usable id get {@code -1} and are never delivered. */
    public static RawMessage of(JsonNode body) {
        JsonNode id = body == null ? null : body.get("id");
        long messageId = id != null && id.canConvertToLong() ? id.asLong() : -1L;
        return new RawMessage(messageId, parseInstant(body == null ? null : body.get("date")), body);
    }

    /** ISO-8601 text (zone-less means UTC) or epoch seconds; anything else is null. */
    @Nullable
    public static Instant parseInstant(@Nullable JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return null;
        if (node.isNumber()) return Instant.ofEpochSecond(node.asLong());
        String v = node.asText().trim();
        if (v.isEmpty()) return null;
        try {
            return OffsetDateTime.parse(v).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(v).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException unparseable) {
                return null;
            }
        }
    }
}
