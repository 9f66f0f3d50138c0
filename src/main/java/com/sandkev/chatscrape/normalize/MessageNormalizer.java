package com.sandkev.chatscrape.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.sandkev.chatscrape.domain.MessageRecord;
import com.sandkev.chatscrape.source.RawMessage;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Flattens a raw source message into a {@link MessageRecord}.
 * <p>
 * Message shapes vary by kind (service messages have no text, channel posts have
 * no sender, older payloads nest reply ids). Every field is read defensively:
 * missing or mistyped values become null, false or an empty list, and this
 * class never throws for a malformed payload.
 */
@Component
public class MessageNormalizer {

    public MessageRecord toRecord(long peerId, RawMessage msg) {
        JsonNode m = msg.body();

        JsonNode senderNode = m.path("sender");
        JsonNode media = m.path("media");
        boolean hasMedia = isPresent(media) || bool(m.path("has_media"));
        String mediaType = isPresent(media) ? typeTag(media) : textOrNull(m.path("media_type"));

        return new MessageRecord(
                msg.id(),
                longOrNull(m.path("chat_id")),
                peerId,
                msg.date(),
                textOrNull(firstPresent(m, "text", "message")),
                longOrNull(m.path("sender_id")),
                sender(senderNode),
                RawMessage.parseInstant(m.path("edit_date")),
                boolOrNull(m.path("out")),
                boolOrNull(m.path("mentioned")),
                boolOrNull(m.path("silent")),
                boolOrNull(m.path("post")),
                intOrNull(m.path("views")),
                intOrNull(m.path("forwards")),
                boolOrNull(m.path("pinned")),
                replyTo(m),
                forward(firstPresent(m, "forward", "fwd_from")),
                hasMedia,
                hasMedia ? mediaType : null,
                reactions(m.path("reactions")),
                entities(m.path("entities"))
        );
    }

    @Nullable
    private static MessageRecord.Sender sender(JsonNode s) {
        if (!s.isObject()) return null;
        return new MessageRecord.Sender(
                longOrNull(s.path("id")),
                textOrNull(s.path("username")),
                textOrNull(s.path("first_name")),
                textOrNull(s.path("last_name")),
                bool(firstPresent(s, "is_bot", "bot")));
    }

    @Nullable
    private static Long replyTo(JsonNode m) {
        Long direct = longOrNull(m.path("reply_to_msg_id"));
        return direct != null ? direct : longOrNull(m.path("reply_to").path("reply_to_msg_id"));
    }

    @Nullable
    private static MessageRecord.Forward forward(JsonNode f) {
        if (!f.isObject()) return null;
        JsonNode from = f.path("from_id");
        // nested peer objects carry the id one level down
        Long fromId = from.isObject() ? firstLong(from, "peer_id", "user_id", "channel_id", "chat_id") : longOrNull(from);
        return new MessageRecord.Forward(fromId, textOrNull(f.path("from_name")), RawMessage.parseInstant(f.path("date")));
    }

    private static List<MessageRecord.Reaction> reactions(JsonNode r) {
        JsonNode results = r.isArray() ? r : r.path("results");
        if (!results.isArray()) return List.of();
        List<MessageRecord.Reaction> out = new ArrayList<>();
        for (JsonNode rc : results) {
            JsonNode reaction = rc.path("reaction");
            Integer order = intOrNull(rc.path("chosen_order"));
            out.add(new MessageRecord.Reaction(
                    textOrNull(firstPresent(reaction, "emoticon", "emoji")),
                    longOrNull(firstPresent(reaction, "document_id", "custom_emoji_id")),
                    intOr(rc.path("count"), 0),
                    order != null || bool(rc.path("i_reacted")),
                    order));
        }
        return out;
    }

    private static List<MessageRecord.Entity> entities(JsonNode e) {
        if (!e.isArray()) return List.of();
        List<MessageRecord.Entity> out = new ArrayList<>();
        for (JsonNode en : e) {
            out.add(new MessageRecord.Entity(
                    typeTag(en),
                    intOr(en.path("offset"), 0),
                    intOr(en.path("length"), 0),
                    textOrNull(en.path("url"))));
        }
        return out;
    }

    @Nullable
    private static String typeTag(JsonNode node) {
        if (!node.isObject()) return textOrNull(node);
        return textOrNull(firstPresent(node, "_", "type"));
    }

    // ---- total accessors ----

    private static JsonNode firstPresent(JsonNode node, String... names) {
        for (String n : names) {
            JsonNode v = node.path(n);
            if (isPresent(v)) return v;
        }
        return node.path(names[0]);
    }

    private static boolean isPresent(JsonNode v) {
        return v != null && !v.isMissingNode() && !v.isNull();
    }

    @Nullable
    private static Long firstLong(JsonNode node, String... names) {
        for (String n : names) {
            Long v = longOrNull(node.path(n));
            if (v != null) return v;
        }
        return null;
    }

    @Nullable
    private static Long longOrNull(JsonNode v) {
        if (v.isIntegralNumber() && v.canConvertToLong()) return v.asLong();
        if (v.isTextual()) {
            try {
                return Long.parseLong(v.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    @Nullable
    private static Integer intOrNull(JsonNode v) {
        return v.isIntegralNumber() && v.canConvertToInt() ? v.asInt() : null;
    }

    private static int intOr(JsonNode v, int fallback) {
        Integer i = intOrNull(v);
        return i == null ? fallback : i;
    }

    @Nullable
    private static Boolean boolOrNull(JsonNode v) {
        return v.isBoolean() ? v.asBoolean() : null;
    }

    private static boolean bool(JsonNode v) {
        return v.isBoolean() && v.asBoolean();
    }

    @Nullable
    private static String textOrNull(JsonNode v) {
        return v.isValueNode() && !v.isNull() ? v.asText() : null;
    }
}
