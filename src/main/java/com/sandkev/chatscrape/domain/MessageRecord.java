package com.sandkev.chatscrape.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.List;

/**
 * Storage-ready form of one chat message. Built once per incoming message by the
 * normalizer and never mutated; re-ingesting the same id replaces the stored copy.
 */
@JsonPropertyOrder({
        "id", "chat_id", "peer_id", "date", "text", "sender_id", "sender",
        "edit_date", "out", "mentioned", "silent", "post", "views", "forwards", "pinned",
        "reply_to_msg_id", "forward", "has_media", "media_type", "reactions", "entities"
})
public record MessageRecord(
        long id,
        @JsonProperty("chat_id") Long chatId,
        @JsonProperty("peer_id") long peerId,
        Instant date,
        String text,
        @JsonProperty("sender_id") Long senderId,
        Sender sender,
        @JsonProperty("edit_date") Instant editDate,
        Boolean out,
        Boolean mentioned,
        Boolean silent,
        Boolean post,
        Integer views,
        Integer forwards,
        Boolean pinned,
        @JsonProperty("reply_to_msg_id") Long replyToMsgId,
        Forward forward,
        @JsonProperty("has_media") boolean hasMedia,
        @JsonProperty("media_type") String mediaType,
        List<Reaction> reactions,
        List<Entity> entities
) {

    public MessageRecord {
        reactions = reactions == null ? List.of() : List.copyOf(reactions);
        entities = entities == null ? List.of() : List.copyOf(entities);
    }

    public record Sender(
            Long id,
            String username,
            @JsonProperty("first_name") String firstName,
            @JsonProperty("last_name") String lastName,
            @JsonProperty("is_bot") boolean bot
    ) {}

    public record Forward(
            @JsonProperty("from_id") Long fromId,
            @JsonProperty("from_name") String fromName,
            Instant date
    ) {}

    public record Reaction(
            String emoji,
            @JsonProperty("custom_emoji_id") Long customEmojiId,
            int count,
            @JsonProperty("i_reacted") boolean reacted,
            @JsonProperty("my_reaction_order") Integer myReactionOrder
    ) {}

    /** Text annotation: link, mention, formatting span. */
    public record Entity(
            String type,
            int offset,
            int length,
            String url
    ) {}
}
