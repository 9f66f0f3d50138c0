package com.sandkev.chatscrape.normalize;

import com.sandkev.chatscrape.domain.MessageRecord;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static com.sandkev.chatscrape.testsupport.Records.raw;
import static org.assertj.core.api.Assertions.assertThat;

class MessageNormalizerTest {

    private final MessageNormalizer normalizer = new MessageNormalizer();

    @Test
    void flattensAFullMessage() {
        MessageRecord r = normalizer.toRecord(-1001L, raw("""
                {
                  "id": 55, "chat_id": 1001, "date": "2024-05-01T10:00:00+00:00",
                  "message": "see https://example.org",
                  "sender_id": 42,
                  "sender": {"id": 42, "username": "alice", "first_name": "Alice", "last_name": null, "bot": false},
                  "edit_date": 1714557660,
                  "out": false, "mentioned": true, "silent": false, "post": false,
                  "views": 120, "forwards": 3, "pinned": true,
                  "reply_to": {"reply_to_msg_id": 50},
                  "fwd_from": {"from_id": {"_": "PeerChannel", "channel_id": 777}, "from_name": "News", "date": "2024-04-30T09:00:00Z"},
                  "media": {"_": "MessageMediaPhoto"},
                  "reactions": {"results": [
                    {"reaction": {"emoticon": "👍"}, "count": 4, "chosen_order": 0},
                    {"reaction": {"document_id": 5368324170671202286}, "count": 1}
                  ]},
                  "entities": [{"_": "MessageEntityUrl", "offset": 4, "length": 19}]
                }
                """));

        assertThat(r.id()).isEqualTo(55);
        assertThat(r.chatId()).isEqualTo(1001L);
        assertThat(r.peerId()).isEqualTo(-1001L);
        assertThat(r.date()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
        assertThat(r.text()).isEqualTo("see https://example.org");
        assertThat(r.senderId()).isEqualTo(42L);
        assertThat(r.sender()).isEqualTo(new MessageRecord.Sender(42L, "alice", "Alice", null, false));
        assertThat(r.editDate()).isEqualTo(Instant.parse("2024-05-01T10:01:00Z"));
        assertThat(r.mentioned()).isTrue();
        assertThat(r.views()).isEqualTo(120);
        assertThat(r.pinned()).isTrue();
        assertThat(r.replyToMsgId()).isEqualTo(50L);
        assertThat(r.forward()).isEqualTo(new MessageRecord.Forward(777L, "News", Instant.parse("2024-04-30T09:00:00Z")));
        assertThat(r.hasMedia()).isTrue();
        assertThat(r.mediaType()).isEqualTo("MessageMediaPhoto");
        assertThat(r.reactions()).containsExactly(
                new MessageRecord.Reaction("👍", null, 4, true, 0),
                new MessageRecord.Reaction(null, 5368324170671202286L, 1, false, null));
        assertThat(r.entities()).containsExactly(new MessageRecord.Entity("MessageEntityUrl", 4, 19, null));
    }

    @Test
    void acceptsAlternateFieldNames() {
        MessageRecord r = normalizer.toRecord(1L, raw("""
                {"id": 2, "text": "hi", "reply_to_msg_id": 1,
                 "sender": {"id": "9", "is_bot": true},
                 "forward": {"from_id": 33},
                 "has_media": true, "media_type": "document",
                 "reactions": [{"reaction": {"emoji": "🔥"}, "count": 2, "i_reacted": true}],
                 "entities": [{"type": "bold", "offset": 0, "length": 2}]}
                """));

        assertThat(r.text()).isEqualTo("hi");
        assertThat(r.replyToMsgId()).isEqualTo(1L);
        assertThat(r.sender().id()).isEqualTo(9L);
        assertThat(r.sender().bot()).isTrue();
        assertThat(r.forward().fromId()).isEqualTo(33L);
        assertThat(r.mediaType()).isEqualTo("document");
        assertThat(r.reactions()).containsExactly(new MessageRecord.Reaction("🔥", null, 2, true, null));
        assertThat(r.entities()).extracting(MessageRecord.Entity::type).containsExactly("bold");
    }

    @Test
    void serviceMessageWithAlmostNothingStillNormalizes() {
        MessageRecord r = normalizer.toRecord(1L, raw("{\"id\": 3, \"action\": {\"_\": \"MessageActionPinMessage\"}}"));

        assertThat(r.id()).isEqualTo(3);
        assertThat(r.date()).isNull();
        assertThat(r.text()).isNull();
        assertThat(r.sender()).isNull();
        assertThat(r.forward()).isNull();
        assertThat(r.hasMedia()).isFalse();
        assertThat(r.mediaType()).isNull();
        assertThat(r.reactions()).isEmpty();
        assertThat(r.entities()).isEmpty();
    }

    @Test
    void mistypedFieldsBecomeNull() {
        MessageRecord r = normalizer.toRecord(1L, raw("""
                {"id": 4, "views": "lots", "pinned": "yes", "sender": "someone",
                 "reactions": {"results": "none"}, "entities": {"_": "oops"}, "edit_date": "yesterday"}
                """));

        assertThat(r.views()).isNull();
        assertThat(r.pinned()).isNull();
        assertThat(r.sender()).isNull();
        assertThat(r.reactions()).isEmpty();
        assertThat(r.entities()).isEmpty();
        assertThat(r.editDate()).isNull();
    }
}
