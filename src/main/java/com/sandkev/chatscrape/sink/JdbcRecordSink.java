package com.sandkev.chatscrape.sink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.sandkev.chatscrape.domain.MessageRecord;
import com.sandkev.chatscrape.jdbc.SqlDialect;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;

/**
 * Idempotent upsert into {@code messages} keyed by (chat_peer_id, message_id).
 * A second write for the same key replaces the payload and bumps updated_at.
 */
@Slf4j
public class JdbcRecordSink implements RecordSink {

    private final JdbcTemplate jdbc;
    private final SqlDialect dialect;
    private final RecordJson json;
    private final Clock clock;

    public JdbcRecordSink(JdbcTemplate jdbc, SqlDialect dialect, RecordJson json, Clock clock) {
        this.jdbc = jdbc;
        this.dialect = dialect;
        this.json = json;
        this.clock = clock;
    }

    @Override
    public boolean write(long peerId, MessageRecord record) {
        try {
            // sent_at is NOT NULL; a dateless service message is stamped with arrival time
            Instant sentAt = record.date() != null ? record.date() : clock.instant();
            jdbc.update(dialect.messageUpsert(), peerId, record.id(), Timestamp.from(sentAt), json.toJson(record));
            log.debug("[DB] Saved message {} for chat {}", record.id(), peerId);
            return true;
        } catch (JsonProcessingException e) {
            log.error("[DB] Cannot serialise message {} for chat {}: {}", record.id(), peerId, e.getOriginalMessage());
            return false;
        } catch (DataAccessException e) {
            log.error("[DB] Error saving message {} for chat {}: {}", record.id(), peerId, e.getMessage());
            return false;
        }
    }

    @Override
    public String mode() {
        return "DATABASE";
    }
}
