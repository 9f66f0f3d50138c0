package com.sandkev.chatscrape.jdbc;

import java.util.Locale;

/**
 * Upsert statements per database. Parameter order is the same across dialects:
 * checkpoint {@code (chat_peer_id, last_message_id)}, message
 * {@code (chat_peer_id, message_id, sent_at, payload)}.
 */
public enum SqlDialect {

    POSTGRESQL("""
            insert into scraper_state (chat_peer_id, last_message_id, last_run_at)
            values (?, ?, now())
            on conflict (chat_peer_id)
            do update set last_message_id = excluded.last_message_id, last_run_at = now()
            """, """
            insert into messages (chat_peer_id, message_id, sent_at, payload)
            values (?, ?, ?, cast(? as jsonb))
            on conflict (chat_peer_id, message_id)
            do update set payload = excluded.payload, sent_at = excluded.sent_at, updated_at = now()
            """),

    H2("""
            merge into scraper_state (chat_peer_id, last_message_id, last_run_at)
            key (chat_peer_id)
            values (?, ?, current_timestamp)
            """, """
            merge into messages (chat_peer_id, message_id, sent_at, payload, updated_at)
            key (chat_peer_id, message_id)
            values (?, ?, ?, ?, current_timestamp)
            """);

    public static final String SELECT_CHECKPOINT =
            "select last_message_id from scraper_state where chat_peer_id = ?";

    private final String checkpointUpsert;
    private final String messageUpsert;

    SqlDialect(String checkpointUpsert, String messageUpsert) {
        this.checkpointUpsert = checkpointUpsert;
        this.messageUpsert = messageUpsert;
    }

    public String checkpointUpsert() {
        return checkpointUpsert;
    }

    public String messageUpsert() {
        return messageUpsert;
    }

    public static SqlDialect fromJdbcUrl(String jdbcUrl) {
        String url = jdbcUrl == null ? "" : jdbcUrl.toLowerCase(Locale.ROOT);
        if (url.startsWith("jdbc:postgresql:")) return POSTGRESQL;
        if (url.startsWith("jdbc:h2:")) return H2;
        throw new IllegalArgumentException("Unsupported database URL: " + jdbcUrl);
    }
}
