package com.sandkev.chatscrape.checkpoint;

import com.sandkev.chatscrape.jdbc.SqlDialect;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;

@Slf4j
public class JdbcCheckpointStore implements CheckpointStore {

    private final JdbcTemplate jdbc;
    private final SqlDialect dialect;

    public JdbcCheckpointStore(JdbcTemplate jdbc, SqlDialect dialect) {
        this.jdbc = jdbc;
        this.dialect = dialect;
    }

    @Override
    public long load(long peerId) {
        try {
            List<Long> rows = jdbc.query(SqlDialect.SELECT_CHECKPOINT, (rs, i) -> rs.getLong(1), peerId);
            return rows.isEmpty() ? 0L : Math.max(rows.get(0), 0L);
        } catch (DataAccessException e) {
            log.error("[db] Error reading last_id for peer {}: {}", peerId, e.getMessage());
            return 0L;
        }
    }

    @Override
    public boolean save(long peerId, long cursor) {
        try {
            jdbc.update(dialect.checkpointUpsert(), peerId, cursor);
            return true;
        } catch (DataAccessException e) {
            log.error("[db] Error saving last_id {} for peer {}: {}", cursor, peerId, e.getMessage());
            return false;
        }
    }
}
