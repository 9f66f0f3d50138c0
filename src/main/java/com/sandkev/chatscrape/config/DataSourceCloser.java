package com.sandkev.chatscrape.config;

import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;

import java.util.concurrent.atomic.AtomicBoolean;

@Slf4j
public class DataSourceCloser implements DisposableBean {

    private final HikariDataSource dataSource;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public DataSourceCloser(HikariDataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void destroy() {
        if (!closed.compareAndSet(false, true)) return;
        try {
            dataSource.close();
            log.info("[db] Connection closed");
        } catch (RuntimeException e) {
            log.warn("[db] Error closing connection: {}", e.getMessage());
        }
    }

    public boolean isClosed() {
        return closed.get();
    }
}
