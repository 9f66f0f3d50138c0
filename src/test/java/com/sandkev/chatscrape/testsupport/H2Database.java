package com.sandkev.chatscrape.testsupport;

import org.flywaydb.core.Flyway;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;
import java.util.UUID;

/** Fresh in-memory H2 database with the application schema migrated in. */
public final class H2Database {

    private H2Database() {}

    public static DataSource migrated() {
        var ds = new DriverManagerDataSource(
                "jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1", "sa", "");
        Flyway.configure()
                .dataSource(ds)
                .locations("classpath:db/migration/h2")
                .load()
                .migrate();
        return ds;
    }

    public static JdbcTemplate jdbc() {
        return new JdbcTemplate(migrated());
    }
}
