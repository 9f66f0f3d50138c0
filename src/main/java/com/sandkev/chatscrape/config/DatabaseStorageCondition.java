package com.sandkev.chatscrape.config;

import org.springframework.boot.autoconfigure.condition.ConditionOutcome;
import org.springframework.boot.autoconfigure.condition.SpringBootCondition;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.core.env.Environment;
import org.springframework.core.type.AnnotatedTypeMetadata;
import org.springframework.util.StringUtils;

/**
 * Matches when the run stores into the database: {@code scraper.storage=database},
 * or no explicit storage and a {@code scraper.database.url} is present.
 * Same rule as {@link ScraperProperties#effectiveStorage()}.
 */
public class DatabaseStorageCondition extends SpringBootCondition {

    @Override
    public ConditionOutcome getMatchOutcome(ConditionContext context, AnnotatedTypeMetadata metadata) {
        return databaseSelected(context.getEnvironment())
                ? ConditionOutcome.match("database storage selected")
                : ConditionOutcome.noMatch("file storage selected");
    }

    static boolean databaseSelected(Environment env) {
        String storage = env.getProperty("scraper.storage");
        if (StringUtils.hasText(storage)) {
            return StorageMode.DATABASE.name().equalsIgnoreCase(storage.trim());
        }
        return StringUtils.hasText(env.getProperty("scraper.database.url"));
    }
}
