package com.sandkev.chatscrape.config;

import org.springframework.boot.autoconfigure.condition.ConditionOutcome;
import org.springframework.boot.autoconfigure.condition.SpringBootCondition;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.core.type.AnnotatedTypeMetadata;

public class FileStorageCondition extends SpringBootCondition {

    @Override
    public ConditionOutcome getMatchOutcome(ConditionContext context, AnnotatedTypeMetadata metadata) {
        return DatabaseStorageCondition.databaseSelected(context.getEnvironment())
                ? ConditionOutcome.noMatch("database storage selected")
                : ConditionOutcome.match("file storage selected");
    }
}
