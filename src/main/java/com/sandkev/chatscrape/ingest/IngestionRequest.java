package com.sandkev.chatscrape.ingest;

import java.time.Duration;
import java.util.Objects;

public record IngestionRequest(String target, Duration lookback, boolean tail, boolean reset) {

    public IngestionRequest {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(lookback, "lookback");
        if (lookback.isNegative()) {
            throw new IllegalArgumentException("lookback must not be negative: " + lookback);
        }
    }
}
