package com.sandkev.chatscrape.shared.http;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.lang.Nullable;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Retries a blocking WebClient call while the bridge answers 429 or 503,
 * honouring Retry-After when present.
 */
@Slf4j
public final class HttpRetrySupport {

    static final int MAX_RETRIES = 5;
    private static final long INITIAL_BACKOFF_MS = 1_000;
    private static final long MAX_BACKOFF_MS = 15_000;

    private HttpRetrySupport() {}

    public static <T> T withRetry(String path, Supplier<T> call) {
        return withRetry(path, call, INITIAL_BACKOFF_MS);
    }

    static <T> T withRetry(String path, Supplier<T> call, long initialBackoffMs) {
        long backoffMs = initialBackoffMs;
        for (int attempt = 0; ; attempt++) {
            try {
                return call.get();
            } catch (WebClientResponseException e) {
                if (!isRetryable(e) || attempt >= MAX_RETRIES) throw e;

                Long retryAfterMs = parseRetryAfterToMillis(e.getHeaders().getFirst(HttpHeaders.RETRY_AFTER));
                long sleepMs = backoffMs + ThreadLocalRandom.current().nextLong(0, Math.max(1, backoffMs / 2));
                if (retryAfterMs != null) sleepMs = Math.max(sleepMs, retryAfterMs);

                log.warn("{} {} attempt {}/{}; sleeping {} ms", e.getStatusCode().value(), path,
                        attempt + 1, MAX_RETRIES, sleepMs);
                if (!sleepQuietly(sleepMs)) throw e;
                backoffMs = Math.min((long) (backoffMs * 1.8), MAX_BACKOFF_MS);
            }
        }
    }

    static boolean isRetryable(WebClientResponseException e) {
        int status = e.getStatusCode().value();
        return status == HttpStatus.TOO_MANY_REQUESTS.value() || status == HttpStatus.SERVICE_UNAVAILABLE.value();
    }

    /** Seconds or an RFC 1123 date; null when absent or unreadable. */
    @Nullable
    public static Long parseRetryAfterToMillis(@Nullable String v) {
        if (v == null || v.isBlank()) return null;
        String value = v.trim();
        if (value.chars().allMatch(Character::isDigit)) {
            try {
                long seconds = Long.parseLong(value);
                return seconds > Long.MAX_VALUE / 1000L ? null : seconds * 1000L;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        try {
            long target = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant().toEpochMilli();
            return Math.max(target - System.currentTimeMillis(), 0L);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /** @return false if interrupted while sleeping */
    public static boolean sleepQuietly(long ms) {
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
