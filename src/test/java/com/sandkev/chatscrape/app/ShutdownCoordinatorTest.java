package com.sandkev.chatscrape.app;

import com.sandkev.chatscrape.config.ScraperProperties;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ShutdownCoordinatorTest {

    private final ConfigurableApplicationContext context = mock(ConfigurableApplicationContext.class);

    private static ScraperProperties props(String grace) {
        return new Binder(new MapConfigurationPropertySource(Map.of(
                "scraper.target", "chat",
                "scraper.shutdown-grace", grace,
                "scraper.source.base-url", "http://localhost:1",
                "scraper.source.api-id", "1",
                "scraper.source.api-hash", "h")))
                .bind("scraper", ScraperProperties.class).get();
    }

    @Test
    void signalCancelsWaitsForRunThenClosesContext() throws Exception {
        when(context.isActive()).thenReturn(true);
        var coordinator = new ShutdownCoordinator(context, props("5s"));
        var cancels = new AtomicInteger();

        CompletableFuture<Integer> exit = CompletableFuture.supplyAsync(() -> coordinator.onSignal(cancels::incrementAndGet));
        Thread.sleep(100);
        assertThat(exit).isNotDone();

        coordinator.runFinished();

        assertThat(exit.get(5, TimeUnit.SECONDS)).isEqualTo(ExitCodes.OK);
        assertThat(cancels).hasValue(1);
        assertThat(coordinator.isSignalled()).isTrue();
        verify(context).close();
    }

    @Test
    void runThatOutlivesGraceExitsNonZero() {
        var coordinator = new ShutdownCoordinator(context, props("50ms"));

        int code = coordinator.onSignal(() -> {});

        assertThat(code).isEqualTo(ExitCodes.FATAL);
        verify(context, never()).close();
    }

    @Test
    void installAndFinishLeaveNoHookBehind() {
        var coordinator = new ShutdownCoordinator(context, props("1s"));
        var cancels = new AtomicInteger();

        coordinator.install(cancels::incrementAndGet);
        coordinator.runFinished();

        assertThat(coordinator.isSignalled()).isFalse();
        assertThat(cancels).hasValue(0);
    }
}
