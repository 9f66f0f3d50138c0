package com.sandkev.chatscrape.app;

import com.sandkev.chatscrape.config.ScraperProperties;
import com.sandkev.chatscrape.ingest.IngestionOrchestrator;
import com.sandkev.chatscrape.ingest.IngestionReport;
import com.sandkev.chatscrape.ingest.IngestionRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;

/** Runs the configured job once the context is up and records the exit status. */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "scraper.runner", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ScrapeRunner implements ApplicationRunner, ExitCodeGenerator {

    private final ScraperProperties props;
    private final IngestionOrchestrator orchestrator;
    private final DialogLister dialogLister;
    private final ShutdownCoordinator shutdown;

    private volatile int exitCode = ExitCodes.OK;

    @Override
    public void run(ApplicationArguments args) {
        long started = System.nanoTime();
        String job = props.listChats() ? "list-chats" : "scrape";
        shutdown.install(orchestrator::cancel);
        try {
            if (props.listChats()) {
                dialogLister.list(props.listFormat());
            } else {
                IngestionReport report = orchestrator.run(toRequest(props));
                log.info("Done: {} messages from {}, cursor {}{}",
                        report.totalProcessed(), report.peer().displayName(), report.cursor(),
                        report.cancelled() ? " (interrupted)" : "");
            }
        } catch (RuntimeException e) {
            exitCode = ExitCodes.FATAL;
            log.error("[fatal] {} failed: {}", job, e.getMessage(), e);
        } finally {
            Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
            log.info("[exit] {} finished in {}s", job, String.format("%.1f", elapsed.toMillis() / 1000.0));
            shutdown.runFinished();
        }
    }

    static IngestionRequest toRequest(ScraperProperties props) {
        return new IngestionRequest(props.target().trim(), props.lookback(), props.tail(), props.reset());
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
