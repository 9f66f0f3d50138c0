package com.sandkev.chatscrape.app;

import com.sandkev.chatscrape.config.ScraperProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Turns SIGINT/SIGTERM into an orderly stop while a run is active.
 * <p>
 * The JVM hook cancels the run, waits up to the configured grace for it to
 * write its final checkpoint, closes the Spring context (and with it the
 * database pool) and halts with the resulting exit code. Halting is needed
 * because {@code System.exit} cannot be called from inside a shutdown hook.
 * Outside a run no hook is registered and the JVM stops as usual.
 */
@Slf4j
@Component
public class ShutdownCoordinator {

    private final ConfigurableApplicationContext context;
    private final Duration grace;
    private final CountDownLatch runFinished = new CountDownLatch(1);
    private final AtomicBoolean signalled = new AtomicBoolean(false);
    private Thread hook;

    public ShutdownCoordinator(ConfigurableApplicationContext context, ScraperProperties props) {
        this.context = context;
        this.grace = props.shutdownGrace();
    }

    public synchronized void install(Runnable cancelRun) {
        if (hook != null) return;
        hook = new Thread(() -> Runtime.getRuntime().halt(onSignal(cancelRun)), "scraper-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
    }

    /** Called by the runner on every exit path. */
    public synchronized void runFinished() {
        runFinished.countDown();
        if (hook == null || signalled.get()) return;
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM is already shutting down; the hook completes the exit
            log.debug("Shutdown already in progress");
        }
        hook = null;
    }

    int onSignal(Runnable cancelRun) {
        if (!signalled.compareAndSet(false, true)) return ExitCodes.OK;
        log.info("[signal] Interrupt received, finishing in-flight message and saving state");
        try {
            cancelRun.run();
        } catch (RuntimeException e) {
            log.warn("[signal] Error cancelling run: {}", e.getMessage(), e);
        }

        int code = ExitCodes.OK;
        if (!awaitRun()) {
            log.error("[signal] Run did not stop within {}; exiting without final checkpoint", grace);
            code = ExitCodes.FATAL;
        }

        try {
            if (context.isActive()) {
                int contextCode = SpringApplication.exit(context);
                if (code == ExitCodes.OK) code = contextCode;
            }
        } catch (RuntimeException e) {
            log.warn("[signal] Error closing application context: {}", e.getMessage(), e);
        }
        return code;
    }

    private boolean awaitRun() {
        try {
            return runFinished.await(grace.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    boolean isSignalled() {
        return signalled.get();
    }
}
