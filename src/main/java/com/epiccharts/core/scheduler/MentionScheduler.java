package com.epiccharts.core.scheduler;

import com.epiccharts.core.config.BotProperties;
import com.epiccharts.core.model.Mention;
import com.epiccharts.core.pipeline.MentionPoller;
import com.epiccharts.core.pipeline.MentionProcessor;
import com.epiccharts.core.render.ChartRenderer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Drives the bot: one poll, then each found mention processed to completion in turn, then
 * a fixed delay before the next poll.
 * <p>
 * A single scheduler thread means at most one cycle is ever in flight. {@link #shutdown()}
 * stops scheduling, lets the current mention finish, then releases the renderer.
 * <p>
 * An {@link Error} out of a cycle stops polling and is handed to the fatal-error handler.
 * By default that rethrows it on a fresh thread so the JVM's default uncaught-exception
 * handler runs the process shutdown.
 */
@Service
public class MentionScheduler {

    private static final Logger log = LoggerFactory.getLogger(MentionScheduler.class);

    private static final long SHUTDOWN_WAIT_SECONDS = 120;

    private final MentionPoller poller;
    private final MentionProcessor processor;
    private final ChartRenderer renderer;
    private final BotProperties properties;
    private final Consumer<Error> fatalErrorHandler;

    private ScheduledExecutorService executor;
    private ScheduledFuture<?> pollTask;
    private volatile boolean running;
    private boolean stopped;

    public MentionScheduler(MentionPoller poller, MentionProcessor processor,
                            ChartRenderer renderer, BotProperties properties) {
        this(poller, processor, renderer, properties, MentionScheduler::escalate);
    }

    MentionScheduler(MentionPoller poller, MentionProcessor processor, ChartRenderer renderer,
                     BotProperties properties, Consumer<Error> fatalErrorHandler) {
        this.poller = poller;
        this.processor = processor;
        this.renderer = renderer;
        this.properties = properties;
        this.fatalErrorHandler = fatalErrorHandler;
    }

    public synchronized void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }
        if (stopped) {
            throw new IllegalStateException("Scheduler has been shut down");
        }
        running = true;
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            var thread = new Thread(r, "mention-poller");
            thread.setDaemon(false);
            return thread;
        });
        pollTask = executor.scheduleWithFixedDelay(this::runCycle, 0,
                properties.getPollIntervalMs(), TimeUnit.MILLISECONDS);
        log.info("Polling for mentions every {}s", properties.getPollIntervalMs() / 1000.0);
    }

    /**
     * One poll followed by sequential processing of what it found.
     */
    void runCycle() {
        if (!running) {
            return;
        }
        try {
            List<Mention> mentions = poller.poll();
            for (Mention mention : mentions) {
                if (!running) {
                    log.info("Shutdown requested; {} mention(s) left for the next run", mentions.size());
                    break;
                }
                processor.process(mention);
            }
        } catch (RuntimeException e) {
            // keep the fixed-delay task alive
            log.error("Unexpected error in poll cycle: {}", e.getMessage(), e);
        } catch (Error e) {
            running = false;
            log.error("Fatal error in poll cycle, polling stopped: {}", e, e);
            fatalErrorHandler.accept(e);
        }
    }

    /**
     * Rethrows on a new thread. Shutdown waits on this executor, so it must not run here.
     */
    private static void escalate(Error error) {
        var thread = new Thread(() -> {
            throw error;
        }, "mention-poller-fatal");
        thread.start();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Stops polling, waits for the in-flight mention, and closes the headless browser.
     * Safe to call more than once.
     */
    @PreDestroy
    public void shutdown() {
        ScheduledExecutorService toStop;
        synchronized (this) {
            if (stopped) {
                return;
            }
            stopped = true;
            running = false;
            if (pollTask != null) {
                pollTask.cancel(false);
            }
            toStop = executor;
        }
        log.info("Shutting down...");
        if (toStop != null) {
            toStop.shutdown();
            try {
                if (!toStop.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                    log.warn("Poll cycle did not finish within {}s, interrupting", SHUTDOWN_WAIT_SECONDS);
                    toStop.shutdownNow();
                }
            } catch (InterruptedException e) {
                toStop.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        renderer.shutdown();
    }
}
