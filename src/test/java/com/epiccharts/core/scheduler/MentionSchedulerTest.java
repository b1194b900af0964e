package com.epiccharts.core.scheduler;

import com.epiccharts.core.config.BotProperties;
import com.epiccharts.core.model.Mention;
import com.epiccharts.core.model.MentionOutcome;
import com.epiccharts.core.pipeline.MentionPoller;
import com.epiccharts.core.pipeline.MentionProcessor;
import com.epiccharts.core.render.ChartRenderer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class MentionSchedulerTest {

    private MentionPoller poller;
    private MentionProcessor processor;
    private ChartRenderer renderer;
    private BotProperties properties;
    private MentionScheduler scheduler;

    private final Mention first = new Mention("1", "u", "make it epic", "p1");
    private final Mention second = new Mention("2", "u", "make it epic", "p2");

    @BeforeEach
    void setUp() {
        poller = mock(MentionPoller.class);
        processor = mock(MentionProcessor.class);
        renderer = mock(ChartRenderer.class);
        properties = new BotProperties();
        properties.setPollIntervalMs(60_000);
        scheduler = new MentionScheduler(poller, processor, renderer, properties);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    @DisplayName("start polls immediately and processes each mention in order")
    void firstCycleRunsImmediately() {
        when(poller.poll()).thenReturn(List.of(first, second));

        scheduler.start();

        verify(processor, timeout(2000)).process(second);
        InOrder order = inOrder(poller, processor);
        order.verify(poller).poll();
        order.verify(processor).process(first);
        order.verify(processor).process(second);
        assertTrue(scheduler.isRunning());
    }

    @Test
    @DisplayName("short interval keeps polling after a cycle that threw")
    void survivesFailedCycle() {
        properties.setPollIntervalMs(10);
        when(poller.poll()).thenThrow(new IllegalStateException("boom")).thenReturn(List.of());

        scheduler.start();

        verify(poller, timeout(2000).atLeast(3)).poll();
    }

    @Test
    @DisplayName("shutdown waits for the in-flight mention, then closes the renderer")
    void shutdownWaitsForInFlight() throws Exception {
        var started = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        var finished = new AtomicBoolean();
        when(poller.poll()).thenReturn(List.of(first, second));
        when(processor.process(first)).thenAnswer(invocation -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            finished.set(true);
            return MentionOutcome.REPLIED;
        });

        scheduler.start();
        assertTrue(started.await(2, TimeUnit.SECONDS));

        var stopper = new Thread(scheduler::shutdown);
        stopper.start();
        Thread.sleep(100);
        verify(renderer, never()).shutdown();
        release.countDown();
        stopper.join(5000);

        assertTrue(finished.get());
        assertFalse(scheduler.isRunning());
        verify(processor, never()).process(second);
        verify(renderer).shutdown();
    }

    @Test
    @DisplayName("shutdown is idempotent and works without start")
    void idempotentShutdown() {
        scheduler.shutdown();
        scheduler.shutdown();

        verify(renderer, times(1)).shutdown();
        verifyNoInteractions(poller);
        assertThrows(IllegalStateException.class, scheduler::start);
    }

    @Test
    @DisplayName("start twice keeps a single poll loop")
    void doubleStart() {
        when(poller.poll()).thenReturn(List.of());

        scheduler.start();
        scheduler.start();

        verify(poller, timeout(2000)).poll();
        verify(poller, after(200).times(1)).poll();
    }

    @Test
    @DisplayName("an Error during a mention stops polling and reaches the fatal handler")
    void errorEscalatesAndStopsPolling() throws Exception {
        var escalated = new AtomicReference<Error>();
        var reported = new CountDownLatch(1);
        scheduler = new MentionScheduler(poller, processor, renderer, properties, error -> {
            escalated.set(error);
            reported.countDown();
        });
        properties.setPollIntervalMs(10);
        var fontFailure = new InternalError("fontconfig missing");
        when(poller.poll()).thenReturn(List.of(first));
        when(processor.process(first)).thenThrow(fontFailure);

        scheduler.start();

        assertTrue(reported.await(2, TimeUnit.SECONDS));
        assertSame(fontFailure, escalated.get());
        assertFalse(scheduler.isRunning());
        verify(poller, after(200).times(1)).poll();
    }
}
