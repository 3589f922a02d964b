package com.lifecycle.engine.projection;

import com.lifecycle.engine.logging.LoggingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Polls the log and hands each projector to a worker thread.
 * 
 * At most one dispatch per projector is queued or running at a time; a
 * projector still busy from the previous poll is left alone. On shutdown
 * the scheduler stops polling and waits for in-flight dispatches.
 */
public class ProjectorScheduler {

    private static final Logger log = LoggerFactory.getLogger(ProjectorScheduler.class);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final ProjectorRegistry registry;
    private final ProjectorDispatcher dispatcher;
    private final ExecutorService workers;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    public ProjectorScheduler(ProjectorRegistry registry, ProjectorDispatcher dispatcher, int workerThreads) {
        this.registry = registry;
        this.dispatcher = dispatcher;
        AtomicInteger counter = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(workerThreads, runnable -> {
            Thread thread = new Thread(runnable, "projector-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Scheduled(fixedDelayString = "${lifecycle.projectors.poll-interval:PT1S}")
    public void poll() {
        if (shuttingDown.get()) {
            return;
        }
        for (String name : registry.names()) {
            if (!inFlight.add(name)) {
                continue;
            }
            try {
                workers.execute(() -> run(name));
            } catch (RejectedExecutionException e) {
                inFlight.remove(name);
                log.warn("Dispatch of {} rejected: {}", name, e.getMessage());
            }
        }
    }

    private void run(String name) {
        try {
            dispatcher.dispatch(name);
        } catch (RuntimeException e) {
            log.error("Dispatch of {} failed unexpectedly: {}", name, e.getMessage(), e);
        } finally {
            inFlight.remove(name);
            LoggingContext.clearAll();
        }
    }

    public int getInFlightCount() {
        return inFlight.size();
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    @EventListener(ContextClosedEvent.class)
    @Order(0)
    public void onShutdown() {
        log.info("Stopping projector scheduler ({} dispatches in flight)", inFlight.size());
        shuttingDown.set(true);
        workers.shutdown();
        try {
            if (!workers.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Shutdown timeout reached with dispatches still running: {}", inFlight);
                workers.shutdownNow();
            } else {
                log.info("Projector scheduler stopped");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for dispatches to finish");
            workers.shutdownNow();
        }
    }
}
