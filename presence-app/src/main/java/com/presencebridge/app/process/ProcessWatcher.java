package com.presencebridge.app.process;

import com.presencebridge.common.channel.EventChannel;
import com.presencebridge.common.model.ProcessDetectedEvent;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Iterator;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Polls the process table and reports the first catalogued application found,
 * or the {@code "null"} sentinel when none is running. Every poll sends one
 * event; de-duplication happens downstream.
 */
@Slf4j
public class ProcessWatcher {

    private final EventChannel<ProcessDetectedEvent> sink;
    private final Supplier<Optional<DetectableCatalog>> catalogLoader;
    private final Supplier<Stream<ProcessSnapshot>> processLister;
    private final Duration pollInterval;
    private final boolean enabled;

    private ScheduledExecutorService scheduler;
    private volatile DetectableCatalog catalog;

    public ProcessWatcher(EventChannel<ProcessDetectedEvent> sink,
            Supplier<Optional<DetectableCatalog>> catalogLoader,
            Duration pollInterval,
            boolean enabled) {
        this(sink, catalogLoader, ProcessSnapshot::listRunning, pollInterval, enabled);
    }

    public ProcessWatcher(EventChannel<ProcessDetectedEvent> sink,
            Supplier<Optional<DetectableCatalog>> catalogLoader,
            Supplier<Stream<ProcessSnapshot>> processLister,
            Duration pollInterval,
            boolean enabled) {
        this.sink = sink;
        this.catalogLoader = catalogLoader;
        this.processLister = processLister;
        this.pollInterval = pollInterval;
        this.enabled = enabled;
    }

    /**
     * Load the catalog and begin polling. Returns false when detection is
     * disabled or the catalog is unavailable.
     */
    public synchronized boolean start() {
        if (!enabled) {
            log.debug("Process detection disabled");
            return false;
        }
        if (scheduler != null) {
            return true;
        }
        Optional<DetectableCatalog> loaded = catalogLoader.get();
        if (loaded.isEmpty()) {
            log.warn("No detectables catalog available, process detection disabled");
            return false;
        }
        catalog = loaded.get();
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "process-watcher");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::tick, 0, pollInterval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Process watcher started ({} detectables, every {} ms)", catalog.size(), pollInterval.toMillis());
        return true;
    }

    public synchronized void stop() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        scheduler = null;
        log.info("Process watcher stopped");
    }

    public synchronized boolean isRunning() {
        return scheduler != null;
    }

    private void tick() {
        try {
            pollOnce();
        } catch (RuntimeException e) {
            // An escaped exception would cancel the periodic task.
            log.warn("Process poll failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Run one detection pass and send its result.
     */
    public ProcessDetectedEvent pollOnce() {
        ProcessDetectedEvent event = detect();
        if (!sink.send(event)) {
            log.debug("Process channel closed, dropping {}", event);
        }
        return event;
    }

    ProcessDetectedEvent detect() {
        DetectableCatalog current = catalog;
        if (current == null) {
            return ProcessDetectedEvent.none();
        }
        try (Stream<ProcessSnapshot> processes = processLister.get()) {
            Iterator<ProcessSnapshot> it = processes.iterator();
            while (it.hasNext()) {
                ProcessSnapshot process = it.next();
                Optional<DetectableApp> app = current.match(process.executable());
                if (app.isPresent()) {
                    return ProcessDetectedEvent.detected(app.get().getId(), app.get().getName(),
                            Long.toString(process.startMillis()), process.pid());
                }
            }
        }
        return ProcessDetectedEvent.none();
    }

    void useCatalog(DetectableCatalog catalog) {
        this.catalog = catalog;
    }
}
