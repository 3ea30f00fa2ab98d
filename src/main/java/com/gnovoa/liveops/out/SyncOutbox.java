package com.gnovoa.liveops.out;

import com.gnovoa.liveops.events.LiveOpsEvent;
import com.gnovoa.liveops.runner.LiveOpsProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Bounded in-memory queue between committed commands and the sync targets.
 *
 * <p>{@link #publish} never blocks: when the queue is full the event is dropped and logged. One
 * dispatcher thread hands each event to every interested target, retrying a failing target with
 * linear backoff up to {@code maxAttempts} times before giving up on it for that event.
 */
@Component
public class SyncOutbox implements EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(SyncOutbox.class);

    private final List<SyncTarget> targets;
    private final int maxAttempts;
    private final Duration backoff;
    private final BlockingQueue<LiveOpsEvent> queue;

    private volatile boolean running;
    private Thread dispatcherThread;

    @Autowired
    public SyncOutbox(List<SyncTarget> targets, LiveOpsProperties props) {
        this(targets, props.sync().maxAttempts(), props.sync().backoff(), props.sync().queueCapacity());
    }

    public SyncOutbox(List<SyncTarget> targets, int maxAttempts, Duration backoff, int capacity) {
        this.targets = List.copyOf(targets);
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
        this.queue = new LinkedBlockingQueue<>(capacity);
    }

    @PostConstruct
    void start() {
        running = true;
        dispatcherThread = new Thread(this::dispatchLoop, "liveops-sync-dispatcher");
        dispatcherThread.setDaemon(true);
        dispatcherThread.start();
        log.info("Sync outbox started with targets {}", targets.stream().map(SyncTarget::name).toList());
    }

    @PreDestroy
    void stop() {
        running = false;
        if (dispatcherThread != null) {
            dispatcherThread.interrupt();
        }
    }

    @Override
    public void publish(LiveOpsEvent event) {
        Objects.requireNonNull(event, "event is required");
        if (!queue.offer(event)) {
            log.warn("Sync outbox full, dropping {} for match {} in tournament {}",
                    event.type(), event.matchId(), event.tournamentId());
        }
    }

    int pending() {
        return queue.size();
    }

    private void dispatchLoop() {
        while (running) {
            try {
                dispatch(queue.take());
            } catch (InterruptedException ex) {
                if (!running) {
                    Thread.currentThread().interrupt();
                    return;
                }
            } catch (RuntimeException ex) {
                log.error("Sync dispatcher failed while dispatching queued event", ex);
            }
        }
    }

    void dispatch(LiveOpsEvent event) throws InterruptedException {
        for (SyncTarget target : targets) {
            if (!target.accepts(event)) continue;
            deliverWithRetry(target, event);
        }
    }

    private void deliverWithRetry(SyncTarget target, LiveOpsEvent event) throws InterruptedException {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                target.deliver(event);
                return;
            } catch (RuntimeException ex) {
                if (attempt == maxAttempts) {
                    log.warn("Sync to {} failed after {} attempts for {} of match {}: {}",
                            target.name(), attempt, event.type(), event.matchId(), ex.getMessage());
                    return;
                }
                log.debug("Sync to {} attempt {} failed, retrying", target.name(), attempt, ex);
                Thread.sleep(backoff.toMillis() * attempt);
            }
        }
    }
}
