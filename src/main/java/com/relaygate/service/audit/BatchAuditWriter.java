package com.relaygate.service.audit;

import com.relaygate.config.RelaygateProperties;
import com.relaygate.model.CallEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Buffers call events and writes them to the durable store in bulk, when a batch
 * fills up or on the flush interval, whichever comes first.
 *
 * A failed batch is kept and retried ahead of newer events. Flushes are serialized,
 * so two triggers firing together cannot write the same events twice.
 */
@Slf4j
@Service
public class BatchAuditWriter {

    private static final String LOG_PREFIX = "[Audit]";
    private static final int EXECUTOR_TERMINATION_TIMEOUT_SECONDS = 5;

    private final AuditPersistenceService persistence;
    private final RelaygateProperties.AuditConfig config;

    private final BlockingQueue<CallEvent> queue;
    // Events that arrived while the queue stayed full past the enqueue timeout
    private final Queue<CallEvent> overflow = new ConcurrentLinkedQueue<>();
    private final ReentrantLock flushLock = new ReentrantLock();
    private final List<CallEvent> pending = new ArrayList<>();
    private final AtomicBoolean flushScheduled = new AtomicBoolean();
    private final AtomicLong written = new AtomicLong();
    private final AtomicLong failedFlushes = new AtomicLong();
    private volatile int pendingSize;
    private int consecutiveFailures;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "audit-writer");
        t.setDaemon(true);
        return t;
    });

    public BatchAuditWriter(AuditPersistenceService persistence, RelaygateProperties properties) {
        this.persistence = persistence;
        this.config = properties.getAudit();
        this.queue = new LinkedBlockingQueue<>(config.getQueueCapacity());
    }

    @PostConstruct
    void start() {
        if (!config.isEnabled()) {
            log.info("{} Durable audit disabled", LOG_PREFIX);
            return;
        }
        long interval = config.getFlushInterval().toMillis();
        scheduler.scheduleWithFixedDelay(this::flushSafely, interval, interval, TimeUnit.MILLISECONDS);
        log.info("{} Batch writer started: batchSize={}, flushInterval={}, queueCapacity={}",
                LOG_PREFIX, config.getBatchSize(), config.getFlushInterval(), config.getQueueCapacity());
    }

    @PreDestroy
    void stop() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(EXECUTOR_TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        if (config.isEnabled()) {
            flush();
            int left = backlog();
            if (left > 0) {
                log.error("{} Shutting down with {} audit records not persisted", LOG_PREFIX, left);
            }
        }
    }

    /**
     * Hand an event to the writer. Waits at most the enqueue timeout when the queue is
     * full and never drops the event.
     */
    public void enqueue(CallEvent event) {
        if (!config.isEnabled()) {
            return;
        }
        boolean accepted;
        try {
            accepted = queue.offer(event, config.getEnqueueTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            accepted = false;
        }
        if (!accepted) {
            overflow.add(event);
            log.warn("{} Queue full for {}, event {} parked in overflow ({} parked)",
                    LOG_PREFIX, config.getEnqueueTimeout(), event.getEventId(), overflow.size());
        }
        if (queue.size() + overflow.size() >= config.getBatchSize()) {
            requestFlush();
        }
    }

    /**
     * Write everything currently buffered, one bulk write per batch.
     * Stops at the first failure, keeping that batch for the next attempt.
     *
     * @return true when the buffer was fully written
     */
    public boolean flush() {
        flushLock.lock();
        try {
            flushScheduled.set(false);
            while (true) {
                fillPending();
                pendingSize = pending.size();
                if (pending.isEmpty()) {
                    return true;
                }
                int batch = pending.size();
                try {
                    int inserted = persistence.persist(List.copyOf(pending));
                    pending.clear();
                    pendingSize = 0;
                    written.addAndGet(inserted);
                    if (consecutiveFailures > 0) {
                        log.info("{} Persistence recovered after {} failed flush(es)", LOG_PREFIX, consecutiveFailures);
                    }
                    consecutiveFailures = 0;
                    log.debug("{} Flushed {} records ({} new)", LOG_PREFIX, batch, inserted);
                } catch (RuntimeException e) {
                    consecutiveFailures++;
                    failedFlushes.incrementAndGet();
                    if (consecutiveFailures > config.getMaxFlushRetries()) {
                        log.error("{} Flush of {} records failed {} times in a row, still retaining them: {}",
                                LOG_PREFIX, batch, consecutiveFailures, e.getMessage());
                    } else {
                        log.warn("{} Flush of {} records failed (attempt {}), will retry in {}: {}",
                                LOG_PREFIX, batch, consecutiveFailures, config.getRetryBackoff(), e.getMessage());
                    }
                    scheduleRetry();
                    return false;
                }
            }
        } finally {
            flushLock.unlock();
        }
    }

    /**
     * Events accepted but not yet written.
     */
    public int backlog() {
        return pendingSize + queue.size() + overflow.size();
    }

    public long getWrittenCount() {
        return written.get();
    }

    public long getFailedFlushCount() {
        return failedFlushes.get();
    }

    // Caller holds flushLock. A retained batch goes first, then overflow, then the queue.
    private void fillPending() {
        int room = config.getBatchSize() - pending.size();
        while (room > 0) {
            CallEvent parked = overflow.poll();
            if (parked == null) {
                break;
            }
            pending.add(parked);
            room--;
        }
        if (room > 0) {
            queue.drainTo(pending, room);
        }
    }

    private void requestFlush() {
        if (flushScheduled.compareAndSet(false, true)) {
            try {
                scheduler.execute(this::flushSafely);
            } catch (RejectedExecutionException e) {
                flushScheduled.set(false);
                log.debug("{} Flush not scheduled, writer is stopping", LOG_PREFIX);
            }
        }
    }

    private void scheduleRetry() {
        try {
            scheduler.schedule(this::flushSafely, config.getRetryBackoff().toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("{} Retry not scheduled, writer is stopping", LOG_PREFIX);
        }
    }

    // A throwing task would cancel the periodic schedule
    private void flushSafely() {
        try {
            flush();
        } catch (RuntimeException e) {
            log.error("{} Unexpected flush error", LOG_PREFIX, e);
        }
    }
}
