package com.alertrouter.alert;

import com.alertrouter.domain.model.Alert;
import java.time.Clock;
import java.util.Comparator;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Pending alerts awaiting delivery, ordered so that the most urgent go out first.
 *
 * <p>Two-level ordering:
 * <ol>
 *   <li>Priority level (lower = more urgent): CRITICAL(0) before INFO(4)</li>
 *   <li>Sequence number (FIFO within the same priority)</li>
 * </ol>
 *
 * <p>A requeued alert gets a fresh sequence number and goes behind alerts of its priority
 * that were enqueued in the meantime.
 */
@Component
public class AlertQueue {

    private static final Logger log = LoggerFactory.getLogger(AlertQueue.class);

    private static final int INITIAL_CAPACITY = 64;

    private final AtomicLong sequenceCounter = new AtomicLong(0);

    private final PriorityBlockingQueue<QueuedAlert> queue = new PriorityBlockingQueue<>(
            INITIAL_CAPACITY,
            Comparator.<QueuedAlert>comparingInt(q -> q.getAlert().getPriority().getLevel())
                    .thenComparingLong(QueuedAlert::getSequenceNumber));

    private final Clock clock;

    public AlertQueue(Clock clock) {
        this.clock = clock;
    }

    public void enqueue(Alert alert) {
        queue.put(QueuedAlert.builder()
                .alert(alert)
                .sequenceNumber(sequenceCounter.incrementAndGet())
                .enqueuedAt(clock.millis())
                .build());
        log.debug("Alert enqueued: alertId={}, priority={}, queueSize={}", alert.getId(), alert.getPriority(), queue.size());
    }

    /** Puts back an entry that is not yet due, keeping its original sequence number. */
    public void requeue(QueuedAlert entry) {
        queue.put(entry);
    }

    /** Returns the most urgent entry, or null if the queue is empty. */
    public QueuedAlert poll() {
        return queue.poll();
    }

    public int size() {
        return queue.size();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    public void clear() {
        int cleared = queue.size();
        queue.clear();
        if (cleared > 0) {
            log.info("Alert queue cleared: {} alerts removed", cleared);
        }
    }
}
