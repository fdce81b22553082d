package com.alertrouter.alert;

import com.alertrouter.domain.model.Alert;
import lombok.Builder;
import lombok.Getter;

/**
 * Entry of the {@link AlertQueue}: the live alert plus its FIFO sequence number.
 */
@Getter
@Builder
public class QueuedAlert {

    private final Alert alert;

    /** Tie-breaker within one priority level; lower dequeues first. */
    private final long sequenceNumber;

    /** Epoch millis at enqueue, for queue latency logging. */
    private final long enqueuedAt;
}
