package com.alertrouter.domain.model;

import com.alertrouter.domain.enums.AlertAction;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/**
 * One append-only record of a lifecycle transition, holding a snapshot of the alert as it
 * was right after the transition.
 */
@Getter
@Builder
public class AlertHistoryEntry {

    private final Alert alert;
    private final AlertAction action;
    private final Instant timestamp;

    /** User who acknowledged or resolved the alert; null for system transitions. */
    private final String userId;

    /** Acknowledgement comment or resolution text. */
    private final String note;
}
