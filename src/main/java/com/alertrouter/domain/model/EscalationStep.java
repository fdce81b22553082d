package com.alertrouter.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One rung of the escalation chain. The rung's index in the chain is its escalation level;
 * {@code delayMs} is how long an alert waits unacknowledged before it is escalated to it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EscalationStep {

    private String role;
    private long delayMs;
}
