package com.alertrouter.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Provenance of an alert and the template flags applied to it.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AlertMetadata {

    private String createdBy;
    private String correlationId;
    private String environment;

    /** Name of the template applied at creation, null when none was used. */
    private String template;

    /** Whether an unacknowledged alert should walk the escalation chain. */
    private boolean escalate;
}
