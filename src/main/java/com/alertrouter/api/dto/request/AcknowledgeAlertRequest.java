package com.alertrouter.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class AcknowledgeAlertRequest {

    @NotBlank
    private String userId;

    /** Free-text note stored with the acknowledgement. */
    private String comment;
}
