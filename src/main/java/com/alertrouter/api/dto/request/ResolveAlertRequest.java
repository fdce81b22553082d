package com.alertrouter.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ResolveAlertRequest {

    @NotBlank
    private String userId;

    private String resolution;
}
