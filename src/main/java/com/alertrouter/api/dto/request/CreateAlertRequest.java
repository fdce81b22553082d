package com.alertrouter.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Input of {@code createAlert}, used both by the REST API and by internal producers such as
 * the escalation manager.
 *
 * <p>{@code priority} is the lower-case or upper-case priority name; omitted means medium.
 * When {@code template} names a known template, its subject, body, priority and channels
 * replace the corresponding fields here.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CreateAlertRequest {

    @NotBlank
    private String type;

    private String priority;
    private String title;
    private String message;

    @Builder.Default
    private Map<String, Object> data = new LinkedHashMap<>();

    private String source;

    @Builder.Default
    private Set<String> tags = new LinkedHashSet<>();

    private String template;
    private String createdBy;
    private String correlationId;
}
