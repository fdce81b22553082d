package com.alertrouter.api.controller;

import com.alertrouter.alert.AlertService;
import com.alertrouter.api.dto.request.AcknowledgeAlertRequest;
import com.alertrouter.api.dto.request.CreateAlertRequest;
import com.alertrouter.api.dto.request.ResolveAlertRequest;
import com.alertrouter.domain.model.Alert;
import com.alertrouter.domain.model.AlertCreationResult;
import com.alertrouter.domain.model.AlertHistoryEntry;
import com.alertrouter.domain.model.AlertStatistics;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for raising and handling alerts.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/alerts} -- create an alert (202 when queued, 429 when rate limited)</li>
 *   <li>{@code POST /api/alerts/{id}/acknowledge} -- acknowledge an active alert</li>
 *   <li>{@code POST /api/alerts/{id}/resolve} -- resolve an active alert</li>
 *   <li>{@code GET /api/alerts/{id}} -- one active alert</li>
 *   <li>{@code GET /api/alerts/active} -- all active alerts</li>
 *   <li>{@code GET /api/alerts/history} -- most recent lifecycle history entries</li>
 *   <li>{@code GET /api/alerts/statistics} -- counts by priority, action and channel</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/alerts")
public class AlertController {

    private final AlertService alertService;

    public AlertController(AlertService alertService) {
        this.alertService = alertService;
    }

    @PostMapping
    public ResponseEntity<AlertCreationResult> createAlert(@Valid @RequestBody CreateAlertRequest request) {
        AlertCreationResult result = alertService.createAlert(request);
        HttpStatus status = result.isSuccess() ? HttpStatus.ACCEPTED : HttpStatus.TOO_MANY_REQUESTS;
        return ResponseEntity.status(status).body(result);
    }

    @PostMapping("/{alertId}/acknowledge")
    public Alert acknowledge(@PathVariable String alertId, @Valid @RequestBody AcknowledgeAlertRequest request) {
        return alertService.acknowledgeAlert(alertId, request.getUserId(), request.getComment());
    }

    @PostMapping("/{alertId}/resolve")
    public Alert resolve(@PathVariable String alertId, @Valid @RequestBody ResolveAlertRequest request) {
        return alertService.resolveAlert(alertId, request.getUserId(), request.getResolution());
    }

    @GetMapping("/active")
    public List<Alert> getActiveAlerts() {
        return alertService.getActiveAlerts();
    }

    @GetMapping("/history")
    public List<AlertHistoryEntry> getHistory(@RequestParam(defaultValue = "100") int limit) {
        List<AlertHistoryEntry> history = alertService.getHistory();
        int from = Math.max(0, history.size() - Math.max(0, limit));
        return history.subList(from, history.size());
    }

    @GetMapping("/statistics")
    public AlertStatistics getStatistics() {
        return alertService.getStatistics();
    }

    @GetMapping("/{alertId}")
    public Alert getAlert(@PathVariable String alertId) {
        return alertService.getAlert(alertId);
    }
}
