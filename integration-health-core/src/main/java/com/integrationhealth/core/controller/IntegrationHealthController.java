package com.integrationhealth.core.controller;

import com.integrationhealth.core.model.HealthRecord;
import com.integrationhealth.core.model.HealthSummary;
import com.integrationhealth.core.model.HistoryEntry;
import com.integrationhealth.core.model.IntegrationType;
import com.integrationhealth.core.model.RetryResult;
import com.integrationhealth.core.service.IntegrationHealthService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/workspaces/{workspaceId}/integrations/health")
public class IntegrationHealthController {
    
    private final IntegrationHealthService healthService;
    
    public IntegrationHealthController(IntegrationHealthService healthService) {
        this.healthService = healthService;
    }
    
    @GetMapping
    public List<HealthRecord> getAllHealth(@PathVariable String workspaceId) {
        return healthService.getAllHealth(workspaceId(workspaceId));
    }
    
    @GetMapping("/summary")
    public HealthSummary getHealthSummary(@PathVariable String workspaceId) {
        return healthService.getHealthSummary(workspaceId(workspaceId));
    }
    
    @GetMapping("/{type}")
    public HealthRecord getHealth(@PathVariable String workspaceId, @PathVariable String type) {
        return healthService.getHealth(workspaceId(workspaceId), IntegrationType.fromValue(type));
    }
    
    @GetMapping("/{type}/history")
    public List<HistoryEntry> getHealthHistory(
            @PathVariable String workspaceId,
            @PathVariable String type,
            @RequestParam(required = false) Integer limit) {
        return healthService.getHealthHistory(workspaceId(workspaceId), IntegrationType.fromValue(type), limit);
    }
    
    @PostMapping("/{type}/check")
    public HealthRecord forceHealthCheck(@PathVariable String workspaceId, @PathVariable String type) {
        return healthService.forceHealthCheck(workspaceId(workspaceId), IntegrationType.fromValue(type));
    }
    
    @PostMapping("/{type}/retry")
    public RetryResult retryFailed(@PathVariable String workspaceId, @PathVariable String type) {
        return healthService.retryFailed(workspaceId(workspaceId), IntegrationType.fromValue(type));
    }
    
    // Only the canonical 36-character form; UUID.fromString also accepts and rewrites short forms
    private static String workspaceId(String raw) {
        UUID parsed;
        try {
            parsed = UUID.fromString(raw);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid workspace id: " + raw, e);
        }
        if (!parsed.toString().equalsIgnoreCase(raw)) {
            throw new IllegalArgumentException("Invalid workspace id: " + raw);
        }
        return parsed.toString();
    }
}
