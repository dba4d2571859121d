package com.tasktracker.guard.controller;

import com.tasktracker.guard.model.IpListRequest;
import com.tasktracker.guard.model.IpReputation;
import com.tasktracker.guard.model.ThreatRecord;
import com.tasktracker.guard.model.ThreatReport;
import com.tasktracker.guard.model.ThreatSeverity;
import com.tasktracker.guard.model.ThreatSummary;
import com.tasktracker.guard.service.ThreatIntelligenceService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/threats")
@Tag(name = "Threats", description = "IP reputation, threat reports and allow/deny lists")
public class ThreatIntelligenceController {

    private final ThreatIntelligenceService threatService;

    public ThreatIntelligenceController(ThreatIntelligenceService threatService) {
        this.threatService = threatService;
    }

    @GetMapping("/reputation/{ip}")
    @Operation(summary = "Check an IP's reputation",
               description = "Whitelisted addresses are always safe. Unknown addresses go through pattern analysis, "
                       + "which may record a new threat.")
    public ResponseEntity<IpReputation> checkReputation(
            @Parameter(description = "IP address", example = "198.51.100.23") @PathVariable String ip) {
        return ResponseEntity.ok(threatService.checkIpReputation(ip));
    }

    @PostMapping
    @Operation(summary = "Report a threat",
               description = "Creates a record, or refreshes the existing one for the same IP and type")
    public ResponseEntity<?> reportThreat(@RequestBody ThreatReport report) {
        if (report.getIpAddress() == null || report.getIpAddress().isBlank()) {
            return badRequest("ipAddress is required", "ipAddress");
        }
        if (report.getThreatType() == null || report.getThreatType().isBlank()) {
            return badRequest("threatType is required", "threatType");
        }
        boolean stored = threatService.addThreatIntelligence(report.getIpAddress(), report.getThreatType(),
                report.getSeverity() != null ? report.getSeverity() : ThreatSeverity.MEDIUM,
                report.getThreatSource(), report.getDescription(), report.getConfidenceScore());
        return ResponseEntity.ok(result("ipAddress", report.getIpAddress(), stored));
    }

    @PostMapping("/whitelist")
    @Operation(summary = "Whitelist an IP")
    public ResponseEntity<?> whitelist(@RequestBody IpListRequest request) {
        if (request.getIpAddress() == null || request.getIpAddress().isBlank()) {
            return badRequest("ipAddress is required", "ipAddress");
        }
        boolean stored = threatService.whitelistIp(request.getIpAddress(), request.getReason());
        return ResponseEntity.ok(result("ipAddress", request.getIpAddress(), stored));
    }

    @PostMapping("/blacklist")
    @Operation(summary = "Blacklist an IP", description = "Blacklisted IPs are CRITICAL and recommended for blocking")
    public ResponseEntity<?> blacklist(@RequestBody IpListRequest request) {
        if (request.getIpAddress() == null || request.getIpAddress().isBlank()) {
            return badRequest("ipAddress is required", "ipAddress");
        }
        boolean stored = threatService.blacklistIp(request.getIpAddress(), request.getReason());
        return ResponseEntity.ok(result("ipAddress", request.getIpAddress(), stored));
    }

    @GetMapping("/summary")
    @Operation(summary = "Threat store summary")
    public ResponseEntity<ThreatSummary> getSummary() {
        return ResponseEntity.ok(threatService.getThreatSummary());
    }

    @GetMapping("/recent")
    @Operation(summary = "Most recently seen active threats")
    public ResponseEntity<List<ThreatRecord>> getRecent(
            @Parameter(description = "Maximum number of records", example = "10")
            @RequestParam(defaultValue = "0") int count) {
        return ResponseEntity.ok(threatService.getRecentThreats(count));
    }

    @GetMapping("/type/{threatType}")
    @Operation(summary = "Active threats of a type")
    public ResponseEntity<List<ThreatRecord>> getByType(
            @Parameter(description = "Threat type", example = "Brute Force") @PathVariable String threatType) {
        return ResponseEntity.ok(threatService.getThreatsByType(threatType));
    }

    @GetMapping("/severity/{severity}")
    @Operation(summary = "Active threats of a severity")
    public ResponseEntity<?> getBySeverity(
            @Parameter(description = "Severity", example = "HIGH") @PathVariable String severity) {
        ThreatSeverity parsed = ThreatSeverity.fromName(severity);
        if (parsed == null) {
            return badRequest("Unknown severity: " + severity, "severity");
        }
        return ResponseEntity.ok(threatService.getThreatsBySeverity(parsed));
    }

    @GetMapping("/types")
    @Operation(summary = "Distinct threat types")
    public ResponseEntity<List<String>> getTypes() {
        return ResponseEntity.ok(threatService.getThreatTypes());
    }

    @GetMapping("/sources")
    @Operation(summary = "Distinct threat sources")
    public ResponseEntity<List<String>> getSources() {
        return ResponseEntity.ok(threatService.getThreatSources());
    }

    @PutMapping("/{threatId}/status")
    @Operation(summary = "Activate or deactivate a threat record")
    public ResponseEntity<Map<String, Object>> updateStatus(
            @Parameter(description = "Threat ID") @PathVariable String threatId,
            @RequestParam boolean active) {
        if (!threatService.updateThreatStatus(threatId, active)) {
            return ResponseEntity.notFound().build();
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("threatId", threatId);
        response.put("active", active);
        return ResponseEntity.ok(response);
    }

    @DeleteMapping("/cleanup")
    @Operation(summary = "Delete threats not seen for the given age",
               description = "Whitelisted and blacklisted records are kept")
    public ResponseEntity<?> cleanup(
            @Parameter(description = "Age in days", example = "90")
            @RequestParam(defaultValue = "90") int daysOld) {
        if (daysOld <= 0) {
            return badRequest("daysOld must be > 0", "daysOld");
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("daysOld", daysOld);
        response.put("removed", threatService.cleanupOldThreats(daysOld));
        return ResponseEntity.ok(response);
    }

    private Map<String, Object> result(String key, Object value, boolean stored) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put(key, value);
        response.put("stored", stored);
        return response;
    }

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }
}
