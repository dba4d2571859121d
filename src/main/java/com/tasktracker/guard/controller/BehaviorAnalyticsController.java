package com.tasktracker.guard.controller;

import com.tasktracker.guard.model.ActivityRequest;
import com.tasktracker.guard.model.AnomalyDetectionResult;
import com.tasktracker.guard.model.BehaviorAnalyticsSummary;
import com.tasktracker.guard.model.BehaviorPattern;
import com.tasktracker.guard.model.BehaviorRecord;
import com.tasktracker.guard.model.UserBaseline;
import com.tasktracker.guard.model.UserBehaviorSummary;
import com.tasktracker.guard.service.AnomalyScoringService;
import com.tasktracker.guard.service.BaselineService;
import com.tasktracker.guard.service.BehaviorAnalyticsService;
import com.tasktracker.guard.service.BehaviorLoggingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/behavior")
@Tag(name = "Behavior", description = "Activity logging, anomaly analysis and behavior analytics")
public class BehaviorAnalyticsController {

    private final BehaviorLoggingService loggingService;
    private final AnomalyScoringService scoringService;
    private final BaselineService baselineService;
    private final BehaviorAnalyticsService analyticsService;

    public BehaviorAnalyticsController(BehaviorLoggingService loggingService,
                                       AnomalyScoringService scoringService,
                                       BaselineService baselineService,
                                       BehaviorAnalyticsService analyticsService) {
        this.loggingService = loggingService;
        this.scoringService = scoringService;
        this.baselineService = baselineService;
        this.analyticsService = analyticsService;
    }

    @PostMapping("/activities")
    @Operation(summary = "Record a user activity",
               description = "Enriches, scores and appends the activity to the behavior ledger. "
                       + "Returns logged=false when the write failed; the caller is never blocked.")
    public ResponseEntity<?> logActivity(@RequestBody ActivityRequest request) {
        if (request.getUserId() == null) {
            return badRequest("userId is required", "userId");
        }
        if (request.getActionType() == null || request.getActionType().isBlank()) {
            return badRequest("actionType is required", "actionType");
        }
        boolean logged = loggingService.logUserActivity(request.getUserId(), request.getUsername(),
                request.getIpAddress(), request.getUserAgent(), request.getActionType(),
                request.getResourceAccessed(), request.getDataVolumeAccessed());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("userId", request.getUserId());
        response.put("actionType", request.getActionType());
        response.put("logged", logged);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }

    @PostMapping("/analyze")
    @Operation(summary = "Analyze an activity without recording it",
               description = "Scores the activity against the user's history at the current time")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = AnomalyDetectionResult.class)))
    public ResponseEntity<?> analyze(@RequestBody ActivityRequest request) {
        if (request.getUserId() == null) {
            return badRequest("userId is required", "userId");
        }
        AnomalyDetectionResult result = scoringService.analyzeUserBehavior(
                request.getUserId(), request.getIpAddress(), request.getActionType());
        return ResponseEntity.ok(result);
    }

    @GetMapping("/summary")
    @Operation(summary = "System-wide analytics summary for the last 7 days")
    public ResponseEntity<BehaviorAnalyticsSummary> getSummary() {
        return ResponseEntity.ok(analyticsService.getAnalyticsSummary());
    }

    @GetMapping("/patterns")
    @Operation(summary = "Common behavior patterns",
               description = "Off-hours, new-location and high-velocity patterns over the last 7 days")
    public ResponseEntity<List<BehaviorPattern>> getPatterns() {
        return ResponseEntity.ok(analyticsService.getCommonPatterns());
    }

    @GetMapping("/anomalies")
    @Operation(summary = "Most anomalous activities", description = "Highest score first")
    public ResponseEntity<List<BehaviorRecord>> getAnomalies(
            @Parameter(description = "Maximum number of records", example = "20")
            @RequestParam(defaultValue = "20") int count) {
        return ResponseEntity.ok(analyticsService.getAnomalousActivities(count));
    }

    @GetMapping("/high-risk")
    @Operation(summary = "HIGH and CRITICAL activities, newest first")
    public ResponseEntity<List<BehaviorRecord>> getHighRisk() {
        return ResponseEntity.ok(analyticsService.getHighRiskActivities());
    }

    @GetMapping("/off-hours")
    @Operation(summary = "Off-hours activities, newest first")
    public ResponseEntity<List<BehaviorRecord>> getOffHours() {
        return ResponseEntity.ok(analyticsService.getOffHoursActivities());
    }

    @GetMapping("/new-locations")
    @Operation(summary = "Activities from locations new to the user")
    public ResponseEntity<List<BehaviorRecord>> getNewLocations() {
        return ResponseEntity.ok(analyticsService.getNewLocationAccess());
    }

    @GetMapping("/new-devices")
    @Operation(summary = "Activities from devices new to the user")
    public ResponseEntity<List<BehaviorRecord>> getNewDevices() {
        return ResponseEntity.ok(analyticsService.getNewDeviceAccess());
    }

    @GetMapping("/users/{userId}/history")
    @Operation(summary = "A user's behavior history",
               description = "Newest first, at most 100 records. Bounds are epoch milliseconds, inclusive.")
    public ResponseEntity<List<BehaviorRecord>> getUserHistory(
            @Parameter(description = "User ID", example = "42") @PathVariable long userId,
            @RequestParam(required = false) Long from,
            @RequestParam(required = false) Long to) {
        return ResponseEntity.ok(analyticsService.getUserBehaviorHistory(userId, from, to));
    }

    @GetMapping("/users/{userId}/summary")
    @Operation(summary = "A user's behavior summary over the last 30 days")
    public ResponseEntity<UserBehaviorSummary> getUserSummary(
            @Parameter(description = "User ID", example = "42") @PathVariable long userId) {
        return ResponseEntity.ok(analyticsService.getUserBehaviorSummary(userId));
    }

    @GetMapping("/users/{userId}/baseline")
    @Operation(summary = "A user's behavioral baseline", description = "Built from non-anomalous records only")
    public ResponseEntity<UserBaseline> getUserBaseline(
            @Parameter(description = "User ID", example = "42") @PathVariable long userId) {
        return ResponseEntity.ok(baselineService.getUserBaseline(userId));
    }

    @PostMapping("/users/{userId}/baseline/refresh")
    @Operation(summary = "Recompute a user's baseline")
    public ResponseEntity<Map<String, Object>> refreshBaseline(
            @Parameter(description = "User ID", example = "42") @PathVariable long userId) {
        boolean refreshed = baselineService.refreshUserBaseline(userId);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("userId", userId);
        response.put("refreshed", refreshed);
        return ResponseEntity.ok(response);
    }

    @DeleteMapping("/cleanup")
    @Operation(summary = "Delete ledger records older than the given age")
    public ResponseEntity<?> cleanup(
            @Parameter(description = "Age in days", example = "30")
            @RequestParam(defaultValue = "30") int daysOld) {
        if (daysOld <= 0) {
            return badRequest("daysOld must be > 0", "daysOld");
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("daysOld", daysOld);
        response.put("removed", analyticsService.cleanupOldBehaviorData(daysOld));
        return ResponseEntity.ok(response);
    }

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }
}
