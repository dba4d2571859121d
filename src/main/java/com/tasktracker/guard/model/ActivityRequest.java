package com.tasktracker.guard.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A user action to record or analyze")
public class ActivityRequest {

    @Schema(description = "User identifier", example = "42")
    private Long userId;

    @Schema(description = "Username", example = "alice")
    private String username;

    @Schema(description = "Client IP address", example = "203.0.113.5")
    private String ipAddress;

    @Schema(description = "Raw User-Agent header",
            example = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0 Safari/537.36")
    private String userAgent;

    @Schema(description = "Action performed", example = "login")
    private String actionType;

    @Schema(description = "Resource touched by the action", example = "/boards/7")
    private String resourceAccessed;

    @Schema(description = "Data volume accessed", example = "0")
    private long dataVolumeAccessed;
}
