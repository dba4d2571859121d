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
@Schema(description = "Daily API usage of a user")
public class UserQuota {

    @Schema(description = "User identifier", example = "42")
    private long userId;

    @Schema(description = "Tier the quota was created from", example = "1")
    private long subscriptionTierId;

    @Schema(description = "Calls counted since the last reset", example = "12")
    private long apiCallsUsedToday;

    @Schema(description = "Daily allowance", example = "1000")
    private int maxDailyApiCalls;

    @Schema(description = "UTC midnight of the day the counter belongs to, epoch milliseconds")
    private long lastResetTime;

    private long lastUpdatedTime;

    @Schema(description = "Exempt quotas never exceed")
    private boolean exemptFromQuota;

    @Schema(description = "Set once per day when usage crosses the warning threshold")
    private boolean hasReceivedQuotaWarning;

    @Builder.Default
    @Schema(description = "Warning threshold as a percentage of the allowance", example = "80")
    private int quotaWarningThresholdPercent = 80;

    /**
     * True when the counter still belongs to a day before {@code todayStart}.
     */
    public boolean needsReset(long todayStart) {
        return lastResetTime < todayStart;
    }
}
