package com.tasktracker.guard.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Whitelist or blacklist request")
public class IpListRequest {

    @Schema(description = "IP address", example = "198.51.100.23")
    private String ipAddress;

    @Schema(description = "Why the address is listed", example = "Office VPN egress")
    private String reason;
}
