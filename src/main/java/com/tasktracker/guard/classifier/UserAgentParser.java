package com.tasktracker.guard.classifier;

import com.tasktracker.guard.model.DeviceInfo;
import org.springframework.stereotype.Component;

/**
 * Substring-based User-Agent classification. Checks run in a fixed order, so a
 * Chrome-on-Android agent is Mobile/Chrome/Linux.
 */
@Component
public class UserAgentParser {

    public static final String UNKNOWN = "Unknown";

    public DeviceInfo parse(String userAgent) {
        if (userAgent == null || userAgent.isBlank()) {
            return new DeviceInfo("Desktop", UNKNOWN, UNKNOWN);
        }
        return new DeviceInfo(deviceType(userAgent), browser(userAgent), operatingSystem(userAgent));
    }

    private String deviceType(String ua) {
        if (ua.contains("Mobile") || ua.contains("Android") || ua.contains("iPhone")) return "Mobile";
        if (ua.contains("Tablet") || ua.contains("iPad")) return "Tablet";
        return "Desktop";
    }

    private String browser(String ua) {
        if (ua.contains("Chrome")) return "Chrome";
        if (ua.contains("Firefox")) return "Firefox";
        if (ua.contains("Safari")) return "Safari";
        if (ua.contains("Edge")) return "Edge";
        return UNKNOWN;
    }

    private String operatingSystem(String ua) {
        if (ua.contains("Windows")) return "Windows";
        if (ua.contains("Mac")) return "macOS";
        if (ua.contains("Linux")) return "Linux";
        if (ua.contains("Android")) return "Android";
        if (ua.contains("iOS")) return "iOS";
        return UNKNOWN;
    }
}
