package com.tasktracker.guard.classifier;

import com.tasktracker.guard.model.GeoLocation;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Local-only IP classification. No external geolocation lookup is made, so every
 * public address maps to Unknown/Unknown.
 */
@Component
public class IpClassifier {

    private static final List<String> LOCAL_PREFIXES = List.of("192.168.", "10.", "172.16.", "127.");

    // Addresses that should never reach the API as a client address.
    private static final List<String> SUSPICIOUS_PREFIXES =
            List.of("192.168.", "10.", "172.16.", "127.", "0.0.0.0", "255.255.255.255");

    private static final int MAX_IPV4_LENGTH = 15;

    public GeoLocation locate(String ipAddress) {
        return isPrivateOrLocal(ipAddress) ? GeoLocation.LOCAL : GeoLocation.UNKNOWN;
    }

    public boolean isPrivateOrLocal(String ipAddress) {
        if (ipAddress == null || ipAddress.isBlank()) return false;
        String ip = ipAddress.trim();
        if ("::1".equals(ip) || "localhost".equalsIgnoreCase(ip)) return true;
        return LOCAL_PREFIXES.stream().anyMatch(ip::startsWith);
    }

    /**
     * Returns the reasons an address looks suspicious, or an empty list when it does not.
     */
    public List<String> suspiciousPatternReasons(String ipAddress) {
        List<String> reasons = new ArrayList<>();
        if (ipAddress == null || ipAddress.isBlank()) return reasons;
        String ip = ipAddress.trim();

        SUSPICIOUS_PREFIXES.stream()
                .filter(ip::startsWith)
                .findFirst()
                .ifPresent(prefix -> reasons.add("Reserved or private address range (" + prefix + ")"));
        if ("::1".equals(ip)) {
            reasons.add("Loopback address");
        }
        if (ip.contains("..")) {
            reasons.add("Malformed address (empty octet)");
        }
        if (ip.length() > MAX_IPV4_LENGTH && !ip.contains(":")) {
            reasons.add("Malformed address (too long)");
        }
        return reasons;
    }
}
