package com.tasktracker.guard.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI behaviorGuardOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Behavior Guard API")
                        .version("1.0.0")
                        .description(
                                "Behavioral anomaly detection, IP reputation and subscription quota service " +
                                "for the task-tracker backend.\n\n" +
                                "**Activity Pipeline:**\n" +
                                "1. Record a user action via `POST /api/v1/behavior/activities`\n" +
                                "2. Classify the IP (geo tags) and user agent (device, browser, OS)\n" +
                                "3. Score against the user's trailing 30-day history (0.0-1.0)\n" +
                                "4. Band the score: **LOW** (<0.4), **MEDIUM** (0.4-0.6), **HIGH** (0.6-0.8), **CRITICAL** (>=0.8)\n" +
                                "5. Append the enriched record to the behavior ledger\n\n" +
                                "**Score Penalties:**\n" +
                                "- `+0.3` access at an hour never seen in the user's history\n" +
                                "- `+0.2` action type used in less than 10% of history\n" +
                                "- `+0.3` IP address used in less than 10% of history\n" +
                                "- `+0.4` more than 10 actions in the preceding minute\n\n" +
                                "**Threat Intelligence:** whitelist/blacklist overrides, stored threat records, " +
                                "and pattern analysis of the raw address.\n\n" +
                                "**Subscriptions:** tier resolution, endpoint rate limits with wildcard patterns, " +
                                "and daily API quotas with a one-time warning.")
                        .contact(new Contact().name("Platform Security Team")));
    }
}
