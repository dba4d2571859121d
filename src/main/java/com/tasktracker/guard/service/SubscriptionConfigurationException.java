package com.tasktracker.guard.service;

/**
 * Tier master data is missing something every request depends on, such as the Free tier.
 */
public class SubscriptionConfigurationException extends RuntimeException {

    public SubscriptionConfigurationException(String message) {
        super(message);
    }
}
