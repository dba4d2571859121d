package com.tasktracker.guard.model;

import java.time.Instant;

/**
 * Calls left today and the instant the counter rolls over. Trusted accounts get
 * {@code Integer.MAX_VALUE} and {@link Instant#MAX}.
 */
public record RemainingQuota(int remainingCalls, Instant resetTime) {}
