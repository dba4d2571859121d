package com.tasktracker.guard.model;

public record RateLimit(int limit, int timeWindowSeconds) {}
