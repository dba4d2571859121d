package com.tasktracker.guard.model;

public enum RecommendedAction {
    BLOCK,
    MONITOR,
    ALLOW
}
