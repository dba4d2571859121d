package com.tasktracker.guard.event;

import com.tasktracker.guard.model.BehaviorRecord;

/**
 * Published after a ledger record lands in the HIGH or CRITICAL band.
 */
public record RiskElevatedEvent(BehaviorRecord record) {}
