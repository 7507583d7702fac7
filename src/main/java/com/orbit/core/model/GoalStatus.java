package com.orbit.core.model;

public enum GoalStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED
}
