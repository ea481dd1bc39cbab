package com.clarifi.backend.enums;

public enum GoalStatus {
    ACTIVE,
    COMPLETED,
    PAUSED,
    CANCELLED
}
