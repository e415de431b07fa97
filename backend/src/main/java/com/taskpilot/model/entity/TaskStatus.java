package com.taskpilot.model.entity;

public enum TaskStatus {
    PENDING,
    COMPLETED
}
