package com.labassist.entity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of a lab request. Transitions only move forward:
 * {@code QUEUED -> RUNNING -> DONE | FAILED}.
 */
public enum RequestStatus {

    QUEUED,
    RUNNING,
    DONE,
    FAILED;

    public boolean canTransitionTo(RequestStatus next) {
        if (next == null) {
            return false;
        }
        return switch (this) {
            case QUEUED -> next == RUNNING;
            case RUNNING -> next == DONE || next == FAILED;
            case DONE, FAILED -> false;
        };
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
