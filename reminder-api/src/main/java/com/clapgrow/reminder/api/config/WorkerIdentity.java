package com.clapgrow.reminder.api.config;

/**
 * Owner recorded on every claim this process makes.
 */
public record WorkerIdentity(String id) {

    public WorkerIdentity {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("Worker id cannot be blank");
        }
    }
}
