package com.clapgrow.reminder.common.schedule;

/**
 * Raised when the stored schedule columns of a reminder cannot form a valid {@link Schedule}.
 */
public class InvalidScheduleException extends RuntimeException {

    public InvalidScheduleException(String message) {
        super(message);
    }

    public InvalidScheduleException(String message, Throwable cause) {
        super(message, cause);
    }
}
