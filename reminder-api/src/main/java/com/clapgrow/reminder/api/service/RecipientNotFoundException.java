package com.clapgrow.reminder.api.service;

/**
 * The owner of a reminder cannot be reached: the user row is gone or has no chat id.
 */
public class RecipientNotFoundException extends RuntimeException {

    public RecipientNotFoundException(String message) {
        super(message);
    }
}
