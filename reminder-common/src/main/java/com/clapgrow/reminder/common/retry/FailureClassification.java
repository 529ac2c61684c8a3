package com.clapgrow.reminder.common.retry;

/**
 * Classification of reminder delivery failures.
 *
 * Used to determine retry strategy and batch behavior:
 * - RATE_LIMIT: The channel asked us to slow down (e.g., 429 Too Many Requests).
 *   Back off for the channel-supplied delay and stop the rest of the current batch.
 * - TERMINAL: Any other failure. Back off exponentially for this reminder only
 *   and keep processing the batch.
 */
public enum FailureClassification {
    RATE_LIMIT,
    TERMINAL
}
