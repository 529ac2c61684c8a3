package com.clapgrow.reminder.common.retry;

/**
 * A classified delivery failure.
 */
public sealed interface DeliveryFailure permits DeliveryFailure.RateLimit, DeliveryFailure.Terminal {

    FailureClassification classification();

    /**
     * Text stored in the ledger and in {@code reminders.last_error}.
     */
    String errorMessage();

    /**
     * Delay requested by the failure itself, or {@code null} when it carries none.
     */
    Integer retryHintSeconds();

    record RateLimit(int retryAfterSeconds) implements DeliveryFailure {
        public RateLimit {
            if (retryAfterSeconds <= 0) {
                throw new IllegalArgumentException("retryAfterSeconds must be positive, got " + retryAfterSeconds);
            }
        }

        @Override
        public FailureClassification classification() {
            return FailureClassification.RATE_LIMIT;
        }

        @Override
        public String errorMessage() {
            return "rate_limited:" + retryAfterSeconds;
        }

        @Override
        public Integer retryHintSeconds() {
            return retryAfterSeconds;
        }
    }

    record Terminal(String message, Integer retryHintSeconds) implements DeliveryFailure {

        public Terminal(String message) {
            this(message, null);
        }

        @Override
        public FailureClassification classification() {
            return FailureClassification.TERMINAL;
        }

        @Override
        public String errorMessage() {
            return message;
        }
    }
}
