package com.clapgrow.reminder.common.retry;

/**
 * Resolves retry policy based on failure classification.
 *
 * Maps failure classifications to retry strategies:
 * - RATE_LIMIT: Wait for the channel-supplied delay, abandon the rest of the batch
 * - TERMINAL: Per-reminder exponential backoff, continue the batch
 *
 * This keeps the classification logic separate from the backoff arithmetic.
 */
public interface RetryPolicyResolver {

    /**
     * Resolve retry policy for a given failure classification.
     *
     * @param classification Failure classification
     * @return Retry policy configuration
     */
    RetryPolicy resolve(FailureClassification classification);

    /**
     * Retry policy configuration.
     *
     * @param abortBatch         whether the remaining reminders of the tick are released
     * @param baseDelaySeconds   delay for attempt zero
     * @param maxDelaySeconds    cap applied to the computed delay
     * @param backoffMultiplier  growth factor per attempt
     */
    record RetryPolicy(
        boolean abortBatch,
        long baseDelaySeconds,
        long maxDelaySeconds,
        double backoffMultiplier
    ) {
        /**
         * Cooperative backpressure (for rate limits). The channel's retry-after normally wins;
         * the base delay only applies when none was supplied.
         */
        public static RetryPolicy cooperativeBackoff() {
            return new RetryPolicy(true, 30, 3600, 1.0);
        }

        /**
         * Exponential backoff: min(2^attempt * 30s, 1h).
         */
        public static RetryPolicy exponentialBackoff() {
            return new RetryPolicy(false, 30, 3600, 2.0);
        }

        /**
         * Delay before the next attempt.
         *
         * @param attemptCount attempts made so far, including the one that just failed
         * @param hintSeconds  delay requested by the failure, used as-is when positive
         * @return delay in seconds
         */
        public long delaySeconds(int attemptCount, Integer hintSeconds) {
            if (hintSeconds != null && hintSeconds > 0) {
                return hintSeconds;
            }
            double computed = Math.pow(backoffMultiplier, Math.max(attemptCount, 0)) * baseDelaySeconds;
            return (long) Math.min(computed, (double) maxDelaySeconds);
        }
    }
}
