package com.clapgrow.reminder.api.service;

import com.clapgrow.reminder.common.retry.FailureClassification;
import com.clapgrow.reminder.common.retry.RetryPolicyResolver;
import org.springframework.stereotype.Service;

@Service
public class ReminderRetryPolicyResolver implements RetryPolicyResolver {

    @Override
    public RetryPolicy resolve(FailureClassification classification) {
        return switch (classification) {
            case RATE_LIMIT -> RetryPolicy.cooperativeBackoff();
            case TERMINAL -> RetryPolicy.exponentialBackoff();
        };
    }
}
