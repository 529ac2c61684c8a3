package com.clapgrow.reminder.api.service;

import java.util.UUID;

/**
 * Outcome of one tick.
 *
 * @param ok         false when the tick was aborted (e.g. the claim failed)
 * @param error      abort reason, null when ok
 */
public record CronTickResult(
    boolean ok,
    UUID tickId,
    int claimed,
    int sent,
    int failed,
    int skipped,
    long durationMs,
    String error
) {
}
