package com.clapgrow.reminder.api.service;

import com.clapgrow.reminder.api.config.CronProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.regex.Pattern;

@Service
@Slf4j
public class CronAuthService {

    private static final Pattern CRON_KEY_PATTERN = Pattern.compile("^[A-Za-z0-9_-]+$");

    private final String configuredSecret;

    public CronAuthService(CronProperties cronProperties) {
        this.configuredSecret = normalize(cronProperties.getSecret());
        if (configuredSecret == null) {
            log.warn("Cron secret is not configured or contains unsupported characters. Tick requests will be rejected.");
        }
    }

    /**
     * Validate the key presented by a tick caller.
     *
     * @param providedKey key from the query string or X-Cron-Key header
     * @throws SecurityException if no secret is configured or the key does not match
     */
    public void validateCronKey(String providedKey) {
        if (configuredSecret == null) {
            throw new SecurityException("Cron secret is not configured");
        }

        String normalized = normalize(providedKey);
        if (normalized == null) {
            throw new SecurityException("Cron key is required");
        }

        if (!constantTimeEquals(normalized, configuredSecret)) {
            throw new SecurityException("Invalid cron key");
        }
    }

    static String normalize(String key) {
        if (key == null) {
            return null;
        }
        String trimmed = key.trim();
        if (trimmed.isEmpty() || !CRON_KEY_PATTERN.matcher(trimmed).matches()) {
            return null;
        }
        return trimmed;
    }

    private boolean constantTimeEquals(String a, String b) {
        int maxLength = Math.max(a.length(), b.length());
        int result = 0;
        for (int i = 0; i < maxLength; i++) {
            char charA = (i < a.length()) ? a.charAt(i) : 0;
            char charB = (i < b.length()) ? b.charAt(i) : 0;
            result |= charA ^ charB;
        }
        return result == 0 && a.length() == b.length();
    }
}
