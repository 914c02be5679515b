package com.phantom.config;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.calendar")
public record CalendarSyncProperties(
        boolean enabled,
        String clientId,
        String clientSecret,
        String tokenUri,
        String apiBase,
        @Positive Integer syncThreads,
        @Positive Integer syncQueueCapacity
) {
    public boolean isOAuthConfigured() {
        return enabled
                && notBlank(clientId)
                && notBlank(clientSecret);
    }

    public String safeTokenUri() {
        return notBlank(tokenUri) ? tokenUri : "https://oauth2.googleapis.com/token";
    }

    public String safeApiBase() {
        return notBlank(apiBase) ? apiBase : "https://www.googleapis.com/calendar/v3";
    }

    public int safeSyncThreads() {
        return syncThreads != null && syncThreads > 0 ? syncThreads : 2;
    }

    public int safeSyncQueueCapacity() {
        return syncQueueCapacity != null ? Math.max(50, syncQueueCapacity) : 500;
    }

    private boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
