package com.epiccharts.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Polling and filtering settings for the mention bot.
 *
 * <pre>
 * epiccharts:
 *   bot:
 *     user-id: ${BOT_USER_ID:}
 *     allowed-user-ids: ${ALLOWED_USER_IDS:}
 *     poll-interval-ms: ${POLL_INTERVAL_MS:60000}
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "epiccharts.bot")
public class BotProperties {

    private String userId = "";
    private List<String> allowedUserIds = new ArrayList<>();
    private long pollIntervalMs = 60_000;
    private int maxResults = 10;
    private String triggerPhrase = "make it epic";

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }
    public List<String> getAllowedUserIds() { return allowedUserIds; }
    public long getPollIntervalMs() { return pollIntervalMs; }
    public void setPollIntervalMs(long pollIntervalMs) { this.pollIntervalMs = pollIntervalMs; }
    public int getMaxResults() { return maxResults; }
    public void setMaxResults(int maxResults) { this.maxResults = maxResults; }
    public String getTriggerPhrase() { return triggerPhrase; }
    public void setTriggerPhrase(String triggerPhrase) { this.triggerPhrase = triggerPhrase; }

    /**
     * Accepts the list Spring binds from a comma-separated value and drops blank entries,
     * so {@code ALLOWED_USER_IDS=""} means "everyone".
     */
    public void setAllowedUserIds(List<String> allowedUserIds) {
        var cleaned = new ArrayList<String>();
        if (allowedUserIds != null) {
            for (String id : allowedUserIds) {
                if (id != null && !id.isBlank()) {
                    cleaned.add(id.trim());
                }
            }
        }
        this.allowedUserIds = cleaned;
    }

    public boolean hasAllowList() {
        return !allowedUserIds.isEmpty();
    }

    public String normalizedTriggerPhrase() {
        return triggerPhrase.toLowerCase(Locale.ROOT);
    }
}
