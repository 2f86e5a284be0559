package com.centralbot.config;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Holds the control API key. No endpoint checks it yet; callers are trusted
 * at the network level until request authentication is wired in.
 */
@Component
@Slf4j
public class ApiKeySettings {

    private final String apiKey;

    public ApiKeySettings(@Value("${central-bot.api-key:}") String apiKey) {
        this.apiKey = apiKey;
    }

    @PostConstruct
    public void reportEnforcement() {
        if (isConfigured()) {
            log.warn("Control API key is configured but NOT enforced on any endpoint");
        } else {
            log.warn("No control API key configured; all endpoints are open");
        }
    }

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }
}
