package com.epiccharts.core.config;

import com.epiccharts.core.vision.VisionProperties;
import com.epiccharts.twitter.TwitterProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks that everything {@code run} needs is configured before the first poll.
 * Reports the environment variable names, since that is how operators set them.
 */
@Component
public class StartupValidator {

    private final TwitterProperties twitter;
    private final BotProperties bot;
    private final VisionProperties vision;

    public StartupValidator(TwitterProperties twitter, BotProperties bot, VisionProperties vision) {
        this.twitter = twitter;
        this.bot = bot;
        this.vision = vision;
    }

    /**
     * @throws MissingConfigurationException listing every missing variable
     */
    public void validate() {
        var missing = new ArrayList<String>();
        require(missing, "TWITTER_API_KEY", twitter.getApiKey());
        require(missing, "TWITTER_API_SECRET", twitter.getApiSecret());
        require(missing, "TWITTER_ACCESS_TOKEN", twitter.getAccessToken());
        require(missing, "TWITTER_ACCESS_SECRET", twitter.getAccessSecret());
        require(missing, "BOT_USER_ID", bot.getUserId());
        require(missing, "GOOGLE_API_KEY", vision.getApiKey());
        if (!missing.isEmpty()) {
            throw new MissingConfigurationException(List.copyOf(missing));
        }
        if (bot.getPollIntervalMs() <= 0) {
            throw new IllegalStateException("POLL_INTERVAL_MS must be positive, got " + bot.getPollIntervalMs());
        }
    }

    private static void require(List<String> missing, String name, String value) {
        if (value == null || value.isBlank()) {
            missing.add(name);
        }
    }
}
