package com.epiccharts.core.pipeline;

import com.epiccharts.core.config.BotProperties;
import com.epiccharts.core.metrics.ChartBotMetrics;
import com.epiccharts.core.model.Mention;
import com.epiccharts.twitter.SocialFeedClient;
import com.epiccharts.twitter.SocialFeedClient.FeedEntry;
import com.epiccharts.twitter.SocialFeedClient.MentionPage;
import com.epiccharts.twitter.SocialFeedClient.ReferencedTweet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads new mentions of the bot account and keeps them only when they are replies that
 * contain the trigger phrase (and, if configured, come from an allowed author).
 * <p>
 * Owns the poll cursor. The cursor only ever moves forward: it follows the feed's
 * {@code newest_id} after every successful fetch, whether or not any entry passed the filters.
 */
@Service
public class MentionPoller {

    private static final Logger log = LoggerFactory.getLogger(MentionPoller.class);

    private final SocialFeedClient feedClient;
    private final BotProperties properties;
    private final ChartBotMetrics metrics;

    private String cursor;

    public MentionPoller(SocialFeedClient feedClient, BotProperties properties, ChartBotMetrics metrics) {
        this.feedClient = feedClient;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Fetches one page of mentions. Never throws: a failed fetch is logged and yields an
     * empty list, leaving the cursor where it was.
     */
    public List<Mention> poll() {
        String since = getCursor();
        MentionPage page;
        try {
            page = feedClient.fetchMentions(properties.getUserId(), since, properties.getMaxResults());
        } catch (RuntimeException e) {
            log.error("Error polling mentions: {}", e.getMessage());
            metrics.recordPollCycle(false);
            return List.of();
        }
        metrics.recordPollCycle(true);

        var mentions = new ArrayList<Mention>();
        String trigger = properties.normalizedTriggerPhrase();
        for (FeedEntry entry : page.entries()) {
            if (properties.hasAllowList() && !properties.getAllowedUserIds().contains(entry.authorId())) {
                log.debug("Skipping {}: author {} not in allow-list", entry.id(), entry.authorId());
                continue;
            }
            if (entry.text() == null || !entry.text().toLowerCase(Locale.ROOT).contains(trigger)) {
                continue;
            }
            String parentId = repliedToId(entry);
            if (parentId == null) {
                log.debug("Skipping {}: not a reply to a single post", entry.id());
                continue;
            }
            mentions.add(new Mention(entry.id(), entry.authorId(), entry.text(), parentId));
        }

        if (page.newestId() != null) {
            advanceCursor(page.newestId());
        }

        if (!mentions.isEmpty()) {
            log.info("Found {} mention(s) to process", mentions.size());
        }
        metrics.recordMentionsFound(mentions.size());
        return mentions;
    }

    public synchronized String getCursor() {
        return cursor;
    }

    /**
     * Seeds the cursor, e.g. from {@code run --since-id}. Refused when it would move the
     * cursor backwards.
     *
     * @return {@code true} if the cursor now equals {@code sinceId}
     */
    public boolean seedCursor(String sinceId) {
        if (sinceId == null || sinceId.isBlank()) {
            return false;
        }
        boolean advanced = advanceCursor(sinceId.trim());
        if (advanced) {
            log.info("Poll cursor set to {}", sinceId.trim());
        } else {
            log.warn("Refusing to move poll cursor back from {} to {}", getCursor(), sinceId);
        }
        return advanced;
    }

    private synchronized boolean advanceCursor(String candidate) {
        if (cursor == null || compareIds(candidate, cursor) >= 0) {
            cursor = candidate;
            return true;
        }
        return false;
    }

    /**
     * Orders snowflake-style numeric ids without parsing them: longer is newer, then lexical.
     */
    static int compareIds(String a, String b) {
        if (a.length() != b.length()) {
            return Integer.compare(a.length(), b.length());
        }
        return a.compareTo(b);
    }

    /**
     * The parent id when the entry replies to exactly one post, otherwise {@code null}.
     */
    private static String repliedToId(FeedEntry entry) {
        if (entry.referencedTweets() == null) {
            return null;
        }
        String parentId = null;
        for (ReferencedTweet ref : entry.referencedTweets()) {
            if (ref.isReply()) {
                if (parentId != null) {
                    return null;
                }
                parentId = ref.id();
            }
        }
        return parentId;
    }
}
