package com.epiccharts.twitter;

import java.util.List;

/**
 * Read/write access to the social platform used by the mention pipeline.
 * <p>
 * Every method may throw {@link SocialFeedException} on transport or API errors.
 * Implementations: {@link TwitterFeedClient}.
 */
public interface SocialFeedClient {

    /**
     * Fetches the most recent posts mentioning {@code userId}.
     *
     * @param userId     the bot account id
     * @param sinceId    only return posts newer than this id; {@code null} on the first poll
     * @param maxResults upper bound on entries returned
     */
    MentionPage fetchMentions(String userId, String sinceId, int maxResults);

    /**
     * Looks up a post and its first photo attachment.
     */
    TweetMedia fetchTweetMedia(String tweetId);

    /**
     * Downloads raw image bytes from a media URL.
     */
    byte[] downloadImage(String url);

    /**
     * Uploads a PNG and returns the platform media id.
     */
    String uploadMedia(byte[] png);

    /**
     * Posts a reply to {@code targetId}, optionally attaching {@code mediaId}.
     *
     * @return id of the posted reply
     */
    String postReply(String targetId, String text, String mediaId);

    /**
     * One page of raw mention entries.
     *
     * @param entries  raw mentions, newest first as returned by the platform
     * @param newestId newest id reported by the platform for this page (nullable)
     */
    record MentionPage(List<FeedEntry> entries, String newestId) {
        public MentionPage {
            entries = entries != null ? List.copyOf(entries) : List.of();
        }

        public static MentionPage empty() {
            return new MentionPage(List.of(), null);
        }
    }

    /**
     * A raw mention before any filtering.
     */
    record FeedEntry(String id, String authorId, String text, List<ReferencedTweet> referencedTweets) {
        public FeedEntry {
            referencedTweets = referencedTweets != null ? List.copyOf(referencedTweets) : List.of();
        }
    }

    /**
     * A reference from one post to another ({@code replied_to}, {@code quoted}, {@code retweeted}).
     */
    record ReferencedTweet(String type, String id) {
        public boolean isReply() {
            return "replied_to".equals(type);
        }
    }

    /**
     * A looked-up post with its first photo.
     *
     * @param imageUrl       URL of the first photo attachment (nullable)
     * @param text           post text
     * @param authorUsername handle of the post author, {@code "unknown"} when not expanded
     */
    record TweetMedia(String imageUrl, String text, String authorUsername) {
        public boolean hasImage() {
            return imageUrl != null && !imageUrl.isBlank();
        }
    }
}
