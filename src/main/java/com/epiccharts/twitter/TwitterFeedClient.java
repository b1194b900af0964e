package com.epiccharts.twitter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * HTTP client for the platform's v2 API (reads and replies) and v1.1 media upload.
 *
 * <p>All authenticated calls are signed with {@link OAuth1Signer}. Image downloads go to the
 * public media CDN and are unauthenticated.
 */
public class TwitterFeedClient implements SocialFeedClient {

    private static final Logger log = LoggerFactory.getLogger(TwitterFeedClient.class);

    private static final Map<String, String> NO_FORM = Map.of();

    private final TwitterProperties properties;
    private final OAuth1Signer signer;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    public TwitterFeedClient(TwitterProperties properties) {
        this(properties, new OAuth1Signer(properties), HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    TwitterFeedClient(TwitterProperties properties, OAuth1Signer signer, HttpClient httpClient) {
        this.properties = properties;
        this.signer = signer;
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper();
        this.requestTimeout = Duration.ofSeconds(properties.getRequestTimeoutSeconds());
    }

    @Override
    public MentionPage fetchMentions(String userId, String sinceId, int maxResults) {
        var query = new StringBuilder()
                .append("max_results=").append(maxResults)
                .append("&tweet.fields=").append(encode("referenced_tweets,author_id"))
                .append("&expansions=").append(encode("referenced_tweets.id"));
        if (sinceId != null && !sinceId.isBlank()) {
            query.append("&since_id=").append(encode(sinceId));
        }

        JsonNode response = apiGet("/2/users/" + encode(userId) + "/mentions?" + query);

        JsonNode data = response.path("data");
        if (!data.isArray() || data.isEmpty()) {
            log.debug("No new mentions found");
            return new MentionPage(List.of(), textOrNull(response.path("meta"), "newest_id"));
        }

        var entries = new ArrayList<FeedEntry>();
        for (JsonNode tweet : data) {
            var refs = new ArrayList<ReferencedTweet>();
            for (JsonNode ref : tweet.path("referenced_tweets")) {
                refs.add(new ReferencedTweet(ref.path("type").asText(), ref.path("id").asText()));
            }
            entries.add(new FeedEntry(
                    tweet.path("id").asText(),
                    tweet.path("author_id").asText(""),
                    tweet.path("text").asText(""),
                    refs));
        }
        String newestId = textOrNull(response.path("meta"), "newest_id");
        log.debug("Fetched {} mention(s), newest_id={}", entries.size(), newestId);
        return new MentionPage(entries, newestId);
    }

    @Override
    public TweetMedia fetchTweetMedia(String tweetId) {
        String query = "tweet.fields=" + encode("attachments,author_id")
                + "&expansions=" + encode("attachments.media_keys,author_id")
                + "&media.fields=" + encode("url,preview_image_url,type")
                + "&user.fields=username";

        JsonNode response = apiGet("/2/tweets/" + encode(tweetId) + "?" + query);
        JsonNode tweet = response.path("data");
        JsonNode includes = response.path("includes");

        String authorId = tweet.path("author_id").asText("");
        String authorUsername = "unknown";
        for (JsonNode user : includes.path("users")) {
            if (authorId.equals(user.path("id").asText())) {
                authorUsername = user.path("username").asText("unknown");
                break;
            }
        }

        String imageUrl = null;
        for (JsonNode media : includes.path("media")) {
            if ("photo".equals(media.path("type").asText()) && media.hasNonNull("url")) {
                imageUrl = media.get("url").asText();
                break;
            }
        }

        log.info("Fetched parent tweet {} (hasImage={}, author={})", tweetId, imageUrl != null, authorUsername);
        return new TweetMedia(imageUrl, tweet.path("text").asText(""), authorUsername);
    }

    @Override
    public byte[] downloadImage(String url) {
        try {
            var request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(requestTimeout)
                    .GET()
                    .build();

            HttpResponse<byte[]> response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
            if (response.statusCode() >= 400) {
                throw new SocialFeedException("Failed to download image: " + response.statusCode(),
                        response.statusCode());
            }
            return response.body();
        } catch (IOException e) {
            throw new SocialFeedException("Image download failed: " + url, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SocialFeedException("Image download interrupted: " + url, e);
        }
    }

    @Override
    public String uploadMedia(byte[] png) {
        URI uri = URI.create(properties.getUploadBaseUrl() + "/1.1/media/upload.json");
        String boundary = "----epiccharts" + UUID.randomUUID().toString().replace("-", "");
        byte[] body = multipartBody(boundary, "media", "chart.png", "image/png", png);

        var request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(requestTimeout)
                .header("Authorization", signer.authorizationHeader("POST", uri, NO_FORM))
                .header("Content-Type", "multipart/form-data; boundary=" + boundary)
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                .build();

        JsonNode response = send(request, "POST /1.1/media/upload.json");
        String mediaId = response.path("media_id_string").asText(null);
        if (mediaId == null || mediaId.isBlank()) {
            throw new SocialFeedException("Media upload returned no media_id_string: " + response);
        }
        log.info("Uploaded media {}", mediaId);
        return mediaId;
    }

    @Override
    public String postReply(String targetId, String text, String mediaId) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("text", text);
        body.putObject("reply").put("in_reply_to_tweet_id", targetId);
        if (mediaId != null) {
            body.putObject("media").putArray("media_ids").add(mediaId);
        }

        URI uri = URI.create(properties.getApiBaseUrl() + "/2/tweets");
        var request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(requestTimeout)
                .header("Authorization", signer.authorizationHeader("POST", uri, NO_FORM))
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body.toString()))
                .build();

        JsonNode response = send(request, "POST /2/tweets");
        String postedId = response.path("data").path("id").asText(null);
        if (postedId == null) {
            throw new SocialFeedException("Reply response carried no tweet id: " + response);
        }
        log.info("Posted reply {} to {}", postedId, targetId);
        return postedId;
    }

    JsonNode apiGet(String pathAndQuery) {
        URI uri = URI.create(properties.getApiBaseUrl() + pathAndQuery);
        var request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(requestTimeout)
                .header("Authorization", signer.authorizationHeader("GET", uri, NO_FORM))
                .header("Accept", "application/json")
                .GET()
                .build();
        return send(request, "GET " + uri.getPath());
    }

    private JsonNode send(HttpRequest request, String label) {
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 400) {
                throw new SocialFeedException("API %s failed (HTTP %d): %s"
                        .formatted(label, response.statusCode(), response.body()), response.statusCode());
            }
            return objectMapper.readTree(response.body());
        } catch (IOException e) {
            throw new SocialFeedException("API request failed: " + label, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SocialFeedException("API request interrupted: " + label, e);
        }
    }

    private static byte[] multipartBody(String boundary, String field, String filename,
                                        String contentType, byte[] content) {
        var out = new ByteArrayOutputStream();
        String head = "--" + boundary + "\r\n"
                + "Content-Disposition: form-data; name=\"" + field + "\"; filename=\"" + filename + "\"\r\n"
                + "Content-Type: " + contentType + "\r\n\r\n";
        String tail = "\r\n--" + boundary + "--\r\n";
        out.writeBytes(head.getBytes(StandardCharsets.UTF_8));
        out.writeBytes(content);
        out.writeBytes(tail.getBytes(StandardCharsets.UTF_8));
        return out.toByteArray();
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
