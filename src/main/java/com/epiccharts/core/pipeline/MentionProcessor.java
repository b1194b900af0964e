package com.epiccharts.core.pipeline;

import com.epiccharts.core.logging.MdcContext;
import com.epiccharts.core.metrics.ChartBotMetrics;
import com.epiccharts.core.model.ChartData;
import com.epiccharts.core.model.DisplayConfig;
import com.epiccharts.core.model.Mention;
import com.epiccharts.core.model.MentionOutcome;
import com.epiccharts.core.render.ChartRenderer;
import com.epiccharts.core.render.WatermarkCompositor;
import com.epiccharts.core.vision.ExtractionException;
import com.epiccharts.core.vision.VisionExtractionService;
import com.epiccharts.twitter.SocialFeedClient;
import com.epiccharts.twitter.SocialFeedClient.TweetMedia;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Runs one mention through the whole pipeline: fetch the parent post, extract chart data from
 * its image, render, watermark, upload and reply.
 * <p>
 * Failures the requester can fix (no reply target, no image, nothing chartable) get an
 * explanatory reply. Everything else is logged and dropped without a reply. A mention id is
 * recorded as processed before any I/O and is never retried.
 */
@Service
public class MentionProcessor {

    private static final Logger log = LoggerFactory.getLogger(MentionProcessor.class);

    static final String STAGE_FETCH_PARENT = "fetch_parent";
    static final String STAGE_EXTRACT = "extract";
    static final String STAGE_RENDER = "render";
    static final String STAGE_WATERMARK = "watermark";
    static final String STAGE_UPLOAD = "upload";
    static final String STAGE_REPLY = "reply";

    private final SocialFeedClient feedClient;
    private final VisionExtractionService visionService;
    private final ChartRenderer renderer;
    private final WatermarkCompositor watermarkCompositor;
    private final ChartBotMetrics metrics;

    private final Set<String> processed = ConcurrentHashMap.newKeySet();

    public MentionProcessor(SocialFeedClient feedClient,
                            VisionExtractionService visionService,
                            ChartRenderer renderer,
                            WatermarkCompositor watermarkCompositor,
                            ChartBotMetrics metrics) {
        this.feedClient = feedClient;
        this.visionService = visionService;
        this.renderer = renderer;
        this.watermarkCompositor = watermarkCompositor;
        this.metrics = metrics;
    }

    /**
     * Processes a mention. Never throws an exception; an {@link Error} is left to propagate
     * since the process cannot carry on after one.
     *
     * @return how the mention ended; callers in the poll loop ignore it
     */
    public MentionOutcome process(Mention mention) {
        if (!processed.add(mention.id())) {
            log.debug("Already processed mention {}", mention.id());
            metrics.recordOutcome(MentionOutcome.DUPLICATE);
            return MentionOutcome.DUPLICATE;
        }

        MdcContext.setMention(mention.id());
        log.info("Processing mention {} from {}", mention.id(), mention.authorId());
        MentionOutcome outcome;
        try {
            outcome = runPipeline(mention);
        } catch (RuntimeException e) {
            log.error("Error processing mention {}: {}", mention.id(), e.getMessage(), e);
            outcome = MentionOutcome.SILENT_FAILURE;
        } finally {
            MdcContext.clear();
        }
        metrics.recordOutcome(outcome);
        return outcome;
    }

    private MentionOutcome runPipeline(Mention mention) {
        if (!mention.hasParent()) {
            return replyWithError(mention, ReplyMessages.NO_REPLY_TARGET);
        }

        TweetMedia parent = stage(STAGE_FETCH_PARENT, () -> feedClient.fetchTweetMedia(mention.parentId()));
        if (!parent.hasImage()) {
            log.info("No image found in parent tweet {}", mention.parentId());
            return replyWithError(mention, ReplyMessages.NO_IMAGE);
        }

        ChartData data;
        try {
            data = stage(STAGE_EXTRACT, () -> extract(parent.imageUrl()));
        } catch (ExtractionException e) {
            if (!e.isUserActionable()) {
                throw e;
            }
            log.info("Extraction failed ({}): {}", e.getKind(), e.getMessage());
            return replyWithError(mention, e.getKind() == ExtractionException.Kind.NO_DATA
                    ? ReplyMessages.NO_DATA
                    : ReplyMessages.INVALID_STRUCTURE);
        }

        DisplayConfig config = DisplayConfig.defaultsFor(data);
        byte[] chart = stage(STAGE_RENDER, () -> renderer.render(data, config));
        byte[] watermarked = stage(STAGE_WATERMARK, () -> watermarkCompositor.watermark(chart));
        String mediaId = stage(STAGE_UPLOAD, () -> feedClient.uploadMedia(watermarked));
        String replyId = stage(STAGE_REPLY, () -> feedClient.postReply(mention.id(), ReplyMessages.SUCCESS, mediaId));

        log.info("Successfully replied to {} with chart (reply {})", mention.id(), replyId);
        return MentionOutcome.REPLIED;
    }

    /**
     * URL first; on any extraction failure download the bytes and try once more. The second
     * attempt's failure is the one that counts.
     */
    private ChartData extract(String imageUrl) {
        try {
            return visionService.extractFromUrl(imageUrl);
        } catch (ExtractionException urlFailure) {
            log.warn("URL extraction failed ({}), retrying with downloaded image", urlFailure.getMessage());
            metrics.recordExtractionFallback();
        }
        byte[] image = feedClient.downloadImage(imageUrl);
        return visionService.extractFromBytes(image);
    }

    private <T> T stage(String name, Supplier<T> work) {
        MdcContext.setStage(name);
        long start = System.currentTimeMillis();
        try {
            return work.get();
        } finally {
            metrics.recordStage(name, System.currentTimeMillis() - start);
        }
    }

    private MentionOutcome replyWithError(Mention mention, String text) {
        try {
            feedClient.postReply(mention.id(), text, null);
        } catch (RuntimeException e) {
            log.error("Failed to post error reply to {}: {}", mention.id(), e.getMessage());
        }
        return MentionOutcome.USER_ERROR;
    }

    public boolean isProcessed(String mentionId) {
        return processed.contains(mentionId);
    }

    public int processedCount() {
        return processed.size();
    }

    /**
     * Forgets every processed id so those mentions could be handled again.
     *
     * @return how many ids were dropped
     */
    public int clearProcessed() {
        int count = processed.size();
        processed.clear();
        log.info("Cleared {} processed mention id(s)", count);
        return count;
    }
}
