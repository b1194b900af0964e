package com.epiccharts.dispatch.api;

import com.epiccharts.core.config.BotProperties;
import com.epiccharts.core.pipeline.MentionPoller;
import com.epiccharts.core.pipeline.MentionProcessor;
import com.epiccharts.core.scheduler.MentionScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Operator endpoints for a running bot.
 */
@RestController
@RequestMapping("/api/v1/bot")
public class BotAdminController {

    private static final Logger log = LoggerFactory.getLogger(BotAdminController.class);

    private final MentionScheduler scheduler;
    private final MentionPoller poller;
    private final MentionProcessor processor;
    private final BotProperties properties;

    public BotAdminController(MentionScheduler scheduler, MentionPoller poller,
                              MentionProcessor processor, BotProperties properties) {
        this.scheduler = scheduler;
        this.poller = poller;
        this.processor = processor;
        this.properties = properties;
    }

    @GetMapping("/status")
    public BotStatusResponse status() {
        return new BotStatusResponse(
                scheduler.isRunning(),
                poller.getCursor(),
                processor.processedCount(),
                properties.getPollIntervalMs());
    }

    /**
     * POST /api/v1/bot/processed/clear. Forgets processed mention ids.
     */
    @PostMapping("/processed/clear")
    public Map<String, Integer> clearProcessed() {
        int cleared = processor.clearProcessed();
        log.info("Processed set cleared via API ({} ids)", cleared);
        return Map.of("cleared", cleared);
    }

    /**
     * PUT /api/v1/bot/cursor. 400 unless the id is numeric, 409 if it would move the cursor backwards.
     */
    @PutMapping("/cursor")
    public ResponseEntity<Map<String, String>> seedCursor(@RequestBody CursorRequest request) {
        if (request == null || request.sinceId() == null || !request.sinceId().trim().matches("\\d+")) {
            return ResponseEntity.badRequest().body(Map.of("error", "sinceId must be a numeric post id"));
        }
        if (!poller.seedCursor(request.sinceId())) {
            String current = poller.getCursor();
            return ResponseEntity.status(409).body(Map.of(
                    "error", "Cursor cannot move backwards",
                    "cursor", current == null ? "" : current));
        }
        return ResponseEntity.ok(Map.of("cursor", poller.getCursor()));
    }
}
