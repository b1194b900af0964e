package com.epiccharts.core.health;

import com.epiccharts.core.render.ChartRenderer;
import com.epiccharts.core.vision.VisionProperties;
import com.epiccharts.twitter.TwitterProperties;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Configuration-level health of the bot's three collaborators. Makes no network calls.
 */
@Service
public class HealthCheckService {

    private final TwitterProperties twitterProperties;
    private final VisionProperties visionProperties;
    private final ChartRenderer renderer;

    public HealthCheckService(TwitterProperties twitterProperties,
                              VisionProperties visionProperties,
                              ChartRenderer renderer) {
        this.twitterProperties = twitterProperties;
        this.visionProperties = visionProperties;
        this.renderer = renderer;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkFeed());
        results.add(checkVision());
        results.add(checkRenderer());
        return results;
    }

    private HealthStatus checkFeed() {
        if (twitterProperties.hasCredentials()) {
            return new HealthStatus("feed", HealthStatus.Status.UP,
                    "Credentials configured", Map.of("api", twitterProperties.getApiBaseUrl()));
        }
        return new HealthStatus("feed", HealthStatus.Status.DOWN,
                "Platform credentials missing", Map.of());
    }

    private HealthStatus checkVision() {
        if (visionProperties.hasApiKey()) {
            return new HealthStatus("vision", HealthStatus.Status.UP,
                    "Model key configured (" + visionProperties.getModel() + ")",
                    Map.of("model", visionProperties.getModel()));
        }
        return new HealthStatus("vision", HealthStatus.Status.DOWN,
                "GOOGLE_API_KEY not set", Map.of());
    }

    private HealthStatus checkRenderer() {
        if (!renderer.isStarted()) {
            return new HealthStatus("renderer", HealthStatus.Status.UP,
                    "Idle (browser launches on first render)", Map.of());
        }
        if (!renderer.isConnected()) {
            return new HealthStatus("renderer", HealthStatus.Status.DEGRADED,
                    "Browser disconnected, relaunches on next render", Map.of());
        }
        return new HealthStatus("renderer", HealthStatus.Status.UP, "Browser running", Map.of());
    }
}
