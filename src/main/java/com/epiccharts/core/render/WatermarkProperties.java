package com.epiccharts.core.render;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "epiccharts.watermark")
public class WatermarkProperties {

    private String text = "epic charts";
    private float opacity = 0.6f;

    public String getText() { return text; }
    public void setText(String text) { this.text = text; }
    public float getOpacity() { return opacity; }
    public void setOpacity(float opacity) { this.opacity = opacity; }
}
