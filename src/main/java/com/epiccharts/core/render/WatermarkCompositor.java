package com.epiccharts.core.render;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.AlphaComposite;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Stamps the brand text onto the bottom-right corner of a rendered chart.
 * <p>
 * Font size and margin scale with image width (16px text, 20px margin at 800px wide).
 * The output keeps the input's dimensions and is always PNG.
 */
@Service
public class WatermarkCompositor {

    private static final Logger log = LoggerFactory.getLogger(WatermarkCompositor.class);

    private static final int REFERENCE_WIDTH = 800;
    private static final int BASE_FONT_SIZE = 16;
    private static final int BASE_PADDING = 20;

    private final WatermarkProperties properties;

    public WatermarkCompositor(WatermarkProperties properties) {
        this.properties = properties;
    }

    public byte[] watermark(byte[] image) {
        BufferedImage source;
        try {
            source = ImageIO.read(new ByteArrayInputStream(image));
        } catch (IOException e) {
            throw new WatermarkException("Could not decode image for watermarking", e);
        }
        if (source == null) {
            throw new WatermarkException("Unsupported image format for watermarking");
        }

        int width = source.getWidth();
        int height = source.getHeight();
        var output = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = output.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.drawImage(source, 0, 0, null);

            double scale = width / (double) REFERENCE_WIDTH;
            int fontSize = Math.max(8, (int) Math.round(BASE_FONT_SIZE * scale));
            int padding = Math.max(4, (int) Math.round(BASE_PADDING * scale));

            g.setFont(new Font(Font.SANS_SERIF, Font.BOLD, fontSize));
            g.setComposite(AlphaComposite.getInstance(AlphaComposite.SRC_OVER, clampOpacity(properties.getOpacity())));
            g.setColor(Color.WHITE);
            FontMetrics metrics = g.getFontMetrics();
            String text = properties.getText();
            int x = width - padding - metrics.stringWidth(text);
            int y = height - padding - metrics.getDescent();
            g.drawString(text, x, y);
        } finally {
            g.dispose();
        }

        var out = new ByteArrayOutputStream();
        try {
            if (!ImageIO.write(output, "png", out)) {
                throw new WatermarkException("No PNG writer available");
            }
        } catch (IOException e) {
            throw new WatermarkException("Could not encode watermarked image", e);
        }
        log.debug("Watermarked {}x{} image ({} bytes)", width, height, out.size());
        return out.toByteArray();
    }

    private static float clampOpacity(float opacity) {
        return Math.max(0f, Math.min(1f, opacity));
    }
}
