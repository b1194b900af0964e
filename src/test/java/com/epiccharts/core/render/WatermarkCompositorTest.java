package com.epiccharts.core.render;

import com.epiccharts.core.model.ChartData;
import com.epiccharts.core.model.DataSeries;
import com.epiccharts.core.model.DisplayConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WatermarkCompositorTest {

    private final WatermarkCompositor compositor = new WatermarkCompositor(new WatermarkProperties());

    private static byte[] solidPng(int width, int height, String format) throws IOException {
        var image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        var g = image.createGraphics();
        g.setColor(new Color(0x0f0f0f));
        g.fillRect(0, 0, width, height);
        g.dispose();
        var out = new ByteArrayOutputStream();
        ImageIO.write(image, format, out);
        return out.toByteArray();
    }

    private static BufferedImage decode(byte[] png) throws IOException {
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(png));
        assertNotNull(image, "output must be a decodable image");
        return image;
    }

    private static boolean anyPixelDiffers(BufferedImage image, int fromX, int fromY, int rgb) {
        for (int x = fromX; x < image.getWidth(); x++) {
            for (int y = fromY; y < image.getHeight(); y++) {
                if ((image.getRGB(x, y) & 0xFFFFFF) != (rgb & 0xFFFFFF)) {
                    return true;
                }
            }
        }
        return false;
    }

    @Test
    @DisplayName("keeps dimensions and marks the bottom-right corner only")
    void marksBottomRight() throws IOException {
        BufferedImage result = decode(compositor.watermark(solidPng(800, 600, "png")));

        assertEquals(800, result.getWidth());
        assertEquals(600, result.getHeight());
        assertTrue(anyPixelDiffers(result, 600, 540, 0x0f0f0f), "text drawn near the corner");
        assertFalse(anyPixelDiffers(cropTopLeft(result), 0, 0, 0x0f0f0f), "rest of the image untouched");
    }

    private static BufferedImage cropTopLeft(BufferedImage image) {
        return image.getSubimage(0, 0, image.getWidth() / 2, image.getHeight() / 2);
    }

    @Test
    @DisplayName("scales to small and non-PNG inputs and always emits PNG")
    void smallJpegInput() throws IOException {
        byte[] result = compositor.watermark(solidPng(200, 150, "jpg"));

        BufferedImage image = decode(result);
        assertEquals(200, image.getWidth());
        assertEquals(150, image.getHeight());
        assertEquals((byte) 0x89, result[0]);
        assertEquals((byte) 'P', result[1]);
    }

    @Test
    @DisplayName("undecodable input fails with WatermarkException")
    void garbageInput() {
        assertThrows(WatermarkException.class, () -> compositor.watermark(new byte[]{1, 2, 3, 4}));
    }

    @Test
    @DisplayName("watermark(render(data)) decodes at the render's dimensions")
    void roundTripWithRenderer() throws IOException {
        byte[] canvas = solidPng(800, 600, "png");
        RenderingEngine fakeEngine = new RenderingEngine() {
            @Override
            public byte[] capture(String html, int width, int height, Duration timeout) {
                assertEquals(800, width);
                assertEquals(600, height);
                return canvas;
            }

            @Override
            public boolean isConnected() {
                return true;
            }

            @Override
            public void close() {
            }
        };
        var renderer = new ChartRenderer(() -> fakeEngine, new RenderProperties());
        var data = new ChartData(List.of("Q1", "Q2"), List.of(new DataSeries("Rev", List.of(10.0, 20.0))));

        byte[] rendered = renderer.render(data, DisplayConfig.defaultsFor(data));
        BufferedImage original = decode(rendered);
        BufferedImage result = decode(compositor.watermark(rendered));

        assertEquals(original.getWidth(), result.getWidth());
        assertEquals(original.getHeight(), result.getHeight());
        renderer.shutdown();
    }
}
