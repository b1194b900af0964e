package com.epiccharts.core.vision;

import org.springframework.util.MimeType;
import org.springframework.util.MimeTypeUtils;

import java.util.Locale;

/**
 * Media-type detection for images handed to the vision model.
 */
public final class ImageMediaTypes {

    public static final MimeType IMAGE_WEBP = MimeType.valueOf("image/webp");

    private ImageMediaTypes() {}

    /**
     * Detects the image type from its leading magic bytes. Unknown signatures default to PNG.
     */
    public static MimeType sniff(byte[] bytes) {
        if (bytes == null) {
            return MimeTypeUtils.IMAGE_PNG;
        }
        if (startsWith(bytes, 0x89, 0x50, 0x4E, 0x47)) {
            return MimeTypeUtils.IMAGE_PNG;
        }
        if (startsWith(bytes, 0xFF, 0xD8, 0xFF)) {
            return MimeTypeUtils.IMAGE_JPEG;
        }
        if (startsWith(bytes, 0x47, 0x49, 0x46)) {
            return MimeTypeUtils.IMAGE_GIF;
        }
        // RIFF container; WebP is the only RIFF image format the platform serves
        if (startsWith(bytes, 0x52, 0x49, 0x46, 0x46)) {
            return IMAGE_WEBP;
        }
        return MimeTypeUtils.IMAGE_PNG;
    }

    /**
     * Guesses the image type from a URL's file extension or {@code format} query parameter.
     * Unknown extensions default to JPEG, which is what photo CDNs serve by default.
     */
    public static MimeType fromUrl(String url) {
        String lower = url.toLowerCase(Locale.ROOT);
        int query = lower.indexOf('?');
        String path = query >= 0 ? lower.substring(0, query) : lower;
        String params = query >= 0 ? lower.substring(query + 1) : "";

        if (path.endsWith(".png") || params.contains("format=png")) {
            return MimeTypeUtils.IMAGE_PNG;
        }
        if (path.endsWith(".gif") || params.contains("format=gif")) {
            return MimeTypeUtils.IMAGE_GIF;
        }
        if (path.endsWith(".webp") || params.contains("format=webp")) {
            return IMAGE_WEBP;
        }
        return MimeTypeUtils.IMAGE_JPEG;
    }

    private static boolean startsWith(byte[] bytes, int... signature) {
        if (bytes.length < signature.length) {
            return false;
        }
        for (int i = 0; i < signature.length; i++) {
            if ((bytes[i] & 0xFF) != signature[i]) {
                return false;
            }
        }
        return true;
    }
}
