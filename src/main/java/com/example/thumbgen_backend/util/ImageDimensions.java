package com.example.thumbgen_backend.util;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.Optional;

/**
 * Reads width and height from an image header without decoding pixels.
 * JPEG and PNG go through ImageIO readers; WebP (no JDK reader) is parsed from its RIFF header.
 */
public final class ImageDimensions {

    public record Size(int width, int height) {
        public boolean atLeast(int minDimension) {
            return width >= minDimension && height >= minDimension;
        }
    }

    private ImageDimensions() {
    }

    public static Optional<Size> read(byte[] bytes, String contentType) throws IOException {
        if ("image/webp".equals(contentType)) {
            return webp(bytes);
        }
        try (ImageInputStream in = ImageIO.createImageInputStream(new ByteArrayInputStream(bytes))) {
            if (in == null) {
                return Optional.empty();
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                return Optional.empty();
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(in, true, true);
                return Optional.of(new Size(reader.getWidth(0), reader.getHeight(0)));
            } finally {
                reader.dispose();
            }
        }
    }

    /**
     * Reads the canvas size from the first chunk after the {@code RIFF....WEBP} header (chunk data starts at 20):
     * <ul>
     *   <li>{@code VP8 } (lossy): frame tag, start code {@code 9D 01 2A}, then 14-bit width and height, LE, at 26 and 28.</li>
     *   <li>{@code VP8L} (lossless): signature {@code 0x2F} at 20, then 14-bit width-1 and height-1 packed in bytes 21..24.</li>
     *   <li>{@code VP8X} (extended): flags and reserved bytes, then 24-bit canvas width-1 and height-1, LE, at 24 and 27.</li>
     * </ul>
     */
    static Optional<Size> webp(byte[] b) {
        if (b.length < 30
                || !"RIFF".equals(ascii(b, 0))
                || !"WEBP".equals(ascii(b, 8))) {
            return Optional.empty();
        }
        String chunk = ascii(b, 12);
        switch (chunk) {
            case "VP8 " -> {
                // lossy: 14-bit dimensions after the 3-byte frame tag and the start code
                int w = ((b[26] & 0xFF) | (b[27] & 0xFF) << 8) & 0x3FFF;
                int h = ((b[28] & 0xFF) | (b[29] & 0xFF) << 8) & 0x3FFF;
                return Optional.of(new Size(w, h));
            }
            case "VP8L" -> {
                if ((b[20] & 0xFF) != 0x2F) {
                    return Optional.empty();
                }
                int b0 = b[21] & 0xFF, b1 = b[22] & 0xFF, b2 = b[23] & 0xFF, b3 = b[24] & 0xFF;
                int w = 1 + (b0 | (b1 & 0x3F) << 8);
                int h = 1 + ((b1 >> 6) | b2 << 2 | (b3 & 0x0F) << 10);
                return Optional.of(new Size(w, h));
            }
            case "VP8X" -> {
                int w = 1 + ((b[24] & 0xFF) | (b[25] & 0xFF) << 8 | (b[26] & 0xFF) << 16);
                int h = 1 + ((b[27] & 0xFF) | (b[28] & 0xFF) << 8 | (b[29] & 0xFF) << 16);
                return Optional.of(new Size(w, h));
            }
            default -> {
                return Optional.empty();
            }
        }
    }

    private static String ascii(byte[] b, int offset) {
        return new String(b, offset, 4, StandardCharsets.US_ASCII);
    }
}
