package com.example.thumbgen_backend.util;

import org.junit.jupiter.api.Test;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class ImageDimensionsTest {

    @Test
    void readsPngAndJpegHeaders() throws Exception {
        assertThat(ImageDimensions.read(encode(640, 480, "png"), "image/png"))
                .contains(new ImageDimensions.Size(640, 480));
        assertThat(ImageDimensions.read(encode(300, 200, "jpg"), "image/jpeg"))
                .contains(new ImageDimensions.Size(300, 200));
    }

    @Test
    void unknownBytesYieldEmpty() throws Exception {
        assertThat(ImageDimensions.read(new byte[]{9, 9, 9, 9}, "image/png")).isEmpty();
        assertThat(ImageDimensions.read(new byte[10], "image/webp")).isEmpty();
    }

    @Test
    void readsLossyWebp() throws Exception {
        byte[] b = webpHeader("VP8 ");
        b[26] = 0x00;
        b[27] = 0x05;
        b[28] = (byte) 0xD0;
        b[29] = 0x02;

        assertThat(ImageDimensions.read(b, "image/webp")).contains(new ImageDimensions.Size(1280, 720));
    }

    @Test
    void readsLosslessWebp() {
        byte[] b = webpHeader("VP8L");
        b[20] = 0x2F;
        b[21] = (byte) 0xFF;
        b[22] = (byte) 0xC4;
        b[23] = (byte) 0xB3;
        b[24] = 0x00;

        assertThat(ImageDimensions.webp(b)).contains(new ImageDimensions.Size(1280, 720));
    }

    @Test
    void losslessWebpWithoutSignatureIsRejected() {
        assertThat(ImageDimensions.webp(webpHeader("VP8L"))).isEmpty();
    }

    @Test
    void readsExtendedWebp() {
        byte[] b = webpHeader("VP8X");
        b[24] = (byte) 0xFF;
        b[25] = 0x04;
        b[27] = (byte) 0xCF;
        b[28] = 0x02;

        assertThat(ImageDimensions.webp(b)).contains(new ImageDimensions.Size(1280, 720));
    }

    @Test
    void minimumDimensionAppliesToBothSides() {
        assertThat(new ImageDimensions.Size(256, 256).atLeast(256)).isTrue();
        assertThat(new ImageDimensions.Size(1024, 255).atLeast(256)).isFalse();
    }

    private static byte[] webpHeader(String chunk) {
        byte[] b = new byte[32];
        System.arraycopy("RIFF".getBytes(StandardCharsets.US_ASCII), 0, b, 0, 4);
        System.arraycopy("WEBP".getBytes(StandardCharsets.US_ASCII), 0, b, 8, 4);
        System.arraycopy(chunk.getBytes(StandardCharsets.US_ASCII), 0, b, 12, 4);
        return b;
    }

    private static byte[] encode(int width, int height, String format) throws Exception {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(image, format, out);
        return out.toByteArray();
    }
}
