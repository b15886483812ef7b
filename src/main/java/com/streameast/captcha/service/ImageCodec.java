package com.streameast.captcha.service;

import com.streameast.captcha.util.AppConstants;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Base64;

@Component
public class ImageCodec {

    public byte[] encodePng(BufferedImage image) {
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            if (!ImageIO.write(image, "png", out)) {
                throw new IllegalStateException("No PNG writer available");
            }
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to encode PNG", e);
        }
    }

    public BufferedImage decodePng(byte[] png) {
        try {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(png));
            if (image == null) {
                throw new IllegalArgumentException("Not a readable image");
            }
            return image;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to decode PNG", e);
        }
    }

    public String toDataUri(BufferedImage image) {
        return AppConstants.PNG_DATA_URI_PREFIX + Base64.getEncoder().encodeToString(encodePng(image));
    }

    public BufferedImage fromDataUri(String dataUri) {
        if (dataUri == null || !dataUri.startsWith(AppConstants.PNG_DATA_URI_PREFIX)) {
            throw new IllegalArgumentException("Expected a PNG data URI");
        }
        return decodePng(Base64.getDecoder().decode(dataUri.substring(AppConstants.PNG_DATA_URI_PREFIX.length())));
    }
}
