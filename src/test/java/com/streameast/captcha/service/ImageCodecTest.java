package com.streameast.captcha.service;

import com.streameast.captcha.font.BuiltinFontSource;
import com.streameast.captcha.font.FontResolver;
import com.streameast.captcha.model.CaptchaParams;
import com.streameast.captcha.render.CaptchaGenerator;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImageCodecTest {

    private final ImageCodec codec = new ImageCodec();

    @Test
    void dataUriDecodesToIdenticalPixels() {
        CaptchaGenerator generator = new CaptchaGenerator(new FontResolver(List.of(new BuiltinFontSource())));
        BufferedImage image = generator.generate(CaptchaParams.builder().text("55978").distortion(0.3).seed(4L).build());

        String dataUri = codec.toDataUri(image);
        BufferedImage decoded = codec.fromDataUri(dataUri);

        assertThat(dataUri).startsWith("data:image/png;base64,");
        assertThat(decoded.getWidth()).isEqualTo(image.getWidth());
        assertThat(decoded.getHeight()).isEqualTo(image.getHeight());
        for (int y = 0; y < image.getHeight(); y++) {
            for (int x = 0; x < image.getWidth(); x++) {
                assertThat(decoded.getRGB(x, y)).isEqualTo(image.getRGB(x, y));
            }
        }
    }

    @Test
    void rejectsForeignPayloads() {
        assertThatThrownBy(() -> codec.fromDataUri("data:image/jpeg;base64,AAAA"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> codec.decodePng("not an image".getBytes(StandardCharsets.US_ASCII)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
