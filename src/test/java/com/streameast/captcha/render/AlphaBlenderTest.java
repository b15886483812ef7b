package com.streameast.captcha.render;

import com.streameast.captcha.model.CaptchaParams;
import com.streameast.captcha.model.GrayBuffer;
import com.streameast.captcha.util.PixelMath;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;

import static org.assertj.core.api.Assertions.assertThat;

class AlphaBlenderTest {

    private static final int W = 40;
    private static final int H = 20;

    private final AlphaBlender blender = new AlphaBlender();

    @Test
    void derivedConstants() {
        assertThat(AlphaBlender.baseSubtraction(1, 0)).isEqualTo(38);
        assertThat(AlphaBlender.baseSubtraction(0, 1)).isEqualTo(122);
        assertThat(AlphaBlender.minAlpha(1, 0)).isEqualTo(102);
        assertThat(AlphaBlender.minAlpha(0, 0)).isEqualTo(150);
        assertThat(AlphaBlender.minAlpha(1, 1)).isEqualTo(100);
    }

    @Test
    void heaviestReductionStopsAtMinimumAlpha() {
        CaptchaParams params = params(1, 1, false);

        GrayBuffer alpha = blender.alphaChannel(GrayBuffer.filled(W, H, 255), GrayBuffer.filled(W, H, 208),
                inkBlock(), params);

        assertThat(alpha.min()).isEqualTo(100);
        assertThat(alpha.get(10, 10)).isEqualTo(100);
    }

    @Test
    void protectedInkKeepsReadabilityFloor() {
        CaptchaParams params = params(1, 1, true);

        GrayBuffer alpha = blender.alphaChannel(GrayBuffer.filled(W, H, 255), GrayBuffer.filled(W, H, 208),
                inkBlock(), params);

        for (int y = 5; y < 15; y++) {
            for (int x = 5; x < 15; x++) {
                assertThat(alpha.get(x, y)).isGreaterThanOrEqualTo(230);
            }
        }
        assertThat(alpha.get(30, 10)).isEqualTo(100);
    }

    @Test
    void faintInkIsNotProtected() {
        BufferedImage faint = new BufferedImage(W, H, BufferedImage.TYPE_INT_ARGB);
        faint.setRGB(3, 3, PixelMath.argb(16, 10, 10, 10));
        faint.setRGB(4, 4, PixelMath.argb(17, 10, 10, 10));

        GrayBuffer floor = blender.inkFloor(faint);

        assertThat(floor.get(3, 3)).isZero();
        assertThat(floor.get(4, 4)).isEqualTo(230);
    }

    @Test
    void quietSettingsKeepAlphaHigh() {
        CaptchaParams params = params(0, 0, true);

        GrayBuffer alpha = blender.alphaChannel(GrayBuffer.filled(W, H, 200), new GrayBuffer(W, H),
                new BufferedImage(W, H, BufferedImage.TYPE_INT_ARGB), params);

        assertThat(alpha.min()).isEqualTo(245);
    }

    @Test
    void applyReplacesOnlyAlpha() {
        BufferedImage image = new BufferedImage(W, H, BufferedImage.TYPE_INT_ARGB);
        image.setRGB(2, 2, PixelMath.argb(255, 11, 22, 33));

        BufferedImage result = blender.apply(image, GrayBuffer.filled(W, H, 140));

        assertThat(result.getRGB(2, 2)).isEqualTo(PixelMath.argb(140, 11, 22, 33));
    }

    private static CaptchaParams params(double noise, double gridStrength, boolean protectText) {
        return CaptchaParams.builder()
                .text("1")
                .width(W)
                .height(H)
                .noise(noise)
                .gridStrength(gridStrength)
                .protectText(protectText)
                .build();
    }

    private static BufferedImage inkBlock() {
        BufferedImage layer = new BufferedImage(W, H, BufferedImage.TYPE_INT_ARGB);
        for (int y = 5; y < 15; y++) {
            for (int x = 5; x < 15; x++) {
                layer.setRGB(x, y, PixelMath.argb(255, 10, 10, 10));
            }
        }
        return layer;
    }
}
