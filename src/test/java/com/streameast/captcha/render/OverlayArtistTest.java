package com.streameast.captcha.render;

import com.streameast.captcha.util.PixelMath;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class OverlayArtistTest {

    private final OverlayArtist artist = new OverlayArtist();

    @Test
    void countsAndAlphasFollowNoise() {
        assertThat(OverlayArtist.lineCount(0)).isEqualTo(2);
        assertThat(OverlayArtist.lineCount(1)).isEqualTo(14);
        assertThat(OverlayArtist.lineAlpha(1)).isEqualTo(160);
        assertThat(OverlayArtist.dotAlpha(1)).isEqualTo(150);
        assertThat(OverlayArtist.dotCount(220, 50, 0)).isEqualTo(7);
        assertThat(OverlayArtist.dotCount(220, 50, 1)).isEqualTo(20);
    }

    @Test
    void noiseNeverLowersOverlayIntensity() {
        double previous = 0;
        for (int i = 1; i <= 20; i++) {
            double noise = i / 20.0;
            assertThat(OverlayArtist.lineCount(noise)).isGreaterThanOrEqualTo(OverlayArtist.lineCount(previous));
            assertThat(OverlayArtist.lineAlpha(noise)).isGreaterThanOrEqualTo(OverlayArtist.lineAlpha(previous));
            assertThat(OverlayArtist.dotCount(220, 50, noise)).isGreaterThanOrEqualTo(OverlayArtist.dotCount(220, 50, previous));
            assertThat(OverlayArtist.dotAlpha(noise)).isGreaterThanOrEqualTo(OverlayArtist.dotAlpha(previous));
            previous = noise;
        }
    }

    @Test
    void overlayDarkensWithoutLoweringAlpha() {
        BufferedImage image = new BufferedImage(60, 30, BufferedImage.TYPE_INT_ARGB);
        for (int y = 0; y < 30; y++) {
            for (int x = 0; x < 60; x++) {
                image.setRGB(x, y, PixelMath.argb(120, 255, 255, 255));
            }
        }

        BufferedImage result = artist.decorate(image, 1, new Random(17));

        int darkened = 0;
        for (int y = 0; y < 30; y++) {
            for (int x = 0; x < 60; x++) {
                int p = result.getRGB(x, y);
                assertThat(PixelMath.alpha(p)).isGreaterThanOrEqualTo(120);
                if (PixelMath.red(p) < 255) {
                    darkened++;
                }
            }
        }
        assertThat(darkened).isPositive();
    }

    @Test
    void overlayUsesOnlyBlackInk() {
        BufferedImage overlay = artist.drawOverlay(80, 40, 0.5, new Random(3));

        for (int y = 0; y < 40; y++) {
            for (int x = 0; x < 80; x++) {
                assertThat(overlay.getRGB(x, y) & 0x00FFFFFF).isZero();
            }
        }
    }
}
