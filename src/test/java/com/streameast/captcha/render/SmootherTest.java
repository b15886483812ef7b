package com.streameast.captcha.render;

import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SmootherTest {

    private final Smoother smoother = new Smoother();

    @Test
    void radiusGrowsWithDistortion() {
        assertThat(Smoother.radiusFor(0)).isCloseTo(0.15, within(1e-9));
        assertThat(Smoother.radiusFor(1)).isCloseTo(0.3, within(1e-9));
    }

    @Test
    void boxRadiusMatchesGaussianVariance() {
        assertThat(Smoother.boxRadius(0, 3)).isZero();
        assertThat(Smoother.boxRadius(0.15, 3)).isCloseTo(0.003778, within(1e-5));
        assertThat(Smoother.boxRadius(1.0, 3)).isCloseTo(0.25, within(1e-9));
        assertThat(Smoother.boxRadius(5.0, 3)).isGreaterThan(2.0);
    }

    @Test
    void uniformImageStaysUniform() {
        BufferedImage image = new BufferedImage(20, 10, BufferedImage.TYPE_INT_ARGB);
        for (int y = 0; y < 10; y++) {
            for (int x = 0; x < 20; x++) {
                image.setRGB(x, y, 0xFFFFFFFF);
            }
        }

        BufferedImage result = smoother.smooth(image, 1.0);

        assertThat(MeshDistorterTest.countDifferences(result, image)).isZero();
    }

    @Test
    void softensHardEdgeAtLowestDistortion() {
        BufferedImage image = hardEdge();

        BufferedImage result = smoother.smooth(image, 0);

        int left = result.getRGB(9, 5) & 0xFF;
        int right = result.getRGB(10, 5) & 0xFF;
        assertThat(left).isGreaterThan(0);
        assertThat(right).isLessThan(255);
        assertThat(result.getRGB(0, 5)).isEqualTo(0xFF000000);
        assertThat(result.getRGB(19, 5)).isEqualTo(0xFFFFFFFF);
    }

    @Test
    void higherDistortionSoftensMore() {
        BufferedImage image = hardEdge();

        int quiet = smoother.smooth(image, 0).getRGB(9, 5) & 0xFF;
        int strong = smoother.smooth(image, 1).getRGB(9, 5) & 0xFF;

        assertThat(strong).isGreaterThan(quiet);
    }

    @Test
    void widerRadiusReachesFurther() {
        BufferedImage result = smoother.blur(hardEdge(), 3.0);

        assertThat(result.getRGB(7, 5) & 0xFF).isGreaterThan(0);
        assertThat(result.getRGB(12, 5) & 0xFF).isLessThan(255);
        assertThat(result.getRGB(0, 5)).isEqualTo(0xFF000000);
    }

    private static BufferedImage hardEdge() {
        BufferedImage image = new BufferedImage(20, 10, BufferedImage.TYPE_INT_ARGB);
        for (int y = 0; y < 10; y++) {
            for (int x = 0; x < 20; x++) {
                image.setRGB(x, y, x < 10 ? 0xFF000000 : 0xFFFFFFFF);
            }
        }
        return image;
    }
}
