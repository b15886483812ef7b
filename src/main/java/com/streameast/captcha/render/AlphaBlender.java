package com.streameast.captcha.render;

import com.streameast.captcha.model.CaptchaParams;
import com.streameast.captcha.model.GrayBuffer;
import com.streameast.captcha.util.AppConstants;
import com.streameast.captcha.util.PixelMath;

import java.awt.image.BufferedImage;

public class AlphaBlender {

    public static int baseSubtraction(double noise, double gridStrength) {
        return (int) Math.round(10 + 140 * (0.2 * noise + 0.8 * gridStrength));
    }

    public static int minAlpha(double noise, double gridStrength) {
        return PixelMath.clamp((int) Math.round(150 - 60 * (0.8 * noise + 0.2 * gridStrength)), 100, 255);
    }

    public GrayBuffer alphaChannel(GrayBuffer noiseField, GrayBuffer grid, BufferedImage textLayer, CaptchaParams params) {
        double noise = params.getNoise();
        double gridStrength = params.getGridStrength();

        GrayBuffer noiseScaled = noiseField.map(p -> (int) (p * noise * 0.85));
        GrayBuffer reduction = noiseScaled.combine(grid, Integer::sum);
        int baseSub = baseSubtraction(noise, gridStrength);
        GrayBuffer alphaMap = reduction.map(p -> (int) (baseSub + p * 0.6));
        GrayBuffer alpha = alphaMap.map(p -> 255 - p);

        if (params.isProtectText()) {
            alpha = alpha.combine(inkFloor(textLayer), Math::max);
        }

        int floor = minAlpha(noise, gridStrength);
        return alpha.map(p -> Math.max(floor, p));
    }

    public GrayBuffer inkFloor(BufferedImage textLayer) {
        int w = textLayer.getWidth();
        int h = textLayer.getHeight();
        int[] pixels = ImageSampler.pixels(textLayer);
        GrayBuffer floor = new GrayBuffer(w, h);
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                if (PixelMath.alpha(pixels[y * w + x]) > AppConstants.PROTECT_TEXT_INK_THRESHOLD) {
                    floor.set(x, y, AppConstants.PROTECT_TEXT_ALPHA_FLOOR);
                }
            }
        }
        return floor;
    }

    public BufferedImage apply(BufferedImage image, GrayBuffer alpha) {
        return PixelPass.replaceAlpha(alpha).applyTo(image);
    }
}
