package com.streameast.captcha.render;

import java.awt.image.BufferedImage;
import java.util.Arrays;

public class BaseCompositor {

    static final int BACKGROUND = 0xFFFFFFFF;

    public BufferedImage compose(BufferedImage textLayer) {
        int w = textLayer.getWidth();
        int h = textLayer.getHeight();
        int[] background = new int[w * h];
        Arrays.fill(background, BACKGROUND);
        return PixelPass.over(textLayer).applyTo(ImageSampler.fromPixels(background, w, h));
    }
}
