package com.streameast.captcha.render;

import java.awt.image.BufferedImage;

public class Finisher {

    static final PixelPass CONTRAST = PixelPass.rgb(p -> (int) ((p - 16) * 1.06 + 6));

    public BufferedImage finish(BufferedImage image) {
        return CONTRAST.applyTo(image);
    }
}
