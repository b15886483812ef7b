package com.streameast.captcha.render;

import com.streameast.captcha.model.GrayBuffer;

import java.util.Random;

public class GaussianNoiseSource implements NoiseSource {

    @Override
    public GrayBuffer generate(int width, int height, int amplitude, double noise, Random random) {
        GrayBuffer field = new GrayBuffer(width, height);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                field.set(x, y, (int) Math.round(128 + random.nextGaussian() * amplitude));
            }
        }
        return field;
    }
}
