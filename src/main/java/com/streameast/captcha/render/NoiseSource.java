package com.streameast.captcha.render;

import com.streameast.captcha.model.GrayBuffer;

import java.util.Random;

public interface NoiseSource {

    GrayBuffer generate(int width, int height, int amplitude, double noise, Random random);
}
