package com.streameast.captcha.render;

import com.streameast.captcha.model.GrayBuffer;
import lombok.extern.slf4j.Slf4j;

import java.util.Random;

@Slf4j
public class NoiseGridGenerator {

    private final NoiseSource primary;
    private final NoiseSource fallback;

    public NoiseGridGenerator() {
        this(new GaussianNoiseSource(), new UniformNoiseSource());
    }

    public NoiseGridGenerator(NoiseSource primary, NoiseSource fallback) {
        this.primary = primary;
        this.fallback = fallback;
    }

    public static int noiseAmplitude(double noise) {
        return (int) Math.round(8 + 120 * noise);
    }

    public static int gridHalfWidth(int gridSpacing, double gridStrength) {
        return (int) Math.max(1, Math.round(Math.max(1, gridSpacing * 0.06) * (0.3 + gridStrength)));
    }

    public static int gridIntensity(double gridStrength) {
        return (int) Math.round(48 + 160 * gridStrength);
    }

    public GrayBuffer noiseField(int width, int height, double noise, Random random) {
        int amplitude = noiseAmplitude(noise);
        try {
            return primary.generate(width, height, amplitude, noise, random);
        } catch (RuntimeException e) {
            log.warn("Noise source failed, using uniform fallback: {}", e.getMessage());
            return fallback.generate(width, height, amplitude, noise, random);
        }
    }

    public GrayBuffer gridOverlay(int width, int height, int gridSpacing, double gridStrength) {
        GrayBuffer grid = new GrayBuffer(width, height);
        int half = gridHalfWidth(gridSpacing, gridStrength);
        int intensity = gridIntensity(gridStrength);
        for (int gx = 0; gx < width; gx += gridSpacing) {
            grid.fillRect(gx - half, 0, gx + half, height, intensity);
        }
        for (int gy = 0; gy < height; gy += gridSpacing) {
            grid.fillRect(0, gy - half, width, gy + half, intensity);
        }
        return grid;
    }
}
