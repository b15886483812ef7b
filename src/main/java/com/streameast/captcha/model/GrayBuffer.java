package com.streameast.captcha.model;

import com.streameast.captcha.util.PixelMath;
import lombok.Getter;

import java.util.Arrays;
import java.util.function.IntBinaryOperator;
import java.util.function.IntUnaryOperator;

public class GrayBuffer {

    @Getter
    private final int width;
    @Getter
    private final int height;
    private final int[] values;

    public GrayBuffer(int width, int height) {
        this.width = width;
        this.height = height;
        this.values = new int[width * height];
    }

    public static GrayBuffer filled(int width, int height, int value) {
        GrayBuffer buffer = new GrayBuffer(width, height);
        Arrays.fill(buffer.values, PixelMath.clamp255(value));
        return buffer;
    }

    public int get(int x, int y) {
        return values[y * width + x];
    }

    public void set(int x, int y, int value) {
        values[y * width + x] = PixelMath.clamp255(value);
    }

    public void fillRect(int left, int top, int right, int bottom, int value) {
        int x0 = Math.max(0, left);
        int y0 = Math.max(0, top);
        int x1 = Math.min(width - 1, right);
        int y1 = Math.min(height - 1, bottom);
        if (x0 > x1 || y0 > y1) {
            return;
        }
        int v = PixelMath.clamp255(value);
        for (int y = y0; y <= y1; y++) {
            Arrays.fill(values, y * width + x0, y * width + x1 + 1, v);
        }
    }

    public GrayBuffer map(IntUnaryOperator op) {
        GrayBuffer out = new GrayBuffer(width, height);
        for (int i = 0; i < values.length; i++) {
            out.values[i] = PixelMath.clamp255(op.applyAsInt(values[i]));
        }
        return out;
    }

    public GrayBuffer combine(GrayBuffer other, IntBinaryOperator op) {
        if (other.width != width || other.height != height) {
            throw new IllegalArgumentException("Buffer size mismatch: " + width + "x" + height
                    + " vs " + other.width + "x" + other.height);
        }
        GrayBuffer out = new GrayBuffer(width, height);
        for (int i = 0; i < values.length; i++) {
            out.values[i] = PixelMath.clamp255(op.applyAsInt(values[i], other.values[i]));
        }
        return out;
    }

    public int min() {
        return Arrays.stream(values).min().orElse(0);
    }
}
