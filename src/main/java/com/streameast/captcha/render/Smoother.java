package com.streameast.captcha.render;

import com.streameast.captcha.util.PixelMath;

import java.awt.image.BufferedImage;

public class Smoother {

    static final int BOX_PASSES = 3;

    public static double radiusFor(double distortion) {
        return 0.3 * (0.5 + 0.5 * distortion);
    }

    public BufferedImage smooth(BufferedImage image, double distortion) {
        return blur(image, radiusFor(distortion));
    }

    // Gaussian of standard deviation `radius` as three extended box passes per axis on premultiplied
    // channels; the box radius is fractional, so sub-pixel radii still blur
    public BufferedImage blur(BufferedImage image, double radius) {
        double boxRadius = boxRadius(radius, BOX_PASSES);
        if (boxRadius <= 0) {
            return ImageSampler.copy(image);
        }
        int whole = (int) Math.floor(boxRadius);
        double edge = boxRadius - whole;

        int w = image.getWidth();
        int h = image.getHeight();
        int[] src = ImageSampler.pixels(image);
        double[] planes = new double[w * h * 4];
        for (int i = 0; i < src.length; i++) {
            int c = src[i];
            double a = PixelMath.alpha(c);
            planes[i * 4] = a;
            planes[i * 4 + 1] = PixelMath.red(c) * a / 255.0;
            planes[i * 4 + 2] = PixelMath.green(c) * a / 255.0;
            planes[i * 4 + 3] = PixelMath.blue(c) * a / 255.0;
        }

        double[] line = new double[Math.max(w, h) * 4];
        for (int pass = 0; pass < BOX_PASSES; pass++) {
            for (int y = 0; y < h; y++) {
                boxLine(planes, y * w, 1, w, whole, edge, line);
            }
        }
        for (int pass = 0; pass < BOX_PASSES; pass++) {
            for (int x = 0; x < w; x++) {
                boxLine(planes, x, w, h, whole, edge, line);
            }
        }

        int[] out = new int[w * h];
        for (int i = 0; i < out.length; i++) {
            out[i] = unpremultiply(planes, i * 4);
        }
        return ImageSampler.fromPixels(out, w, h);
    }

    /**
     * Box radius whose {@code passes}-fold self-convolution has the variance of a Gaussian with
     * standard deviation {@code radius} (Gwosdek et al., "Theoretical foundations of Gaussian
     * convolution by extended box filtering").
     */
    static double boxRadius(double radius, int passes) {
        double sigma2 = radius * radius / passes;
        double boxLength = Math.sqrt(12.0 * sigma2 + 1.0);
        double whole = Math.floor((boxLength - 1.0) / 2.0);
        double fraction = (2 * whole + 1) * (whole * (whole + 1) - 3 * sigma2)
                / (6 * (sigma2 - (whole + 1) * (whole + 1)));
        return Math.max(0.0, whole + fraction);
    }

    // one box pass over `n` pixels starting at pixel `start`, `stride` pixels apart; edges repeat
    private static void boxLine(double[] planes, int start, int stride, int n, int whole, double edge, double[] line) {
        for (int i = 0; i < n; i++) {
            System.arraycopy(planes, (start + i * stride) * 4, line, i * 4, 4);
        }
        double norm = 1.0 / (2 * whole + 1 + 2 * edge);
        for (int i = 0; i < n; i++) {
            int o = (start + i * stride) * 4;
            int before = PixelMath.clamp(i - whole - 1, 0, n - 1) * 4;
            int after = PixelMath.clamp(i + whole + 1, 0, n - 1) * 4;
            for (int c = 0; c < 4; c++) {
                double acc = edge * (line[before + c] + line[after + c]);
                for (int k = -whole; k <= whole; k++) {
                    acc += line[PixelMath.clamp(i + k, 0, n - 1) * 4 + c];
                }
                planes[o + c] = acc * norm;
            }
        }
    }

    private static int unpremultiply(double[] planes, int o) {
        int a = PixelMath.clamp255((int) Math.round(planes[o]));
        if (a == 0) {
            return 0;
        }
        double scale = 255.0 / planes[o];
        return PixelMath.argb(a,
                PixelMath.clamp255((int) Math.round(planes[o + 1] * scale)),
                PixelMath.clamp255((int) Math.round(planes[o + 2] * scale)),
                PixelMath.clamp255((int) Math.round(planes[o + 3] * scale)));
    }
}
