package com.streameast.captcha.util;

public final class PixelMath {

    private PixelMath() {
    }

    public static int clamp(int v, int lo, int hi) {
        return v < lo ? lo : (v > hi ? hi : v);
    }

    public static int clamp255(int v) {
        return clamp(v, 0, 255);
    }

    public static double clamp01(double v) {
        if (Double.isNaN(v)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, v));
    }

    public static int alpha(int argb) {
        return (argb >>> 24) & 0xFF;
    }

    public static int red(int argb) {
        return (argb >>> 16) & 0xFF;
    }

    public static int green(int argb) {
        return (argb >>> 8) & 0xFF;
    }

    public static int blue(int argb) {
        return argb & 0xFF;
    }

    public static int argb(int a, int r, int g, int b) {
        return (a << 24) | (r << 16) | (g << 8) | b;
    }

    public static int over(int src, int dst) {
        int sa = alpha(src);
        if (sa == 0) {
            return dst;
        }
        if (sa == 255) {
            return src;
        }
        double as = sa / 255.0;
        double ad = alpha(dst) / 255.0;
        double ao = as + ad * (1.0 - as);
        if (ao <= 0.0) {
            return 0;
        }
        int r = blend(red(src), red(dst), as, ad, ao);
        int g = blend(green(src), green(dst), as, ad, ao);
        int b = blend(blue(src), blue(dst), as, ad, ao);
        return argb(clamp255((int) Math.round(ao * 255.0)), r, g, b);
    }

    private static int blend(int cs, int cd, double as, double ad, double ao) {
        return clamp255((int) Math.round((cs * as + cd * ad * (1.0 - as)) / ao));
    }
}
