package com.streameast.captcha.render;

import com.streameast.captcha.util.PixelMath;

import java.awt.image.BufferedImage;

public final class ImageSampler {

    private ImageSampler() {
    }

    public static int[] pixels(BufferedImage image) {
        int w = image.getWidth();
        return image.getRGB(0, 0, w, image.getHeight(), null, 0, w);
    }

    public static BufferedImage fromPixels(int[] pixels, int w, int h) {
        BufferedImage out = new BufferedImage(w, h, BufferedImage.TYPE_INT_ARGB);
        out.setRGB(0, 0, w, h, pixels, 0, w);
        return out;
    }

    public static BufferedImage copy(BufferedImage image) {
        return fromPixels(pixels(image), image.getWidth(), image.getHeight());
    }

    /**
     * Samples at continuous pixel coordinates where {@code (0,0)} is the centre of the top-left
     * pixel. Outside the image the result is transparent unless {@code clampEdge} extends the
     * border pixels.
     */
    public static int sampleBicubic(int[] data, int w, int h, double x, double y, boolean clampEdge) {
        if (!clampEdge && (x < -0.5 || y < -0.5 || x > w - 0.5 || y > h - 0.5)) {
            return 0;
        }
        int x1 = (int) Math.floor(x);
        int y1 = (int) Math.floor(y);
        double[] wx = catmullRomWeights(x - x1);
        double[] wy = catmullRomWeights(y - y1);

        double weight = 0, sa = 0, sr = 0, sg = 0, sb = 0;
        for (int j = 0; j < 4; j++) {
            int yy = y1 + j - 1;
            if (clampEdge) {
                yy = PixelMath.clamp(yy, 0, h - 1);
            } else if (yy < 0 || yy >= h) {
                continue;
            }
            for (int i = 0; i < 4; i++) {
                int xx = x1 + i - 1;
                if (clampEdge) {
                    xx = PixelMath.clamp(xx, 0, w - 1);
                } else if (xx < 0 || xx >= w) {
                    continue;
                }
                double wgt = wx[i] * wy[j];
                int c = data[yy * w + xx];
                double a = PixelMath.alpha(c) / 255.0;
                weight += wgt;
                sa += wgt * a;
                sr += wgt * PixelMath.red(c) * a;
                sg += wgt * PixelMath.green(c) * a;
                sb += wgt * PixelMath.blue(c) * a;
            }
        }
        if (weight <= 1e-12 || sa <= 1e-12) {
            return 0;
        }
        double alpha = sa / weight;
        int ia = PixelMath.clamp255((int) Math.round(alpha * 255.0));
        if (ia == 0) {
            return 0;
        }
        int ir = PixelMath.clamp255((int) Math.round(sr / weight / alpha));
        int ig = PixelMath.clamp255((int) Math.round(sg / weight / alpha));
        int ib = PixelMath.clamp255((int) Math.round(sb / weight / alpha));
        return PixelMath.argb(ia, ir, ig, ib);
    }

    static double[] catmullRomWeights(double t) {
        double a = -0.5, t2 = t * t, t3 = t2 * t;
        double w0 = a * (-t3 + 2 * t2 - t);
        double w1 = (a + 2) * t3 + (-a - 3) * t2 + 1;
        double w2 = (a + 2) * (-t3) + (2 * a + 3) * t2 + (-a) * t;
        double w3 = a * (t3 - t2);
        return new double[]{w0, w1, w2, w3};
    }

    public static BufferedImage rotate(BufferedImage source, double degrees, boolean expand, boolean clampEdge) {
        int sw = source.getWidth();
        int sh = source.getHeight();
        if (degrees == 0.0) {
            return copy(source);
        }
        double theta = Math.toRadians(degrees);
        double cos = Math.cos(theta);
        double sin = Math.sin(theta);

        int dw = sw;
        int dh = sh;
        if (expand) {
            dw = (int) Math.ceil(Math.abs(sw * cos) + Math.abs(sh * sin) - 1e-9);
            dh = (int) Math.ceil(Math.abs(sw * sin) + Math.abs(sh * cos) - 1e-9);
        }

        int[] src = pixels(source);
        int[] dst = new int[dw * dh];
        double scx = sw / 2.0, scy = sh / 2.0;
        double dcx = dw / 2.0, dcy = dh / 2.0;
        for (int y = 0; y < dh; y++) {
            double py = y + 0.5 - dcy;
            for (int x = 0; x < dw; x++) {
                double px = x + 0.5 - dcx;
                double sx = px * cos - py * sin + scx - 0.5;
                double sy = px * sin + py * cos + scy - 0.5;
                dst[y * dw + x] = sampleBicubic(src, sw, sh, sx, sy, clampEdge);
            }
        }
        return fromPixels(dst, dw, dh);
    }
}
