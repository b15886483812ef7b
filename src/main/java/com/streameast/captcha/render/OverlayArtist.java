package com.streameast.captcha.render;

import com.streameast.captcha.util.PixelMath;

import java.awt.AlphaComposite;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.util.Random;

public class OverlayArtist {

    public static int lineCount(double noise) {
        return (int) Math.round(2 + 12 * noise);
    }

    public static int lineAlpha(double noise) {
        return (int) Math.round(20 + 140 * noise);
    }

    public static int dotCount(int width, int height, double noise) {
        return (int) Math.round(width * height * 0.0006 * (1 + 2 * noise));
    }

    public static int dotAlpha(double noise) {
        return (int) Math.round(10 + 140 * noise);
    }

    public BufferedImage decorate(BufferedImage image, double noise, Random random) {
        return PixelPass.over(drawOverlay(image.getWidth(), image.getHeight(), noise, random)).applyTo(image);
    }

    BufferedImage drawOverlay(int w, int h, double noise, Random random) {
        BufferedImage overlay = new BufferedImage(w, h, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = overlay.createGraphics();
        try {
            g.setComposite(AlphaComposite.Src);
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_OFF);
            g.setColor(new Color(0, 0, 0, lineAlpha(noise)));
            int lines = lineCount(noise);
            for (int i = 0; i < lines; i++) {
                int x0 = random.nextInt(w + 1);
                int y0 = random.nextInt(h + 1);
                int x1 = random.nextInt(w + 1);
                int y1 = random.nextInt(h + 1);
                g.setStroke(new BasicStroke(1 + random.nextInt(2)));
                g.drawLine(x0, y0, x1, y1);
            }
        } finally {
            g.dispose();
        }

        int dot = PixelMath.argb(dotAlpha(noise), 0, 0, 0);
        int dots = dotCount(w, h, noise);
        for (int i = 0; i < dots; i++) {
            overlay.setRGB(random.nextInt(w), random.nextInt(h), dot);
        }
        return overlay;
    }
}
