package com.streameast.captcha.render;

import com.streameast.captcha.font.GlyphFace;
import com.streameast.captcha.model.CaptchaParams;
import com.streameast.captcha.model.GlyphLayer;
import com.streameast.captcha.util.AppConstants;
import lombok.extern.slf4j.Slf4j;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

@Slf4j
public class GlyphRenderer {

    static final Color INK = new Color(10, 10, 10, 255);

    private final GlyphFace face;

    public GlyphRenderer(GlyphFace face) {
        this.face = face;
    }

    public List<GlyphLayer> renderGlyphs(CaptchaParams params, Random random) {
        int w = params.getWidth();
        int h = params.getHeight();
        int fontSize = params.getFontSize();
        int glyphWidth = (int) Math.floor(fontSize * 1.05) + 8;
        int yOffset = Math.max(0, (h - fontSize) / 2 - 2);
        double maxAngle = AppConstants.MAX_GLYPH_ANGLE_DEG * params.getRotation();

        List<GlyphLayer> layers = new ArrayList<>();
        int cursor = AppConstants.GLYPH_START_X;
        String text = params.getText();
        for (int i = 0; i < text.length(); i++) {
            BufferedImage canvas = new BufferedImage(glyphWidth, h, BufferedImage.TYPE_INT_ARGB);
            Graphics2D g = canvas.createGraphics();
            try {
                g.setColor(INK);
                face.drawGlyph(g, text.charAt(i), 4, yOffset, fontSize);
            } finally {
                g.dispose();
            }

            double angle = uniform(random, -maxAngle, maxAngle);
            BufferedImage rotated = ImageSampler.rotate(canvas, angle, true, false);
            if (cursor + rotated.getWidth() > w - AppConstants.GLYPH_RIGHT_MARGIN) {
                log.debug("Text truncated at {} of {} characters", i, text.length());
                break;
            }
            layers.add(new GlyphLayer(rotated, cursor));
            cursor += (int) Math.floor(fontSize * 0.68) + random.nextInt(5) - 1;
        }
        return layers;
    }

    public BufferedImage renderTextLayer(CaptchaParams params, Random random) {
        BufferedImage textLayer = new BufferedImage(params.getWidth(), params.getHeight(), BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = textLayer.createGraphics();
        try {
            for (GlyphLayer layer : renderGlyphs(params, random)) {
                g.drawImage(layer.getImage(), layer.getOffsetX(), 0, null);
            }
        } finally {
            g.dispose();
        }
        return textLayer;
    }

    static double uniform(Random random, double min, double max) {
        return min + (max - min) * random.nextDouble();
    }
}
