package com.streameast.captcha.font;

import lombok.extern.slf4j.Slf4j;

import java.awt.Font;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.Optional;

@Slf4j
public class LogicalFontSource implements FontSource {

    @Override
    public String describe() {
        return "logical:" + Font.SANS_SERIF;
    }

    @Override
    public Optional<GlyphFace> load() {
        try {
            GlyphFace face = new TrueTypeGlyphFace(new Font(Font.SANS_SERIF, Font.PLAIN, 12), Font.SANS_SERIF);
            BufferedImage probe = new BufferedImage(16, 16, BufferedImage.TYPE_INT_ARGB);
            Graphics2D g = probe.createGraphics();
            try {
                face.drawGlyph(g, '0', 0, 0, 12);
            } finally {
                g.dispose();
            }
            return Optional.of(face);
        } catch (RuntimeException | LinkageError e) {
            log.warn("Logical font unavailable: {}", e.toString());
            return Optional.empty();
        }
    }
}
