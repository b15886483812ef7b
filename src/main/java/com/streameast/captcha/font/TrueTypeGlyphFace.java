package com.streameast.captcha.font;

import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;

public class TrueTypeGlyphFace implements GlyphFace {

    private final Font baseFont;
    private final String name;

    public TrueTypeGlyphFace(Font baseFont, String name) {
        this.baseFont = baseFont;
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void drawGlyph(Graphics2D g, char ch, int x, int top, int fontSize) {
        Font font = baseFont.deriveFont((float) fontSize);
        g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
        g.setRenderingHint(RenderingHints.KEY_FRACTIONALMETRICS, RenderingHints.VALUE_FRACTIONALMETRICS_ON);
        g.setFont(font);
        FontMetrics metrics = g.getFontMetrics(font);
        g.drawString(String.valueOf(ch), x, top + metrics.getAscent());
    }
}
