package com.streameast.captcha.font;

import java.awt.Graphics2D;

public interface GlyphFace {

    String getName();

    void drawGlyph(Graphics2D g, char ch, int x, int top, int fontSize);
}
