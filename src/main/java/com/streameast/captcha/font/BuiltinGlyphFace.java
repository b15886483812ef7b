package com.streameast.captcha.font;

import java.awt.Graphics2D;
import java.util.HashMap;
import java.util.Map;

public class BuiltinGlyphFace implements GlyphFace {

    public static final BuiltinGlyphFace INSTANCE = new BuiltinGlyphFace();

    private static final int COLUMNS = 5;
    private static final int ROWS = 7;

    private static final String CHARS = "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZ";
    private static final String[] PATTERNS = {
            "01110 10001 10011 10101 11001 10001 01110",
            "00100 01100 00100 00100 00100 00100 01110",
            "01110 10001 00001 00010 00100 01000 11111",
            "11111 00010 00100 00010 00001 10001 01110",
            "00010 00110 01010 10010 11111 00010 00010",
            "11111 10000 11110 00001 00001 10001 01110",
            "00110 01000 10000 11110 10001 10001 01110",
            "11111 00001 00010 00100 01000 01000 01000",
            "01110 10001 10001 01110 10001 10001 01110",
            "01110 10001 10001 01111 00001 00010 01100",
            "01110 10001 10001 11111 10001 10001 10001",
            "11110 10001 10001 11110 10001 10001 11110",
            "01110 10001 10000 10000 10000 10001 01110",
            "11100 10010 10001 10001 10001 10010 11100",
            "11111 10000 10000 11110 10000 10000 11111",
            "11111 10000 10000 11110 10000 10000 10000",
            "01110 10001 10000 10111 10001 10001 01111",
            "10001 10001 10001 11111 10001 10001 10001",
            "01110 00100 00100 00100 00100 00100 01110",
            "00111 00010 00010 00010 00010 10010 01100",
            "10001 10010 10100 11000 10100 10010 10001",
            "10000 10000 10000 10000 10000 10000 11111",
            "10001 11011 10101 10101 10001 10001 10001",
            "10001 10001 11001 10101 10011 10001 10001",
            "01110 10001 10001 10001 10001 10001 01110",
            "11110 10001 10001 11110 10000 10000 10000",
            "01110 10001 10001 10001 10101 10010 01101",
            "11110 10001 10001 11110 10100 10010 10001",
            "01111 10000 10000 01110 00001 00001 11110",
            "11111 00100 00100 00100 00100 00100 00100",
            "10001 10001 10001 10001 10001 10001 01110",
            "10001 10001 10001 10001 10001 01010 00100",
            "10001 10001 10001 10101 10101 10101 01010",
            "10001 10001 01010 00100 01010 10001 10001",
            "10001 10001 10001 01010 00100 00100 00100",
            "11111 00001 00010 00100 01000 10000 11111"
    };
    private static final String UNKNOWN = "11111 10001 10001 10001 10001 10001 11111";

    private static final Map<Character, boolean[][]> GLYPHS = new HashMap<>();
    private static final boolean[][] UNKNOWN_GLYPH = parse(UNKNOWN);

    static {
        for (int i = 0; i < CHARS.length(); i++) {
            GLYPHS.put(CHARS.charAt(i), parse(PATTERNS[i]));
        }
    }

    private BuiltinGlyphFace() {
    }

    @Override
    public String getName() {
        return "builtin-5x7";
    }

    @Override
    public void drawGlyph(Graphics2D g, char ch, int x, int top, int fontSize) {
        if (Character.isWhitespace(ch)) {
            return;
        }
        boolean[][] glyph = GLYPHS.getOrDefault(Character.toUpperCase(ch), UNKNOWN_GLYPH);
        int dot = Math.max(1, Math.round(fontSize * 0.7f / ROWS));
        int y0 = top + Math.round(fontSize * 0.2f);
        for (int row = 0; row < ROWS; row++) {
            for (int col = 0; col < COLUMNS; col++) {
                if (glyph[row][col]) {
                    g.fillRect(x + col * dot, y0 + row * dot, dot, dot);
                }
            }
        }
    }

    private static boolean[][] parse(String pattern) {
        String[] rows = pattern.split(" ");
        boolean[][] bits = new boolean[ROWS][COLUMNS];
        for (int row = 0; row < ROWS; row++) {
            for (int col = 0; col < COLUMNS; col++) {
                bits[row][col] = rows[row].charAt(col) == '1';
            }
        }
        return bits;
    }
}
