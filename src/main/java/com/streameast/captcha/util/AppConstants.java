package com.streameast.captcha.util;

import java.util.List;

public final class AppConstants {

    /**
     * Source-alpha level above which a text-layer pixel counts as glyph ink.
     */
    public static final int PROTECT_TEXT_INK_THRESHOLD = 16;

    /**
     * Alpha forced onto glyph ink when text protection is enabled.
     */
    public static final int PROTECT_TEXT_ALPHA_FLOOR = 230;

    public static final int MAX_TEXT_LENGTH = 64;
    public static final int MAX_CANVAS_DIMENSION = 1024;
    public static final int MAX_FONT_SIZE = MAX_CANVAS_DIMENSION / 2;
    public static final int MAX_MESH_STEPS = 256;

    public static final int MIN_AUTO_WIDTH = 220;
    public static final int GLYPH_START_X = 20;
    public static final int GLYPH_RIGHT_MARGIN = 20;
    public static final double MAX_GLYPH_ANGLE_DEG = 12.0;

    public static final List<String> DEFAULT_FONT_CANDIDATES = List.of(
            "arial.ttf",
            "/usr/share/fonts/truetype/dejavu/DejaVuSans.ttf",
            "/usr/share/fonts/truetype/liberation/LiberationSans-Regular.ttf");

    public static final String PNG_DATA_URI_PREFIX = "data:image/png;base64,";
    public static final String PERFORMANCE_LOGGER = "com.streameast.captcha.performance";

    private AppConstants() {
    }
}
