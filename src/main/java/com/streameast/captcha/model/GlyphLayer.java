package com.streameast.captcha.model;

import lombok.Value;

import java.awt.image.BufferedImage;

@Value
public class GlyphLayer {
    BufferedImage image;
    int offsetX;
}
