package com.streameast.captcha.model;

import lombok.Value;

import java.awt.image.BufferedImage;

@Value
public class CaptchaRender {
    BufferedImage image;
    BufferedImage textLayer;
    CaptchaParams params;
}
