package com.streameast.captcha.model;

import lombok.Value;

@Value
public class MeshCell {
    int index;
    int x0;
    int y0;
    int x1;
    int y1;
    Quad quad;

    public int width() {
        return x1 - x0;
    }

    public int height() {
        return y1 - y0;
    }

    public boolean isEmpty() {
        return x1 <= x0 || y1 <= y0;
    }
}
