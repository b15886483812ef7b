package com.streameast.captcha.model;

import lombok.Value;

@Value
public class Quad {
    // corners clockwise from the top-left
    double nwX;
    double nwY;
    double neX;
    double neY;
    double seX;
    double seY;
    double swX;
    double swY;

    // u runs west to east, v north to south
    public void interpolate(double u, double v, double[] out) {
        double topX = nwX + (neX - nwX) * u;
        double topY = nwY + (neY - nwY) * u;
        double bottomX = swX + (seX - swX) * u;
        double bottomY = swY + (seY - swY) * u;
        out[0] = topX + (bottomX - topX) * v;
        out[1] = topY + (bottomY - topY) * v;
    }
}
