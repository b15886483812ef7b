package com.streameast.captcha.render;

import com.streameast.captcha.model.MeshCell;

import java.awt.image.BufferedImage;
import java.util.List;

public class BicubicMeshWarper implements MeshWarper {

    @Override
    public BufferedImage warp(BufferedImage source, List<MeshCell> mesh) {
        int w = source.getWidth();
        int h = source.getHeight();
        int[] src = ImageSampler.pixels(source);
        int[] dst = new int[w * h];
        double[] point = new double[2];

        for (MeshCell cell : mesh) {
            if (cell.isEmpty()) {
                continue;
            }
            if (cell.getX0() < 0 || cell.getY0() < 0 || cell.getX1() > w || cell.getY1() > h) {
                throw new IllegalArgumentException("Mesh cell " + cell.getIndex() + " lies outside a "
                        + w + "x" + h + " canvas");
            }
            double cw = cell.width();
            double ch = cell.height();
            for (int y = cell.getY0(); y < cell.getY1(); y++) {
                double v = (y + 0.5 - cell.getY0()) / ch;
                for (int x = cell.getX0(); x < cell.getX1(); x++) {
                    double u = (x + 0.5 - cell.getX0()) / cw;
                    cell.getQuad().interpolate(u, v, point);
                    dst[y * w + x] = ImageSampler.sampleBicubic(src, w, h, point[0] - 0.5, point[1] - 0.5, true);
                }
            }
        }
        return ImageSampler.fromPixels(dst, w, h);
    }
}
