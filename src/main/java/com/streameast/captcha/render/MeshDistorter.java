package com.streameast.captcha.render;

import com.streameast.captcha.model.CaptchaParams;
import com.streameast.captcha.model.MeshCell;
import com.streameast.captcha.model.Quad;
import lombok.extern.slf4j.Slf4j;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

@Slf4j
public class MeshDistorter {

    static final double MIN_DISTORTION = 0.001;
    static final double X_OFFSET_FACTOR = 0.25;
    static final double Y_OFFSET_FACTOR = 0.30;
    static final double IDLE_ROTATION_DEG = 1.0;
    static final double FAILURE_ROTATION_DEG = 2.0;

    private final MeshWarper warper;

    public MeshDistorter() {
        this(new BicubicMeshWarper());
    }

    public MeshDistorter(MeshWarper warper) {
        this.warper = warper;
    }

    public BufferedImage distort(BufferedImage image, CaptchaParams params, Random random) {
        double distortion = params.getDistortion();
        if (distortion <= MIN_DISTORTION) {
            double angle = GlyphRenderer.uniform(random, -IDLE_ROTATION_DEG, IDLE_ROTATION_DEG) * params.getRotation();
            return ImageSampler.rotate(image, angle, false, true);
        }

        List<MeshCell> mesh = buildMesh(image.getWidth(), image.getHeight(),
                params.meshStepsX(), params.meshStepsY(), distortion, random);
        try {
            return warper.warp(image, mesh);
        } catch (RuntimeException e) {
            log.warn("Mesh warp failed, falling back to rotation: {}", e.getMessage());
            double angle = GlyphRenderer.uniform(random, -FAILURE_ROTATION_DEG, FAILURE_ROTATION_DEG);
            return ImageSampler.rotate(image, angle, false, true);
        }
    }

    public List<MeshCell> buildMesh(int w, int h, int nx, int ny, double distortion, Random random) {
        double cellW = (double) w / nx;
        double cellH = (double) h / ny;
        double maxX = Math.max(1.0, cellW * X_OFFSET_FACTOR * distortion);
        double maxY = Math.max(1.0, cellH * Y_OFFSET_FACTOR * distortion);

        List<MeshCell> mesh = new ArrayList<>(nx * ny);
        for (int i = 0; i < nx; i++) {
            int x0 = (int) ((long) i * w / nx);
            int x1 = (int) ((long) (i + 1) * w / nx);
            for (int j = 0; j < ny; j++) {
                int y0 = (int) ((long) j * h / ny);
                int y1 = (int) ((long) (j + 1) * h / ny);
                Quad quad = new Quad(
                        x0 + offset(random, maxX), y0 + offset(random, maxY),
                        x1 + offset(random, maxX), y0 + offset(random, maxY),
                        x1 + offset(random, maxX), y1 + offset(random, maxY),
                        x0 + offset(random, maxX), y1 + offset(random, maxY));
                mesh.add(new MeshCell(mesh.size(), x0, y0, x1, y1, quad));
            }
        }
        return mesh;
    }

    private static double offset(Random random, double max) {
        return GlyphRenderer.uniform(random, -max, max);
    }
}
