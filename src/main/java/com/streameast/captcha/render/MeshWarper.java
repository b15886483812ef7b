package com.streameast.captcha.render;

import com.streameast.captcha.model.MeshCell;

import java.awt.image.BufferedImage;
import java.util.List;

public interface MeshWarper {

    BufferedImage warp(BufferedImage source, List<MeshCell> mesh);
}
