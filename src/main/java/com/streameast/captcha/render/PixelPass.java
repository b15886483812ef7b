package com.streameast.captcha.render;

import com.streameast.captcha.model.GrayBuffer;
import com.streameast.captcha.util.PixelMath;

import java.awt.image.BufferedImage;
import java.util.function.IntUnaryOperator;

@FunctionalInterface
public interface PixelPass {

    int apply(int argb, int x, int y);

    default PixelPass andThen(PixelPass next) {
        return (argb, x, y) -> next.apply(apply(argb, x, y), x, y);
    }

    default BufferedImage applyTo(BufferedImage source) {
        int w = source.getWidth();
        int h = source.getHeight();
        int[] pixels = source.getRGB(0, 0, w, h, null, 0, w);
        for (int y = 0; y < h; y++) {
            int row = y * w;
            for (int x = 0; x < w; x++) {
                pixels[row + x] = apply(pixels[row + x], x, y);
            }
        }
        BufferedImage out = new BufferedImage(w, h, BufferedImage.TYPE_INT_ARGB);
        out.setRGB(0, 0, w, h, pixels, 0, w);
        return out;
    }

    static PixelPass rgb(IntUnaryOperator channelOp) {
        return (argb, x, y) -> PixelMath.argb(
                PixelMath.alpha(argb),
                PixelMath.clamp255(channelOp.applyAsInt(PixelMath.red(argb))),
                PixelMath.clamp255(channelOp.applyAsInt(PixelMath.green(argb))),
                PixelMath.clamp255(channelOp.applyAsInt(PixelMath.blue(argb))));
    }

    static PixelPass replaceAlpha(GrayBuffer alpha) {
        return (argb, x, y) -> (alpha.get(x, y) << 24) | (argb & 0x00FFFFFF);
    }

    static PixelPass over(BufferedImage top) {
        int w = top.getWidth();
        int[] topPixels = top.getRGB(0, 0, w, top.getHeight(), null, 0, w);
        return (argb, x, y) -> PixelMath.over(topPixels[y * w + x], argb);
    }
}
