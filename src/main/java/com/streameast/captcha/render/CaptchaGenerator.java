package com.streameast.captcha.render;

import com.streameast.captcha.font.FontResolver;
import com.streameast.captcha.font.GlyphFace;
import com.streameast.captcha.model.CaptchaParams;
import com.streameast.captcha.model.CaptchaRender;
import com.streameast.captcha.model.GrayBuffer;
import lombok.extern.slf4j.Slf4j;

import java.awt.image.BufferedImage;
import java.util.Random;
import java.util.concurrent.CancellationException;

@Slf4j
public class CaptchaGenerator {

    private final FontResolver fontResolver;
    private final ParameterNormalizer normalizer = new ParameterNormalizer();
    private final BaseCompositor compositor = new BaseCompositor();
    private final MeshDistorter meshDistorter;
    private final Smoother smoother = new Smoother();
    private final NoiseGridGenerator noiseGridGenerator;
    private final AlphaBlender alphaBlender = new AlphaBlender();
    private final OverlayArtist overlayArtist = new OverlayArtist();
    private final Finisher finisher = new Finisher();

    public CaptchaGenerator(FontResolver fontResolver) {
        this(fontResolver, new MeshDistorter(), new NoiseGridGenerator());
    }

    public CaptchaGenerator(FontResolver fontResolver, MeshDistorter meshDistorter, NoiseGridGenerator noiseGridGenerator) {
        this.fontResolver = fontResolver;
        this.meshDistorter = meshDistorter;
        this.noiseGridGenerator = noiseGridGenerator;
    }

    public BufferedImage generate(CaptchaParams params) {
        return render(params).getImage();
    }

    public CaptchaRender render(CaptchaParams params) {
        CaptchaParams normalized = normalizer.normalize(params);
        Random random = normalized.getSeed() != null ? new Random(normalized.getSeed()) : new Random();
        return run(normalized, random);
    }

    public CaptchaRender render(CaptchaParams params, Random random) {
        return run(normalizer.normalize(params), random);
    }

    private CaptchaRender run(CaptchaParams p, Random random) {
        int w = p.getWidth();
        int h = p.getHeight();
        GlyphFace face = fontResolver.resolve(p.getFontPath());
        log.debug("Rendering {} characters on {}x{} with {}", p.getText().length(), w, h, face.getName());

        BufferedImage textLayer = new GlyphRenderer(face).renderTextLayer(p, random);
        BufferedImage image = compositor.compose(textLayer);
        checkInterrupted();
        image = meshDistorter.distort(image, p, random);
        checkInterrupted();
        image = smoother.smooth(image, p.getDistortion());
        checkInterrupted();

        GrayBuffer noiseField = noiseGridGenerator.noiseField(w, h, p.getNoise(), random);
        GrayBuffer grid = noiseGridGenerator.gridOverlay(w, h, p.getGridSpacing(), p.getGridStrength());
        GrayBuffer alpha = alphaBlender.alphaChannel(noiseField, grid, textLayer, p);
        image = alphaBlender.apply(image, alpha);
        checkInterrupted();

        image = overlayArtist.decorate(image, p.getNoise(), random);
        image = finisher.finish(image);
        return new CaptchaRender(image, textLayer, p);
    }

    // a timed-out request cancels its task; stop at the next stage boundary
    private static void checkInterrupted() {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Render interrupted");
        }
    }
}
