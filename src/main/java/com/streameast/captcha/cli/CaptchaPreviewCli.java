package com.streameast.captcha.cli;

import com.streameast.captcha.font.FontResolver;
import com.streameast.captcha.model.CaptchaParams;
import com.streameast.captcha.render.CaptchaGenerator;
import com.streameast.captcha.service.ImageCodec;
import com.streameast.captcha.util.AppConstants;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;

import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.util.List;

/**
 * Renders one image with the service defaults and writes it as PNG.
 * Usage: {@code CaptchaPreviewCli [text] [output.png] [fontPath]}
 */
@Slf4j
public class CaptchaPreviewCli {

    static final String DEFAULT_TEXT = "55978";
    static final String DEFAULT_OUTPUT = "captcha_out2.png";

    public static void main(String[] args) throws IOException {
        String text = args.length > 0 ? args[0] : DEFAULT_TEXT;
        File output = new File(args.length > 1 ? args[1] : DEFAULT_OUTPUT);
        String fontPath = args.length > 2 ? args[2] : null;

        FontResolver fontResolver = FontResolver.create(fontPath, AppConstants.DEFAULT_FONT_CANDIDATES, true);
        File written = render(text, output, fontResolver);
        log.info("Wrote {}", written.getAbsolutePath());
    }

    static File render(String text, File output, FontResolver fontResolver) throws IOException {
        CaptchaGenerator generator = new CaptchaGenerator(fontResolver);
        CaptchaParams params = CaptchaParams.builder()
                .text(text)
                .fontSize(30)
                .height(50)
                .meshSteps(List.of(1, 11))
                .gridSpacing(16)
                .distortion(0)
                .noise(1)
                .gridStrength(0)
                .rotation(1)
                .build();

        BufferedImage image = generator.generate(params);
        FileUtils.writeByteArrayToFile(output, new ImageCodec().encodePng(image));
        return output;
    }
}
