package com.streameast.captcha.service;

import com.streameast.captcha.config.AppSettings;
import com.streameast.captcha.model.CaptchaParams;
import com.streameast.captcha.render.CaptchaGenerator;
import com.streameast.captcha.util.AppConstants;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.util.List;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

@Slf4j
@Service
public class CaptchaService {

    private static final Logger performanceLogger = LoggerFactory.getLogger(AppConstants.PERFORMANCE_LOGGER);
    private final AppSettings appSettings;
    private final CaptchaGenerator captchaGenerator;
    private final ImageCodec imageCodec;
    private final ThreadPoolTaskExecutor captchaRenderExecutor;

    public CaptchaService(AppSettings appSettings, CaptchaGenerator captchaGenerator, ImageCodec imageCodec,
                          @Qualifier("captchaRenderExecutor") ThreadPoolTaskExecutor captchaRenderExecutor) {
        this.appSettings = appSettings;
        this.captchaGenerator = captchaGenerator;
        this.imageCodec = imageCodec;
        this.captchaRenderExecutor = captchaRenderExecutor;
    }

    public CaptchaParams defaultParams(String text) {
        return appSettings.getRender().toParams(text);
    }

    public String digitsToText(List<Integer> numbers) {
        return numbers.stream().map(String::valueOf).collect(Collectors.joining());
    }

    public BufferedImage generate(CaptchaParams params) {
        long startTime = System.currentTimeMillis();
        BufferedImage image = captchaGenerator.generate(params);
        long duration = System.currentTimeMillis() - startTime;
        performanceLogger.info("Captcha rendered in {} ms ({}x{})", duration, image.getWidth(), image.getHeight());
        return image;
    }

    public Future<String> generateDataUri(CaptchaParams params) {
        return captchaRenderExecutor.submit(() -> imageCodec.toDataUri(generate(params)));
    }
}
