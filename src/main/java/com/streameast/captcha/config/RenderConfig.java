package com.streameast.captcha.config;

import com.streameast.captcha.font.FontResolver;
import com.streameast.captcha.render.CaptchaGenerator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RenderConfig {

    @Bean
    public FontResolver fontResolver(AppSettings appSettings) {
        AppSettings.FontParams font = appSettings.getFont();
        return FontResolver.create(font.getPath(), font.getCandidates(), font.isUseLogicalFonts());
    }

    @Bean
    public CaptchaGenerator captchaGenerator(FontResolver fontResolver) {
        return new CaptchaGenerator(fontResolver);
    }
}
