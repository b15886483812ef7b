package com.streameast.captcha.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final AppSettings appSettings;

    public WebConfig(AppSettings appSettings) {
        this.appSettings = appSettings;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
                .allowedOrigins(appSettings.getCors().getAllowedOrigins().toArray(new String[0]))
                .allowedMethods("*")
                .allowedHeaders("*");
    }
}
