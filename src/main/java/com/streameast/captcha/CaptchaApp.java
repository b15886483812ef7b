package com.streameast.captcha;

import com.streameast.captcha.config.AppSettings;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
public class CaptchaApp {

    public static void main(String[] args) {
        SpringApplication.run(CaptchaApp.class, args);
    }

    @Bean
    @ConfigurationProperties()
    public AppSettings appSettings () {
        return new AppSettings();
    }
}
