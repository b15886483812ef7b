package com.streameast.captcha.config;

import com.streameast.captcha.model.CaptchaParams;
import com.streameast.captcha.util.AppConstants;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Validated
public class AppSettings {

    @Valid
    @Getter
    private RenderDefaults render = new RenderDefaults();

    @Valid
    @Getter
    private FontParams font = new FontParams();

    @Valid
    @Getter
    private CorsParams cors = new CorsParams();

    @Valid
    @Getter
    private TransportParams transport = new TransportParams();

    @Valid
    @Getter
    private ExecutorParams renderExecutor = new ExecutorParams();

    @Getter
    @Setter
    public static class RenderDefaults {

        @NotNull
        @Positive
        @Max(AppConstants.MAX_CANVAS_DIMENSION)
        private Integer height = 50;

        @NotNull
        @Positive
        @Max(AppConstants.MAX_FONT_SIZE)
        private Integer fontSize = 30;

        @NotNull
        @Size(min = 2, max = 2)
        private List<Integer> meshSteps = new ArrayList<>(List.of(1, 11));

        @NotNull
        @Positive
        private Integer gridSpacing = 16;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double distortion = 0;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double noise = 1;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double gridStrength = 0;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double rotation = 1;

        private boolean protectText = true;

        public CaptchaParams toParams(String text) {
            return CaptchaParams.builder()
                    .text(text)
                    .height(height)
                    .fontSize(fontSize)
                    .meshSteps(List.copyOf(meshSteps))
                    .gridSpacing(gridSpacing)
                    .distortion(distortion)
                    .noise(noise)
                    .gridStrength(gridStrength)
                    .rotation(rotation)
                    .protectText(protectText)
                    .build();
        }
    }

    @Getter
    @Setter
    public static class FontParams {
        private String path;
        private List<String> candidates = new ArrayList<>(AppConstants.DEFAULT_FONT_CANDIDATES);
        private boolean useLogicalFonts = true;
    }

    @Getter
    @Setter
    public static class CorsParams {
        @NotEmpty
        private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:44332"));
    }

    @Getter
    @Setter
    public static class TransportParams {

        @NotNull
        @Positive
        private Integer digitCount = 5;

        @NotBlank
        private String tokenPlaceholder = "dummy-token";

        @NotNull
        @Positive
        private Integer timeoutSeconds = 10;
    }

    @Getter
    @Setter
    public static class ExecutorParams {

        @Positive
        private int corePoolSize = Runtime.getRuntime().availableProcessors();

        @Positive
        private int maxPoolSize = Runtime.getRuntime().availableProcessors() * 2;

        @Positive
        private int queueCapacity = 200;

        @Positive
        private int keepAliveSeconds = 60;
    }
}
