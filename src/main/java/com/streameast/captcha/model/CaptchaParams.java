package com.streameast.captcha.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CaptchaParams {

    private String text;

    // derived from text length and font size when absent
    private Integer width;

    @Builder.Default
    private int height = 50;

    @Builder.Default
    private int fontSize = 30;

    @Builder.Default
    private List<Integer> meshSteps = List.of(1, 11);

    @Builder.Default
    private int gridSpacing = 16;

    @Builder.Default
    private double distortion = 0;

    @Builder.Default
    private double noise = 1;

    @Builder.Default
    private double gridStrength = 0;

    @Builder.Default
    private double rotation = 1;

    @Builder.Default
    private boolean protectText = true;

    private String fontPath;

    // fixed seed for reproducible output, fresh generator per call when null
    private Long seed;

    public int meshStepsX() {
        return meshSteps.get(0);
    }

    public int meshStepsY() {
        return meshSteps.get(1);
    }
}
