package com.streameast.captcha.render;

import com.streameast.captcha.exception.CaptchaValidationException;
import com.streameast.captcha.model.CaptchaParams;
import com.streameast.captcha.util.AppConstants;
import com.streameast.captcha.util.PixelMath;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Objects;

public class ParameterNormalizer {

    public CaptchaParams normalize(CaptchaParams params) {
        if (params == null) {
            throw new CaptchaValidationException("Parameters are required");
        }
        String text = params.getText();
        if (StringUtils.isEmpty(text)) {
            throw new CaptchaValidationException("Text must not be empty");
        }
        if (text.length() > AppConstants.MAX_TEXT_LENGTH) {
            throw new CaptchaValidationException("Text longer than " + AppConstants.MAX_TEXT_LENGTH + " characters");
        }
        requirePositive("height", params.getHeight());
        requirePositive("fontSize", params.getFontSize());
        if (params.getFontSize() > AppConstants.MAX_FONT_SIZE) {
            throw new CaptchaValidationException("fontSize exceeds " + AppConstants.MAX_FONT_SIZE + ", got " + params.getFontSize());
        }
        requirePositive("gridSpacing", params.getGridSpacing());

        List<Integer> meshSteps = params.getMeshSteps();
        if (meshSteps == null || meshSteps.size() != 2 || meshSteps.stream().anyMatch(Objects::isNull)) {
            throw new CaptchaValidationException("meshSteps must hold exactly two values");
        }
        if (meshSteps.get(0) < 1 || meshSteps.get(1) < 1) {
            throw new CaptchaValidationException("meshSteps values must be at least 1, got " + meshSteps);
        }
        if (meshSteps.get(0) > AppConstants.MAX_MESH_STEPS || meshSteps.get(1) > AppConstants.MAX_MESH_STEPS) {
            throw new CaptchaValidationException("meshSteps values must not exceed " + AppConstants.MAX_MESH_STEPS + ", got " + meshSteps);
        }

        int width;
        if (params.getWidth() == null) {
            width = autoWidth(text.length(), params.getFontSize());
        } else {
            width = params.getWidth();
            requirePositive("width", width);
        }
        requireCanvas("width", width);
        requireCanvas("height", params.getHeight());

        return params.toBuilder()
                .width(width)
                .meshSteps(List.copyOf(meshSteps))
                .distortion(PixelMath.clamp01(params.getDistortion()))
                .noise(PixelMath.clamp01(params.getNoise()))
                .gridStrength(PixelMath.clamp01(params.getGridStrength()))
                .rotation(PixelMath.clamp01(params.getRotation()))
                .build();
    }

    public static int autoWidth(int textLength, int fontSize) {
        return Math.max(AppConstants.MIN_AUTO_WIDTH, (int) Math.floor(textLength * fontSize * 0.6) + 60);
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new CaptchaValidationException(name + " must be positive, got " + value);
        }
    }

    private static void requireCanvas(String name, int value) {
        if (value > AppConstants.MAX_CANVAS_DIMENSION) {
            throw new CaptchaValidationException(name + " exceeds " + AppConstants.MAX_CANVAS_DIMENSION + ", got " + value);
        }
    }
}
