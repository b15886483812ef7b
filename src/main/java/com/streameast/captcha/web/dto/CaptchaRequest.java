package com.streameast.captcha.web.dto;

import lombok.Data;

import java.util.List;

@Data
public class CaptchaRequest {
    private List<Integer> numbers;
}
