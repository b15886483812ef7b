package com.streameast.captcha.web.controller;

import com.streameast.captcha.config.AppSettings;
import com.streameast.captcha.exception.CaptchaValidationException;
import com.streameast.captcha.service.CaptchaService;
import com.streameast.captcha.web.dto.CaptchaRequest;
import com.streameast.captcha.web.dto.CaptchaResponse;
import com.streameast.captcha.web.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Slf4j
@RestController
public class CaptchaController {

    private final CaptchaService captchaService;
    private final AppSettings appSettings;

    public CaptchaController(CaptchaService captchaService, AppSettings appSettings) {
        this.captchaService = captchaService;
        this.appSettings = appSettings;
    }

    @PostMapping("/captcha")
    public ResponseEntity<?> generateCaptcha(@RequestBody CaptchaRequest request) {
        AppSettings.TransportParams transport = appSettings.getTransport();
        List<Integer> numbers = request.getNumbers();
        if (numbers == null || numbers.size() != transport.getDigitCount() || numbers.stream().anyMatch(Objects::isNull)) {
            return ResponseEntity.badRequest()
                    .body(new ErrorResponse("Must provide exactly " + transport.getDigitCount() + " numbers"));
        }

        String text = captchaService.digitsToText(numbers);
        Future<String> future = null;
        try {
            future = captchaService.generateDataUri(captchaService.defaultParams(text));
            String imageB64 = future.get(transport.getTimeoutSeconds(), TimeUnit.SECONDS);
            return ResponseEntity.ok(new CaptchaResponse(transport.getTokenPlaceholder(), imageB64));
        } catch (ExecutionException e) {
            if (e.getCause() instanceof CaptchaValidationException) {
                return ResponseEntity.badRequest().body(new ErrorResponse(e.getCause().getMessage()));
            }
            log.error("Failed to generate captcha", e.getCause());
            return ResponseEntity.internalServerError()
                    .body(new ErrorResponse("Failed to generate captcha: " + e.getCause().getMessage()));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("Captcha generation timed out after {} s", transport.getTimeoutSeconds());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(new ErrorResponse("Captcha generation timed out"));
        } catch (RejectedExecutionException e) {
            log.warn("Render executor saturated: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(new ErrorResponse("Captcha service is busy, try again later"));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ResponseEntity.internalServerError().body(new ErrorResponse("Interrupted"));
        } catch (Exception e) {
            log.error("Failed to generate captcha", e);
            return ResponseEntity.internalServerError()
                    .body(new ErrorResponse("Failed to generate captcha: " + e.getMessage()));
        }
    }
}
