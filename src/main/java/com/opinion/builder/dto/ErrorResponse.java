package com.opinion.builder.dto;

import java.util.Map;

/**
 * Error body returned by every endpoint: {@code {"error":{"code":..,"message":..,"details":..}}}.
 */
public record ErrorResponse(Detail error) {

    public record Detail(String code, String message, Map<String, Object> details) {}

    public static ErrorResponse of(String code, String message) {
        return new ErrorResponse(new Detail(code, message, null));
    }

    public static ErrorResponse of(String code, String message, Map<String, Object> details) {
        return new ErrorResponse(new Detail(code, message, details));
    }
}
