package com.musicinsights.listeningstats.application.common.error;

/**
 * 필터 값이 차원 타입으로 변환되지 않는 경우 (예: filter_years=abc).
 */
public class InvalidFilterValueException extends BadRequestException {
    public static final String CODE = "INVALID_FILTER_VALUE";

    private final String dimension;
    private final String rawValue;

    public InvalidFilterValueException(String dimension, String rawValue) {
        super("Invalid value for " + dimension + ": " + rawValue, CODE);
        this.dimension = dimension;
        this.rawValue = rawValue;
    }

    public String dimension() {
        return dimension;
    }

    public String rawValue() {
        return rawValue;
    }
}
