package com.musicinsights.listeningstats.application.common.error;

/**
 * 허용 목록에 없는 차원(컬럼)명이 요청된 경우.
 */
public class InvalidDimensionException extends BadRequestException {
    public static final String CODE = "INVALID_DIMENSION";

    private final String dimension;

    public InvalidDimensionException(String dimension) {
        super("Invalid column: " + dimension, CODE);
        this.dimension = dimension;
    }

    public String dimension() {
        return dimension;
    }
}
