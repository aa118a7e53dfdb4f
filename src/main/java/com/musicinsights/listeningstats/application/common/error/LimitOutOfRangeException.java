package com.musicinsights.listeningstats.application.common.error;

/**
 * limit 이 허용 범위 [min, max]를 벗어난 경우.
 */
public class LimitOutOfRangeException extends BadRequestException {
    public static final String CODE = "LIMIT_OUT_OF_RANGE";

    private final int limit;

    public LimitOutOfRangeException(int limit, int min, int max) {
        super("limit must be between " + min + " and " + max + ": " + limit, CODE);
        this.limit = limit;
    }

    public int limit() {
        return limit;
    }
}
