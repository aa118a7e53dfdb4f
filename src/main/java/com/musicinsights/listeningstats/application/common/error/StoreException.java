package com.musicinsights.listeningstats.application.common.error;

/**
 * 저장소(DB) 조회 실패.
 *
 * <p>재시도하지 않고 500 응답으로 그대로 보고한다. 부분 결과는 함께 반환되지 않는다.</p>
 */
public class StoreException extends RuntimeException {
    public static final String CODE = "DB_ERROR";

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public String code() {
        return CODE;
    }
}
