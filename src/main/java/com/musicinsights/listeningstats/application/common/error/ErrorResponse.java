package com.musicinsights.listeningstats.application.common.error;

import java.time.Instant;

/**
 * 공통 에러 응답 DTO.
 *
 * @param timestamp 에러 발생 시각
 * @param status    HTTP 상태 코드
 * @param error     HTTP 상태 메시지
 * @param message   에러 메시지(문제가 된 필드/값 포함)
 * @param path      요청 경로
 * @param code      애플리케이션 에러 코드
 */
public record ErrorResponse(
        Instant timestamp,
        int status,
        String error,
        String message,
        String path,
        String code
) {
    public static ErrorResponse of(int status, String error, String message, String path, String code) {
        return new ErrorResponse(Instant.now(), status, error, message, path, code);
    }

    static ErrorResponse badRequest(String message, String path, String code) {
        return of(400, "Bad Request", message, path, code);
    }

    static ErrorResponse internal(String message, String path, String code) {
        return of(500, "Internal Server Error", message, path, code);
    }
}
