package com.musicinsights.listeningstats.application.common.error;

import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;

/**
 * 전역 예외 처리기.
 *
 * <p>요청 형태 오류는 400, 저장소 오류는 500(DB_ERROR)으로 구분해 {@link ErrorResponse}로 반환한다.</p>
 */
@Order(-2)
@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * {@link BadRequestException}(및 하위 타입)을 400 응답으로 변환한다.
     *
     * @param e  예외
     * @param ex 요청 컨텍스트
     * @return 400 ErrorResponse
     */
    @ExceptionHandler(BadRequestException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(BadRequestException e, ServerWebExchange ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.badRequest(e.getMessage(), path(ex), e.code()));
    }

    /**
     * 집계 쿼리 실행 실패를 500 응답으로 변환한다.
     *
     * @param e  예외
     * @param ex 요청 컨텍스트
     * @return 500 ErrorResponse(DB_ERROR)
     */
    @ExceptionHandler(StoreException.class)
    public ResponseEntity<ErrorResponse> handleStore(StoreException e, ServerWebExchange ex) {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.internal("Database error", path(ex), e.code()));
    }

    /**
     * DB 접근/SQL 오류를 500 응답으로 변환한다.
     *
     * @param e  예외
     * @param ex 요청 컨텍스트
     * @return 500 ErrorResponse(DB_ERROR)
     */
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDb(DataAccessException e, ServerWebExchange ex) {
        log.error("Database error on {}", path(ex), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.internal("Database error", path(ex), StoreException.CODE));
    }

    /**
     * 처리되지 않은 예외를 500 응답으로 변환한다.
     *
     * @param e  예외
     * @param ex 요청 컨텍스트
     * @return 500 ErrorResponse(INTERNAL_ERROR)
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnknown(Exception e, ServerWebExchange ex) {
        log.error("Unexpected error on {}", path(ex), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.internal("Unexpected error", path(ex), "INTERNAL_ERROR"));
    }

    /**
     * 검증(ConstraintViolation) 실패를 400 응답으로 변환한다.
     *
     * @param e  예외
     * @param ex 요청 컨텍스트
     * @return 400 ErrorResponse(VALIDATION_ERROR)
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(ConstraintViolationException e, ServerWebExchange ex) {
        String msg = e.getConstraintViolations().stream()
                .findFirst()
                .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                .orElse("Validation failed");

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.badRequest(msg, path(ex), "VALIDATION_ERROR"));
    }

    /**
     * 바인딩/파라미터 검증(WebExchangeBind) 실패를 400 응답으로 변환한다.
     *
     * @param e  예외
     * @param ex 요청 컨텍스트
     * @return 400 ErrorResponse(VALIDATION_ERROR)
     */
    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> handleWebExchangeBind(WebExchangeBindException e, ServerWebExchange ex) {
        String msg = e.getFieldErrors().stream()
                .findFirst()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .orElse("Validation failed");

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.badRequest(msg, path(ex), "VALIDATION_ERROR"));
    }

    /**
     * 필수 파라미터 누락/타입 변환 실패(예: limit=abc, group_by 없음)를 400 응답으로 변환한다.
     *
     * @param e  예외
     * @param ex 요청 컨텍스트
     * @return 400 ErrorResponse(VALIDATION_ERROR)
     */
    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleServerWebInput(ServerWebInputException e, ServerWebExchange ex) {
        String msg = (e.getReason() == null) ? "Invalid request" : e.getReason();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.badRequest(msg, path(ex), "VALIDATION_ERROR"));
    }

    private static String path(ServerWebExchange ex) {
        return ex.getRequest().getPath().value();
    }
}
