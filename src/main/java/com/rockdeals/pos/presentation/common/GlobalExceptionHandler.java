package com.rockdeals.pos.presentation.common;

import com.rockdeals.pos.common.exception.BizException;
import com.rockdeals.pos.common.exception.ErrorCode;
import com.rockdeals.pos.common.exception.SystemException;
import com.rockdeals.pos.presentation.common.response.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * GlobalExceptionHandler - 전역 예외 처리 (Presentation 계층)
 *
 * 에러 응답 형식:
 * {
 *   "error_code": "DOMAIN_CART_INSUFFICIENT_PAYMENT",
 *   "error_message": "받은 금액이 결제 금액보다 적습니다 | 합계: 68.98, 받은 금액: 60.00",
 *   "timestamp": "2026-10-19T12:34:56.000Z",
 *   "request_id": "req-abc123def456",
 *   "details": { "shortfall": 8.98, ... }
 * }
 *
 * HTTP 상태 코드 매핑:
 * - BizException: ErrorCode의 statusCode (404, 400, 409, 503 등)
 * - 요청 본문/파라미터 형식 오류: 400
 * - 그 외: 500
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    private static final String INVALID_REQUEST = "INVALID_REQUEST";

    /**
     * 비즈니스 예외 (도메인/애플리케이션/시스템)
     */
    @ExceptionHandler(BizException.class)
    public ResponseEntity<ErrorResponse> handleBizException(BizException e) {
        if (e instanceof SystemException) {
            logger.error("System exception: code={}, message={}", e.getErrorCodeValue(), e.getMessage(), e);
        } else {
            logger.debug("Business exception: code={}, message={}", e.getErrorCodeValue(), e.getMessage());
        }
        ErrorResponse errorResponse = ErrorResponse.of(e.getErrorCodeValue(), e.getMessage(), e.getDetails());
        return ResponseEntity.status(e.getStatusCode()).body(errorResponse);
    }

    /**
     * 필수 값 누락 등 잘못된 요청 (400)
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of(INVALID_REQUEST, e.getMessage()));
    }

    /**
     * JSON 형식 오류, 알 수 없는 결제수단 등 (400)
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleHttpMessageNotReadableException(HttpMessageNotReadableException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of(INVALID_REQUEST, "요청 본문을 읽을 수 없습니다"));
    }

    /**
     * 경로/쿼리 파라미터 타입 오류 (400)
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatchException(MethodArgumentTypeMismatchException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of(INVALID_REQUEST, "잘못된 파라미터: " + e.getName()));
    }

    /**
     * 서버 내부 오류 (500)
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        logger.error("Unhandled exception occurred: ", e);
        ErrorCode errorCode = ErrorCode.INTERNAL_SERVER_ERROR;
        return ResponseEntity.status(errorCode.getStatusCode())
                .body(ErrorResponse.of(errorCode.getCode(), errorCode.getMessage()));
    }
}
