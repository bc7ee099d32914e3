package com.rockdeals.pos.common.exception;

/**
 * ErrorCode - POS 예외 코드 정의
 *
 * 역할:
 * - 모든 비즈니스 예외의 코드와 메시지 정의
 * - HTTP 상태 코드 매핑
 *
 * 코드 형식: {LAYER}_{DOMAIN}_{ERROR}
 * 예: DOMAIN_CART_EMPTY, APP_CHECKOUT_IN_PROGRESS
 */
public enum ErrorCode {

    // ========== Domain Layer Errors (4XX) ==========

    // Cart Domain
    CART_NOT_FOUND("DOMAIN_CART_NOT_FOUND", "장바구니 세션을 찾을 수 없습니다", 404),
    CART_EMPTY("DOMAIN_CART_EMPTY", "장바구니가 비어 있습니다", 400),
    INSUFFICIENT_PAYMENT("DOMAIN_CART_INSUFFICIENT_PAYMENT", "받은 금액이 결제 금액보다 적습니다", 400),
    INVALID_TAX_RATE("DOMAIN_CART_INVALID_TAX_RATE", "세율은 0 이상 100 이하여야 합니다 (장바구니 데이터 모델 불변식: taxPercent >= 0)", 400),
    INVALID_AMOUNT("DOMAIN_CART_INVALID_AMOUNT", "받은 금액은 0 이상 10,000,000.00 이하여야 합니다 (장바구니 데이터 모델 불변식: amountTendered >= 0)", 400),

    // Product Domain
    PRODUCT_NOT_FOUND("DOMAIN_PRODUCT_NOT_FOUND", "상품을 찾을 수 없습니다", 404),
    OUT_OF_STOCK("DOMAIN_PRODUCT_OUT_OF_STOCK", "재고가 부족합니다", 409),
    DUPLICATE_BARCODE("DOMAIN_PRODUCT_DUPLICATE_BARCODE", "이미 등록된 바코드입니다", 409),

    // Customer Domain
    CUSTOMER_NOT_FOUND("DOMAIN_CUSTOMER_NOT_FOUND", "고객을 찾을 수 없습니다", 404),

    // Sale Domain
    SALE_NOT_FOUND("DOMAIN_SALE_NOT_FOUND", "판매 내역을 찾을 수 없습니다", 404),
    SALE_VALIDATION_FAILED("DOMAIN_SALE_VALIDATION_FAILED", "판매 요청이 유효하지 않습니다", 400),
    SALE_ALREADY_REFUNDED("DOMAIN_SALE_ALREADY_REFUNDED", "이미 환불된 판매입니다", 409),

    // ========== Application Layer Errors ==========

    SUBMISSION_IN_PROGRESS("APP_CHECKOUT_IN_PROGRESS", "이미 결제가 진행 중입니다", 409),

    // ========== System Errors (5XX) ==========

    SERVICE_UNAVAILABLE("SYSTEM_SERVICE_UNAVAILABLE", "판매 저장소를 사용할 수 없습니다. 잠시 후 다시 시도하세요", 503),
    INTERNAL_SERVER_ERROR("SYSTEM_INTERNAL_SERVER_ERROR", "서버 내부 오류가 발생했습니다", 500);

    private final String code;
    private final String message;
    private final int statusCode;

    ErrorCode(String code, String message, int statusCode) {
        this.code = code;
        this.message = message;
        this.statusCode = statusCode;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
