package com.rockdeals.pos.common.exception;

import java.util.Collections;
import java.util.Map;

/**
 * BizException - POS 비즈니스 예외의 최상위 클래스
 *
 * 역할:
 * - 모든 비즈니스 예외의 기본 클래스
 * - 에러 코드와 메시지, 응답에 노출할 부가 정보(details) 포함
 *
 * 예외 계층:
 * BizException (최상위)
 * ├─ DomainException (장바구니/상품/판매 규칙 위반)
 * ├─ ApplicationException (결제 흐름 제어 실패)
 * └─ SystemException (저장소/인프라 오류)
 */
public abstract class BizException extends RuntimeException {

    private final ErrorCode errorCode;

    protected BizException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    protected BizException(ErrorCode errorCode, Throwable cause) {
        super(errorCode.getMessage(), cause);
        this.errorCode = errorCode;
    }

    protected BizException(ErrorCode errorCode, String detailMessage) {
        super(errorCode.getMessage() + " | " + detailMessage);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public int getStatusCode() {
        return errorCode.getStatusCode();
    }

    public String getErrorCodeValue() {
        return errorCode.getCode();
    }

    /**
     * 에러 응답의 details 필드로 내려갈 값
     * 하위 예외가 부족 금액, 재고 수량 등 필요한 정보를 채운다.
     */
    public Map<String, Object> getDetails() {
        return Collections.emptyMap();
    }
}
