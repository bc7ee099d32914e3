package com.rockdeals.pos.common.exception;

/**
 * DomainException - 도메인 규칙 위반 예외
 *
 * 역할:
 * - 장바구니, 상품, 판매 도메인의 규칙 위반 시 발생
 * - 일반적으로 클라이언트 오류(4XX)로 응답
 *
 * 사용 예:
 * - EmptyCartException: 빈 장바구니 결제 시도
 * - InsufficientPaymentException: 받은 현금이 합계보다 적음
 * - OutOfStockException: 판매 확정 시점의 재고 부족
 */
public class DomainException extends BizException {

    public DomainException(ErrorCode errorCode) {
        super(errorCode);
    }

    public DomainException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, cause);
    }

    public DomainException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }
}
