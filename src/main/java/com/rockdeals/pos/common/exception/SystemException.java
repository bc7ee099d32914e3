package com.rockdeals.pos.common.exception;

/**
 * SystemException - 시스템/인프라 계층 오류 예외
 *
 * 역할:
 * - 데이터베이스, 트랜잭션, 캐시 등 인프라 오류
 * - 항상 서버 오류(5XX)로 응답
 *
 * 특징:
 * - 클라이언트(POS 단말)가 수동으로 재시도할 수 있음
 * - 장바구니는 그대로 유지된다
 */
public class SystemException extends BizException {

    public SystemException(ErrorCode errorCode) {
        super(errorCode);
    }

    public SystemException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, cause);
    }

    public SystemException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }
}
