package com.rockdeals.pos.domain.sale;

import com.rockdeals.pos.common.exception.ErrorCode;
import com.rockdeals.pos.common.exception.SystemException;

/**
 * 판매 저장소 연결/트랜잭션 실패 (503)
 * 장바구니는 유지되며 운영자가 다시 결제할 수 있다.
 */
public class ServiceUnavailableException extends SystemException {

    public ServiceUnavailableException(Throwable cause) {
        super(ErrorCode.SERVICE_UNAVAILABLE, cause);
    }
}
