package com.rockdeals.pos.domain.cart;

import com.rockdeals.pos.common.exception.ApplicationException;
import com.rockdeals.pos.common.exception.ErrorCode;

/**
 * 같은 장바구니에 대해 결제가 이미 진행 중일 때 발생 (409)
 *
 * 더블 클릭 등으로 판매가 두 번 생성되는 것을 막는다.
 * 두 번째 요청은 대기열에 넣지 않고 즉시 거절한다.
 */
public class SubmissionInProgressException extends ApplicationException {

    public SubmissionInProgressException(String cartId) {
        super(ErrorCode.SUBMISSION_IN_PROGRESS, "cartId=" + cartId);
    }
}
