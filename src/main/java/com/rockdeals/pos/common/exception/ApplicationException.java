package com.rockdeals.pos.common.exception;

/**
 * ApplicationException - 애플리케이션 흐름 제어 실패 예외
 *
 * 사용 예:
 * - SubmissionInProgressException: 같은 장바구니에 대한 중복 결제 요청
 */
public class ApplicationException extends BizException {

    public ApplicationException(ErrorCode errorCode) {
        super(errorCode);
    }

    public ApplicationException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, cause);
    }

    public ApplicationException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }
}
