package com.my.offers.domain.exception;

/**
 * 왜: 커서/중복 원장 I/O 실패는 중복 게시 위험이 있어 추측하지 않고 프로세스를 멈추도록 구분하기 위함.
 */
public class StateStoreException extends RuntimeException {
    public StateStoreException(String message) {
        super(message);
    }

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
