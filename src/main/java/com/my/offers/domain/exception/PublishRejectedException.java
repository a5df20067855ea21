package com.my.offers.domain.exception;

/**
 * 목적지가 게시를 거부한 영구 실패. 재시도하지 않는다.
 */
public class PublishRejectedException extends PublishException {

    public PublishRejectedException(String message) {
        super(message, true);
    }
}
