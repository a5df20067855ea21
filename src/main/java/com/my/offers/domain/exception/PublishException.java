package com.my.offers.domain.exception;

import java.time.Duration;
import java.util.Optional;

/**
 * 왜: 목적지 채널 게시 실패를 일시적(재시도 가능)/영구적(운영자 개입 필요)으로 구분해 전달하기 위함.
 */
public class PublishException extends RuntimeException {

    private final boolean permanent;
    private final Duration retryAfter;

    public PublishException(String message, boolean permanent) {
        this(message, permanent, null, null);
    }

    public PublishException(String message, boolean permanent, Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.permanent = permanent;
        this.retryAfter = retryAfter;
    }

    public static PublishException transientFailure(String message, Throwable cause) {
        return new PublishException(message, false, null, cause);
    }

    public static PublishException rateLimited(String message, Duration retryAfter) {
        return new PublishException(message, false, retryAfter, null);
    }

    public static PublishException permanentFailure(String message) {
        return new PublishRejectedException(message);
    }

    public boolean permanent() {
        return permanent;
    }

    public Optional<Duration> retryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
