package com.my.offers.domain.exception;

/**
 * 왜: 소스 채널 피드 연결이 일시적으로 끊겼음을 알려 리스너가 백오프 후 재연결하도록 하기 위함.
 */
public class ListenerException extends RuntimeException {
    public ListenerException(String message) {
        super(message);
    }

    public ListenerException(String message, Throwable cause) {
        super(message, cause);
    }
}
