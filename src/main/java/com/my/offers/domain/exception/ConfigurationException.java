package com.my.offers.domain.exception;

/**
 * 왜: 규칙 세트나 대상 채널 설정이 잘못되었을 때 기동을 중단시키기 위함.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
