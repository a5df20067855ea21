package com.my.offers.domain.model;

import java.time.Duration;
import java.util.Objects;

/**
 * 왜: 일시적 실패 재시도 횟수와 상한이 있는 지수 백오프 간격을 값으로 표현하기 위함.
 */
public record RetryPolicy(int maxAttempts, Duration initialDelay, Duration maxDelay) {

    public RetryPolicy {
        Objects.requireNonNull(initialDelay, "initialDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts는 1 이상이어야 합니다.");
        }
        if (initialDelay.isNegative() || maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("백오프 간격이 올바르지 않습니다.");
        }
    }

    /**
     * @param failures 연속 실패 횟수 (1부터)
     */
    public Duration delayAfter(int failures) {
        if (failures <= 1 || initialDelay.isZero()) {
            return initialDelay;
        }
        int shift = Math.min(failures - 1, 30);
        long millis = initialDelay.toMillis() << shift;
        if (millis <= 0 || millis > maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis(millis);
    }
}
