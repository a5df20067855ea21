package com.my.offers.adapter.out.telegram;

import com.my.offers.domain.exception.PublishException;
import io.smallrye.faulttolerance.api.CustomBackoffStrategy;

import java.time.Duration;

/**
 * 게시 재시도 간격. 초기 지연에서 두 배씩 늘리되 {@link #MAX_DELAY_MILLIS}에서 멈추고,
 * 텔레그램이 retry_after를 알려주면 그보다 짧게 기다리지 않는다.
 */
public class TelegramRetryBackoff implements CustomBackoffStrategy {

    static final long MAX_DELAY_MILLIS = 30_000;

    private long nextDelay;

    @Override
    public void init(long initialDelayInMillis) {
        this.nextDelay = Math.max(0, Math.min(initialDelayInMillis, MAX_DELAY_MILLIS));
    }

    @Override
    public long nextDelayInMillis(Throwable exceptionOrNull) {
        long delay = nextDelay;
        nextDelay = Math.min(MAX_DELAY_MILLIS, Math.max(1, nextDelay) * 2);
        if (exceptionOrNull instanceof PublishException) {
            long retryAfter = ((PublishException) exceptionOrNull).retryAfter().map(Duration::toMillis).orElse(0L);
            return Math.max(delay, retryAfter);
        }
        return delay;
    }
}
