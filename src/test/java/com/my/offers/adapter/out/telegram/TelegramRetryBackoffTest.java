package com.my.offers.adapter.out.telegram;

import com.my.offers.domain.exception.PublishException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class TelegramRetryBackoffTest {

    private static final PublishException TIMEOUT = PublishException.transientFailure("timeout", null);

    @Test
    void doubles_from_the_initial_delay_up_to_the_cap() {
        TelegramRetryBackoff backoff = new TelegramRetryBackoff();
        backoff.init(8_000);

        assertThat(backoff.nextDelayInMillis(TIMEOUT)).isEqualTo(8_000);
        assertThat(backoff.nextDelayInMillis(TIMEOUT)).isEqualTo(16_000);
        assertThat(backoff.nextDelayInMillis(TIMEOUT)).isEqualTo(TelegramRetryBackoff.MAX_DELAY_MILLIS);
        assertThat(backoff.nextDelayInMillis(TIMEOUT)).isEqualTo(TelegramRetryBackoff.MAX_DELAY_MILLIS);
    }

    @Test
    void waits_at_least_as_long_as_telegram_asks() {
        TelegramRetryBackoff backoff = new TelegramRetryBackoff();
        backoff.init(1_000);

        assertThat(backoff.nextDelayInMillis(PublishException.rateLimited("Too Many Requests", Duration.ofSeconds(45))))
                .isEqualTo(45_000);
        assertThat(backoff.nextDelayInMillis(PublishException.rateLimited("Too Many Requests", Duration.ofSeconds(1))))
                .isEqualTo(2_000);
    }

    @Test
    void zero_initial_delay_still_grows() {
        TelegramRetryBackoff backoff = new TelegramRetryBackoff();
        backoff.init(0);

        assertThat(backoff.nextDelayInMillis(null)).isZero();
        assertThat(backoff.nextDelayInMillis(new IllegalStateException())).isEqualTo(2);
    }
}
