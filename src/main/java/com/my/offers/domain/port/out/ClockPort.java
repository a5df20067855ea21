package com.my.offers.domain.port.out;

import java.time.Instant;

/**
 * 왜: 결정 시각을 주입형으로 분리하여 테스트에서 시간을 고정할 수 있도록 하기 위함.
 */
public interface ClockPort {
    Instant now();
}
