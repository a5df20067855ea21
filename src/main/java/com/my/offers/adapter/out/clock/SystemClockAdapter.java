package com.my.offers.adapter.out.clock;

import com.my.offers.domain.port.out.ClockPort;

import java.time.Clock;
import java.time.Instant;

public class SystemClockAdapter implements ClockPort {

    private final Clock clock;

    private SystemClockAdapter(Clock clock) {
        this.clock = clock;
    }

    public static SystemClockAdapter system() {
        return new SystemClockAdapter(Clock.systemUTC());
    }

    @Override
    public Instant now() {
        return clock.instant();
    }
}
