package com.followchat.social.common.time;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Wall-clock instants truncated to microseconds (the precision the message table stores) that never
 * repeat or go backwards within this process, so message creation order is total.
 */
@Component
public class MonotonicClock {

    private final AtomicLong lastMicros = new AtomicLong();

    public Instant now() {
        var wall = Instant.now().truncatedTo(ChronoUnit.MICROS);
        var wallMicros = ChronoUnit.MICROS.between(Instant.EPOCH, wall);
        var next = lastMicros.updateAndGet(prev -> Math.max(prev + 1, wallMicros));
        return Instant.EPOCH.plus(next, ChronoUnit.MICROS);
    }
}
