package io.pipe.core.session;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/** Advances one second on every read so consecutive timestamps are distinct and ordered. */
final class SteppingClock extends Clock {
    private Instant next;

    SteppingClock(Instant start) {
        this.next = start;
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        throw new UnsupportedOperationException("fixed zone");
    }

    @Override
    public synchronized Instant instant() {
        Instant current = next;
        next = next.plusSeconds(1);
        return current;
    }
}
