package lab.accessmanager.support;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

// Moves only when told to.
public class MutableClock extends Clock {

    private volatile Instant instant;

    public MutableClock(long epochSecond) {
        this.instant = Instant.ofEpochSecond(epochSecond);
    }

    public long now() {
        return instant.getEpochSecond();
    }

    public void setEpochSecond(long epochSecond) {
        this.instant = Instant.ofEpochSecond(epochSecond);
    }

    public long advance(long seconds) {
        this.instant = instant.plusSeconds(seconds);
        return now();
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }

    @Override
    public Instant instant() {
        return instant;
    }
}
