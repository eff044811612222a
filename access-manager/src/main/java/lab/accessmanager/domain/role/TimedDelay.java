package lab.accessmanager.domain.role;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * A delay in seconds with an optional pending value that takes over at {@code effectAt}.
 * Used for role grant delays and member execution delays so that shortening a delay cannot
 * take effect faster than the delay it replaces.
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TimedDelay {

    @Column(nullable = false)
    private long currentValue;

    @Column(nullable = false)
    private long pendingValue;

    // 0 when there is no pending update
    @Column(nullable = false)
    private long effectAt;

    public static TimedDelay of(long seconds) {
        return new TimedDelay(seconds, 0L, 0L);
    }

    public long valueAt(long now) {
        return effectAt != 0L && effectAt <= now ? pendingValue : currentValue;
    }

    public boolean hasPendingUpdate(long now) {
        return effectAt > now;
    }

    // The new value applies after max(minSetback, current - newValue): increases are immediate unless a setback is
    // imposed, decreases wait for the difference.
    public TimedDelay withUpdate(long newValue, long minSetback, long now) {
        long current = valueAt(now);
        long setback = Math.max(minSetback, current > newValue ? current - newValue : 0L);
        return new TimedDelay(current, newValue, now + setback);
    }
}
