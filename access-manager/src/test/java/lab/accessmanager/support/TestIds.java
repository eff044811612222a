package lab.accessmanager.support;

import java.util.concurrent.atomic.AtomicLong;

public final class TestIds {

    // Must match application.yml.
    public static final String MANAGER = "0x00000000000000000000000000000000000ac0de";
    public static final String ADMIN = "0x000000000000000000000000000000000000a11c";
    public static final long GUARDIAN_ROLE = 1L;

    private static final AtomicLong ADDRESSES = new AtomicLong(0x1000);
    private static final AtomicLong ROLES = new AtomicLong(1000);

    private TestIds() {
    }

    // Unique per call, so tests sharing a context do not see each other's roles and locks.
    public static String freshAddress() {
        return "0x%040x".formatted(ADDRESSES.incrementAndGet());
    }

    public static long freshRole() {
        return ROLES.incrementAndGet();
    }
}
