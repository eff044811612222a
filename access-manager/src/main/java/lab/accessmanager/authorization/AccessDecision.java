package lab.accessmanager.authorization;

/**
 * Outcome of a permission check: callable now, callable after {@code delay} seconds once scheduled, or neither
 * ({@code immediate == false && delay == 0}).
 */
public record AccessDecision(
        boolean immediate,
        long delay
) {
    public static AccessDecision immediately() {
        return new AccessDecision(true, 0L);
    }

    public static AccessDecision afterDelay(long delay) {
        return new AccessDecision(false, delay);
    }

    public static AccessDecision denied() {
        return new AccessDecision(false, 0L);
    }

    public static AccessDecision forMember(long executionDelay) {
        return executionDelay == 0L ? immediately() : afterDelay(executionDelay);
    }

    public boolean requiresSchedule() {
        return !immediate && delay > 0L;
    }
}
