package lab.accessmanager.registry;

public record RoleAccess(
        boolean isMember,
        long executionDelay
) {
    public static final RoleAccess NONE = new RoleAccess(false, 0L);
}
