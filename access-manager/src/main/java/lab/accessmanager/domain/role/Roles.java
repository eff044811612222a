package lab.accessmanager.domain.role;

import lab.accessmanager.authorization.InvalidRequestException;

import java.math.BigInteger;

public final class Roles {

    // Root of the admin hierarchy; its own admin.
    public static final long ADMIN_ROLE = 0L;

    // uint64 max: every caller is implicitly a member with zero delay.
    public static final long PUBLIC_ROLE = -1L;

    private Roles() {
    }

    public static boolean isLocked(long roleId) {
        return roleId == ADMIN_ROLE || roleId == PUBLIC_ROLE;
    }

    public static BigInteger toUnsigned(long roleId) {
        return new BigInteger(Long.toUnsignedString(roleId));
    }

    public static String display(long roleId) {
        return Long.toUnsignedString(roleId);
    }

    // Accepts an unsigned decimal role id, or -1 as shorthand for the public role.
    public static long parse(String roleId) {
        if (roleId == null || roleId.isBlank()) {
            throw new InvalidRequestException("role id is required");
        }
        String trimmed = roleId.trim();
        if ("-1".equals(trimmed)) {
            return PUBLIC_ROLE;
        }
        try {
            return Long.parseUnsignedLong(trimmed);
        } catch (NumberFormatException e) {
            throw new InvalidRequestException("invalid role id: " + roleId);
        }
    }
}
