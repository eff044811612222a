package lab.accessmanager.authorization.init;

import lab.accessmanager.authorization.OperationId;

import java.util.List;

/**
 * One-time wiring applied by {@code initialize}: which role guards each target operation (with the minimal
 * execution delay for that role), the admin of each role, and the initial role members.
 */
public record BootstrapConfig(
        List<FunctionPermission> functionPermissions,
        List<RoleAdmin> roleAdmins,
        List<RoleGrant> roleGrants
) {
    public BootstrapConfig {
        functionPermissions = functionPermissions == null ? List.of() : List.copyOf(functionPermissions);
        roleAdmins = roleAdmins == null ? List.of() : List.copyOf(roleAdmins);
        roleGrants = roleGrants == null ? List.of() : List.copyOf(roleGrants);
    }

    public record FunctionPermission(
            String target,
            OperationId operation,
            long roleId,
            long minimalDelay
    ) {}

    public record RoleAdmin(
            long roleId,
            long adminRoleId
    ) {}

    public record RoleGrant(
            long roleId,
            String account,
            long executionDelay
    ) {}
}
