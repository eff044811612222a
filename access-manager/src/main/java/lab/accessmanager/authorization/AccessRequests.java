package lab.accessmanager.authorization;

import java.util.List;

/**
 * Request bodies of the access endpoints. Role ids travel as strings so that the full unsigned 64-bit range
 * (and {@code -1} for the public role) survives JSON.
 */
public final class AccessRequests {

    private AccessRequests() {
    }

    public record InitializeRequest(
            List<FunctionPermissionEntry> functionPermissions,
            List<RoleAdminEntry> roleAdmins,
            List<RoleGrantEntry> roleGrants
    ) {}

    public record FunctionPermissionEntry(
            String target,
            String selector,
            String roleId,
            long minimalDelay
    ) {}

    public record RoleAdminEntry(
            String roleId,
            String adminRoleId
    ) {}

    public record RoleGrantEntry(
            String roleId,
            String account,
            long executionDelay
    ) {}

    public record CanCallRequest(
            String target,
            String selector
    ) {}

    public record GrantRoleRequest(
            String account,
            long executionDelay
    ) {}

    public record RenounceRoleRequest(
            String callerConfirmation
    ) {}

    public record RoleAdminRequest(
            String adminRoleId
    ) {}

    public record RoleGuardianRequest(
            String guardianRoleId
    ) {}

    public record GrantDelayRequest(
            long grantDelay
    ) {}

    public record MinimalDelaysRequest(
            List<String> roleIds,
            List<Long> delays
    ) {}

    public record TargetClosedRequest(
            boolean closed
    ) {}

    public record TargetFunctionRoleRequest(
            List<String> selectors,
            String roleId
    ) {}

    public record ScheduleRequest(
            String target,
            String payload,
            Long when
    ) {}

    public record CancelRequest(
            String caller,
            String target,
            String payload
    ) {}
}
