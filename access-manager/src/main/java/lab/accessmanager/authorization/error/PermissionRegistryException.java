package lab.accessmanager.authorization.error;

import lab.accessmanager.domain.role.Roles;

import java.util.Map;

/**
 * Rejections raised by the role/permission registry itself (role administration, scheduling).
 */
public class PermissionRegistryException extends AccessManagerException {

    private PermissionRegistryException(String errorName, ErrorCategory category, Map<String, Object> parameters) {
        super(errorName, category, parameters);
    }

    public static PermissionRegistryException unauthorizedAccount(String account, long requiredRole) {
        return new PermissionRegistryException("AccessManagerUnauthorizedAccount", ErrorCategory.AUTHORIZATION,
                params("account", account, "roleId", Roles.display(requiredRole)));
    }

    public static PermissionRegistryException unauthorizedCall(String caller, String target, String selector) {
        return new PermissionRegistryException("AccessManagerUnauthorizedCall", ErrorCategory.AUTHORIZATION,
                params("caller", caller, "target", target, "selector", selector));
    }

    public static PermissionRegistryException unauthorizedCancel(String canceller, String caller, String target, String selector) {
        return new PermissionRegistryException("AccessManagerUnauthorizedCancel", ErrorCategory.AUTHORIZATION,
                params("canceller", canceller, "caller", caller, "target", target, "selector", selector));
    }

    public static PermissionRegistryException unauthorizedConsume(String target) {
        return new PermissionRegistryException("AccessManagerUnauthorizedConsume", ErrorCategory.AUTHORIZATION,
                params("target", target));
    }

    public static PermissionRegistryException badConfirmation() {
        return new PermissionRegistryException("AccessManagerBadConfirmation", ErrorCategory.AUTHORIZATION, Map.of());
    }

    public static PermissionRegistryException notScheduled(String operationId) {
        return new PermissionRegistryException("AccessManagerNotScheduled", ErrorCategory.AUTHORIZATION,
                params("operationId", operationId));
    }

    public static PermissionRegistryException expired(String operationId) {
        return new PermissionRegistryException("AccessManagerExpired", ErrorCategory.AUTHORIZATION,
                params("operationId", operationId));
    }

    public static PermissionRegistryException notReady(String operationId, long readyAt) {
        return new PermissionRegistryException("AccessManagerNotReady", ErrorCategory.TEMPORAL,
                params("operationId", operationId, "readyAt", readyAt));
    }

    public static PermissionRegistryException alreadyScheduled(String operationId) {
        return new PermissionRegistryException("AccessManagerAlreadyScheduled", ErrorCategory.CONFIGURATION,
                params("operationId", operationId));
    }

    public static PermissionRegistryException lockedRole(long roleId) {
        return new PermissionRegistryException("AccessManagerLockedRole", ErrorCategory.CONFIGURATION,
                params("roleId", Roles.display(roleId)));
    }

    public static PermissionRegistryException roleAdminCycle(long roleId, long adminRoleId) {
        return new PermissionRegistryException("RoleAdminCycle", ErrorCategory.CONFIGURATION,
                params("roleId", Roles.display(roleId), "adminRoleId", Roles.display(adminRoleId)));
    }
}
