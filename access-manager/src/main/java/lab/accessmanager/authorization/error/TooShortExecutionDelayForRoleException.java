package lab.accessmanager.authorization.error;

import lab.accessmanager.domain.role.Roles;

public class TooShortExecutionDelayForRoleException extends AccessManagerException {

    private final long roleId;
    private final long executionDelay;

    public TooShortExecutionDelayForRoleException(long roleId, long executionDelay) {
        super("TooShortExecutionDelayForRole", ErrorCategory.AUTHORIZATION,
                params("roleId", Roles.display(roleId), "executionDelay", executionDelay));
        this.roleId = roleId;
        this.executionDelay = executionDelay;
    }

    public long getRoleId() {
        return roleId;
    }

    public long getExecutionDelay() {
        return executionDelay;
    }
}
