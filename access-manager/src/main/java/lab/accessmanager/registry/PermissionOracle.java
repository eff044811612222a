package lab.accessmanager.registry;

import lab.accessmanager.authorization.AccessDecision;
import lab.accessmanager.authorization.ManagerCall;
import lab.accessmanager.authorization.OperationId;
import lab.accessmanager.domain.role.RoleMember;
import lab.accessmanager.domain.schedule.ScheduledOperation;

import java.util.List;
import java.util.Optional;

/**
 * The generic role/permission registry the authorization core is composed with.
 *
 * <p>{@link #check}, {@link #grant}, {@link #schedule} and {@link #consume} are the capabilities the core builds
 * its own rules on; the remaining methods are the role and target administration the registry owns. Implementations
 * do not authorize callers except through {@link #authorize}.
 */
public interface PermissionOracle {

    AccessDecision check(String caller, String target, OperationId operation);

    void authorize(String caller, ManagerCall call);

    boolean grant(long roleId, String account, long executionDelay);

    ScheduleReceipt schedule(String caller, String target, String payload, long when);

    long consume(String caller, String target, String payload);

    long cancel(String canceller, String caller, String target, String payload);

    boolean revoke(long roleId, String account);

    void setRoleAdmin(long roleId, long adminRoleId);

    void setRoleGuardian(long roleId, long guardianRoleId);

    long setGrantDelay(long roleId, long grantDelay);

    void setTargetFunctionRole(String target, OperationId operation, long roleId);

    void setTargetClosed(String target, boolean closed);

    RoleAccess hasRole(long roleId, String account);

    List<RoleMember> members(long roleId);

    long getRoleAdmin(long roleId);

    long getRoleGuardian(long roleId);

    long getRoleGrantDelay(long roleId);

    long getTargetFunctionRole(String target, OperationId operation);

    boolean isTargetClosed(String target);

    Optional<ScheduledOperation> getSchedule(String operationId);

    String hashOperation(String caller, String target, String payload);
}
