package lab.accessmanager.registry;

import lab.accessmanager.authorization.AccessAuditTrail;
import lab.accessmanager.authorization.AccessDecision;
import lab.accessmanager.authorization.ManagerCall;
import lab.accessmanager.authorization.ManagerCalls;
import lab.accessmanager.authorization.OperationId;
import lab.accessmanager.authorization.error.PermissionRegistryException;
import lab.accessmanager.common.Addresses;
import lab.accessmanager.domain.audit.AccessEventType;
import lab.accessmanager.domain.role.RoleConfig;
import lab.accessmanager.domain.role.RoleConfigRepository;
import lab.accessmanager.domain.role.RoleMember;
import lab.accessmanager.domain.role.RoleMemberRepository;
import lab.accessmanager.domain.role.Roles;
import lab.accessmanager.domain.role.TimedDelay;
import lab.accessmanager.domain.schedule.ScheduledOperation;
import lab.accessmanager.domain.schedule.ScheduledOperationRepository;
import lab.accessmanager.domain.target.TargetConfig;
import lab.accessmanager.domain.target.TargetConfigRepository;
import lab.accessmanager.domain.target.TargetFunctionPermission;
import lab.accessmanager.domain.target.TargetFunctionPermissionRepository;
import lab.accessmanager.managed.ConsumptionGuard;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Component
@Slf4j
public class AccessRegistry implements PermissionOracle {

    private final RoleConfigRepository roleConfigRepository;
    private final RoleMemberRepository roleMemberRepository;
    private final TargetFunctionPermissionRepository targetFunctionPermissionRepository;
    private final TargetConfigRepository targetConfigRepository;
    private final ScheduledOperationRepository scheduledOperationRepository;
    private final ConsumptionGuard consumptionGuard;
    private final AccessAuditTrail auditTrail;
    private final Clock clock;
    private final String managerAddress;
    private final long expirationSeconds;
    private final long minSetbackSeconds;

    public AccessRegistry(
            RoleConfigRepository roleConfigRepository,
            RoleMemberRepository roleMemberRepository,
            TargetFunctionPermissionRepository targetFunctionPermissionRepository,
            TargetConfigRepository targetConfigRepository,
            ScheduledOperationRepository scheduledOperationRepository,
            ConsumptionGuard consumptionGuard,
            AccessAuditTrail auditTrail,
            Clock clock,
            @Value("${access.manager.address}") String managerAddress,
            @Value("${access.schedule.expiration-seconds:604800}") long expirationSeconds,
            @Value("${access.roles.min-setback-seconds:432000}") long minSetbackSeconds
    ) {
        this.roleConfigRepository = roleConfigRepository;
        this.roleMemberRepository = roleMemberRepository;
        this.targetFunctionPermissionRepository = targetFunctionPermissionRepository;
        this.targetConfigRepository = targetConfigRepository;
        this.scheduledOperationRepository = scheduledOperationRepository;
        this.consumptionGuard = consumptionGuard;
        this.auditTrail = auditTrail;
        this.clock = clock;
        this.managerAddress = Addresses.normalize(managerAddress);
        this.expirationSeconds = expirationSeconds;
        this.minSetbackSeconds = minSetbackSeconds;
    }

    // A closed target admits nobody but root admins, who still need the operation's role.
    @Override
    public AccessDecision check(String caller, String target, OperationId operation) {
        if (isTargetClosed(target) && !hasRole(Roles.ADMIN_ROLE, caller).isMember()) {
            return AccessDecision.denied();
        }
        RoleAccess access = hasRole(getTargetFunctionRole(target, operation), caller);
        return access.isMember() ? AccessDecision.forMember(access.executionDelay()) : AccessDecision.denied();
    }

    // Self-authorization of the manager's own operations: immediate members pass, delayed members must have
    // scheduled exactly this payload beforehand.
    @Override
    public void authorize(String caller, ManagerCall call) {
        AccessDecision decision = checkManagerCall(caller, call.payload());
        if (decision.immediate()) {
            return;
        }
        if (!decision.requiresSchedule()) {
            long requiredRole = requiredManagerRole(call.payload());
            log.warn(
                    "event=access.authorize.rejected caller={} operation={} requiredRole={}",
                    caller,
                    call.operation(),
                    Roles.display(requiredRole)
            );
            throw PermissionRegistryException.unauthorizedAccount(caller, requiredRole);
        }
        consume(caller, managerAddress, call.payload());
    }

    @Override
    public boolean grant(long roleId, String account, long executionDelay) {
        if (roleId == Roles.PUBLIC_ROLE) {
            throw PermissionRegistryException.lockedRole(roleId);
        }
        long now = now();
        Optional<RoleMember> existing = roleMemberRepository.findByRoleIdAndAccount(roleId, account);
        if (existing.isEmpty()) {
            long since = now + getRoleGrantDelay(roleId);
            roleMemberRepository.save(RoleMember.granted(roleId, account, since, executionDelay));
            auditTrail.record(AccessEventType.ROLE_GRANTED, account,
                    "roleId=%s executionDelay=%d since=%d newMember=true".formatted(Roles.display(roleId), executionDelay, since));
            log.info(
                    "event=access.role.granted roleId={} account={} executionDelay={} since={} newMember=true",
                    Roles.display(roleId),
                    account,
                    executionDelay,
                    since
            );
            return true;
        }

        RoleMember member = existing.get();
        TimedDelay updated = member.getExecutionDelay().withUpdate(executionDelay, 0L, now);
        member.changeExecutionDelay(updated);
        roleMemberRepository.save(member);
        auditTrail.record(AccessEventType.ROLE_GRANTED, account,
                "roleId=%s executionDelay=%d effectAt=%d newMember=false".formatted(Roles.display(roleId), executionDelay, updated.getEffectAt()));
        log.info(
                "event=access.role.granted roleId={} account={} executionDelay={} effectAt={} newMember=false",
                Roles.display(roleId),
                account,
                executionDelay,
                updated.getEffectAt()
        );
        return false;
    }

    @Override
    public ScheduleReceipt schedule(String caller, String target, String payload, long when) {
        long now = now();
        OperationId operation = OperationId.fromPayload(payload);
        long setback = checkCall(caller, target, payload).delay();
        long minWhen = now + setback;

        if (setback == 0L || (when > 0L && when < minWhen)) {
            log.warn(
                    "event=access.schedule.rejected caller={} target={} operation={} when={} minWhen={}",
                    caller,
                    target,
                    operation,
                    when,
                    minWhen
            );
            throw PermissionRegistryException.unauthorizedCall(caller, target, operation.selector());
        }

        long readyAt = Math.max(when, minWhen);
        String operationId = hashOperation(caller, target, payload);
        ScheduledOperation scheduled = scheduledOperationRepository.findById(operationId)
                .orElseGet(() -> ScheduledOperation.unscheduled(operationId, caller, target, payload));
        if (scheduled.isPending() && !isExpired(scheduled.getReadyAt(), now)) {
            throw PermissionRegistryException.alreadyScheduled(operationId);
        }

        scheduled.schedule(readyAt);
        scheduledOperationRepository.save(scheduled);
        auditTrail.record(AccessEventType.OPERATION_SCHEDULED, operationId,
                "caller=%s target=%s readyAt=%d nonce=%d".formatted(caller, target, readyAt, scheduled.getNonce()));
        log.info(
                "event=access.schedule.created operationId={} caller={} target={} operation={} readyAt={} nonce={}",
                operationId,
                caller,
                target,
                operation,
                readyAt,
                scheduled.getNonce()
        );
        return new ScheduleReceipt(operationId, readyAt, scheduled.getNonce());
    }

    @Override
    public long consume(String caller, String target, String payload) {
        if (!target.equals(managerAddress) && !consumptionGuard.isConsuming(target)) {
            throw PermissionRegistryException.unauthorizedConsume(target);
        }
        long now = now();
        String operationId = hashOperation(caller, target, payload);
        ScheduledOperation scheduled = scheduledOperationRepository.findById(operationId)
                .filter(ScheduledOperation::isPending)
                .orElseThrow(() -> PermissionRegistryException.notScheduled(operationId));

        if (scheduled.getReadyAt() > now) {
            throw PermissionRegistryException.notReady(operationId, scheduled.getReadyAt());
        }
        if (isExpired(scheduled.getReadyAt(), now)) {
            throw PermissionRegistryException.expired(operationId);
        }

        scheduled.clear();
        scheduledOperationRepository.save(scheduled);
        auditTrail.record(AccessEventType.OPERATION_EXECUTED, operationId, "nonce=" + scheduled.getNonce());
        log.info("event=access.schedule.consumed operationId={} caller={} target={} nonce={}", operationId, caller, target, scheduled.getNonce());
        return scheduled.getNonce();
    }

    // The scheduling caller may always cancel; otherwise a root admin or the guardian of the operation's role.
    @Override
    public long cancel(String canceller, String caller, String target, String payload) {
        OperationId operation = OperationId.fromPayload(payload);
        String operationId = hashOperation(caller, target, payload);
        ScheduledOperation scheduled = scheduledOperationRepository.findById(operationId)
                .filter(ScheduledOperation::isPending)
                .orElseThrow(() -> PermissionRegistryException.notScheduled(operationId));

        if (!canceller.equals(caller)) {
            boolean isAdmin = hasRole(Roles.ADMIN_ROLE, canceller).isMember();
            long requiredRole = target.equals(managerAddress)
                    ? requiredManagerRole(payload)
                    : getTargetFunctionRole(target, operation);
            boolean isGuardian = hasRole(getRoleGuardian(requiredRole), canceller).isMember();
            if (!isAdmin && !isGuardian) {
                log.warn(
                        "event=access.schedule.cancel_rejected operationId={} canceller={} caller={}",
                        operationId,
                        canceller,
                        caller
                );
                throw PermissionRegistryException.unauthorizedCancel(canceller, caller, target, operation.selector());
            }
        }

        scheduled.clear();
        scheduledOperationRepository.save(scheduled);
        auditTrail.record(AccessEventType.OPERATION_CANCELED, operationId,
                "canceller=%s nonce=%d".formatted(canceller, scheduled.getNonce()));
        log.info("event=access.schedule.canceled operationId={} canceller={} nonce={}", operationId, canceller, scheduled.getNonce());
        return scheduled.getNonce();
    }

    @Override
    public boolean revoke(long roleId, String account) {
        if (roleId == Roles.PUBLIC_ROLE) {
            throw PermissionRegistryException.lockedRole(roleId);
        }
        Optional<RoleMember> existing = roleMemberRepository.findByRoleIdAndAccount(roleId, account);
        if (existing.isEmpty()) {
            return false;
        }
        roleMemberRepository.delete(existing.get());
        auditTrail.record(AccessEventType.ROLE_REVOKED, account, "roleId=" + Roles.display(roleId));
        log.info("event=access.role.revoked roleId={} account={}", Roles.display(roleId), account);
        return true;
    }

    // The admin relation is a parent-pointer map rooted at ADMIN_ROLE; a binding may not close a loop.
    @Override
    public void setRoleAdmin(long roleId, long adminRoleId) {
        if (Roles.isLocked(roleId)) {
            throw PermissionRegistryException.lockedRole(roleId);
        }
        Set<Long> visited = new HashSet<>();
        long cursor = adminRoleId;
        while (true) {
            if (cursor == roleId) {
                log.warn("event=access.role_admin.rejected reason=cycle roleId={} adminRoleId={}", Roles.display(roleId), Roles.display(adminRoleId));
                throw PermissionRegistryException.roleAdminCycle(roleId, adminRoleId);
            }
            if (cursor == Roles.ADMIN_ROLE || !visited.add(cursor)) {
                break;
            }
            cursor = getRoleAdmin(cursor);
        }

        RoleConfig config = roleConfig(roleId);
        config.changeAdmin(adminRoleId);
        roleConfigRepository.save(config);
        auditTrail.record(AccessEventType.ROLE_ADMIN_CHANGED, Roles.display(roleId), "adminRoleId=" + Roles.display(adminRoleId));
        log.info("event=access.role_admin.changed roleId={} adminRoleId={}", Roles.display(roleId), Roles.display(adminRoleId));
    }

    @Override
    public void setRoleGuardian(long roleId, long guardianRoleId) {
        if (Roles.isLocked(roleId)) {
            throw PermissionRegistryException.lockedRole(roleId);
        }
        RoleConfig config = roleConfig(roleId);
        config.changeGuardian(guardianRoleId);
        roleConfigRepository.save(config);
        auditTrail.record(AccessEventType.ROLE_GUARDIAN_CHANGED, Roles.display(roleId), "guardianRoleId=" + Roles.display(guardianRoleId));
        log.info("event=access.role_guardian.changed roleId={} guardianRoleId={}", Roles.display(roleId), Roles.display(guardianRoleId));
    }

    // Returns when the new grant delay takes effect.
    @Override
    public long setGrantDelay(long roleId, long grantDelay) {
        if (roleId == Roles.PUBLIC_ROLE) {
            throw PermissionRegistryException.lockedRole(roleId);
        }
        RoleConfig config = roleConfig(roleId);
        TimedDelay updated = config.getGrantDelay().withUpdate(grantDelay, minSetbackSeconds, now());
        config.changeGrantDelay(updated);
        roleConfigRepository.save(config);
        auditTrail.record(AccessEventType.ROLE_GRANT_DELAY_CHANGED, Roles.display(roleId),
                "grantDelay=%d effectAt=%d".formatted(grantDelay, updated.getEffectAt()));
        log.info("event=access.grant_delay.changed roleId={} grantDelay={} effectAt={}", Roles.display(roleId), grantDelay, updated.getEffectAt());
        return updated.getEffectAt();
    }

    @Override
    public void setTargetFunctionRole(String target, OperationId operation, long roleId) {
        TargetFunctionPermission permission = targetFunctionPermissionRepository
                .findByTargetAndSelector(target, operation.selector())
                .map(existing -> {
                    existing.rebind(roleId);
                    return existing;
                })
                .orElseGet(() -> TargetFunctionPermission.of(target, operation.selector(), roleId));
        targetFunctionPermissionRepository.save(permission);
        auditTrail.record(AccessEventType.TARGET_FUNCTION_ROLE_UPDATED, target,
                "selector=%s roleId=%s".formatted(operation.selector(), Roles.display(roleId)));
        log.info("event=access.target_function_role.updated target={} operation={} roleId={}", target, operation, Roles.display(roleId));
    }

    @Override
    public void setTargetClosed(String target, boolean closed) {
        TargetConfig config = targetConfigRepository.findById(target).orElseGet(() -> TargetConfig.open(target));
        config.setClosed(closed);
        targetConfigRepository.save(config);
        auditTrail.record(AccessEventType.TARGET_CLOSED, target, "closed=" + closed);
        log.info("event=access.target.closed_updated target={} closed={}", target, closed);
    }

    @Override
    public RoleAccess hasRole(long roleId, String account) {
        if (roleId == Roles.PUBLIC_ROLE) {
            return new RoleAccess(true, 0L);
        }
        long now = now();
        return roleMemberRepository.findByRoleIdAndAccount(roleId, account)
                .filter(member -> member.isActiveAt(now))
                .map(member -> new RoleAccess(true, member.getExecutionDelay().valueAt(now)))
                .orElse(RoleAccess.NONE);
    }

    @Override
    public List<RoleMember> members(long roleId) {
        return roleMemberRepository.findByRoleIdOrderByCreatedAtAsc(roleId);
    }

    @Override
    public long getRoleAdmin(long roleId) {
        return roleConfigRepository.findById(roleId).map(RoleConfig::getAdminRoleId).orElse(Roles.ADMIN_ROLE);
    }

    @Override
    public long getRoleGuardian(long roleId) {
        return roleConfigRepository.findById(roleId).map(RoleConfig::getGuardianRoleId).orElse(Roles.ADMIN_ROLE);
    }

    @Override
    public long getRoleGrantDelay(long roleId) {
        long now = now();
        return roleConfigRepository.findById(roleId).map(config -> config.getGrantDelay().valueAt(now)).orElse(0L);
    }

    @Override
    public long getTargetFunctionRole(String target, OperationId operation) {
        return targetFunctionPermissionRepository.findByTargetAndSelector(target, operation.selector())
                .map(TargetFunctionPermission::getRoleId)
                .orElse(Roles.ADMIN_ROLE);
    }

    @Override
    public boolean isTargetClosed(String target) {
        return targetConfigRepository.findById(target).map(TargetConfig::isClosed).orElse(false);
    }

    // Pending and not yet expired.
    @Override
    public Optional<ScheduledOperation> getSchedule(String operationId) {
        long now = now();
        return scheduledOperationRepository.findById(operationId)
                .filter(ScheduledOperation::isPending)
                .filter(scheduled -> !isExpired(scheduled.getReadyAt(), now));
    }

    @Override
    public String hashOperation(String caller, String target, String payload) {
        return OperationHashes.hashOperation(caller, target, payload);
    }

    private AccessDecision checkCall(String caller, String target, String payload) {
        if (target.equals(managerAddress)) {
            return checkManagerCall(caller, payload);
        }
        return check(caller, target, OperationId.fromPayload(payload));
    }

    private AccessDecision checkManagerCall(String caller, String payload) {
        RoleAccess access = hasRole(requiredManagerRole(payload), caller);
        return access.isMember() ? AccessDecision.forMember(access.executionDelay()) : AccessDecision.denied();
    }

    private long requiredManagerRole(String payload) {
        OperationId operation = OperationId.fromPayload(payload);
        if (ManagerCalls.isRoleScoped(operation)) {
            return getRoleAdmin(ManagerCalls.roleIdArgument(payload));
        }
        return getTargetFunctionRole(managerAddress, operation);
    }

    private RoleConfig roleConfig(long roleId) {
        return roleConfigRepository.findById(roleId).orElseGet(() -> RoleConfig.defaults(roleId));
    }

    private boolean isExpired(long readyAt, long now) {
        return expirationSeconds > 0L && readyAt + expirationSeconds <= now;
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
