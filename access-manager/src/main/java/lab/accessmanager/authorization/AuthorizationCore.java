package lab.accessmanager.authorization;

import jakarta.annotation.PostConstruct;
import lab.accessmanager.authorization.delay.ExecutionDelayRegistry;
import lab.accessmanager.authorization.error.OperationPermanentlyPublicException;
import lab.accessmanager.authorization.error.PermissionRegistryException;
import lab.accessmanager.authorization.error.TooLongRedemptionDelayException;
import lab.accessmanager.authorization.init.BootstrapConfig;
import lab.accessmanager.authorization.init.InitializationGuard;
import lab.accessmanager.authorization.init.InitializationState;
import lab.accessmanager.authorization.lock.RedemptionLockLedger;
import lab.accessmanager.authorization.vault.DepositAccess;
import lab.accessmanager.authorization.vault.ShareTransfer;
import lab.accessmanager.authorization.vault.VaultLatchRegistry;
import lab.accessmanager.authorization.vault.VaultOperations;
import lab.accessmanager.common.Addresses;
import lab.accessmanager.domain.audit.AccessEventType;
import lab.accessmanager.domain.role.RoleMember;
import lab.accessmanager.domain.role.Roles;
import lab.accessmanager.domain.schedule.ScheduledOperation;
import lab.accessmanager.managed.ConsumptionGuard;
import lab.accessmanager.registry.OperationHashes;
import lab.accessmanager.registry.PermissionOracle;
import lab.accessmanager.registry.RoleAccess;
import lab.accessmanager.registry.ScheduleReceipt;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Authorization and timelock control plane in front of the permission registry.
 *
 * <p>Adds to the registry's role model: a minimal execution delay per role enforced on every grant, the per-account
 * redemption lock driven by {@link #canCallAndUpdate}, the one-time bootstrap, and the one-way vault latches. The
 * manager's own administrative operations are authorized through the registry against their ABI-encoded payload,
 * so a delayed admin must schedule exactly that payload first.
 *
 * <p>Every mutating call is serialized by a single fair lock and runs in one transaction: a failure anywhere rolls
 * back everything the call wrote, including a redemption lock written before a later denial.
 */
@Service
@Slf4j
public class AuthorizationCore {

    public static final long MAX_REDEMPTION_DELAY_SECONDS = 604_800L;

    private final PermissionOracle registry;
    private final InitializationGuard initializationGuard;
    private final ExecutionDelayRegistry executionDelays;
    private final RedemptionLockLedger redemptionLocks;
    private final VaultLatchRegistry vaultLatches;
    private final VaultOperations vaultOperations;
    private final ConsumptionGuard consumptionGuard;
    private final AccessAuditTrail auditTrail;
    private final TransactionTemplate transactionTemplate;
    private final long redemptionDelaySeconds;
    private final String managerAddress;
    private final String initialAdmin;
    private final long guardianRole;
    private final ReentrantLock lock = new ReentrantLock(true);

    public AuthorizationCore(
            PermissionOracle registry,
            InitializationGuard initializationGuard,
            ExecutionDelayRegistry executionDelays,
            RedemptionLockLedger redemptionLocks,
            VaultLatchRegistry vaultLatches,
            VaultOperations vaultOperations,
            ConsumptionGuard consumptionGuard,
            AccessAuditTrail auditTrail,
            TransactionTemplate transactionTemplate,
            @Value("${access.redemption-delay-seconds:0}") long redemptionDelaySeconds,
            @Value("${access.manager.address}") String managerAddress,
            @Value("${access.manager.initial-admin}") String initialAdmin,
            @Value("${access.roles.guardian:1}") long guardianRole
    ) {
        if (redemptionDelaySeconds < 0 || redemptionDelaySeconds > MAX_REDEMPTION_DELAY_SECONDS) {
            throw new TooLongRedemptionDelayException(redemptionDelaySeconds, MAX_REDEMPTION_DELAY_SECONDS);
        }
        if (Roles.isLocked(guardianRole)) {
            throw new IllegalStateException("access.roles.guardian must not be the admin or public role");
        }
        this.registry = registry;
        this.initializationGuard = initializationGuard;
        this.executionDelays = executionDelays;
        this.redemptionLocks = redemptionLocks;
        this.vaultLatches = vaultLatches;
        this.vaultOperations = vaultOperations;
        this.consumptionGuard = consumptionGuard;
        this.auditTrail = auditTrail;
        this.transactionTemplate = transactionTemplate;
        this.redemptionDelaySeconds = redemptionDelaySeconds;
        this.managerAddress = Addresses.normalize(managerAddress);
        this.initialAdmin = Addresses.normalize(initialAdmin);
        this.guardianRole = guardianRole;
    }

    // Stores the redemption delay and, on a fresh deployment, makes the initial admin root and hands target closing
    // to the guardian role. The admin grant does not go through grantRole, so no minimal delay is checked.
    @PostConstruct
    void deploy() {
        atomicallyRun(() -> {
            redemptionLocks.storeRedemptionDelay(redemptionDelaySeconds);
            if (!registry.members(Roles.ADMIN_ROLE).isEmpty()) {
                log.info("event=access.deploy.resumed managerAddress={} redemptionDelay={}", managerAddress, redemptionDelaySeconds);
                return;
            }
            registry.grant(Roles.ADMIN_ROLE, initialAdmin, 0L);
            registry.setTargetFunctionRole(managerAddress, ManagerCalls.UPDATE_TARGET_CLOSED, guardianRole);
            log.warn(
                    "event=access.deploy.initial_admin account={} executionDelay=0 minimalDelayCheck=skipped",
                    initialAdmin
            );
            log.info(
                    "event=access.deploy.done managerAddress={} redemptionDelay={} guardianRole={}",
                    managerAddress,
                    redemptionDelaySeconds,
                    Roles.display(guardianRole)
            );
        });
    }

    public <T> T atomically(Supplier<T> work) {
        lock.lock();
        try {
            return transactionTemplate.execute(status -> work.get());
        } finally {
            lock.unlock();
        }
    }

    public void atomicallyRun(Runnable work) {
        atomically(() -> {
            work.run();
            return null;
        });
    }

    // One-time bootstrap. Passes: function roles (with guardian as canceller), minimal delays, role admins, grants.
    public void initialize(String caller, BootstrapConfig config) {
        String normalizedCaller = Addresses.normalize(caller);
        BootstrapConfig normalized = normalize(config);
        atomicallyRun(() -> {
            initializationGuard.ensureNotInitialized();
            registry.authorize(normalizedCaller, ManagerCalls.initialize(normalized));

            Set<Long> guardedRoles = new LinkedHashSet<>();
            for (BootstrapConfig.FunctionPermission permission : normalized.functionPermissions()) {
                requireNotLatched(permission.target(), permission.operation(), permission.roleId());
                registry.setTargetFunctionRole(permission.target(), permission.operation(), permission.roleId());
                long roleId = permission.roleId();
                if (!Roles.isLocked(roleId) && roleId != guardianRole && guardedRoles.add(roleId)) {
                    registry.setRoleGuardian(roleId, guardianRole);
                }
            }
            for (BootstrapConfig.FunctionPermission permission : normalized.functionPermissions()) {
                executionDelays.set(permission.roleId(), permission.minimalDelay());
            }
            for (BootstrapConfig.RoleAdmin roleAdmin : normalized.roleAdmins()) {
                registry.setRoleAdmin(roleAdmin.roleId(), roleAdmin.adminRoleId());
            }
            for (BootstrapConfig.RoleGrant grant : normalized.roleGrants()) {
                executionDelays.requireSatisfied(grant.roleId(), grant.executionDelay());
                registry.grant(grant.roleId(), grant.account(), grant.executionDelay());
            }

            initializationGuard.markInitialized();
            auditTrail.record(AccessEventType.INITIALIZED, managerAddress,
                    "permissions=%d admins=%d grants=%d".formatted(
                            normalized.functionPermissions().size(),
                            normalized.roleAdmins().size(),
                            normalized.roleGrants().size()));
            log.info(
                    "event=access.initialize.done caller={} permissions={} admins={} grants={} guardedRoles={}",
                    normalizedCaller,
                    normalized.functionPermissions().size(),
                    normalized.roleAdmins().size(),
                    normalized.roleGrants().size(),
                    guardedRoles.size()
            );
        });
    }

    // Not a read: deposit-like operations refresh the caller's redemption lock. Call once per guarded invocation.
    public AccessDecision canCallAndUpdate(String caller, String target, OperationId operation) {
        String normalizedCaller = Addresses.normalize(caller);
        String normalizedTarget = Addresses.normalize(target);
        return atomically(() -> {
            redemptionLocks.lockChecks(normalizedCaller, operation);
            AccessDecision decision = registry.check(normalizedCaller, normalizedTarget, operation);
            log.info(
                    "event=access.can_call caller={} target={} operation={} immediate={} delay={}",
                    normalizedCaller,
                    normalizedTarget,
                    operation,
                    decision.immediate(),
                    decision.delay()
            );
            return decision;
        });
    }

    public void updateTargetClosed(String caller, String target, boolean closed) {
        String normalizedCaller = Addresses.normalize(caller);
        String normalizedTarget = Addresses.normalize(target);
        if (normalizedTarget.equals(managerAddress)) {
            throw new InvalidRequestException("the access manager itself cannot be closed");
        }
        atomicallyRun(() -> {
            registry.authorize(normalizedCaller, ManagerCalls.updateTargetClosed(normalizedTarget, closed));
            registry.setTargetClosed(normalizedTarget, closed);
        });
    }

    // One-way: deposit operations on the vault become callable by anyone.
    public void convertToPublicVault(String caller, String vault) {
        String normalizedCaller = Addresses.normalize(caller);
        String normalizedVault = Addresses.normalize(vault);
        atomicallyRun(() -> {
            registry.authorize(normalizedCaller, ManagerCalls.convertToPublicVault(normalizedVault));
            if (!vaultLatches.openDeposits(normalizedVault)) {
                log.info("event=access.vault.public_skipped vault={} reason=already_public", normalizedVault);
                return;
            }
            vaultOperations.publicDepositOperations()
                    .forEach(operation -> registry.setTargetFunctionRole(normalizedVault, operation, Roles.PUBLIC_ROLE));
            auditTrail.record(AccessEventType.VAULT_CONVERTED_TO_PUBLIC, normalizedVault,
                    "operations=" + vaultOperations.publicDepositOperations().size());
            log.info("event=access.vault.converted_to_public vault={} caller={}", normalizedVault, normalizedCaller);
        });
    }

    // One-way: share transfers on the vault become callable by anyone.
    public void enableTransferShares(String caller, String vault) {
        String normalizedCaller = Addresses.normalize(caller);
        String normalizedVault = Addresses.normalize(vault);
        atomicallyRun(() -> {
            registry.authorize(normalizedCaller, ManagerCalls.enableTransferShares(normalizedVault));
            if (!vaultLatches.enableTransfers(normalizedVault)) {
                log.info("event=access.vault.transfers_skipped vault={} reason=already_transferable", normalizedVault);
                return;
            }
            vaultOperations.shareTransferOperations()
                    .forEach(operation -> registry.setTargetFunctionRole(normalizedVault, operation, Roles.PUBLIC_ROLE));
            auditTrail.record(AccessEventType.VAULT_TRANSFERS_ENABLED, normalizedVault,
                    "operations=" + vaultOperations.shareTransferOperations().size());
            log.info("event=access.vault.transfers_enabled vault={} caller={}", normalizedVault, normalizedCaller);
        });
    }

    public void setMinimalExecutionDelaysForRoles(String caller, List<Long> roleIds, List<Long> delays) {
        String normalizedCaller = Addresses.normalize(caller);
        if (roleIds.size() != delays.size()) {
            throw new InvalidRequestException("roleIds and delays must have the same length: "
                    + roleIds.size() + " != " + delays.size());
        }
        delays.forEach(delay -> ManagerCalls.requireUint32(delay, "delay"));
        atomicallyRun(() -> {
            registry.authorize(normalizedCaller, ManagerCalls.setMinimalExecutionDelaysForRoles(roleIds, delays));
            executionDelays.setAll(roleIds, delays);
        });
    }

    // Returns true when the account became a new member. The floor is checked before the caller is authorized.
    public boolean grantRole(String caller, long roleId, String account, long executionDelay) {
        String normalizedCaller = Addresses.normalize(caller);
        String normalizedAccount = Addresses.normalize(account);
        ManagerCalls.requireUint32(executionDelay, "executionDelay");
        return atomically(() -> {
            registry.authorize(normalizedCaller, ManagerCalls.grantRole(roleId, normalizedAccount, executionDelay));
            executionDelays.requireSatisfied(roleId, executionDelay);
            return registry.grant(roleId, normalizedAccount, executionDelay);
        });
    }

    public boolean revokeRole(String caller, long roleId, String account) {
        String normalizedCaller = Addresses.normalize(caller);
        String normalizedAccount = Addresses.normalize(account);
        return atomically(() -> {
            registry.authorize(normalizedCaller, ManagerCalls.revokeRole(roleId, normalizedAccount));
            return registry.revoke(roleId, normalizedAccount);
        });
    }

    public boolean renounceRole(String caller, long roleId, String callerConfirmation) {
        String normalizedCaller = Addresses.normalize(caller);
        if (!normalizedCaller.equals(Addresses.normalize(callerConfirmation))) {
            throw PermissionRegistryException.badConfirmation();
        }
        return atomically(() -> registry.revoke(roleId, normalizedCaller));
    }

    public void setRoleAdmin(String caller, long roleId, long adminRoleId) {
        String normalizedCaller = Addresses.normalize(caller);
        atomicallyRun(() -> {
            registry.authorize(normalizedCaller, ManagerCalls.setRoleAdmin(roleId, adminRoleId));
            registry.setRoleAdmin(roleId, adminRoleId);
        });
    }

    public void setRoleGuardian(String caller, long roleId, long guardianRoleId) {
        String normalizedCaller = Addresses.normalize(caller);
        atomicallyRun(() -> {
            registry.authorize(normalizedCaller, ManagerCalls.setRoleGuardian(roleId, guardianRoleId));
            registry.setRoleGuardian(roleId, guardianRoleId);
        });
    }

    // Returns when the new grant delay takes effect.
    public long setGrantDelay(String caller, long roleId, long grantDelay) {
        String normalizedCaller = Addresses.normalize(caller);
        ManagerCalls.requireUint32(grantDelay, "grantDelay");
        return atomically(() -> {
            registry.authorize(normalizedCaller, ManagerCalls.setGrantDelay(roleId, grantDelay));
            return registry.setGrantDelay(roleId, grantDelay);
        });
    }

    // Operations opened by a vault latch stay on the public role.
    public void setTargetFunctionRole(String caller, String target, List<OperationId> operations, long roleId) {
        String normalizedCaller = Addresses.normalize(caller);
        String normalizedTarget = Addresses.normalize(target);
        atomicallyRun(() -> {
            registry.authorize(normalizedCaller, ManagerCalls.setTargetFunctionRole(normalizedTarget, operations, roleId));
            for (OperationId operation : operations) {
                requireNotLatched(normalizedTarget, operation, roleId);
                registry.setTargetFunctionRole(normalizedTarget, operation, roleId);
            }
        });
    }

    public ScheduleReceipt schedule(String caller, String target, String payload, long when) {
        String normalizedCaller = Addresses.normalize(caller);
        String normalizedTarget = Addresses.normalize(target);
        String normalizedPayload = OperationHashes.normalizePayload(payload);
        if (when < 0) {
            throw new InvalidRequestException("when must not be negative: " + when);
        }
        return atomically(() -> registry.schedule(normalizedCaller, normalizedTarget, normalizedPayload, when));
    }

    public long cancel(String canceller, String caller, String target, String payload) {
        String normalizedCanceller = Addresses.normalize(canceller);
        String normalizedCaller = Addresses.normalize(caller);
        String normalizedTarget = Addresses.normalize(target);
        String normalizedPayload = OperationHashes.normalizePayload(payload);
        return atomically(() -> registry.cancel(normalizedCanceller, normalizedCaller, normalizedTarget, normalizedPayload));
    }

    // Called by a guarded target while it holds the consuming marker for itself.
    public long consumeScheduledOp(String target, String caller, String payload) {
        String normalizedTarget = Addresses.normalize(target);
        String normalizedCaller = Addresses.normalize(caller);
        String normalizedPayload = OperationHashes.normalizePayload(payload);
        return atomically(() -> registry.consume(normalizedCaller, normalizedTarget, normalizedPayload));
    }

    public long getMinimalExecutionDelayForRole(long roleId) {
        return executionDelays.get(roleId);
    }

    public long getAccountLockTime(String account) {
        return redemptionLocks.getAccountLockTime(Addresses.normalize(account));
    }

    public long getRedemptionDelaySeconds() {
        return redemptionDelaySeconds;
    }

    public String isConsumingScheduledOp() {
        return consumptionGuard.marker();
    }

    public String isConsumingScheduledOp(String target) {
        return consumptionGuard.marker(Addresses.normalize(target));
    }

    public InitializationState getInitializationState() {
        return initializationGuard.state();
    }

    public DepositAccess getDepositAccess(String vault) {
        return vaultLatches.depositAccess(Addresses.normalize(vault));
    }

    public ShareTransfer getShareTransfer(String vault) {
        return vaultLatches.shareTransfer(Addresses.normalize(vault));
    }

    public RoleAccess hasRole(long roleId, String account) {
        return registry.hasRole(roleId, Addresses.normalize(account));
    }

    public List<RoleMember> getRoleMembers(long roleId) {
        return registry.members(roleId);
    }

    public long getRoleAdmin(long roleId) {
        return registry.getRoleAdmin(roleId);
    }

    public long getRoleGuardian(long roleId) {
        return registry.getRoleGuardian(roleId);
    }

    public long getRoleGrantDelay(long roleId) {
        return registry.getRoleGrantDelay(roleId);
    }

    public long getTargetFunctionRole(String target, OperationId operation) {
        return registry.getTargetFunctionRole(Addresses.normalize(target), operation);
    }

    public boolean isTargetClosed(String target) {
        return registry.isTargetClosed(Addresses.normalize(target));
    }

    public Optional<ScheduledOperation> getSchedule(String operationId) {
        return registry.getSchedule(operationId.toLowerCase(Locale.ROOT));
    }

    public String hashOperation(String caller, String target, String payload) {
        return registry.hashOperation(
                Addresses.normalize(caller),
                Addresses.normalize(target),
                OperationHashes.normalizePayload(payload)
        );
    }

    public String getManagerAddress() {
        return managerAddress;
    }

    public long getGuardianRole() {
        return guardianRole;
    }

    // Operations reopened by a vault latch stay on PUBLIC_ROLE.
    private void requireNotLatched(String target, OperationId operation, long roleId) {
        if (roleId != Roles.PUBLIC_ROLE && isLatchedPublic(target, operation)) {
            log.warn(
                    "event=access.target_function_role.rejected reason=permanently_public target={} operation={}",
                    target,
                    operation
            );
            throw new OperationPermanentlyPublicException(target, operation.selector());
        }
    }

    private boolean isLatchedPublic(String target, OperationId operation) {
        boolean publicDeposit = vaultLatches.depositAccess(target) == DepositAccess.PUBLIC
                && vaultOperations.publicDepositOperations().contains(operation);
        boolean transferable = vaultLatches.shareTransfer(target) == ShareTransfer.TRANSFERABLE
                && vaultOperations.shareTransferOperations().contains(operation);
        return publicDeposit || transferable;
    }

    private BootstrapConfig normalize(BootstrapConfig config) {
        List<BootstrapConfig.FunctionPermission> permissions = config.functionPermissions().stream()
                .map(p -> {
                    ManagerCalls.requireUint32(p.minimalDelay(), "minimalDelay");
                    return new BootstrapConfig.FunctionPermission(
                            Addresses.normalize(p.target()), p.operation(), p.roleId(), p.minimalDelay());
                })
                .toList();
        List<BootstrapConfig.RoleGrant> grants = config.roleGrants().stream()
                .map(g -> {
                    ManagerCalls.requireUint32(g.executionDelay(), "executionDelay");
                    return new BootstrapConfig.RoleGrant(g.roleId(), Addresses.normalize(g.account()), g.executionDelay());
                })
                .toList();
        return new BootstrapConfig(permissions, config.roleAdmins(), grants);
    }
}
