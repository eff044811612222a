package lab.accessmanager.authorization;

import lab.accessmanager.authorization.AccessRequests.CanCallRequest;
import lab.accessmanager.authorization.AccessRequests.GrantDelayRequest;
import lab.accessmanager.authorization.AccessRequests.GrantRoleRequest;
import lab.accessmanager.authorization.AccessRequests.InitializeRequest;
import lab.accessmanager.authorization.AccessRequests.MinimalDelaysRequest;
import lab.accessmanager.authorization.AccessRequests.RenounceRoleRequest;
import lab.accessmanager.authorization.AccessRequests.RoleAdminRequest;
import lab.accessmanager.authorization.AccessRequests.RoleGuardianRequest;
import lab.accessmanager.authorization.AccessRequests.TargetClosedRequest;
import lab.accessmanager.authorization.AccessRequests.TargetFunctionRoleRequest;
import lab.accessmanager.authorization.AccessResponses.AccountLockResponse;
import lab.accessmanager.authorization.AccessResponses.CanCallResponse;
import lab.accessmanager.authorization.AccessResponses.GrantDelayResponse;
import lab.accessmanager.authorization.AccessResponses.MemberResponse;
import lab.accessmanager.authorization.AccessResponses.MembershipResponse;
import lab.accessmanager.authorization.AccessResponses.MinimalDelayResponse;
import lab.accessmanager.authorization.AccessResponses.RoleGrantResponse;
import lab.accessmanager.authorization.AccessResponses.RoleResponse;
import lab.accessmanager.authorization.AccessResponses.RoleRevokeResponse;
import lab.accessmanager.authorization.AccessResponses.StatusResponse;
import lab.accessmanager.authorization.AccessResponses.TargetFunctionRoleResponse;
import lab.accessmanager.authorization.AccessResponses.TargetResponse;
import lab.accessmanager.authorization.AccessResponses.VaultResponse;
import lab.accessmanager.authorization.init.BootstrapConfig;
import lab.accessmanager.common.Addresses;
import lab.accessmanager.common.CorrelationIdFilter;
import lab.accessmanager.domain.audit.AccessAuditLog;
import lab.accessmanager.domain.audit.AccessEventType;
import lab.accessmanager.domain.role.Roles;
import lab.accessmanager.registry.RoleAccess;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.List;
import java.util.Locale;

@RestController
@RequiredArgsConstructor
@RequestMapping("/access")
@Slf4j
public class AuthorizationController {

    private final AuthorizationCore authorizationCore;
    private final AccessAuditTrail auditTrail;
    private final Clock clock;

    @GetMapping("/status")
    public ResponseEntity<StatusResponse> status() {
        return ResponseEntity.ok(new StatusResponse(
                authorizationCore.getManagerAddress(),
                authorizationCore.getInitializationState(),
                authorizationCore.getRedemptionDelaySeconds(),
                Roles.display(authorizationCore.getGuardianRole()),
                authorizationCore.isConsumingScheduledOp()
        ));
    }

    // One-time bootstrap of function roles, minimal delays, role admins and grants.
    @PostMapping("/initialize")
    public ResponseEntity<StatusResponse> initialize(
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) String caller,
            @RequestBody InitializeRequest req
    ) {
        BootstrapConfig config = toBootstrapConfig(req);
        log.info(
                "event=access.initialize.request caller={} permissions={} admins={} grants={}",
                caller,
                config.functionPermissions().size(),
                config.roleAdmins().size(),
                config.roleGrants().size()
        );
        authorizationCore.initialize(caller, config);
        return status();
    }

    // Called by a guarded target on behalf of X-Caller; updates the caller's redemption lock.
    @PostMapping("/can-call")
    public ResponseEntity<CanCallResponse> canCall(
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) String caller,
            @RequestBody CanCallRequest req
    ) {
        log.info("event=access.can_call.request caller={} target={} selector={}", caller, req.target(), req.selector());
        AccessDecision decision = authorizationCore.canCallAndUpdate(caller, req.target(), new OperationId(req.selector()));
        return ResponseEntity.ok(new CanCallResponse(decision.immediate(), decision.delay()));
    }

    @GetMapping("/roles/{roleId}")
    public ResponseEntity<RoleResponse> getRole(@PathVariable String roleId) {
        long role = Roles.parse(roleId);
        long now = clock.instant().getEpochSecond();
        List<MemberResponse> members = authorizationCore.getRoleMembers(role).stream()
                .map(member -> MemberResponse.of(member, now))
                .toList();
        return ResponseEntity.ok(new RoleResponse(
                Roles.display(role),
                Roles.display(authorizationCore.getRoleAdmin(role)),
                Roles.display(authorizationCore.getRoleGuardian(role)),
                authorizationCore.getRoleGrantDelay(role),
                authorizationCore.getMinimalExecutionDelayForRole(role),
                members
        ));
    }

    @GetMapping("/roles/{roleId}/members/{account}")
    public ResponseEntity<MembershipResponse> hasRole(@PathVariable String roleId, @PathVariable String account) {
        long role = Roles.parse(roleId);
        RoleAccess access = authorizationCore.hasRole(role, account);
        return ResponseEntity.ok(new MembershipResponse(
                Roles.display(role),
                Addresses.normalize(account),
                access.isMember(),
                access.executionDelay()
        ));
    }

    @PostMapping("/roles/{roleId}/grants")
    public ResponseEntity<RoleGrantResponse> grantRole(
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) String caller,
            @PathVariable String roleId,
            @RequestBody GrantRoleRequest req
    ) {
        long role = Roles.parse(roleId);
        log.info(
                "event=access.grant.request caller={} roleId={} account={} executionDelay={}",
                caller,
                Roles.display(role),
                req.account(),
                req.executionDelay()
        );
        boolean newMember = authorizationCore.grantRole(caller, role, req.account(), req.executionDelay());
        return ResponseEntity.ok(new RoleGrantResponse(Roles.display(role), Addresses.normalize(req.account()), newMember));
    }

    @DeleteMapping("/roles/{roleId}/members/{account}")
    public ResponseEntity<RoleRevokeResponse> revokeRole(
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) String caller,
            @PathVariable String roleId,
            @PathVariable String account
    ) {
        long role = Roles.parse(roleId);
        log.info("event=access.revoke.request caller={} roleId={} account={}", caller, Roles.display(role), account);
        boolean revoked = authorizationCore.revokeRole(caller, role, account);
        return ResponseEntity.ok(new RoleRevokeResponse(Roles.display(role), Addresses.normalize(account), revoked));
    }

    @PostMapping("/roles/{roleId}/renounce")
    public ResponseEntity<RoleRevokeResponse> renounceRole(
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) String caller,
            @PathVariable String roleId,
            @RequestBody RenounceRoleRequest req
    ) {
        long role = Roles.parse(roleId);
        log.info("event=access.renounce.request caller={} roleId={}", caller, Roles.display(role));
        boolean revoked = authorizationCore.renounceRole(caller, role, req.callerConfirmation());
        return ResponseEntity.ok(new RoleRevokeResponse(Roles.display(role), Addresses.normalize(caller), revoked));
    }

    @PutMapping("/roles/{roleId}/admin")
    public ResponseEntity<RoleResponse> setRoleAdmin(
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) String caller,
            @PathVariable String roleId,
            @RequestBody RoleAdminRequest req
    ) {
        long role = Roles.parse(roleId);
        long adminRole = Roles.parse(req.adminRoleId());
        log.info("event=access.role_admin.request caller={} roleId={} adminRoleId={}", caller, Roles.display(role), Roles.display(adminRole));
        authorizationCore.setRoleAdmin(caller, role, adminRole);
        return getRole(roleId);
    }

    @PutMapping("/roles/{roleId}/guardian")
    public ResponseEntity<RoleResponse> setRoleGuardian(
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) String caller,
            @PathVariable String roleId,
            @RequestBody RoleGuardianRequest req
    ) {
        long role = Roles.parse(roleId);
        long guardianRole = Roles.parse(req.guardianRoleId());
        log.info("event=access.role_guardian.request caller={} roleId={} guardianRoleId={}", caller, Roles.display(role), Roles.display(guardianRole));
        authorizationCore.setRoleGuardian(caller, role, guardianRole);
        return getRole(roleId);
    }

    @PutMapping("/roles/{roleId}/grant-delay")
    public ResponseEntity<GrantDelayResponse> setGrantDelay(
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) String caller,
            @PathVariable String roleId,
            @RequestBody GrantDelayRequest req
    ) {
        long role = Roles.parse(roleId);
        log.info("event=access.grant_delay.request caller={} roleId={} grantDelay={}", caller, Roles.display(role), req.grantDelay());
        long effectAt = authorizationCore.setGrantDelay(caller, role, req.grantDelay());
        return ResponseEntity.ok(new GrantDelayResponse(Roles.display(role), req.grantDelay(), effectAt));
    }

    @PutMapping("/minimal-delays")
    public ResponseEntity<List<MinimalDelayResponse>> setMinimalExecutionDelays(
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) String caller,
            @RequestBody MinimalDelaysRequest req
    ) {
        if (req.roleIds() == null || req.delays() == null) {
            throw new InvalidRequestException("roleIds and delays are required");
        }
        List<Long> roleIds = req.roleIds().stream().map(Roles::parse).toList();
        log.info("event=access.minimal_delays.request caller={} count={}", caller, roleIds.size());
        authorizationCore.setMinimalExecutionDelaysForRoles(caller, roleIds, req.delays());
        return ResponseEntity.ok(roleIds.stream()
                .map(roleId -> MinimalDelayResponse.of(roleId, authorizationCore.getMinimalExecutionDelayForRole(roleId)))
                .toList());
    }

    @GetMapping("/minimal-delays/{roleId}")
    public ResponseEntity<MinimalDelayResponse> getMinimalExecutionDelay(@PathVariable String roleId) {
        long role = Roles.parse(roleId);
        return ResponseEntity.ok(MinimalDelayResponse.of(role, authorizationCore.getMinimalExecutionDelayForRole(role)));
    }

    @GetMapping("/targets/{target}")
    public ResponseEntity<TargetResponse> getTarget(@PathVariable String target) {
        return ResponseEntity.ok(new TargetResponse(Addresses.normalize(target), authorizationCore.isTargetClosed(target)));
    }

    // Emergency switch; bound to the guardian role at deployment.
    @PutMapping("/targets/{target}/closed")
    public ResponseEntity<TargetResponse> updateTargetClosed(
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) String caller,
            @PathVariable String target,
            @RequestBody TargetClosedRequest req
    ) {
        log.info("event=access.target_closed.request caller={} target={} closed={}", caller, target, req.closed());
        authorizationCore.updateTargetClosed(caller, target, req.closed());
        return getTarget(target);
    }

    @PutMapping("/targets/{target}/functions")
    public ResponseEntity<List<TargetFunctionRoleResponse>> setTargetFunctionRole(
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) String caller,
            @PathVariable String target,
            @RequestBody TargetFunctionRoleRequest req
    ) {
        if (req.selectors() == null || req.selectors().isEmpty()) {
            throw new InvalidRequestException("selectors are required");
        }
        List<OperationId> operations = req.selectors().stream().map(OperationId::new).toList();
        long role = Roles.parse(req.roleId());
        log.info(
                "event=access.target_function_role.request caller={} target={} selectors={} roleId={}",
                caller,
                target,
                operations,
                Roles.display(role)
        );
        authorizationCore.setTargetFunctionRole(caller, target, operations, role);
        return ResponseEntity.ok(operations.stream()
                .map(operation -> functionRole(target, operation))
                .toList());
    }

    @GetMapping("/targets/{target}/functions/{selector}")
    public ResponseEntity<TargetFunctionRoleResponse> getTargetFunctionRole(
            @PathVariable String target,
            @PathVariable String selector
    ) {
        return ResponseEntity.ok(functionRole(target, new OperationId(selector)));
    }

    @GetMapping("/vaults/{vault}")
    public ResponseEntity<VaultResponse> getVault(@PathVariable String vault) {
        return ResponseEntity.ok(new VaultResponse(
                Addresses.normalize(vault),
                authorizationCore.getDepositAccess(vault),
                authorizationCore.getShareTransfer(vault)
        ));
    }

    @PostMapping("/vaults/{vault}/public")
    public ResponseEntity<VaultResponse> convertToPublicVault(
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) String caller,
            @PathVariable String vault
    ) {
        log.info("event=access.vault_public.request caller={} vault={}", caller, vault);
        authorizationCore.convertToPublicVault(caller, vault);
        return getVault(vault);
    }

    @PostMapping("/vaults/{vault}/transferable")
    public ResponseEntity<VaultResponse> enableTransferShares(
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) String caller,
            @PathVariable String vault
    ) {
        log.info("event=access.vault_transferable.request caller={} vault={}", caller, vault);
        authorizationCore.enableTransferShares(caller, vault);
        return getVault(vault);
    }

    @GetMapping("/accounts/{account}/lock")
    public ResponseEntity<AccountLockResponse> getAccountLockTime(@PathVariable String account) {
        return ResponseEntity.ok(new AccountLockResponse(
                Addresses.normalize(account),
                authorizationCore.getAccountLockTime(account),
                authorizationCore.getRedemptionDelaySeconds()
        ));
    }

    // Change notifications recorded for an account, target, vault, role id or operation id.
    @GetMapping("/audits")
    public ResponseEntity<List<AccessAuditLog>> getAudits(
            @RequestParam String subject,
            @RequestParam(required = false) AccessEventType type
    ) {
        String key = subject.trim().toLowerCase(Locale.ROOT);
        List<AccessAuditLog> audits = type == null ? auditTrail.list(key) : auditTrail.list(key, type);
        log.info("event=access.audits.response subject={} type={} count={}", key, type, audits.size());
        return ResponseEntity.ok(audits);
    }

    private TargetFunctionRoleResponse functionRole(String target, OperationId operation) {
        return new TargetFunctionRoleResponse(
                Addresses.normalize(target),
                operation.selector(),
                Roles.display(authorizationCore.getTargetFunctionRole(target, operation))
        );
    }

    private BootstrapConfig toBootstrapConfig(InitializeRequest req) {
        List<BootstrapConfig.FunctionPermission> permissions = req.functionPermissions() == null ? List.of()
                : req.functionPermissions().stream()
                .map(entry -> new BootstrapConfig.FunctionPermission(
                        entry.target(),
                        new OperationId(entry.selector()),
                        Roles.parse(entry.roleId()),
                        entry.minimalDelay()))
                .toList();
        List<BootstrapConfig.RoleAdmin> admins = req.roleAdmins() == null ? List.of()
                : req.roleAdmins().stream()
                .map(entry -> new BootstrapConfig.RoleAdmin(Roles.parse(entry.roleId()), Roles.parse(entry.adminRoleId())))
                .toList();
        List<BootstrapConfig.RoleGrant> grants = req.roleGrants() == null ? List.of()
                : req.roleGrants().stream()
                .map(entry -> new BootstrapConfig.RoleGrant(Roles.parse(entry.roleId()), entry.account(), entry.executionDelay()))
                .toList();
        return new BootstrapConfig(permissions, admins, grants);
    }
}
