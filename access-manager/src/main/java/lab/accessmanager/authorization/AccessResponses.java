package lab.accessmanager.authorization;

import lab.accessmanager.authorization.init.InitializationState;
import lab.accessmanager.authorization.vault.DepositAccess;
import lab.accessmanager.authorization.vault.ShareTransfer;
import lab.accessmanager.domain.role.RoleMember;
import lab.accessmanager.domain.role.Roles;

import java.util.List;

public final class AccessResponses {

    private AccessResponses() {
    }

    public record CanCallResponse(
            boolean immediate,
            long delay
    ) {}

    public record RoleGrantResponse(
            String roleId,
            String account,
            boolean newMember
    ) {}

    public record RoleRevokeResponse(
            String roleId,
            String account,
            boolean revoked
    ) {}

    public record RoleResponse(
            String roleId,
            String adminRoleId,
            String guardianRoleId,
            long grantDelay,
            long minimalExecutionDelay,
            List<MemberResponse> members
    ) {}

    public record MemberResponse(
            String account,
            long since,
            long executionDelay
    ) {
        static MemberResponse of(RoleMember member, long now) {
            return new MemberResponse(member.getAccount(), member.getSince(), member.getExecutionDelay().valueAt(now));
        }
    }

    public record MembershipResponse(
            String roleId,
            String account,
            boolean isMember,
            long executionDelay
    ) {}

    public record GrantDelayResponse(
            String roleId,
            long grantDelay,
            long effectAt
    ) {}

    public record MinimalDelayResponse(
            String roleId,
            long minimalDelay
    ) {
        static MinimalDelayResponse of(long roleId, long minimalDelay) {
            return new MinimalDelayResponse(Roles.display(roleId), minimalDelay);
        }
    }

    public record TargetResponse(
            String target,
            boolean closed
    ) {}

    public record TargetFunctionRoleResponse(
            String target,
            String selector,
            String roleId
    ) {}

    public record VaultResponse(
            String vault,
            DepositAccess depositAccess,
            ShareTransfer shareTransfer
    ) {}

    public record AccountLockResponse(
            String account,
            long unlockTime,
            long redemptionDelay
    ) {}

    public record StatusResponse(
            String managerAddress,
            InitializationState initializationState,
            long redemptionDelay,
            String guardianRoleId,
            String consumingMarker
    ) {}
}
