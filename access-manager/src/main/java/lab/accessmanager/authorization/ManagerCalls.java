package lab.accessmanager.authorization;

import lab.accessmanager.authorization.init.BootstrapConfig;
import lab.accessmanager.domain.role.Roles;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Bytes4;
import org.web3j.abi.datatypes.generated.Uint32;
import org.web3j.abi.datatypes.generated.Uint64;
import org.web3j.utils.Numeric;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;

public final class ManagerCalls {

    public static final long MAX_UINT32 = 0xFFFF_FFFFL;

    public static final OperationId INITIALIZE = OperationId.ofSignature(
            "initialize(address[],bytes4[],uint64[],uint32[],uint64[],uint64[],uint64[],address[],uint32[])");
    public static final OperationId GRANT_ROLE = OperationId.ofSignature("grantRole(uint64,address,uint32)");
    public static final OperationId REVOKE_ROLE = OperationId.ofSignature("revokeRole(uint64,address)");
    public static final OperationId SET_ROLE_ADMIN = OperationId.ofSignature("setRoleAdmin(uint64,uint64)");
    public static final OperationId SET_ROLE_GUARDIAN = OperationId.ofSignature("setRoleGuardian(uint64,uint64)");
    public static final OperationId SET_GRANT_DELAY = OperationId.ofSignature("setGrantDelay(uint64,uint32)");
    public static final OperationId SET_TARGET_FUNCTION_ROLE = OperationId.ofSignature("setTargetFunctionRole(address,bytes4[],uint64)");
    public static final OperationId UPDATE_TARGET_CLOSED = OperationId.ofSignature("updateTargetClosed(address,bool)");
    public static final OperationId CONVERT_TO_PUBLIC_VAULT = OperationId.ofSignature("convertToPublicVault(address)");
    public static final OperationId ENABLE_TRANSFER_SHARES = OperationId.ofSignature("enableTransferShares(address)");
    public static final OperationId SET_MINIMAL_EXECUTION_DELAYS = OperationId.ofSignature("setMinimalExecutionDelaysForRoles(uint64[],uint32[])");

    // Restricted by the admin of the role passed as first argument rather than by a target-function role.
    private static final Set<OperationId> ROLE_SCOPED = Set.of(GRANT_ROLE, REVOKE_ROLE);

    private ManagerCalls() {
    }

    public static ManagerCall initialize(BootstrapConfig config) {
        List<BootstrapConfig.FunctionPermission> permissions = config.functionPermissions();
        List<BootstrapConfig.RoleAdmin> admins = config.roleAdmins();
        List<BootstrapConfig.RoleGrant> grants = config.roleGrants();
        return encode("initialize", List.<Type>of(
                addresses(permissions.stream().map(BootstrapConfig.FunctionPermission::target).toList()),
                selectors(permissions.stream().map(BootstrapConfig.FunctionPermission::operation).toList()),
                uint64s(permissions.stream().map(BootstrapConfig.FunctionPermission::roleId).toList()),
                uint32s(permissions.stream().map(BootstrapConfig.FunctionPermission::minimalDelay).toList()),
                uint64s(admins.stream().map(BootstrapConfig.RoleAdmin::roleId).toList()),
                uint64s(admins.stream().map(BootstrapConfig.RoleAdmin::adminRoleId).toList()),
                uint64s(grants.stream().map(BootstrapConfig.RoleGrant::roleId).toList()),
                addresses(grants.stream().map(BootstrapConfig.RoleGrant::account).toList()),
                uint32s(grants.stream().map(BootstrapConfig.RoleGrant::executionDelay).toList())
        ));
    }

    public static ManagerCall grantRole(long roleId, String account, long executionDelay) {
        return encode("grantRole", List.<Type>of(uint64(roleId), new Address(account), uint32(executionDelay)));
    }

    public static ManagerCall revokeRole(long roleId, String account) {
        return encode("revokeRole", List.<Type>of(uint64(roleId), new Address(account)));
    }

    public static ManagerCall setRoleAdmin(long roleId, long adminRoleId) {
        return encode("setRoleAdmin", List.<Type>of(uint64(roleId), uint64(adminRoleId)));
    }

    public static ManagerCall setRoleGuardian(long roleId, long guardianRoleId) {
        return encode("setRoleGuardian", List.<Type>of(uint64(roleId), uint64(guardianRoleId)));
    }

    public static ManagerCall setGrantDelay(long roleId, long grantDelay) {
        return encode("setGrantDelay", List.<Type>of(uint64(roleId), uint32(grantDelay)));
    }

    public static ManagerCall setTargetFunctionRole(String target, Collection<OperationId> operations, long roleId) {
        return encode("setTargetFunctionRole", List.<Type>of(new Address(target), selectors(List.copyOf(operations)), uint64(roleId)));
    }

    public static ManagerCall updateTargetClosed(String target, boolean closed) {
        return encode("updateTargetClosed", List.<Type>of(new Address(target), new Bool(closed)));
    }

    public static ManagerCall convertToPublicVault(String vault) {
        return encode("convertToPublicVault", List.<Type>of(new Address(vault)));
    }

    public static ManagerCall enableTransferShares(String vault) {
        return encode("enableTransferShares", List.<Type>of(new Address(vault)));
    }

    public static ManagerCall setMinimalExecutionDelaysForRoles(List<Long> roleIds, List<Long> delays) {
        return encode("setMinimalExecutionDelaysForRoles", List.<Type>of(uint64s(roleIds), uint32s(delays)));
    }

    public static boolean isRoleScoped(OperationId operation) {
        return ROLE_SCOPED.contains(operation);
    }

    // First ABI word after the selector.
    public static long roleIdArgument(String payload) {
        String hex = Numeric.cleanHexPrefix(payload);
        if (hex.length() < 8 + 64) {
            throw new InvalidRequestException("payload is missing the role id argument");
        }
        return Numeric.toBigInt(hex.substring(8, 8 + 64)).longValue();
    }

    public static long requireUint32(long seconds, String name) {
        if (seconds < 0 || seconds > MAX_UINT32) {
            throw new InvalidRequestException(name + " must be between 0 and " + MAX_UINT32 + " seconds: " + seconds);
        }
        return seconds;
    }

    private static ManagerCall encode(String name, List<Type> inputs) {
        String payload = FunctionEncoder.encode(new Function(name, inputs, Collections.emptyList()));
        return new ManagerCall(OperationId.fromPayload(payload), payload);
    }

    private static Uint64 uint64(long roleId) {
        return new Uint64(Roles.toUnsigned(roleId));
    }

    private static Uint32 uint32(long seconds) {
        return new Uint32(requireUint32(seconds, "delay"));
    }

    private static DynamicArray<Address> addresses(List<String> values) {
        return new DynamicArray<>(Address.class, values.stream().map(Address::new).toList());
    }

    private static DynamicArray<Bytes4> selectors(List<OperationId> values) {
        return new DynamicArray<>(Bytes4.class, values.stream().map(op -> new Bytes4(op.toBytes())).toList());
    }

    private static DynamicArray<Uint64> uint64s(List<Long> values) {
        return new DynamicArray<>(Uint64.class, values.stream().map(ManagerCalls::uint64).toList());
    }

    private static DynamicArray<Uint32> uint32s(List<Long> values) {
        return new DynamicArray<>(Uint32.class, values.stream().map(ManagerCalls::uint32).toList());
    }
}
