package lab.accessmanager.authorization;

import lab.accessmanager.authorization.error.AccessManagerException;
import lab.accessmanager.authorization.error.AlreadyInitializedException;
import lab.accessmanager.authorization.error.TooShortExecutionDelayForRoleException;
import lab.accessmanager.authorization.init.BootstrapConfig;
import lab.accessmanager.authorization.init.BootstrapConfig.FunctionPermission;
import lab.accessmanager.authorization.init.BootstrapConfig.RoleAdmin;
import lab.accessmanager.authorization.init.BootstrapConfig.RoleGrant;
import lab.accessmanager.authorization.init.InitializationState;
import lab.accessmanager.domain.audit.AccessEventType;
import lab.accessmanager.domain.role.Roles;
import lab.accessmanager.support.TestClockConfig;
import lab.accessmanager.support.TestIds;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.annotation.DirtiesContext;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

// initialize is one-shot per deployment, so this class owns its context
@SpringBootTest
@Import(TestClockConfig.class)
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_CLASS)
class InitializationIntegrationTest {

    private static final OperationId DEPOSIT = OperationId.ofSignature("deposit(uint256,address)");
    private static final OperationId WITHDRAW = OperationId.ofSignature("withdraw(uint256,address,address)");
    private static final OperationId TOTAL_ASSETS = OperationId.ofSignature("totalAssets()");
    private static final long DEPOSITOR_ROLE = 10L;
    private static final long WITHDRAWER_ROLE = 11L;

    @Autowired
    private AuthorizationCore core;

    @Autowired
    private AccessAuditTrail auditTrail;

    @Test
    void initialize_wiresEverythingOnceAndAtomically() {
        String vault = TestIds.freshAddress();
        String alice = TestIds.freshAddress();
        String bob = TestIds.freshAddress();
        String carol = TestIds.freshAddress();
        List<FunctionPermission> permissions = List.of(
                new FunctionPermission(vault, DEPOSIT, DEPOSITOR_ROLE, 0),
                new FunctionPermission(vault, WITHDRAW, WITHDRAWER_ROLE, 3600),
                new FunctionPermission(vault, TOTAL_ASSETS, Roles.PUBLIC_ROLE, 0)
        );
        List<RoleAdmin> admins = List.of(new RoleAdmin(WITHDRAWER_ROLE, DEPOSITOR_ROLE));

        // a non-admin cannot bootstrap
        assertThatThrownBy(() -> core.initialize(alice, new BootstrapConfig(permissions, admins, List.of())))
                .isInstanceOfSatisfying(AccessManagerException.class,
                        e -> assertThat(e.getErrorName()).isEqualTo("AccessManagerUnauthorizedAccount"));

        // a grant below the floor fails the whole bootstrap
        BootstrapConfig tooShort = new BootstrapConfig(permissions, admins, List.of(
                new RoleGrant(DEPOSITOR_ROLE, alice, 0),
                new RoleGrant(WITHDRAWER_ROLE, carol, 100)
        ));
        assertThatThrownBy(() -> core.initialize(TestIds.ADMIN, tooShort))
                .isInstanceOf(TooShortExecutionDelayForRoleException.class);
        assertThat(core.getInitializationState()).isEqualTo(InitializationState.UNINITIALIZED);
        assertThat(core.getTargetFunctionRole(vault, DEPOSIT)).isEqualTo(Roles.ADMIN_ROLE);
        assertThat(core.getMinimalExecutionDelayForRole(WITHDRAWER_ROLE)).isZero();
        assertThat(core.hasRole(DEPOSITOR_ROLE, alice).isMember()).isFalse();

        BootstrapConfig config = new BootstrapConfig(permissions, admins, List.of(
                new RoleGrant(DEPOSITOR_ROLE, alice, 0),
                new RoleGrant(WITHDRAWER_ROLE, bob, 3600)
        ));
        core.initialize(TestIds.ADMIN, config);

        assertThat(core.getInitializationState()).isEqualTo(InitializationState.INITIALIZED);
        assertThat(core.getTargetFunctionRole(vault, DEPOSIT)).isEqualTo(DEPOSITOR_ROLE);
        assertThat(core.getTargetFunctionRole(vault, WITHDRAW)).isEqualTo(WITHDRAWER_ROLE);
        assertThat(core.getTargetFunctionRole(vault, TOTAL_ASSETS)).isEqualTo(Roles.PUBLIC_ROLE);
        assertThat(core.getRoleGuardian(DEPOSITOR_ROLE)).isEqualTo(TestIds.GUARDIAN_ROLE);
        assertThat(core.getRoleGuardian(WITHDRAWER_ROLE)).isEqualTo(TestIds.GUARDIAN_ROLE);
        assertThat(core.getMinimalExecutionDelayForRole(WITHDRAWER_ROLE)).isEqualTo(3600);
        assertThat(core.getRoleAdmin(WITHDRAWER_ROLE)).isEqualTo(DEPOSITOR_ROLE);
        assertThat(core.hasRole(DEPOSITOR_ROLE, alice).isMember()).isTrue();
        assertThat(core.hasRole(WITHDRAWER_ROLE, bob).executionDelay()).isEqualTo(3600);
        assertThat(auditTrail.list(TestIds.MANAGER, AccessEventType.INITIALIZED)).hasSize(1);

        // second attempt fails whatever it carries and changes nothing
        BootstrapConfig other = new BootstrapConfig(
                List.of(new FunctionPermission(vault, DEPOSIT, Roles.PUBLIC_ROLE, 0)),
                List.of(),
                List.of(new RoleGrant(DEPOSITOR_ROLE, carol, 0))
        );
        assertThatThrownBy(() -> core.initialize(TestIds.ADMIN, other)).isInstanceOf(AlreadyInitializedException.class);
        assertThatThrownBy(() -> core.initialize(TestIds.ADMIN, config)).isInstanceOf(AlreadyInitializedException.class);
        assertThat(core.getTargetFunctionRole(vault, DEPOSIT)).isEqualTo(DEPOSITOR_ROLE);
        assertThat(core.hasRole(DEPOSITOR_ROLE, carol).isMember()).isFalse();
        assertThat(auditTrail.list(TestIds.MANAGER, AccessEventType.INITIALIZED)).hasSize(1);
    }
}
