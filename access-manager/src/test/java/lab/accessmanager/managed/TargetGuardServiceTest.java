package lab.accessmanager.managed;

import lab.accessmanager.authorization.AccessDecision;
import lab.accessmanager.authorization.AuthorizationCore;
import lab.accessmanager.authorization.InvalidRequestException;
import lab.accessmanager.authorization.OperationId;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TargetGuardServiceTest {

    private static final String MANAGER = "0x00000000000000000000000000000000000ac0de";
    private static final String CALLER = "0x0000000000000000000000000000000000001001";
    private static final OperationId DEPOSIT = OperationId.ofSignature("deposit(uint256,address)");

    @Mock AuthorizationCore authorizationCore;

    private TargetGuardService service() {
        return new TargetGuardService(authorizationCore, new ConsumptionGuard());
    }

    private void runAtomicallyInline() {
        when(authorizationCore.atomically(any())).thenAnswer(invocation -> {
            Supplier<?> work = invocation.getArgument(0);
            return work.get();
        });
    }

    @Test
    void guard_reportsTheSelectorOfTheNormalizedPayload() {
        String target = "0x000000000000000000000000000000000000BEEF";
        String payload = DEPOSIT.selector().substring(2).toUpperCase() + "00".repeat(64);
        when(authorizationCore.getManagerAddress()).thenReturn(MANAGER);
        runAtomicallyInline();
        when(authorizationCore.canCallAndUpdate(CALLER, "0x000000000000000000000000000000000000beef", DEPOSIT))
                .thenReturn(AccessDecision.immediately());
        when(authorizationCore.getAccountLockTime(CALLER)).thenReturn(1_700_000_600L);

        GuardedCallReceipt receipt = service().guard(target, CALLER, payload);

        assertThat(receipt.target()).isEqualTo("0x000000000000000000000000000000000000beef");
        assertThat(receipt.caller()).isEqualTo(CALLER);
        assertThat(receipt.operation()).isEqualTo(DEPOSIT.selector());
        assertThat(receipt.authorizationPath()).isEqualTo(AuthorizationPath.IMMEDIATE);
        assertThat(receipt.accountLockTime()).isEqualTo(1_700_000_600L);
    }

    @Test
    void guard_checksEveryCallAgainstItsOwnTarget() {
        String first = "0x0000000000000000000000000000000000002001";
        String second = "0x0000000000000000000000000000000000002002";
        when(authorizationCore.getManagerAddress()).thenReturn(MANAGER);
        runAtomicallyInline();
        when(authorizationCore.canCallAndUpdate(eq(CALLER), anyString(), eq(DEPOSIT)))
                .thenReturn(AccessDecision.immediately());
        TargetGuardService service = service();

        assertThat(service.guard(first, CALLER, DEPOSIT.selector()).target()).isEqualTo(first);
        assertThat(service.guard(second, CALLER, DEPOSIT.selector()).target()).isEqualTo(second);
        assertThat(service.guard(first, CALLER, DEPOSIT.selector()).target()).isEqualTo(first);

        verify(authorizationCore, times(2)).canCallAndUpdate(CALLER, first, DEPOSIT);
        verify(authorizationCore).canCallAndUpdate(CALLER, second, DEPOSIT);
    }

    @Test
    void guard_refusesTheManagerItself() {
        when(authorizationCore.getManagerAddress()).thenReturn(MANAGER);

        assertThatThrownBy(() -> service().guard(MANAGER, CALLER, DEPOSIT.selector()))
                .isInstanceOf(InvalidRequestException.class);

        verify(authorizationCore, never()).atomically(any());
    }
}
