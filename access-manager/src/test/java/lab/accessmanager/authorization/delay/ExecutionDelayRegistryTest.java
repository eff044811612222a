package lab.accessmanager.authorization.delay;

import lab.accessmanager.authorization.AccessAuditTrail;
import lab.accessmanager.authorization.InvalidRequestException;
import lab.accessmanager.authorization.error.ErrorCategory;
import lab.accessmanager.authorization.error.TooShortExecutionDelayForRoleException;
import lab.accessmanager.support.InMemoryStateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@ExtendWith(MockitoExtension.class)
class ExecutionDelayRegistryTest {

    @Mock AccessAuditTrail auditTrail;

    ExecutionDelayRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ExecutionDelayRegistry(new InMemoryStateStore(), auditTrail);
    }

    @Test
    void requireSatisfied_rejectsDelaysBelowTheRoleFloor() {
        registry.set(7L, 3600L);

        assertThatThrownBy(() -> registry.requireSatisfied(7L, 1800L))
                .isInstanceOfSatisfying(TooShortExecutionDelayForRoleException.class, e -> {
                    assertThat(e.getRoleId()).isEqualTo(7L);
                    assertThat(e.getExecutionDelay()).isEqualTo(1800L);
                    assertThat(e.getCategory()).isEqualTo(ErrorCategory.AUTHORIZATION);
                });
        assertThatCode(() -> registry.requireSatisfied(7L, 3600L)).doesNotThrowAnyException();
        assertThatCode(() -> registry.requireSatisfied(8L, 0L)).doesNotThrowAnyException();
    }

    @Test
    void setAll_appliesEachPairIndependently() {
        registry.set(1L, 50L);
        registry.setAll(List.of(1L, 2L), List.of(100L, 200L));
        assertThat(registry.get(1L)).isEqualTo(100L);
        assertThat(registry.get(2L)).isEqualTo(200L);

        registry.setAll(List.of(2L, 1L), List.of(20L, 10L));
        assertThat(registry.get(1L)).isEqualTo(10L);
        assertThat(registry.get(2L)).isEqualTo(20L);
    }

    @Test
    void setAll_requiresPairedArrays() {
        assertThatThrownBy(() -> registry.setAll(List.of(1L, 2L), List.of(100L)))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("same length");
        assertThat(registry.get(1L)).isZero();
    }
}
