package lab.accessmanager.managed;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConsumptionGuardTest {

    private static final String VAULT = "0x000000000000000000000000000000000000c0de";
    private static final String OTHER = "0x000000000000000000000000000000000000d00d";

    private final ConsumptionGuard guard = new ConsumptionGuard();

    @Test
    void marker_isSetOnlyInsideTheScope() {
        assertThat(guard.marker()).isEqualTo(ConsumptionGuard.IDLE_MARKER);

        try (ConsumptionGuard.Scope ignored = guard.enter(VAULT)) {
            assertThat(guard.marker()).isEqualTo(ConsumptionGuard.CONSUMING_MARKER);
            assertThat(guard.marker(VAULT)).isEqualTo(ConsumptionGuard.CONSUMING_MARKER);
            assertThat(guard.marker(OTHER)).isEqualTo(ConsumptionGuard.IDLE_MARKER);
        }

        assertThat(guard.marker()).isEqualTo(ConsumptionGuard.IDLE_MARKER);
        assertThat(guard.isConsuming(VAULT)).isFalse();
    }

    @Test
    void marker_isClearedWhenConsumptionFails() {
        assertThatThrownBy(() -> {
            try (ConsumptionGuard.Scope ignored = guard.enter(VAULT)) {
                throw new IllegalStateException("consume failed");
            }
        }).isInstanceOf(IllegalStateException.class);

        assertThat(guard.marker()).isEqualTo(ConsumptionGuard.IDLE_MARKER);
    }

    @Test
    void nestedScopes_unwindInOrder() {
        ConsumptionGuard.Scope outer = guard.enter(VAULT);
        ConsumptionGuard.Scope inner = guard.enter(OTHER);

        inner.close();
        inner.close();
        assertThat(guard.isConsuming(VAULT)).isTrue();
        assertThat(guard.isConsuming(OTHER)).isFalse();

        outer.close();
        assertThat(guard.marker()).isEqualTo(ConsumptionGuard.IDLE_MARKER);
    }

    @Test
    void marker_isNotVisibleFromOtherThreads() throws Exception {
        try (ConsumptionGuard.Scope ignored = guard.enter(VAULT)) {
            String seenElsewhere = CompletableFuture.supplyAsync(guard::marker).get();

            assertThat(seenElsewhere).isEqualTo(ConsumptionGuard.IDLE_MARKER);
        }
    }

    @Test
    void consumingMarker_isTheSelectorOfTheQuery() {
        assertThat(ConsumptionGuard.CONSUMING_MARKER).isNotEqualTo(ConsumptionGuard.IDLE_MARKER).hasSize(10);
    }
}
