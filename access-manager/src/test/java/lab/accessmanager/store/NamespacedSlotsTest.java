package lab.accessmanager.store;

import lab.accessmanager.support.InMemoryStateStore;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NamespacedSlotsTest {

    @Test
    void baseSlot_matchesPublishedExampleForExampleMain() {
        assertThat(NamespacedSlots.toHex(NamespacedSlots.baseSlot("example.main")))
                .isEqualTo("0x183a6125c38840424c4a85fa12bab2ab606c4b6d0e7cc73c0c06ba5300eab500");
    }

    @Test
    void baseSlot_clearsLowByte() {
        for (String namespace : StorageNamespaces.ALL) {
            assertThat(NamespacedSlots.baseSlot(namespace).and(BigInteger.valueOf(0xff))).isEqualTo(BigInteger.ZERO);
        }
    }

    @Test
    void namespaces_neverShareABaseSlot() {
        Set<BigInteger> slots = new HashSet<>();
        StorageNamespaces.ALL.forEach(namespace -> slots.add(NamespacedSlots.baseSlot(namespace)));

        assertThat(slots).hasSize(StorageNamespaces.ALL.size());
    }

    @Test
    void mappingEntries_areKeyedByAccountAndNamespace() {
        InMemoryStateStore store = new InMemoryStateStore();
        StateMapping<String> locks = store.mapping(StorageNamespaces.REDEMPTION_LOCKS, SlotKeys.ADDRESS);
        StateMapping<String> deposits = store.mapping(StorageNamespaces.VAULT_DEPOSIT_ACCESS, SlotKeys.ADDRESS);
        String alice = "0x00000000000000000000000000000000000a11ce";
        String bob = "0x0000000000000000000000000000000000000b0b";

        assertThat(locks.slotOf(alice)).isNotEqualTo(locks.slotOf(bob));
        assertThat(locks.slotOf(alice)).isNotEqualTo(deposits.slotOf(alice));
        assertThat(locks.slotOf(alice)).hasSize(66);
        // checksum case does not change the key
        assertThat(locks.slotOf(alice.toUpperCase().replace("0X", "0x"))).isEqualTo(locks.slotOf(alice));
    }

    @Test
    void writingZero_clearsTheSlot() {
        InMemoryStateStore store = new InMemoryStateStore();
        StateValue delay = store.value(StorageNamespaces.REDEMPTION_DELAY);

        delay.put(600);
        assertThat(store.slots()).containsKey(delay.slot());
        delay.put(0);

        assertThat(store.slots()).isEmpty();
        assertThat(delay.get()).isZero();
    }

    @Test
    void negativeValues_areRejected() {
        StateValue delay = new InMemoryStateStore().value(StorageNamespaces.REDEMPTION_DELAY);

        assertThatThrownBy(() -> delay.put(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void blankNamespace_isRejected() {
        assertThatThrownBy(() -> NamespacedSlots.baseSlot(" ")).isInstanceOf(IllegalArgumentException.class);
    }
}
