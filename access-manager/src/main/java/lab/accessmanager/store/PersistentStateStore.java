package lab.accessmanager.store;

import java.math.BigInteger;

/**
 * Word-addressed storage for the manager's own state.
 *
 * <p>Slots are 32-byte addresses derived from namespace strings (see {@link NamespacedSlots}); an unwritten slot
 * reads as zero and writing zero clears it. The permission registry keeps its own tables, so nothing written here can
 * collide with registry state or with namespaces added later.
 */
public interface PersistentStateStore {

    BigInteger load(String slot);

    void store(String slot, BigInteger word);

    default <K> StateMapping<K> mapping(String namespace, SlotKeys.Encoder<K> keyEncoder) {
        return new StateMapping<>(this, NamespacedSlots.baseSlot(namespace), keyEncoder);
    }

    default StateValue value(String namespace) {
        return new StateValue(this, NamespacedSlots.baseSlot(namespace));
    }
}
