package lab.accessmanager.store;

import java.math.BigInteger;

public final class StateMapping<K> {

    private final PersistentStateStore store;
    private final BigInteger baseSlot;
    private final SlotKeys.Encoder<K> keyEncoder;

    StateMapping(PersistentStateStore store, BigInteger baseSlot, SlotKeys.Encoder<K> keyEncoder) {
        this.store = store;
        this.baseSlot = baseSlot;
        this.keyEncoder = keyEncoder;
    }

    public long get(K key) {
        return store.load(slotOf(key)).longValueExact();
    }

    public void put(K key, long value) {
        if (value < 0) {
            throw new IllegalArgumentException("stored values are unsigned: " + value);
        }
        store.store(slotOf(key), BigInteger.valueOf(value));
    }

    public String slotOf(K key) {
        return NamespacedSlots.toHex(NamespacedSlots.mappingSlot(keyEncoder.encode(key), baseSlot));
    }
}
