package lab.accessmanager.store;

import java.math.BigInteger;

public final class StateValue {

    private final PersistentStateStore store;
    private final String slot;

    StateValue(PersistentStateStore store, BigInteger baseSlot) {
        this.store = store;
        this.slot = NamespacedSlots.toHex(baseSlot);
    }

    public long get() {
        return store.load(slot).longValueExact();
    }

    public void put(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("stored values are unsigned: " + value);
        }
        store.store(slot, BigInteger.valueOf(value));
    }

    public String slot() {
        return slot;
    }
}
