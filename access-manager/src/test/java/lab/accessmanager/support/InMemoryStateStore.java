package lab.accessmanager.support;

import lab.accessmanager.store.PersistentStateStore;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

public class InMemoryStateStore implements PersistentStateStore {

    private final Map<String, BigInteger> slots = new HashMap<>();

    @Override
    public BigInteger load(String slot) {
        return slots.getOrDefault(slot, BigInteger.ZERO);
    }

    @Override
    public void store(String slot, BigInteger word) {
        if (word.signum() == 0) {
            slots.remove(slot);
        } else {
            slots.put(slot, word);
        }
    }

    public Map<String, BigInteger> slots() {
        return slots;
    }
}
