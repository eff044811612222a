package lab.accessmanager.store;

import lab.accessmanager.common.Addresses;
import lab.accessmanager.domain.role.Roles;
import org.web3j.utils.Numeric;

public final class SlotKeys {

    public static final Encoder<String> ADDRESS = address -> Numeric.toBytesPadded(
            Numeric.toBigInt(Addresses.normalize(address)), 32);

    public static final Encoder<Long> UINT64 = value -> Numeric.toBytesPadded(Roles.toUnsigned(value), 32);

    private SlotKeys() {
    }

    @FunctionalInterface
    public interface Encoder<K> {
        byte[] encode(K key);
    }
}
