package lab.accessmanager.store;

import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

/**
 * ERC-7201 style slot derivation.
 *
 * <p>{@code base = keccak256(abi.encode(uint256(keccak256(namespace)) - 1)) & ~0xff}; mapping entries live at
 * {@code keccak256(abi.encode(key, base))}. The cleared low byte leaves room for scalar fields at {@code base + n}.
 */
public final class NamespacedSlots {

    private static final BigInteger LOW_BYTE_MASK = BigInteger.ONE.shiftLeft(256)
            .subtract(BigInteger.ONE)
            .xor(BigInteger.valueOf(0xff));

    private NamespacedSlots() {
    }

    public static BigInteger baseSlot(String namespace) {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace is required");
        }
        BigInteger id = Numeric.toBigInt(Hash.sha3(namespace.getBytes(StandardCharsets.UTF_8)));
        byte[] encoded = Numeric.toBytesPadded(id.subtract(BigInteger.ONE), 32);
        return Numeric.toBigInt(Hash.sha3(encoded)).and(LOW_BYTE_MASK);
    }

    public static BigInteger mappingSlot(byte[] key, BigInteger baseSlot) {
        if (key.length != 32) {
            throw new IllegalArgumentException("mapping key must be a 32-byte word");
        }
        byte[] preimage = new byte[64];
        System.arraycopy(key, 0, preimage, 0, 32);
        System.arraycopy(Numeric.toBytesPadded(baseSlot, 32), 0, preimage, 32, 32);
        return Numeric.toBigInt(Hash.sha3(preimage));
    }

    public static String toHex(BigInteger slot) {
        return Numeric.toHexStringWithPrefixZeroPadded(slot, 64);
    }
}
