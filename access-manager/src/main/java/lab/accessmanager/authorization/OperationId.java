package lab.accessmanager.authorization;

import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * A 4-byte operation selector, the first four bytes of keccak256 of a function signature.
 */
public record OperationId(String selector) {

    private static final Pattern SELECTOR_PATTERN = Pattern.compile("0x[0-9a-f]{8}");

    public OperationId {
        if (selector == null) {
            throw new InvalidRequestException("operation selector is required");
        }
        selector = selector.trim().toLowerCase(Locale.ROOT);
        if (!SELECTOR_PATTERN.matcher(selector).matches()) {
            throw new InvalidRequestException("invalid operation selector: " + selector);
        }
    }

    public static OperationId ofSignature(String signature) {
        if (signature == null || signature.isBlank() || !signature.contains("(")) {
            throw new InvalidRequestException("invalid function signature: " + signature);
        }
        return new OperationId(Hash.sha3String(signature.replace(" ", "")).substring(0, 10));
    }

    public static OperationId fromPayload(String payload) {
        String hex = Numeric.cleanHexPrefix(payload == null ? "" : payload.trim());
        if (hex.length() < 8) {
            throw new InvalidRequestException("payload must start with a 4-byte selector");
        }
        return new OperationId("0x" + hex.substring(0, 8));
    }

    public byte[] toBytes() {
        return Numeric.hexStringToByteArray(selector);
    }

    @Override
    public String toString() {
        return selector;
    }
}
