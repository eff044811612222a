package lab.accessmanager.registry;

import lab.accessmanager.authorization.InvalidRequestException;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.DynamicBytes;
import org.web3j.abi.datatypes.Type;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

public final class OperationHashes {

    private static final Pattern HEX_PATTERN = Pattern.compile("(?:[0-9a-f]{2})*");

    private OperationHashes() {
    }

    // keccak256(abi.encode(caller, target, payload))
    public static String hashOperation(String caller, String target, String payload) {
        String encoded = FunctionEncoder.encodeConstructor(List.<Type>of(
                new Address(caller),
                new Address(target),
                new DynamicBytes(Numeric.hexStringToByteArray(payload))
        ));
        return Hash.sha3(Numeric.prependHexPrefix(encoded));
    }

    public static String normalizePayload(String payload) {
        String hex = Numeric.cleanHexPrefix(payload == null ? "" : payload.trim()).toLowerCase(Locale.ROOT);
        if (hex.length() < 8 || !HEX_PATTERN.matcher(hex).matches()) {
            throw new InvalidRequestException("payload must be hex calldata starting with a 4-byte selector");
        }
        return "0x" + hex;
    }
}
