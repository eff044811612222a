package lab.accessmanager.common;

import lab.accessmanager.authorization.InvalidRequestException;
import org.web3j.crypto.WalletUtils;
import org.web3j.utils.Numeric;

import java.util.Locale;

public final class Addresses {

    private Addresses() {
    }

    // Accounts, targets and vaults are 20-byte hex addresses; all comparisons use the lower-case form.
    public static String normalize(String address) {
        if (address == null || !WalletUtils.isValidAddress(address.trim())) {
            throw new InvalidRequestException("invalid address: " + address);
        }
        return Numeric.prependHexPrefix(Numeric.cleanHexPrefix(address.trim()).toLowerCase(Locale.ROOT));
    }
}
