package lab.accessmanager.store;

import java.util.List;

public final class StorageNamespaces {

    public static final String REDEMPTION_LOCKS = "accessmanager.storage.RedemptionLocks";
    public static final String MINIMAL_EXECUTION_DELAYS = "accessmanager.storage.MinimalExecutionDelays";
    public static final String REDEMPTION_DELAY = "accessmanager.storage.RedemptionDelay";
    public static final String INITIALIZATION = "accessmanager.storage.Initialization";
    public static final String VAULT_DEPOSIT_ACCESS = "accessmanager.storage.VaultDepositAccess";
    public static final String VAULT_SHARE_TRANSFERS = "accessmanager.storage.VaultShareTransfers";

    public static final List<String> ALL = List.of(
            REDEMPTION_LOCKS,
            MINIMAL_EXECUTION_DELAYS,
            REDEMPTION_DELAY,
            INITIALIZATION,
            VAULT_DEPOSIT_ACCESS,
            VAULT_SHARE_TRANSFERS
    );

    private StorageNamespaces() {
    }
}
