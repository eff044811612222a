package lab.accessmanager.authorization.vault;

import lab.accessmanager.store.PersistentStateStore;
import lab.accessmanager.store.SlotKeys;
import lab.accessmanager.store.StateMapping;
import lab.accessmanager.store.StorageNamespaces;
import org.springframework.stereotype.Component;

/**
 * Per-vault one-way latches. There is deliberately no operation that moves a latch back.
 */
@Component
public class VaultLatchRegistry {

    private final StateMapping<String> depositAccess;
    private final StateMapping<String> shareTransfers;

    public VaultLatchRegistry(PersistentStateStore store) {
        this.depositAccess = store.mapping(StorageNamespaces.VAULT_DEPOSIT_ACCESS, SlotKeys.ADDRESS);
        this.shareTransfers = store.mapping(StorageNamespaces.VAULT_SHARE_TRANSFERS, SlotKeys.ADDRESS);
    }

    public DepositAccess depositAccess(String vault) {
        return DepositAccess.values()[(int) depositAccess.get(vault)];
    }

    public ShareTransfer shareTransfer(String vault) {
        return ShareTransfer.values()[(int) shareTransfers.get(vault)];
    }

    // Returns false when the vault was already public.
    public boolean openDeposits(String vault) {
        if (depositAccess(vault) == DepositAccess.PUBLIC) {
            return false;
        }
        depositAccess.put(vault, DepositAccess.PUBLIC.ordinal());
        return true;
    }

    // Returns false when transfers were already enabled.
    public boolean enableTransfers(String vault) {
        if (shareTransfer(vault) == ShareTransfer.TRANSFERABLE) {
            return false;
        }
        shareTransfers.put(vault, ShareTransfer.TRANSFERABLE.ordinal());
        return true;
    }
}
