package lab.accessmanager.authorization.vault;

// NON_TRANSFERABLE -> TRANSFERABLE only.
public enum ShareTransfer {
    NON_TRANSFERABLE,
    TRANSFERABLE
}
