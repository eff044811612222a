package lab.accessmanager.authorization.vault;

// PRIVATE -> PUBLIC only.
public enum DepositAccess {
    PRIVATE,
    PUBLIC
}
