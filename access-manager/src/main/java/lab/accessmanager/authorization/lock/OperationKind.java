package lab.accessmanager.authorization.lock;

public enum OperationKind {
    DEPOSIT,
    WITHDRAW,
    OTHER
}
