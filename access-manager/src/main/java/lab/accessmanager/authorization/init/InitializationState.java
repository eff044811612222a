package lab.accessmanager.authorization.init;

public enum InitializationState {
    UNINITIALIZED,
    INITIALIZED
}
