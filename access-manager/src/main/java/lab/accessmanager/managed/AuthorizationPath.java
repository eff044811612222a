package lab.accessmanager.managed;

// How a guarded call got through: directly, or by consuming an operation scheduled earlier.
public enum AuthorizationPath {
    IMMEDIATE,
    SCHEDULED
}
