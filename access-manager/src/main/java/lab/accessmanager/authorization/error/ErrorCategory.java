package lab.accessmanager.authorization.error;

public enum ErrorCategory {
    // fatal for the attempted arguments
    CONFIGURATION,
    // retryable only by another caller, or after scheduling
    AUTHORIZATION,
    // retryable by waiting
    TEMPORAL
}
