package lab.accessmanager.domain.audit;

public enum AccessEventType {
    INITIALIZED,
    ROLE_GRANTED,
    ROLE_REVOKED,
    ROLE_ADMIN_CHANGED,
    ROLE_GUARDIAN_CHANGED,
    ROLE_GRANT_DELAY_CHANGED,
    MINIMAL_EXECUTION_DELAY_SET,
    TARGET_FUNCTION_ROLE_UPDATED,
    TARGET_CLOSED,
    VAULT_CONVERTED_TO_PUBLIC,
    VAULT_TRANSFERS_ENABLED,
    REDEMPTION_LOCK_UPDATED,
    OPERATION_SCHEDULED,
    OPERATION_EXECUTED,
    OPERATION_CANCELED
}
