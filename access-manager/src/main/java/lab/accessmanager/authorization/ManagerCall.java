package lab.accessmanager.authorization;

/**
 * ABI-encoded call to one of the manager's own administrative operations. The payload is what a delayed admin
 * schedules beforehand and what gets consumed when the operation finally runs.
 */
public record ManagerCall(
        OperationId operation,
        String payload
) {}
