package lab.accessmanager.registry;

public record ScheduleReceipt(
        String operationId,
        long readyAt,
        long nonce
) {}
