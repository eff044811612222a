package lab.accessmanager.authorization.vault;

import lab.accessmanager.authorization.OperationId;

import java.util.Set;

/**
 * Operations reopened to everyone by the one-way vault latches.
 */
public record VaultOperations(
        Set<OperationId> publicDepositOperations,
        Set<OperationId> shareTransferOperations
) {
    public VaultOperations {
        publicDepositOperations = Set.copyOf(publicDepositOperations);
        shareTransferOperations = Set.copyOf(shareTransferOperations);
    }
}
