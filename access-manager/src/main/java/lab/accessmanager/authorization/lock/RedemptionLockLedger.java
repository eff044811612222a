package lab.accessmanager.authorization.lock;

import lab.accessmanager.authorization.AccessAuditTrail;
import lab.accessmanager.authorization.OperationId;
import lab.accessmanager.authorization.error.AccountIsLockedException;
import lab.accessmanager.domain.audit.AccessEventType;
import lab.accessmanager.store.PersistentStateStore;
import lab.accessmanager.store.SlotKeys;
import lab.accessmanager.store.StateMapping;
import lab.accessmanager.store.StateValue;
import lab.accessmanager.store.StorageNamespaces;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Per-account unlock timestamps tying deposit-like operations to later withdraw-like ones.
 *
 * <p>A deposit pushes the account's unlock time to {@code now + redemptionDelay}; a withdraw is rejected while
 * {@code unlockTime > now}. The boundary instant itself is unlocked. Withdraws never write the ledger.
 */
@Component
@Slf4j
public class RedemptionLockLedger {

    private final StateMapping<String> locks;
    private final StateValue redemptionDelay;
    private final OperationClassifier classifier;
    private final AccessAuditTrail auditTrail;
    private final Clock clock;

    public RedemptionLockLedger(
            PersistentStateStore store,
            OperationClassifier classifier,
            AccessAuditTrail auditTrail,
            Clock clock
    ) {
        this.locks = store.mapping(StorageNamespaces.REDEMPTION_LOCKS, SlotKeys.ADDRESS);
        this.redemptionDelay = store.value(StorageNamespaces.REDEMPTION_DELAY);
        this.classifier = classifier;
        this.auditTrail = auditTrail;
        this.clock = clock;
    }

    public void lockChecks(String account, OperationId operation) {
        long now = clock.instant().getEpochSecond();
        switch (classifier.classify(operation)) {
            case WITHDRAW -> {
                long unlockTime = locks.get(account);
                if (unlockTime > now) {
                    log.warn(
                            "event=access.redemption_lock.rejected account={} operation={} unlockTime={} now={}",
                            account,
                            operation,
                            unlockTime,
                            now
                    );
                    throw new AccountIsLockedException(unlockTime);
                }
            }
            case DEPOSIT -> {
                long delay = redemptionDelay.get();
                if (delay == 0L) {
                    return;
                }
                long unlockTime = now + delay;
                locks.put(account, unlockTime);
                auditTrail.record(AccessEventType.REDEMPTION_LOCK_UPDATED, account, "unlockTime=" + unlockTime);
                log.info(
                        "event=access.redemption_lock.updated account={} operation={} unlockTime={}",
                        account,
                        operation,
                        unlockTime
                );
            }
            case OTHER -> {
                // not correlated with the lock
            }
        }
    }

    public long getAccountLockTime(String account) {
        return locks.get(account);
    }

    public long getRedemptionDelay() {
        return redemptionDelay.get();
    }

    // Written once while the manager is constructed.
    public void storeRedemptionDelay(long seconds) {
        redemptionDelay.put(seconds);
    }
}
