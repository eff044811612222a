package lab.accessmanager.authorization.delay;

import lab.accessmanager.authorization.AccessAuditTrail;
import lab.accessmanager.authorization.InvalidRequestException;
import lab.accessmanager.authorization.error.TooShortExecutionDelayForRoleException;
import lab.accessmanager.domain.audit.AccessEventType;
import lab.accessmanager.domain.role.Roles;
import lab.accessmanager.store.PersistentStateStore;
import lab.accessmanager.store.SlotKeys;
import lab.accessmanager.store.StateMapping;
import lab.accessmanager.store.StorageNamespaces;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Minimal execution delay per role. Only consulted when a role is granted: lowering or raising a
 * floor leaves existing members untouched.
 */
@Component
@Slf4j
public class ExecutionDelayRegistry {

    private final StateMapping<Long> minimalDelays;
    private final AccessAuditTrail auditTrail;

    public ExecutionDelayRegistry(PersistentStateStore store, AccessAuditTrail auditTrail) {
        this.minimalDelays = store.mapping(StorageNamespaces.MINIMAL_EXECUTION_DELAYS, SlotKeys.UINT64);
        this.auditTrail = auditTrail;
    }

    public long get(long roleId) {
        return minimalDelays.get(roleId);
    }

    public void set(long roleId, long minimalDelay) {
        minimalDelays.put(roleId, minimalDelay);
        auditTrail.record(AccessEventType.MINIMAL_EXECUTION_DELAY_SET, Roles.display(roleId), "minimalDelay=" + minimalDelay);
        log.info("event=access.minimal_delay.set roleId={} minimalDelay={}", Roles.display(roleId), minimalDelay);
    }

    // Pairs are applied by index, each independently of the others.
    public void setAll(List<Long> roleIds, List<Long> minimalDelays) {
        if (roleIds.size() != minimalDelays.size()) {
            throw new InvalidRequestException("roleIds and delays must have the same length: "
                    + roleIds.size() + " != " + minimalDelays.size());
        }
        for (int i = 0; i < roleIds.size(); i++) {
            set(roleIds.get(i), minimalDelays.get(i));
        }
    }

    public void requireSatisfied(long roleId, long executionDelay) {
        long minimal = get(roleId);
        if (executionDelay < minimal) {
            log.warn(
                    "event=access.grant.rejected reason=too_short_execution_delay roleId={} executionDelay={} minimalDelay={}",
                    Roles.display(roleId),
                    executionDelay,
                    minimal
            );
            throw new TooShortExecutionDelayForRoleException(roleId, executionDelay);
        }
    }
}
