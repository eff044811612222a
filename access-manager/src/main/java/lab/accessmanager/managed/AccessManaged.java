package lab.accessmanager.managed;

import lab.accessmanager.authorization.AccessDecision;
import lab.accessmanager.authorization.AuthorizationCore;
import lab.accessmanager.authorization.OperationId;
import lab.accessmanager.authorization.error.AccessManagedUnauthorizedException;
import lab.accessmanager.common.Addresses;
import lab.accessmanager.registry.OperationHashes;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Function;

/**
 * Entry guard of one managed target.
 *
 * <p>Each guarded call asks the manager once through {@code canCallAndUpdate}. A caller with an execution delay
 * must have scheduled the exact payload; the guard then consumes it while holding the consuming marker for its
 * target. The check, the consumption and the guarded body commit or roll back together.
 */
@Slf4j
public class AccessManaged {

    private final String target;
    private final AuthorizationCore authorizationCore;
    private final ConsumptionGuard consumptionGuard;

    public AccessManaged(String target, AuthorizationCore authorizationCore, ConsumptionGuard consumptionGuard) {
        this.target = Addresses.normalize(target);
        this.authorizationCore = authorizationCore;
        this.consumptionGuard = consumptionGuard;
    }

    public <T> T restricted(String caller, String payload, Function<AuthorizationPath, T> body) {
        String normalizedCaller = Addresses.normalize(caller);
        String normalizedPayload = OperationHashes.normalizePayload(payload);
        OperationId operation = OperationId.fromPayload(normalizedPayload);

        return authorizationCore.atomically(() -> {
            AccessDecision decision = authorizationCore.canCallAndUpdate(normalizedCaller, target, operation);
            if (decision.immediate()) {
                return body.apply(AuthorizationPath.IMMEDIATE);
            }
            if (!decision.requiresSchedule()) {
                log.warn(
                        "event=access.managed.unauthorized target={} caller={} operation={}",
                        target,
                        normalizedCaller,
                        operation
                );
                throw new AccessManagedUnauthorizedException(normalizedCaller);
            }
            try (ConsumptionGuard.Scope ignored = consumptionGuard.enter(target)) {
                long nonce = authorizationCore.consumeScheduledOp(target, normalizedCaller, normalizedPayload);
                log.info(
                        "event=access.managed.scheduled_consumed target={} caller={} operation={} nonce={}",
                        target,
                        normalizedCaller,
                        operation,
                        nonce
                );
            }
            return body.apply(AuthorizationPath.SCHEDULED);
        });
    }

    public String isConsumingScheduledOp() {
        return consumptionGuard.marker(target);
    }

    public String getTarget() {
        return target;
    }
}
