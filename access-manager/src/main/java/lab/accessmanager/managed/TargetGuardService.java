package lab.accessmanager.managed;

import lab.accessmanager.authorization.AuthorizationCore;
import lab.accessmanager.authorization.InvalidRequestException;
import lab.accessmanager.authorization.OperationId;
import lab.accessmanager.common.Addresses;
import lab.accessmanager.registry.OperationHashes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Applies the {@link AccessManaged} guard on behalf of targets that live outside this process. The guarded body
 * only reports how the call was authorized; executing the operation is the target's business.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TargetGuardService {

    private final AuthorizationCore authorizationCore;
    private final ConsumptionGuard consumptionGuard;

    public GuardedCallReceipt guard(String target, String caller, String payload) {
        String normalizedTarget = Addresses.normalize(target);
        String normalizedCaller = Addresses.normalize(caller);
        String normalizedPayload = OperationHashes.normalizePayload(payload);
        if (normalizedTarget.equals(authorizationCore.getManagerAddress())) {
            throw new InvalidRequestException("access manager operations are not guarded calls");
        }
        OperationId operation = OperationId.fromPayload(normalizedPayload);
        // AccessManaged is stateless, so one per call.
        AccessManaged guard = new AccessManaged(normalizedTarget, authorizationCore, consumptionGuard);
        log.info("event=access.guarded_call.start target={} caller={} operation={}", normalizedTarget, normalizedCaller, operation);
        GuardedCallReceipt receipt = guard.restricted(normalizedCaller, normalizedPayload, path -> new GuardedCallReceipt(
                normalizedTarget,
                normalizedCaller,
                operation.selector(),
                path,
                authorizationCore.getAccountLockTime(normalizedCaller)
        ));
        log.info(
                "event=access.guarded_call.done target={} caller={} operation={} path={}",
                receipt.target(),
                receipt.caller(),
                receipt.operation(),
                receipt.authorizationPath()
        );
        return receipt;
    }
}
