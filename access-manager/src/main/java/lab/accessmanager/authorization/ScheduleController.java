package lab.accessmanager.authorization;

import lab.accessmanager.authorization.AccessRequests.CancelRequest;
import lab.accessmanager.authorization.AccessRequests.ScheduleRequest;
import lab.accessmanager.common.CorrelationIdFilter;
import lab.accessmanager.domain.schedule.ScheduledOperation;
import lab.accessmanager.registry.ScheduleReceipt;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequiredArgsConstructor
@RequestMapping("/schedules")
@Slf4j
public class ScheduleController {

    private final AuthorizationCore authorizationCore;

    // First phase for delayed callers: the exact payload becomes consumable at readyAt.
    @PostMapping
    public ResponseEntity<ScheduleReceipt> schedule(
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) String caller,
            @RequestBody ScheduleRequest req
    ) {
        long when = req.when() == null ? 0L : req.when();
        log.info("event=schedule.create.request caller={} target={} when={}", caller, req.target(), when);
        ScheduleReceipt receipt = authorizationCore.schedule(caller, req.target(), req.payload(), when);
        log.info(
                "event=schedule.create.response operationId={} readyAt={} nonce={}",
                receipt.operationId(),
                receipt.readyAt(),
                receipt.nonce()
        );
        return ResponseEntity.ok(receipt);
    }

    // X-Caller is the canceller; the body names the caller that scheduled the operation.
    @PostMapping("/cancel")
    public ResponseEntity<Map<String, Object>> cancel(
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) String canceller,
            @RequestBody CancelRequest req
    ) {
        log.info("event=schedule.cancel.request canceller={} caller={} target={}", canceller, req.caller(), req.target());
        long nonce = authorizationCore.cancel(canceller, req.caller(), req.target(), req.payload());
        String operationId = authorizationCore.hashOperation(req.caller(), req.target(), req.payload());
        return ResponseEntity.ok(Map.of("operationId", operationId, "nonce", nonce));
    }

    @GetMapping("/{operationId}")
    public ResponseEntity<ScheduledOperation> get(@PathVariable String operationId) {
        return authorizationCore.getSchedule(operationId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/hash")
    public ResponseEntity<Map<String, String>> hashOperation(
            @RequestParam String caller,
            @RequestParam String target,
            @RequestParam String payload
    ) {
        return ResponseEntity.ok(Map.of("operationId", authorizationCore.hashOperation(caller, target, payload)));
    }
}
