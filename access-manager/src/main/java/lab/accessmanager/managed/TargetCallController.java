package lab.accessmanager.managed;

import lab.accessmanager.common.CorrelationIdFilter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/targets")
@Slf4j
public class TargetCallController {

    private final TargetGuardService targetGuardService;

    // Gate for a remote target: authorizes X-Caller for the payload, consuming a schedule when the caller is delayed.
    @PostMapping("/{target}/calls")
    public ResponseEntity<GuardedCallReceipt> call(
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) String caller,
            @PathVariable String target,
            @RequestBody GuardedCallRequest req
    ) {
        log.info("event=target_call.request target={} caller={}", target, caller);
        GuardedCallReceipt receipt = targetGuardService.guard(target, caller, req.payload());
        log.info("event=target_call.response target={} path={}", receipt.target(), receipt.authorizationPath());
        return ResponseEntity.ok(receipt);
    }

    public record GuardedCallRequest(
            String payload
    ) {}
}
