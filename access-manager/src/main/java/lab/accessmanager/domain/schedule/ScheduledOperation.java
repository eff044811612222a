package lab.accessmanager.domain.schedule;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "scheduled_operations",
       indexes = {
           @Index(name = "idx_schedule_target", columnList = "target")
       })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class ScheduledOperation {

    // keccak256(abi.encode(caller, target, payload))
    @Id
    @Column(nullable = false, updatable = false, length = 66)
    private String operationId;

    @Column(nullable = false, updatable = false, length = 42)
    private String caller;

    @Column(nullable = false, updatable = false, length = 42)
    private String target;

    @Column(nullable = false, updatable = false, length = 16384)
    private String payload;

    // epoch seconds; 0 once consumed or canceled
    @Column(nullable = false)
    private long readyAt;

    // bumped on every schedule and kept after the operation leaves the queue
    @Column(nullable = false)
    private long nonce;

    @Column(nullable = false)
    private Instant updatedAt;

    public static ScheduledOperation unscheduled(String operationId, String caller, String target, String payload) {
        return ScheduledOperation.builder()
                .operationId(operationId)
                .caller(caller)
                .target(target)
                .payload(payload)
                .readyAt(0L)
                .nonce(0L)
                .updatedAt(Instant.now())
                .build();
    }

    public boolean isPending() {
        return readyAt != 0L;
    }

    public void schedule(long readyAt) {
        this.readyAt = readyAt;
        this.nonce = this.nonce + 1;
        this.updatedAt = Instant.now();
    }

    public void clear() {
        this.readyAt = 0L;
        this.updatedAt = Instant.now();
    }
}
