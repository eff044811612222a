package lab.accessmanager.domain.audit;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "access_audit_logs", indexes = {
        @Index(name = "idx_access_audit_subject", columnList = "subject")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class AccessAuditLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 40)
    private AccessEventType eventType;

    // account, target, role id or operation id the event is about
    @Column(nullable = false, updatable = false, length = 66)
    private String subject;

    @Column(nullable = false, updatable = false, length = 255)
    private String detail;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    public static AccessAuditLog of(AccessEventType eventType, String subject, String detail) {
        return AccessAuditLog.builder()
                .eventType(eventType)
                .subject(subject)
                .detail(detail)
                .createdAt(Instant.now())
                .build();
    }
}
