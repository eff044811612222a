package lab.accessmanager.authorization;

import lab.accessmanager.domain.audit.AccessAuditLog;
import lab.accessmanager.domain.audit.AccessAuditLogRepository;
import lab.accessmanager.domain.audit.AccessEventType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
public class AccessAuditTrail {

    private final AccessAuditLogRepository accessAuditLogRepository;

    // Written inside the caller's transaction, so a rolled-back change leaves no notification behind.
    public void record(AccessEventType type, String subject, String detail) {
        accessAuditLogRepository.save(AccessAuditLog.of(type, subject, detail));
    }

    public List<AccessAuditLog> list(String subject) {
        return accessAuditLogRepository.findBySubjectOrderByCreatedAtAsc(subject);
    }

    public List<AccessAuditLog> list(String subject, AccessEventType type) {
        return accessAuditLogRepository.findBySubjectAndEventTypeOrderByCreatedAtAsc(subject, type);
    }
}
