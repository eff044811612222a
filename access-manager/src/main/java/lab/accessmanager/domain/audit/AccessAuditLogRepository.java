package lab.accessmanager.domain.audit;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface AccessAuditLogRepository extends JpaRepository<AccessAuditLog, UUID> {

    List<AccessAuditLog> findBySubjectOrderByCreatedAtAsc(String subject);

    List<AccessAuditLog> findBySubjectAndEventTypeOrderByCreatedAtAsc(String subject, AccessEventType eventType);
}
