package lab.accessmanager.domain.schedule;

import org.springframework.data.jpa.repository.JpaRepository;

public interface ScheduledOperationRepository extends JpaRepository<ScheduledOperation, String> {
}
