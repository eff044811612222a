package lab.accessmanager.domain.target;

import org.springframework.data.jpa.repository.JpaRepository;

public interface TargetConfigRepository extends JpaRepository<TargetConfig, String> {
}
