package lab.accessmanager.domain.role;

import org.springframework.data.jpa.repository.JpaRepository;

public interface RoleConfigRepository extends JpaRepository<RoleConfig, Long> {
}
