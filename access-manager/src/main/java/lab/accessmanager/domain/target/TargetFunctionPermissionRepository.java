package lab.accessmanager.domain.target;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface TargetFunctionPermissionRepository extends JpaRepository<TargetFunctionPermission, UUID> {

    Optional<TargetFunctionPermission> findByTargetAndSelector(String target, String selector);

    List<TargetFunctionPermission> findByTargetOrderBySelectorAsc(String target);
}
