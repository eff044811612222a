package lab.accessmanager.domain.role;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface RoleMemberRepository extends JpaRepository<RoleMember, UUID> {

    Optional<RoleMember> findByRoleIdAndAccount(long roleId, String account);

    List<RoleMember> findByRoleIdOrderByCreatedAtAsc(long roleId);

    boolean existsByRoleId(long roleId);
}
