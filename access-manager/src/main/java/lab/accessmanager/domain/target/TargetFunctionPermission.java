package lab.accessmanager.domain.target;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "target_function_permissions",
       uniqueConstraints = {
           @UniqueConstraint(name = "uk_target_selector", columnNames = {"target", "selector"})
       })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class TargetFunctionPermission {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, updatable = false, length = 42)
    private String target;

    @Column(nullable = false, updatable = false, length = 10)
    private String selector;

    @Column(nullable = false)
    private long roleId;

    @Column(nullable = false)
    private Instant updatedAt;

    public static TargetFunctionPermission of(String target, String selector, long roleId) {
        return TargetFunctionPermission.builder()
                .target(target)
                .selector(selector)
                .roleId(roleId)
                .updatedAt(Instant.now())
                .build();
    }

    public void rebind(long roleId) {
        this.roleId = roleId;
        this.updatedAt = Instant.now();
    }
}
