package lab.accessmanager.domain.role;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "role_configs")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class RoleConfig {

    // unsigned 64-bit role id held in a signed long (PUBLIC_ROLE is -1)
    @Id
    @Column(nullable = false, updatable = false)
    private Long roleId;

    @Column(nullable = false)
    private long adminRoleId;

    @Column(nullable = false)
    private long guardianRoleId;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "currentValue", column = @Column(name = "grant_delay")),
            @AttributeOverride(name = "pendingValue", column = @Column(name = "grant_delay_pending")),
            @AttributeOverride(name = "effectAt", column = @Column(name = "grant_delay_effect_at"))
    })
    private TimedDelay grantDelay;

    @Column(nullable = false)
    private Instant updatedAt;

    public static RoleConfig defaults(long roleId) {
        return RoleConfig.builder()
                .roleId(roleId)
                .adminRoleId(Roles.ADMIN_ROLE)
                .guardianRoleId(Roles.ADMIN_ROLE)
                .grantDelay(TimedDelay.of(0L))
                .updatedAt(Instant.now())
                .build();
    }

    public void changeAdmin(long adminRoleId) {
        this.adminRoleId = adminRoleId;
        this.updatedAt = Instant.now();
    }

    public void changeGuardian(long guardianRoleId) {
        this.guardianRoleId = guardianRoleId;
        this.updatedAt = Instant.now();
    }

    public void changeGrantDelay(TimedDelay grantDelay) {
        this.grantDelay = grantDelay;
        this.updatedAt = Instant.now();
    }
}
