package lab.accessmanager.domain.role;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "role_members",
       uniqueConstraints = {
           @UniqueConstraint(name = "uk_role_member", columnNames = {"roleId", "account"})
       })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class RoleMember {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, updatable = false)
    private long roleId;

    @Column(nullable = false, updatable = false, length = 42)
    private String account;

    // epoch seconds from which the membership is effective
    @Column(nullable = false, updatable = false)
    private long since;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "currentValue", column = @Column(name = "execution_delay")),
            @AttributeOverride(name = "pendingValue", column = @Column(name = "execution_delay_pending")),
            @AttributeOverride(name = "effectAt", column = @Column(name = "execution_delay_effect_at"))
    })
    private TimedDelay executionDelay;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    public static RoleMember granted(long roleId, String account, long since, long executionDelay) {
        return RoleMember.builder()
                .roleId(roleId)
                .account(account)
                .since(since)
                .executionDelay(TimedDelay.of(executionDelay))
                .createdAt(Instant.now())
                .build();
    }

    public boolean isActiveAt(long now) {
        return since <= now;
    }

    public void changeExecutionDelay(TimedDelay executionDelay) {
        this.executionDelay = executionDelay;
    }
}
