package lab.accessmanager.domain.target;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "target_configs")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class TargetConfig {

    @Id
    @Column(nullable = false, updatable = false, length = 42)
    private String target;

    @Column(nullable = false)
    private boolean closed;

    @Column(nullable = false)
    private Instant updatedAt;

    public static TargetConfig open(String target) {
        return TargetConfig.builder()
                .target(target)
                .closed(false)
                .updatedAt(Instant.now())
                .build();
    }

    public void setClosed(boolean closed) {
        this.closed = closed;
        this.updatedAt = Instant.now();
    }
}
