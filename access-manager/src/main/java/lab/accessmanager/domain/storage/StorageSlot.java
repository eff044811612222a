package lab.accessmanager.domain.storage;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "storage_slots")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class StorageSlot {

    // 32-byte slot address, 0x-prefixed hex
    @Id
    @Column(nullable = false, updatable = false, length = 66)
    private String slot;

    // 32-byte word, 0x-prefixed hex
    @Column(nullable = false, length = 66)
    private String word;

    @Column(nullable = false)
    private Instant updatedAt;

    public static StorageSlot of(String slot, String word) {
        return StorageSlot.builder()
                .slot(slot)
                .word(word)
                .updatedAt(Instant.now())
                .build();
    }

    public void overwrite(String word) {
        this.word = word;
        this.updatedAt = Instant.now();
    }
}
