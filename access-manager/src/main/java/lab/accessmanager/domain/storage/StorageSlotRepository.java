package lab.accessmanager.domain.storage;

import org.springframework.data.jpa.repository.JpaRepository;

public interface StorageSlotRepository extends JpaRepository<StorageSlot, String> {
}
