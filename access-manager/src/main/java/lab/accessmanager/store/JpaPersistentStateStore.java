package lab.accessmanager.store;

import lab.accessmanager.domain.storage.StorageSlot;
import lab.accessmanager.domain.storage.StorageSlotRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.web3j.utils.Numeric;

import java.math.BigInteger;

@Component
@RequiredArgsConstructor
public class JpaPersistentStateStore implements PersistentStateStore {

    private final StorageSlotRepository storageSlotRepository;

    @Override
    public BigInteger load(String slot) {
        return storageSlotRepository.findById(slot)
                .map(existing -> Numeric.toBigInt(existing.getWord()))
                .orElse(BigInteger.ZERO);
    }

    @Override
    public void store(String slot, BigInteger word) {
        if (word.signum() < 0 || word.bitLength() > 256) {
            throw new IllegalArgumentException("storage word must be an unsigned 256-bit value: " + word);
        }
        if (word.signum() == 0) {
            storageSlotRepository.findById(slot).ifPresent(existing -> {
                storageSlotRepository.delete(existing);
                storageSlotRepository.flush();
            });
            return;
        }
        String encoded = Numeric.toHexStringWithPrefixZeroPadded(word, 64);
        storageSlotRepository.findById(slot).ifPresentOrElse(
                existing -> {
                    existing.overwrite(encoded);
                    storageSlotRepository.save(existing);
                },
                () -> storageSlotRepository.save(StorageSlot.of(slot, encoded))
        );
    }
}
