package lab.accessmanager.authorization;

import lab.accessmanager.authorization.lock.OperationClassifier;
import lab.accessmanager.authorization.vault.VaultOperations;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

@Configuration
@Slf4j
public class OperationTableConfig {

    // Signatures contain commas, so lists are ';'-separated.
    static List<OperationId> parseSignatures(String signatures) {
        return Arrays.stream(signatures.split(";"))
                .map(String::trim)
                .filter(s -> !s.isBlank())
                .map(OperationId::ofSignature)
                .toList();
    }

    @Bean
    public OperationClassifier operationClassifier(
            @Value("${access.operations.deposit}") String depositSignatures,
            @Value("${access.operations.withdraw}") String withdrawSignatures
    ) {
        OperationClassifier classifier = OperationClassifier.of(
                parseSignatures(depositSignatures),
                parseSignatures(withdrawSignatures)
        );
        log.info("event=access.config.operation_table entries={}", classifier.table());
        return classifier;
    }

    @Bean
    public VaultOperations vaultOperations(
            @Value("${access.operations.public-deposit}") String publicDepositSignatures,
            @Value("${access.operations.share-transfer}") String shareTransferSignatures
    ) {
        return new VaultOperations(
                Set.copyOf(parseSignatures(publicDepositSignatures)),
                Set.copyOf(parseSignatures(shareTransferSignatures))
        );
    }
}
