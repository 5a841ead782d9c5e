package com.intelhub.backend.ingestion;

import com.intelhub.backend.db.entity.FingerprintRecord;
import com.intelhub.backend.db.repository.FingerprintRepository;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Dedup index over source fingerprints. Registration is a single insert against the fingerprint
 * primary key, so of any number of concurrent callers exactly one sees CREATED.
 */
@Slf4j
@Service
public class FingerprintStore {

    private final FingerprintRepository fingerprintRepository;
    private final TransactionTemplate requiresNewTransaction;

    public FingerprintStore(FingerprintRepository fingerprintRepository, PlatformTransactionManager transactionManager) {
        this.fingerprintRepository = fingerprintRepository;
        this.requiresNewTransaction = new TransactionTemplate(transactionManager);
        this.requiresNewTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public boolean exists(String fingerprint) {
        return fingerprintRepository.existsById(fingerprint);
    }

    public RegistrationResult registerIfAbsent(String fingerprint, UUID itemUuid) {
        if (fingerprintRepository.existsById(fingerprint)) {
            return RegistrationResult.DUPLICATE;
        }
        try {
            requiresNewTransaction.executeWithoutResult(status -> fingerprintRepository.saveAndFlush(
                    FingerprintRecord.builder()
                            .fingerprint(fingerprint)
                            .itemUuid(itemUuid)
                            .registeredAt(LocalDateTime.now())
                            .build()));
            return RegistrationResult.CREATED;
        } catch (DataIntegrityViolationException e) {
            log.debug("Fingerprint {} registered concurrently by another caller", fingerprint);
            return RegistrationResult.DUPLICATE;
        }
    }

    /**
     * Compensating delete for a registration whose item could not be created. Only removes the
     * entry if it still belongs to the given item.
     */
    public void release(String fingerprint, UUID itemUuid) {
        int removed = fingerprintRepository.deleteByFingerprintAndItemUuid(fingerprint, itemUuid);
        if (removed > 0) {
            log.info("↩️ Released fingerprint {} of item {}", fingerprint, itemUuid);
        }
    }
}
