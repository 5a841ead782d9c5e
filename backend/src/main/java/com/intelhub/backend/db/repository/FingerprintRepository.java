package com.intelhub.backend.db.repository;

import com.intelhub.backend.db.entity.FingerprintRecord;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public interface FingerprintRepository extends JpaRepository<FingerprintRecord, String> {

    @Modifying
    @Transactional
    @Query("DELETE FROM FingerprintRecord f WHERE f.fingerprint = :fingerprint AND f.itemUuid = :itemUuid")
    int deleteByFingerprintAndItemUuid(@Param("fingerprint") String fingerprint, @Param("itemUuid") UUID itemUuid);
}
