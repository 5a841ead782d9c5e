package com.intelhub.backend.db.repository;

import com.intelhub.backend.db.entity.EmbeddingVector;
import com.intelhub.backend.db.entity.VectorSpan;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface EmbeddingVectorRepository extends JpaRepository<EmbeddingVector, Long> {

    Optional<EmbeddingVector> findByItemUuidAndSpan(UUID itemUuid, VectorSpan span);

    List<EmbeddingVector> findByItemUuid(UUID itemUuid);

    boolean existsByItemUuidAndSpan(UUID itemUuid, VectorSpan span);

    Long countBySpan(VectorSpan span);
}
