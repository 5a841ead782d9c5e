package com.intelhub.backend.db.repository;

import com.intelhub.backend.db.entity.ManualRating;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ManualRatingRepository extends JpaRepository<ManualRating, Long> {

    Optional<ManualRating> findByItemUuidAndDimension(UUID itemUuid, String dimension);

    List<ManualRating> findByItemUuid(UUID itemUuid);

    List<ManualRating> findByItemUuidIn(Collection<UUID> itemUuids);
}
