package com.intelhub.backend.rating;

import com.intelhub.backend.db.entity.IntelligenceItem;
import com.intelhub.backend.db.entity.ItemState;
import com.intelhub.backend.db.entity.ManualRating;
import com.intelhub.backend.db.repository.IntelligenceItemRepository;
import com.intelhub.backend.db.repository.ManualRatingRepository;
import com.intelhub.backend.exception.ItemNotFoundException;
import com.intelhub.backend.exception.StorageConflictException;
import com.intelhub.backend.exception.ValidationException;
import com.intelhub.backend.model.dto.ManualRatingRequest;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Human ratings kept beside the AI ratings. A submission is validated as a whole before
 * anything is written; each (item, dimension) holds the latest value.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ManualRatingService {

    public static final double MIN_RATING = 0.0;
    public static final double MAX_RATING = 10.0;

    private final ManualRatingRepository manualRatingRepository;
    private final IntelligenceItemRepository itemRepository;

    @Transactional
    public Map<String, Double> submit(ManualRatingRequest request) {
        if (request == null || request.getUuid() == null) {
            throw new ValidationException("uuid", null, "Item uuid is required");
        }
        UUID uuid = request.getUuid();
        Map<String, Double> ratings = validateRatings(request.getRatings());

        IntelligenceItem item = itemRepository.findById(uuid).orElseThrow(() -> new ItemNotFoundException(uuid));
        if (item.getState() != ItemState.ARCHIVED) {
            throw new ValidationException("uuid", uuid, "Only archived items can be rated, item is " + item.getState());
        }

        LocalDateTime ratedAt = request.getTimestamp() != null ? request.getTimestamp() : LocalDateTime.now();
        try {
            for (Map.Entry<String, Double> rating : ratings.entrySet()) {
                ManualRating manualRating = manualRatingRepository.findByItemUuidAndDimension(uuid, rating.getKey())
                        .orElseGet(() -> ManualRating.builder().itemUuid(uuid).dimension(rating.getKey()).build());
                manualRating.setValue(rating.getValue());
                manualRating.setRatedAt(ratedAt);
                manualRatingRepository.save(manualRating);
            }
            manualRatingRepository.flush();
        } catch (DataIntegrityViolationException e) {
            throw new StorageConflictException(uuid, "Concurrent manual rating of item " + uuid + ", resubmit", e);
        }

        log.info("✍️ Manual rating for item {}: {}", uuid, ratings);
        return getRatings(uuid);
    }

    @Transactional(readOnly = true)
    public Map<String, Double> getRatings(UUID uuid) {
        Map<String, Double> ratings = new TreeMap<>();
        for (ManualRating rating : manualRatingRepository.findByItemUuid(uuid)) {
            ratings.put(rating.getDimension(), rating.getValue());
        }
        return ratings;
    }

    @Transactional(readOnly = true)
    public Map<UUID, Map<String, Double>> getRatings(Collection<UUID> uuids) {
        Map<UUID, Map<String, Double>> byItem = new HashMap<>();
        if (uuids.isEmpty()) {
            return byItem;
        }
        List<ManualRating> ratings = manualRatingRepository.findByItemUuidIn(uuids);
        for (ManualRating rating : ratings) {
            byItem.computeIfAbsent(rating.getItemUuid(), key -> new TreeMap<>())
                    .put(rating.getDimension(), rating.getValue());
        }
        return byItem;
    }

    /**
     * Every value must be a finite number in [0, 10] on the 0.5 grid. Out-of-range values are
     * rejected, never clamped.
     */
    static Map<String, Double> validateRatings(Map<String, Double> ratings) {
        if (ratings == null || ratings.isEmpty()) {
            throw new ValidationException("ratings", ratings, "At least one rating is required");
        }
        Map<String, Double> validated = new LinkedHashMap<>();
        for (Map.Entry<String, Double> rating : ratings.entrySet()) {
            String dimension = rating.getKey() != null ? rating.getKey().trim() : "";
            Double value = rating.getValue();
            if (dimension.isEmpty()) {
                throw new ValidationException("ratings", rating.getKey(), "Rating dimension must not be blank");
            }
            if (dimension.length() > IntelligenceItem.DIMENSION_LENGTH) {
                throw new ValidationException("ratings", dimension,
                        "Rating dimension longer than " + IntelligenceItem.DIMENSION_LENGTH + " characters");
            }
            if (value == null || value.isNaN() || value.isInfinite()) {
                throw new ValidationException("ratings." + dimension, value, "Rating must be a number");
            }
            if (value < MIN_RATING || value > MAX_RATING) {
                throw new ValidationException("ratings." + dimension, value,
                        "Rating must be between " + MIN_RATING + " and " + MAX_RATING);
            }
            if (value * 2 != Math.rint(value * 2)) {
                throw new ValidationException("ratings." + dimension, value, "Rating must be a multiple of 0.5");
            }
            validated.put(dimension, value);
        }
        return validated;
    }
}
