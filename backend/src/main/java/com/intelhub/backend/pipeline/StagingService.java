package com.intelhub.backend.pipeline;

import com.intelhub.backend.ai.classification.ClassificationResult;
import com.intelhub.backend.config.PipelineProperties;
import com.intelhub.backend.db.entity.IntelligenceAppendix;
import com.intelhub.backend.db.entity.IntelligenceItem;
import com.intelhub.backend.db.entity.ItemState;
import com.intelhub.backend.db.repository.IntelligenceItemRepository;
import com.intelhub.backend.exception.ItemNotFoundException;
import com.intelhub.backend.exception.StorageConflictException;
import com.intelhub.backend.exception.ValidationException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Per-item state machine. Every transition is either a conditional update or a guarded write
 * under the optimistic lock, so no two workers can both own an item.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StagingService {

    static final String LEASE_EXPIRED = "Lease expired";

    private final IntelligenceItemRepository itemRepository;
    private final PipelineProperties pipelineProperties;

    @Transactional
    public boolean claim(UUID uuid, String owner) {
        return claim(uuid, owner, pipelineProperties.getMaxAttempts(),
                Duration.ofSeconds(pipelineProperties.getLeaseSeconds()));
    }

    /**
     * Atomically moves a claimable item to ANALYZING under a lease held by {@code owner}.
     *
     * @return false when the item is not claimable or another worker claimed it first
     */
    @Transactional
    public boolean claim(UUID uuid, String owner, int maxAttempts, Duration leaseDuration) {
        LocalDateTime now = LocalDateTime.now();
        int updated = itemRepository.claim(uuid, owner, now.plus(leaseDuration), maxAttempts, now);
        if (updated == 1) {
            log.debug("🔒 {} claimed item {}", owner, uuid);
            return true;
        }
        return false;
    }

    @Transactional(readOnly = true)
    public List<UUID> findClaimable(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return itemRepository.findClaimableUuids(pipelineProperties.getMaxAttempts(), LocalDateTime.now(),
                PageRequest.of(0, limit));
    }

    /**
     * Terminal transition: writes the classification and the routing decision in one step.
     */
    @Transactional
    public IntelligenceItem complete(UUID uuid, String owner, ClassificationResult result,
                                     RoutingDecision routing, double weightedScore) {
        if (routing.getState() != ItemState.ARCHIVED && routing.getState() != ItemState.LOW_VALUE) {
            throw new IllegalArgumentException("Not a terminal routing state: " + routing.getState());
        }
        IntelligenceItem item = loadOwned(uuid, owner, routing.getState());
        LocalDateTime now = LocalDateTime.now();

        item.setEventTitle(result.getEventTitle());
        item.setEventBrief(result.getEventBrief());
        item.setEventText(result.getEventText());
        item.setLocations(new ArrayList<>(result.getLocations()));
        item.setPeople(new ArrayList<>(result.getPeople()));
        item.setOrganizations(new ArrayList<>(result.getOrganizations()));
        item.setEventTimes(new ArrayList<>(result.getTimes()));
        item.setSubCategories(new ArrayList<>(result.getSubCategories()));
        item.setRates(new LinkedHashMap<>(result.getRates()));
        item.setGeography(result.getGeography());
        item.setImpact(result.getImpact());
        item.setTips(result.getTips());
        item.setReason(result.getReason());
        item.setTaxonomy(result.getTaxonomy());

        IntelligenceAppendix appendix = item.getAppendix() != null ? item.getAppendix() : new IntelligenceAppendix();
        appendix.setPubTimeCache(item.getPubTime());
        appendix.setArchivedAt(routing.getState() == ItemState.ARCHIVED ? now : null);
        appendix.setMaxRateClass(routing.getMaxRateClass());
        appendix.setMaxRateScore(routing.getMaxRateScore());
        appendix.setWeightedScore(weightedScore);
        appendix.setAiProvider(result.getProvider());
        appendix.setAiModel(result.getModel());
        appendix.setPromptVersion(result.getPromptVersion());
        appendix.setThresholdAtClassification(routing.getThreshold());
        item.setAppendix(appendix);

        item.setState(routing.getState());
        item.setLeaseOwner(null);
        item.setLeaseExpiresAt(null);
        item.setNextAttemptAt(null);
        item.setLastError(null);

        IntelligenceItem saved = save(item);
        log.info("✅ Item {} routed to {} (max {} = {}, threshold {})", uuid, routing.getState(),
                routing.getMaxRateClass(), routing.getMaxRateScore(), routing.getThreshold());
        return saved;
    }

    /**
     * Records a failed attempt. The item becomes due again after the backoff delay, or stays
     * FAILED for good once its attempts are used up.
     */
    @Transactional
    public IntelligenceItem fail(UUID uuid, String owner, String error) {
        IntelligenceItem item = loadOwned(uuid, owner, ItemState.FAILED);
        int attempts = item.getAttempts() != null ? item.getAttempts() : 0;

        item.setState(ItemState.FAILED);
        item.setLeaseOwner(null);
        item.setLeaseExpiresAt(null);
        item.setLastError(error);
        if (attempts < pipelineProperties.getMaxAttempts()) {
            item.setNextAttemptAt(LocalDateTime.now().plus(backoffFor(attempts)));
            log.warn("⚠️ Item {} failed attempt {}/{}: {}", uuid, attempts, pipelineProperties.getMaxAttempts(), error);
        } else {
            item.setNextAttemptAt(null);
            log.error("❌ Item {} exhausted {} attempts: {}", uuid, attempts, error);
        }
        return save(item);
    }

    /**
     * Returns items whose lease ran out to FAILED; the lost attempt counts.
     */
    @Transactional
    public int releaseExpiredLeases(LocalDateTime now) {
        int released = itemRepository.releaseExpiredLeases(now, pipelineProperties.getMaxAttempts(), LEASE_EXPIRED);
        if (released > 0) {
            log.warn("⏰ Released {} expired leases", released);
        }
        return released;
    }

    /**
     * Operator action: gives a FAILED item a fresh set of attempts.
     */
    @Transactional
    public void operatorRetry(UUID uuid) {
        IntelligenceItem item = itemRepository.findById(uuid).orElseThrow(() -> new ItemNotFoundException(uuid));
        if (item.getState() != ItemState.FAILED) {
            throw new ValidationException("state", item.getState(), "Only FAILED items can be retried",
                    List.of(ItemState.FAILED.name()));
        }
        if (itemRepository.resetFailed(uuid) != 1) {
            throw new StorageConflictException(uuid, "Item " + uuid + " changed state during retry");
        }
        log.info("🔁 Operator retry queued for item {}", uuid);
    }

    @Transactional(readOnly = true)
    public Map<ItemState, Long> countByState() {
        Map<ItemState, Long> counts = new EnumMap<>(ItemState.class);
        for (ItemState state : ItemState.values()) {
            Long count = itemRepository.countByState(state);
            counts.put(state, count != null ? count : 0L);
        }
        return counts;
    }

    /**
     * Delay before the next attempt: min(base * 2^(attempts-1), max).
     */
    public Duration backoffFor(int attempts) {
        long base = pipelineProperties.getBackoffBaseSeconds();
        long max = pipelineProperties.getBackoffMaxSeconds();
        int exponent = Math.max(0, Math.min(attempts - 1, 30));
        long delay = base * (1L << exponent);
        if (delay < 0 || delay > max) {
            delay = max;
        }
        return Duration.ofSeconds(delay);
    }

    private IntelligenceItem loadOwned(UUID uuid, String owner, ItemState target) {
        IntelligenceItem item = itemRepository.findById(uuid).orElseThrow(() -> new ItemNotFoundException(uuid));
        if (!item.getState().canTransitionTo(target) || item.getState() != ItemState.ANALYZING) {
            throw conflict(uuid, "Item " + uuid + " is " + item.getState() + ", cannot move to " + target);
        }
        if (!Objects.equals(item.getLeaseOwner(), owner)) {
            throw conflict(uuid, "Item " + uuid + " is leased by " + item.getLeaseOwner() + ", not " + owner);
        }
        return item;
    }

    private IntelligenceItem save(IntelligenceItem item) {
        try {
            return itemRepository.saveAndFlush(item);
        } catch (ObjectOptimisticLockingFailureException e) {
            throw conflict(item.getUuid(), "Concurrent modification of item " + item.getUuid(), e);
        }
    }

    private StorageConflictException conflict(UUID uuid, String message) {
        log.error("🚨 CRITICAL storage conflict: {}", message);
        return new StorageConflictException(uuid, message);
    }

    private StorageConflictException conflict(UUID uuid, String message, Throwable cause) {
        log.error("🚨 CRITICAL storage conflict: {}", message);
        return new StorageConflictException(uuid, message, cause);
    }
}
