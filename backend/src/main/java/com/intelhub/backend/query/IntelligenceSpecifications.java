package com.intelhub.backend.query;

import com.intelhub.backend.db.entity.IntelligenceItem;
import com.intelhub.backend.db.entity.ItemState;
import jakarta.persistence.criteria.Join;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.criteria.Subquery;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Locale;
import java.util.UUID;
import org.springframework.data.jpa.domain.Specification;

/**
 * Building blocks of the structured (non-vector) query.
 */
final class IntelligenceSpecifications {

    private IntelligenceSpecifications() {
    }

    static Specification<IntelligenceItem> inStates(Collection<ItemState> states) {
        return (root, query, cb) -> root.get("state").in(states);
    }

    static Specification<IntelligenceItem> publishedBetween(LocalDateTime start, LocalDateTime end) {
        return (root, query, cb) -> {
            if (start != null && end != null) {
                return cb.between(root.<LocalDateTime>get("pubTime"), start, end);
            }
            if (start != null) {
                return cb.greaterThanOrEqualTo(root.<LocalDateTime>get("pubTime"), start);
            }
            if (end != null) {
                return cb.lessThanOrEqualTo(root.<LocalDateTime>get("pubTime"), end);
            }
            return cb.conjunction();
        };
    }

    // Title or brief contains the keyword, case-insensitive
    static Specification<IntelligenceItem> keyword(String keyword) {
        return (root, query, cb) -> {
            if (keyword == null || keyword.isBlank()) {
                return cb.conjunction();
            }
            String pattern = "%" + keyword.trim().toLowerCase(Locale.ROOT) + "%";
            return cb.or(
                    cb.like(cb.lower(root.<String>get("eventTitle")), pattern),
                    cb.like(cb.lower(root.<String>get("eventBrief")), pattern));
        };
    }

    /**
     * Matches items whose element collection {@code attribute} contains any of the values.
     */
    static Specification<IntelligenceItem> containsAny(String attribute, Collection<String> values) {
        return (root, query, cb) -> {
            if (values == null || values.isEmpty()) {
                return cb.conjunction();
            }
            Subquery<UUID> subquery = query.subquery(UUID.class);
            Root<IntelligenceItem> sub = subquery.from(IntelligenceItem.class);
            Join<IntelligenceItem, String> element = sub.join(attribute);
            subquery.select(sub.<UUID>get("uuid"))
                    .where(cb.equal(sub.get("uuid"), root.get("uuid")), element.in(values));
            return cb.exists(subquery);
        };
    }

    static Specification<IntelligenceItem> minRateScore(Double threshold) {
        return (root, query, cb) -> threshold == null
                ? cb.conjunction()
                : cb.greaterThanOrEqualTo(root.get("appendix").<Double>get("maxRateScore"), threshold);
    }
}
