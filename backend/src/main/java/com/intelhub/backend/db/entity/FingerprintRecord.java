package com.intelhub.backend.db.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

/**
 * Dedup index entry. The fingerprint is the primary key, so a second insert of the same
 * fingerprint fails on the database instead of being merged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "fingerprints")
public class FingerprintRecord implements Persistable<String> {

    @Id
    @Column(length = 64)
    private String fingerprint;

    @Column(nullable = false)
    private UUID itemUuid;

    @Column(nullable = false)
    private LocalDateTime registeredAt;

    @Override
    public String getId() {
        return fingerprint;
    }

    // Always insert; never merge over an existing fingerprint
    @Override
    @Transient
    public boolean isNew() {
        return true;
    }
}
