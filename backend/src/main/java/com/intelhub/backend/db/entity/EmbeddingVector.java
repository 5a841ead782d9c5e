package com.intelhub.backend.db.entity;

import com.intelhub.backend.db.converter.FloatArrayConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "embedding_vectors",
        uniqueConstraints = @UniqueConstraint(name = "uk_vector_item_span", columnNames = {"item_uuid", "span"}),
        indexes = @Index(name = "idx_vector_span", columnList = "span"))
public class EmbeddingVector {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "item_uuid", nullable = false)
    private UUID itemUuid;

    @Enumerated(EnumType.STRING)
    @Column(name = "span", nullable = false, length = 20)
    private VectorSpan span;

    @Column(nullable = false)
    private Integer dimensions;

    @ToString.Exclude
    @Convert(converter = FloatArrayConverter.class)
    @Column(nullable = false, columnDefinition = "TEXT")
    private float[] vector;

    @Column(length = 200)
    private String modelName;

    // Copied from the item so tie-breaks don't need a join
    private LocalDateTime archivedAt;

    @CreationTimestamp
    private LocalDateTime createdAt;
}
