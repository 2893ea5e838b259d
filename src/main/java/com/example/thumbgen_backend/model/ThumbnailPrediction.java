package com.example.thumbgen_backend.model;

import com.example.thumbgen_backend.util.PredictionStatus;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * One provider invocation belonging to a {@link ThumbnailJob}. {@code sequence} is the creation order within the job.
 */
@Entity
@Table(
        name = "thumbnail_prediction",
        uniqueConstraints = @UniqueConstraint(name = "uq_thumbnail_prediction_external", columnNames = "external_id"),
        indexes = @Index(name = "idx_thumbnail_prediction_job", columnList = "job_id, sequence")
)
public class ThumbnailPrediction {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "job_id", nullable = false, foreignKey = @ForeignKey(name = "fk_thumbnail_prediction_job"))
    private ThumbnailJob job;

    @Column(name = "external_id", nullable = false, length = 128)
    private String externalId;

    @Column(name = "sequence", nullable = false)
    private int sequence;

    @Column(name = "variation_note", length = 120)
    private String variationNote;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private PredictionStatus status = PredictionStatus.STARTING;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "output_images")
    private List<OutputImage> outputImages = new ArrayList<>();

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    protected ThumbnailPrediction() {
    }

    public ThumbnailPrediction(ThumbnailJob job, String externalId, int sequence, String variationNote) {
        this.job = job;
        this.externalId = externalId;
        this.sequence = sequence;
        this.variationNote = variationNote;
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public ThumbnailJob getJob() {
        return job;
    }

    public String getExternalId() {
        return externalId;
    }

    public int getSequence() {
        return sequence;
    }

    public String getVariationNote() {
        return variationNote;
    }

    public PredictionStatus getStatus() {
        return status;
    }

    public void setStatus(PredictionStatus status) {
        this.status = status;
    }

    public List<OutputImage> getOutputImages() {
        return outputImages == null ? List.of() : outputImages;
    }

    public void setOutputImages(List<OutputImage> outputImages) {
        this.outputImages = new ArrayList<>(outputImages);
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public long getVersion() {
        return version;
    }

    @PrePersist
    void prePersist() {
        if (updatedAt == null) updatedAt = Instant.now();
        if (status == null) status = PredictionStatus.STARTING;
    }
}
