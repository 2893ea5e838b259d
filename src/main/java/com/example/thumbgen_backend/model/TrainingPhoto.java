package com.example.thumbgen_backend.model;

import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

/**
 * Uploaded identity photo. {@code identityModelId} is a plain column, not a foreign key: photos exist before
 * any model is committed.
 */
@Entity
@Table(
        name = "training_photo",
        uniqueConstraints = @UniqueConstraint(name = "uq_training_photo_owner_sha", columnNames = {"owner_id", "sha256"}),
        indexes = @Index(name = "idx_training_photo_owner", columnList = "owner_id")
)
public class TrainingPhoto {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "owner_id", nullable = false, foreignKey = @ForeignKey(name = "fk_training_photo_owner"))
    private Account owner;

    @Column(name = "identity_model_id")
    private UUID identityModelId;

    @Column(name = "storage_key", length = 512)
    private String storageKey;

    @Column(name = "sha256", nullable = false, length = 64)
    private String sha256;

    @Column(name = "content_type", nullable = false, length = 64)
    private String contentType;

    @Column(name = "size_bytes", nullable = false)
    private long sizeBytes;

    @Column(name = "width", nullable = false)
    private int width;

    @Column(name = "height", nullable = false)
    private int height;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected TrainingPhoto() {
    }

    public TrainingPhoto(Account owner, String sha256, String contentType, long sizeBytes, int width, int height) {
        this.owner = owner;
        this.sha256 = sha256;
        this.contentType = contentType;
        this.sizeBytes = sizeBytes;
        this.width = width;
        this.height = height;
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public Account getOwner() {
        return owner;
    }

    public UUID getIdentityModelId() {
        return identityModelId;
    }

    public void setIdentityModelId(UUID identityModelId) {
        this.identityModelId = identityModelId;
    }

    public String getStorageKey() {
        return storageKey;
    }

    public void setStorageKey(String storageKey) {
        this.storageKey = storageKey;
    }

    public String getSha256() {
        return sha256;
    }

    public String getContentType() {
        return contentType;
    }

    public long getSizeBytes() {
        return sizeBytes;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
