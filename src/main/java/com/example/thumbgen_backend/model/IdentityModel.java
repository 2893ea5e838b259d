package com.example.thumbgen_backend.model;

import com.example.thumbgen_backend.util.IdentityStatus;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

/**
 * Per-account personalization model. At most one row per owner.
 */
@Entity
@Table(
        name = "identity_model",
        uniqueConstraints = @UniqueConstraint(name = "uq_identity_model_owner", columnNames = "owner_id")
)
public class IdentityModel {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "owner_id", nullable = false, foreignKey = @ForeignKey(name = "fk_identity_model_owner"))
    private Account owner;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private IdentityStatus status = IdentityStatus.NONE;

    @Column(name = "trigger_word", length = 32)
    private String triggerWord;

    @Column(name = "model_version_ref", length = 256)
    private String modelVersionRef;

    @Column(name = "weights_ref", length = 2048)
    private String weightsRef;

    @Column(name = "provider_model_owner", length = 128)
    private String providerModelOwner;

    @Column(name = "provider_model_name", length = 128)
    private String providerModelName;

    @Column(name = "training_id", length = 128)
    private String trainingId;

    @Column(name = "dataset_hash", length = 64)
    private String datasetHash;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    @Column(name = "committed_at")
    private Instant committedAt;

    @Column(name = "training_started_at")
    private Instant trainingStartedAt;

    @Column(name = "training_completed_at")
    private Instant trainingCompletedAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    protected IdentityModel() {
    }

    public IdentityModel(Account owner) {
        this.owner = owner;
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

    public IdentityStatus getStatus() {
        return status;
    }

    public void setStatus(IdentityStatus status) {
        this.status = status;
    }

    public String getTriggerWord() {
        return triggerWord;
    }

    public void setTriggerWord(String triggerWord) {
        this.triggerWord = triggerWord;
    }

    public String getModelVersionRef() {
        return modelVersionRef;
    }

    public void setModelVersionRef(String modelVersionRef) {
        this.modelVersionRef = modelVersionRef;
    }

    public String getWeightsRef() {
        return weightsRef;
    }

    public void setWeightsRef(String weightsRef) {
        this.weightsRef = weightsRef;
    }

    public String getProviderModelOwner() {
        return providerModelOwner;
    }

    public void setProviderModelOwner(String providerModelOwner) {
        this.providerModelOwner = providerModelOwner;
    }

    public String getProviderModelName() {
        return providerModelName;
    }

    public void setProviderModelName(String providerModelName) {
        this.providerModelName = providerModelName;
    }

    public String getTrainingId() {
        return trainingId;
    }

    public void setTrainingId(String trainingId) {
        this.trainingId = trainingId;
    }

    public String getDatasetHash() {
        return datasetHash;
    }

    public void setDatasetHash(String datasetHash) {
        this.datasetHash = datasetHash;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public Instant getCommittedAt() {
        return committedAt;
    }

    public void setCommittedAt(Instant committedAt) {
        this.committedAt = committedAt;
    }

    public Instant getTrainingStartedAt() {
        return trainingStartedAt;
    }

    public void setTrainingStartedAt(Instant trainingStartedAt) {
        this.trainingStartedAt = trainingStartedAt;
    }

    public Instant getTrainingCompletedAt() {
        return trainingCompletedAt;
    }

    public void setTrainingCompletedAt(Instant trainingCompletedAt) {
        this.trainingCompletedAt = trainingCompletedAt;
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

    /** Clears everything produced by a previous training run. */
    public void clearTrainingState() {
        this.triggerWord = null;
        this.modelVersionRef = null;
        this.weightsRef = null;
        this.trainingId = null;
        this.datasetHash = null;
        this.errorMessage = null;
        this.committedAt = null;
        this.trainingStartedAt = null;
        this.trainingCompletedAt = null;
    }

    @PrePersist
    void prePersist() {
        if (updatedAt == null) updatedAt = Instant.now();
        if (status == null) status = IdentityStatus.NONE;
    }
}
