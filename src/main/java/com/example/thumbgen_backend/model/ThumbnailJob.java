package com.example.thumbgen_backend.model;

import com.example.thumbgen_backend.util.JobSource;
import com.example.thumbgen_backend.util.JobStatus;
import com.example.thumbgen_backend.util.ThumbnailStyle;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(
        name = "thumbnail_job",
        indexes = {
                @Index(name = "idx_thumbnail_job_status_created", columnList = "status, created_at"),
                @Index(name = "idx_thumbnail_job_owner", columnList = "owner_id")
        }
)
public class ThumbnailJob {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "owner_id", nullable = false, foreignKey = @ForeignKey(name = "fk_thumbnail_job_owner"))
    private Account owner;

    @Enumerated(EnumType.STRING)
    @Column(name = "style", nullable = false, length = 32)
    private ThumbnailStyle style;

    @Enumerated(EnumType.STRING)
    @Column(name = "source", nullable = false, length = 16)
    private JobSource source = JobSource.TEXT2IMG;

    @Column(name = "parent_job_id")
    private UUID parentJobId;

    @Column(name = "input_image_url", length = 2048)
    private String inputImageUrl;

    @Column(name = "strength")
    private Double strength;

    @Column(name = "user_prompt", nullable = false, length = 1000)
    private String userPrompt;

    @Column(name = "composed_prompt", length = 4000)
    private String composedPrompt;

    @Column(name = "negative_prompt", length = 4000)
    private String negativePrompt;

    @Column(name = "style_model_version", length = 128)
    private String styleModelVersion;

    @Column(name = "identity_model_id")
    private UUID identityModelId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "composed_config")
    private Map<String, Object> composedConfig;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private JobStatus status = JobStatus.QUEUED;

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

    @Column(name = "completed_at")
    private Instant completedAt;

    // null while predictions are still being dispatched; aggregation cannot finalize before it is set
    @Column(name = "dispatched_at")
    private Instant dispatchedAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    protected ThumbnailJob() {
    }

    public ThumbnailJob(Account owner, ThumbnailStyle style, JobSource source, String userPrompt) {
        this.owner = owner;
        this.style = style;
        this.source = source;
        this.userPrompt = userPrompt;
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

    public ThumbnailStyle getStyle() {
        return style;
    }

    public JobSource getSource() {
        return source;
    }

    public UUID getParentJobId() {
        return parentJobId;
    }

    public void setParentJobId(UUID parentJobId) {
        this.parentJobId = parentJobId;
    }

    public String getInputImageUrl() {
        return inputImageUrl;
    }

    public void setInputImageUrl(String inputImageUrl) {
        this.inputImageUrl = inputImageUrl;
    }

    public Double getStrength() {
        return strength;
    }

    public void setStrength(Double strength) {
        this.strength = strength;
    }

    public String getUserPrompt() {
        return userPrompt;
    }

    public String getComposedPrompt() {
        return composedPrompt;
    }

    public void setComposedPrompt(String composedPrompt) {
        this.composedPrompt = composedPrompt;
    }

    public String getNegativePrompt() {
        return negativePrompt;
    }

    public void setNegativePrompt(String negativePrompt) {
        this.negativePrompt = negativePrompt;
    }

    public String getStyleModelVersion() {
        return styleModelVersion;
    }

    public void setStyleModelVersion(String styleModelVersion) {
        this.styleModelVersion = styleModelVersion;
    }

    public UUID getIdentityModelId() {
        return identityModelId;
    }

    public void setIdentityModelId(UUID identityModelId) {
        this.identityModelId = identityModelId;
    }

    public Map<String, Object> getComposedConfig() {
        return composedConfig;
    }

    public void setComposedConfig(Map<String, Object> composedConfig) {
        this.composedConfig = composedConfig;
    }

    public JobStatus getStatus() {
        return status;
    }

    public void setStatus(JobStatus status) {
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

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }

    public Instant getDispatchedAt() {
        return dispatchedAt;
    }

    public void setDispatchedAt(Instant dispatchedAt) {
        this.dispatchedAt = dispatchedAt;
    }

    public long getVersion() {
        return version;
    }

    @PrePersist
    void prePersist() {
        if (updatedAt == null) updatedAt = Instant.now();
        if (status == null) status = JobStatus.QUEUED;
    }
}
