package com.example.thumbgen_backend.model;

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
 * Editor project derived from a job. {@code exports} holds the URLs of images exported from the editor.
 */
@Entity
@Table(name = "thumbnail_project", indexes = @Index(name = "idx_thumbnail_project_job", columnList = "job_id"))
public class ThumbnailProject {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "owner_id", nullable = false, foreignKey = @ForeignKey(name = "fk_thumbnail_project_owner"))
    private Account owner;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "job_id", nullable = false, foreignKey = @ForeignKey(name = "fk_thumbnail_project_job"))
    private ThumbnailJob job;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "exports")
    private List<String> exports = new ArrayList<>();

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected ThumbnailProject() {
    }

    public ThumbnailProject(Account owner, ThumbnailJob job) {
        this.owner = owner;
        this.job = job;
    }

    public UUID getId() {
        return id;
    }

    public Account getOwner() {
        return owner;
    }

    public ThumbnailJob getJob() {
        return job;
    }

    public List<String> getExports() {
        return exports == null ? List.of() : exports;
    }

    public void setExports(List<String> exports) {
        this.exports = new ArrayList<>(exports);
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    @PrePersist
    void prePersist() {
        if (updatedAt == null) updatedAt = Instant.now();
    }
}
