package com.example.thumbgen_backend.repository;

import com.example.thumbgen_backend.model.ThumbnailJob;
import com.example.thumbgen_backend.util.JobStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ThumbnailJobRepository extends JpaRepository<ThumbnailJob, UUID> {

    Optional<ThumbnailJob> findByIdAndOwner_Id(UUID id, UUID ownerId);

    List<ThumbnailJob> findByStatusAndCreatedAtBeforeOrderByCreatedAtAsc(JobStatus status, Instant cutoff, Pageable page);
}
