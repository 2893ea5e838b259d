package com.example.thumbgen_backend.repository;

import com.example.thumbgen_backend.model.ThumbnailPrediction;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ThumbnailPredictionRepository extends JpaRepository<ThumbnailPrediction, UUID> {

    Optional<ThumbnailPrediction> findByExternalId(String externalId);

    /** Predictions of a job in creation order; aggregation depends on this order. */
    List<ThumbnailPrediction> findByJob_IdOrderBySequenceAsc(UUID jobId);

    long countByJob_Id(UUID jobId);
}
