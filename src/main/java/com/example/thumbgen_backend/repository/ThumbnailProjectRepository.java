package com.example.thumbgen_backend.repository;

import com.example.thumbgen_backend.model.ThumbnailProject;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface ThumbnailProjectRepository extends JpaRepository<ThumbnailProject, UUID> {

    List<ThumbnailProject> findByJob_IdAndOwner_Id(UUID jobId, UUID ownerId);
}
