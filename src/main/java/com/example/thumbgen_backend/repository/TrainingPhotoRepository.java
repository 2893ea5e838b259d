package com.example.thumbgen_backend.repository;

import com.example.thumbgen_backend.model.TrainingPhoto;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface TrainingPhotoRepository extends JpaRepository<TrainingPhoto, UUID> {

    long countByOwner_Id(UUID ownerId);

    Optional<TrainingPhoto> findByOwner_IdAndSha256(UUID ownerId, String sha256);

    Optional<TrainingPhoto> findByIdAndOwner_Id(UUID id, UUID ownerId);

    List<TrainingPhoto> findByOwner_IdOrderByStorageKeyAsc(UUID ownerId);

    List<TrainingPhoto> findByIdentityModelIdOrderByStorageKeyAsc(UUID identityModelId);

    @Modifying
    @Query("update TrainingPhoto p set p.identityModelId = :modelId where p.owner.id = :ownerId")
    int attachAllToModel(@Param("ownerId") UUID ownerId, @Param("modelId") UUID modelId);

    @Modifying
    @Query("update TrainingPhoto p set p.identityModelId = null where p.identityModelId = :modelId")
    int detachFromModel(@Param("modelId") UUID modelId);
}
