package com.example.thumbgen_backend.repository;

import com.example.thumbgen_backend.model.IdentityModel;
import com.example.thumbgen_backend.util.IdentityStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface IdentityModelRepository extends JpaRepository<IdentityModel, UUID> {

    Optional<IdentityModel> findByOwner_Id(UUID ownerId);

    Optional<IdentityModel> findByIdAndOwner_Id(UUID id, UUID ownerId);

    /** Row lock serializing commit/reset for one owner. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select m from IdentityModel m where m.owner.id = :ownerId")
    Optional<IdentityModel> lockByOwnerId(@Param("ownerId") UUID ownerId);

    Optional<IdentityModel> findByTrainingId(String trainingId);

    List<IdentityModel> findByStatusAndCommittedAtBeforeOrderByCommittedAtAsc(IdentityStatus status, Instant cutoff, Pageable page);

    List<IdentityModel> findByStatusAndTrainingStartedAtBeforeOrderByTrainingStartedAtAsc(IdentityStatus status, Instant cutoff, Pageable page);
}
