package com.example.thumbgen_backend.service;

import com.example.thumbgen_backend.config.IdentityProperties;
import com.example.thumbgen_backend.model.Account;
import com.example.thumbgen_backend.model.IdentityModel;
import com.example.thumbgen_backend.repository.IdentityModelRepository;
import com.example.thumbgen_backend.util.IdentityStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.data.domain.Pageable;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IdentityTrainingSweeperTest {
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private IdentityModelRepository modelRepo;
    private IdentityModelService identityService;
    private IdentityTrainingSweeper sweeper;

    @BeforeEach
    void setup() {
        modelRepo = Mockito.mock(IdentityModelRepository.class);
        identityService = Mockito.mock(IdentityModelService.class);
        sweeper = new IdentityTrainingSweeper(modelRepo, identityService, new IdentityProperties(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void nothingStaleDoesNothing() {
        when(modelRepo.findByStatusAndCommittedAtBeforeOrderByCommittedAtAsc(any(), any(), any())).thenReturn(List.of());
        when(modelRepo.findByStatusAndTrainingStartedAtBeforeOrderByTrainingStartedAtAsc(any(), any(), any())).thenReturn(List.of());

        assertThat(sweeper.sweep()).isZero();
        verify(identityService, never()).reconcile(any());
    }

    @Test
    void usesConfiguredTimeoutsAsCutoffs() {
        when(modelRepo.findByStatusAndCommittedAtBeforeOrderByCommittedAtAsc(any(), any(), any())).thenReturn(List.of());
        when(modelRepo.findByStatusAndTrainingStartedAtBeforeOrderByTrainingStartedAtAsc(any(), any(), any())).thenReturn(List.of());

        sweeper.sweep();

        verify(modelRepo).findByStatusAndCommittedAtBeforeOrderByCommittedAtAsc(
                eq(IdentityStatus.PENDING), eq(Instant.parse("2026-03-01T09:45:00Z")), any(Pageable.class));
        verify(modelRepo).findByStatusAndTrainingStartedAtBeforeOrderByTrainingStartedAtAsc(
                eq(IdentityStatus.TRAINING), eq(Instant.parse("2026-03-01T07:00:00Z")), any(Pageable.class));
    }

    @Test
    void stuckModelsAreReconciledAndOneFailureDoesNotStopTheBatch() {
        IdentityModel pending = model(IdentityStatus.PENDING);
        IdentityModel broken = model(IdentityStatus.PENDING);
        IdentityModel training = model(IdentityStatus.TRAINING);
        when(modelRepo.findByStatusAndCommittedAtBeforeOrderByCommittedAtAsc(any(), any(), any()))
                .thenReturn(List.of(pending, broken));
        when(modelRepo.findByStatusAndTrainingStartedAtBeforeOrderByTrainingStartedAtAsc(any(), any(), any()))
                .thenReturn(List.of(training));
        when(identityService.reconcile(pending)).thenReturn(model(IdentityStatus.FAILED));
        when(identityService.reconcile(broken)).thenThrow(new IllegalStateException("db down"));
        when(identityService.reconcile(training)).thenReturn(model(IdentityStatus.READY));

        assertThat(sweeper.sweep()).isEqualTo(2);
        verify(identityService).reconcile(training);
    }

    private static IdentityModel model(IdentityStatus status) {
        IdentityModel model = new IdentityModel(new Account("user-1", "User"));
        model.setId(UUID.randomUUID());
        model.setStatus(status);
        return model;
    }
}
