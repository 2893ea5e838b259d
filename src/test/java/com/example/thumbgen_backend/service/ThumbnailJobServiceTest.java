package com.example.thumbgen_backend.service;

import com.example.thumbgen_backend.config.ThumbnailProperties;
import com.example.thumbgen_backend.dto.ThumbnailJobResponse;
import com.example.thumbgen_backend.engine.Interfaces.ImageGenerationProvider;
import com.example.thumbgen_backend.exception.ErrorKind;
import com.example.thumbgen_backend.exception.ProviderException;
import com.example.thumbgen_backend.exception.ThumbnailException;
import com.example.thumbgen_backend.model.Account;
import com.example.thumbgen_backend.model.ThumbnailJob;
import com.example.thumbgen_backend.model.ThumbnailPrediction;
import com.example.thumbgen_backend.repository.ThumbnailJobRepository;
import com.example.thumbgen_backend.repository.ThumbnailPredictionRepository;
import com.example.thumbgen_backend.util.JobSource;
import com.example.thumbgen_backend.util.JobStatus;
import com.example.thumbgen_backend.util.PredictionStatus;
import com.example.thumbgen_backend.util.ThumbnailStyle;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.dao.OptimisticLockingFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link ThumbnailJobService}: owner scoping, the poll channel and stale expiry on read.
 */
class ThumbnailJobServiceTest {
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private AccountService accountService;
    private ThumbnailJobRepository jobRepo;
    private ThumbnailPredictionRepository predictionRepo;
    private ImageGenerationProvider provider;
    private PredictionReconciler reconciler;
    private ThumbnailJobService service;

    private Account owner;
    private ThumbnailJob job;
    private final List<ThumbnailPrediction> predictions = new ArrayList<>();

    @BeforeEach
    void setup() {
        accountService = Mockito.mock(AccountService.class);
        jobRepo = Mockito.mock(ThumbnailJobRepository.class);
        predictionRepo = Mockito.mock(ThumbnailPredictionRepository.class);
        provider = Mockito.mock(ImageGenerationProvider.class);
        reconciler = Mockito.mock(PredictionReconciler.class);
        service = new ThumbnailJobService(accountService, jobRepo, predictionRepo, provider, reconciler,
                new ThumbnailProperties(), Clock.fixed(NOW, ZoneOffset.UTC));

        owner = new Account("user-1", "User");
        owner.setId(UUID.randomUUID());
        job = new ThumbnailJob(owner, ThumbnailStyle.SUBJECT, JobSource.TEXT2IMG, "a cat");
        job.setId(UUID.randomUUID());
        job.setStatus(JobStatus.RUNNING);
        job.setCreatedAt(NOW.minusSeconds(60));

        when(accountService.getByExternalSubjectOrThrow("user-1")).thenReturn(owner);
        when(jobRepo.findByIdAndOwner_Id(job.getId(), owner.getId())).thenReturn(Optional.of(job));
        when(jobRepo.findById(job.getId())).thenReturn(Optional.of(job));
        when(predictionRepo.findByJob_IdOrderBySequenceAsc(job.getId())).thenAnswer(inv -> List.copyOf(predictions));
    }

    @Test
    void terminalJobIsReturnedWithoutTouchingTheProvider() {
        job.setStatus(JobStatus.SUCCEEDED);
        predictions.add(prediction("p1", 1, PredictionStatus.SUCCEEDED));

        ThumbnailJobResponse response = service.getJob("user-1", job.getId());

        assertThat(response.status()).isEqualTo("succeeded");
        assertThat(response.predictions()).hasSize(1);
        Mockito.verifyNoInteractions(provider);
        verify(reconciler, never()).expire(any());
    }

    @Test
    void runningJobPollsOnlyInFlightPredictions() {
        predictions.add(prediction("p1", 1, PredictionStatus.SUCCEEDED));
        predictions.add(prediction("p2", 2, PredictionStatus.PROCESSING));
        when(provider.getPrediction("p2")).thenReturn(
                new ImageGenerationProvider.Prediction("p2", "succeeded", TextNode.valueOf("https://cdn/b.png"), null));

        service.getJob("user-1", job.getId());

        verify(provider, never()).getPrediction("p1");
        verify(reconciler).applyUpdate(eq("p2"), eq(PredictionStatus.SUCCEEDED), any(), any());
        verify(reconciler, never()).expire(any());
    }

    @Test
    void staleRunningJobIsExpiredAfterALastPoll() {
        job.setCreatedAt(NOW.minusSeconds(31 * 60));
        predictions.add(prediction("p1", 1, PredictionStatus.STARTING));
        when(provider.getPrediction("p1")).thenReturn(
                new ImageGenerationProvider.Prediction("p1", "processing", null, null));

        service.getJob("user-1", job.getId());

        verify(reconciler).applyUpdate(eq("p1"), eq(PredictionStatus.PROCESSING), any(), any());
        verify(reconciler).expire(job.getId());
    }

    @Test
    void pollSkipsPredictionsTheProviderCannotAnswer() {
        predictions.add(prediction("p1", 1, PredictionStatus.STARTING));
        predictions.add(prediction("p2", 2, PredictionStatus.STARTING));
        predictions.add(prediction("p3", 3, PredictionStatus.STARTING));
        when(provider.getPrediction("p1")).thenThrow(new ProviderException("boom", 500));
        when(provider.getPrediction("p2")).thenReturn(
                new ImageGenerationProvider.Prediction("p2", "teleporting", null, null));
        when(provider.getPrediction("p3")).thenReturn(
                new ImageGenerationProvider.Prediction("p3", "failed", null, "nsfw"));

        int applied = service.poll(job.getId());

        assertThat(applied).isEqualTo(1);
        verify(reconciler, times(1)).applyUpdate(anyString(), any(), any(), any());
        verify(reconciler).applyUpdate("p3", PredictionStatus.FAILED, null, "nsfw");
    }

    @Test
    void pollRetriesOnConcurrentWrite() {
        predictions.add(prediction("p1", 1, PredictionStatus.STARTING));
        when(provider.getPrediction("p1")).thenReturn(
                new ImageGenerationProvider.Prediction("p1", "canceled", null, null));
        when(reconciler.applyUpdate("p1", PredictionStatus.CANCELED, null, null))
                .thenThrow(new OptimisticLockingFailureException("stale"))
                .thenReturn(JobStatus.FAILED);

        assertThat(service.poll(job.getId())).isEqualTo(1);
        verify(reconciler, times(2)).applyUpdate("p1", PredictionStatus.CANCELED, null, null);
    }

    @Test
    void jobOfAnotherOwnerIsNotFound() {
        Account stranger = new Account("user-2", "Other");
        stranger.setId(UUID.randomUUID());
        when(accountService.getByExternalSubjectOrThrow("user-2")).thenReturn(stranger);
        when(jobRepo.findByIdAndOwner_Id(job.getId(), stranger.getId())).thenReturn(Optional.empty());

        ThumbnailException ex = assertThrows(ThumbnailException.class, () -> service.getJob("user-2", job.getId()));

        assertThat(ex.getKind()).isEqualTo(ErrorKind.NOT_FOUND);
        assertThat(ex.getReason()).isEqualTo("JOB_NOT_FOUND");
    }

    @Test
    void staleThresholdIsThirtyMinutes() {
        job.setCreatedAt(NOW.minusSeconds(29 * 60));
        assertThat(service.isStale(job, NOW)).isFalse();
        job.setCreatedAt(NOW.minusSeconds(30 * 60 + 1));
        assertThat(service.isStale(job, NOW)).isTrue();
    }

    private ThumbnailPrediction prediction(String externalId, int seq, PredictionStatus status) {
        ThumbnailPrediction p = new ThumbnailPrediction(job, externalId, seq, "v" + seq);
        p.setId(UUID.randomUUID());
        p.setStatus(status);
        return p;
    }
}
