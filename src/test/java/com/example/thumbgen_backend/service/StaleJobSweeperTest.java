package com.example.thumbgen_backend.service;

import com.example.thumbgen_backend.config.ThumbnailProperties;
import com.example.thumbgen_backend.model.Account;
import com.example.thumbgen_backend.model.ThumbnailJob;
import com.example.thumbgen_backend.repository.ThumbnailJobRepository;
import com.example.thumbgen_backend.util.JobSource;
import com.example.thumbgen_backend.util.JobStatus;
import com.example.thumbgen_backend.util.ThumbnailStyle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.mockito.Mockito;
import org.springframework.data.domain.PageRequest;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StaleJobSweeperTest {
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private ThumbnailJobRepository jobRepo;
    private ThumbnailJobService jobService;
    private PredictionReconciler reconciler;
    private StaleJobSweeper sweeper;

    @BeforeEach
    void setup() {
        jobRepo = Mockito.mock(ThumbnailJobRepository.class);
        jobService = Mockito.mock(ThumbnailJobService.class);
        reconciler = Mockito.mock(PredictionReconciler.class);
        ThumbnailProperties props = new ThumbnailProperties();
        props.setStaleAfter(Duration.ofMinutes(30));
        props.setSweeperBatchSize(5);
        sweeper = new StaleJobSweeper(jobRepo, jobService, reconciler, props, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void nothingToSweep() {
        when(jobRepo.findByStatusAndCreatedAtBeforeOrderByCreatedAtAsc(any(), any(), any())).thenReturn(List.of());

        assertThat(sweeper.sweep()).isZero();
        verify(reconciler, never()).expire(any());
    }

    @Test
    void pollsThenExpiresEveryCandidate() {
        ThumbnailJob first = job();
        ThumbnailJob second = job();
        when(jobRepo.findByStatusAndCreatedAtBeforeOrderByCreatedAtAsc(
                JobStatus.RUNNING, NOW.minus(Duration.ofMinutes(30)), PageRequest.of(0, 5)))
                .thenReturn(List.of(first, second));

        assertThat(sweeper.sweep()).isEqualTo(2);

        InOrder order = Mockito.inOrder(jobService, reconciler);
        order.verify(jobService).poll(first.getId());
        order.verify(reconciler).expire(first.getId());
        order.verify(jobService).poll(second.getId());
        order.verify(reconciler).expire(second.getId());
    }

    @Test
    void oneFailingJobDoesNotStopTheBatch() {
        ThumbnailJob broken = job();
        ThumbnailJob healthy = job();
        when(jobRepo.findByStatusAndCreatedAtBeforeOrderByCreatedAtAsc(any(), any(), any()))
                .thenReturn(List.of(broken, healthy));
        when(jobService.poll(broken.getId())).thenThrow(new IllegalStateException("db down"));

        assertThat(sweeper.sweep()).isEqualTo(1);
        verify(reconciler, never()).expire(broken.getId());
        verify(reconciler).expire(healthy.getId());
    }

    private static ThumbnailJob job() {
        ThumbnailJob job = new ThumbnailJob(new Account("user-1", "User"), ThumbnailStyle.OBJECT, JobSource.TEXT2IMG, "x");
        job.setId(UUID.randomUUID());
        job.setStatus(JobStatus.RUNNING);
        return job;
    }
}
