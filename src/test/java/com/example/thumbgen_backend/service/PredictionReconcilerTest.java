package com.example.thumbgen_backend.service;

import com.example.thumbgen_backend.config.ThumbnailProperties;
import com.example.thumbgen_backend.exception.ErrorKind;
import com.example.thumbgen_backend.exception.ThumbnailException;
import com.example.thumbgen_backend.model.Account;
import com.example.thumbgen_backend.model.OutputImage;
import com.example.thumbgen_backend.model.ThumbnailJob;
import com.example.thumbgen_backend.model.ThumbnailPrediction;
import com.example.thumbgen_backend.repository.ThumbnailJobRepository;
import com.example.thumbgen_backend.repository.ThumbnailPredictionRepository;
import com.example.thumbgen_backend.util.JobSource;
import com.example.thumbgen_backend.util.JobStatus;
import com.example.thumbgen_backend.util.PredictionStatus;
import com.example.thumbgen_backend.util.ThumbnailStyle;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

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
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link PredictionReconciler}: idempotent updates, aggregation and the dispatch gate.
 */
class PredictionReconcilerTest {
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private ThumbnailPredictionRepository predictionRepo;
    private ThumbnailJobRepository jobRepo;
    private PredictionReconciler reconciler;
    private ThumbnailJob job;
    private final List<ThumbnailPrediction> predictions = new ArrayList<>();
    private final ObjectMapper mapper = new ObjectMapper();

    @BeforeEach
    void setup() {
        predictionRepo = Mockito.mock(ThumbnailPredictionRepository.class);
        jobRepo = Mockito.mock(ThumbnailJobRepository.class);
        reconciler = new PredictionReconciler(predictionRepo, jobRepo, new ThumbnailProperties(),
                Clock.fixed(NOW, ZoneOffset.UTC));

        job = new ThumbnailJob(new Account("user-1", "User"), ThumbnailStyle.OBJECT, JobSource.TEXT2IMG, "a car");
        job.setId(UUID.randomUUID());
        job.setStatus(JobStatus.RUNNING);
        job.setDispatchedAt(NOW.minusSeconds(5));

        when(jobRepo.findById(job.getId())).thenReturn(Optional.of(job));
        when(jobRepo.save(any())).thenAnswer(inv -> inv.getArgument(0));
        when(predictionRepo.save(any())).thenAnswer(inv -> inv.getArgument(0));
        when(predictionRepo.findByJob_IdOrderBySequenceAsc(job.getId())).thenAnswer(inv -> List.copyOf(predictions));
        when(predictionRepo.findByExternalId(any())).thenAnswer(inv -> predictions.stream()
                .filter(p -> p.getExternalId().equals(inv.getArgument(0)))
                .findFirst());
    }

    @Test
    void jobSucceedsOnceAllPredictionsAreTerminal() {
        addPrediction("p1", 1);
        addPrediction("p2", 2);

        JobStatus afterFirst = reconciler.applyUpdate("p1", PredictionStatus.SUCCEEDED, url("https://cdn/a.png"), null);
        assertThat(afterFirst).isEqualTo(JobStatus.RUNNING);
        assertThat(job.getOutputImages()).extracting(OutputImage::url).containsExactly("https://cdn/a.png");

        JobStatus afterSecond = reconciler.applyUpdate("p2", PredictionStatus.FAILED, null, "nsfw detected");
        assertThat(afterSecond).isEqualTo(JobStatus.SUCCEEDED);
        assertThat(job.getStatus()).isEqualTo(JobStatus.SUCCEEDED);
        assertThat(job.getCompletedAt()).isEqualTo(NOW);
        assertThat(job.getOutputImages()).hasSize(1);
        assertThat(predictions.get(1).getErrorMessage()).isEqualTo("nsfw detected");
    }

    @Test
    void redeliveredTerminalUpdateIsIgnored() {
        addPrediction("p1", 1);
        reconciler.applyUpdate("p1", PredictionStatus.SUCCEEDED, url("https://cdn/a.png"), null);

        JobStatus again = reconciler.applyUpdate("p1", PredictionStatus.FAILED, null, "late failure");

        assertThat(again).isEqualTo(JobStatus.SUCCEEDED);
        assertThat(predictions.get(0).getStatus()).isEqualTo(PredictionStatus.SUCCEEDED);
        assertThat(predictions.get(0).getErrorMessage()).isNull();
    }

    @Test
    void unchangedStatusIsNoOp() {
        addPrediction("p1", 1);
        predictions.get(0).setStatus(PredictionStatus.PROCESSING);

        reconciler.applyUpdate("p1", PredictionStatus.PROCESSING, null, null);

        verify(predictionRepo, never()).save(any());
        verify(jobRepo, never()).save(any());
    }

    @Test
    void allFailedCarriesFirstError() {
        addPrediction("p1", 1);
        addPrediction("p2", 2);

        reconciler.applyUpdate("p2", PredictionStatus.FAILED, null, "second");
        reconciler.applyUpdate("p1", PredictionStatus.CANCELED, null, null);

        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getErrorMessage()).isEqualTo("canceled");
        assertThat(job.getOutputImages()).isEmpty();
    }

    @Test
    void unknownPredictionIsNotFound() {
        ThumbnailException ex = assertThrows(ThumbnailException.class,
                () -> reconciler.applyUpdate("ghost", PredictionStatus.SUCCEEDED, null, null));

        assertThat(ex.getKind()).isEqualTo(ErrorKind.NOT_FOUND);
        assertThat(ex.getReason()).isEqualTo("PREDICTION_NOT_FOUND");
    }

    @Test
    void jobStaysRunningUntilDispatchCompletes() {
        job.setDispatchedAt(null);
        addPrediction("p1", 1);

        JobStatus early = reconciler.applyUpdate("p1", PredictionStatus.SUCCEEDED, url("https://cdn/a.png"), null);
        assertThat(early).isEqualTo(JobStatus.RUNNING);
        assertThat(job.getOutputImages()).hasSize(1);

        JobStatus done = reconciler.markDispatched(job.getId());
        assertThat(done).isEqualTo(JobStatus.SUCCEEDED);
        assertThat(job.getDispatchedAt()).isEqualTo(NOW);
    }

    @Test
    void expireFailsInFlightPredictions() {
        addPrediction("p1", 1);
        addPrediction("p2", 2);
        reconciler.applyUpdate("p1", PredictionStatus.SUCCEEDED, url("https://cdn/a.png"), null);

        int expired = reconciler.expire(job.getId());

        assertThat(expired).isEqualTo(1);
        assertThat(predictions.get(1).getStatus()).isEqualTo(PredictionStatus.FAILED);
        assertThat(predictions.get(1).getErrorMessage()).isEqualTo(PredictionReconciler.TIMED_OUT);
        assertThat(job.getStatus()).isEqualTo(JobStatus.SUCCEEDED);
    }

    @Test
    void failJobDoesNotReopenTerminalJob() {
        job.setStatus(JobStatus.SUCCEEDED);

        reconciler.failJob(job.getId(), "dispatch failed");

        assertThat(job.getStatus()).isEqualTo(JobStatus.SUCCEEDED);
        verify(jobRepo, never()).save(any());
    }

    @Test
    void aggregateRules() {
        assertThat(PredictionReconciler.aggregate(List.of())).isEqualTo(JobStatus.FAILED);
        assertThat(PredictionReconciler.aggregate(List.of(PredictionStatus.SUCCEEDED, PredictionStatus.PROCESSING)))
                .isEqualTo(JobStatus.RUNNING);
        assertThat(PredictionReconciler.aggregate(List.of(PredictionStatus.FAILED, PredictionStatus.CANCELED)))
                .isEqualTo(JobStatus.FAILED);
        assertThat(PredictionReconciler.aggregate(List.of(PredictionStatus.FAILED, PredictionStatus.SUCCEEDED)))
                .isEqualTo(JobStatus.SUCCEEDED);
    }

    @Test
    void outputUrlsAcceptsStringOrArray() throws Exception {
        JsonNode array = mapper.readTree("[\"https://a\", 3, \"\", \"https://b\"]");

        assertThat(PredictionReconciler.outputUrls(array)).containsExactly("https://a", "https://b");
        assertThat(PredictionReconciler.outputUrls(TextNode.valueOf("https://c"))).containsExactly("https://c");
        assertThat(PredictionReconciler.outputUrls(null)).isEmpty();
    }

    @Test
    void completionOrderDoesNotChangeTheOutcome() {
        addPrediction("p1", 1);
        addPrediction("p2", 2);
        reconciler.applyUpdate("p2", PredictionStatus.SUCCEEDED, url("https://cdn/b.png"), null);
        reconciler.applyUpdate("p1", PredictionStatus.SUCCEEDED, url("https://cdn/a.png"), null);
        JobStatus reversedStatus = job.getStatus();
        List<String> reversedUrls = job.getOutputImages().stream().map(OutputImage::url).toList();

        predictions.clear();
        job.setStatus(JobStatus.RUNNING);
        job.setOutputImages(null);
        job.setCompletedAt(null);
        addPrediction("p1", 1);
        addPrediction("p2", 2);
        reconciler.applyUpdate("p1", PredictionStatus.SUCCEEDED, url("https://cdn/a.png"), null);
        reconciler.applyUpdate("p2", PredictionStatus.SUCCEEDED, url("https://cdn/b.png"), null);

        assertThat(reversedStatus).isEqualTo(JobStatus.SUCCEEDED);
        assertThat(job.getStatus()).isEqualTo(reversedStatus);
        assertThat(reversedUrls).containsExactly("https://cdn/a.png", "https://cdn/b.png");
        assertThat(job.getOutputImages()).extracting(OutputImage::url).isEqualTo(reversedUrls);
    }

    private void addPrediction(String externalId, int sequence) {
        predictions.add(new ThumbnailPrediction(job, externalId, sequence, "note " + sequence));
    }

    private static JsonNode url(String value) {
        return TextNode.valueOf(value);
    }
}
