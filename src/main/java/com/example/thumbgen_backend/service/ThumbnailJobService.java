package com.example.thumbgen_backend.service;

import com.example.thumbgen_backend.config.ThumbnailProperties;
import com.example.thumbgen_backend.dto.ThumbnailJobResponse;
import com.example.thumbgen_backend.engine.Interfaces.ImageGenerationProvider;
import com.example.thumbgen_backend.exception.ProviderException;
import com.example.thumbgen_backend.exception.ThumbnailException;
import com.example.thumbgen_backend.model.Account;
import com.example.thumbgen_backend.model.ThumbnailJob;
import com.example.thumbgen_backend.model.ThumbnailPrediction;
import com.example.thumbgen_backend.repository.ThumbnailJobRepository;
import com.example.thumbgen_backend.repository.ThumbnailPredictionRepository;
import com.example.thumbgen_backend.util.OptimisticRetry;
import com.example.thumbgen_backend.util.PredictionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Read side of jobs plus the poll channel. Polling asks the provider for every in-flight prediction and feeds
 * the answers through {@link PredictionReconciler}, the same path webhooks take.
 */
@Service
public class ThumbnailJobService {
    private static final Logger LOGGER = LoggerFactory.getLogger(ThumbnailJobService.class);
    static final int MAX_WRITE_ATTEMPTS = 3;

    private final AccountService accountService;
    private final ThumbnailJobRepository jobRepo;
    private final ThumbnailPredictionRepository predictionRepo;
    private final ImageGenerationProvider provider;
    private final PredictionReconciler reconciler;
    private final ThumbnailProperties properties;
    private final Clock clock;

    public ThumbnailJobService(AccountService accountService,
                               ThumbnailJobRepository jobRepo,
                               ThumbnailPredictionRepository predictionRepo,
                               ImageGenerationProvider provider,
                               PredictionReconciler reconciler,
                               ThumbnailProperties properties,
                               Clock clock) {
        this.accountService = accountService;
        this.jobRepo = jobRepo;
        this.predictionRepo = predictionRepo;
        this.provider = provider;
        this.reconciler = reconciler;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Returns the job, reconciling it first when it is still running. A running job past the stale timeout
     * is polled one last time and then expired.
     */
    public ThumbnailJobResponse getJob(String ownerExternalSubject, UUID jobId) {
        Account owner = accountService.getByExternalSubjectOrThrow(ownerExternalSubject);
        ThumbnailJob job = jobRepo.findByIdAndOwner_Id(jobId, owner.getId())
                .orElseThrow(() -> ThumbnailException.notFound("JOB_NOT_FOUND"));

        if (!job.getStatus().isTerminal()) {
            refresh(job);
            job = jobRepo.findById(jobId).orElseThrow(() -> ThumbnailException.notFound("JOB_NOT_FOUND"));
        }
        return ThumbnailJobResponse.from(job, predictionRepo.findByJob_IdOrderBySequenceAsc(jobId));
    }

    void refresh(ThumbnailJob job) {
        boolean stale = isStale(job, clock.instant());
        poll(job.getId());
        if (stale) {
            reconciler.expire(job.getId());
        }
    }

    public boolean isStale(ThumbnailJob job, Instant now) {
        return job.getCreatedAt() != null && job.getCreatedAt().isBefore(now.minus(properties.getStaleAfter()));
    }

    /**
     * Polls every non-terminal prediction of the job once. A failing poll is logged and skipped; the webhook
     * or the next poll will catch up.
     *
     * @return number of predictions for which an update was applied.
     */
    public int poll(UUID jobId) {
        int applied = 0;
        for (ThumbnailPrediction prediction : predictionRepo.findByJob_IdOrderBySequenceAsc(jobId)) {
            if (prediction.getStatus().isTerminal()) {
                continue;
            }
            String externalId = prediction.getExternalId();
            try {
                ImageGenerationProvider.Prediction remote = provider.getPrediction(externalId);
                PredictionStatus status = PredictionStatus.fromProvider(remote.status());
                OptimisticRetry.run("POLL externalId=" + externalId, MAX_WRITE_ATTEMPTS,
                        () -> reconciler.applyUpdate(externalId, status, remote.output(), remote.error()));
                applied++;
            } catch (ProviderException e) {
                LOGGER.warn("POLL provider lookup failed jobId={} externalId={} status={} reason={}",
                        jobId, externalId, e.getStatusCode(), e.getMessage());
            } catch (IllegalArgumentException e) {
                LOGGER.warn("POLL unexpected provider status jobId={} externalId={} reason={}",
                        jobId, externalId, e.getMessage());
            }
        }
        LOGGER.debug("POLL jobId={} applied={}", jobId, applied);
        return applied;
    }
}
