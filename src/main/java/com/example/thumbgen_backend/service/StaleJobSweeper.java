package com.example.thumbgen_backend.service;

import com.example.thumbgen_backend.config.ThumbnailProperties;
import com.example.thumbgen_backend.model.ThumbnailJob;
import com.example.thumbgen_backend.repository.ThumbnailJobRepository;
import com.example.thumbgen_backend.util.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Expires running jobs nobody observes any more. Works purely from persisted rows, so every instance may run it.
 */
@Component
public class StaleJobSweeper {
    private static final Logger LOGGER = LoggerFactory.getLogger(StaleJobSweeper.class);

    private final ThumbnailJobRepository jobRepo;
    private final ThumbnailJobService jobService;
    private final PredictionReconciler reconciler;
    private final ThumbnailProperties properties;
    private final Clock clock;

    public StaleJobSweeper(ThumbnailJobRepository jobRepo,
                           ThumbnailJobService jobService,
                           PredictionReconciler reconciler,
                           ThumbnailProperties properties,
                           Clock clock) {
        this.jobRepo = jobRepo;
        this.jobService = jobService;
        this.reconciler = reconciler;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${thumbnails.sweeper-delay-ms:60000}")
    public void tick() {
        sweep();
    }

    /** @return number of jobs swept. */
    public int sweep() {
        Instant cutoff = clock.instant().minus(properties.getStaleAfter());
        List<ThumbnailJob> stale = jobRepo.findByStatusAndCreatedAtBeforeOrderByCreatedAtAsc(
                JobStatus.RUNNING, cutoff, PageRequest.of(0, properties.getSweeperBatchSize()));
        if (stale.isEmpty()) {
            LOGGER.debug("SWEEP tick no stale jobs cutoff={}", cutoff);
            return 0;
        }
        int swept = 0;
        for (ThumbnailJob job : stale) {
            try {
                jobService.poll(job.getId());
                reconciler.expire(job.getId());
                swept++;
            } catch (RuntimeException e) {
                LOGGER.error("SWEEP failed jobId={} reason={}", job.getId(), e.toString(), e);
            }
        }
        LOGGER.info("SWEEP done candidates={} swept={} cutoff={}", stale.size(), swept, cutoff);
        return swept;
    }
}
