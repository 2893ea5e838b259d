package com.example.thumbgen_backend.service;

import com.example.thumbgen_backend.config.ThumbnailProperties;
import com.example.thumbgen_backend.exception.ThumbnailException;
import com.example.thumbgen_backend.model.OutputImage;
import com.example.thumbgen_backend.model.ThumbnailJob;
import com.example.thumbgen_backend.model.ThumbnailPrediction;
import com.example.thumbgen_backend.repository.ThumbnailJobRepository;
import com.example.thumbgen_backend.repository.ThumbnailPredictionRepository;
import com.example.thumbgen_backend.util.JobStatus;
import com.example.thumbgen_backend.util.PredictionStatus;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Single writer of prediction and job state after dispatch. Webhook and poll updates both land in
 * {@link #applyUpdate}; a prediction's status is overwritten, never patched, and the job is re-derived from
 * all of its predictions after every change, so both channels converge whatever order they arrive in.
 */
@Service
public class PredictionReconciler {
    private static final Logger LOGGER = LoggerFactory.getLogger(PredictionReconciler.class);

    static final String TIMED_OUT = "timed out";

    private final ThumbnailPredictionRepository predictionRepo;
    private final ThumbnailJobRepository jobRepo;
    private final ThumbnailProperties properties;
    private final Clock clock;

    public PredictionReconciler(ThumbnailPredictionRepository predictionRepo,
                                ThumbnailJobRepository jobRepo,
                                ThumbnailProperties properties,
                                Clock clock) {
        this.predictionRepo = predictionRepo;
        this.jobRepo = jobRepo;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Applies the provider's current view of one prediction.
     *
     * @param externalId provider prediction id.
     * @param status     absolute status reported by the provider.
     * @param output     provider output, a URL or an array of URLs; only read on success.
     * @param error      provider error text, kept for failed and canceled predictions.
     * @return the job status after aggregation.
     * @throws ThumbnailException NOT_FOUND when no prediction carries {@code externalId}.
     */
    @Transactional
    public JobStatus applyUpdate(String externalId,
                                 PredictionStatus status,
                                 @Nullable JsonNode output,
                                 @Nullable String error) {
        ThumbnailPrediction prediction = predictionRepo.findByExternalId(externalId)
                .orElseThrow(() -> ThumbnailException.notFound("PREDICTION_NOT_FOUND"));
        ThumbnailJob job = prediction.getJob();

        if (prediction.getStatus().isTerminal() || job.getStatus().isTerminal()) {
            LOGGER.debug("RECONCILE ignored externalId={} current={} incoming={} job={}",
                    externalId, prediction.getStatus(), status, job.getStatus());
            return job.getStatus();
        }
        if (prediction.getStatus() == status) {
            return job.getStatus();
        }

        prediction.setStatus(status);
        if (status == PredictionStatus.SUCCEEDED) {
            prediction.setOutputImages(toOutputImages(output));
        } else if (status == PredictionStatus.FAILED || status == PredictionStatus.CANCELED) {
            prediction.setErrorMessage(error != null && !error.isBlank() ? truncate(error) : status.name().toLowerCase(Locale.ROOT));
        }
        predictionRepo.save(prediction);
        LOGGER.info("RECONCILE prediction externalId={} jobId={} status={} outputs={}",
                externalId, job.getId(), status, prediction.getOutputImages().size());

        return aggregateInto(job);
    }

    /**
     * Marks the end of dispatch. Until then aggregation may collect outputs but cannot finalize the job,
     * otherwise a fast first variant could close the job before the rest are created.
     */
    @Transactional
    public JobStatus markDispatched(UUID jobId) {
        ThumbnailJob job = requireJob(jobId);
        if (job.getDispatchedAt() == null) {
            job.setDispatchedAt(clock.instant());
        }
        return aggregateInto(job);
    }

    /** Terminal failure from a dispatch path. No-op once the job is terminal. */
    @Transactional
    public void failJob(UUID jobId, String reason) {
        ThumbnailJob job = requireJob(jobId);
        if (job.getStatus().isTerminal()) {
            return;
        }
        job.setStatus(JobStatus.FAILED);
        job.setErrorMessage(truncate(reason));
        if (job.getDispatchedAt() == null) {
            job.setDispatchedAt(clock.instant());
        }
        job.setCompletedAt(clock.instant());
        jobRepo.save(job);
        LOGGER.info("JOB failed jobId={} reason={}", jobId, reason);
    }

    /**
     * Fails every prediction of the job that is still in flight and re-derives the job.
     *
     * @return number of predictions expired.
     */
    @Transactional
    public int expire(UUID jobId) {
        ThumbnailJob job = requireJob(jobId);
        if (job.getStatus().isTerminal()) {
            return 0;
        }
        int expired = 0;
        for (ThumbnailPrediction p : predictionRepo.findByJob_IdOrderBySequenceAsc(jobId)) {
            if (!p.getStatus().isTerminal()) {
                p.setStatus(PredictionStatus.FAILED);
                p.setErrorMessage(TIMED_OUT);
                predictionRepo.save(p);
                expired++;
            }
        }
        if (job.getDispatchedAt() == null) {
            job.setDispatchedAt(clock.instant());
        }
        JobStatus status = aggregateInto(job);
        LOGGER.info("JOB expired jobId={} predictionsExpired={} status={}", jobId, expired, status);
        return expired;
    }

    private JobStatus aggregateInto(ThumbnailJob job) {
        if (job.getStatus().isTerminal()) {
            return job.getStatus();
        }
        List<ThumbnailPrediction> predictions = predictionRepo.findByJob_IdOrderBySequenceAsc(job.getId());
        JobStatus derived = aggregate(predictions.stream().map(ThumbnailPrediction::getStatus).toList());
        job.setOutputImages(collectOutputs(predictions));

        if (derived.isTerminal() && job.getDispatchedAt() == null) {
            derived = JobStatus.RUNNING;
        }
        if (derived != job.getStatus()) {
            LOGGER.info("JOB status jobId={} {} -> {} outputs={}",
                    job.getId(), job.getStatus(), derived, job.getOutputImages().size());
            job.setStatus(derived);
        }
        if (derived.isTerminal()) {
            job.setCompletedAt(clock.instant());
            if (derived == JobStatus.FAILED) {
                job.setErrorMessage(firstError(predictions));
            }
        }
        jobRepo.save(job);
        return derived;
    }

    /**
     * Job status as a pure function of its prediction statuses: succeeded iff all are terminal and at least one
     * succeeded, failed iff all are terminal and none succeeded, running otherwise. A job without predictions
     * has nothing left to wait for and is failed.
     */
    public static JobStatus aggregate(List<PredictionStatus> statuses) {
        if (statuses.isEmpty()) {
            return JobStatus.FAILED;
        }
        boolean anySucceeded = false;
        for (PredictionStatus s : statuses) {
            if (!s.isTerminal()) {
                return JobStatus.RUNNING;
            }
            anySucceeded |= s == PredictionStatus.SUCCEEDED;
        }
        return anySucceeded ? JobStatus.SUCCEEDED : JobStatus.FAILED;
    }

    /** Outputs of succeeded predictions, in prediction creation order, without de-duplication. */
    public static List<OutputImage> collectOutputs(List<ThumbnailPrediction> predictions) {
        List<OutputImage> out = new ArrayList<>();
        for (ThumbnailPrediction p : predictions) {
            if (p.getStatus() == PredictionStatus.SUCCEEDED) {
                out.addAll(p.getOutputImages());
            }
        }
        return out;
    }

    List<OutputImage> toOutputImages(@Nullable JsonNode output) {
        List<OutputImage> images = new ArrayList<>();
        for (String url : outputUrls(output)) {
            images.add(new OutputImage(url, properties.getOutputWidth(), properties.getOutputHeight(),
                    properties.getOutputContentType()));
        }
        return images;
    }

    /** Provider output is either a single URL or an array of URLs. */
    public static List<String> outputUrls(@Nullable JsonNode output) {
        List<String> urls = new ArrayList<>();
        if (output == null || output.isNull()) {
            return urls;
        }
        if (output.isTextual()) {
            if (!output.asText().isBlank()) {
                urls.add(output.asText());
            }
        } else if (output.isArray()) {
            for (JsonNode n : output) {
                if (n.isTextual() && !n.asText().isBlank()) {
                    urls.add(n.asText());
                }
            }
        }
        return urls;
    }

    private static String firstError(List<ThumbnailPrediction> predictions) {
        return predictions.stream()
                .map(ThumbnailPrediction::getErrorMessage)
                .filter(e -> e != null && !e.isBlank())
                .findFirst()
                .orElse("all predictions failed");
    }

    private ThumbnailJob requireJob(UUID jobId) {
        return jobRepo.findById(jobId).orElseThrow(() -> ThumbnailException.notFound("JOB_NOT_FOUND"));
    }

    private static String truncate(String message) {
        return message.length() > 1000 ? message.substring(0, 1000) : message;
    }
}
