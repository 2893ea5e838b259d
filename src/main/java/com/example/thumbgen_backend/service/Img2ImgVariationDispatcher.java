package com.example.thumbgen_backend.service;

import com.example.thumbgen_backend.config.ThumbnailProperties;
import com.example.thumbgen_backend.dto.CreateVariationRequest;
import com.example.thumbgen_backend.dto.VariationResponse;
import com.example.thumbgen_backend.engine.Interfaces.ImageGenerationProvider;
import com.example.thumbgen_backend.exception.ProviderException;
import com.example.thumbgen_backend.exception.ThumbnailException;
import com.example.thumbgen_backend.model.Account;
import com.example.thumbgen_backend.model.OutputImage;
import com.example.thumbgen_backend.model.ThumbnailJob;
import com.example.thumbgen_backend.model.ThumbnailPrediction;
import com.example.thumbgen_backend.model.ThumbnailProject;
import com.example.thumbgen_backend.prompt.PromptComposer;
import com.example.thumbgen_backend.repository.ThumbnailJobRepository;
import com.example.thumbgen_backend.repository.ThumbnailPredictionRepository;
import com.example.thumbgen_backend.repository.ThumbnailProjectRepository;
import com.example.thumbgen_backend.util.JobSource;
import com.example.thumbgen_backend.util.JobStatus;
import com.example.thumbgen_backend.util.OptimisticRetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Derives a one-prediction img2img job from an image of a succeeded job.
 */
@Service
public class Img2ImgVariationDispatcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(Img2ImgVariationDispatcher.class);

    public static final double DEFAULT_STRENGTH = 0.75;
    static final double MIN_STRENGTH = 0.1;
    static final double MAX_STRENGTH = 1.0;
    static final int MIN_PROMPT_CHARS = 3;
    static final int OUTPUT_QUALITY = 90;

    private final AccountService accountService;
    private final ThumbnailJobRepository jobRepo;
    private final ThumbnailPredictionRepository predictionRepo;
    private final ThumbnailProjectRepository projectRepo;
    private final ImageGenerationProvider provider;
    private final PredictionReconciler reconciler;
    private final ThumbnailProperties properties;

    public Img2ImgVariationDispatcher(AccountService accountService,
                                      ThumbnailJobRepository jobRepo,
                                      ThumbnailPredictionRepository predictionRepo,
                                      ThumbnailProjectRepository projectRepo,
                                      ImageGenerationProvider provider,
                                      PredictionReconciler reconciler,
                                      ThumbnailProperties properties) {
        this.accountService = accountService;
        this.jobRepo = jobRepo;
        this.predictionRepo = predictionRepo;
        this.projectRepo = projectRepo;
        this.provider = provider;
        this.reconciler = reconciler;
        this.properties = properties;
    }

    public VariationResponse createVariation(CreateVariationRequest request) {
        Account owner = accountService.getByExternalSubjectOrThrow(request.ownerExternalSubject());
        ThumbnailJob parent = jobRepo.findByIdAndOwner_Id(request.parentJobId(), owner.getId())
                .orElseThrow(() -> ThumbnailException.notFound("PARENT_JOB_NOT_FOUND"));
        if (parent.getStatus() != JobStatus.SUCCEEDED) {
            throw ThumbnailException.invalid("PARENT_JOB_NOT_SUCCEEDED");
        }

        double strength = request.strength() == null ? DEFAULT_STRENGTH : request.strength();
        if (Double.isNaN(strength) || strength < MIN_STRENGTH || strength > MAX_STRENGTH) {
            throw ThumbnailException.invalid("INVALID_STRENGTH");
        }
        String prompt = resolvePrompt(request.prompt(), parent);

        String imageUrl = request.inputImageUrl().trim();
        if (!isProvenFrom(parent, owner, imageUrl)) {
            LOGGER.warn("VARIATION provenance rejected parentJobId={} owner={} url={}",
                    parent.getId(), owner.getId(), PromptComposer.abbreviate(imageUrl, 120));
            throw ThumbnailException.forbidden("IMAGE_PROVENANCE_FAILED");
        }

        String version = parent.getStyleModelVersion();
        if (version == null || version.isBlank()) {
            ThumbnailProperties.StyleModel model = properties.styleModel(parent.getStyle());
            if (model == null || model.getVersion() == null) {
                throw ThumbnailException.invalid("STYLE_NOT_CONFIGURED");
            }
            version = model.getVersion();
        }

        ThumbnailJob job = new ThumbnailJob(owner, parent.getStyle(), JobSource.IMG2IMG, prompt);
        job.setParentJobId(parent.getId());
        job.setInputImageUrl(imageUrl);
        job.setStrength(strength);
        job.setComposedPrompt(prompt);
        job.setNegativePrompt(parent.getNegativePrompt());
        job.setStyleModelVersion(version);
        job.setStatus(JobStatus.RUNNING);
        Map<String, Object> input = providerInput(imageUrl, prompt, strength);
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("parentJobId", parent.getId().toString());
        config.put("styleModelVersion", version);
        config.put("input", input);
        job.setComposedConfig(config);
        job = jobRepo.save(job);
        LOGGER.info("VARIATION job created jobId={} parentJobId={} strength={}", job.getId(), parent.getId(), strength);

        ImageGenerationProvider.Prediction created;
        try {
            created = provider.createPrediction(
                    new ImageGenerationProvider.PredictionRequest(version, input, properties.webhookUrl()));
        } catch (ProviderException e) {
            LOGGER.error("VARIATION dispatch failed jobId={} status={} reason={}", job.getId(), e.getStatusCode(), e.getMessage());
            reconciler.failJob(job.getId(), "dispatch failed: " + e.getMessage());
            throw ThumbnailException.external("PROVIDER_DISPATCH_FAILED", e);
        }

        ThumbnailPrediction prediction = predictionRepo.save(
                new ThumbnailPrediction(job, created.id(), 1, "img2img strength=" + strength));
        UUID jobId = job.getId();
        JobStatus status = OptimisticRetry.run("VARIATION markDispatched jobId=" + jobId,
                ThumbnailJobService.MAX_WRITE_ATTEMPTS, () -> reconciler.markDispatched(jobId));
        LOGGER.info("VARIATION dispatched jobId={} externalId={}", job.getId(), created.id());
        return new VariationResponse(job.getId(), parent.getId(), status.name().toLowerCase(Locale.ROOT), prediction.getId());
    }

    private String resolvePrompt(String requested, ThumbnailJob parent) {
        if (requested == null) {
            return PromptComposer.sanitize(parent.getUserPrompt() + " (variation)", properties.getMaxUserTextChars());
        }
        String prompt = PromptComposer.sanitize(requested, Integer.MAX_VALUE);
        if (prompt.length() < MIN_PROMPT_CHARS || prompt.length() > properties.getMaxUserTextChars()) {
            throw ThumbnailException.invalid("INVALID_PROMPT");
        }
        return prompt;
    }

    /** The image must be one of the parent's outputs or an export of a project derived from it. */
    boolean isProvenFrom(ThumbnailJob parent, Account owner, String imageUrl) {
        for (OutputImage image : parent.getOutputImages()) {
            if (imageUrl.equals(image.url())) {
                return true;
            }
        }
        for (ThumbnailProject project : projectRepo.findByJob_IdAndOwner_Id(parent.getId(), owner.getId())) {
            if (project.getExports().contains(imageUrl)) {
                return true;
            }
        }
        return false;
    }

    static Map<String, Object> providerInput(String imageUrl, String prompt, double strength) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("image", imageUrl);
        input.put("prompt", prompt);
        input.put("num_outputs", 1);
        input.put("output_format", "png");
        input.put("output_quality", OUTPUT_QUALITY);
        input.put("prompt_strength", strength);
        return input;
    }
}
