package com.example.thumbgen_backend.service;

import com.example.thumbgen_backend.config.IdentityProperties;
import com.example.thumbgen_backend.config.ThumbnailProperties;
import com.example.thumbgen_backend.dto.GenerateThumbnailRequest;
import com.example.thumbgen_backend.dto.GenerateThumbnailResponse;
import com.example.thumbgen_backend.engine.Interfaces.ImageGenerationProvider;
import com.example.thumbgen_backend.exception.ProviderException;
import com.example.thumbgen_backend.exception.ThumbnailException;
import com.example.thumbgen_backend.model.Account;
import com.example.thumbgen_backend.model.IdentityModel;
import com.example.thumbgen_backend.model.ThumbnailJob;
import com.example.thumbgen_backend.model.ThumbnailPrediction;
import com.example.thumbgen_backend.prompt.PromptComposer;
import com.example.thumbgen_backend.prompt.PromptPlan;
import com.example.thumbgen_backend.prompt.PromptRequest;
import com.example.thumbgen_backend.prompt.PromptVariant;
import com.example.thumbgen_backend.repository.IdentityModelRepository;
import com.example.thumbgen_backend.repository.ThumbnailJobRepository;
import com.example.thumbgen_backend.repository.ThumbnailPredictionRepository;
import com.example.thumbgen_backend.style.PostProcessingStep;
import com.example.thumbgen_backend.style.StylePackRegistry;
import com.example.thumbgen_backend.util.IdentityStatus;
import com.example.thumbgen_backend.util.JobSource;
import com.example.thumbgen_backend.util.JobStatus;
import com.example.thumbgen_backend.util.OptimisticRetry;
import com.example.thumbgen_backend.util.ThumbnailStyle;
import jakarta.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Text-to-image entry point. Every precondition (identity, style model, prompts) is checked before the job row
 * is written, so a rejected request leaves nothing behind. Once the job exists, variants that fail to start are
 * tolerated: the job completes on whichever predictions did start.
 */
@Service
public class GenerationDispatcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(GenerationDispatcher.class);

    private final AccountService accountService;
    private final IdentityModelRepository identityRepo;
    private final ThumbnailJobRepository jobRepo;
    private final ThumbnailPredictionRepository predictionRepo;
    private final StylePackRegistry packRegistry;
    private final PromptComposer promptComposer;
    private final ImageGenerationProvider provider;
    private final PredictionReconciler reconciler;
    private final ThumbnailProperties thumbnailProperties;
    private final IdentityProperties identityProperties;

    public GenerationDispatcher(AccountService accountService,
                                IdentityModelRepository identityRepo,
                                ThumbnailJobRepository jobRepo,
                                ThumbnailPredictionRepository predictionRepo,
                                StylePackRegistry packRegistry,
                                PromptComposer promptComposer,
                                ImageGenerationProvider provider,
                                PredictionReconciler reconciler,
                                ThumbnailProperties thumbnailProperties,
                                IdentityProperties identityProperties) {
        this.accountService = accountService;
        this.identityRepo = identityRepo;
        this.jobRepo = jobRepo;
        this.predictionRepo = predictionRepo;
        this.packRegistry = packRegistry;
        this.promptComposer = promptComposer;
        this.provider = provider;
        this.reconciler = reconciler;
        this.thumbnailProperties = thumbnailProperties;
        this.identityProperties = identityProperties;
    }

    public GenerateThumbnailResponse generate(GenerateThumbnailRequest request) {
        Account owner = accountService.getByExternalSubjectOrThrow(request.ownerExternalSubject());
        ThumbnailStyle style = parseStyle(request.style());
        ThumbnailProperties.StyleModel styleModel = requireStyleModel(style);
        IdentityModel identity = resolveIdentity(owner, style, request);
        List<String> packIds = resolvePackIds(request.memeStyle(), request.visualStyle());

        ImageGenerationProvider.VersionCheck check =
                provider.verifyModelVersion(styleModel.owner(), styleModel.name(), styleModel.getVersion());
        if (!check.valid()) {
            LOGGER.error("GENERATE style model check failed style={} model={} version={} error={}",
                    style.key(), styleModel.getModel(), styleModel.getVersion(), check.error());
            throw ThumbnailException.external("STYLE_MODEL_UNAVAILABLE");
        }

        int variantCount = request.variantCountOrDefault();
        PromptPlan plan = promptComposer.compose(new PromptRequest(
                style,
                styleModel.getTriggerWord(),
                identity != null ? identity.getTriggerWord() : null,
                request.promptText(),
                variantCount,
                packIds,
                styleModel.isAcceptsNegativePrompt()));

        String userPrompt = PromptComposer.sanitize(request.promptText(), thumbnailProperties.getMaxUserTextChars());
        ThumbnailJob job = new ThumbnailJob(owner, style, JobSource.TEXT2IMG, userPrompt);
        job.setStatus(JobStatus.RUNNING);
        job.setComposedPrompt(plan.variants().get(0).finalPrompt());
        job.setNegativePrompt(plan.variants().get(0).negativePrompt());
        job.setStyleModelVersion(styleModel.getVersion());
        job.setIdentityModelId(identity != null ? identity.getId() : null);
        job.setComposedConfig(composedConfig(style, styleModel, identity, packIds, plan));
        job = jobRepo.save(job);
        LOGGER.info("GENERATE job created jobId={} owner={} style={} variants={} identity={} fallback={}",
                job.getId(), owner.getId(), style.key(), variantCount, identity != null, plan.fallback());

        Map<String, Object> identityParams = identityParameters(identity);
        List<GenerateThumbnailResponse.DispatchedPrediction> dispatched = new ArrayList<>();
        String lastError = null;
        int sequence = 0;
        for (PromptVariant variant : plan.variants()) {
            sequence++;
            Map<String, Object> input = new LinkedHashMap<>(variant.providerParameters());
            input.putAll(identityParams);
            try {
                ImageGenerationProvider.Prediction created = provider.createPrediction(
                        new ImageGenerationProvider.PredictionRequest(styleModel.getVersion(), input,
                                thumbnailProperties.webhookUrl()));
                ThumbnailPrediction prediction = predictionRepo.save(
                        new ThumbnailPrediction(job, created.id(), sequence, variant.variationNote()));
                dispatched.add(new GenerateThumbnailResponse.DispatchedPrediction(
                        prediction.getId(), created.id(), variant.variationNote()));
                LOGGER.info("GENERATE prediction started jobId={} seq={} externalId={}", job.getId(), sequence, created.id());
            } catch (ProviderException e) {
                lastError = e.getMessage();
                LOGGER.error("GENERATE prediction failed to start jobId={} seq={} status={} reason={}",
                        job.getId(), sequence, e.getStatusCode(), e.getMessage());
            }
        }

        if (dispatched.isEmpty()) {
            reconciler.failJob(job.getId(), "no prediction could be started: " + lastError);
            throw ThumbnailException.external("PROVIDER_DISPATCH_FAILED");
        }
        UUID jobId = job.getId();
        JobStatus status = OptimisticRetry.run("GENERATE markDispatched jobId=" + jobId,
                ThumbnailJobService.MAX_WRITE_ATTEMPTS, () -> reconciler.markDispatched(jobId));
        LOGGER.info("GENERATE dispatched jobId={} predictions={} of {}", job.getId(), dispatched.size(), variantCount);
        return new GenerateThumbnailResponse(job.getId(), status.name().toLowerCase(Locale.ROOT), dispatched, variantCount);
    }

    static ThumbnailStyle parseStyle(String raw) {
        try {
            ThumbnailStyle style = ThumbnailStyle.fromKey(raw);
            if (style == null) {
                throw ThumbnailException.invalid("STYLE_REQUIRED");
            }
            return style;
        } catch (IllegalArgumentException e) {
            throw ThumbnailException.invalid("UNKNOWN_STYLE");
        }
    }

    private ThumbnailProperties.StyleModel requireStyleModel(ThumbnailStyle style) {
        ThumbnailProperties.StyleModel model = thumbnailProperties.styleModel(style);
        if (model == null || model.owner() == null || model.getVersion() == null || model.getVersion().isBlank()) {
            LOGGER.error("GENERATE no style model configured style={}", style.key());
            throw ThumbnailException.invalid("STYLE_NOT_CONFIGURED");
        }
        return model;
    }

    /**
     * Identity is re-checked here on every request: owner, readiness, weights and style support.
     */
    @Nullable
    IdentityModel resolveIdentity(Account owner, ThumbnailStyle style, GenerateThumbnailRequest request) {
        if (!request.useIdentity()) {
            return null;
        }
        if (!style.supportsIdentity()) {
            throw ThumbnailException.invalid("IDENTITY_STYLE_UNSUPPORTED");
        }
        IdentityModel model = (request.identityModelId() != null
                ? identityRepo.findByIdAndOwner_Id(request.identityModelId(), owner.getId())
                : identityRepo.findByOwner_Id(owner.getId()))
                .orElseThrow(() -> ThumbnailException.notFound("IDENTITY_MODEL_NOT_FOUND"));
        if (model.getStatus() != IdentityStatus.READY) {
            throw ThumbnailException.invalid("IDENTITY_NOT_READY");
        }
        if (model.getWeightsRef() == null || model.getWeightsRef().isBlank()) {
            LOGGER.error("GENERATE identity model ready without weights modelId={}", model.getId());
            throw ThumbnailException.external("IDENTITY_WEIGHTS_MISSING");
        }
        return model;
    }

    private List<String> resolvePackIds(@Nullable String memeStyle, @Nullable String visualStyle) {
        try {
            return packRegistry.packIdsFromControls(memeStyle, visualStyle);
        } catch (IllegalArgumentException e) {
            throw ThumbnailException.invalid("UNKNOWN_STYLE_PACK");
        }
    }

    /**
     * Identity weights ride along as an extra LoRA; the identity scale is stronger than the base style scale
     * so the face holds without washing out the style.
     */
    Map<String, Object> identityParameters(@Nullable IdentityModel identity) {
        if (identity == null) {
            return Map.of();
        }
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("extra_lora", identity.getWeightsRef());
        params.put("extra_lora_scale", identityProperties.getIdentityLoraScale());
        params.put("lora_scale", identityProperties.getStyleLoraScale());
        return params;
    }

    private Map<String, Object> composedConfig(ThumbnailStyle style,
                                               ThumbnailProperties.StyleModel styleModel,
                                               @Nullable IdentityModel identity,
                                               List<String> requestedPacks,
                                               PromptPlan plan) {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("style", style.key());
        config.put("styleModel", styleModel.getModel());
        config.put("styleModelVersion", styleModel.getVersion());
        config.put("requestedPacks", requestedPacks);
        config.put("keptPacks", plan.keptPackIds());
        config.put("removedPacks", plan.removedPackIds());
        List<Map<String, Object>> steps = new ArrayList<>();
        for (PostProcessingStep step : plan.postProcessing()) {
            steps.add(Map.of("type", step.type().key(), "intensity", step.intensity()));
        }
        config.put("postProcessing", steps);
        config.put("postProcessingRequired", !steps.isEmpty());
        if (plan.recommendedProvider() != null) {
            config.put("recommendedProvider", plan.recommendedProvider());
        }
        config.put("llmFallback", plan.fallback());
        if (identity != null) {
            Map<String, Object> id = new LinkedHashMap<>();
            id.put("modelId", identity.getId().toString());
            id.put("triggerWord", identity.getTriggerWord());
            id.putAll(identityParameters(identity));
            config.put("identity", id);
        }
        List<Map<String, Object>> variants = new ArrayList<>();
        for (PromptVariant v : plan.variants()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("variationNote", v.variationNote());
            entry.put("prompt", v.finalPrompt());
            entry.put("negativePrompt", v.negativePrompt());
            variants.add(entry);
        }
        config.put("variants", variants);
        return config;
    }
}
