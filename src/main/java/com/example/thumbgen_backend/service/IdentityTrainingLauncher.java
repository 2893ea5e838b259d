package com.example.thumbgen_backend.service;

import com.example.thumbgen_backend.config.IdentityProperties;
import com.example.thumbgen_backend.config.ReplicateProperties;
import com.example.thumbgen_backend.config.ThumbnailProperties;
import com.example.thumbgen_backend.engine.Interfaces.ImageGenerationProvider;
import com.example.thumbgen_backend.exception.ProviderException;
import com.example.thumbgen_backend.model.IdentityModel;
import com.example.thumbgen_backend.model.TrainingPhoto;
import com.example.thumbgen_backend.repository.IdentityModelRepository;
import com.example.thumbgen_backend.repository.TrainingPhotoRepository;
import com.example.thumbgen_backend.service.Interfaces.StorageService;
import com.example.thumbgen_backend.util.IdentityStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Starts a committed (pending) identity model's training off the request thread: zips the original photos,
 * uploads the archive, ensures the destination model exists and creates the training. Moves the model to
 * training on success, to failed on any error.
 */
@Service
public class IdentityTrainingLauncher {
    private static final Logger LOGGER = LoggerFactory.getLogger(IdentityTrainingLauncher.class);

    private final IdentityModelRepository modelRepo;
    private final TrainingPhotoRepository photoRepo;
    private final StorageService storage;
    private final ImageGenerationProvider provider;
    private final IdentityProperties identityProps;
    private final ReplicateProperties replicateProps;
    private final ThumbnailProperties thumbnailProps;
    private final TransactionTemplate txTemplate;
    private final TaskExecutor executor;
    private final Clock clock;

    public IdentityTrainingLauncher(IdentityModelRepository modelRepo,
                                    TrainingPhotoRepository photoRepo,
                                    StorageService storage,
                                    ImageGenerationProvider provider,
                                    IdentityProperties identityProps,
                                    ReplicateProperties replicateProps,
                                    ThumbnailProperties thumbnailProps,
                                    TransactionTemplate txTemplate,
                                    @Qualifier("workerTaskExecutor") TaskExecutor executor,
                                    Clock clock) {
        this.modelRepo = modelRepo;
        this.photoRepo = photoRepo;
        this.storage = storage;
        this.provider = provider;
        this.identityProps = identityProps;
        this.replicateProps = replicateProps;
        this.thumbnailProps = thumbnailProps;
        this.txTemplate = txTemplate;
        this.executor = executor;
        this.clock = clock;
    }

    public void launch(UUID modelId) {
        try {
            executor.execute(() -> run(modelId));
        } catch (TaskRejectedException e) {
            LOGGER.error("IDENTITY launch rejected modelId={} reason={}", modelId, e.getMessage());
            markFailed(modelId, "training could not be scheduled");
        }
    }

    void run(UUID modelId) {
        try {
            start(modelId);
        } catch (RuntimeException e) {
            LOGGER.error("IDENTITY training start failed modelId={} reason={}", modelId, e.toString(), e);
            markFailed(modelId, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    void start(UUID modelId) {
        IdentityModel model = modelRepo.findById(modelId)
                .orElseThrow(() -> new IllegalStateException("identity model vanished: " + modelId));
        if (model.getStatus() != IdentityStatus.PENDING) {
            LOGGER.info("IDENTITY launch skipped modelId={} status={}", modelId, model.getStatus());
            return;
        }
        String trainerVersion = replicateProps.getTrainerVersion();
        if (trainerVersion == null || trainerVersion.isBlank()) {
            throw new IllegalStateException("trainer version not configured");
        }
        List<TrainingPhoto> photos = photoRepo.findByIdentityModelIdOrderByStorageKeyAsc(modelId);
        if (photos.size() < identityProps.getMinPhotos()) {
            throw new IllegalStateException("only " + photos.size() + " photos attached, need " + identityProps.getMinPhotos());
        }

        byte[] archive = zip(photos);
        ImageGenerationProvider.UploadedFile file =
                provider.uploadFile("identity-" + modelId + ".zip", "application/zip", archive);
        LOGGER.info("IDENTITY dataset uploaded modelId={} photos={} bytes={} fileId={}",
                modelId, photos.size(), archive.length, file.id());

        String owner = model.getProviderModelOwner();
        String name = model.getProviderModelName();
        try {
            provider.createModel(owner, name, "Identity model " + modelId);
        } catch (ProviderException e) {
            LOGGER.warn("IDENTITY createModel failed, continuing model={}/{} status={} reason={}",
                    owner, name, e.getStatusCode(), e.getMessage());
        }

        ImageGenerationProvider.Training training = provider.createTraining(new ImageGenerationProvider.TrainingRequest(
                trainerVersion, owner + "/" + name, trainerInput(file.url(), model.getTriggerWord()),
                thumbnailProps.trainingWebhookUrl()));

        txTemplate.executeWithoutResult(tx -> {
            IdentityModel current = modelRepo.findById(modelId)
                    .orElseThrow(() -> new IllegalStateException("identity model vanished: " + modelId));
            if (current.getStatus() != IdentityStatus.PENDING) {
                LOGGER.warn("IDENTITY training started but model moved on modelId={} status={} trainingId={}",
                        modelId, current.getStatus(), training.id());
                return;
            }
            current.setStatus(IdentityStatus.TRAINING);
            current.setTrainingId(training.id());
            current.setTrainingStartedAt(clock.instant());
            modelRepo.save(current);
        });
        LOGGER.info("IDENTITY status modelId={} pending -> training trainingId={}", modelId, training.id());
    }

    Map<String, Object> trainerInput(String datasetUrl, String triggerWord) {
        Map<String, Object> input = new LinkedHashMap<>(identityProps.getTrainerInput());
        input.put(identityProps.getTrainerDataKey(), datasetUrl);
        input.put(identityProps.getTrainerTriggerKey(), triggerWord);
        input.put("autocaption_prefix", "a photo of " + triggerWord + ",");
        return input;
    }

    byte[] zip(List<TrainingPhoto> photos) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(out)) {
            int index = 0;
            for (TrainingPhoto photo : photos) {
                if (photo.getStorageKey() == null) {
                    continue;
                }
                index++;
                zip.putNextEntry(new ZipEntry(String.format("photo-%02d.%s", index, extension(photo.getContentType()))));
                zip.write(storage.get(photo.getStorageKey()));
                zip.closeEntry();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("zipping training photos failed", e);
        }
        return out.toByteArray();
    }

    void markFailed(UUID modelId, String reason) {
        txTemplate.executeWithoutResult(tx -> modelRepo.findById(modelId).ifPresent(m -> {
            if (!m.getStatus().isInFlight()) {
                return;
            }
            LOGGER.info("IDENTITY status modelId={} {} -> failed reason={}", modelId, m.getStatus(), reason);
            m.setStatus(IdentityStatus.FAILED);
            m.setErrorMessage(reason.length() > 1000 ? reason.substring(0, 1000) : reason);
            m.setTrainingCompletedAt(clock.instant());
            modelRepo.save(m);
        }));
    }

    public static String extension(String contentType) {
        if (contentType == null) {
            return "bin";
        }
        return switch (contentType) {
            case "image/jpeg" -> "jpg";
            case "image/png" -> "png";
            case "image/webp" -> "webp";
            default -> "bin";
        };
    }
}
