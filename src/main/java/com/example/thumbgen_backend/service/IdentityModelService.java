package com.example.thumbgen_backend.service;

import com.example.thumbgen_backend.config.IdentityProperties;
import com.example.thumbgen_backend.config.ReplicateProperties;
import com.example.thumbgen_backend.dto.AwaitTrainingResponse;
import com.example.thumbgen_backend.dto.CommitTrainingResponse;
import com.example.thumbgen_backend.dto.IdentityStatusResponse;
import com.example.thumbgen_backend.dto.PhotoUploadResponse;
import com.example.thumbgen_backend.dto.ResetIdentityResponse;
import com.example.thumbgen_backend.engine.Interfaces.ImageGenerationProvider;
import com.example.thumbgen_backend.exception.ErrorKind;
import com.example.thumbgen_backend.exception.ProviderException;
import com.example.thumbgen_backend.exception.StorageException;
import com.example.thumbgen_backend.exception.ThumbnailException;
import com.example.thumbgen_backend.model.Account;
import com.example.thumbgen_backend.model.IdentityModel;
import com.example.thumbgen_backend.model.TrainingPhoto;
import com.example.thumbgen_backend.repository.IdentityModelRepository;
import com.example.thumbgen_backend.repository.TrainingPhotoRepository;
import com.example.thumbgen_backend.service.Interfaces.StorageService;
import com.example.thumbgen_backend.util.IdentityStatus;
import com.example.thumbgen_backend.util.ImageDimensions;
import com.example.thumbgen_backend.util.OptimisticRetry;
import com.example.thumbgen_backend.util.WaitOutcome;
import com.example.thumbgen_backend.util.WaitPolicy;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Lifecycle of the per-user identity model: photo intake, training commit, status refresh, bounded wait,
 * photo deletion and reset.
 */
@Service
public class IdentityModelService {
    private static final Logger LOGGER = LoggerFactory.getLogger(IdentityModelService.class);

    static final Pattern TRIGGER_WORD = Pattern.compile("^TOK[a-z0-9]{5}$");
    private static final String TRIGGER_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";
    private static final int MAX_WRITE_ATTEMPTS = 3;

    private final AccountService accountService;
    private final IdentityModelRepository modelRepo;
    private final TrainingPhotoRepository photoRepo;
    private final StorageService storage;
    private final ImageGenerationProvider provider;
    private final IdentityTrainingLauncher launcher;
    private final IdentityProperties props;
    private final ReplicateProperties replicateProps;
    private final TransactionTemplate txTemplate;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public IdentityModelService(AccountService accountService,
                                IdentityModelRepository modelRepo,
                                TrainingPhotoRepository photoRepo,
                                StorageService storage,
                                ImageGenerationProvider provider,
                                IdentityTrainingLauncher launcher,
                                IdentityProperties props,
                                ReplicateProperties replicateProps,
                                TransactionTemplate txTemplate,
                                Clock clock) {
        this.accountService = accountService;
        this.modelRepo = modelRepo;
        this.photoRepo = photoRepo;
        this.storage = storage;
        this.provider = provider;
        this.launcher = launcher;
        this.props = props;
        this.replicateProps = replicateProps;
        this.txTemplate = txTemplate;
        this.clock = clock;
    }

    /**
     * Stores each file independently; one bad file never fails the others. Does not touch the model status.
     */
    public PhotoUploadResponse uploadPhotos(String ownerExternalSubject, List<MultipartFile> files) {
        if (files == null || files.isEmpty()) {
            throw ThumbnailException.invalid("NO_FILES");
        }
        if (files.size() > props.getMaxFilesPerRequest()) {
            throw ThumbnailException.invalid("TOO_MANY_FILES");
        }
        Account owner = accountService.ensureByExternalSubject(ownerExternalSubject, null);
        long photoCount = photoRepo.countByOwner_Id(owner.getId());

        List<PhotoUploadResponse.Result> results = new ArrayList<>(files.size());
        int uploaded = 0;
        int failed = 0;
        for (MultipartFile file : files) {
            PhotoUploadResponse.Result result = storeOne(owner, file, photoCount);
            if (result.isFailed()) {
                failed++;
            } else if ("uploaded".equals(result.status())) {
                uploaded++;
                photoCount++;
            }
            results.add(result);
        }
        LOGGER.info("IDENTITY upload owner={} total={} uploaded={} failed={} photoCount={}",
                owner.getId(), files.size(), uploaded, failed, photoCount);
        return new PhotoUploadResponse(files.size(), uploaded, failed, photoCount,
                props.getMinPhotos(), props.getMaxPhotosPerUser(), results);
    }

    PhotoUploadResponse.Result storeOne(Account owner, MultipartFile file, long photoCount) {
        String filename = file.getOriginalFilename() != null ? file.getOriginalFilename() : "file";
        String contentType = normalizeContentType(file.getContentType());
        if (contentType == null || !props.getAllowedContentTypes().contains(contentType)) {
            return PhotoUploadResponse.Result.failed(filename, "UNSUPPORTED_TYPE");
        }
        if (file.getSize() < 1) {
            return PhotoUploadResponse.Result.failed(filename, "EMPTY_FILE");
        }
        if (file.getSize() > props.getMaxBytes()) {
            return PhotoUploadResponse.Result.failed(filename, "FILE_TOO_LARGE");
        }

        byte[] bytes;
        Optional<ImageDimensions.Size> size;
        try {
            bytes = file.getBytes();
            size = ImageDimensions.read(bytes, contentType);
        } catch (IOException e) {
            LOGGER.warn("IDENTITY upload unreadable owner={} file={} reason={}", owner.getId(), filename, e.getMessage());
            return PhotoUploadResponse.Result.failed(filename, "UNREADABLE_IMAGE");
        }
        String sha = sha256(bytes);
        Optional<TrainingPhoto> existing = photoRepo.findByOwner_IdAndSha256(owner.getId(), sha);
        if (existing.isPresent()) {
            return PhotoUploadResponse.Result.duplicate(filename, existing.get().getId(), urlOf(existing.get()));
        }
        if (photoCount >= props.getMaxPhotosPerUser()) {
            return PhotoUploadResponse.Result.failed(filename, "PHOTO_LIMIT_REACHED");
        }
        if (size.isEmpty()) {
            return PhotoUploadResponse.Result.failed(filename, "UNREADABLE_IMAGE");
        }
        if (!size.get().atLeast(props.getMinDimension())) {
            return PhotoUploadResponse.Result.failed(filename, "IMAGE_TOO_SMALL");
        }

        TrainingPhoto photo;
        try {
            photo = photoRepo.save(new TrainingPhoto(owner, sha, contentType, bytes.length,
                    size.get().width(), size.get().height()));
        } catch (DataIntegrityViolationException e) {
            // same bytes uploaded concurrently
            return photoRepo.findByOwner_IdAndSha256(owner.getId(), sha)
                    .map(p -> PhotoUploadResponse.Result.duplicate(filename, p.getId(), urlOf(p)))
                    .orElseThrow(() -> e);
        }
        String key = "identity/original/%s/%s.%s".formatted(
                owner.getId(), photo.getId(), IdentityTrainingLauncher.extension(contentType));
        try {
            storage.put(key, bytes, contentType);
        } catch (StorageException e) {
            LOGGER.error("IDENTITY upload storage failed owner={} photoId={} reason={}", owner.getId(), photo.getId(), e.getMessage());
            photoRepo.delete(photo);
            return PhotoUploadResponse.Result.failed(filename, "STORAGE_FAILED");
        }
        photo.setStorageKey(key);
        photoRepo.save(photo);
        return PhotoUploadResponse.Result.uploaded(filename, photo.getId(), storage.publicUrl(key));
    }

    @Nullable
    private String urlOf(TrainingPhoto photo) {
        return photo.getStorageKey() == null ? null : storage.publicUrl(photo.getStorageKey());
    }

    static String normalizeContentType(@Nullable String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String ct = raw.split(";")[0].trim().toLowerCase(Locale.ROOT);
        return "image/jpg".equals(ct) ? "image/jpeg" : ct;
    }

    /**
     * none/failed/canceled -> pending, then hands the model to {@link IdentityTrainingLauncher}.
     *
     * @throws ThumbnailException CONFLICT while a training is pending or running, or when the model is ready;
     *                            INVALID_INPUT with fewer than the minimum photos.
     */
    public CommitTrainingResponse commit(String ownerExternalSubject) {
        Account owner = accountService.getByExternalSubjectOrThrow(ownerExternalSubject);
        expireIfStale(owner);
        CommitTrainingResponse response = txTemplate.execute(tx -> commitLocked(owner));
        launcher.launch(response.identityModelId());
        return response;
    }

    private CommitTrainingResponse commitLocked(Account owner) {
        IdentityModel model = modelRepo.lockByOwnerId(owner.getId())
                .orElseGet(() -> createModel(owner));
        if (model.getStatus().isInFlight()) {
            LOGGER.info("IDENTITY commit rejected, already {} modelId={}", model.getStatus(), model.getId());
            throw ThumbnailException.conflict("TRAINING_IN_PROGRESS");
        }
        if (!model.getStatus().canCommit()) {
            throw ThumbnailException.conflict("IDENTITY_ALREADY_READY");
        }
        long photoCount = photoRepo.countByOwner_Id(owner.getId());
        if (photoCount < props.getMinPhotos()) {
            throw ThumbnailException.invalid("NOT_ENOUGH_PHOTOS");
        }
        String modelOwner = replicateProps.getModelOwner();
        if (modelOwner == null || modelOwner.isBlank()) {
            LOGGER.error("IDENTITY commit impossible: replicate.model-owner not configured");
            throw ThumbnailException.external("IDENTITY_TRAINING_NOT_CONFIGURED");
        }

        IdentityStatus previous = model.getStatus();
        model.clearTrainingState();
        model.setCommittedAt(clock.instant());
        model.setTriggerWord(newTriggerWord());
        model.setProviderModelOwner(modelOwner.trim());
        model.setProviderModelName("user-" + UUID.randomUUID() + "-identity");
        model.setDatasetHash(datasetHash(photoRepo.findByOwner_IdOrderByStorageKeyAsc(owner.getId())));
        model.setStatus(IdentityStatus.PENDING);
        modelRepo.save(model);
        photoRepo.attachAllToModel(owner.getId(), model.getId());
        LOGGER.info("IDENTITY status modelId={} {} -> pending photos={} model={}/{}",
                model.getId(), previous, photoCount, model.getProviderModelOwner(), model.getProviderModelName());
        return new CommitTrainingResponse(model.getId(), "pending", photoCount);
    }

    private IdentityModel createModel(Account owner) {
        try {
            return modelRepo.saveAndFlush(new IdentityModel(owner));
        } catch (DataIntegrityViolationException e) {
            // a concurrent first commit created the row and holds it
            LOGGER.info("IDENTITY commit lost creation race owner={}", owner.getId());
            throw new ThumbnailException(ErrorKind.CONFLICT, "TRAINING_IN_PROGRESS", e);
        }
    }

    String newTriggerWord() {
        StringBuilder sb = new StringBuilder("TOK");
        for (int i = 0; i < 5; i++) {
            sb.append(TRIGGER_ALPHABET.charAt(random.nextInt(TRIGGER_ALPHABET.length())));
        }
        String word = sb.toString();
        if (!TRIGGER_WORD.matcher(word).matches()) {
            throw new IllegalStateException("generated trigger word is not safe: " + word);
        }
        return word;
    }

    static String datasetHash(List<TrainingPhoto> photos) {
        StringBuilder keys = new StringBuilder();
        photos.stream()
                .map(TrainingPhoto::getStorageKey)
                .filter(k -> k != null)
                .sorted()
                .forEach(k -> keys.append(k).append('\n'));
        return sha256(keys.toString().getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Current status; while training, asks the provider first. A model stuck past its timeout is failed.
     */
    public IdentityStatusResponse refresh(String ownerExternalSubject) {
        Account owner = accountService.getByExternalSubjectOrThrow(ownerExternalSubject);
        long photoCount = photoRepo.countByOwner_Id(owner.getId());
        Optional<IdentityModel> found = modelRepo.findByOwner_Id(owner.getId());
        if (found.isEmpty()) {
            return IdentityStatusResponse.none(photoCount);
        }
        return IdentityStatusResponse.from(reconcile(found.get()), photoCount);
    }

    /**
     * Polls the provider for a training model, then fails it when it has been pending or training longer than
     * allowed. A provider error leaves the stored status to the timeout.
     */
    public IdentityModel reconcile(IdentityModel model) {
        IdentityModel current = model;
        if (current.getStatus() == IdentityStatus.TRAINING && current.getTrainingId() != null) {
            try {
                ImageGenerationProvider.Training training = provider.getTraining(current.getTrainingId());
                current = applyTraining(current.getId(), training.status(), training.output(), training.error());
            } catch (ProviderException e) {
                LOGGER.warn("IDENTITY status poll failed modelId={} trainingId={} status={} reason={}",
                        current.getId(), current.getTrainingId(), e.getStatusCode(), e.getMessage());
            }
        }
        if (isStale(current)) {
            UUID modelId = current.getId();
            current = OptimisticRetry.run("IDENTITY expire modelId=" + modelId, MAX_WRITE_ATTEMPTS, () -> expire(modelId));
        }
        return current;
    }

    boolean isStale(IdentityModel m) {
        Instant now = clock.instant();
        return switch (m.getStatus()) {
            case PENDING -> olderThan(firstNonNull(m.getCommittedAt(), m.getUpdatedAt()), now, props.getPendingTimeout());
            case TRAINING -> olderThan(firstNonNull(m.getTrainingStartedAt(), m.getCommittedAt()), now, props.getTrainingTimeout());
            default -> false;
        };
    }

    private static boolean olderThan(@Nullable Instant since, Instant now, Duration timeout) {
        return since != null && since.plus(timeout).isBefore(now);
    }

    private static Instant firstNonNull(@Nullable Instant a, @Nullable Instant b) {
        return a != null ? a : b;
    }

    private void expireIfStale(Account owner) {
        modelRepo.findByOwner_Id(owner.getId())
                .filter(this::isStale)
                .ifPresent(m -> OptimisticRetry.run("IDENTITY expire modelId=" + m.getId(), MAX_WRITE_ATTEMPTS,
                        () -> expire(m.getId())));
    }

    private IdentityModel expire(UUID modelId) {
        return txTemplate.execute(tx -> {
            IdentityModel m = modelRepo.findById(modelId)
                    .orElseThrow(() -> ThumbnailException.notFound("IDENTITY_MODEL_NOT_FOUND"));
            if (!isStale(m)) {
                return m;
            }
            IdentityStatus previous = m.getStatus();
            m.setStatus(IdentityStatus.FAILED);
            m.setErrorMessage("training timed out");
            m.setTrainingCompletedAt(clock.instant());
            LOGGER.warn("IDENTITY status modelId={} {} -> failed, timed out committedAt={} trainingId={}",
                    modelId, previous, m.getCommittedAt(), m.getTrainingId());
            return modelRepo.save(m);
        });
    }

    /** Training webhook entry point. */
    public IdentityModel handleTrainingUpdate(String trainingId, String status, @Nullable JsonNode output, @Nullable String error) {
        IdentityModel model = modelRepo.findByTrainingId(trainingId)
                .orElseThrow(() -> ThumbnailException.notFound("TRAINING_NOT_FOUND"));
        return applyTraining(model.getId(), status, output, error);
    }

    /**
     * Applies a provider training status. Only a model that is still pending or training can move; terminal
     * states are final until reset or a new commit.
     */
    IdentityModel applyTraining(UUID modelId, String providerStatus, @Nullable JsonNode output, @Nullable String error) {
        return txTemplate.execute(tx -> {
            IdentityModel m = modelRepo.findById(modelId)
                    .orElseThrow(() -> ThumbnailException.notFound("IDENTITY_MODEL_NOT_FOUND"));
            if (!m.getStatus().isInFlight()) {
                return m;
            }
            IdentityStatus previous = m.getStatus();
            String status = providerStatus == null ? "" : providerStatus.trim().toLowerCase(Locale.ROOT);
            switch (status) {
                case "succeeded" -> {
                    m.setStatus(IdentityStatus.READY);
                    m.setModelVersionRef(text(output, "version"));
                    m.setWeightsRef(text(output, "weights"));
                    m.setErrorMessage(null);
                    if (m.getWeightsRef() == null) {
                        LOGGER.warn("IDENTITY training succeeded without weights modelId={}", modelId);
                    }
                }
                case "failed" -> {
                    m.setStatus(IdentityStatus.FAILED);
                    m.setErrorMessage(error != null && !error.isBlank() ? error : "training failed");
                }
                case "canceled" -> {
                    m.setStatus(IdentityStatus.CANCELED);
                    m.setErrorMessage(error != null && !error.isBlank() ? error : "training canceled");
                }
                default -> {
                    return m;
                }
            }
            m.setTrainingCompletedAt(clock.instant());
            LOGGER.info("IDENTITY status modelId={} {} -> {}", modelId, previous, m.getStatus());
            return modelRepo.save(m);
        });
    }

    private static String text(@Nullable JsonNode output, String field) {
        if (output == null || !output.hasNonNull(field)) {
            return null;
        }
        String value = output.get(field).asText();
        return value.isBlank() ? null : value;
    }

    public AwaitTrainingResponse awaitReady(String ownerExternalSubject) {
        return awaitReady(ownerExternalSubject,
                new WaitPolicy(props.getWait().getMaxAttempts(), props.getWait().getInterval()),
                WaitPolicy.Sleeper.THREAD);
    }

    /**
     * Refreshes until the model leaves pending/training or the policy runs out. Never waits longer than
     * {@link WaitPolicy#maxWait()}.
     */
    public AwaitTrainingResponse awaitReady(String ownerExternalSubject, WaitPolicy policy, WaitPolicy.Sleeper sleeper) {
        IdentityStatusResponse last = null;
        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            last = refresh(ownerExternalSubject);
            WaitOutcome outcome = switch (last.status()) {
                case "ready" -> WaitOutcome.READY;
                case "failed" -> WaitOutcome.FAILED;
                case "canceled" -> WaitOutcome.CANCELED;
                case "none" -> throw ThumbnailException.invalid("NO_TRAINING_IN_PROGRESS");
                default -> null;
            };
            if (outcome != null) {
                return new AwaitTrainingResponse(outcome.name().toLowerCase(Locale.ROOT), attempt, last);
            }
            if (attempt < policy.maxAttempts()) {
                try {
                    sleeper.sleep(policy.interval());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    LOGGER.warn("IDENTITY wait interrupted attempt={}", attempt);
                    return new AwaitTrainingResponse(timedOut(), attempt, last);
                }
            }
        }
        LOGGER.info("IDENTITY wait timed out attempts={} status={}", policy.maxAttempts(), last.status());
        return new AwaitTrainingResponse(timedOut(), policy.maxAttempts(), last);
    }

    private static String timedOut() {
        return WaitOutcome.TIMED_OUT.name().toLowerCase(Locale.ROOT);
    }

    public void deletePhoto(String ownerExternalSubject, UUID photoId) {
        Account owner = accountService.getByExternalSubjectOrThrow(ownerExternalSubject);
        TrainingPhoto photo = photoRepo.findByIdAndOwner_Id(photoId, owner.getId())
                .orElseThrow(() -> ThumbnailException.notFound("PHOTO_NOT_FOUND"));
        expireIfStale(owner);
        modelRepo.findByOwner_Id(owner.getId()).ifPresent(m -> {
            if (m.getStatus().isInFlight()) {
                throw ThumbnailException.conflict("PHOTO_LOCKED_DURING_TRAINING");
            }
        });
        photoRepo.delete(photo);
        deleteObject(photo.getStorageKey());
        LOGGER.info("IDENTITY photo deleted owner={} photoId={}", owner.getId(), photoId);
    }

    /**
     * ready/failed/canceled -> none. Optionally deletes every photo of the owner. The remote model is removed
     * best effort after the local state is committed.
     */
    public ResetIdentityResponse reset(String ownerExternalSubject, boolean cascadePhotos) {
        Account owner = accountService.getByExternalSubjectOrThrow(ownerExternalSubject);
        expireIfStale(owner);
        ResetOutcome outcome = txTemplate.execute(tx -> resetLocked(owner, cascadePhotos));

        if (outcome.remoteOwner() != null && outcome.remoteName() != null) {
            try {
                provider.deleteModel(outcome.remoteOwner(), outcome.remoteName());
            } catch (ProviderException e) {
                LOGGER.warn("IDENTITY remote model delete failed model={}/{} status={} reason={}",
                        outcome.remoteOwner(), outcome.remoteName(), e.getStatusCode(), e.getMessage());
            }
        }
        outcome.storageKeys().forEach(this::deleteObject);
        LOGGER.info("IDENTITY reset owner={} cascade={} deletedPhotos={}", owner.getId(), cascadePhotos, outcome.storageKeys().size());
        return new ResetIdentityResponse("none", outcome.deletedPhotos());
    }

    private record ResetOutcome(String remoteOwner, String remoteName, List<String> storageKeys, int deletedPhotos) {
    }

    private ResetOutcome resetLocked(Account owner, boolean cascadePhotos) {
        String remoteOwner = null;
        String remoteName = null;
        Optional<IdentityModel> locked = modelRepo.lockByOwnerId(owner.getId());
        if (locked.isPresent()) {
            IdentityModel model = locked.get();
            if (model.getStatus().isInFlight()) {
                throw ThumbnailException.conflict("TRAINING_IN_PROGRESS");
            }
            if (model.getTrainingId() != null) {
                remoteOwner = model.getProviderModelOwner();
                remoteName = model.getProviderModelName();
            }
            IdentityStatus previous = model.getStatus();
            model.clearTrainingState();
            model.setProviderModelOwner(null);
            model.setProviderModelName(null);
            model.setStatus(IdentityStatus.NONE);
            modelRepo.save(model);
            photoRepo.detachFromModel(model.getId());
            LOGGER.info("IDENTITY status modelId={} {} -> none", model.getId(), previous);
        }
        List<String> keys = new ArrayList<>();
        int deleted = 0;
        if (cascadePhotos) {
            List<TrainingPhoto> photos = photoRepo.findByOwner_IdOrderByStorageKeyAsc(owner.getId());
            for (TrainingPhoto p : photos) {
                if (p.getStorageKey() != null) {
                    keys.add(p.getStorageKey());
                }
            }
            photoRepo.deleteAll(photos);
            deleted = photos.size();
        }
        return new ResetOutcome(remoteOwner, remoteName, keys, deleted);
    }

    private void deleteObject(@Nullable String key) {
        if (key == null) {
            return;
        }
        try {
            storage.delete(key);
        } catch (StorageException e) {
            LOGGER.warn("IDENTITY storage delete failed key={} reason={}", key, e.getMessage());
        }
    }

    static String sha256(byte[] bytes) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
