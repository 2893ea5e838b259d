package com.example.thumbgen_backend.service;

import com.example.thumbgen_backend.config.IdentityProperties;
import com.example.thumbgen_backend.model.IdentityModel;
import com.example.thumbgen_backend.repository.IdentityModelRepository;
import com.example.thumbgen_backend.util.IdentityStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Fails identity models left pending or training past their timeout, e.g. after a restart lost the launch task.
 */
@Component
public class IdentityTrainingSweeper {
    private static final Logger LOGGER = LoggerFactory.getLogger(IdentityTrainingSweeper.class);

    private final IdentityModelRepository modelRepo;
    private final IdentityModelService identityService;
    private final IdentityProperties properties;
    private final Clock clock;

    public IdentityTrainingSweeper(IdentityModelRepository modelRepo,
                                   IdentityModelService identityService,
                                   IdentityProperties properties,
                                   Clock clock) {
        this.modelRepo = modelRepo;
        this.identityService = identityService;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${identity.sweeper-delay-ms:60000}")
    public void tick() {
        sweep();
    }

    /** @return number of models that left pending/training. */
    public int sweep() {
        Instant now = clock.instant();
        PageRequest page = PageRequest.of(0, properties.getSweeperBatchSize());
        List<IdentityModel> candidates = new ArrayList<>(modelRepo.findByStatusAndCommittedAtBeforeOrderByCommittedAtAsc(
                IdentityStatus.PENDING, now.minus(properties.getPendingTimeout()), page));
        candidates.addAll(modelRepo.findByStatusAndTrainingStartedAtBeforeOrderByTrainingStartedAtAsc(
                IdentityStatus.TRAINING, now.minus(properties.getTrainingTimeout()), page));
        if (candidates.isEmpty()) {
            LOGGER.debug("IDENTITY sweep no stale models");
            return 0;
        }
        int settled = 0;
        for (IdentityModel model : candidates) {
            try {
                if (!identityService.reconcile(model).getStatus().isInFlight()) {
                    settled++;
                }
            } catch (RuntimeException e) {
                LOGGER.error("IDENTITY sweep failed modelId={} reason={}", model.getId(), e.toString(), e);
            }
        }
        LOGGER.info("IDENTITY sweep done candidates={} settled={}", candidates.size(), settled);
        return settled;
    }
}
