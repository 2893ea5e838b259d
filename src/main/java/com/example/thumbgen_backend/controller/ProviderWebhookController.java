package com.example.thumbgen_backend.controller;

import com.example.thumbgen_backend.model.IdentityModel;
import com.example.thumbgen_backend.service.IdentityModelService;
import com.example.thumbgen_backend.service.PredictionReconciler;
import com.example.thumbgen_backend.service.WebhookSignatureVerifier;
import com.example.thumbgen_backend.util.JobStatus;
import com.example.thumbgen_backend.util.OptimisticRetry;
import com.example.thumbgen_backend.util.PredictionStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.Locale;
import java.util.Map;

/**
 * Inbound provider callbacks. The body is read raw so the signature is checked over the exact bytes sent.
 */
@RestController
@RequestMapping("/v1/webhooks")
public class ProviderWebhookController {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProviderWebhookController.class);
    static final int MAX_WRITE_ATTEMPTS = 3;

    private final PredictionReconciler reconciler;
    private final IdentityModelService identityService;
    private final WebhookSignatureVerifier verifier;
    private final ObjectMapper objectMapper;

    public ProviderWebhookController(PredictionReconciler reconciler,
                                     IdentityModelService identityService,
                                     WebhookSignatureVerifier verifier,
                                     ObjectMapper objectMapper) {
        this.reconciler = reconciler;
        this.identityService = identityService;
        this.verifier = verifier;
        this.objectMapper = objectMapper;
    }

    @Operation(summary = "Prediction completion callback")
    @ApiResponse(responseCode = "200", description = "Applied, or ignored because the prediction is already terminal")
    @ApiResponse(responseCode = "401", description = "Signature missing or invalid")
    @ApiResponse(responseCode = "404", description = "Unknown prediction id")
    @PostMapping("/replicate")
    public Map<String, Object> prediction(@RequestHeader(value = "webhook-id", required = false) String webhookId,
                                          @RequestHeader(value = "webhook-timestamp", required = false) String timestamp,
                                          @RequestHeader(value = "webhook-signature", required = false) String signature,
                                          @RequestBody String body) {
        JsonNode payload = authenticate(webhookId, timestamp, signature, body);
        String externalId = requireText(payload, "id");
        PredictionStatus status = parseStatus(payload);
        JsonNode output = payload.get("output");
        String error = errorText(payload);

        LOGGER.info("WEBHOOK prediction externalId={} status={}", externalId, status);
        JobStatus jobStatus = OptimisticRetry.run("WEBHOOK externalId=" + externalId, MAX_WRITE_ATTEMPTS,
                () -> reconciler.applyUpdate(externalId, status, output, error));
        return Map.of("externalId", externalId, "jobStatus", jobStatus.name().toLowerCase(Locale.ROOT));
    }

    @Operation(summary = "Identity training completion callback")
    @PostMapping("/replicate/training")
    public Map<String, Object> training(@RequestHeader(value = "webhook-id", required = false) String webhookId,
                                        @RequestHeader(value = "webhook-timestamp", required = false) String timestamp,
                                        @RequestHeader(value = "webhook-signature", required = false) String signature,
                                        @RequestBody String body) {
        JsonNode payload = authenticate(webhookId, timestamp, signature, body);
        String trainingId = requireText(payload, "id");
        String status = requireText(payload, "status");

        LOGGER.info("WEBHOOK training trainingId={} status={}", trainingId, status);
        IdentityModel model = identityService.handleTrainingUpdate(trainingId, status, payload.get("output"), errorText(payload));
        return Map.of("trainingId", trainingId, "identityStatus", model.getStatus().name().toLowerCase(Locale.ROOT));
    }

    private JsonNode authenticate(String webhookId, String timestamp, String signature, String body) {
        if (!verifier.verify(webhookId, timestamp, signature, body)) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "INVALID_WEBHOOK_SIGNATURE");
        }
        try {
            JsonNode payload = objectMapper.readTree(body);
            if (payload == null || !payload.isObject()) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "INVALID_WEBHOOK_PAYLOAD");
            }
            return payload;
        } catch (JsonProcessingException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "INVALID_WEBHOOK_PAYLOAD", e);
        }
    }

    private static String requireText(JsonNode payload, String field) {
        String value = payload.path(field).asText("");
        if (value.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "WEBHOOK_" + field.toUpperCase(Locale.ROOT) + "_REQUIRED");
        }
        return value;
    }

    private static PredictionStatus parseStatus(JsonNode payload) {
        try {
            return PredictionStatus.fromProvider(payload.path("status").asText(null));
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "INVALID_WEBHOOK_STATUS", e);
        }
    }

    private static String errorText(JsonNode payload) {
        JsonNode error = payload.get("error");
        if (error == null || error.isNull()) {
            return null;
        }
        return error.isTextual() ? error.asText() : error.toString();
    }
}
