package com.example.thumbgen_backend.engine;

import com.example.thumbgen_backend.config.ReplicateProperties;
import com.example.thumbgen_backend.engine.Interfaces.ImageGenerationProvider;
import com.example.thumbgen_backend.exception.ProviderException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Replicate HTTP API adapter. Maps raw responses to port records; holds no business rules.
 */
@Service
public class ReplicateImageProvider implements ImageGenerationProvider {
    private static final Logger LOGGER = LoggerFactory.getLogger(ReplicateImageProvider.class);
    private static final List<String> COMPLETED_ONLY = List.of("completed");

    private final WebClient client;
    private final ReplicateProperties props;

    public ReplicateImageProvider(@Qualifier("replicateWebClient") WebClient client, ReplicateProperties props) {
        this.client = client;
        this.props = props;
    }

    @Override
    public Prediction createPrediction(PredictionRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("version", request.version());
        body.put("input", request.input());
        if (request.webhookUrl() != null) {
            body.put("webhook", request.webhookUrl());
            body.put("webhook_events_filter", COMPLETED_ONLY);
        }
        LOGGER.info("Replicate createPrediction version={} inputKeys={}", abbreviate(request.version(), 20), request.input().keySet());
        JsonNode raw = block(client.post()
                .uri("/predictions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, ReplicateImageProvider::toProviderException)
                .bodyToMono(JsonNode.class), "createPrediction");
        return mapPrediction(raw);
    }

    @Override
    public Prediction getPrediction(String predictionId) {
        JsonNode raw = block(client.get()
                .uri("/predictions/{id}", predictionId)
                .retrieve()
                .onStatus(HttpStatusCode::isError, ReplicateImageProvider::toProviderException)
                .bodyToMono(JsonNode.class), "getPrediction");
        return mapPrediction(raw);
    }

    @Override
    public VersionCheck verifyModelVersion(String owner, String name, String version) {
        try {
            block(client.get()
                    .uri("/models/{owner}/{name}/versions/{version}", owner, name, version)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, ReplicateImageProvider::toProviderException)
                    .bodyToMono(JsonNode.class), "verifyModelVersion");
            return VersionCheck.ok();
        } catch (ProviderException e) {
            if (e.isNotFound()) {
                return VersionCheck.invalid("Model version not found: %s/%s@%s".formatted(owner, name, version));
            }
            if (e.isUnauthorized()) {
                return VersionCheck.invalid("Not authorized to access model: %s/%s".formatted(owner, name));
            }
            return VersionCheck.invalid("Cannot verify model (Replicate error): " + e.getMessage());
        }
    }

    @Override
    public Training createTraining(TrainingRequest request) {
        String[] trainer = parseTrainerVersion(request.trainerVersion());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("destination", request.destination());
        body.put("input", request.input());
        if (request.webhookUrl() != null) {
            body.put("webhook", request.webhookUrl());
            body.put("webhook_events_filter", COMPLETED_ONLY);
        }
        LOGGER.info("Replicate createTraining trainer={}/{} destination={} inputKeys={}",
                trainer[0], trainer[1], request.destination(), request.input().keySet());
        JsonNode raw = block(client.post()
                .uri("/models/{owner}/{name}/versions/{version}/trainings", trainer[0], trainer[1], trainer[2])
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, ReplicateImageProvider::toProviderException)
                .bodyToMono(JsonNode.class), "createTraining");
        return mapTraining(raw);
    }

    @Override
    public Training getTraining(String trainingId) {
        JsonNode raw = block(client.get()
                .uri("/trainings/{id}", trainingId)
                .retrieve()
                .onStatus(HttpStatusCode::isError, ReplicateImageProvider::toProviderException)
                .bodyToMono(JsonNode.class), "getTraining");
        return mapTraining(raw);
    }

    @Override
    public UploadedFile uploadFile(String filename, String contentType, byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new IllegalArgumentException("Cannot upload empty file");
        }
        MultipartBodyBuilder multipart = new MultipartBodyBuilder();
        multipart.part("content", new ByteArrayResource(bytes) {
            @Override
            public String getFilename() {
                return filename;
            }
        }).filename(filename).contentType(MediaType.parseMediaType(contentType));

        LOGGER.info("Replicate uploadFile filename={} size={} contentType={}", filename, bytes.length, contentType);
        JsonNode raw = block(client.post()
                .uri("/files")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(multipart.build()))
                .retrieve()
                .onStatus(HttpStatusCode::isError, ReplicateImageProvider::toProviderException)
                .bodyToMono(JsonNode.class), "uploadFile");
        String url = raw.path("urls").path("get").asText(null);
        if (url == null) {
            throw new ProviderException("Replicate file upload returned no url", -1);
        }
        return new UploadedFile(raw.path("id").asText(null), url);
    }

    @Override
    public void createModel(String owner, String name, String description) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("owner", owner);
        body.put("name", name);
        body.put("description", description);
        body.put("visibility", "private");
        body.put("hardware", "gpu-t4");
        block(client.post()
                .uri("/models")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, ReplicateImageProvider::toProviderException)
                .bodyToMono(JsonNode.class), "createModel");
        LOGGER.info("Replicate model created {}/{}", owner, name);
    }

    @Override
    public void deleteModel(String owner, String name) {
        block(client.delete()
                .uri("/models/{owner}/{name}", owner, name)
                .retrieve()
                .onStatus(HttpStatusCode::isError, ReplicateImageProvider::toProviderException)
                .toBodilessEntity(), "deleteModel");
        LOGGER.info("Replicate model deleted {}/{}", owner, name);
    }

    private <T> T block(Mono<T> mono, String operation) {
        try {
            return mono.block(Duration.ofSeconds(props.getBlockTimeoutSeconds()));
        } catch (ProviderException e) {
            LOGGER.error("Replicate {} failed status={} message={}", operation, e.getStatusCode(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            LOGGER.error("Replicate {} failed without response: {}", operation, e.getMessage());
            throw new ProviderException("Replicate " + operation + " failed: " + e.getMessage(), e);
        }
    }

    private static Mono<? extends Throwable> toProviderException(ClientResponse response) {
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> new ProviderException("Replicate API error %d: %s".formatted(status, abbreviate(body, 500)), status));
    }

    static String[] parseTrainerVersion(String trainerVersion) {
        if (trainerVersion == null || !trainerVersion.contains(":") || !trainerVersion.contains("/")) {
            throw new IllegalArgumentException("Trainer version must be owner/model:version but was " + trainerVersion);
        }
        int colon = trainerVersion.indexOf(':');
        String modelRef = trainerVersion.substring(0, colon);
        int slash = modelRef.indexOf('/');
        return new String[]{modelRef.substring(0, slash), modelRef.substring(slash + 1), trainerVersion.substring(colon + 1)};
    }

    private static Prediction mapPrediction(JsonNode raw) {
        if (raw == null) {
            throw new ProviderException("Empty prediction response", -1);
        }
        return new Prediction(text(raw, "id"), text(raw, "status"), nonNull(raw.get("output")), text(raw, "error"));
    }

    private static Training mapTraining(JsonNode raw) {
        if (raw == null) {
            throw new ProviderException("Empty training response", -1);
        }
        return new Training(text(raw, "id"), text(raw, "status"), nonNull(raw.get("output")), text(raw, "error"));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static JsonNode nonNull(JsonNode node) {
        return node == null || node.isNull() ? null : node;
    }

    private static String abbreviate(String value, int max) {
        if (value == null) return "";
        return value.length() <= max ? value : value.substring(0, max) + "...";
    }
}
