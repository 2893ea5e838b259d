package com.example.thumbgen_backend.controller;

import com.example.thumbgen_backend.exception.ThumbnailException;
import com.example.thumbgen_backend.model.Account;
import com.example.thumbgen_backend.model.IdentityModel;
import com.example.thumbgen_backend.service.IdentityModelService;
import com.example.thumbgen_backend.service.PredictionReconciler;
import com.example.thumbgen_backend.service.WebhookSignatureVerifier;
import com.example.thumbgen_backend.util.IdentityStatus;
import com.example.thumbgen_backend.util.JobStatus;
import com.example.thumbgen_backend.util.PredictionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = ProviderWebhookController.class)
@AutoConfigureMockMvc(addFilters = false)
class ProviderWebhookControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private PredictionReconciler reconciler;

    @MockitoBean
    private IdentityModelService identityService;

    @MockitoBean
    private WebhookSignatureVerifier verifier;

    @BeforeEach
    void setup() {
        when(verifier.verify(any(), any(), any(), any())).thenReturn(true);
    }

    @Test
    void succeededPredictionIsApplied() throws Exception {
        when(reconciler.applyUpdate(eq("pred-1"), eq(PredictionStatus.SUCCEEDED), any(), isNull()))
                .thenReturn(JobStatus.SUCCEEDED);

        mockMvc.perform(post("/v1/webhooks/replicate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":\"pred-1\",\"status\":\"succeeded\",\"output\":[\"https://cdn/a.png\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.externalId").value("pred-1"))
                .andExpect(jsonPath("$.jobStatus").value("succeeded"));
    }

    @Test
    void invalidSignatureIsUnauthorized() throws Exception {
        when(verifier.verify(any(), any(), any(), any())).thenReturn(false);

        mockMvc.perform(post("/v1/webhooks/replicate")
                        .header("webhook-id", "msg_1")
                        .header("webhook-timestamp", "1700000000")
                        .header("webhook-signature", "v1,forged")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":\"pred-1\",\"status\":\"succeeded\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(status().reason("INVALID_WEBHOOK_SIGNATURE"));
        verify(reconciler, never()).applyUpdate(anyString(), any(), any(), any());
    }

    @Test
    void malformedPayloadsAreBadRequests() throws Exception {
        mockMvc.perform(post("/v1/webhooks/replicate").contentType(MediaType.APPLICATION_JSON).content("not json"))
                .andExpect(status().isBadRequest())
                .andExpect(status().reason("INVALID_WEBHOOK_PAYLOAD"));
        mockMvc.perform(post("/v1/webhooks/replicate").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"succeeded\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(status().reason("WEBHOOK_ID_REQUIRED"));
        mockMvc.perform(post("/v1/webhooks/replicate").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":\"pred-1\",\"status\":\"exploded\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(status().reason("INVALID_WEBHOOK_STATUS"));
    }

    @Test
    void unknownPredictionIsNotFound() throws Exception {
        when(reconciler.applyUpdate(eq("ghost"), any(), any(), any()))
                .thenThrow(ThumbnailException.notFound("PREDICTION_NOT_FOUND"));

        mockMvc.perform(post("/v1/webhooks/replicate").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":\"ghost\",\"status\":\"failed\",\"error\":\"oom\"}"))
                .andExpect(status().isNotFound());
    }

    @Test
    void concurrentWriteIsRetried() throws Exception {
        when(reconciler.applyUpdate(eq("pred-1"), eq(PredictionStatus.FAILED), any(), eq("oom")))
                .thenThrow(new OptimisticLockingFailureException("stale"))
                .thenReturn(JobStatus.FAILED);

        mockMvc.perform(post("/v1/webhooks/replicate").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":\"pred-1\",\"status\":\"failed\",\"error\":\"oom\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.jobStatus").value("failed"));
        verify(reconciler, times(2)).applyUpdate(eq("pred-1"), eq(PredictionStatus.FAILED), any(), eq("oom"));
    }

    @Test
    void trainingCallbackUpdatesIdentity() throws Exception {
        IdentityModel model = new IdentityModel(new Account("user-1", "User"));
        model.setStatus(IdentityStatus.READY);
        when(identityService.handleTrainingUpdate(eq("tr-1"), eq("succeeded"), any(), isNull())).thenReturn(model);

        mockMvc.perform(post("/v1/webhooks/replicate/training").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":\"tr-1\",\"status\":\"succeeded\",\"output\":{\"weights\":\"https://w\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.trainingId").value("tr-1"))
                .andExpect(jsonPath("$.identityStatus").value("ready"));
    }
}
