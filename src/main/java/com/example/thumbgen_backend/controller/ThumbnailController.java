package com.example.thumbgen_backend.controller;

import com.example.thumbgen_backend.dto.CreateVariationRequest;
import com.example.thumbgen_backend.dto.GenerateThumbnailRequest;
import com.example.thumbgen_backend.dto.GenerateThumbnailResponse;
import com.example.thumbgen_backend.dto.ThumbnailJobResponse;
import com.example.thumbgen_backend.dto.VariationResponse;
import com.example.thumbgen_backend.service.GenerationDispatcher;
import com.example.thumbgen_backend.service.Img2ImgVariationDispatcher;
import com.example.thumbgen_backend.service.ThumbnailJobService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Thumbnail generation endpoints. Generation is asynchronous: callers poll the job until it is terminal.
 */
@RestController
@RequestMapping("/v1/thumbnails")
public class ThumbnailController {
    private final GenerationDispatcher generationDispatcher;
    private final Img2ImgVariationDispatcher variationDispatcher;
    private final ThumbnailJobService jobService;

    public ThumbnailController(GenerationDispatcher generationDispatcher,
                               Img2ImgVariationDispatcher variationDispatcher,
                               ThumbnailJobService jobService) {
        this.generationDispatcher = generationDispatcher;
        this.variationDispatcher = variationDispatcher;
        this.jobService = jobService;
    }

    @Operation(summary = "Compose prompts and start one prediction per requested variant")
    @ApiResponse(responseCode = "202", description = "Job created, predictions dispatched")
    @ApiResponse(responseCode = "400", description = "Invalid style, prompt, variant count or identity combination")
    @ApiResponse(responseCode = "404", description = "Owner or identity model not found")
    @ApiResponse(responseCode = "502", description = "Style model unavailable or no prediction could be started")
    @PostMapping("/generate")
    public ResponseEntity<GenerateThumbnailResponse> generate(@Valid @RequestBody GenerateThumbnailRequest request) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(generationDispatcher.generate(request));
    }

    @Operation(summary = "Derive an img2img variation from an image of a succeeded job")
    @ApiResponse(responseCode = "202", description = "Variation job created")
    @ApiResponse(responseCode = "403", description = "Image is not an output or export of the parent job")
    @ApiResponse(responseCode = "404", description = "Parent job not found for this owner")
    @PostMapping("/variations")
    public ResponseEntity<VariationResponse> createVariation(@Valid @RequestBody CreateVariationRequest request) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(variationDispatcher.createVariation(request));
    }

    @Operation(summary = "Get a job, reconciling running predictions with the provider first")
    @GetMapping("/jobs/{jobId}")
    public ThumbnailJobResponse getJob(@PathVariable UUID jobId,
                                       @RequestParam("ownerExternalSubject") String ownerExternalSubject) {
        return jobService.getJob(ownerExternalSubject, jobId);
    }
}
