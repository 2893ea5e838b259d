package com.example.thumbgen_backend.controller;

import com.example.thumbgen_backend.dto.AwaitTrainingResponse;
import com.example.thumbgen_backend.dto.CommitTrainingResponse;
import com.example.thumbgen_backend.dto.IdentityStatusResponse;
import com.example.thumbgen_backend.dto.OwnerRequest;
import com.example.thumbgen_backend.dto.PhotoUploadResponse;
import com.example.thumbgen_backend.dto.ResetIdentityResponse;
import com.example.thumbgen_backend.service.IdentityModelService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/v1/identity")
public class IdentityController {
    private final IdentityModelService identityService;

    public IdentityController(IdentityModelService identityService) {
        this.identityService = identityService;
    }

    @Operation(summary = "Upload training photos; each file succeeds or fails on its own")
    @PostMapping(value = "/photos", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public PhotoUploadResponse upload(@RequestParam("ownerExternalSubject") String ownerExternalSubject,
                                      @RequestPart("file") List<MultipartFile> files) {
        return identityService.uploadPhotos(ownerExternalSubject, files);
    }

    @Operation(summary = "Delete one training photo")
    @ApiResponse(responseCode = "409", description = "A training is pending or running")
    @DeleteMapping("/photos/{photoId}")
    public ResponseEntity<Void> deletePhoto(@PathVariable UUID photoId,
                                            @RequestParam("ownerExternalSubject") String ownerExternalSubject) {
        identityService.deletePhoto(ownerExternalSubject, photoId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Start training the identity model")
    @ApiResponse(responseCode = "202", description = "Training accepted")
    @ApiResponse(responseCode = "400", description = "Not enough photos")
    @ApiResponse(responseCode = "409", description = "Training already pending or running")
    @PostMapping("/commit")
    public ResponseEntity<CommitTrainingResponse> commit(@Valid @RequestBody OwnerRequest request) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(identityService.commit(request.ownerExternalSubject()));
    }

    @Operation(summary = "Current identity status, refreshed from the provider while training")
    @GetMapping("/status")
    public IdentityStatusResponse status(@RequestParam("ownerExternalSubject") String ownerExternalSubject) {
        return identityService.refresh(ownerExternalSubject);
    }

    @Operation(summary = "Wait, bounded, until the training leaves pending/training")
    @PostMapping("/await")
    public AwaitTrainingResponse await(@Valid @RequestBody OwnerRequest request) {
        return identityService.awaitReady(request.ownerExternalSubject());
    }

    @Operation(summary = "Reset the identity model to none, optionally deleting all photos")
    @ApiResponse(responseCode = "409", description = "A training is pending or running")
    @PostMapping("/reset")
    public ResetIdentityResponse reset(@RequestParam("ownerExternalSubject") String ownerExternalSubject,
                                       @RequestParam(value = "cascadePhotos", defaultValue = "false") boolean cascadePhotos) {
        return identityService.reset(ownerExternalSubject, cascadePhotos);
    }
}
