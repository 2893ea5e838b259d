package com.example.thumbgen_backend.controller;

import com.example.thumbgen_backend.exception.ErrorKind;
import com.example.thumbgen_backend.exception.StorageException;
import com.example.thumbgen_backend.exception.ThumbnailException;
import com.example.thumbgen_backend.service.Interfaces.StorageService;
import io.swagger.v3.oas.annotations.Operation;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Serves stored objects under the URLs produced by {@link StorageService#publicUrl(String)}.
 */
@RestController
@RequestMapping("/v1/files")
public class FileController {
    private static final String PREFIX = "/v1/files/";

    private final StorageService storage;

    public FileController(StorageService storage) {
        this.storage = storage;
    }

    @Operation(summary = "Download a stored object")
    @GetMapping(value = "/**", produces = MediaType.ALL_VALUE)
    public ResponseEntity<byte[]> get(HttpServletRequest req) {
        String objectKey = extractTail(req);
        if (objectKey.isBlank()) {
            throw ThumbnailException.invalid("OBJECT_KEY_REQUIRED");
        }
        byte[] bytes;
        try {
            bytes = storage.get(objectKey);
        } catch (StorageException e) {
            throw new ThumbnailException(ErrorKind.NOT_FOUND, "OBJECT_NOT_FOUND", e);
        }
        return ResponseEntity.ok()
                .contentType(MediaTypeFactory.getMediaType(objectKey).orElse(MediaType.APPLICATION_OCTET_STREAM))
                .cacheControl(CacheControl.maxAge(Duration.ofHours(1)).cachePrivate())
                .body(bytes);
    }

    private static String extractTail(HttpServletRequest req) {
        String uri = URLDecoder.decode(req.getRequestURI(), StandardCharsets.UTF_8);
        int i = uri.indexOf(PREFIX);
        if (i < 0) {
            return "";
        }
        String tail = uri.substring(i + PREFIX.length());
        while (tail.startsWith("/")) {
            tail = tail.substring(1);
        }
        return tail;
    }
}
