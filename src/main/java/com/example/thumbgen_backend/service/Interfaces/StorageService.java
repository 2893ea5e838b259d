package com.example.thumbgen_backend.service.Interfaces;

/**
 * Object storage addressed by forward-slash keys.
 */
public interface StorageService {

    void put(String objectKey, byte[] bytes, String contentType);

    byte[] get(String objectKey);

    void delete(String objectKey);

    /** Absolute URL under which the object is served to clients. */
    String publicUrl(String objectKey);
}
