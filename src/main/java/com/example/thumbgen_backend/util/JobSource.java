package com.example.thumbgen_backend.util;

public enum JobSource {
    TEXT2IMG,
    IMG2IMG
}
