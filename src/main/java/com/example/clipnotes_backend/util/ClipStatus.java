package com.example.clipnotes_backend.util;

public enum ClipStatus {
    PENDING,
    PROCESSING,
    READY,
    FAILED
}
