package com.example.clipnotes_backend.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

public class ClipNotFoundException extends ResponseStatusException {
    public ClipNotFoundException(UUID clipId) {
        super(HttpStatus.NOT_FOUND, "CLIP_NOT_FOUND");
        setDetail("Clip " + clipId + " not found");
    }
}
