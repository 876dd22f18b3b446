package com.example.clipnotes_backend.dto.web;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ClipCreateRequest(@NotBlank @Size(max = 255) String filename) {
}
