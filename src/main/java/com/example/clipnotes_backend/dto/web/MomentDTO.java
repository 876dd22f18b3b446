package com.example.clipnotes_backend.dto.web;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Labeled slice of a clip.
 *
 * @param startS   start offset in seconds.
 * @param endS     end offset in seconds.
 * @param label    free-form label.
 * @param severity one of {@code low}, {@code medium}, {@code high}.
 */
public record MomentDTO(@NotNull @PositiveOrZero Double startS,
                        @NotNull @PositiveOrZero Double endS,
                        @NotBlank String label,
                        @NotNull @Pattern(regexp = "low|medium|high") String severity) {
}
