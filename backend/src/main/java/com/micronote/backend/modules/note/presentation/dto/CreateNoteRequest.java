package com.micronote.backend.modules.note.presentation.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateNoteRequest(
        @NotBlank(message = "Title is required")
        @Size(max = 100, message = "Title must be less than 100 characters")
        String title,
        @NotBlank(message = "Text is required")
        @Size(max = 5000, message = "Text must be less than 5000 characters")
        String text,
        @Size(max = 20, message = "A note can have at most 20 tags")
        List<@Size(max = 20, message = "Each tag must be less than 20 characters") String> tags,
        @JsonProperty("isPinned") Boolean isPinned
) {
}
