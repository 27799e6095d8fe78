package com.micronote.backend.modules.note.presentation.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Partial update; {@code null} fields are left unchanged.
 */
public record UpdateNoteRequest(
        @Size(min = 1, max = 100, message = "Title must be between 1 and 100 characters")
        @Pattern(regexp = "(?s).*\\S.*", message = "Title must not be blank")
        String title,
        @Size(min = 1, max = 5000, message = "Text must be between 1 and 5000 characters")
        @Pattern(regexp = "(?s).*\\S.*", message = "Text must not be blank")
        String text,
        @Size(max = 20, message = "A note can have at most 20 tags")
        List<@Size(max = 20, message = "Each tag must be less than 20 characters") String> tags,
        @JsonProperty("isPinned") Boolean isPinned,
        @JsonProperty("isArchived") Boolean isArchived
) {
}
