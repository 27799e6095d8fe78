package com.micronote.backend.modules.note.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.micronote.backend.modules.note.domain.Note;

public record NoteResponse(
        UUID id,
        String title,
        String text,
        List<String> tags,
        @JsonProperty("isPinned") boolean isPinned,
        @JsonProperty("isArchived") boolean isArchived,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static NoteResponse from(Note note) {
        return new NoteResponse(
                note.getId(),
                note.getTitle(),
                note.getText(),
                List.copyOf(note.getTags()),
                note.isPinned(),
                note.isArchived(),
                note.getCreatedAt(),
                note.getUpdatedAt()
        );
    }
}
