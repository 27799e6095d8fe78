package com.micronote.backend.modules.note.presentation.dto;

public record NoteDetailResponse(NoteResponse note) {
}
