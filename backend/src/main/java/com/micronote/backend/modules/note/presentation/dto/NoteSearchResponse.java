package com.micronote.backend.modules.note.presentation.dto;

import java.util.List;

public record NoteSearchResponse(List<NoteResponse> notes, String query) {
}
