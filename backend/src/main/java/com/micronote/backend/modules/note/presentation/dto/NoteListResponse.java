package com.micronote.backend.modules.note.presentation.dto;

import java.util.List;

import com.micronote.backend.global.web.PaginationResponse;

public record NoteListResponse(List<NoteResponse> notes, PaginationResponse pagination) {
}
