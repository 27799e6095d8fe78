package com.micronote.backend.modules.note.presentation;

import java.util.UUID;

import com.micronote.backend.global.security.SecurityUtils;
import com.micronote.backend.global.web.ApiResponse;
import com.micronote.backend.modules.note.application.NoteService;
import com.micronote.backend.modules.note.presentation.dto.CreateNoteRequest;
import com.micronote.backend.modules.note.presentation.dto.NoteDetailResponse;
import com.micronote.backend.modules.note.presentation.dto.NoteListResponse;
import com.micronote.backend.modules.note.presentation.dto.NoteResponse;
import com.micronote.backend.modules.note.presentation.dto.NoteSearchResponse;
import com.micronote.backend.modules.note.presentation.dto.UpdateNoteRequest;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Notes")
@RestController
@RequestMapping("/api/notes")
public class NoteController {

    private final NoteService noteService;

    public NoteController(NoteService noteService) {
        this.noteService = noteService;
    }

    @Operation(
            summary = "List notes",
            description = """
                    Pinned notes first, then newest first. \
                    Responses are cached per account for a few minutes and dropped on any note write.
                    """
    )
    @GetMapping
    public ResponseEntity<ApiResponse<NoteListResponse>> listNotes(
            @RequestParam(name = "page", defaultValue = "1") int page,
            @RequestParam(name = "limit", defaultValue = "20") int limit,
            @RequestParam(name = "search", required = false) String search,
            @RequestParam(name = "archived", defaultValue = "false") boolean archived,
            @RequestParam(name = "pinned", required = false) Boolean pinned
    ) {
        UUID accountId = SecurityUtils.getCurrentAccountId();
        return ResponseEntity.ok(ApiResponse.ok(noteService.listNotes(accountId, page, limit, search, archived, pinned)));
    }

    @Operation(summary = "Search notes", description = "400 `SEARCH_QUERY_REQUIRED` when `q` is blank.")
    @GetMapping("/search")
    public ResponseEntity<ApiResponse<NoteSearchResponse>> searchNotes(
            @RequestParam(name = "q", required = false) String query,
            @RequestParam(name = "limit", defaultValue = "20") int limit
    ) {
        UUID accountId = SecurityUtils.getCurrentAccountId();
        return ResponseEntity.ok(ApiResponse.ok(noteService.searchNotes(accountId, query, limit)));
    }

    @GetMapping("/{noteId}")
    public ResponseEntity<ApiResponse<NoteDetailResponse>> getNote(@PathVariable("noteId") UUID noteId) {
        NoteResponse note = noteService.getNote(SecurityUtils.getCurrentAccountId(), noteId);
        return ResponseEntity.ok(ApiResponse.ok(new NoteDetailResponse(note)));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<NoteDetailResponse>> createNote(@Valid @RequestBody CreateNoteRequest request) {
        NoteResponse note = noteService.createNote(SecurityUtils.getCurrentAccountId(), request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok("Note created successfully", new NoteDetailResponse(note)));
    }

    @PutMapping("/{noteId}")
    public ResponseEntity<ApiResponse<NoteDetailResponse>> updateNote(
            @PathVariable("noteId") UUID noteId,
            @Valid @RequestBody UpdateNoteRequest request
    ) {
        NoteResponse note = noteService.updateNote(SecurityUtils.getCurrentAccountId(), noteId, request);
        return ResponseEntity.ok(ApiResponse.ok("Note updated successfully", new NoteDetailResponse(note)));
    }

    @DeleteMapping("/{noteId}")
    public ResponseEntity<ApiResponse<Void>> deleteNote(@PathVariable("noteId") UUID noteId) {
        noteService.deleteNote(SecurityUtils.getCurrentAccountId(), noteId);
        return ResponseEntity.ok(ApiResponse.ok("Note deleted successfully"));
    }

    @PatchMapping("/{noteId}/pin")
    public ResponseEntity<ApiResponse<NoteDetailResponse>> togglePin(@PathVariable("noteId") UUID noteId) {
        NoteResponse note = noteService.togglePin(SecurityUtils.getCurrentAccountId(), noteId);
        String message = "Note " + (note.isPinned() ? "pinned" : "unpinned") + " successfully";
        return ResponseEntity.ok(ApiResponse.ok(message, new NoteDetailResponse(note)));
    }
}
