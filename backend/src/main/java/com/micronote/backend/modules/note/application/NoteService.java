package com.micronote.backend.modules.note.application;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

import com.micronote.backend.global.error.ApiException;
import com.micronote.backend.global.web.PaginationResponse;
import com.micronote.backend.modules.auth.domain.Account;
import com.micronote.backend.modules.auth.infrastructure.persistence.AccountRepository;
import com.micronote.backend.modules.note.domain.Note;
import com.micronote.backend.modules.note.infrastructure.persistence.NoteRepository;
import com.micronote.backend.modules.note.presentation.dto.CreateNoteRequest;
import com.micronote.backend.modules.note.presentation.dto.NoteListResponse;
import com.micronote.backend.modules.note.presentation.dto.NoteResponse;
import com.micronote.backend.modules.note.presentation.dto.NoteSearchResponse;
import com.micronote.backend.modules.note.presentation.dto.UpdateNoteRequest;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ResponseStatusException;

@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class NoteService {

    static final int DEFAULT_PAGE_SIZE = 20;
    static final int MAX_PAGE_SIZE = 100;

    private final NoteRepository noteRepository;
    private final AccountRepository accountRepository;

    public NoteService(NoteRepository noteRepository, AccountRepository accountRepository) {
        this.noteRepository = noteRepository;
        this.accountRepository = accountRepository;
    }

    @Transactional(readOnly = true)
    public NoteListResponse listNotes(UUID accountId, int page, int limit, String search, boolean archived, Boolean pinned) {
        int safePage = Math.max(page, 1);
        int safeLimit = clampLimit(limit);
        String searchPattern = StringUtils.hasText(search) ? likePattern(search) : null;

        Page<Note> result = noteRepository.findByFilters(
                accountId,
                archived,
                pinned,
                searchPattern,
                PageRequest.of(safePage - 1, safeLimit)
        );
        List<NoteResponse> notes = result.getContent().stream()
                .map(NoteResponse::from)
                .toList();
        return new NoteListResponse(notes, PaginationResponse.from(result));
    }

    /**
     * Matches title, text and tags of non-archived notes, most recently updated first.
     */
    @Transactional(readOnly = true)
    public NoteSearchResponse searchNotes(UUID accountId, String query, int limit) {
        if (!StringUtils.hasText(query)) {
            throw new ApiException(HttpStatus.BAD_REQUEST, "SEARCH_QUERY_REQUIRED", "Search query is required");
        }
        String trimmed = query.trim();
        List<NoteResponse> notes = noteRepository.search(accountId, likePattern(trimmed), PageRequest.of(0, clampLimit(limit)))
                .stream()
                .map(NoteResponse::from)
                .toList();
        return new NoteSearchResponse(notes, trimmed);
    }

    @Transactional(readOnly = true)
    public NoteResponse getNote(UUID accountId, UUID noteId) {
        return NoteResponse.from(loadOwnedNote(accountId, noteId));
    }

    public NoteResponse createNote(UUID accountId, CreateNoteRequest request) {
        Account owner = accountRepository.getReferenceById(accountId);

        Note note = new Note();
        note.setOwner(owner);
        note.setTitle(request.title().trim());
        note.setText(request.text());
        note.replaceTags(normalizeTags(request.tags()));
        note.setPinned(Boolean.TRUE.equals(request.isPinned()));
        note.setArchived(false);

        return NoteResponse.from(noteRepository.saveAndFlush(note));
    }

    public NoteResponse updateNote(UUID accountId, UUID noteId, UpdateNoteRequest request) {
        Note note = loadOwnedNote(accountId, noteId);

        if (request.title() != null) {
            note.setTitle(request.title().trim());
        }
        if (request.text() != null) {
            note.setText(request.text());
        }
        if (request.tags() != null) {
            note.replaceTags(normalizeTags(request.tags()));
        }
        if (request.isPinned() != null) {
            note.setPinned(request.isPinned());
        }
        if (request.isArchived() != null) {
            note.setArchived(request.isArchived());
        }
        return NoteResponse.from(noteRepository.saveAndFlush(note));
    }

    public void deleteNote(UUID accountId, UUID noteId) {
        noteRepository.delete(loadOwnedNote(accountId, noteId));
    }

    public NoteResponse togglePin(UUID accountId, UUID noteId) {
        Note note = loadOwnedNote(accountId, noteId);
        note.setPinned(!note.isPinned());
        return NoteResponse.from(noteRepository.saveAndFlush(note));
    }

    private Note loadOwnedNote(UUID accountId, UUID noteId) {
        // someone else's note is reported exactly like a missing one
        return noteRepository.findByIdAndOwnerId(noteId, accountId)
                .orElseThrow(() -> new ApiException(HttpStatus.NOT_FOUND, "NOTE_NOT_FOUND", "Note not found"));
    }

    static List<String> normalizeTags(List<String> tags) {
        if (tags == null) {
            return List.of();
        }
        return tags.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(tag -> !tag.isEmpty())
                .distinct()
                .toList();
    }

    private static int clampLimit(int limit) {
        if (limit < 1) {
            return DEFAULT_PAGE_SIZE;
        }
        return Math.min(limit, MAX_PAGE_SIZE);
    }

    // '!' is the escape character declared by the repository queries
    private static String likePattern(String raw) {
        String literal = raw.trim().toLowerCase(Locale.ROOT)
                .replace("!", "!!")
                .replace("%", "!%")
                .replace("_", "!_");
        return "%" + literal + "%";
    }
}
