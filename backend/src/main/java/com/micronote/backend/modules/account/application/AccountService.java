package com.micronote.backend.modules.account.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.UUID;

import com.micronote.backend.global.error.ApiException;
import com.micronote.backend.global.security.JwtAuthenticationPrincipal;
import com.micronote.backend.modules.account.presentation.dto.AccountStatsResponse;
import com.micronote.backend.modules.account.presentation.dto.ChangePasswordRequest;
import com.micronote.backend.modules.account.presentation.dto.DeleteAccountRequest;
import com.micronote.backend.modules.account.presentation.dto.UpdateProfileRequest;
import com.micronote.backend.modules.auth.domain.Account;
import com.micronote.backend.modules.auth.infrastructure.persistence.AccountRepository;
import com.micronote.backend.modules.auth.infrastructure.session.SessionTokenStore;
import com.micronote.backend.modules.auth.presentation.dto.AccountResponse;
import com.micronote.backend.modules.note.infrastructure.persistence.NoteRepository;
import com.micronote.backend.modules.todo.infrastructure.persistence.TodoRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * Self-service operations on the authenticated account. Password change and deletion revoke the
 * stored refresh token inside the same transaction, so a session store outage rolls the change back.
 */
@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class AccountService {

    private static final Logger log = LoggerFactory.getLogger(AccountService.class);

    private final AccountRepository accountRepository;
    private final NoteRepository noteRepository;
    private final TodoRepository todoRepository;
    private final SessionTokenStore sessionTokenStore;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    public AccountService(
            AccountRepository accountRepository,
            NoteRepository noteRepository,
            TodoRepository todoRepository,
            SessionTokenStore sessionTokenStore,
            PasswordEncoder passwordEncoder,
            Clock clock
    ) {
        this.accountRepository = accountRepository;
        this.noteRepository = noteRepository;
        this.todoRepository = todoRepository;
        this.sessionTokenStore = sessionTokenStore;
        this.passwordEncoder = passwordEncoder;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public AccountResponse getProfile(UUID accountId) {
        return AccountResponse.from(loadAccount(accountId));
    }

    public AccountResponse updateProfile(UUID accountId, UpdateProfileRequest request) {
        Account account = loadAccount(accountId);

        if (request.email() != null) {
            String email = request.email().trim().toLowerCase(Locale.ROOT);
            if (accountRepository.existsByEmailExcluding(email, accountId)) {
                throw new ApiException(HttpStatus.BAD_REQUEST, "EMAIL_ALREADY_EXISTS", "Email already in use");
            }
            account.setEmail(email);
        }
        if (request.username() != null) {
            String username = request.username().trim();
            if (accountRepository.existsByUsernameExcluding(username, accountId)) {
                throw new ApiException(HttpStatus.BAD_REQUEST, "USERNAME_ALREADY_EXISTS", "Username already taken");
            }
            account.setUsername(username);
        }
        if (request.name() != null) {
            account.setName(request.name().trim());
        }
        return AccountResponse.from(accountRepository.saveAndFlush(account));
    }

    /**
     * Changes the password and ends refresh-token based sessions; access tokens already issued stay
     * valid until they expire.
     */
    public void changePassword(UUID accountId, ChangePasswordRequest request) {
        Account account = loadAccount(accountId);
        if (!passwordEncoder.matches(request.currentPassword(), account.getPasswordHash())) {
            throw new ApiException(HttpStatus.BAD_REQUEST, "CURRENT_PASSWORD_MISMATCH", "Current password is incorrect");
        }
        account.setPasswordHash(passwordEncoder.encode(request.newPassword()));
        accountRepository.saveAndFlush(account);
        sessionTokenStore.revokeRefreshToken(accountId);
        log.info("Password changed for account {}", accountId);
    }

    public void deleteAccount(JwtAuthenticationPrincipal principal, String accessToken, DeleteAccountRequest request) {
        Account account = loadAccount(principal.accountId());
        if (!passwordEncoder.matches(request.password(), account.getPasswordHash())) {
            throw new ApiException(HttpStatus.BAD_REQUEST, "PASSWORD_MISMATCH", "Password is incorrect");
        }
        // notes and todos go with the account through ON DELETE CASCADE
        accountRepository.delete(account);
        accountRepository.flush();
        sessionTokenStore.revokeRefreshToken(principal.accountId());
        sessionTokenStore.blacklistAccessToken(accessToken, principal.expiresAt());
        log.info("Deleted account {}", principal.accountId());
    }

    @Transactional(readOnly = true)
    public AccountStatsResponse getStats(UUID accountId) {
        Account account = loadAccount(accountId);
        OffsetDateTime joinedAt = account.getCreatedAt();
        long accountAgeDays = Math.max(0, Duration.between(joinedAt.toInstant(), clock.instant()).toDays());
        return new AccountStatsResponse(
                AccountResponse.from(account),
                accountAgeDays,
                joinedAt,
                noteRepository.countByOwnerId(accountId),
                todoRepository.countByOwnerId(accountId)
        );
    }

    private Account loadAccount(UUID accountId) {
        return accountRepository.findById(accountId)
                .orElseThrow(() -> new ApiException(HttpStatus.NOT_FOUND, "USER_NOT_FOUND", "User not found"));
    }
}
