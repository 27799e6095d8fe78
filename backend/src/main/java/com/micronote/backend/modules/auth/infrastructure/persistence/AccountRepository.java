package com.micronote.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.micronote.backend.modules.auth.domain.Account;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AccountRepository extends JpaRepository<Account, UUID> {

    @Query("""
            select a
              from Account a
             where lower(a.username) = lower(:identifier)
                or a.email = lower(:identifier)
            """)
    Optional<Account> findByUsernameOrEmail(@Param("identifier") String identifier);

    Optional<Account> findByUsernameIgnoreCase(String username);

    boolean existsByEmail(String email);

    boolean existsByUsernameIgnoreCase(String username);

    @Query("""
            select case when count(a) > 0 then true else false end
              from Account a
             where a.email = :email
               and a.id <> :excludeId
            """)
    boolean existsByEmailExcluding(@Param("email") String email, @Param("excludeId") UUID excludeId);

    @Query("""
            select case when count(a) > 0 then true else false end
              from Account a
             where lower(a.username) = lower(:username)
               and a.id <> :excludeId
            """)
    boolean existsByUsernameExcluding(@Param("username") String username, @Param("excludeId") UUID excludeId);
}
