package com.micronote.backend.modules.note.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.micronote.backend.modules.note.domain.Note;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface NoteRepository extends JpaRepository<Note, UUID> {

    Optional<Note> findByIdAndOwnerId(UUID id, UUID ownerId);

    long countByOwnerId(UUID ownerId);

    /**
     * {@code searchPattern} is expected lower-cased, wrapped in {@code %}, with literal
     * {@code %}, {@code _} and {@code !} escaped by {@code !}.
     */
    @Query(value = """
            select n
              from Note n
             where n.owner.id = :ownerId
               and n.archived = :archived
               and (:pinned is null or n.pinned = :pinned)
               and (
                     :searchPattern is null
                  or lower(n.title) like :searchPattern escape '!'
                  or lower(n.text) like :searchPattern escape '!'
               )
             order by n.pinned desc, n.createdAt desc
            """,
            countQuery = """
            select count(n)
              from Note n
             where n.owner.id = :ownerId
               and n.archived = :archived
               and (:pinned is null or n.pinned = :pinned)
               and (
                     :searchPattern is null
                  or lower(n.title) like :searchPattern escape '!'
                  or lower(n.text) like :searchPattern escape '!'
               )
            """)
    Page<Note> findByFilters(
            @Param("ownerId") UUID ownerId,
            @Param("archived") boolean archived,
            @Param("pinned") Boolean pinned,
            @Param("searchPattern") String searchPattern,
            Pageable pageable
    );

    @Query("""
            select distinct n
              from Note n
              left join n.tags t
             where n.owner.id = :ownerId
               and n.archived = false
               and (
                     lower(n.title) like :searchPattern escape '!'
                  or lower(n.text) like :searchPattern escape '!'
                  or lower(t) like :searchPattern escape '!'
               )
             order by n.updatedAt desc
            """)
    List<Note> search(@Param("ownerId") UUID ownerId, @Param("searchPattern") String searchPattern, Pageable pageable);
}
