package com.micronote.backend.modules.todo.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.micronote.backend.modules.todo.domain.Todo;
import com.micronote.backend.modules.todo.domain.TodoPriority;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TodoRepository extends JpaRepository<Todo, UUID> {

    Optional<Todo> findByIdAndOwnerId(UUID id, UUID ownerId);

    long countByOwnerId(UUID ownerId);

    long countByOwnerIdAndCompleted(UUID ownerId, boolean completed);

    @Query(value = """
            select t
              from Todo t
             where t.owner.id = :ownerId
               and (:completed is null or t.completed = :completed)
               and (:priority is null or t.priority = :priority)
               and (:category is null or t.category = :category)
             order by t.completed asc, t.createdAt desc
            """,
            countQuery = """
            select count(t)
              from Todo t
             where t.owner.id = :ownerId
               and (:completed is null or t.completed = :completed)
               and (:priority is null or t.priority = :priority)
               and (:category is null or t.category = :category)
            """)
    Page<Todo> findByFilters(
            @Param("ownerId") UUID ownerId,
            @Param("completed") Boolean completed,
            @Param("priority") TodoPriority priority,
            @Param("category") String category,
            Pageable pageable
    );

    @Query("""
            select t.priority as priority,
                   count(t) as total,
                   sum(case when t.completed = true then 1 else 0 end) as completedCount
              from Todo t
             where t.owner.id = :ownerId
             group by t.priority
            """)
    List<PriorityCount> countByPriority(@Param("ownerId") UUID ownerId);

    @Query("""
            select t.category as category,
                   count(t) as total,
                   sum(case when t.completed = true then 1 else 0 end) as completedCount
              from Todo t
             where t.owner.id = :ownerId
               and t.category is not null
             group by t.category
             order by count(t) desc, t.category asc
            """)
    List<CategoryCount> countByCategory(@Param("ownerId") UUID ownerId);

    interface PriorityCount {
        TodoPriority getPriority();

        long getTotal();

        long getCompletedCount();
    }

    interface CategoryCount {
        String getCategory();

        long getTotal();

        long getCompletedCount();
    }
}
