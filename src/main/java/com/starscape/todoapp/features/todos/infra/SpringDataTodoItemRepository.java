package com.starscape.todoapp.features.todos.infra;

import com.starscape.todoapp.features.todos.domain.TodoItem;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Spring Data access to the todo_items table. Every finder takes the owner id.
 */
@Repository
@ConditionalOnProperty(name = "app.storage.backend", havingValue = "jpa", matchIfMissing = true)
public interface SpringDataTodoItemRepository extends JpaRepository<TodoItem, Long> {

    Optional<TodoItem> findByIdAndOwnerId(Long id, Long ownerId);

    List<TodoItem> findByOwnerIdOrderByCreatedAtAscIdAsc(Long ownerId);

    @Modifying
    @Query("DELETE FROM TodoItem t WHERE t.id = :id AND t.ownerId = :ownerId")
    int deleteOwned(@Param("id") Long id, @Param("ownerId") Long ownerId);
}
