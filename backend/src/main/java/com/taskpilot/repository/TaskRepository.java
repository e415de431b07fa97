package com.taskpilot.repository;

import com.taskpilot.model.entity.Task;
import com.taskpilot.model.entity.TaskStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface TaskRepository extends JpaRepository<Task, UUID> {
    List<Task> findByUserIdOrderByCreatedAtAsc(String userId);

    List<Task> findByUserIdAndStatusOrderByCreatedAtAsc(String userId, TaskStatus status);

    Optional<Task> findByIdAndUserId(UUID id, String userId);
}
