package com.ai.tpr.repository;

import com.ai.tpr.entity.WorkflowSessionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface WorkflowSessionRepository extends JpaRepository<WorkflowSessionEntity, Long> {
    Optional<WorkflowSessionEntity> findBySessionId(String sessionId);

    long deleteBySessionId(String sessionId);
}
