package com.ai.tpr.service;

import com.ai.tpr.conversation.Selections;
import com.ai.tpr.conversation.Session;
import com.ai.tpr.entity.WorkflowSessionEntity;
import com.ai.tpr.exception.SessionConflictException;
import com.ai.tpr.exception.SessionStoreException;
import com.ai.tpr.repository.WorkflowSessionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Database-backed session store. The {@code @Version} column rejects writes
 * computed from stale state across processes; the local lock serializes
 * requests within this one.
 */
@Service
@ConditionalOnProperty(name = "tpr.session-store", havingValue = "jpa")
public class JpaSessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(JpaSessionStore.class);

    private final WorkflowSessionRepository repository;
    private final SessionLocks locks = new SessionLocks();

    public JpaSessionStore(WorkflowSessionRepository repository) {
        this.repository = repository;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Session> load(String sessionId) {
        try {
            return repository.findBySessionId(sessionId).map(JpaSessionStore::toSession);
        } catch (DataAccessException e) {
            log.error("[{}] failed to load session", sessionId, e);
            throw new SessionStoreException(sessionId, "Failed to load session", e);
        }
    }

    @Override
    @Transactional
    public Session save(String sessionId, Session session) {
        try {
            Optional<WorkflowSessionEntity> existing = repository.findBySessionId(sessionId);
            Long actual = existing.map(WorkflowSessionEntity::getVersion).orElse(null);
            if (!Objects.equals(actual, session.getVersion())) {
                throw new SessionConflictException(sessionId, session.getVersion(), actual);
            }
            WorkflowSessionEntity entity = existing.orElseGet(() -> WorkflowSessionEntity.builder()
                    .sessionId(sessionId)
                    .build());
            entity.setStage(session.getStage());
            entity.setSelectedState(session.getSelections().getState());
            entity.setFacilityLevel(session.getSelections().getFacilityLevel());
            entity.setAgeGroup(session.getSelections().getAgeGroup());
            entity.setDatasetHandle(session.getDatasetHandle());
            entity.setCompletionReason(session.getCompletionReason());
            entity.touch();
            return toSession(repository.saveAndFlush(entity));
        } catch (ObjectOptimisticLockingFailureException | DataIntegrityViolationException e) {
            throw new SessionConflictException(sessionId, e);
        } catch (DataAccessException e) {
            log.error("[{}] failed to save session", sessionId, e);
            throw new SessionStoreException(sessionId, "Failed to save session", e);
        }
    }

    @Override
    @Transactional
    public void delete(String sessionId) {
        try {
            repository.deleteBySessionId(sessionId);
        } catch (DataAccessException e) {
            log.error("[{}] failed to delete session", sessionId, e);
            throw new SessionStoreException(sessionId, "Failed to delete session", e);
        } finally {
            locks.forget(sessionId);
        }
    }

    @Override
    public <T> T withSessionLock(String sessionId, Supplier<T> action) {
        return locks.withLock(sessionId, action);
    }

    private static Session toSession(WorkflowSessionEntity entity) {
        Session session = new Session(entity.getSessionId());
        session.setStage(entity.getStage());
        session.setSelections(new Selections(entity.getSelectedState(), entity.getFacilityLevel(), entity.getAgeGroup()));
        session.setDatasetHandle(entity.getDatasetHandle());
        session.setCompletionReason(entity.getCompletionReason());
        session.setVersion(entity.getVersion());
        return session;
    }
}
