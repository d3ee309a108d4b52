package com.ai.tpr.service;

import com.ai.tpr.conversation.Session;
import com.ai.tpr.exception.SessionConflictException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Process-local session store. Sessions are lost on restart.
 */
@Service
@ConditionalOnProperty(name = "tpr.session-store", havingValue = "memory", matchIfMissing = true)
public class InMemorySessionStore implements SessionStore {

    private final ConcurrentMap<String, Session> sessions = new ConcurrentHashMap<>();
    private final SessionLocks locks = new SessionLocks();

    @Override
    public Optional<Session> load(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId)).map(Session::copy);
    }

    @Override
    public Session save(String sessionId, Session session) {
        AtomicReference<Session> saved = new AtomicReference<>();
        sessions.compute(sessionId, (id, existing) -> {
            Long actual = existing == null ? null : existing.getVersion();
            if (!Objects.equals(actual, session.getVersion())) {
                throw new SessionConflictException(sessionId, session.getVersion(), actual);
            }
            Session stored = session.copy();
            stored.setVersion(actual == null ? 0L : actual + 1);
            saved.set(stored);
            return stored;
        });
        return saved.get().copy();
    }

    @Override
    public void delete(String sessionId) {
        sessions.remove(sessionId);
        locks.forget(sessionId);
    }

    @Override
    public <T> T withSessionLock(String sessionId, Supplier<T> action) {
        return locks.withLock(sessionId, action);
    }
}
