package com.ai.tpr.service;

import com.ai.tpr.conversation.Session;
import com.ai.tpr.exception.SessionConflictException;
import com.ai.tpr.exception.SessionStoreException;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Keyed storage for workflow sessions with optimistic versioning.
 * <p>
 * Callers read-modify-write as: {@link #withSessionLock} around {@link #load},
 * mutate the returned copy, {@link #save}. The lock serializes callers in this
 * process; the version check rejects writes computed from stale state from anywhere.
 */
public interface SessionStore {

    /**
     * @return a detached copy; changes to it are not visible until saved
     */
    Optional<Session> load(String sessionId);

    /**
     * Stores the session if its version equals the stored one ({@code null} when
     * none is stored yet).
     *
     * @return a detached copy carrying the new version
     * @throws SessionConflictException when the stored version differs
     * @throws SessionStoreException when the write fails
     */
    Session save(String sessionId, Session session);

    void delete(String sessionId);

    <T> T withSessionLock(String sessionId, Supplier<T> action);
}
