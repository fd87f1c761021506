package com.flagship.shipping_workflow.session;

import com.flagship.shipping_workflow.workflow.WorkflowStep;

import java.util.Optional;

/**
 * Persisted per-user workflow state.
 *
 * Every operation is atomic per user key and tolerates concurrent callers.
 * An expired session behaves exactly like a missing one.
 */
public interface SessionStore {

    /**
     * Returns the live session for the user, creating one at START if none
     * exists. A stale session for the same user is discarded first. When the
     * session already exists only its last-touched time is refreshed and
     * {@code initialFields} is ignored.
     */
    Session getOrCreate(String userKey, FieldPatch initialFields);

    /**
     * Merges {@code patch} into the session's fields key by key and, when
     * {@code step} is not null, moves the session to that step. Keys absent
     * from the patch keep their stored values even if another writer changed
     * them concurrently.
     *
     * @return the post-update session, or empty if no live session exists
     */
    Optional<Session> updateAtomic(String userKey, WorkflowStep step, FieldPatch patch);

    Optional<Session> get(String userKey);

    void clear(String userKey);

    /**
     * Archives {@code record} and deletes the user's session, atomically where
     * the backing store supports it.
     */
    void finalizeAndArchive(String userKey, CompletionRecord record);

    /**
     * Deletes every expired session.
     *
     * @return number of sessions removed
     */
    int purgeExpired();
}
