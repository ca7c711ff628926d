package com.ai.intake.store;

import com.ai.intake.conversation.IntakeRecord;

import java.util.Optional;

/**
 * Key-value persistence of live intake records. Implementations hand out copies, so a
 * record loaded by one caller is never the instance another caller mutates.
 */
public interface SessionStore {

    Optional<IntakeRecord> load(String conversationId);

    void save(String conversationId, IntakeRecord record);

    /** Returns true if a record was removed. */
    boolean remove(String conversationId);
}
