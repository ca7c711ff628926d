package com.ai.intake.service;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One mutex per conversation id, created on demand and dropped once no thread holds
 * or waits for it. Different ids never share a lock.
 */
@Component
public class ConversationLocks {

    private static final class Entry {
        final ReentrantLock lock = new ReentrantLock();
        int users;
    }

    private final Map<String, Entry> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String conversationId, Supplier<T> action) {
        Entry entry = acquire(conversationId);
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            release(conversationId);
        }
    }

    /** Ids that currently have a lock entry; for tests and diagnostics. */
    public int activeCount() {
        return locks.size();
    }

    private Entry acquire(String conversationId) {
        return locks.compute(conversationId, (id, existing) -> {
            Entry e = existing != null ? existing : new Entry();
            e.users++;
            return e;
        });
    }

    private void release(String conversationId) {
        locks.computeIfPresent(conversationId, (id, e) -> --e.users == 0 ? null : e);
    }
}
