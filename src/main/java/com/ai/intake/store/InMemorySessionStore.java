package com.ai.intake.store;

import com.ai.intake.conversation.IntakeRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
@ConditionalOnProperty(name = "intake.session-store", havingValue = "memory", matchIfMissing = true)
public class InMemorySessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(InMemorySessionStore.class);

    private final Map<String, IntakeRecord> records = new ConcurrentHashMap<>();

    @Override
    public Optional<IntakeRecord> load(String conversationId) {
        IntakeRecord record = records.get(conversationId);
        return record != null ? Optional.of(record.copy()) : Optional.empty();
    }

    @Override
    public void save(String conversationId, IntakeRecord record) {
        records.put(conversationId, record.copy());
        log.debug("[{}] saved ({})", conversationId, record.getStatus());
    }

    @Override
    public boolean remove(String conversationId) {
        return records.remove(conversationId) != null;
    }

    public int size() {
        return records.size();
    }
}
