package com.ai.intake.service;

import com.ai.intake.catalog.CatalogMatch;
import com.ai.intake.catalog.FollowUpQuestion;
import com.ai.intake.catalog.SymptomCatalog;
import com.ai.intake.catalog.SymptomEntry;
import com.ai.intake.config.IntakePolicyProperties;
import com.ai.intake.conversation.EngineAction;
import com.ai.intake.conversation.IntakeField;
import com.ai.intake.conversation.IntakeRecord;
import com.ai.intake.conversation.IntakeSnapshot;
import com.ai.intake.conversation.IntakeStatus;
import com.ai.intake.exception.UnknownConversationException;
import com.ai.intake.extraction.ExtractedFields;
import com.ai.intake.extraction.ExtractionGateway;
import com.ai.intake.notification.CompletionNotifier;
import com.ai.intake.store.SessionStore;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Drives one intake conversation per id: demographics, then the chief complaint, then
 * catalog follow-ups, until the intake is complete or abandoned.
 *
 * <p>Every operation on an id runs its load-merge-save cycle under that id's lock.
 * Completion listeners are called after the lock is released, once per conversation.
 */
@Service
public class IntakeDialogueEngine {

    private static final Logger log = LoggerFactory.getLogger(IntakeDialogueEngine.class);

    public static final String EMAIL_MISSING = "contact email not provided";
    public static final String CANCELLED = "cancelled";
    public static final String IDLE_TIMEOUT = "idle timeout";

    static final String UNSPECIFIED_SYMPTOM = "unspecified";
    private static final int MAX_SYMPTOM_WORDING = 200;

    private static final List<IntakeField> REQUIRED = List.of(IntakeField.NAME, IntakeField.EMAIL);

    private final SessionStore store;
    private final ExtractionGateway extraction;
    private final FieldMerger merger;
    private final FollowUpSelector selector;
    private final SymptomCatalog catalog;
    private final ResponsePhrases phrases;
    private final ConversationLocks locks;
    private final CompletionNotifier notifier;
    private final IntakePolicyProperties policy;
    private final Clock clock;

    public IntakeDialogueEngine(SessionStore store,
                                ExtractionGateway extraction,
                                FieldMerger merger,
                                FollowUpSelector selector,
                                SymptomCatalog catalog,
                                ResponsePhrases phrases,
                                ConversationLocks locks,
                                CompletionNotifier notifier,
                                IntakePolicyProperties policy,
                                Clock clock) {
        this.store = store;
        this.extraction = extraction;
        this.merger = merger;
        this.selector = selector;
        this.catalog = catalog;
        this.phrases = phrases;
        this.locks = locks;
        this.notifier = notifier;
        this.policy = policy;
        this.clock = clock;
    }

    private record Turn(EngineAction action, IntakeSnapshot completed) {
    }

    /**
     * Creates the record if needed and returns the question the patient should see now:
     * the greeting for a new conversation, otherwise the question still awaiting an answer.
     */
    public EngineAction openConversation(String conversationId) {
        requireId(conversationId);
        return locks.withLock(conversationId, () -> {
            Optional<IntakeRecord> existing = store.load(conversationId);
            if (existing.isPresent()) {
                IntakeRecord record = existing.get();
                return record.isTerminal() ? terminalAction(record) : EngineAction.ask(currentQuestion(record));
            }
            IntakeRecord record = IntakeRecord.start(conversationId, now());
            record.recordFieldQuestion(IntakeField.demographics());
            store.save(conversationId, record);
            log.info("[{}] Intake opened", conversationId);
            return EngineAction.ask(phrases.greeting());
        });
    }

    public EngineAction processMessage(String conversationId, String rawText) {
        requireId(conversationId);
        Turn turn = locks.withLock(conversationId, () -> handleTurn(conversationId, rawText));
        if (turn.completed() != null) {
            notifier.notifyCompleted(turn.completed());
        }
        return turn.action();
    }

    public EngineAction cancel(String conversationId, String reason) {
        return abandon(conversationId, StringUtils.defaultIfBlank(reason, CANCELLED));
    }

    /** Idle timeout reported by the transport; the engine keeps no timers of its own. */
    public EngineAction timeout(String conversationId) {
        return abandon(conversationId, IDLE_TIMEOUT);
    }

    public IntakeSnapshot snapshot(String conversationId) {
        requireId(conversationId);
        return store.load(conversationId)
                .map(IntakeRecord::toSnapshot)
                .orElseThrow(() -> unknown(conversationId));
    }

    /**
     * Drops a finished record from the store once a collaborator has taken it over.
     */
    public void release(String conversationId) {
        requireId(conversationId);
        locks.withLock(conversationId, () -> {
            IntakeRecord record = store.load(conversationId).orElseThrow(() -> unknown(conversationId));
            if (!record.isTerminal()) {
                throw new IllegalStateException("Intake " + conversationId + " is still " + record.getStatus());
            }
            store.remove(conversationId);
            log.info("[{}] Intake released ({})", conversationId, record.getStatus());
            return null;
        });
    }

    // ---- turn handling ----

    private Turn handleTurn(String conversationId, String rawText) {
        Instant now = now();
        IntakeRecord record = store.load(conversationId).orElse(null);
        if (record == null) {
            record = IntakeRecord.start(conversationId, now);
            log.info("[{}] Intake started by first message", conversationId);
        } else if (record.isTerminal()) {
            log.info("[{}] Message after intake ended ({}), ignored", conversationId, record.getStatus());
            return new Turn(terminalAction(record), null);
        }

        String text = StringUtils.trimToEmpty(rawText);
        IntakeStatus startedIn = record.getStatus();
        record.nextTurn(now);

        if (record.hasPendingQuestion()) {
            record.recordAnswer(text);
        }

        ExtractedFields extracted = text.isEmpty()
                ? ExtractedFields.empty()
                : extraction.extract(conversationId, text, record.missingFields());
        FieldMerger.MergeResult merged = merger.merge(record, extracted);
        if (merged.changed()) {
            log.info("[{}] Fields merged: accepted={} corrected={}", conversationId, merged.accepted(), merged.corrected());
        }
        boolean symptomTurn = startedIn == IntakeStatus.COLLECTING_SYMPTOM;
        // after a clarification the reply is taken verbatim, so only earlier attempts are matched
        if (!record.isProvided(IntakeField.SYMPTOM) && !(symptomTurn && record.getSymptomClarifications() > 0)) {
            matchSymptom(record, text, extracted, symptomTurn);
        }

        EngineAction action = advance(record, text, startedIn, now);
        store.save(conversationId, record);
        log.info("[{}] Turn {} -> {} ({})", conversationId, record.getTurnCount(), action.getType(), record.getStatus());
        return new Turn(action, record.getStatus() == IntakeStatus.COMPLETE ? record.toSnapshot() : null);
    }

    /**
     * Sets the symptom when the extracted mention, or the raw reply to the symptom
     * question, matches the catalog. Misses are left to the symptom phase.
     */
    private void matchSymptom(IntakeRecord record, String text, ExtractedFields extracted, boolean symptomTurn) {
        Optional<String> mention = extracted.value(IntakeField.SYMPTOM);
        CatalogMatch match = mention.map(catalog::lookup).orElse(CatalogMatch.noMatch());
        if (!match.isMatched() && (symptomTurn || mention.isPresent())) {
            match = catalog.lookup(text);
        }
        if (match.isMatched()) {
            String wording = StringUtils.defaultIfBlank(text, mention.orElse(match.entry().name()));
            record.setPrimarySymptom(match.entry().name(), StringUtils.abbreviate(wording, MAX_SYMPTOM_WORDING), true);
            log.info("[{}] Symptom matched: {} (via '{}')", record.getConversationId(), match.entry().name(),
                    match.matchedPhrase());
        }
    }

    private EngineAction advance(IntakeRecord record, String text, IntakeStatus startedIn, Instant now) {
        if (record.getStatus() == IntakeStatus.COLLECTING_DEMOGRAPHICS) {
            EngineAction action = demographicsStep(record, now);
            if (action != null) return action;
        }
        if (record.getStatus() == IntakeStatus.COLLECTING_SYMPTOM) {
            EngineAction action = symptomStep(record, text, startedIn == IntakeStatus.COLLECTING_SYMPTOM, now);
            if (action != null) return action;
        }
        return followUpStep(record, now);
    }

    private EngineAction demographicsStep(IntakeRecord record, Instant now) {
        int cap = policy.getDemographicRetryCap();
        for (IntakeField field : REQUIRED) {
            if (!record.isProvided(field)) record.recordMiss(field);
        }
        if (!record.isProvided(IntakeField.EMAIL)) {
            if (record.misses(IntakeField.EMAIL) >= cap) {
                log.info("[{}] No email after {} turns, abandoning", record.getConversationId(), cap);
                record.abandon(EMAIL_MISSING, now);
                return EngineAction.abandoned(EMAIL_MISSING);
            }
        } else if (record.isProvided(IntakeField.NAME) || record.misses(IntakeField.NAME) >= cap) {
            if (!record.isProvided(IntakeField.NAME)) {
                log.info("[{}] No name after {} turns, continuing without it", record.getConversationId(), cap);
            }
            record.transitionTo(IntakeStatus.COLLECTING_SYMPTOM, now);
            return null;
        }
        Set<IntakeField> ask = askableDemographics(record);
        Set<IntakeField> known = providedDemographics(record);
        record.recordFieldQuestion(ask);
        record.allowCorrection(known);
        return EngineAction.ask(phrases.demographicsPrompt(record.getName(), ask, known));
    }

    /** Missing demographics that still have ask budget: required ones up to the cap, optional ones once. */
    private Set<IntakeField> askableDemographics(IntakeRecord record) {
        Set<IntakeField> ask = EnumSet.noneOf(IntakeField.class);
        for (IntakeField field : IntakeField.demographics()) {
            if (record.isProvided(field)) continue;
            int budget = field.isRequired() ? policy.getDemographicRetryCap() : 1;
            if (record.asks(field) < budget) ask.add(field);
        }
        return ask;
    }

    private static Set<IntakeField> providedDemographics(IntakeRecord record) {
        Set<IntakeField> known = EnumSet.noneOf(IntakeField.class);
        for (IntakeField field : IntakeField.demographics()) {
            if (record.isProvided(field)) known.add(field);
        }
        return known;
    }

    private EngineAction symptomStep(IntakeRecord record, String text, boolean symptomTurn, Instant now) {
        if (!record.isProvided(IntakeField.SYMPTOM) && symptomTurn) {
            if (record.getSymptomClarifications() < policy.getSymptomClarifications()) {
                record.incrementSymptomClarifications();
                record.clearLastAskedFields();
                log.info("[{}] Symptom '{}' not in catalog, asking to clarify", record.getConversationId(), text);
                return EngineAction.ask(phrases.symptomClarification());
            }
            String wording = StringUtils.abbreviate(StringUtils.defaultIfBlank(text, UNSPECIFIED_SYMPTOM), MAX_SYMPTOM_WORDING);
            record.setPrimarySymptom(wording, wording, false);
            log.info("[{}] Symptom accepted unmatched, using general follow-ups", record.getConversationId());
        }
        if (!record.isProvided(IntakeField.SYMPTOM)) {
            record.clearLastAskedFields();
            return EngineAction.ask(phrases.symptomPrompt(record.getName()));
        }
        record.transitionTo(IntakeStatus.COLLECTING_FOLLOWUPS, now);
        return null;
    }

    private EngineAction followUpStep(IntakeRecord record, Instant now) {
        if (record.getAnswers().size() >= policy.getMinFollowUps()) {
            return complete(record, now, "follow-ups answered");
        }
        Optional<FollowUpQuestion> next = selector.select(record, activeEntry(record));
        if (next.isEmpty()) {
            return complete(record, now, "no follow-up questions left");
        }
        FollowUpQuestion question = next.get();
        if (!record.markAsked(question.id(), question.text(), question.category())) {
            throw new IllegalStateException("Follow-up " + question.id() + " selected twice for "
                    + record.getConversationId());
        }
        log.debug("[{}] Asking {} ({})", record.getConversationId(), question.id(), question.category());
        return EngineAction.ask(question.text());
    }

    private SymptomEntry activeEntry(IntakeRecord record) {
        if (!record.isSymptomMatched()) return catalog.fallback();
        return catalog.entry(record.getPrimarySymptom()).orElseGet(catalog::fallback);
    }

    private EngineAction complete(IntakeRecord record, Instant now, String why) {
        record.transitionTo(IntakeStatus.COMPLETE, now);
        log.info("[{}] Intake complete: {} ({} answers)", record.getConversationId(), why, record.getAnswers().size());
        return EngineAction.complete(record.toSnapshot());
    }

    // ---- abandonment ----

    private EngineAction abandon(String conversationId, String reason) {
        requireId(conversationId);
        return locks.withLock(conversationId, () -> {
            IntakeRecord record = store.load(conversationId).orElseThrow(() -> unknown(conversationId));
            if (record.isTerminal()) {
                return terminalAction(record);
            }
            record.abandon(reason, now());
            store.save(conversationId, record);
            log.info("[{}] Intake abandoned: {}", conversationId, reason);
            return EngineAction.abandoned(reason);
        });
    }

    // ---- helpers ----

    private String currentQuestion(IntakeRecord record) {
        if (record.hasPendingQuestion()) {
            return record.getPendingQuestionText();
        }
        switch (record.getStatus()) {
            case COLLECTING_DEMOGRAPHICS:
                return record.getTurnCount() == 0
                        ? phrases.greeting()
                        : demographicsPromptAgain(record);
            case COLLECTING_SYMPTOM:
                return record.getSymptomClarifications() > 0
                        ? phrases.symptomClarification()
                        : phrases.symptomPrompt(record.getName());
            default:
                return phrases.greeting();
        }
    }

    /** The last demographics prompt; nothing has been merged since it was asked. */
    private String demographicsPromptAgain(IntakeRecord record) {
        Set<IntakeField> asked = EnumSet.noneOf(IntakeField.class);
        for (IntakeField field : record.getLastAskedFields()) {
            if (!record.isProvided(field)) asked.add(field);
        }
        return phrases.demographicsPrompt(record.getName(), asked, providedDemographics(record));
    }

    private static EngineAction terminalAction(IntakeRecord record) {
        return record.getStatus() == IntakeStatus.COMPLETE
                ? EngineAction.complete(record.toSnapshot())
                : EngineAction.abandoned(record.getAbandonReason());
    }

    private static void requireId(String conversationId) {
        if (StringUtils.isBlank(conversationId)) {
            throw unknown(conversationId);
        }
    }

    private static UnknownConversationException unknown(String conversationId) {
        log.warn("Unknown conversation id '{}'", conversationId);
        return new UnknownConversationException(conversationId);
    }

    private Instant now() {
        return clock.instant();
    }
}
