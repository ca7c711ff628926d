package com.ai.intake.conversation;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Accumulated state of one intake conversation. Mutated only by the dialogue
 * engine while it holds the conversation's lock; stores keep their own copies.
 */
@Getter
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE,
        setterVisibility = JsonAutoDetect.Visibility.NONE)
public class IntakeRecord {

    private String conversationId;
    private IntakeStatus status = IntakeStatus.COLLECTING_DEMOGRAPHICS;

    private String name;
    private Integer age;
    private String gender;
    private String email;

    /** Catalog name when matched, otherwise the patient's accepted wording. */
    private String primarySymptom;
    private String symptomWording;
    private boolean symptomMatched;
    private int symptomClarifications;

    private List<AnsweredQuestion> answers = new ArrayList<>();
    @JsonDeserialize(as = LinkedHashSet.class)
    private Set<String> askedQuestionIds = new LinkedHashSet<>();
    private Map<QuestionCategory, Integer> categoryTurns = new EnumMap<>(QuestionCategory.class);

    private String pendingQuestionId;
    private String pendingQuestionText;
    private QuestionCategory pendingCategory;

    /** Fields the latest question asked about; only these may be corrected once provided. */
    private Set<IntakeField> lastAskedFields = EnumSet.noneOf(IntakeField.class);
    private Map<IntakeField, Integer> fieldAsks = new EnumMap<>(IntakeField.class);
    private Map<IntakeField, Integer> fieldMisses = new EnumMap<>(IntakeField.class);

    private int turnCount;
    private String abandonReason;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant completedAt;
    private Instant abandonedAt;

    /** Version of the stored copy this record was loaded from; null until first persisted. */
    @JsonIgnore
    private Long revision;

    IntakeRecord() {
    }

    public static IntakeRecord start(String conversationId, Instant now) {
        IntakeRecord record = new IntakeRecord();
        record.conversationId = conversationId;
        record.createdAt = now;
        record.updatedAt = now;
        return record;
    }

    public void transitionTo(IntakeStatus next, Instant now) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal intake transition " + status + " -> " + next
                    + " for conversation " + conversationId);
        }
        status = next;
        updatedAt = now;
        if (next == IntakeStatus.COMPLETE && completedAt == null) {
            completedAt = now;
        }
        if (next == IntakeStatus.ABANDONED && abandonedAt == null) {
            abandonedAt = now;
        }
    }

    public void abandon(String reason, Instant now) {
        transitionTo(IntakeStatus.ABANDONED, now);
        abandonReason = reason;
        pendingQuestionId = null;
        pendingQuestionText = null;
        pendingCategory = null;
    }

    public void setRevision(Long revision) {
        this.revision = revision;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public void nextTurn(Instant now) {
        turnCount++;
        updatedAt = now;
    }

    // ---- slots ----

    public boolean isProvided(IntakeField field) {
        return value(field) != null;
    }

    public String value(IntakeField field) {
        switch (field) {
            case NAME:
                return name;
            case AGE:
                return age != null ? age.toString() : null;
            case GENDER:
                return gender;
            case EMAIL:
                return email;
            case SYMPTOM:
                return primarySymptom;
            default:
                return null;
        }
    }

    /**
     * Stores an already validated demographic value. The symptom slot is set through
     * {@link #setPrimarySymptom} only.
     */
    public void fill(IntakeField field, String value) {
        switch (field) {
            case NAME:
                name = value;
                break;
            case AGE:
                age = Integer.valueOf(value);
                break;
            case GENDER:
                gender = value;
                break;
            case EMAIL:
                email = value;
                break;
            default:
                throw new IllegalArgumentException("Not a demographic field: " + field);
        }
    }

    public Set<IntakeField> missingFields() {
        Set<IntakeField> missing = EnumSet.noneOf(IntakeField.class);
        for (IntakeField f : IntakeField.values()) {
            if (!isProvided(f)) missing.add(f);
        }
        return missing;
    }

    public void setPrimarySymptom(String symptom, String wording, boolean matched) {
        if (primarySymptom != null) {
            throw new IllegalStateException("Primary symptom already set for conversation " + conversationId);
        }
        primarySymptom = symptom;
        symptomWording = wording;
        symptomMatched = matched;
    }

    public void incrementSymptomClarifications() {
        symptomClarifications++;
    }

    // ---- loop guards ----

    public int asks(IntakeField field) {
        return fieldAsks.getOrDefault(field, 0);
    }

    public int misses(IntakeField field) {
        return fieldMisses.getOrDefault(field, 0);
    }

    public void recordMiss(IntakeField field) {
        fieldMisses.merge(field, 1, Integer::sum);
    }

    public void recordFieldQuestion(Set<IntakeField> fields) {
        lastAskedFields = fields.isEmpty() ? EnumSet.noneOf(IntakeField.class) : EnumSet.copyOf(fields);
        for (IntakeField f : fields) {
            fieldAsks.merge(f, 1, Integer::sum);
        }
    }

    /** Lets already provided fields be corrected on the next turn without counting as an ask. */
    public void allowCorrection(Set<IntakeField> fields) {
        lastAskedFields.addAll(fields);
    }

    public void clearLastAskedFields() {
        lastAskedFields = EnumSet.noneOf(IntakeField.class);
    }

    public boolean wasLastAskedAbout(IntakeField field) {
        return lastAskedFields.contains(field);
    }

    // ---- follow-ups ----

    public boolean hasAsked(String questionId) {
        return askedQuestionIds.contains(questionId);
    }

    public int categoryTurns(QuestionCategory category) {
        return categoryTurns.getOrDefault(category, 0);
    }

    /**
     * Registers a follow-up as asked and pending. Returns false, leaving the record
     * untouched, if the id was asked before.
     */
    public boolean markAsked(String questionId, String questionText, QuestionCategory category) {
        if (!askedQuestionIds.add(questionId)) {
            return false;
        }
        categoryTurns.merge(category, 1, Integer::sum);
        pendingQuestionId = questionId;
        pendingQuestionText = questionText;
        pendingCategory = category;
        clearLastAskedFields();
        return true;
    }

    public boolean hasPendingQuestion() {
        return pendingQuestionId != null;
    }

    public AnsweredQuestion recordAnswer(String answer) {
        if (pendingQuestionId == null) {
            throw new IllegalStateException("No pending question for conversation " + conversationId);
        }
        AnsweredQuestion answered = new AnsweredQuestion(pendingQuestionId, pendingQuestionText, pendingCategory,
                answer == null ? "" : answer.trim());
        answers.add(answered);
        pendingQuestionId = null;
        pendingQuestionText = null;
        pendingCategory = null;
        return answered;
    }

    public List<AnsweredQuestion> getAnswers() {
        return Collections.unmodifiableList(answers);
    }

    public Set<String> getAskedQuestionIds() {
        return Collections.unmodifiableSet(askedQuestionIds);
    }

    public IntakeSnapshot toSnapshot() {
        return new IntakeSnapshot(conversationId, status, name, age, gender, email,
                primarySymptom, symptomWording, symptomMatched, List.copyOf(answers),
                createdAt, completedAt, abandonReason);
    }

    public IntakeRecord copy() {
        IntakeRecord c = new IntakeRecord();
        c.conversationId = conversationId;
        c.status = status;
        c.name = name;
        c.age = age;
        c.gender = gender;
        c.email = email;
        c.primarySymptom = primarySymptom;
        c.symptomWording = symptomWording;
        c.symptomMatched = symptomMatched;
        c.symptomClarifications = symptomClarifications;
        c.answers = new ArrayList<>(answers);
        c.askedQuestionIds = new LinkedHashSet<>(askedQuestionIds);
        c.categoryTurns = new EnumMap<>(QuestionCategory.class);
        c.categoryTurns.putAll(categoryTurns);
        c.pendingQuestionId = pendingQuestionId;
        c.pendingQuestionText = pendingQuestionText;
        c.pendingCategory = pendingCategory;
        c.lastAskedFields = EnumSet.noneOf(IntakeField.class);
        c.lastAskedFields.addAll(lastAskedFields);
        c.fieldAsks = new EnumMap<>(IntakeField.class);
        c.fieldAsks.putAll(fieldAsks);
        c.fieldMisses = new EnumMap<>(IntakeField.class);
        c.fieldMisses.putAll(fieldMisses);
        c.turnCount = turnCount;
        c.abandonReason = abandonReason;
        c.createdAt = createdAt;
        c.updatedAt = updatedAt;
        c.completedAt = completedAt;
        c.abandonedAt = abandonedAt;
        c.revision = revision;
        return c;
    }
}
