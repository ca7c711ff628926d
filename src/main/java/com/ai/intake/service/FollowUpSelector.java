package com.ai.intake.service;

import com.ai.intake.catalog.FollowUpQuestion;
import com.ai.intake.catalog.SymptomEntry;
import com.ai.intake.config.IntakePolicyProperties;
import com.ai.intake.conversation.AnsweredQuestion;
import com.ai.intake.conversation.IntakeRecord;
import com.ai.intake.conversation.QuestionCategory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Picks the next follow-up for the active symptom. Red-flag questions go first once a
 * trigger shows up in what the patient said; otherwise detail, vital signs, red flags.
 */
@Component
public class FollowUpSelector {

    static final List<QuestionCategory> DEFAULT_ORDER =
            List.of(QuestionCategory.DETAIL, QuestionCategory.VITAL_SIGN, QuestionCategory.RED_FLAG);
    static final List<QuestionCategory> RED_FLAG_ORDER =
            List.of(QuestionCategory.RED_FLAG, QuestionCategory.DETAIL, QuestionCategory.VITAL_SIGN);

    private final IntakePolicyProperties policy;

    public FollowUpSelector(IntakePolicyProperties policy) {
        this.policy = policy;
    }

    public Optional<FollowUpQuestion> select(IntakeRecord record, SymptomEntry entry) {
        for (QuestionCategory category : categoryOrder(record, entry)) {
            if (record.categoryTurns(category) >= policy.capFor(category)) continue;
            for (FollowUpQuestion q : entry.questions()) {
                if (q.category() == category && !record.hasAsked(q.id())) {
                    return Optional.of(q);
                }
            }
        }
        return Optional.empty();
    }

    public List<QuestionCategory> categoryOrder(IntakeRecord record, SymptomEntry entry) {
        return redFlagRaised(record, entry) ? RED_FLAG_ORDER : DEFAULT_ORDER;
    }

    boolean redFlagRaised(IntakeRecord record, SymptomEntry entry) {
        if (entry.hasRedFlagTrigger(record.getSymptomWording())) return true;
        for (AnsweredQuestion a : record.getAnswers()) {
            if (entry.hasRedFlagTrigger(a.answer())) return true;
        }
        return false;
    }
}
