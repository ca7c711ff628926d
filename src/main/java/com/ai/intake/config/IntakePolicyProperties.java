package com.ai.intake.config;

import com.ai.intake.conversation.QuestionCategory;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.EnumMap;
import java.util.Map;

/**
 * Conversation policy thresholds ({@code intake.policy.*}).
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "intake.policy")
public class IntakePolicyProperties {

    /** Follow-up answers needed before the intake is complete. */
    private int minFollowUps = 2;

    /** Demographic turns a required field may stay missing before the engine moves on. */
    private int demographicRetryCap = 2;

    /** Clarifying questions asked when the symptom matches nothing in the catalog. */
    private int symptomClarifications = 1;

    /** Extracted values below this confidence are ignored. */
    private double minConfidence = 0.5;

    /**
     * Once demographics are over, a value for a field the last question did not ask
     * about is only taken at this confidence or above.
     */
    private double unpromptedMinConfidence = 0.8;

    /** Questions asked per category for the active symptom. */
    private Map<QuestionCategory, Integer> categoryCaps = defaultCaps();

    public int capFor(QuestionCategory category) {
        Integer cap = categoryCaps.get(category);
        return cap != null ? cap : 0;
    }

    private static Map<QuestionCategory, Integer> defaultCaps() {
        Map<QuestionCategory, Integer> caps = new EnumMap<>(QuestionCategory.class);
        caps.put(QuestionCategory.DETAIL, 2);
        caps.put(QuestionCategory.VITAL_SIGN, 1);
        caps.put(QuestionCategory.RED_FLAG, 1);
        return caps;
    }
}
