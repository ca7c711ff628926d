package com.ai.intake.conversation;

/**
 * Follow-up question categories, declared in default asking priority.
 */
public enum QuestionCategory {
    RED_FLAG,
    DETAIL,
    VITAL_SIGN
}
