package com.ai.intake.conversation;

/**
 * One follow-up question and the patient's reply, in ask order.
 */
public record AnsweredQuestion(String questionId, String question, QuestionCategory category, String answer) {
}
