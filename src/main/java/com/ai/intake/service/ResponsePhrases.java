package com.ai.intake.service;

import com.ai.intake.conversation.IntakeField;
import com.ai.intake.conversation.IntakeSnapshot;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Patient-facing wording for the intake. The engine decides what to ask; this only words it.
 */
@Component
public class ResponsePhrases {

    public String greeting() {
        return "Hello! I'm the clinic's intake assistant. Before you see the doctor, could you tell me "
                + "your name, age, gender and email address?";
    }

    /**
     * Asks for the missing {@code fields}. When some details are already {@code known}
     * the patient is told they can still correct them.
     */
    public String demographicsPrompt(String knownName, Set<IntakeField> fields, Set<IntakeField> known) {
        String opener = StringUtils.isNotBlank(knownName) ? "Thanks, " + knownName + ". " : "Thanks. ";
        String question;
        if (fields.isEmpty()) {
            question = "Could you share your email address so the doctor can reach you?";
        } else {
            List<String> labels = new ArrayList<>();
            for (IntakeField f : fields) {
                labels.add(label(f));
            }
            question = "Could you also tell me your " + joinLabels(labels) + "?";
        }
        return known.isEmpty() ? opener + question : opener + question + " If I got anything wrong, just tell me.";
    }

    public String symptomPrompt(String knownName) {
        String thanks = StringUtils.isNotBlank(knownName) ? "Thank you, " + knownName + ". " : "Thank you. ";
        return thanks + "What is the main symptom or concern that brings you in today?";
    }

    public String symptomClarification() {
        return "I want to make sure I understand. Could you describe the main symptom in a few words, "
                + "for example chest pain, shortness of breath or dizziness?";
    }

    public String completed(IntakeSnapshot snapshot) {
        StringBuilder sb = new StringBuilder("Thank you");
        if (StringUtils.isNotBlank(snapshot.name())) sb.append(", ").append(snapshot.name());
        sb.append(". I've passed your information about ").append(snapshot.symptom())
                .append(" to the doctor");
        if (StringUtils.isNotBlank(snapshot.email())) {
            sb.append(", and a confirmation will be sent to ").append(snapshot.email());
        }
        sb.append(". If your symptoms get suddenly worse, please call emergency services.");
        return sb.toString();
    }

    public String abandoned(String reason) {
        if ("contact email not provided".equals(reason)) {
            return "I'm sorry, I can't finish your intake without an email address. Please start again when you have one.";
        }
        return "This intake has been closed. You're welcome to start a new one at any time.";
    }

    private static String label(IntakeField field) {
        return field == IntakeField.EMAIL ? "email address" : field.key();
    }

    private static String joinLabels(List<String> labels) {
        if (labels.size() == 1) return labels.get(0);
        return String.join(", ", labels.subList(0, labels.size() - 1)) + " and " + labels.get(labels.size() - 1);
    }
}
