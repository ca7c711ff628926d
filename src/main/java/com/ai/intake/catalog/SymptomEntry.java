package com.ai.intake.catalog;

import java.util.List;

/**
 * One catalog symptom: its name, the phrasings that map to it, the words in
 * patient answers that promote red-flag questions, and its ordered follow-ups.
 */
public record SymptomEntry(String name, List<String> synonyms, List<String> redFlagTriggers,
                           List<FollowUpQuestion> questions) {

    public SymptomEntry {
        synonyms = synonyms == null ? List.of() : List.copyOf(synonyms);
        redFlagTriggers = redFlagTriggers == null ? List.of() : List.copyOf(redFlagTriggers);
        questions = questions == null ? List.of() : List.copyOf(questions);
    }

    public boolean hasRedFlagTrigger(String text) {
        String normalized = SymptomCatalog.normalize(text);
        if (normalized.isEmpty()) return false;
        for (String trigger : redFlagTriggers) {
            if (SymptomCatalog.containsPhrase(normalized, SymptomCatalog.normalize(trigger))) {
                return true;
            }
        }
        return false;
    }
}
