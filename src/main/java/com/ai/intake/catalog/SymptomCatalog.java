package com.ai.intake.catalog;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable symptom reference data. Lookups are case-insensitive and match any
 * synonym word-bounded inside the text; the longest matching phrase wins.
 */
public class SymptomCatalog {

    private final Map<String, SymptomEntry> entriesByName = new LinkedHashMap<>();
    private final List<PhraseIndex> phrases = new ArrayList<>();
    private final SymptomEntry fallback;

    private record PhraseIndex(String phrase, SymptomEntry entry) {
    }

    public SymptomCatalog(List<SymptomEntry> entries, SymptomEntry fallback) {
        for (SymptomEntry e : entries) {
            String key = normalize(e.name());
            if (entriesByName.putIfAbsent(key, e) != null) {
                throw new IllegalArgumentException("Duplicate catalog symptom: " + e.name());
            }
            phrases.add(new PhraseIndex(key, e));
            for (String synonym : e.synonyms()) {
                String s = normalize(synonym);
                if (!s.isEmpty()) phrases.add(new PhraseIndex(s, e));
            }
        }
        phrases.sort((a, b) -> Integer.compare(b.phrase().length(), a.phrase().length()));
        this.fallback = fallback != null ? fallback : new SymptomEntry("general", List.of(), List.of(), List.of());
    }

    public CatalogMatch lookup(String symptomText) {
        String text = normalize(symptomText);
        if (text.isEmpty()) return CatalogMatch.noMatch();
        for (PhraseIndex p : phrases) {
            if (containsPhrase(text, p.phrase())) {
                return CatalogMatch.matched(p.entry(), p.phrase());
            }
        }
        return CatalogMatch.noMatch();
    }

    public Optional<SymptomEntry> entry(String name) {
        return Optional.ofNullable(entriesByName.get(normalize(name)));
    }

    /** Generic follow-ups used when the patient's symptom matched nothing. Not reachable through lookup. */
    public SymptomEntry fallback() {
        return fallback;
    }

    public List<SymptomEntry> entries() {
        return Collections.unmodifiableList(new ArrayList<>(entriesByName.values()));
    }

    public int size() {
        return entriesByName.size();
    }

    static String normalize(String text) {
        if (StringUtils.isBlank(text)) return "";
        String lower = text.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", " ");
        return StringUtils.normalizeSpace(lower);
    }

    static boolean containsPhrase(String normalizedText, String normalizedPhrase) {
        if (normalizedPhrase.isEmpty()) return false;
        return (" " + normalizedText + " ").contains(" " + normalizedPhrase + " ");
    }
}
