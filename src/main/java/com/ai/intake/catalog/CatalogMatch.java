package com.ai.intake.catalog;

import java.util.NoSuchElementException;

/**
 * Result of a catalog lookup. A match whose entry has no questions is still a
 * match; {@link #noMatch()} means the text named no known symptom.
 */
public final class CatalogMatch {

    private static final CatalogMatch NO_MATCH = new CatalogMatch(null, null);

    private final SymptomEntry entry;
    private final String matchedPhrase;

    private CatalogMatch(SymptomEntry entry, String matchedPhrase) {
        this.entry = entry;
        this.matchedPhrase = matchedPhrase;
    }

    public static CatalogMatch matched(SymptomEntry entry, String matchedPhrase) {
        return new CatalogMatch(entry, matchedPhrase);
    }

    public static CatalogMatch noMatch() {
        return NO_MATCH;
    }

    public boolean isMatched() {
        return entry != null;
    }

    public SymptomEntry entry() {
        if (entry == null) throw new NoSuchElementException("No catalog match");
        return entry;
    }

    public String matchedPhrase() {
        return matchedPhrase;
    }

    @Override
    public String toString() {
        return isMatched() ? "Matched(" + entry.name() + ")" : "NoMatch";
    }
}
