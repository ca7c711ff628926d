package com.ai.intake.catalog;

import com.ai.intake.conversation.QuestionCategory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SymptomCatalogTest {

    private final SymptomCatalog catalog = CatalogFixtures.standard();

    @ParameterizedTest
    @CsvSource({
        "'I have chest pain',                          chest pain",
        "'CHEST PAIN!!',                               chest pain",
        "'my chest hurts when I climb stairs',         chest pain",
        "'I get short of breath walking',              shortness of breath",
        "'I have a racing heart at night',            palpitations",
        "'feeling lightheaded',                        dizziness",
        "'so tired lately',                            fatigue",
        "'swollen ankles since monday',                leg swelling",
        "'I passed out yesterday',                     fainting",
    })
    void matchesNamesAndSynonyms(String text, String expected) {
        CatalogMatch match = catalog.lookup(text);
        assertTrue(match.isMatched(), text);
        assertEquals(expected, match.entry().name());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "my elbow is weird", "chestpain", "I feel tiredish"})
    void unknownTextIsNoMatch(String text) {
        CatalogMatch match = catalog.lookup(text);
        assertFalse(match.isMatched());
        assertSame(CatalogMatch.noMatch(), match);
    }

    @Test
    void longestPhraseWins() {
        SymptomCatalog c = new SymptomCatalog(List.of(
                CatalogFixtures.entry("pain", List.of(), List.of()),
                CatalogFixtures.entry("chest pain", List.of(), List.of())), null);
        assertEquals("chest pain", c.lookup("bad chest pain").entry().name());
        assertEquals("pain", c.lookup("back pain").entry().name());
    }

    @Test
    void matchWithNoQuestionsIsStillAMatch() {
        SymptomCatalog c = new SymptomCatalog(List.of(CatalogFixtures.entry("hiccups", List.of(), List.of())), null);
        CatalogMatch match = c.lookup("I have hiccups");
        assertTrue(match.isMatched());
        assertTrue(match.entry().questions().isEmpty());
    }

    @Test
    void duplicateNamesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new SymptomCatalog(List.of(
                CatalogFixtures.entry("Fatigue", List.of(), List.of()),
                CatalogFixtures.entry("fatigue", List.of(), List.of())), null));
    }

    @Test
    void fallbackIsNotReachableThroughLookup() {
        assertEquals("general", catalog.fallback().name());
        assertFalse(catalog.fallback().questions().isEmpty());
        assertFalse(catalog.lookup("general").isMatched());
    }

    @Test
    void missingFallbackBecomesEmptyEntry() {
        SymptomCatalog c = new SymptomCatalog(List.of(), null);
        assertEquals(0, c.size());
        assertTrue(c.fallback().questions().isEmpty());
    }

    @Test
    void shippedCatalogIsConsistent() {
        assertEquals(7, catalog.size());
        for (SymptomEntry e : catalog.entries()) {
            assertFalse(e.questions().isEmpty(), e.name());
            long distinct = e.questions().stream().map(FollowUpQuestion::id).distinct().count();
            assertEquals(e.questions().size(), distinct, "duplicate question id in " + e.name());
        }
        assertTrue(catalog.entry("Chest Pain").isPresent());
        assertEquals(QuestionCategory.DETAIL, catalog.entry("chest pain").orElseThrow().questions().get(0).category());
    }

    @Test
    void redFlagTriggersAreWordBounded() {
        SymptomEntry chestPain = catalog.entry("chest pain").orElseThrow();
        assertTrue(chestPain.hasRedFlagTrigger("it radiates to my LEFT ARM"));
        assertTrue(chestPain.hasRedFlagTrigger("Sudden, crushing pain"));
        assertFalse(chestPain.hasRedFlagTrigger("it started suddenly"));
        assertFalse(chestPain.hasRedFlagTrigger(null));
    }
}
