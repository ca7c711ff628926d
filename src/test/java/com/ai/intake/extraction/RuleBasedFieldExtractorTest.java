package com.ai.intake.extraction;

import com.ai.intake.catalog.CatalogFixtures;
import com.ai.intake.conversation.IntakeField;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RuleBasedFieldExtractorTest {

    private static final Set<IntakeField> ALL_MISSING = EnumSet.allOf(IntakeField.class);
    private static final Set<IntakeField> NONE_MISSING = EnumSet.noneOf(IntakeField.class);

    private final RuleBasedFieldExtractor extractor = new RuleBasedFieldExtractor(CatalogFixtures.standard());

    @Test
    void extractsEveryFieldFromOneIntroduction() {
        ExtractedFields fields = extractor.extract("I'm John, 28, male, john@example.com, chest pain", ALL_MISSING);

        assertEquals("John", fields.value(IntakeField.NAME).orElseThrow());
        assertEquals("28", fields.value(IntakeField.AGE).orElseThrow());
        assertEquals("Male", fields.value(IntakeField.GENDER).orElseThrow());
        assertEquals("john@example.com", fields.value(IntakeField.EMAIL).orElseThrow());
        assertEquals("chest pain", fields.value(IntakeField.SYMPTOM).orElseThrow());
    }

    @Test
    void explicitNameStopsAtFillerWords() {
        ExtractedFields fields = extractor.extract("My name is sarah connor and I am 45 years old", ALL_MISSING);

        assertEquals("Sarah Connor", fields.value(IntakeField.NAME).orElseThrow());
        assertEquals(0.95, fields.get(IntakeField.NAME).orElseThrow().confidence());
        assertEquals("45", fields.value(IntakeField.AGE).orElseThrow());
    }

    @Test
    void feelingsAreNotNames() {
        ExtractedFields fields = extractor.extract("I'm feeling dizzy", ALL_MISSING);

        assertFalse(fields.contains(IntakeField.NAME));
        assertEquals("dizziness", fields.value(IntakeField.SYMPTOM).orElseThrow());
    }

    @Test
    void durationIsNotAnAge() {
        ExtractedFields fields = extractor.extract("I have had chest pain for 2 years", ALL_MISSING);

        assertFalse(fields.contains(IntakeField.AGE));
        assertTrue(fields.contains(IntakeField.SYMPTOM));
    }

    @Test
    void lowercaseIntroductionGetsLowerConfidence() {
        ExtractedFields fields = extractor.extract("i'm anna", ALL_MISSING);

        assertEquals("Anna", fields.value(IntakeField.NAME).orElseThrow());
        assertTrue(fields.get(IntakeField.NAME).orElseThrow().confidence() < 0.8);
    }

    @Test
    void bareAnswersOnlyCountForMissingFields() {
        assertEquals("Maria Lopez", extractor.extract("Maria Lopez", ALL_MISSING).value(IntakeField.NAME).orElseThrow());
        assertFalse(extractor.extract("Maria Lopez", NONE_MISSING).contains(IntakeField.NAME));

        assertEquals("42", extractor.extract("42", ALL_MISSING).value(IntakeField.AGE).orElseThrow());
        assertFalse(extractor.extract("42", NONE_MISSING).contains(IntakeField.AGE));
    }

    @Test
    void bareSymptomIsNotTakenAsName() {
        ExtractedFields fields = extractor.extract("palpitations", ALL_MISSING);

        assertFalse(fields.contains(IntakeField.NAME));
        assertEquals("palpitations", fields.value(IntakeField.SYMPTOM).orElseThrow());
    }

    @ParameterizedTest
    @CsvSource({
        "'female',            Female",
        "'I am a woman',      Female",
        "'man',               Male",
        "'non-binary',        Other",
    })
    void normalizesGender(String text, String expected) {
        assertEquals(expected, extractor.extract(text, ALL_MISSING).value(IntakeField.GENDER).orElseThrow());
    }

    @Test
    void emailIsLowercased() {
        ExtractedFields fields = extractor.extract("reach me at JOHN.Doe@Example.COM please", ALL_MISSING);

        assertEquals("john.doe@example.com", fields.value(IntakeField.EMAIL).orElseThrow());
    }

    @Test
    void blankTextExtractsNothing() {
        assertTrue(extractor.extract("   ", ALL_MISSING).isEmpty());
        assertEquals("rules", extractor.name());
    }
}
