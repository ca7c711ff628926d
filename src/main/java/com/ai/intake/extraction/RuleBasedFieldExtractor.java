package com.ai.intake.extraction;

import com.ai.intake.catalog.CatalogMatch;
import com.ai.intake.catalog.SymptomCatalog;
import com.ai.intake.conversation.IntakeField;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic regex extractor. Used when no language model is configured and
 * throughout the engine tests.
 */
public class RuleBasedFieldExtractor implements FieldExtractor {

    private static final Pattern EMAIL = Pattern.compile(
            "[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}"
    );

    private static final Pattern NAME_EXPLICIT = Pattern.compile(
            "\\b(?:my name is|my name['’]s|name is|name\\s*[:=-]|call me)\\s*([a-z][a-z'-]*(?:\\s+[a-z][a-z'-]*){0,2})",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern NAME_INTRO = Pattern.compile(
            "\\b(?:i['’]m|i am|im|this is)\\s+([a-z][a-z'-]*(?:\\s+[a-z][a-z'-]*){0,2})",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern AGE_EXPLICIT = Pattern.compile(
            "\\b(\\d{1,3})\\s*-?\\s*(?:years?|yrs?)\\s*-?\\s*old\\b|\\b(\\d{1,3})\\s*y/?o\\b|\\baged?\\s*(?:is|:|=)?\\s*(\\d{1,3})\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern AGE_INTRO = Pattern.compile(
            "\\b(?:i['’]m|i am|im)\\s+(\\d{1,3})\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern BARE_NUMBER = Pattern.compile("^\\d{1,3}$");

    private static final Pattern SINGLE_NAME_SEGMENT = Pattern.compile("^[A-Za-z][A-Za-z'-]*(?:\\s+[A-Za-z][A-Za-z'-]*)?$");

    private static final Pattern GENDER = Pattern.compile(
            "\\b(male|female|man|woman|boy|girl|non[- ]?binary)\\b",
            Pattern.CASE_INSENSITIVE
    );

    /** Words that follow "I'm" / "I am" without being a name. */
    private static final Set<String> NOT_A_NAME = Set.of(
            "a", "an", "the", "and", "with", "from", "in", "at", "on", "of", "to", "for", "here", "so", "very",
            "really", "not", "also", "just", "currently", "still", "ok", "okay", "fine", "good", "well", "sick",
            "ill", "unwell", "feeling", "having", "experiencing", "suffering", "getting", "going", "doing",
            "been", "worried", "scared", "afraid", "concerned", "calling", "looking", "tired", "dizzy",
            "exhausted", "short", "pregnant", "male", "female", "man", "woman", "boy", "girl", "years", "year",
            "old", "since", "better", "worse", "sure", "yes", "no", "hi", "hello", "hey", "now", "today",
            "my", "i", "me", "have", "has", "had", "is", "am", "are", "was", "it", "that", "this", "there"
    );

    private final SymptomCatalog catalog;

    public RuleBasedFieldExtractor(SymptomCatalog catalog) {
        this.catalog = catalog;
    }

    @Override
    public String name() {
        return "rules";
    }

    @Override
    public ExtractedFields extract(String text, Set<IntakeField> missingFields) {
        if (StringUtils.isBlank(text)) return ExtractedFields.empty();
        ExtractedFields.Builder out = ExtractedFields.builder();

        String rest = text;
        Matcher email = EMAIL.matcher(text);
        if (email.find()) {
            out.put(IntakeField.EMAIL, email.group().toLowerCase(Locale.ROOT), 0.99);
            rest = text.substring(0, email.start()) + " " + text.substring(email.end());
        }

        extractName(rest, missingFields, out);
        extractAge(rest, missingFields, out);

        Matcher gender = GENDER.matcher(rest);
        if (gender.find()) {
            out.put(IntakeField.GENDER, normalizeGender(gender.group(1)), 0.9);
        }

        CatalogMatch symptom = catalog.lookup(rest);
        if (symptom.isMatched()) {
            out.put(IntakeField.SYMPTOM, symptom.entry().name(), 0.9);
        }
        return out.build();
    }

    private void extractName(String text, Set<IntakeField> missingFields, ExtractedFields.Builder out) {
        Matcher explicit = NAME_EXPLICIT.matcher(text);
        if (explicit.find()) {
            String name = cleanName(explicit.group(1));
            if (name != null) {
                out.put(IntakeField.NAME, name, 0.95);
                return;
            }
        }
        Matcher intro = NAME_INTRO.matcher(text);
        while (intro.find()) {
            String name = cleanName(intro.group(1));
            if (name != null) {
                boolean capitalized = Character.isUpperCase(intro.group(1).charAt(0));
                out.put(IntakeField.NAME, name, capitalized ? 0.8 : 0.55);
                return;
            }
        }
        if (missingFields.contains(IntakeField.NAME)) {
            // bare answers to the demographics question: "John Smith" or "John Smith, 28, male"
            String first = StringUtils.trimToEmpty(StringUtils.substringBefore(text, ","));
            if (SINGLE_NAME_SEGMENT.matcher(first).matches() && !catalog.lookup(first).isMatched()
                    && !GENDER.matcher(first).find()) {
                String name = cleanName(first);
                if (name != null && name.equalsIgnoreCase(StringUtils.normalizeSpace(first))) {
                    out.put(IntakeField.NAME, name, 0.6);
                }
            }
        }
    }

    private void extractAge(String text, Set<IntakeField> missingFields, ExtractedFields.Builder out) {
        Matcher explicit = AGE_EXPLICIT.matcher(text);
        if (explicit.find()) {
            out.put(IntakeField.AGE, firstGroup(explicit), 0.95);
            return;
        }
        Matcher intro = AGE_INTRO.matcher(text);
        if (intro.find()) {
            out.put(IntakeField.AGE, intro.group(1), 0.85);
            return;
        }
        if (missingFields.contains(IntakeField.AGE)) {
            for (String segment : StringUtils.split(text, ",;")) {
                String s = segment.trim();
                if (BARE_NUMBER.matcher(s).matches()) {
                    out.put(IntakeField.AGE, s, 0.7);
                    return;
                }
            }
        }
    }

    /**
     * Keeps leading words up to the first one that cannot be part of a name
     * (filler words, symptom words).
     */
    String cleanName(String candidate) {
        if (StringUtils.isBlank(candidate)) return null;
        List<String> kept = new ArrayList<>();
        for (String word : StringUtils.split(candidate.trim())) {
            String lower = word.toLowerCase(Locale.ROOT);
            if (NOT_A_NAME.contains(lower) || catalog.lookup(lower).isMatched()) break;
            kept.add(StringUtils.capitalize(lower));
        }
        return kept.isEmpty() ? null : String.join(" ", kept);
    }

    private static String firstGroup(Matcher m) {
        for (int i = 1; i <= m.groupCount(); i++) {
            if (m.group(i) != null) return m.group(i);
        }
        return null;
    }

    static String normalizeGender(String raw) {
        String g = raw.toLowerCase(Locale.ROOT);
        switch (g) {
            case "male":
            case "man":
            case "boy":
                return "Male";
            case "female":
            case "woman":
            case "girl":
                return "Female";
            default:
                return "Other";
        }
    }
}
