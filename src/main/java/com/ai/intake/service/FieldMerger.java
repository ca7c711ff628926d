package com.ai.intake.service;

import com.ai.intake.config.IntakePolicyProperties;
import com.ai.intake.conversation.IntakeField;
import com.ai.intake.conversation.IntakeRecord;
import com.ai.intake.conversation.IntakeStatus;
import com.ai.intake.extraction.ExtractedFields;
import com.ai.intake.extraction.ExtractedValue;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Applies extractor output to a record, one demographic field at a time.
 * A provided value is only replaced when the latest question asked about that field.
 */
@Component
public class FieldMerger {

    private static final Logger log = LoggerFactory.getLogger(FieldMerger.class);

    private static final Pattern EMAIL = Pattern.compile("^[a-z0-9._%+-]+@[a-z0-9-]+(\\.[a-z0-9-]+)*\\.[a-z]{2,}$");
    private static final Pattern NAME = Pattern.compile("^\\p{L}[\\p{L}'. -]{0,59}$");
    private static final int MAX_AGE = 120;

    private final IntakePolicyProperties policy;

    public FieldMerger(IntakePolicyProperties policy) {
        this.policy = policy;
    }

    public MergeResult merge(IntakeRecord record, ExtractedFields extracted) {
        Set<IntakeField> accepted = EnumSet.noneOf(IntakeField.class);
        Set<IntakeField> corrected = EnumSet.noneOf(IntakeField.class);
        Set<IntakeField> rejected = EnumSet.noneOf(IntakeField.class);

        for (IntakeField field : extracted.fields()) {
            if (!field.isDemographic()) continue;
            ExtractedValue proposed = extracted.get(field).orElseThrow();
            if (proposed.confidence() < policy.getMinConfidence()) {
                log.debug("[{}] {} below confidence ({})", record.getConversationId(), field, proposed.confidence());
                rejected.add(field);
                continue;
            }
            if (isUnprompted(record, field) && proposed.confidence() < policy.getUnpromptedMinConfidence()) {
                log.debug("[{}] unprompted {} below confidence ({})", record.getConversationId(), field,
                        proposed.confidence());
                rejected.add(field);
                continue;
            }
            Optional<String> normalized = normalize(field, proposed.value());
            if (normalized.isEmpty()) {
                log.debug("[{}] {} rejected as invalid", record.getConversationId(), field);
                rejected.add(field);
                continue;
            }
            String current = record.value(field);
            String value = normalized.get();
            if (current == null) {
                record.fill(field, value);
                accepted.add(field);
            } else if (current.equals(value)) {
                // same value again, nothing to do
            } else if (record.wasLastAskedAbout(field)) {
                record.fill(field, value);
                corrected.add(field);
                log.info("[{}] {} corrected after being asked", record.getConversationId(), field);
            } else {
                log.debug("[{}] conflicting {} ignored, value already provided", record.getConversationId(), field);
                rejected.add(field);
            }
        }
        return new MergeResult(accepted, corrected, rejected);
    }

    private static boolean isUnprompted(IntakeRecord record, IntakeField field) {
        return record.getStatus() != IntakeStatus.COLLECTING_DEMOGRAPHICS && !record.wasLastAskedAbout(field);
    }

    static Optional<String> normalize(IntakeField field, String raw) {
        String value = StringUtils.normalizeSpace(raw);
        if (StringUtils.isEmpty(value)) return Optional.empty();
        switch (field) {
            case NAME:
                if (!NAME.matcher(value).matches() || StringUtils.split(value).length > 3) return Optional.empty();
                return Optional.of(capitalizeWords(value));
            case AGE:
                String digits = StringUtils.getDigits(value);
                if (digits.isEmpty() || digits.length() > 3) return Optional.empty();
                int age = Integer.parseInt(digits);
                return age <= MAX_AGE ? Optional.of(Integer.toString(age)) : Optional.empty();
            case GENDER:
                return normalizeGender(value);
            case EMAIL:
                String email = value.toLowerCase(Locale.ROOT);
                return EMAIL.matcher(email).matches() ? Optional.of(email) : Optional.empty();
            default:
                return Optional.empty();
        }
    }

    private static Optional<String> normalizeGender(String value) {
        switch (value.toLowerCase(Locale.ROOT)) {
            case "m":
            case "male":
            case "man":
            case "boy":
                return Optional.of("Male");
            case "f":
            case "female":
            case "woman":
            case "girl":
                return Optional.of("Female");
            case "other":
            case "non-binary":
            case "nonbinary":
            case "non binary":
                return Optional.of("Other");
            default:
                return Optional.empty();
        }
    }

    private static String capitalizeWords(String value) {
        boolean mixedCase = !value.equals(value.toLowerCase(Locale.ROOT)) && !value.equals(value.toUpperCase(Locale.ROOT));
        if (mixedCase) return value;
        StringBuilder sb = new StringBuilder();
        for (String word : StringUtils.split(value.toLowerCase(Locale.ROOT))) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(StringUtils.capitalize(word));
        }
        return sb.toString();
    }

    public record MergeResult(Set<IntakeField> accepted, Set<IntakeField> corrected, Set<IntakeField> rejected) {

        public boolean changed() {
            return !accepted.isEmpty() || !corrected.isEmpty();
        }
    }
}
