package com.ai.intake.conversation;

import java.util.EnumSet;
import java.util.Set;

/**
 * Slots the extractor can fill from free text.
 */
public enum IntakeField {
    NAME("name", true),
    AGE("age", false),
    GENDER("gender", false),
    EMAIL("email", true),
    SYMPTOM("symptom", false);

    private final String key;
    private final boolean required;

    IntakeField(String key, boolean required) {
        this.key = key;
        this.required = required;
    }

    /** JSON key used in extractor prompts and responses. */
    public String key() {
        return key;
    }

    /** Required to leave the demographics phase (subject to the retry cap). */
    public boolean isRequired() {
        return required;
    }

    public boolean isDemographic() {
        return this != SYMPTOM;
    }

    public static Set<IntakeField> demographics() {
        return EnumSet.of(NAME, AGE, GENDER, EMAIL);
    }

    public static IntakeField fromKey(String key) {
        for (IntakeField f : values()) {
            if (f.key.equalsIgnoreCase(key)) return f;
        }
        return null;
    }
}
