package com.ai.intake.extraction;

import com.ai.intake.conversation.IntakeField;
import org.apache.commons.lang3.StringUtils;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Partial field map returned by an extractor. Fields it could not determine are absent;
 * blank values are never stored.
 */
public final class ExtractedFields {

    private static final ExtractedFields EMPTY = new ExtractedFields(new EnumMap<>(IntakeField.class));

    private final Map<IntakeField, ExtractedValue> values;

    private ExtractedFields(EnumMap<IntakeField, ExtractedValue> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static ExtractedFields empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<ExtractedValue> get(IntakeField field) {
        return Optional.ofNullable(values.get(field));
    }

    public Optional<String> value(IntakeField field) {
        return get(field).map(ExtractedValue::value);
    }

    public boolean contains(IntakeField field) {
        return values.containsKey(field);
    }

    public Set<IntakeField> fields() {
        return values.keySet();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public String toString() {
        return values.toString();
    }

    public static final class Builder {
        private final EnumMap<IntakeField, ExtractedValue> values = new EnumMap<>(IntakeField.class);

        public Builder put(IntakeField field, String value, double confidence) {
            if (field != null && StringUtils.isNotBlank(value)) {
                values.put(field, new ExtractedValue(value.trim(), confidence));
            }
            return this;
        }

        public ExtractedFields build() {
            return values.isEmpty() ? EMPTY : new ExtractedFields(values.clone());
        }
    }
}
