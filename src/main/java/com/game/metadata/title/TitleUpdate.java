package com.game.metadata.title;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A field-level patch for a {@link GameTitle}.
 *
 * <p>A field that is absent from the patch is left alone. A field present with a
 * {@code null} value is cleared.</p>
 */
public class TitleUpdate {

    private final Map<TitleField, Object> values = new EnumMap<>(TitleField.class);

    public TitleUpdate set(TitleField field, Object value) {
        Objects.requireNonNull(field, "field is required");
        if (value != null && !field.getValueType().isInstance(value)) {
            throw new IllegalArgumentException("Field " + field.getKey() + " expects "
                    + field.getValueType().getSimpleName() + " but got " + value.getClass().getSimpleName());
        }
        values.put(field, value);
        return this;
    }

    public TitleUpdate clear(TitleField field) {
        return set(field, null);
    }

    public boolean contains(TitleField field) {
        return values.containsKey(field);
    }

    public Object get(TitleField field) {
        return values.get(field);
    }

    public String getString(TitleField field) {
        return (String) values.get(field);
    }

    public Integer getInteger(TitleField field) {
        return (Integer) values.get(field);
    }

    public Boolean getBoolean(TitleField field) {
        return (Boolean) values.get(field);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Map<TitleField, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    /**
     * Property names of the patched fields, in declaration order.
     */
    public List<String> fieldNames() {
        return values.keySet().stream().map(TitleField::getKey).toList();
    }

    @Override
    public String toString() {
        return "TitleUpdate" + values;
    }
}
