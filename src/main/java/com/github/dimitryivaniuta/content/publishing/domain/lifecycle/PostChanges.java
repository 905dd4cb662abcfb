package com.github.dimitryivaniuta.content.publishing.domain.lifecycle;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Field updates computed by the transition engine.
 *
 * <p>A field mapped to {@code null} is cleared; a field absent from the map is left untouched.
 * Instances are immutable and applied to a post in a single write.</p>
 */
public final class PostChanges {

    private static final PostChanges NONE = new PostChanges(new EnumMap<>(PostField.class));

    private final Map<PostField, Object> values;

    private PostChanges(EnumMap<PostField, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    /**
     * Changes that touch no field.
     *
     * @return empty changes
     */
    public static PostChanges none() {
        return NONE;
    }

    /**
     * Starts a new set of changes.
     *
     * @return builder
     */
    public static Builder builder() {
        return new Builder();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public boolean touches(PostField field) {
        return values.containsKey(field);
    }

    /**
     * Returns true when the field is explicitly cleared.
     *
     * @param field field
     * @return true if mapped to null
     */
    public boolean clears(PostField field) {
        return values.containsKey(field) && values.get(field) == null;
    }

    /**
     * Typed read of a changed value.
     *
     * @param field field
     * @param type expected type
     * @param <T> value type
     * @return new value, or null when cleared or untouched
     */
    public <T> T valueOf(PostField field, Class<T> type) {
        return type.cast(values.get(field));
    }

    /**
     * Read-only view of all changes, in {@link PostField} declaration order.
     *
     * @return changes
     */
    public Map<PostField, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "PostChanges" + values;
    }

    /**
     * Builder validating value types against {@link PostField#type()}.
     */
    public static final class Builder {

        private final EnumMap<PostField, Object> values = new EnumMap<>(PostField.class);

        private Builder() {
        }

        public Builder set(PostField field, Object value) {
            if (value == null) {
                return clear(field);
            }
            if (!field.type().isInstance(value)) {
                throw new IllegalArgumentException(field + " expects " + field.type().getSimpleName()
                        + " but got " + value.getClass().getSimpleName());
            }
            values.put(field, value);
            return this;
        }

        public Builder clear(PostField field) {
            if (!field.isNullable()) {
                throw new IllegalArgumentException(field + " cannot be cleared");
            }
            values.put(field, null);
            return this;
        }

        public PostChanges build() {
            return values.isEmpty() ? NONE : new PostChanges(values.clone());
        }
    }
}
