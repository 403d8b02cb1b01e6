package com.stockdash.migration;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Structured SQL built from ordered chunks plus positional values.
 * <p>
 * A chunk is literal SQL text, a nested fragment, or a {@link Raw} value spliced in verbatim.
 * Value {@code i}, when present, is rendered right after chunk {@code i}. Values are inlined as
 * text, so fragments must only ever carry trusted, hand-authored input.
 */
public final class QueryFragment {
    private final List<Object> chunks;
    private final List<Object> values;

    private QueryFragment(List<Object> chunks, List<Object> values) {
        this.chunks = Collections.unmodifiableList(new ArrayList<>(chunks));
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static QueryFragment of(Object... chunks) {
        return new QueryFragment(chunks == null ? List.of() : Arrays.asList(chunks), List.of());
    }

    public static Raw raw(Object value) {
        return new Raw(value);
    }

    public QueryFragment withValues(Object... values) {
        return new QueryFragment(chunks, values == null ? List.of() : Arrays.asList(values));
    }

    public List<Object> chunks() {
        return chunks;
    }

    public List<Object> values() {
        return values;
    }

    /**
     * Verbatim SQL text. The value is a string or a list whose elements are joined without separator.
     */
    public static final class Raw {
        private final Object value;

        private Raw(Object value) {
            this.value = value;
        }

        public Object value() {
            return value;
        }
    }
}
