package com.github.salilvnair.researchengine.engine.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Classified purpose of a query. Parameters keep insertion order so that anything
 * rendered from them is stable.
 */
public record Intent(
        IntentType type,
        Map<String, Object> parameters,
        double confidence
) {

    public static final String KEYWORDS = "keywords";
    public static final String AUTHOR_NAME = "author_name";
    public static final String PAPER_ID = "paper_id";
    public static final String PAPER_TITLE = "paper_title";
    public static final String FIELD = "field";
    public static final String TIME_RANGE = "time_range";
    public static final String LIMIT = "limit";
    public static final String YEAR_FROM = "year_from";

    public Intent {
        if (type == null) {
            type = IntentType.UNKNOWN;
        }
        if (confidence < 0.0d || confidence > 1.0d || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("confidence must be within [0,1] but was " + confidence);
        }
        parameters = parameters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public static Intent unknown(double confidence) {
        return new Intent(IntentType.UNKNOWN, Map.of(), confidence);
    }

    public String stringParam(String name) {
        Object value = parameters.get(name);
        if (value == null) {
            return null;
        }
        String text = String.valueOf(value).trim();
        return text.isEmpty() ? null : text;
    }

    public Integer intParam(String name) {
        Object value = parameters.get(name);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text && text.trim().matches("\\d+")) {
            return Integer.parseInt(text.trim());
        }
        return null;
    }

    public List<String> listParam(String name) {
        Object value = parameters.get(name);
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        if (value instanceof String text && !text.isBlank()) {
            return List.of(text.trim());
        }
        return List.of();
    }
}
