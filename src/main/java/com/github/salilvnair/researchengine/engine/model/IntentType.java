package com.github.salilvnair.researchengine.engine.model;

import java.util.Arrays;
import java.util.Locale;

public enum IntentType {

    SEARCH_PAPERS("search_papers"),
    AUTHOR_INFO("author_info"),
    CITATION_ANALYSIS("citation_analysis"),
    TREND_ANALYSIS("trend_analysis"),
    KEYWORD_ANALYSIS("keyword_analysis"),
    UNKNOWN("unknown");

    private final String code;

    IntentType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static IntentType fromCode(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.code.equals(normalized) || type.name().equalsIgnoreCase(normalized))
                .findFirst()
                .orElse(UNKNOWN);
    }
}
