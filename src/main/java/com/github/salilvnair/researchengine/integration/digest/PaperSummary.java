package com.github.salilvnair.researchengine.integration.digest;

import java.util.List;

public record PaperSummary(
        String id,
        String title,
        List<String> authors,
        Integer year,
        Integer citations,
        String venue
) {
    public PaperSummary {
        authors = authors == null ? List.of() : List.copyOf(authors);
    }
}
