package com.github.salilvnair.researchengine.integration.digest;

import java.util.List;

public record AuthorSummary(
        String id,
        String name,
        String affiliation,
        Integer paperCount,
        Integer hIndex,
        List<String> researchAreas
) {
    public AuthorSummary {
        researchAreas = researchAreas == null ? List.of() : List.copyOf(researchAreas);
    }
}
