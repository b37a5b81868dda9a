package com.github.salilvnair.researchengine.integration.digest;

public record KeywordStat(
        String keyword,
        Integer count
) {}
