package com.github.salilvnair.researchengine.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "researchengine.dispatch")
@Getter
@Setter
public class ResearchEngineDispatchConfig {
    private int defaultSearchLimit = 6;
    private int authorPaperLimit = 10;
    private int keywordLimit = 20;
    private int networkDepth = 2;
    private String defaultTimeRange = "1year";
}
