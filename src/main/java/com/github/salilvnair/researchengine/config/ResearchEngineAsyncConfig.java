package com.github.salilvnair.researchengine.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "researchengine.async")
@Getter
@Setter
public class ResearchEngineAsyncConfig {
    private int corePoolSize = 8;
    private int maxPoolSize = 32;
    private int queueCapacity = 500;
    private String threadNamePrefix = "research-engine-";
}
