package com.github.salilvnair.researchengine.config;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.AutoConfigurationPackage;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

import java.time.Clock;

@AutoConfiguration
@AutoConfigurationPackage(basePackages = "com.github.salilvnair.researchengine")
@ComponentScan(basePackages = "com.github.salilvnair.researchengine")
@EntityScan(basePackages = "com.github.salilvnair.researchengine.entity")
@EnableJpaRepositories(basePackages = "com.github.salilvnair.researchengine.repo")
public class ResearchEngineAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock researchEngineClock() {
        return Clock.systemUTC();
    }
}
