package com.github.salilvnair.researchengine.annotation;

import com.github.salilvnair.researchengine.config.ResearchEngineAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(ResearchEngineAutoConfiguration.class)
public @interface EnableResearchEngine {
}
