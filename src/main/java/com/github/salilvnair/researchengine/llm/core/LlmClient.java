package com.github.salilvnair.researchengine.llm.core;

/**
 * Text generation capability of the language model service.
 * Implementations throw {@link com.github.salilvnair.researchengine.engine.exception.ResearchEngineException}
 * with {@code GENERATION_FAILURE} or {@code LLM_TIMEOUT} when no text can be produced.
 */
public interface LlmClient {
    String generate(String prompt, LlmGenerationOptions options);
}
