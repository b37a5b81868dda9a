package com.github.salilvnair.researchengine.template;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.github.salilvnair.researchengine.support.TestConstants.AUTHOR_BENGIO;
import static com.github.salilvnair.researchengine.support.TestConstants.QUERY_DEEP_LEARNING;
import static com.github.salilvnair.researchengine.support.TestConstants.TITLE_ALZHEIMER;
import static org.junit.jupiter.api.Assertions.assertEquals;

class ThymeleafTemplateRendererTest {

    private final ThymeleafTemplateRenderer renderer = new ThymeleafTemplateRenderer();

    @Test
    void rendersDoubleBraceVariables() {
        String rendered = renderer.render("User query: {{query}}", Map.of("query", QUERY_DEEP_LEARNING));

        assertEquals("User query: " + QUERY_DEEP_LEARNING, rendered);
    }

    @Test
    void rendersHashExpressionsWithFallback() {
        String rendered = renderer.render("#{history ?: 'none'}", Map.of("query", QUERY_DEEP_LEARNING));

        assertEquals("none", rendered);
    }

    @Test
    void rendersSingleBracketExpressions() {
        String rendered = renderer.render("Author: [${author.name}]", Map.of("author", Map.of("name", AUTHOR_BENGIO)));

        assertEquals("Author: " + AUTHOR_BENGIO, rendered);
    }

    @Test
    void preservesQuotesAndSpecialCharactersInValues() {
        String value = "Who cites \"Attention Is All You Need\" {v2} $5 \\path";
        String rendered = renderer.render("Query: {{query}}", Map.of("query", value));

        assertEquals("Query: " + value, rendered);
    }

    @Test
    void markupCharactersAreNotEscaped() {
        String rendered = renderer.render("Title: {{title}} / #{title} / [${title}]", Map.of("title", TITLE_ALZHEIMER));

        assertEquals("Title: " + TITLE_ALZHEIMER + " / " + TITLE_ALZHEIMER + " / " + TITLE_ALZHEIMER, rendered);
    }

    @Test
    void blankTemplateIsReturnedAsIs() {
        assertEquals("", renderer.render(null, Map.of()));
        assertEquals("  ", renderer.render("  ", null));
    }
}
