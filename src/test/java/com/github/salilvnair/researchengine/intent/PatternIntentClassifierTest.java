package com.github.salilvnair.researchengine.intent;

import com.github.salilvnair.researchengine.engine.model.IntentType;
import org.junit.jupiter.api.Test;

import static com.github.salilvnair.researchengine.support.TestConstants.QUERY_CITATIONS_BY_DOI;
import static com.github.salilvnair.researchengine.support.TestConstants.QUERY_CITATIONS_BY_TITLE;
import static com.github.salilvnair.researchengine.support.TestConstants.QUERY_DEEP_LEARNING;
import static com.github.salilvnair.researchengine.support.TestConstants.QUERY_GREETING;
import static com.github.salilvnair.researchengine.support.TestConstants.QUERY_HIS_PAPERS;
import static com.github.salilvnair.researchengine.support.TestConstants.QUERY_TOP_KEYWORDS;
import static com.github.salilvnair.researchengine.support.TestConstants.QUERY_TRENDS;
import static com.github.salilvnair.researchengine.support.TestConstants.QUERY_WHO_IS_BENGIO;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PatternIntentClassifierTest {

    private final PatternIntentClassifier classifier = new PatternIntentClassifier();

    @Test
    void searchRequestIsStrongSearchPapers() {
        IntentCandidate candidate = classifier.classify(QUERY_DEEP_LEARNING).orElseThrow();

        assertEquals(IntentType.SEARCH_PAPERS, candidate.type());
        assertEquals(MatchStrength.STRONG, candidate.strength());
    }

    @Test
    void structuredPaperIdWithCitationWordsIsExact() {
        IntentCandidate exact = classifier.classify(QUERY_CITATIONS_BY_DOI).orElseThrow();
        IntentCandidate phrased = classifier.classify(QUERY_CITATIONS_BY_TITLE).orElseThrow();

        assertEquals(IntentType.CITATION_ANALYSIS, exact.type());
        assertEquals(MatchStrength.EXACT, exact.strength());
        assertEquals(IntentType.CITATION_ANALYSIS, phrased.type());
        assertEquals(MatchStrength.STRONG, phrased.strength());
    }

    @Test
    void authorPronounOutranksGenericSearchOnTie() {
        IntentCandidate candidate = classifier.classify(QUERY_HIS_PAPERS).orElseThrow();

        assertEquals(IntentType.AUTHOR_INFO, candidate.type());
        assertEquals("author-pronoun", candidate.matchedRule());
    }

    @Test
    void classifiesRemainingIntentTypes() {
        assertEquals(IntentType.AUTHOR_INFO, classifier.classify(QUERY_WHO_IS_BENGIO).orElseThrow().type());
        assertEquals(IntentType.TREND_ANALYSIS, classifier.classify(QUERY_TRENDS).orElseThrow().type());
        assertEquals(IntentType.KEYWORD_ANALYSIS, classifier.classify(QUERY_TOP_KEYWORDS).orElseThrow().type());
    }

    @Test
    void unrelatedTextHasNoCandidate() {
        assertTrue(classifier.classify(QUERY_GREETING).isEmpty());
        assertTrue(classifier.classify("  ").isEmpty());
    }
}
