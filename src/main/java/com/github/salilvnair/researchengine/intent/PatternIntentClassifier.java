package com.github.salilvnair.researchengine.intent;

import com.github.salilvnair.researchengine.engine.model.IntentType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Rule based classification. Rules are listed by precedence; the strongest match wins and
 * equal strengths are decided by list order.
 */
@Slf4j
@Component
public class PatternIntentClassifier {

    private static final String PAPER_ID =
            "\\b(?:doi:?\\s*10\\.\\d{4,9}/\\S+|arxiv:?\\s*\\d{4}\\.\\d{4,5}(?:v\\d+)?|paper[\\s_-]?id[:\\s#]+[\\w.\\-/]+)";

    private static final String CITATION_WORDS = "\\b(?:citations?|cited|citing|cites|references?|citation network|cite)\\b";

    private final List<IntentPattern> patterns = List.of(
            rule(IntentType.CITATION_ANALYSIS, MatchStrength.EXACT, "citation-structured-id",
                    "(?i)(?=.*" + CITATION_WORDS + ")(?=.*" + PAPER_ID + ").*"),
            rule(IntentType.CITATION_ANALYSIS, MatchStrength.STRONG, "structured-id",
                    "(?i)" + PAPER_ID),
            rule(IntentType.CITATION_ANALYSIS, MatchStrength.STRONG, "citation-of-paper",
                    "(?i)" + CITATION_WORDS + ".*(?:\"[^\"]+\"|“[^”]+”|\\b(?:this|that|the) paper\\b|\\bof\\b|\\bfor\\b|\\bto\\b)"),
            rule(IntentType.CITATION_ANALYSIS, MatchStrength.WEAK, "citation-word",
                    "(?i)" + CITATION_WORDS),

            rule(IntentType.AUTHOR_INFO, MatchStrength.STRONG, "author-phrase",
                    "(?i)\\b(?:who is|who's|profile of|papers (?:by|from|written by)|publications (?:by|of|from)|works? (?:by|of)|articles (?:by|from))\\b"),
            rule(IntentType.AUTHOR_INFO, MatchStrength.STRONG, "author-pronoun",
                    "(?i)\\b(?:his|her|their)\\s+(?:other\\s+)?(?:papers|publications|work|works|research|articles|collaborators)\\b"),
            rule(IntentType.AUTHOR_INFO, MatchStrength.WEAK, "author-word",
                    "(?i)\\b(?:authors?|researchers?|professor|scientist|collaborat\\w*)\\b"),

            rule(IntentType.KEYWORD_ANALYSIS, MatchStrength.STRONG, "keyword-phrase",
                    "(?i)\\b(?:top|popular|frequent|common|main|most used|trending)\\s+(?:\\d{1,3}\\s+)?(?:keywords?|key words|key terms|terms)\\b"),
            rule(IntentType.KEYWORD_ANALYSIS, MatchStrength.WEAK, "keyword-word",
                    "(?i)\\b(?:keywords?|key words|key terms)\\b"),

            rule(IntentType.TREND_ANALYSIS, MatchStrength.STRONG, "trend-phrase",
                    "(?i)\\b(?:trends?|trending|emerging|hot(?:test)? (?:topics?|papers|research)|rising|research landscape)\\b"),
            rule(IntentType.TREND_ANALYSIS, MatchStrength.WEAK, "trend-word",
                    "(?i)\\b(?:popular|latest developments|state of the art)\\b"),

            rule(IntentType.SEARCH_PAPERS, MatchStrength.STRONG, "search-verb-object",
                    "(?i)\\b(?:find|search|look(?:ing)? for|show(?: me)?|get|list|recommend|give me|any)\\b.*\\b(?:papers?|articles?|publications?|studies|literature|research)\\b"),
            rule(IntentType.SEARCH_PAPERS, MatchStrength.STRONG, "object-about",
                    "(?i)\\b(?:papers?|articles?|publications?|studies|literature|research)\\s+(?:about|on|regarding|related to|concerning|covering)\\b"),
            rule(IntentType.SEARCH_PAPERS, MatchStrength.WEAK, "search-word",
                    "(?i)\\b(?:papers?|articles?|publications?|search)\\b")
    );

    public Optional<IntentCandidate> classify(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        IntentCandidate best = null;
        for (IntentPattern pattern : patterns) {
            if (!pattern.regex().matcher(text).find()) {
                continue;
            }
            if (best == null || pattern.strength().compareTo(best.strength()) > 0) {
                best = new IntentCandidate(pattern.type(), pattern.strength(), pattern.name());
            }
        }
        if (best != null) {
            log.debug("Pattern classification intent={} strength={} rule={}", best.type(), best.strength(), best.matchedRule());
        }
        return Optional.ofNullable(best);
    }

    private static IntentPattern rule(IntentType type, MatchStrength strength, String name, String regex) {
        return new IntentPattern(type, strength, name, Pattern.compile(regex));
    }

    private record IntentPattern(IntentType type, MatchStrength strength, String name, Pattern regex) {}
}
