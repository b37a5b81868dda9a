package com.github.salilvnair.researchengine.intent;

import com.github.salilvnair.researchengine.engine.model.ConversationTurn;
import com.github.salilvnair.researchengine.engine.model.Intent;
import com.github.salilvnair.researchengine.engine.model.IntentType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fills the typed parameters of an intent from the query text, falling back to earlier
 * turns when the query refers to an author or paper by pronoun.
 */
@Component
public class SlotExtractor {

    private static final Pattern TOPIC_AFTER_OBJECT = Pattern.compile(
            "(?i)\\b(?:papers?|articles?|publications?|research|studies|literature|work)\\s+(?:about|on|regarding|related to|concerning|covering|in|for)\\s+(.+)");
    private static final Pattern TOPIC_AFTER_PREPOSITION = Pattern.compile(
            "(?i)\\b(?:about|regarding|related to|concerning|covering)\\s+(.+)");
    private static final Pattern LIMIT = Pattern.compile(
            "(?i)\\b(?:top|first)\\s+(\\d{1,3})\\b|\\b(\\d{1,3})\\s+(?:papers|articles|publications|results|keywords|authors)\\b");
    private static final Pattern YEAR_FROM = Pattern.compile(
            "(?i)\\b(?:since|after|from|published after)\\s+((?:19|20)\\d{2})\\b");
    private static final Pattern TIME_RANGE = Pattern.compile(
            "(?i)\\b(?:over|during|in|for|within)?\\s*(?:the\\s+)?(?:last|past|this)\\s+(?:(\\d{1,2})\\s+)?(year|month|week|day)s?\\b");
    private static final Pattern FIELD = Pattern.compile(
            "(?i)\\b(?:in|of|for|within|across)\\s+(?:the\\s+)?(?:field of\\s+|area of\\s+|domain of\\s+)?(.+)$");
    private static final Pattern NOISE_SUFFIX = Pattern.compile(
            "(?i)[\\s,]*(?:\\b(?:please|thanks|thank you|recently|lately))?[\\s?.!]*$");

    private static final String NAME = "([A-Z][\\p{L}'\\-]*\\.?(?:\\s+[A-Z][\\p{L}'\\-]*\\.?){0,3})";
    private static final Pattern NAME_AFTER_MARKER = Pattern.compile(
            "(?:[Pp]apers|[Pp]ublications|[Ww]orks?|[Aa]rticles|[Rr]esearch)\\s+(?:by|from|written by|of)\\s+" + NAME
                    + "|(?:[Ww]ho is|[Ww]ho's|[Pp]rofile of|[Aa]bout|[Aa]uthor|[Rr]esearcher|[Pp]rofessor|[Dd]r\\.?)\\s+" + NAME);
    private static final Pattern LOWERCASE_NAME_AFTER_MARKER = Pattern.compile(
            "(?i)\\b(?:papers by|publications by|works? by|who is|who's|profile of|author|researcher|professor)\\s+([\\p{L}'\\-.]+(?:\\s+[\\p{L}'\\-.]+){0,2})");
    private static final Pattern CAPITALIZED_RUN = Pattern.compile(
            "\\b[A-Z][\\p{L}'\\-]*\\.?(?:\\s+[A-Z][\\p{L}'\\-]*\\.?)+");

    private static final Pattern DOI = Pattern.compile("(?i)\\bdoi:?\\s*(10\\.\\d{4,9}/[^\\s,;?]+)");
    private static final Pattern ARXIV = Pattern.compile("(?i)\\barxiv:?\\s*(\\d{4}\\.\\d{4,5}(?:v\\d+)?)");
    private static final Pattern PAPER_ID = Pattern.compile("(?i)\\bpaper[\\s_-]?id[:\\s#]+([\\w.\\-/]+)");
    private static final Pattern QUOTED_TITLE = Pattern.compile("[\"“]([^\"”]{3,})[\"”]");
    private static final Pattern TITLE_AFTER_CITATION = Pattern.compile(
            "(?i)\\bcit\\w*\\s+(?:of|for|to)\\s+(?:the\\s+)?(?:paper\\s+)?(?!this\\b|that\\b|it\\b|paper\\b)(.+)");

    private static final Pattern PERSON_PRONOUN = Pattern.compile(
            "(?i)\\b(?:he|him|his|she|her|hers|they|them|their|this author|that author|the author|this researcher|that researcher)\\b");
    private static final Pattern PAPER_PRONOUN = Pattern.compile(
            "(?i)\\b(?:this paper|that paper|the paper|this one|that one|it)\\b");

    private static final Set<String> NAME_STOP_WORDS = Set.of(
            "who", "what", "find", "show", "tell", "me", "papers", "paper", "search", "list", "get", "give",
            "the", "a", "an", "i", "please", "can", "could", "is", "are", "about", "author", "professor", "dr", "dr.",
            "researcher", "information", "profile", "his", "her", "their", "and", "or",
            "he", "him", "she", "they", "them", "this", "that", "it");

    private static final Set<String> SEARCH_FILLER_WORDS = new LinkedHashSet<>(Arrays.asList(
            "find", "search", "show", "me", "get", "list", "recommend", "give", "look", "looking", "for", "some", "any",
            "papers", "paper", "articles", "article", "publications", "publication", "studies", "literature",
            "research", "the", "a", "an", "please", "can", "could", "you", "i", "want", "need", "to", "recent",
            "latest", "new", "on", "about", "of", "in", "related", "with", "what", "are", "is", "there"));

    public SlotFill extract(IntentType type, String text, List<ConversationTurn> recentTurns) {
        String query = text == null ? "" : text.trim();
        return switch (type) {
            case SEARCH_PAPERS -> searchSlots(query);
            case AUTHOR_INFO -> authorSlots(query, recentTurns);
            case CITATION_ANALYSIS -> citationSlots(query, recentTurns);
            case TREND_ANALYSIS -> trendSlots(query);
            case KEYWORD_ANALYSIS -> keywordSlots(query);
            case UNKNOWN -> new SlotFill(Map.of(), false, false);
        };
    }

    /**
     * Re-checks parameters that did not come from this extractor, e.g. a model answer.
     */
    public boolean requiredSlotMissing(IntentType type, Map<String, Object> parameters) {
        Intent probe = new Intent(type, parameters, 0.0d);
        return switch (type) {
            case SEARCH_PAPERS -> probe.listParam(Intent.KEYWORDS).isEmpty();
            case AUTHOR_INFO -> probe.stringParam(Intent.AUTHOR_NAME) == null;
            case CITATION_ANALYSIS -> probe.stringParam(Intent.PAPER_ID) == null && probe.stringParam(Intent.PAPER_TITLE) == null;
            case TREND_ANALYSIS, KEYWORD_ANALYSIS, UNKNOWN -> false;
        };
    }

    private SlotFill searchSlots(String query) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        String remainder = query;

        Matcher limit = LIMIT.matcher(remainder);
        if (limit.find()) {
            parameters.put(Intent.LIMIT, Integer.parseInt(limit.group(1) != null ? limit.group(1) : limit.group(2)));
            remainder = remainder.substring(0, limit.start()) + " " + remainder.substring(limit.end());
        }
        Matcher year = YEAR_FROM.matcher(remainder);
        if (year.find()) {
            parameters.put(Intent.YEAR_FROM, Integer.parseInt(year.group(1)));
            remainder = remainder.substring(0, year.start()) + " " + remainder.substring(year.end());
        }

        List<String> keywords = keywords(remainder);
        if (!keywords.isEmpty()) {
            parameters.put(Intent.KEYWORDS, keywords);
        }
        return new SlotFill(order(parameters), keywords.isEmpty(), false);
    }

    private List<String> keywords(String text) {
        String topic = firstGroup(TOPIC_AFTER_OBJECT, text);
        if (topic == null) {
            topic = firstGroup(TOPIC_AFTER_PREPOSITION, text);
        }
        if (topic == null) {
            topic = stripFillers(text);
        }
        List<String> keywords = new ArrayList<>();
        for (String part : clean(topic).split("\\s*(?:,|;|\\band\\b|&)\\s*")) {
            String keyword = stripFillers(part).toLowerCase(Locale.ROOT);
            if (!keyword.isBlank() && !keywords.contains(keyword)) {
                keywords.add(keyword);
            }
        }
        return keywords;
    }

    private SlotFill authorSlots(String query, List<ConversationTurn> recentTurns) {
        String name = authorName(query);
        if (name != null) {
            return new SlotFill(Map.of(Intent.AUTHOR_NAME, name), false, false);
        }
        if (PERSON_PRONOUN.matcher(query).find()) {
            Object previous = latestParameter(recentTurns, Intent.AUTHOR_NAME);
            if (previous != null) {
                return new SlotFill(Map.of(Intent.AUTHOR_NAME, previous), false, true);
            }
        }
        return new SlotFill(Map.of(), true, false);
    }

    private String authorName(String query) {
        Matcher marker = NAME_AFTER_MARKER.matcher(query);
        while (marker.find()) {
            String candidate = marker.group(1) != null ? marker.group(1) : marker.group(2);
            String name = trimName(candidate);
            if (name != null) {
                return name;
            }
        }
        Matcher run = CAPITALIZED_RUN.matcher(query);
        while (run.find()) {
            String name = trimName(run.group());
            if (name != null && name.contains(" ")) {
                return name;
            }
        }
        Matcher lowercase = LOWERCASE_NAME_AFTER_MARKER.matcher(query);
        if (lowercase.find()) {
            return trimName(lowercase.group(1));
        }
        return null;
    }

    private String trimName(String candidate) {
        if (candidate == null) {
            return null;
        }
        List<String> tokens = new ArrayList<>();
        for (String token : candidate.replaceAll("'s\\b", "").replaceAll("[?!,;:]", " ").trim().split("\\s+")) {
            if (token.isBlank()) {
                continue;
            }
            if (NAME_STOP_WORDS.contains(token.toLowerCase(Locale.ROOT))) {
                if (tokens.isEmpty()) {
                    continue;
                }
                break;
            }
            tokens.add(token);
        }
        if (tokens.isEmpty()) {
            return null;
        }
        String name = String.join(" ", tokens);
        return name.endsWith(".") && !name.matches(".*\\b\\p{L}\\.$") ? name.substring(0, name.length() - 1) : name;
    }

    private SlotFill citationSlots(String query, List<ConversationTurn> recentTurns) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        String paperId = firstGroup(DOI, query);
        if (paperId == null) {
            paperId = firstGroup(ARXIV, query);
        }
        if (paperId == null) {
            paperId = firstGroup(PAPER_ID, query);
        }
        if (paperId != null) {
            parameters.put(Intent.PAPER_ID, paperId);
        }
        String title = firstGroup(QUOTED_TITLE, query);
        if (title == null && paperId == null) {
            title = firstGroup(TITLE_AFTER_CITATION, query);
        }
        if (title != null && !clean(title).isBlank()) {
            parameters.put(Intent.PAPER_TITLE, clean(title));
        }
        if (!parameters.isEmpty()) {
            return new SlotFill(parameters, false, false);
        }
        if (PAPER_PRONOUN.matcher(query).find()) {
            Object previousId = latestParameter(recentTurns, Intent.PAPER_ID);
            Object previousTitle = latestParameter(recentTurns, Intent.PAPER_TITLE);
            if (previousId != null) {
                parameters.put(Intent.PAPER_ID, previousId);
            }
            if (previousTitle != null) {
                parameters.put(Intent.PAPER_TITLE, previousTitle);
            }
            if (!parameters.isEmpty()) {
                return new SlotFill(parameters, false, true);
            }
        }
        return new SlotFill(Map.of(), true, false);
    }

    private SlotFill trendSlots(String query) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        String remainder = query;
        Matcher range = TIME_RANGE.matcher(remainder);
        if (range.find()) {
            String amount = range.group(1) == null ? "1" : range.group(1);
            String unit = range.group(2).toLowerCase(Locale.ROOT);
            parameters.put(Intent.TIME_RANGE, amount + unit + ("1".equals(amount) ? "" : "s"));
            remainder = remainder.substring(0, range.start()) + " " + remainder.substring(range.end());
        }
        String field = field(remainder);
        if (field != null) {
            parameters.put(Intent.FIELD, field);
        }
        return new SlotFill(order(parameters), false, false);
    }

    private SlotFill keywordSlots(String query) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        String remainder = query;
        Matcher limit = LIMIT.matcher(remainder);
        if (limit.find()) {
            parameters.put(Intent.LIMIT, Integer.parseInt(limit.group(1) != null ? limit.group(1) : limit.group(2)));
            remainder = remainder.substring(0, limit.start()) + " " + remainder.substring(limit.end());
        }
        String field = field(remainder);
        if (field != null) {
            parameters.put(Intent.FIELD, field);
        }
        return new SlotFill(order(parameters), false, false);
    }

    private String field(String text) {
        String field = firstGroup(FIELD, text.trim());
        if (field == null) {
            return null;
        }
        String cleaned = stripFillers(clean(field)).toLowerCase(Locale.ROOT);
        return cleaned.isBlank() ? null : cleaned;
    }

    private Object latestParameter(List<ConversationTurn> recentTurns, String name) {
        if (recentTurns == null) {
            return null;
        }
        for (int i = recentTurns.size() - 1; i >= 0; i--) {
            Object value = recentTurns.get(i).parameters().get(name);
            if (value != null && !String.valueOf(value).isBlank()) {
                return value;
            }
        }
        return null;
    }

    private static String firstGroup(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher.group(1).trim() : null;
    }

    private static String clean(String text) {
        return NOISE_SUFFIX.matcher(text.trim()).replaceAll("").trim();
    }

    private static String stripFillers(String text) {
        List<String> kept = new ArrayList<>();
        for (String token : text.replaceAll("[?!.]", " ").trim().split("\\s+")) {
            if (!token.isBlank() && !SEARCH_FILLER_WORDS.contains(token.toLowerCase(Locale.ROOT))) {
                kept.add(token);
            }
        }
        return String.join(" ", kept);
    }

    private static Map<String, Object> order(Map<String, Object> parameters) {
        Map<String, Object> ordered = new LinkedHashMap<>();
        parameters.keySet().stream().sorted().forEach(key -> ordered.put(key, parameters.get(key)));
        return ordered;
    }
}
