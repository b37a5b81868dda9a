package com.github.salilvnair.researchengine.integration.digest;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.salilvnair.researchengine.dispatch.ToolNames;
import com.github.salilvnair.researchengine.engine.mcp.payload.ToolPayloadReader;
import com.github.salilvnair.researchengine.engine.model.AggregatedResult;
import com.github.salilvnair.researchengine.engine.model.ToolExchange;
import com.github.salilvnair.researchengine.engine.model.ToolResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Slf4j
@Component
@RequiredArgsConstructor
public class ResultDigester {

    private static final int MAX_NOTE_LENGTH = 600;

    private final ToolPayloadReader payloadReader;

    public ResearchDigest digest(AggregatedResult aggregated) {
        List<PaperSummary> papers = new ArrayList<>();
        List<AuthorSummary> authors = new ArrayList<>();
        List<KeywordStat> keywords = new ArrayList<>();
        List<PaperSummary> citingPapers = new ArrayList<>();
        List<String> networkNotes = new ArrayList<>();
        List<String> notes = new ArrayList<>();
        Set<String> dataSources = new LinkedHashSet<>();
        Set<String> unavailable = new LinkedHashSet<>();

        for (ToolExchange exchange : aggregated.exchanges()) {
            ToolResult result = exchange.result();
            if (result.isFailed()) {
                unavailable.add(result.toolName());
                log.warn("Tool result excluded tool={} id={} status={} errorCode={} detail={}",
                        result.toolName(), result.correlationId(), result.status(),
                        result.error() == null ? null : result.error().code(),
                        result.error() == null ? null : result.error().detail());
                continue;
            }
            dataSources.add(result.toolName());
            JsonNode data = payloadReader.data(result);
            if (data.isMissingNode() || data.isNull()) {
                payloadReader.text(result).ifPresent(text -> notes.add(truncate(text)));
                continue;
            }
            switch (result.toolName()) {
                case ToolNames.SEARCH_PAPERS, ToolNames.GET_AUTHOR_PAPERS, ToolNames.GET_TRENDING_PAPERS ->
                        addPapers(papers, list(data, "papers", "results", "trending_papers", "data"));
                case ToolNames.GET_PAPER_DETAILS ->
                        paper(data.has("paper") ? data.get("paper") : data).ifPresent(paper -> addPapers(papers, paper));
                case ToolNames.GET_PAPER_CITATIONS ->
                        addPapers(citingPapers, list(data, "citations", "citing_papers", "papers", "data"));
                case ToolNames.SEARCH_AUTHORS -> {
                    for (JsonNode node : list(data, "authors", "results", "data")) {
                        author(node).ifPresent(authors::add);
                    }
                }
                case ToolNames.GET_TOP_KEYWORDS -> {
                    for (JsonNode node : list(data, "keywords", "results", "data")) {
                        keyword(node).ifPresent(keywords::add);
                    }
                }
                case ToolNames.GET_CITATION_NETWORK, ToolNames.GET_COLLABORATION_NETWORK ->
                        networkNotes.add(networkNote(result.toolName(), data));
                default -> notes.add(truncate(summaryText(data)));
            }
        }
        return new ResearchDigest(papers, authors, keywords, citingPapers, networkNotes, notes,
                new ArrayList<>(dataSources), new ArrayList<>(unavailable));
    }

    private void addPapers(List<PaperSummary> target, List<JsonNode> nodes) {
        for (JsonNode node : nodes) {
            paper(node).ifPresent(paper -> addPapers(target, paper));
        }
    }

    private void addPapers(List<PaperSummary> target, PaperSummary paper) {
        boolean duplicate = target.stream().anyMatch(existing ->
                (paper.id() != null && paper.id().equals(existing.id()))
                        || existing.title().equalsIgnoreCase(paper.title()));
        if (!duplicate) {
            target.add(paper);
        }
    }

    private Optional<PaperSummary> paper(JsonNode node) {
        String title = text(node, "title");
        if (title == null) {
            return Optional.empty();
        }
        List<String> authorNames = new ArrayList<>();
        for (JsonNode author : node.path("authors")) {
            String name = author.isTextual() ? author.asText() : text(author, "name");
            if (name != null && !name.isBlank()) {
                authorNames.add(name);
            }
        }
        return Optional.of(new PaperSummary(
                text(node, "id", "paper_id", "paperId"),
                title,
                authorNames,
                year(node),
                integer(node, "citations", "citation_count", "citationCount", "cited_by_count"),
                text(node, "venue_name", "venue", "journal")
        ));
    }

    private Optional<AuthorSummary> author(JsonNode node) {
        String name = node.isTextual() ? node.asText() : text(node, "name");
        if (name == null) {
            return Optional.empty();
        }
        List<String> areas = new ArrayList<>();
        for (JsonNode area : node.path("research_areas")) {
            areas.add(area.asText());
        }
        return Optional.of(new AuthorSummary(
                text(node, "id", "author_id", "authorId"),
                name,
                text(node, "affiliation", "institution"),
                integer(node, "paper_count", "papers_count", "works_count"),
                integer(node, "h_index", "hIndex"),
                areas
        ));
    }

    private Optional<KeywordStat> keyword(JsonNode node) {
        String keyword = node.isTextual() ? node.asText() : text(node, "keyword", "name", "term");
        if (keyword == null) {
            return Optional.empty();
        }
        return Optional.of(new KeywordStat(keyword, node.isObject() ? integer(node, "count", "frequency", "paper_count") : null));
    }

    private String networkNote(String toolName, JsonNode data) {
        JsonNode nodes = data.path("nodes");
        JsonNode edges = data.has("edges") ? data.path("edges") : data.path("links");
        String subject = ToolNames.GET_COLLABORATION_NETWORK.equals(toolName) ? "Collaboration network" : "Citation network";
        return subject + ": " + (nodes.isArray() ? nodes.size() : 0) + " nodes, "
                + (edges.isArray() ? edges.size() : 0) + " connections";
    }

    private String summaryText(JsonNode data) {
        String summary = text(data, "summary", "description", "message");
        if (summary != null) {
            return summary;
        }
        List<String> items = new ArrayList<>();
        for (JsonNode item : list(data, "trends", "items", "data")) {
            String value = item.isTextual() ? item.asText() : text(item, "name", "topic", "title", "keyword");
            if (value != null) {
                items.add(value);
            }
        }
        return items.isEmpty() ? data.toString() : String.join(", ", items);
    }

    private static List<JsonNode> list(JsonNode data, String... fields) {
        JsonNode array = data.isArray() ? data : null;
        for (int i = 0; array == null && i < fields.length; i++) {
            if (data.path(fields[i]).isArray()) {
                array = data.get(fields[i]);
            }
        }
        List<JsonNode> nodes = new ArrayList<>();
        if (array != null) {
            array.forEach(nodes::add);
        }
        return nodes;
    }

    private static String text(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isValueNode() && !value.asText().isBlank()) {
                return value.asText().trim();
            }
            if (value != null && value.isObject() && value.hasNonNull("name")) {
                return value.get("name").asText().trim();
            }
        }
        return null;
    }

    private static Integer integer(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isNumber()) {
                return value.asInt();
            }
            if (value != null && value.isTextual() && value.asText().trim().matches("\\d+")) {
                return Integer.parseInt(value.asText().trim());
            }
        }
        return null;
    }

    private static Integer year(JsonNode node) {
        Integer year = integer(node, "year", "publication_year");
        if (year != null) {
            return year;
        }
        JsonNode published = node.has("published_at") ? node.get("published_at") : node.get("publication_date");
        if (published == null || published.isNull()) {
            return null;
        }
        if (published.isNumber()) {
            return Instant.ofEpochSecond(published.asLong()).atZone(ZoneOffset.UTC).getYear();
        }
        String text = published.asText("");
        return text.matches("^\\d{4}.*") ? Integer.parseInt(text.substring(0, 4)) : null;
    }

    private static String truncate(String text) {
        return text.length() <= MAX_NOTE_LENGTH ? text : text.substring(0, MAX_NOTE_LENGTH) + "...";
    }
}
