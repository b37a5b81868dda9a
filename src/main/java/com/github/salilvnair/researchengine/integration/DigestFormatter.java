package com.github.salilvnair.researchengine.integration;

import com.github.salilvnair.researchengine.integration.digest.AuthorSummary;
import com.github.salilvnair.researchengine.integration.digest.KeywordStat;
import com.github.salilvnair.researchengine.integration.digest.PaperSummary;
import com.github.salilvnair.researchengine.integration.digest.ResearchDigest;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Plain text sections of a digest. Shared by the prompt and the templated fallback answer.
 */
@Component
public class DigestFormatter {

    static final int MAX_PAPERS = 10;
    static final int MAX_AUTHORS = 5;
    static final int MAX_KEYWORDS = 15;
    static final int MAX_AUTHOR_NAMES = 3;

    public String format(ResearchDigest digest) {
        List<String> sections = new ArrayList<>();
        if (!digest.papers().isEmpty()) {
            sections.add(papers("Papers", digest.papers()));
        }
        if (!digest.authors().isEmpty()) {
            sections.add(authors(digest.authors()));
        }
        if (!digest.citingPapers().isEmpty()) {
            sections.add(papers("Citing papers", digest.citingPapers()));
        }
        if (!digest.networkNotes().isEmpty()) {
            sections.add(bullets("Networks", digest.networkNotes()));
        }
        if (!digest.keywords().isEmpty()) {
            sections.add(keywords(digest.keywords()));
        }
        if (!digest.notes().isEmpty()) {
            sections.add(bullets("Notes", digest.notes()));
        }
        return String.join("\n\n", sections);
    }

    private String papers(String heading, List<PaperSummary> papers) {
        StringBuilder out = new StringBuilder(heading).append(" (").append(papers.size()).append("):");
        int index = 1;
        for (PaperSummary paper : papers.subList(0, Math.min(MAX_PAPERS, papers.size()))) {
            out.append('\n').append(index++).append(". ").append(paper.title());
            List<String> details = new ArrayList<>();
            if (!paper.authors().isEmpty()) {
                details.add(authorNames(paper.authors()));
            }
            if (paper.year() != null) {
                details.add(String.valueOf(paper.year()));
            }
            if (paper.venue() != null) {
                details.add(paper.venue());
            }
            if (paper.citations() != null) {
                details.add(paper.citations() + " citations");
            }
            if (!details.isEmpty()) {
                out.append(" (").append(String.join("; ", details)).append(')');
            }
        }
        return out.toString();
    }

    private String authors(List<AuthorSummary> authors) {
        StringBuilder out = new StringBuilder("Researchers (").append(authors.size()).append("):");
        for (AuthorSummary author : authors.subList(0, Math.min(MAX_AUTHORS, authors.size()))) {
            out.append("\n- ").append(author.name());
            List<String> details = new ArrayList<>();
            if (author.affiliation() != null) {
                details.add(author.affiliation());
            }
            if (author.paperCount() != null) {
                details.add(author.paperCount() + " papers");
            }
            if (author.hIndex() != null) {
                details.add("h-index " + author.hIndex());
            }
            if (!author.researchAreas().isEmpty()) {
                details.add("areas: " + String.join(", ", author.researchAreas()));
            }
            if (!details.isEmpty()) {
                out.append(" (").append(String.join("; ", details)).append(')');
            }
        }
        return out.toString();
    }

    private String keywords(List<KeywordStat> keywords) {
        List<String> items = new ArrayList<>();
        for (KeywordStat keyword : keywords.subList(0, Math.min(MAX_KEYWORDS, keywords.size()))) {
            items.add(keyword.count() == null ? keyword.keyword() : keyword.keyword() + " (" + keyword.count() + ")");
        }
        return "Top keywords: " + String.join(", ", items);
    }

    private String bullets(String heading, List<String> lines) {
        StringBuilder out = new StringBuilder(heading).append(':');
        lines.forEach(line -> out.append("\n- ").append(line));
        return out.toString();
    }

    private String authorNames(List<String> names) {
        if (names.size() <= MAX_AUTHOR_NAMES) {
            return String.join(", ", names);
        }
        return String.join(", ", names.subList(0, MAX_AUTHOR_NAMES)) + " et al.";
    }
}
