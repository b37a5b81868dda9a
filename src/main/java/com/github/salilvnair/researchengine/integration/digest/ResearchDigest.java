package com.github.salilvnair.researchengine.integration.digest;

import java.util.List;

/**
 * Normalised view of the successful tool results, in issue order.
 */
public record ResearchDigest(
        List<PaperSummary> papers,
        List<AuthorSummary> authors,
        List<KeywordStat> keywords,
        List<PaperSummary> citingPapers,
        List<String> networkNotes,
        List<String> notes,
        List<String> dataSources,
        List<String> unavailableSources
) {
    public ResearchDigest {
        papers = List.copyOf(papers);
        authors = List.copyOf(authors);
        keywords = List.copyOf(keywords);
        citingPapers = List.copyOf(citingPapers);
        networkNotes = List.copyOf(networkNotes);
        notes = List.copyOf(notes);
        dataSources = List.copyOf(dataSources);
        unavailableSources = List.copyOf(unavailableSources);
    }

    public boolean hasContent() {
        return !papers.isEmpty() || !authors.isEmpty() || !keywords.isEmpty()
                || !citingPapers.isEmpty() || !networkNotes.isEmpty() || !notes.isEmpty();
    }
}
