package com.libraryindex.agent.search;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Bibliographic metadata of one paper as returned by an academic search provider.
 * {@code id} is the provider's stable identifier without version suffix.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PaperMetadata {

    private String id;
    private String title;
    private String summary;

    @Builder.Default
    private List<String> authors = new ArrayList<>();

    @Builder.Default
    private List<String> categories = new ArrayList<>();

    private String primaryCategory;
    private String published;
    private String updated;
    private String absUrl;
    private String pdfUrl;
    private String doi;
    private String journalRef;
    private String comment;

    /**
     * Fills fields missing here from {@code other}. Present values win, so
     * merging the same paper found by two queries never loses information.
     */
    public PaperMetadata mergedWith(PaperMetadata other) {
        if (other == null) return this;
        return toBuilder()
                .title(firstPresent(title, other.title))
                .summary(firstPresent(summary, other.summary))
                .authors(authors == null || authors.isEmpty() ? other.authors : authors)
                .categories(categories == null || categories.isEmpty() ? other.categories : categories)
                .primaryCategory(firstPresent(primaryCategory, other.primaryCategory))
                .published(firstPresent(published, other.published))
                .updated(firstPresent(updated, other.updated))
                .absUrl(firstPresent(absUrl, other.absUrl))
                .pdfUrl(firstPresent(pdfUrl, other.pdfUrl))
                .doi(firstPresent(doi, other.doi))
                .journalRef(firstPresent(journalRef, other.journalRef))
                .comment(firstPresent(comment, other.comment))
                .build();
    }

    private static String firstPresent(String a, String b) {
        return a != null && !a.isBlank() ? a : b;
    }
}
