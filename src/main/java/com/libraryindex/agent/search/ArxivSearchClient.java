package com.libraryindex.agent.search;

import com.libraryindex.agent.config.ResearchProperties;
import com.libraryindex.agent.document.RawDocument;
import com.libraryindex.agent.exception.ResearchException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;
import com.rometools.rome.feed.synd.SyndCategory;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.feed.synd.SyndLink;
import com.rometools.rome.feed.synd.SyndPerson;
import com.rometools.rome.io.SyndFeedInput;
import org.jdom2.Element;

import java.io.StringReader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.regex.Pattern;

/**
 * arXiv export API client.
 *
 * Metadata comes back as an Atom feed, read with ROME; each {@code <entry>}
 * becomes one {@link PaperMetadata}. The arXiv extension elements (doi,
 * journal_ref, comment, primary_category) are not part of Atom and arrive as
 * the entry's foreign markup. Query expressions use arXiv syntax with '+' as the
 * word separator, so '+' must survive URI encoding untouched.
 */
@Slf4j
public class ArxivSearchClient implements AcademicSearchClient {

    static final String ARXIV_NS = "http://arxiv.org/schemas/atom";

    private static final Pattern VERSION_SUFFIX = Pattern.compile("v\\d+$");

    private final ResearchProperties.Search.Arxiv arxiv;
    private final long maxDownloadBytes;
    private final RestClient restClient;

    public ArxivSearchClient(ResearchProperties properties, RestClient.Builder restClientBuilder) {
        this.arxiv = properties.getSearch().getArxiv();
        this.maxDownloadBytes = properties.getDocument().getMaxDownloadBytes();
        this.restClient = restClientBuilder
                .defaultHeader("User-Agent", "library-index-agent/0.1")
                .build();
    }

    @Override
    public List<PaperMetadata> searchMetadata(String query, int maxResults) {
        int limit = Math.max(1, maxResults);
        URI uri = UriComponentsBuilder.fromHttpUrl(arxiv.getBaseUrl())
                .path(arxiv.getQueryPath())
                .queryParam("search_query", UriUtils.encodeQueryParam(query, StandardCharsets.UTF_8))
                .queryParam("max_results", limit)
                .build(true)
                .toUri();

        log.info("arXiv search: query='{}' max={}", query, limit);

        String body = restClient.get()
                .uri(uri)
                .retrieve()
                .body(String.class);

        if (body == null || body.isBlank()) {
            return List.of();
        }
        List<PaperMetadata> papers = parseAtomFeed(body);
        log.info("arXiv search: query='{}' returned {} entries", query, papers.size());
        return papers;
    }

    @Override
    public RawDocument fetchDocument(PaperMetadata metadata) {
        String pdfUrl = resolvePdfUrl(metadata);
        if (pdfUrl == null) {
            throw new ResearchException("No PDF location for paper " + metadata.getId());
        }

        log.debug("Downloading PDF for {} from {}", metadata.getId(), pdfUrl);

        byte[] content = restClient.get()
                .uri(URI.create(pdfUrl))
                .retrieve()
                .body(byte[].class);

        if (content == null || content.length == 0) {
            throw new ResearchException("Empty PDF download for paper " + metadata.getId());
        }
        if (content.length > maxDownloadBytes) {
            throw new ResearchException("PDF for " + metadata.getId() + " exceeds "
                    + maxDownloadBytes + " bytes");
        }
        return new RawDocument(content, pdfUrl, "application/pdf");
    }

    String resolvePdfUrl(PaperMetadata metadata) {
        if (metadata.getPdfUrl() != null && !metadata.getPdfUrl().isBlank()) {
            return metadata.getPdfUrl();
        }
        if (metadata.getId() != null && !metadata.getId().isBlank()) {
            return arxiv.getPdfBaseUrl() + "/" + metadata.getId() + ".pdf";
        }
        return null;
    }

    List<PaperMetadata> parseAtomFeed(String xml) {
        SyndFeed feed;
        try {
            // doctype declarations are refused by default
            feed = new SyndFeedInput().build(new StringReader(xml));
        } catch (Exception e) {
            throw new ResearchException("Malformed arXiv Atom response: " + e.getMessage(), e);
        }

        List<PaperMetadata> result = new ArrayList<>(feed.getEntries().size());
        for (SyndEntry entry : feed.getEntries()) {
            String rawId = entry.getUri();
            if (rawId == null || rawId.isBlank()) {
                continue;
            }

            PaperMetadata.PaperMetadataBuilder paper = PaperMetadata.builder()
                    .id(normalizeId(rawId))
                    .absUrl(rawId.trim())
                    .title(collapse(entry.getTitle()))
                    .summary(entry.getDescription() != null ? collapse(entry.getDescription().getValue()) : null)
                    .published(isoInstant(entry.getPublishedDate()))
                    .updated(isoInstant(entry.getUpdatedDate()));

            List<String> authors = new ArrayList<>();
            for (SyndPerson author : entry.getAuthors()) {
                if (author.getName() != null && !author.getName().isBlank()) authors.add(author.getName().trim());
            }
            paper.authors(authors);

            List<String> categories = new ArrayList<>();
            for (SyndCategory category : entry.getCategories()) {
                if (category.getName() != null && !category.getName().isBlank()) categories.add(category.getName());
            }
            paper.categories(categories);

            for (SyndLink link : entry.getLinks()) {
                if ("application/pdf".equals(link.getType()) || "pdf".equals(link.getTitle())) {
                    paper.pdfUrl(link.getHref());
                }
            }

            for (Element element : entry.getForeignMarkup()) {
                if (!ARXIV_NS.equals(element.getNamespaceURI())) {
                    continue;
                }
                switch (element.getName()) {
                    case "doi" -> paper.doi(blankToNull(element.getTextTrim()));
                    case "journal_ref" -> paper.journalRef(blankToNull(element.getTextTrim()));
                    case "comment" -> paper.comment(blankToNull(element.getTextTrim()));
                    case "primary_category" -> paper.primaryCategory(blankToNull(element.getAttributeValue("term")));
                    default -> { }
                }
            }

            result.add(paper.build());
        }
        return result;
    }

    /** "http://arxiv.org/abs/2101.00001v2" → "2101.00001"; old-style "hep-th/9901001v1" keeps its archive. */
    static String normalizeId(String rawId) {
        String id = rawId.trim();
        int abs = id.indexOf("/abs/");
        if (abs >= 0) {
            id = id.substring(abs + "/abs/".length());
        }
        return VERSION_SUFFIX.matcher(id).replaceFirst("");
    }

    private static String isoInstant(Date date) {
        return date == null ? null : date.toInstant().toString();
    }

    private static String blankToNull(String text) {
        return text == null || text.isBlank() ? null : text;
    }

    private static String collapse(String text) {
        return text == null ? null : text.replaceAll("\\s+", " ").trim();
    }
}
