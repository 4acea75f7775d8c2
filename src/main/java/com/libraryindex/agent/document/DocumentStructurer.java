package com.libraryindex.agent.document;

/**
 * Document-structuring capability: raw document → text a model can analyze.
 */
public interface DocumentStructurer {

    /**
     * @throws com.libraryindex.agent.exception.ResearchException when the document cannot be read
     */
    String toStructuredText(RawDocument document);
}
