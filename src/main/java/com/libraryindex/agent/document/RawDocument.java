package com.libraryindex.agent.document;

/**
 * Raw bytes of a fetched document plus where they came from.
 */
public record RawDocument(byte[] content, String sourceUri, String contentType) {

    public int size() {
        return content == null ? 0 : content.length;
    }
}
