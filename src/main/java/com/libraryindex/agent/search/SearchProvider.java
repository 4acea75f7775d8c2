package com.libraryindex.agent.search;

public enum SearchProvider {
    ARXIV
}
