package com.libraryindex.agent.cache;

public enum CacheProvider {
    REDIS,
    MONGO
}
