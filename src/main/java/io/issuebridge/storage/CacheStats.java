package io.issuebridge.storage;

public record CacheStats(long issueCount, long searchCacheCount, Long oldestCachedAt, Long newestCachedAt) {
}
