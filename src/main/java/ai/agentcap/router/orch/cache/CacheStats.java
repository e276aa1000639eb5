package ai.agentcap.router.orch.cache;

public record CacheStats(long size, long hits, long misses, double hitRate) {

    static CacheStats of(long size, long hits, long misses) {
        long total = hits + misses;
        return new CacheStats(size, hits, misses, total == 0 ? 0d : (double) hits / total);
    }
}
