package ai.agentcap.router.orch;

import ai.agentcap.router.orch.cache.CacheStats;
import ai.agentcap.router.orch.schedule.QueueStats;

/**
 * Snapshot of the router's optimisation layers.
 */
public record PerformanceStats(CacheStats cache,
                               int inflightRequests,
                               long coalescedRequests,
                               long dedupEntries,
                               QueueStats queue,
                               int circuitBreakers,
                               long trackedDependencies,
                               long pendingPrefetches) {
}
