package ai.agentcap.router.orch;

public record MaintenanceReport(int breakersRemoved, int cacheEntriesExpired, int dedupEntriesExpired, int prefetchesExpired) {
}
